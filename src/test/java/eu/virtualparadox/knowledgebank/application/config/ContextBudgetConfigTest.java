package eu.virtualparadox.knowledgebank.application.config;

import eu.virtualparadox.knowledgebank.context.budget.BudgetAllocationPolicy;
import eu.virtualparadox.knowledgebank.context.budget.EGenerationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextBudgetConfigTest {

    private final ContextBudgetConfig budgetConfig = new ContextBudgetConfig();

    private static KnowledgeBankConfig.Tier tier(String name, int maxDocuments, double raw) {
        KnowledgeBankConfig.Tier tier = new KnowledgeBankConfig.Tier();
        tier.setName(name);
        tier.setMaxDocuments(maxDocuments);
        tier.setCatalog(0.1);
        tier.setRawContent(raw);
        return tier;
    }

    @Test
    @DisplayName("Empty tier list falls back to the stock tiers")
    void stockTiers() {
        BudgetAllocationPolicy policy = budgetConfig.budgetAllocationPolicy(new KnowledgeBankConfig());

        assertThat(policy.tierFor(2).name()).isEqualTo("deep");
        assertThat(policy.tierFor(3).name()).isEqualTo("balanced");
    }

    @Test
    @DisplayName("Configured tiers replace the stock ones")
    void customTiers() {
        KnowledgeBankConfig config = new KnowledgeBankConfig();
        config.getBudget().setTiers(List.of(tier("wide", Integer.MAX_VALUE, 0.2), tier("narrow", 3, 0.9)));

        BudgetAllocationPolicy policy = budgetConfig.budgetAllocationPolicy(config);

        assertThat(policy.tierFor(3).name()).isEqualTo("narrow");
        assertThat(policy.tierFor(4).shares().rawContent()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Invalid budget values fail at startup")
    void invalidValues() {
        KnowledgeBankConfig config = new KnowledgeBankConfig();
        config.getBudget().setTiers(List.of(tier("broken", 3, 0.95)));
        assertThatThrownBy(() -> budgetConfig.budgetAllocationPolicy(config)).isInstanceOf(IllegalArgumentException.class);

        KnowledgeBankConfig zero = new KnowledgeBankConfig();
        zero.getBudget().setChainTokens(0);
        assertThatThrownBy(() -> budgetConfig.contextBudgeter(zero)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Budgets come from the bound properties")
    void budgets() {
        KnowledgeBankConfig config = new KnowledgeBankConfig();
        config.getBudget().setSingleTokens(100);
        config.getBudget().setCharsPerToken(3);

        assertThat(budgetConfig.contextBudgeter(config).resolveBudget(EGenerationType.SINGLE)).isEqualTo(300);
    }
}
