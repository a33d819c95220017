package eu.virtualparadox.knowledgebank.application.config;

import eu.virtualparadox.knowledgebank.context.budget.BudgetAllocationPolicy;
import eu.virtualparadox.knowledgebank.context.budget.BudgetTier;
import eu.virtualparadox.knowledgebank.context.budget.ContextBudgeter;
import eu.virtualparadox.knowledgebank.context.budget.EGenerationType;
import eu.virtualparadox.knowledgebank.context.budget.LevelShares;
import eu.virtualparadox.knowledgebank.context.budget.TieredBudgetAllocationPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the bound budget properties into the budgeter and the level split policy.
 * Invalid values fail at startup.
 */
@Configuration
@Slf4j
public class ContextBudgetConfig {

    @Bean
    public ContextBudgeter contextBudgeter(final KnowledgeBankConfig config) {
        final KnowledgeBankConfig.Budget budget = config.getBudget();
        final Map<EGenerationType, Integer> tokens = new EnumMap<>(EGenerationType.class);
        tokens.put(EGenerationType.SINGLE, budget.getSingleTokens());
        tokens.put(EGenerationType.CHAIN, budget.getChainTokens());
        tokens.put(EGenerationType.TRANSFORM, budget.getTransformTokens());
        log.info("Knowledge context budgets (tokens): default={}, {}; {} chars per token",
                budget.getDefaultTokens(), tokens, budget.getCharsPerToken());
        return new ContextBudgeter(tokens, budget.getDefaultTokens(), budget.getCharsPerToken());
    }

    @Bean
    public BudgetAllocationPolicy budgetAllocationPolicy(final KnowledgeBankConfig config) {
        final List<KnowledgeBankConfig.Tier> configured = config.getBudget().getTiers();
        if (configured == null || configured.isEmpty()) {
            return TieredBudgetAllocationPolicy.withDefaults();
        }
        final List<BudgetTier> tiers = new ArrayList<>(configured.size());
        for (final KnowledgeBankConfig.Tier tier : configured) {
            final String name = tier.getName() == null ? "tier-" + tiers.size() : tier.getName();
            tiers.add(new BudgetTier(name, tier.getMaxDocuments(), new LevelShares(
                    tier.getCatalog(), tier.getDocSummaries(), tier.getChapterSummaries(), tier.getRawContent())));
        }
        return new TieredBudgetAllocationPolicy(tiers);
    }
}
