package eu.virtualparadox.knowledgebank.application.config;

import eu.virtualparadox.knowledgebank.context.budget.ContextBudgeter;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code knowledgebank.*} properties.
 * <p>An empty tier list means the stock deep / balanced / broad tiers.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "knowledgebank")
@Getter @Setter
public class KnowledgeBankConfig {

    private Budget budget = new Budget();

    @Getter @Setter
    public static class Budget {
        private int defaultTokens = ContextBudgeter.DEFAULT_TOKENS;
        private int singleTokens = ContextBudgeter.SINGLE_TOKENS;
        private int chainTokens = ContextBudgeter.CHAIN_TOKENS;
        private int transformTokens = ContextBudgeter.TRANSFORM_TOKENS;
        private int charsPerToken = ContextBudgeter.CHARS_PER_TOKEN;
        private List<Tier> tiers = new ArrayList<>();
    }

    @Getter @Setter
    public static class Tier {
        private String name;
        private int maxDocuments = Integer.MAX_VALUE;
        private double catalog;
        private double docSummaries;
        private double chapterSummaries;
        private double rawContent;
    }
}
