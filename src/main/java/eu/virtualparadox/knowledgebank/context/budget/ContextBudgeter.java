package eu.virtualparadox.knowledgebank.context.budget;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the character budget of the knowledge context for a generation type.
 * <p>
 * Every generation type maps to a token budget ({@code single > default > chain > transform}
 * with the stock values); the token budget is converted to characters with a fixed
 * characters-per-token ratio.
 * </p>
 */
public class ContextBudgeter {

    public static final int DEFAULT_TOKENS = 8_000;
    public static final int SINGLE_TOKENS = 12_000;
    public static final int CHAIN_TOKENS = 4_000;
    public static final int TRANSFORM_TOKENS = 3_000;
    public static final int CHARS_PER_TOKEN = 4;

    private final Map<EGenerationType, Integer> tokenBudgets;
    private final int defaultTokens;
    private final int charsPerToken;

    /**
     * @param tokenBudgets  token budget per generation type; a missing type uses {@code defaultTokens}
     * @param defaultTokens budget when no generation type is given (must be {@code > 0})
     * @param charsPerToken conversion ratio (must be {@code > 0})
     * @throws IllegalArgumentException if any budget or the ratio is not positive
     */
    public ContextBudgeter(final Map<EGenerationType, Integer> tokenBudgets,
                           final int defaultTokens,
                           final int charsPerToken) {
        if (defaultTokens <= 0) {
            throw new IllegalArgumentException("defaultTokens must be positive");
        }
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        final Map<EGenerationType, Integer> budgets = new EnumMap<>(EGenerationType.class);
        tokenBudgets.forEach((type, tokens) -> {
            if (tokens == null || tokens <= 0) {
                throw new IllegalArgumentException("token budget for " + type + " must be positive");
            }
            budgets.put(type, tokens);
        });
        this.tokenBudgets = budgets;
        this.defaultTokens = defaultTokens;
        this.charsPerToken = charsPerToken;
    }

    /**
     * Budgeter with the stock budgets: single 12K, default 8K, chain 4K, transform 3K tokens, 4 chars per token.
     */
    public static ContextBudgeter withDefaults() {
        return new ContextBudgeter(Map.of(
                EGenerationType.SINGLE, SINGLE_TOKENS,
                EGenerationType.CHAIN, CHAIN_TOKENS,
                EGenerationType.TRANSFORM, TRANSFORM_TOKENS),
                DEFAULT_TOKENS,
                CHARS_PER_TOKEN);
    }

    /**
     * @param generationType type of the current call, {@code null} for the default
     * @return token budget
     */
    public int resolveTokenBudget(final EGenerationType generationType) {
        if (generationType == null) {
            return defaultTokens;
        }
        return tokenBudgets.getOrDefault(generationType, defaultTokens);
    }

    /**
     * @param generationType type of the current call, {@code null} for the default
     * @return character budget
     */
    public int resolveBudget(final EGenerationType generationType) {
        return resolveTokenBudget(generationType) * charsPerToken;
    }
}
