package eu.virtualparadox.knowledgebank.context;

/**
 * Joins whole text blocks with a separator without ever exceeding a character budget.
 * <p>
 * A block is appended entirely or not at all; separators count against the budget.
 * Not thread-safe, one instance per rendering pass.
 * </p>
 */
public class BudgetedTextBuilder {

    private final int budget;
    private final String separator;
    private final StringBuilder text = new StringBuilder();

    /**
     * @param budget    maximum number of characters, a negative value is treated as zero
     * @param separator placed between consecutive blocks
     */
    public BudgetedTextBuilder(final int budget, final String separator) {
        this.budget = Math.max(0, budget);
        this.separator = separator;
    }

    /**
     * Appends the block if it fits (together with the separator it needs).
     *
     * @param block block to append
     * @return {@code true} if appended, {@code false} if it would overflow the budget
     */
    public boolean tryAppend(final String block) {
        final int cost = separatorCost() + block.length();
        if (cost > remaining()) {
            return false;
        }
        if (!text.isEmpty()) {
            text.append(separator);
        }
        text.append(block);
        return true;
    }

    /**
     * @return characters the next append would spend on the separator
     */
    public int separatorCost() {
        return text.isEmpty() ? 0 : separator.length();
    }

    public int remaining() {
        return budget - text.length();
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public String build() {
        return text.toString();
    }
}
