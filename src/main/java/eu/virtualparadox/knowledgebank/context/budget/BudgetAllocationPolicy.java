package eu.virtualparadox.knowledgebank.context.budget;

/**
 * Decides how the document budget is split across the detail levels.
 * <p>
 * Few documents favour depth (raw content), many documents favour breadth
 * (catalog and summaries).
 * </p>
 */
public interface BudgetAllocationPolicy {

    /**
     * @param documentCount number of document groups competing for space ({@code >= 1})
     * @return level split for that many documents
     */
    BudgetTier tierFor(int documentCount);
}
