package eu.virtualparadox.knowledgebank.context.budget;

/**
 * Level shares applied while the number of documents is at most {@code maxDocuments}.
 *
 * @param name         label used in logs
 * @param maxDocuments inclusive upper bound of the document count
 * @param shares       level split
 */
public record BudgetTier(String name, int maxDocuments, LevelShares shares) {

}
