package eu.virtualparadox.knowledgebank.context.budget;

/**
 * Fractions of the document budget given to each detail level.
 *
 * @param catalog          one line per document
 * @param docSummaries     document-level summaries
 * @param chapterSummaries chunk-level summaries
 * @param rawContent       full chunk text
 * @throws IllegalArgumentException if a share is negative or the shares add up to more than 1
 */
public record LevelShares(double catalog, double docSummaries, double chapterSummaries, double rawContent) {

    private static final double TOLERANCE = 1e-9;

    public LevelShares {
        if (catalog < 0 || docSummaries < 0 || chapterSummaries < 0 || rawContent < 0) {
            throw new IllegalArgumentException("level shares must not be negative");
        }
        if (catalog + docSummaries + chapterSummaries + rawContent > 1 + TOLERANCE) {
            throw new IllegalArgumentException("level shares must not add up to more than 1");
        }
    }

    /**
     * @return sum of all shares
     */
    public double total() {
        return catalog + docSummaries + chapterSummaries + rawContent;
    }
}
