package eu.virtualparadox.knowledgebank.rag.rank.model;

import java.util.Comparator;

/**
 * @param item  ranked element
 * @param index position of the element in the input, used as tie-break
 * @param score relevance score (higher = better)
 */
public record RankedCandidate<T>(T item, int index, double score) {

    /**
     * Descending score, ties kept in input order.
     */
    public static <T> Comparator<RankedCandidate<T>> byScoreDescending() {
        return Comparator.<RankedCandidate<T>>comparingDouble(RankedCandidate::score)
                .reversed()
                .thenComparingInt(RankedCandidate::index);
    }
}
