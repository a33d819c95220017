package eu.virtualparadox.knowledgebank.rag.rank.service;

import eu.virtualparadox.knowledgebank.entry.grouping.DocumentGroup;

import java.util.Collection;
import java.util.List;

/**
 * Orders whole documents (parent plus chunks) by relevance to a query.
 */
public interface DocumentRankService {

    /**
     * Scores one document group.
     *
     * @param group    document to score
     * @param keywords distinct query keywords
     * @return non-negative score, {@code 0} for no keywords
     */
    double scoreDocumentGroup(DocumentGroup group, Collection<String> keywords);

    /**
     * Rank the given groups for the specified query.
     *
     * @param groups groups to order
     * @param query  free-text query, may be {@code null} or blank
     * @return a new list; input order when the query carries no keyword,
     *         otherwise descending score with ties kept in input order
     */
    List<DocumentGroup> rankDocumentGroups(List<DocumentGroup> groups, String query);
}
