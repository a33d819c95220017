package eu.virtualparadox.knowledgebank.rag.rank.service;

import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;

import java.util.List;

/**
 * Orders standalone knowledge entries by relevance to a query.
 */
public interface EntryRankService {

    /**
     * Rank the given entries for the specified query.
     *
     * @param entries entries to order
     * @param query   free-text query, may be {@code null} or blank
     * @return a new list with the same entries; input order when the query carries no keyword,
     *         otherwise descending relevance with ties kept in input order
     */
    List<KnowledgeEntry> rankEntries(List<KnowledgeEntry> entries, String query);
}
