package eu.virtualparadox.knowledgebank.context.service;

import eu.virtualparadox.knowledgebank.context.HierarchicalContextBuilder;
import eu.virtualparadox.knowledgebank.context.budget.EGenerationType;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point used by the generation layer: takes a workspace snapshot, keeps the
 * enabled entries and returns the knowledge context for the current prompt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeBankContextService {

    private final HierarchicalContextBuilder contextBuilder;

    /**
     * @param entries        all entries of the workspace, may contain disabled ones
     * @param query          current user prompt, may be {@code null}
     * @param generationType {@code single}, {@code chain}, {@code transform} or {@code null};
     *                       unknown values use the default budget
     * @return wrapped context or empty string
     */
    public String assembleContext(final List<KnowledgeEntry> entries,
                                  final String query,
                                  final String generationType) {
        return assembleContext(entries, query, EGenerationType.fromValue(generationType).orElse(null));
    }

    /**
     * @param entries        all entries of the workspace, may contain disabled ones
     * @param query          current user prompt, may be {@code null}
     * @param generationType selects the budget, {@code null} for the default
     * @return wrapped context or empty string
     */
    public String assembleContext(final List<KnowledgeEntry> entries,
                                  final String query,
                                  final EGenerationType generationType) {
        final List<KnowledgeEntry> enabled = enabledEntries(entries);
        final String context = contextBuilder.build(enabled, query, generationType);
        log.debug("Assembled knowledge context from {} enabled entries: {} chars", enabled.size(), context.length());
        return context;
    }

    /**
     * Number of documents the user sees: every entry that is not a child chunk.
     */
    public long countDocuments(final List<KnowledgeEntry> entries) {
        if (entries == null) {
            return 0;
        }
        return entries.stream()
                .filter(entry -> entry != null && !entry.isChild())
                .count();
    }

    private static List<KnowledgeEntry> enabledEntries(final List<KnowledgeEntry> entries) {
        final List<KnowledgeEntry> enabled = new ArrayList<>();
        if (entries == null) {
            return enabled;
        }
        for (final KnowledgeEntry entry : entries) {
            if (entry != null && entry.isEnabled()) {
                enabled.add(entry);
            }
        }
        return enabled;
    }
}
