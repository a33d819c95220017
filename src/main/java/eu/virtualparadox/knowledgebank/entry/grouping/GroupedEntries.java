package eu.virtualparadox.knowledgebank.entry.grouping;

import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;

import java.util.List;

/**
 * Lossless partition of an entry snapshot: every input entry appears exactly once,
 * either in {@code standalone} or as a part of one of the {@code documents}.
 */
public record GroupedEntries(List<KnowledgeEntry> standalone, List<DocumentGroup> documents) {

    public static GroupedEntries empty() {
        return new GroupedEntries(List.of(), List.of());
    }

    public int entryCount() {
        return standalone.size() + documents.stream().mapToInt(DocumentGroup::totalParts).sum();
    }
}
