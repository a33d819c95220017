package eu.virtualparadox.knowledgebank.entry.grouping;

import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds document groups (parent + child chunks) from a flat list of entries.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Split the input into children ({@code parentEntryId != null}) and non-children,
 *       indexing children by the parent id they point to.</li>
 *   <li>Every non-child with at least one child becomes a {@link DocumentGroup}; a
 *       non-child without children is standalone.</li>
 *   <li>Children whose parent is not part of the input (orphans) are appended to the
 *       standalone list in input order.</li>
 * </ol>
 * Linear in the input size apart from sorting children inside each group.
 *
 * <p>Entries are never copied; groups reference the instances passed in.</p>
 */
@Component
public class DocumentGrouper {

    /**
     * Trailing {@code " - Part N"} label written by the chunker, optionally zero padded.
     */
    private static final Pattern PART_SUFFIX = Pattern.compile("\\s+-\\s+Part\\s+0*(\\d+)\\s*$", Pattern.CASE_INSENSITIVE);

    /**
     * Groups the entries by document.
     *
     * @param entries snapshot of entries; {@code null} is treated as empty
     * @return standalone entries (input order, orphans last) and document groups (parent input order)
     */
    public GroupedEntries groupEntriesByDocument(final List<KnowledgeEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return GroupedEntries.empty();
        }

        final Map<String, List<KnowledgeEntry>> childrenByParent = new LinkedHashMap<>();
        final List<KnowledgeEntry> nonChildren = new ArrayList<>();
        final Map<String, KnowledgeEntry> nonChildById = new HashMap<>();

        for (final KnowledgeEntry entry : entries) {
            if (entry.isChild()) {
                childrenByParent.computeIfAbsent(entry.getParentEntryId(), k -> new ArrayList<>()).add(entry);
            } else {
                nonChildren.add(entry);
                nonChildById.putIfAbsent(entry.getId(), entry);
            }
        }

        final List<KnowledgeEntry> standalone = new ArrayList<>();
        final List<DocumentGroup> documents = new ArrayList<>();

        for (final KnowledgeEntry candidate : nonChildren) {
            // a duplicated parent id only claims the children once
            final List<KnowledgeEntry> children = nonChildById.get(candidate.getId()) == candidate
                    ? childrenByParent.remove(candidate.getId())
                    : null;
            if (children == null || children.isEmpty()) {
                standalone.add(candidate);
            } else {
                documents.add(DocumentGroup.of(candidate, sortByChunkPosition(children)));
            }
        }

        // whatever is left never found its parent
        final int orphanStart = standalone.size();
        for (final List<KnowledgeEntry> orphans : childrenByParent.values()) {
            standalone.addAll(orphans);
        }
        if (childrenByParent.size() > 1) {
            restoreInputOrder(standalone, orphanStart, entries);
        }

        return new GroupedEntries(List.copyOf(standalone), List.copyOf(documents));
    }

    /**
     * Human-facing title of a document: the stored title with one trailing
     * {@code " - Part N"} label removed. The entry itself is not modified.
     *
     * @param entry parent entry
     * @return display title
     */
    public static String getDisplayTitle(final KnowledgeEntry entry) {
        final String title = entry.getTitle() == null ? "" : entry.getTitle();
        return PART_SUFFIX.matcher(title).replaceFirst("");
    }

    /**
     * Stable sort by chunk index, falling back to the part number in the title,
     * and finally to input order.
     */
    private static List<KnowledgeEntry> sortByChunkPosition(final List<KnowledgeEntry> children) {
        final List<KnowledgeEntry> sorted = new ArrayList<>(children);
        sorted.sort(Comparator.comparingInt(DocumentGrouper::chunkPosition));
        return sorted;
    }

    private static int chunkPosition(final KnowledgeEntry entry) {
        if (entry.getChunkIndex() != null) {
            return entry.getChunkIndex();
        }
        if (entry.getTitle() != null) {
            final Matcher matcher = PART_SUFFIX.matcher(entry.getTitle());
            if (matcher.find()) {
                try {
                    // "Part N" is 1-based, chunk indexes are 0-based
                    return Integer.parseInt(matcher.group(1)) - 1;
                } catch (NumberFormatException e) {
                    return Integer.MAX_VALUE;
                }
            }
        }
        return Integer.MAX_VALUE;
    }

    /**
     * Orphans of different parents were collected per parent; put the orphan tail back
     * into the order the entries were supplied in.
     */
    private static void restoreInputOrder(final List<KnowledgeEntry> standalone,
                                          final int orphanStart,
                                          final List<KnowledgeEntry> input) {
        final List<KnowledgeEntry> orphans = standalone.subList(orphanStart, standalone.size());
        final Map<KnowledgeEntry, Integer> position = new IdentityHashMap<>();
        for (int i = 0; i < input.size(); i++) {
            position.putIfAbsent(input.get(i), i);
        }
        orphans.sort(Comparator.comparingInt(position::get));
    }
}
