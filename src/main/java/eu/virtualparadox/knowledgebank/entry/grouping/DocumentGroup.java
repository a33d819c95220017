package eu.virtualparadox.knowledgebank.entry.grouping;

import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * A parent entry together with its child chunks, in chunk order.
 * <p>A read-only view: the entries are the very instances passed to the grouper.</p>
 *
 * @param parent     the first part of the document
 * @param children   remaining parts, ascending by chunk position (never empty)
 * @param totalParts {@code 1 + children.size()}
 */
public record DocumentGroup(KnowledgeEntry parent, List<KnowledgeEntry> children, int totalParts) {

    public static DocumentGroup of(final KnowledgeEntry parent, final List<KnowledgeEntry> children) {
        return new DocumentGroup(parent, List.copyOf(children), 1 + children.size());
    }

    /**
     * @return parent followed by children
     */
    public List<KnowledgeEntry> parts() {
        final List<KnowledgeEntry> parts = new ArrayList<>(totalParts);
        parts.add(parent);
        parts.addAll(children);
        return parts;
    }

    public String displayTitle() {
        return DocumentGrouper.getDisplayTitle(parent);
    }
}
