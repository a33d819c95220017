package eu.virtualparadox.knowledgebank.rag.score;

import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;

import java.util.List;

/**
 * Text fields of anything that can be scored against query keywords.
 *
 * @param title   weighted highest
 * @param content body text
 * @param summary optional shorter body, may be {@code null}
 * @param tags    optional labels, may be empty
 */
public record ScoringCandidate(String title, String content, String summary, List<String> tags) {

    public ScoringCandidate {
        tags = tags == null ? List.of() : tags;
    }

    public static ScoringCandidate of(final String title, final String content) {
        return new ScoringCandidate(title, content, null, List.of());
    }

    public static ScoringCandidate from(final KnowledgeEntry entry) {
        return new ScoringCandidate(entry.getTitle(), entry.getContent(), entry.getSummary(), entry.getTags());
    }

    /**
     * All fields joined into one text, used to build a term-frequency corpus.
     */
    public String fullText() {
        final StringBuilder sb = new StringBuilder();
        append(sb, title);
        append(sb, content);
        append(sb, summary);
        if (!tags.isEmpty()) {
            append(sb, String.join(" ", tags));
        }
        return sb.toString();
    }

    private static void append(final StringBuilder sb, final String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (!sb.isEmpty()) {
            sb.append(' ');
        }
        sb.append(text);
    }
}
