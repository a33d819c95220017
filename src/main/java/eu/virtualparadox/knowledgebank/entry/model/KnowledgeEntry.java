package eu.virtualparadox.knowledgebank.entry.model;

import eu.virtualparadox.knowledgebank.entry.EDocumentSummaryStatus;
import eu.virtualparadox.knowledgebank.entry.EEntryType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One unit of workspace reference material.
 * <p>
 * Instances are immutable snapshots handed in by the persistence layer. An entry
 * with a non-null {@code parentEntryId} is a child chunk of a longer document;
 * {@code chunkIndex} records its position inside that document when known.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class KnowledgeEntry {

    String id;
    String workspaceId;
    EEntryType type;
    String title;

    /** Raw text; for images the generated description. */
    String content;

    /** Shorter rendition produced out-of-band, may be absent or blank. */
    String summary;

    @Singular
    List<String> tags;

    boolean pinned;
    String parentEntryId;
    Integer chunkIndex;
    EDocumentSummaryStatus documentSummaryStatus;

    @Builder.Default
    boolean enabled = true;

    Instant createdAt;
    Instant updatedAt;

    public boolean isChild() {
        return parentEntryId != null;
    }

    /**
     * @return the summary, or empty when it is missing or blank
     */
    public Optional<String> summaryIfPresent() {
        return StringUtils.isBlank(summary) ? Optional.empty() : Optional.of(summary);
    }

    /**
     * Text used when this entry is injected as a whole: the summary when present,
     * otherwise the content.
     */
    public String contextText() {
        return summaryIfPresent().orElse(StringUtils.defaultString(content));
    }

    public boolean isDocumentSummaryPending() {
        return documentSummaryStatus == EDocumentSummaryStatus.PENDING;
    }
}
