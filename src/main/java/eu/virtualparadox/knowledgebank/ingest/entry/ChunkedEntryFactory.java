package eu.virtualparadox.knowledgebank.ingest.entry;

import eu.virtualparadox.knowledgebank.entry.EEntryType;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import eu.virtualparadox.knowledgebank.ingest.chunker.Chunker;
import eu.virtualparadox.knowledgebank.ingest.model.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns freshly parsed material into knowledge entries ready to be stored.
 * <p>
 * Steps:
 * <ol>
 *   <li>Image descriptions and short texts become a single entry.</li>
 *   <li>Long texts and documents are split by the {@link Chunker}; the first chunk becomes
 *       the parent entry and every following chunk a child pointing at it.</li>
 * </ol>
 *
 * <p>Persisting the result is the caller's job; this service only builds the records.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkedEntryFactory {

    private final Chunker chunker;

    /**
     * Builds the entries for one piece of material.
     *
     * @param workspaceId owning workspace
     * @param type        entry kind
     * @param title       user-facing title (non-blank)
     * @param content     extracted text
     * @return one entry, or a parent followed by its children in chunk order
     * @throws IllegalArgumentException if {@code title} is blank
     */
    public List<KnowledgeEntry> createEntries(final String workspaceId,
                                              final EEntryType type,
                                              final String title,
                                              final String content) {
        Objects.requireNonNull(type, "type must not be null");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        final String trimmedTitle = title.trim();
        final Instant now = Instant.now();

        final List<Chunk> chunks = type.isChunkable()
                ? chunker.chunkDocument(content, trimmedTitle)
                : List.of();

        if (chunks.isEmpty()) {
            return List.of(baseEntry(workspaceId, type, now)
                    .title(trimmedTitle)
                    .content(content == null ? "" : content)
                    .build());
        }

        final List<KnowledgeEntry> entries = new ArrayList<>(chunks.size());
        final Chunk first = chunks.get(0);
        final KnowledgeEntry parent = baseEntry(workspaceId, type, now)
                .title(first.title())
                .content(first.content())
                .chunkIndex(first.index())
                .build();
        entries.add(parent);

        for (final Chunk chunk : chunks.subList(1, chunks.size())) {
            entries.add(baseEntry(workspaceId, type, now)
                    .title(chunk.title())
                    .content(chunk.content())
                    .chunkIndex(chunk.index())
                    .parentEntryId(parent.getId())
                    .build());
        }

        log.info("Split '{}' into {} chunks ({} chars)", trimmedTitle, chunks.size(), content.length());
        return entries;
    }

    private static KnowledgeEntry.KnowledgeEntryBuilder baseEntry(final String workspaceId,
                                                                  final EEntryType type,
                                                                  final Instant now) {
        return KnowledgeEntry.builder()
                .id(generateId())
                .workspaceId(workspaceId)
                .type(type)
                .enabled(true)
                .createdAt(now)
                .updatedAt(now);
    }

    /**
     * Random UUID with dashes removed.
     */
    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
