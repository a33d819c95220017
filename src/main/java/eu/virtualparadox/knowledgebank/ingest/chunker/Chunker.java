package eu.virtualparadox.knowledgebank.ingest.chunker;

import eu.virtualparadox.knowledgebank.ingest.model.Chunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Boundary-aware {@code Chunker} that splits an over-long document into bounded slices at ingestion time.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Threshold:</strong> a document whose length is within {@code thresholdChars}
 *       fits in one entry and yields no chunks at all.</li>
 *   <li><strong>Cutting:</strong> the next slice is the prefix of the remaining text up to
 *       {@code thresholdChars}. The cut is moved back to the last paragraph break
 *       ({@code "\n\n"}) inside that window when the break lies past
 *       {@link #MIN_BOUNDARY_RATIO} of the window; otherwise to the last sentence end
 *       ({@code ". "}) under the same rule; otherwise the window is cut hard.</li>
 *   <li><strong>Labelling:</strong> every slice is trimmed and titled
 *       {@code "{title} - Part {n}"} with a 1-based {@code n}.</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * Concatenating the untrimmed slices reproduces the input; no slice exceeds
 * {@code thresholdChars}; slices that trim to nothing are dropped without breaking the
 * sequence of indexes.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction, thus thread-safe and deterministic.
 */
@Component
public class Chunker {

    /**
     * A boundary is only honoured when it lies strictly past this fraction of the window,
     * so that slices never become tiny.
     */
    static final double MIN_BOUNDARY_RATIO = 0.3;

    private static final String PARAGRAPH_BREAK = "\n\n";
    private static final String SENTENCE_END = ". ";
    private static final String PART_TITLE_FORMAT = "%s - Part %d";

    /**
     * Maximum number of characters per slice and the size up to which a document is not split.
     */
    private final int thresholdChars;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param thresholdChars strict upper bound on a slice length (must be {@code > 0})
     * @throws IllegalArgumentException if the threshold is not positive
     */
    public Chunker(@Value("${knowledgebank.chunker.threshold-chars:8000}") final int thresholdChars) {
        if (thresholdChars <= 0) {
            throw new IllegalArgumentException("thresholdChars must be positive");
        }
        this.thresholdChars = thresholdChars;
    }

    /**
     * Splits {@code content} into labelled chunks.
     *
     * @param content raw document text; {@code null} is treated as empty
     * @param title   document title used for labels (non-null)
     * @return ordered chunks, or an empty list when the document fits in one entry
     */
    public List<Chunk> chunkDocument(final String content, final String title) {
        Objects.requireNonNull(title, "title must not be null");

        final List<Chunk> result = new ArrayList<>();
        if (content == null || content.length() <= thresholdChars) {
            return result;
        }

        int start = 0;
        while (start < content.length()) {
            final int end = nextCut(content, start);
            final String slice = content.substring(start, end).trim();
            if (!slice.isEmpty()) {
                final int index = result.size();
                result.add(new Chunk(index, partTitle(title, index + 1), slice));
            }
            start = end;
        }
        return result;
    }

    /**
     * Formats the label of a 1-based part.
     */
    public static String partTitle(final String title, final int partNumber) {
        return String.format(PART_TITLE_FORMAT, title, partNumber);
    }

    /**
     * Finds the exclusive end of the slice starting at {@code start}.
     *
     * @param content full text
     * @param start   inclusive start of the remaining text
     * @return cut position, {@code start < cut <= start + thresholdChars}
     */
    private int nextCut(final String content, final int start) {
        final int hardEnd = start + thresholdChars;
        if (hardEnd >= content.length()) {
            return content.length();
        }

        final int minOffset = (int) (thresholdChars * MIN_BOUNDARY_RATIO);

        final int paragraph = lastBoundary(content, PARAGRAPH_BREAK, start, hardEnd);
        if (paragraph - start > minOffset) {
            return paragraph + PARAGRAPH_BREAK.length();
        }

        final int sentence = lastBoundary(content, SENTENCE_END, start, hardEnd);
        if (sentence - start > minOffset) {
            return sentence + SENTENCE_END.length();
        }

        return hardEnd;
    }

    /**
     * Last occurrence of {@code boundary} lying completely inside {@code [start, end)}.
     *
     * @return absolute index of the boundary, or {@code -1}
     */
    private static int lastBoundary(final String content, final String boundary, final int start, final int end) {
        final int index = content.lastIndexOf(boundary, end - boundary.length());
        return index >= start ? index : -1;
    }
}
