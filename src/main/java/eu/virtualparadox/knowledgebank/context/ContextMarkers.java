package eu.virtualparadox.knowledgebank.context;

import org.apache.commons.lang3.StringUtils;

/**
 * Literal strings framing the knowledge context. Downstream prompts rely on them verbatim.
 */
public final class ContextMarkers {

    public static final String WRAPPER_START = "--- Workspace Knowledge Bank ---";
    public static final String WRAPPER_END = "--- End Knowledge Bank ---";

    public static final String CATALOG_HEADER = "=== DOCUMENT CATALOG ===";
    public static final String DOC_SUMMARIES_HEADER = "=== DOCUMENT SUMMARIES ===";
    public static final String CHAPTER_SUMMARIES_HEADER = "=== CHAPTER SUMMARIES ===";
    public static final String RAW_CONTENT_HEADER = "=== RAW CONTENT ===";

    /** Between blocks of the flat section and between sections. */
    public static final String BLOCK_SEPARATOR = "\n\n";

    /** Between catalog lines. */
    public static final String LINE_SEPARATOR = "\n";

    private ContextMarkers() {
    }

    /**
     * Flat block of a standalone entry.
     *
     * @param title entry title, {@code null} renders empty
     * @param text  summary or content
     * @return {@code [Knowledge: title]\ntext}
     */
    public static String knowledgeBlock(final String title, final String text) {
        return "[Knowledge: " + StringUtils.defaultString(title) + "]\n" + text;
    }

    /**
     * Titled block inside a document section.
     *
     * @param title document or chunk title
     * @param text  summary or content
     * @return {@code [title]\ntext}
     */
    public static String titledBlock(final String title, final String text) {
        return "[" + StringUtils.defaultString(title) + "]\n" + text;
    }

    /**
     * @return the wrapped context, or an empty string for an empty body
     */
    public static String wrap(final String body) {
        if (body.isEmpty()) {
            return "";
        }
        return WRAPPER_START + "\n" + body + "\n" + WRAPPER_END;
    }
}
