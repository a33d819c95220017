package eu.virtualparadox.knowledgebank.ingest.model;

/**
 * Immutable slice of an over-long document produced by the chunker.
 *
 * @param index   zero-based position inside the document
 * @param title   document title labelled with the 1-based part number
 * @param content trimmed slice text
 */
public record Chunk(int index, String title, String content) {

}
