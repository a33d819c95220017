package eu.virtualparadox.knowledgebank.entry;

/**
 * Kind of material a knowledge entry was produced from.
 * <p>Orthogonal to whether the entry is a child chunk, which is expressed by
 * {@code parentEntryId} alone.</p>
 */
public enum EEntryType {
    TEXT,
    IMAGE,
    DOCUMENT;

    /**
     * Whether long content of this kind may be split into child chunks.
     * Image entries carry a generated description and are always kept whole.
     */
    public boolean isChunkable() {
        return switch (this) {
            case TEXT, DOCUMENT -> true;
            case IMAGE -> false;
        };
    }
}
