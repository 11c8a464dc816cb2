package com.eainde.extraction.chunk;

/**
 * A bounded slice of a document, cut on line boundaries.
 *
 * <p>The index only drives human-readable labels in the consolidated context;
 * merging does not depend on chunk order.</p>
 *
 * @param index zero-based position of this chunk in the split
 * @param text  the lines of this chunk joined by {@code \n}
 */
public record Chunk(int index, String text) {

    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        text = text == null ? "" : text;
    }

    /**
     * @return one-based label used in prompts, e.g. {@code CHUNK 3}
     */
    public String label() {
        return "CHUNK " + (index + 1);
    }

    @Override
    public String toString() {
        return String.format("Chunk[%d, %d chars]", index + 1, text.length());
    }
}
