package com.eainde.extraction.fanout;

import com.eainde.extraction.chunk.Chunk;

/**
 * Extraction applied to one chunk. Any exception marks that chunk as failed.
 */
@FunctionalInterface
public interface ChunkExtraction {

    String extract(Chunk chunk) throws Exception;
}
