package com.eainde.extraction.pipeline;

import java.util.Objects;

/**
 * A raw uploaded file.
 */
public record SourceFile(String name, byte[] content) {

    public SourceFile {
        Objects.requireNonNull(name, "name");
        content = content == null ? new byte[0] : content;
    }
}
