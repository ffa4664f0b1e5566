package com.jsprinter.printer;

import com.jsprinter.sourcemap.Chunk;

import java.nio.charset.StandardCharsets;

/**
 * Generated module source together with its source map chunk.
 */
public record PrintResult(String output, Chunk sourceMapChunk) {

    public byte[] outputBytes() {
        return output.getBytes(StandardCharsets.UTF_8);
    }
}
