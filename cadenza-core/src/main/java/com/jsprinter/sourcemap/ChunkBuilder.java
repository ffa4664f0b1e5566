package com.jsprinter.sourcemap;

import com.jsprinter.ast.Loc;

import java.util.ArrayList;
import java.util.List;

/**
 * Records source mappings while a module is being generated.
 *
 * <p>Callers pass the output produced so far on every call. The builder only looks at the part
 * of the output it has not seen yet, counting line breaks to keep track of the current generated
 * line and column, so each call costs time proportional to the text appended since the previous
 * one. The output must only ever grow.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * ChunkBuilder builder = new ChunkBuilder(source);
 * builder.addSourceMapping(attribute.keyLoc(), output);
 * output.append(attribute.key());
 * builder.addNilSourceMapping(output);
 * output.append("=");
 * Chunk chunk = builder.generateChunk(output);
 * }</pre>
 */
public final class ChunkBuilder {
    private final LineOffsetTable originalLines;
    private final List<Mapping> mappings = new ArrayList<>();

    // Generated position of output.charAt(scanned)
    private int scanned = 0;
    private int generatedLine = 0;
    private int generatedColumn = 0;
    private boolean pendingCarriageReturn = false;

    public ChunkBuilder(CharSequence originalSource) {
        this.originalLines = new LineOffsetTable(originalSource);
    }

    /**
     * Maps the position at the end of {@code output} to {@code location}. A null location records
     * a synthetic mapping.
     */
    public void addSourceMapping(Loc location, CharSequence output) {
        if (location == null) {
            addNilSourceMapping(output);
            return;
        }
        advance(output);
        int offset = location.start();
        append(new Mapping(
            generatedLine,
            generatedColumn,
            offset,
            originalLines.line(offset),
            originalLines.column(offset)));
    }

    /**
     * Marks the position at the end of {@code output} as the start of generated code with no
     * origin in the source.
     */
    public void addNilSourceMapping(CharSequence output) {
        advance(output);
        append(Mapping.synthetic(generatedLine, generatedColumn));
    }

    /**
     * Returns an immutable snapshot of the mappings recorded so far.
     */
    public Chunk generateChunk(CharSequence output) {
        advance(output);
        return new Chunk(mappings, generatedLine, generatedColumn);
    }

    public int mappingCount() {
        return mappings.size();
    }

    private void append(Mapping mapping) {
        if (!mappings.isEmpty()) {
            Mapping previous = mappings.get(mappings.size() - 1);
            if (previous.equals(mapping)) {
                return;
            }
            if (!mapping.isAfter(previous)) {
                throw new IllegalStateException("Mapping " + mapping + " precedes " + previous);
            }
        }
        mappings.add(mapping);
    }

    private void advance(CharSequence output) {
        int length = output.length();
        if (length < scanned) {
            throw new IllegalStateException(
                "Generated output shrank from " + scanned + " to " + length + " characters");
        }
        for (int i = scanned; i < length; i++) {
            char c = output.charAt(i);
            if (c == '\n') {
                if (!pendingCarriageReturn) {
                    generatedLine++;
                }
                generatedColumn = 0;
                pendingCarriageReturn = false;
            } else if (c == '\r') {
                generatedLine++;
                generatedColumn = 0;
                pendingCarriageReturn = true;
            } else {
                generatedColumn++;
                pendingCarriageReturn = false;
            }
        }
        scanned = length;
    }
}
