package com.jsprinter.sourcemap;

import java.util.List;

/**
 * The finalized mappings of one generated module.
 *
 * <p>A chunk is a value: it keeps its own copy of the mappings and is unaffected by whatever
 * the builder that produced it does afterwards.</p>
 *
 * @param mappings mappings in generated order
 * @param finalGeneratedLine zero-based line the generated output ends on
 * @param finalGeneratedColumn column the generated output ends at
 */
public record Chunk(
    List<Mapping> mappings,
    int finalGeneratedLine,
    int finalGeneratedColumn
) {
    public Chunk {
        mappings = List.copyOf(mappings);
    }

    /**
     * Encodes the mappings as the Base64 VLQ "mappings" string of a version 3 source map with a
     * single source. Synthetic mappings become one-field segments.
     */
    public String encodeMappings() {
        StringBuilder out = new StringBuilder();
        int line = 0;
        int previousColumn = 0;
        int previousOriginalLine = 0;
        int previousOriginalColumn = 0;
        boolean needsComma = false;

        for (Mapping mapping : mappings) {
            while (line < mapping.generatedLine()) {
                out.append(';');
                line++;
                previousColumn = 0;
                needsComma = false;
            }
            if (needsComma) {
                out.append(',');
            }
            Base64Vlq.encode(out, mapping.generatedColumn() - previousColumn);
            previousColumn = mapping.generatedColumn();

            if (mapping.hasOrigin()) {
                // Single source, so the source index delta is always 0
                Base64Vlq.encode(out, 0);
                Base64Vlq.encode(out, mapping.originalLine() - previousOriginalLine);
                Base64Vlq.encode(out, mapping.originalColumn() - previousOriginalColumn);
                previousOriginalLine = mapping.originalLine();
                previousOriginalColumn = mapping.originalColumn();
            }
            needsComma = true;
        }
        return out.toString();
    }

    public SourceMap toSourceMap(String file, String sourceName, String sourceContent) {
        return new SourceMap(
            SourceMap.VERSION,
            file,
            List.of(sourceName),
            sourceContent != null ? List.of(sourceContent) : null,
            List.of(),
            encodeMappings());
    }
}
