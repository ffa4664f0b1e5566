package com.jsprinter.sourcemap;

/**
 * One source map segment. A mapping without an original offset marks generated code that has
 * no counterpart in the source (runtime calls, punctuation, wrappers).
 *
 * @param generatedLine zero-based line in the generated output
 * @param generatedColumn zero-based column in the generated output
 * @param originalOffset offset in the original source, or null for synthetic code
 * @param originalLine zero-based original line, -1 for synthetic code
 * @param originalColumn zero-based original column, -1 for synthetic code
 */
public record Mapping(
    int generatedLine,
    int generatedColumn,
    Integer originalOffset,
    int originalLine,
    int originalColumn
) {
    public static Mapping synthetic(int generatedLine, int generatedColumn) {
        return new Mapping(generatedLine, generatedColumn, null, -1, -1);
    }

    public boolean hasOrigin() {
        return originalOffset != null;
    }

    boolean isAfter(Mapping other) {
        return generatedLine > other.generatedLine
            || (generatedLine == other.generatedLine && generatedColumn >= other.generatedColumn);
    }
}
