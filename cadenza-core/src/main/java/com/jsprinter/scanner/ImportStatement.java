package com.jsprinter.scanner;

import java.util.List;

/**
 * A top-level import statement found in script source.
 *
 * @param specifier the module specifier, without quotes
 * @param imports bindings in declaration order; empty for side-effect imports
 * @param start offset of the {@code import} keyword
 * @param end offset just past the statement, including a trailing semicolon
 * @param typeOnly true for TypeScript {@code import type} statements
 */
public record ImportStatement(
    String specifier,
    List<ImportedName> imports,
    int start,
    int end,
    boolean typeOnly
) {
    public ImportStatement {
        imports = List.copyOf(imports);
    }

    public ImportStatement(String specifier, List<ImportedName> imports) {
        this(specifier, imports, 0, 0, false);
    }
}
