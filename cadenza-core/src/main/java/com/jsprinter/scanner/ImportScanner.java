package com.jsprinter.scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds top-level import statements in script source.
 *
 * <p>Callers iterate by passing the offset returned by the previous call:</p>
 * <pre>{@code
 * ScanResult result = scanner.nextImportStatement(source, 0);
 * while (result.found()) {
 *     use(result.statement());
 *     result = scanner.nextImportStatement(source, result.next());
 * }
 * }</pre>
 *
 * <p>Implementations must never throw on malformed source.</p>
 */
public interface ImportScanner {

    /**
     * Finds the first import statement starting at or after {@code from}.
     *
     * @param source script source
     * @param from offset of a top-level statement boundary
     * @return the statement and the offset just past it, or {@link ScanResult#NOT_FOUND}
     */
    ScanResult nextImportStatement(String source, int from);

    /**
     * Returns every import statement in {@code source}, in source order.
     */
    default List<ImportStatement> importStatements(String source) {
        List<ImportStatement> statements = new ArrayList<>();
        ScanResult result = nextImportStatement(source, 0);
        while (result.found()) {
            statements.add(result.statement());
            result = nextImportStatement(source, result.next());
        }
        return statements;
    }
}
