package com.jsprinter.scanner;

/**
 * Result of one {@link ImportScanner#nextImportStatement} call.
 *
 * @param next offset to resume scanning from, or -1 when no further statement exists
 * @param statement the statement found, or null
 */
public record ScanResult(int next, ImportStatement statement) {
    public static final ScanResult NOT_FOUND = new ScanResult(-1, null);

    public boolean found() {
        return next >= 0;
    }
}
