package com.jsprinter.ast;

/**
 * {@code {...key}}. {@code keyLoc} points at the expression, just past the {@code ...}.
 */
public record SpreadAttribute(
    String key,
    Loc keyLoc,
    String namespace
) implements Attribute {
    public SpreadAttribute(String key, Loc keyLoc) {
        this(key, keyLoc, null);
    }
}
