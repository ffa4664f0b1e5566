package com.jsprinter.ast;

public record ShorthandAttribute(
    String key,
    Loc keyLoc,
    String namespace
) implements Attribute {
    public ShorthandAttribute(String key, Loc keyLoc) {
        this(key, keyLoc, null);
    }
}
