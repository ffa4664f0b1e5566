package com.jsprinter.ast;

public record EmptyAttribute(
    String key,
    Loc keyLoc,
    String namespace
) implements Attribute {
    public EmptyAttribute(String key, Loc keyLoc) {
        this(key, keyLoc, null);
    }
}
