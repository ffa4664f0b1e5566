package com.jsprinter.ast;

public record ExpressionAttribute(
    String key,
    String value,   // expression text between the braces
    Loc keyLoc,
    Loc valueLoc,
    String namespace
) implements Attribute {
    public ExpressionAttribute {
        value = value != null ? value : "";
    }

    public ExpressionAttribute(String key, String value, Loc keyLoc, Loc valueLoc) {
        this(key, value, keyLoc, valueLoc, null);
    }

    public ExpressionAttribute(String key, String value) {
        this(key, value, null, null, null);
    }
}
