package com.jsprinter.ast;

public record QuotedAttribute(
    String key,
    String value,
    Loc keyLoc,
    Loc valueLoc,
    String namespace
) implements Attribute {
    public QuotedAttribute {
        value = value != null ? value : "";
    }

    public QuotedAttribute(String key, String value, Loc keyLoc, Loc valueLoc) {
        this(key, value, keyLoc, valueLoc, null);
    }

    public QuotedAttribute(String key, String value) {
        this(key, value, null, null, null);
    }
}
