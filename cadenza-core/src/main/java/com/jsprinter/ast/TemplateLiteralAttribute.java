package com.jsprinter.ast;

public record TemplateLiteralAttribute(
    String key,
    String value,   // literal body between the backticks
    Loc keyLoc,
    Loc valueLoc,
    String namespace
) implements Attribute {
    public TemplateLiteralAttribute {
        value = value != null ? value : "";
    }

    public TemplateLiteralAttribute(String key, String value, Loc keyLoc, Loc valueLoc) {
        this(key, value, keyLoc, valueLoc, null);
    }
}
