package com.jsprinter.ast;

/**
 * A {@code {...}} expression inside markup. {@code code} excludes the braces and {@code start}
 * is the offset of its first character.
 */
public record MarkupExpression(
    int start,
    int end,
    String code
) implements Node {
    public MarkupExpression {
        code = code != null ? code : "";
    }

    public MarkupExpression(int start, String code) {
        this(start, start + (code != null ? code.length() : 0), code);
    }
}
