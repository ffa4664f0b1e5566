package com.jsprinter.ast;

/**
 * The script block between the {@code ---} fences. {@code start} is the offset of the first
 * character of {@code code} in the document source.
 */
public record Frontmatter(
    int start,
    int end,
    String code
) implements Node {
    public Frontmatter {
        code = code != null ? code : "";
    }

    public Frontmatter(int start, String code) {
        this(start, start + (code != null ? code.length() : 0), code);
    }
}
