package com.jsprinter.ast;

public record Comment(
    int start,
    int end,
    String data
) implements Node {
    public Comment {
        data = data != null ? data : "";
    }
}
