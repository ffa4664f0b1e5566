package com.jsprinter.ast;

public record Text(
    int start,
    int end,
    String data
) implements Node {
    public Text {
        data = data != null ? data : "";
    }

    public Text(int start, String data) {
        this(start, start + (data != null ? data.length() : 0), data);
    }

    public boolean isBlank() {
        return data.isBlank();
    }
}
