package com.jsprinter.ast;

import java.util.List;

public record Fragment(
    int start,
    int end,
    List<Node> children
) implements Node {
    public Fragment {
        children = children != null ? List.copyOf(children) : List.of();
    }
}
