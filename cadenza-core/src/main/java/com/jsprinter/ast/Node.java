package com.jsprinter.ast;

/**
 * Base interface for all document tree nodes
 */
public sealed interface Node permits
    Document,
    Frontmatter,
    Element,
    Text,
    Comment,
    Fragment,
    MarkupExpression {

    int start();
    int end();

    default Loc loc() {
        return new Loc(start());
    }
}
