package com.jsprinter.printer;

import com.jsprinter.ast.Element;

/**
 * Identifies an element by its position and tag name, so lookups do not hash its subtree.
 *
 * <p>Two copies of the same parsed element (one under {@code children}, one in a list computed by
 * the transform pass) map to the same key even when one of them is a shallow copy.</p>
 */
record ElementKey(int start, int end, String name) {

    static ElementKey of(Element element) {
        return new ElementKey(element.start(), element.end(), element.name());
    }
}
