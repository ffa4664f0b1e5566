package com.jsprinter.ast;

/**
 * A character offset into the original document source.
 *
 * <p>Synthetic nodes and attributes carry a {@code null} location instead of an offset, so a
 * {@code Loc} always denotes a real position, including position 0.</p>
 */
public record Loc(int start) {
    public Loc {
        if (start < 0) {
            throw new IllegalArgumentException("Source offset must not be negative: " + start);
        }
    }
}
