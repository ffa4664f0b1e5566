package com.jsprinter.ast;

import java.util.List;

/**
 * Root of a parsed component.
 *
 * <p>{@code hydratedComponents}, {@code clientOnlyComponents} and {@code scripts} are computed by
 * the transform pass and refer to elements that also appear somewhere under {@code children}.
 * Elements are records, so the same element read twice (for example from JSON) compares equal.</p>
 */
public record Document(
    int start,
    int end,
    List<Node> children,
    List<Element> hydratedComponents,
    List<Element> clientOnlyComponents,
    List<Element> scripts
) implements Node {
    public Document {
        children = children != null ? List.copyOf(children) : List.of();
        hydratedComponents = hydratedComponents != null ? List.copyOf(hydratedComponents) : List.of();
        clientOnlyComponents = clientOnlyComponents != null ? List.copyOf(clientOnlyComponents) : List.of();
        scripts = scripts != null ? List.copyOf(scripts) : List.of();
    }

    public Document(List<Node> children) {
        this(0, 0, children, List.of(), List.of(), List.of());
    }

    /**
     * Returns the frontmatter script block, or null if the component has none.
     */
    public Frontmatter frontmatter() {
        for (Node child : children) {
            if (child instanceof Frontmatter frontmatter) {
                return frontmatter;
            }
        }
        return null;
    }
}
