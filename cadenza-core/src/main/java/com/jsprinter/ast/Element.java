package com.jsprinter.ast;

import java.util.List;
import java.util.Set;

/**
 * An element, component or custom element in markup.
 *
 * <p>{@code name} is the tag text exactly as written ({@code div}, {@code Counter},
 * {@code UI.Button}, {@code my-el}). {@code customElement} is set by the transform pass.</p>
 */
public record Element(
    int start,
    int end,
    String name,
    List<Attribute> attributes,
    List<Node> children,
    boolean customElement
) implements Node {
    private static final Set<String> VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input",
        "link", "meta", "param", "source", "track", "wbr");

    public Element {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Element name must not be empty");
        }
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    public Element(int start, String name, List<Attribute> attributes, List<Node> children) {
        this(start, start, name, attributes, children, false);
    }

    public Node firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Returns the first attribute with the given key, or null.
     */
    public Attribute attribute(String key) {
        for (Attribute attribute : attributes) {
            if (key.equals(attribute.key())) {
                return attribute;
            }
        }
        return null;
    }

    public boolean isScript() {
        return name.equalsIgnoreCase("script");
    }

    public boolean isStyle() {
        return name.equalsIgnoreCase("style");
    }

    public boolean isSlot() {
        return name.equals("slot");
    }

    public boolean isVoid() {
        return VOID_ELEMENTS.contains(name.toLowerCase());
    }

    // Components start upper-case or are member expressions (UI.Button)
    public boolean isComponent() {
        return Character.isUpperCase(name.charAt(0)) || name.indexOf('.') > 0;
    }
}
