package com.jsprinter.ast;

/**
 * An attribute on an element. Exactly one of the six forms applies:
 *
 * <pre>
 * QuotedAttribute           key="value"
 * EmptyAttribute            key
 * ExpressionAttribute       key={value}
 * SpreadAttribute           {...key}
 * ShorthandAttribute        {key}
 * TemplateLiteralAttribute  key=`value`
 * </pre>
 *
 * <p>For spread and shorthand attributes {@code key} holds the raw expression text. A null
 * location marks an attribute that has no counterpart in the source.</p>
 */
public sealed interface Attribute permits
    QuotedAttribute,
    EmptyAttribute,
    ExpressionAttribute,
    SpreadAttribute,
    ShorthandAttribute,
    TemplateLiteralAttribute {

    String key();
    Loc keyLoc();

    /**
     * Namespace prefix ({@code xlink} in {@code xlink:href}), or null.
     */
    String namespace();

    default boolean hasNamespace() {
        return namespace() != null && !namespace().isEmpty();
    }
}
