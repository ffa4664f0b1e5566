package com.jsprinter.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jsprinter.ast.*;

/**
 * Jackson module that configures serialization/deserialization for the document tree.
 *
 * This module handles:
 * - Polymorphic Node and Attribute types via a "type" property holding the record name
 * - Hiding derived boolean accessors (isScript, isBlank, ...) from the JSON form
 * - Reading source locations as {"start": offset}
 */
public class DocumentModule extends SimpleModule {

    public DocumentModule() {
        super("DocumentModule", new Version(1, 0, 0, null, "com.jsprinter", "cadenza-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Attribute.class, AttributeMixin.class);

        context.setMixInAnnotations(Element.class, ElementMixin.class);
        context.setMixInAnnotations(Text.class, TextMixin.class);
        context.setMixInAnnotations(Loc.class, LocMixin.class);
    }

    // ==================== Polymorphic types ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Document.class, name = "Document"),
        @JsonSubTypes.Type(value = Frontmatter.class, name = "Frontmatter"),
        @JsonSubTypes.Type(value = Element.class, name = "Element"),
        @JsonSubTypes.Type(value = Text.class, name = "Text"),
        @JsonSubTypes.Type(value = Comment.class, name = "Comment"),
        @JsonSubTypes.Type(value = Fragment.class, name = "Fragment"),
        @JsonSubTypes.Type(value = MarkupExpression.class, name = "MarkupExpression")
    })
    private interface NodeMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = QuotedAttribute.class, name = "QuotedAttribute"),
        @JsonSubTypes.Type(value = EmptyAttribute.class, name = "EmptyAttribute"),
        @JsonSubTypes.Type(value = ExpressionAttribute.class, name = "ExpressionAttribute"),
        @JsonSubTypes.Type(value = SpreadAttribute.class, name = "SpreadAttribute"),
        @JsonSubTypes.Type(value = ShorthandAttribute.class, name = "ShorthandAttribute"),
        @JsonSubTypes.Type(value = TemplateLiteralAttribute.class, name = "TemplateLiteralAttribute")
    })
    private interface AttributeMixin {
    }

    // ==================== Derived accessors ====================

    private abstract static class ElementMixin {
        @JsonIgnore
        abstract boolean isScript();
        @JsonIgnore
        abstract boolean isStyle();
        @JsonIgnore
        abstract boolean isSlot();
        @JsonIgnore
        abstract boolean isVoid();
        @JsonIgnore
        abstract boolean isComponent();
    }

    private abstract static class TextMixin {
        @JsonIgnore
        abstract boolean isBlank();
    }

    // Single-component records are otherwise ambiguous between delegating and property creators
    private abstract static class LocMixin {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        LocMixin(@JsonProperty("start") int start) {
        }
    }
}
