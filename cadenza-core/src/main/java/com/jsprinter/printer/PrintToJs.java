package com.jsprinter.printer;

import com.jsprinter.ast.*;
import com.jsprinter.scanner.ImportScanner;
import com.jsprinter.scanner.ImportStatement;
import com.jsprinter.scanner.LexicalImportScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a document and drives a {@link Printer} to produce the complete component module.
 *
 * <p>Module layout:</p>
 * <pre>
 * import { ...runtime... } from "astro/internal";
 * import Foo from './Foo';                         frontmatter imports, hoisted
 * import * as $$module1 from './Foo';
 * export const $$metadata = $$createMetadata(...);
 * const $$Astro = $$createAstro(import.meta.url, 'site');
 * const $$Component = $$createComponent(async ($$result, $$props, $$slots) => {
 *   ...rest of the frontmatter...
 *   const STYLES = [...];
 *   return $$render`...markup...`;
 * });
 * export default $$Component;
 * </pre>
 */
public final class PrintToJs {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrintToJs.class);

    static final String COMPONENT_NAME = "$$Component";

    private final Document document;
    private final TransformOptions options;
    private final RuntimeNames names;
    private final ImportScanner scanner;
    private final Printer p;
    private final Set<ElementKey> hoistedScripts;
    private final Set<ElementKey> hydratedComponents;

    private PrintToJs(Document document, String source, TransformOptions options, ImportScanner scanner) {
        this.document = document;
        this.options = options;
        this.names = options.runtimeNames();
        this.scanner = scanner;
        this.p = new Printer(options, source, scanner);
        this.hoistedScripts = keys(document.scripts());
        this.hydratedComponents = keys(document.hydratedComponents());
    }

    private static Set<ElementKey> keys(List<Element> elements) {
        Set<ElementKey> keys = new HashSet<>();
        for (Element element : elements) {
            keys.add(ElementKey.of(element));
        }
        return keys;
    }

    public static PrintResult printToJs(Document document, String source, TransformOptions options) {
        return printToJs(document, source, options, new LexicalImportScanner());
    }

    public static PrintResult printToJs(Document document, String source, TransformOptions options, ImportScanner scanner) {
        PrintToJs session = new PrintToJs(document, source, options, scanner);
        session.render();
        PrintResult result = session.p.result();
        LOGGER.debug("Printed {}: {} characters, {} mappings",
            options.filename(), result.output().length(), result.sourceMapChunk().mappings().size());
        return result;
    }

    private void render() {
        LOGGER.debug("Printing {}", options.filename());
        Frontmatter frontmatter = document.frontmatter();
        String code = frontmatter != null ? frontmatter.code() : "";
        int codeStart = frontmatter != null ? frontmatter.start() : 0;
        List<ImportStatement> imports = scanner.importStatements(code);

        p.printInternalImports(options.internalUrl());
        for (ImportStatement statement : imports) {
            p.addSourceMapping(new Loc(codeStart + statement.start()));
            p.println(code.substring(statement.start(), statement.end()));
        }
        // Client-only attributes must be in place before any element is printed
        p.printComponentMetadata(document, code);
        p.printTopLevelAstro();
        p.printFuncPrelude(COMPONENT_NAME);

        int cursor = 0;
        for (ImportStatement statement : imports) {
            printCode(code.substring(cursor, statement.start()), codeStart + cursor);
            cursor = statement.end();
        }
        printCode(code.substring(cursor), codeStart + cursor);

        printStyles();

        p.printReturnOpen();
        printChildren(document.children());
        p.printReturnClose();
        p.printFuncSuffix(COMPONENT_NAME);
    }

    /**
     * Prints script code verbatim, mapping the start of every line to its origin.
     */
    private void printCode(String code, int origin) {
        if (code.isBlank()) {
            return;
        }
        int lineStart = 0;
        while (lineStart < code.length()) {
            int newline = code.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? code.length() : newline + 1;
            p.addSourceMapping(new Loc(origin + lineStart));
            p.print(code.substring(lineStart, lineEnd));
            lineStart = lineEnd;
        }
        if (!code.endsWith("\n")) {
            p.print("\n");
        }
    }

    private void printStyles() {
        List<Element> styles = new ArrayList<>();
        collectStyles(document.children(), styles);
        if (styles.isEmpty()) {
            return;
        }
        p.addNilSourceMapping();
        p.print("const STYLES = [\n");
        for (Element style : styles) {
            p.printStyleOrScript(style);
        }
        p.addNilSourceMapping();
        p.println("];");
        p.println("for (const STYLE of STYLES) " + names.result() + ".styles.add(STYLE);");
    }

    private static void collectStyles(List<Node> nodes, List<Element> styles) {
        for (Node node : nodes) {
            if (node instanceof Element element) {
                if (isCollectedStyle(element)) {
                    styles.add(element);
                } else {
                    collectStyles(element.children(), styles);
                }
            } else if (node instanceof Fragment fragment) {
                collectStyles(fragment.children(), styles);
            }
        }
    }

    // Styles with define:vars need per-render values, so they stay in the markup
    private static boolean isCollectedStyle(Element element) {
        return element.isStyle() && element.attribute(Printer.DEFINE_VARS) == null;
    }

    // ========================================================================
    // Markup
    // ========================================================================

    private void printChildren(List<Node> children) {
        for (Node child : children) {
            printNode(child);
        }
    }

    private void printNode(Node node) {
        if (node instanceof Text text) {
            p.addSourceMapping(text.loc());
            p.print(Escapes.escapeText(text.data()));
        } else if (node instanceof Comment comment) {
            p.addSourceMapping(comment.loc());
            p.print("<!--" + Escapes.escapeText(comment.data()) + "-->");
        } else if (node instanceof MarkupExpression expression) {
            p.addNilSourceMapping();
            p.print("${");
            p.addSourceMapping(expression.loc());
            p.print(expression.code());
            p.addNilSourceMapping();
            p.print("}");
        } else if (node instanceof Element element) {
            printElement(element);
        } else if (node instanceof Fragment fragment) {
            printChildren(fragment.children());
        } else if (node instanceof Document nested) {
            printChildren(nested.children());
        }
        // Frontmatter has already been printed
    }

    private void printElement(Element element) {
        if (hoistedScripts.contains(ElementKey.of(element)) || isCollectedStyle(element)) {
            return;
        }
        if (element.isSlot()) {
            printSlot(element);
        } else if (element.isComponent() || (element.customElement() && hydratedComponents.contains(ElementKey.of(element)))) {
            printComponent(element);
        } else {
            printHtmlElement(element);
        }
    }

    private void printHtmlElement(Element element) {
        p.addSourceMapping(element.loc());
        p.print("<" + element.name());
        for (Attribute attribute : p.attributesOf(element)) {
            p.printAttribute(attribute);
        }
        p.addNilSourceMapping();
        p.print(">");
        if (element.isVoid()) {
            return;
        }
        p.printDefineVars(element);
        printChildren(element.children());
        p.addNilSourceMapping();
        p.print("</" + element.name() + ">");
    }

    private void printComponent(Element element) {
        String quotedName = "'" + Escapes.escapeSingleQuote(element.name()) + "'";
        String reference = element.isComponent() ? element.name() : quotedName;

        p.addSourceMapping(element.loc());
        p.print("${" + names.renderComponent() + "(" + names.result() + "," + quotedName + "," + reference + ",");
        p.printAttributesToObject(element);
        p.print(",");
        printSlots(element.children());
        p.addNilSourceMapping();
        p.print(")}");
    }

    private void printSlots(List<Node> children) {
        Map<String, List<Node>> slots = new LinkedHashMap<>();
        for (Node child : children) {
            String slot = "default";
            if (child instanceof Element element && element.attribute("slot") instanceof QuotedAttribute named) {
                slot = named.value();
            }
            slots.computeIfAbsent(slot, s -> new ArrayList<>()).add(child);
        }
        List<Node> defaultSlot = slots.get("default");
        if (defaultSlot != null && defaultSlot.stream().allMatch(n -> n instanceof Text text && text.isBlank())) {
            slots.remove("default");
        }

        p.print("{");
        boolean first = true;
        for (Map.Entry<String, List<Node>> slot : slots.entrySet()) {
            if (!first) {
                p.print(",");
            }
            p.print("\"" + Escapes.escapeDoubleQuote(slot.getKey()) + "\": () => ");
            p.printTemplateLiteralOpen();
            printChildren(slot.getValue());
            p.printTemplateLiteralClose();
            first = false;
        }
        p.print("}");
    }

    private void printSlot(Element element) {
        Attribute name = element.attribute("name");
        String slotKey;
        if (name instanceof QuotedAttribute quoted) {
            slotKey = "\"" + Escapes.escapeDoubleQuote(quoted.value()) + "\"";
        } else if (name instanceof ExpressionAttribute expression) {
            slotKey = expression.value().trim();
        } else {
            slotKey = "\"default\"";
        }

        p.addSourceMapping(element.loc());
        p.print("${" + names.renderSlot() + "(" + names.result() + "," + names.slots() + "[" + slotKey + "]");
        if (!element.children().isEmpty()) {
            p.print(",");
            p.printTemplateLiteralOpen();
            printChildren(element.children());
            p.printTemplateLiteralClose();
        }
        p.addNilSourceMapping();
        p.print(")}");
    }
}
