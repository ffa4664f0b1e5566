package com.jsprinter.printer;

import com.jsprinter.ast.*;
import com.jsprinter.scanner.ImportScanner;
import com.jsprinter.scanner.ImportStatement;
import com.jsprinter.scanner.ImportedName;
import com.jsprinter.scanner.LexicalImportScanner;
import com.jsprinter.scanner.ScanResult;
import com.jsprinter.sourcemap.ChunkBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits the JavaScript module for one component, recording a source mapping before every token.
 *
 * <p>A printer holds the output of a single print session and must not be shared between
 * sessions or threads. The wrapper pieces (runtime imports, component prelude and suffix) are
 * written at most once per session no matter how often they are requested.</p>
 */
public class Printer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Printer.class);

    static final String BACKTICK = "`";
    static final String DEFINE_VARS = "define:vars";
    static final String COMPONENT_PATH = "client:component-path";
    static final String COMPONENT_EXPORT = "client:component-export";

    // A spread attribute's key location points past the "..." the parser does not keep
    private static final int SPREAD_PREFIX_LENGTH = 3;

    private final TransformOptions options;
    private final RuntimeNames names;
    private final ImportScanner scanner;
    private final StringBuilder output = new StringBuilder();
    private final ChunkBuilder builder;

    private EmissionState internalImports = EmissionState.NOT_EMITTED;
    private EmissionState funcPrelude = EmissionState.NOT_EMITTED;
    private EmissionState funcSuffix = EmissionState.NOT_EMITTED;

    // Attributes added to client-only components by printComponentMetadata
    private final Map<ElementKey, List<Attribute>> injectedAttributes = new HashMap<>();

    public Printer(TransformOptions options, String source) {
        this(options, source, new LexicalImportScanner());
    }

    public Printer(TransformOptions options, String source, ImportScanner scanner) {
        this.options = options;
        this.names = options.runtimeNames();
        this.scanner = scanner;
        this.builder = new ChunkBuilder(source);
    }

    public PrintResult result() {
        return new PrintResult(output.toString(), builder.generateChunk(output));
    }

    public CharSequence output() {
        return output;
    }

    int mappingCount() {
        return builder.mappingCount();
    }

    public void print(String text) {
        output.append(text);
    }

    public void println(String text) {
        output.append(text).append('\n');
    }

    public void addSourceMapping(Loc location) {
        builder.addSourceMapping(location, output);
    }

    public void addNilSourceMapping() {
        builder.addNilSourceMapping(output);
    }

    /**
     * Returns the attributes of {@code element}, followed by any attributes injected for
     * client-only rendering.
     */
    public List<Attribute> attributesOf(Element element) {
        List<Attribute> injected = injectedAttributes.get(ElementKey.of(element));
        if (injected == null) {
            return element.attributes();
        }
        List<Attribute> all = new ArrayList<>(element.attributes());
        all.addAll(injected);
        return Collections.unmodifiableList(all);
    }

    // ========================================================================
    // Module and component wrappers
    // ========================================================================

    public void printInternalImports(String importSpecifier) {
        if (internalImports == EmissionState.EMITTED) {
            return;
        }
        addNilSourceMapping();
        print("import {\n  ");
        print(names.fragment() + ",\n  ");
        print("render as " + names.render() + ",\n  ");
        print("createAstro as " + names.createAstro() + ",\n  ");
        print("createComponent as " + names.createComponent() + ",\n  ");
        print("renderComponent as " + names.renderComponent() + ",\n  ");
        print("renderSlot as " + names.renderSlot() + ",\n  ");
        print("addAttribute as " + names.addAttribute() + ",\n  ");
        print("spreadAttributes as " + names.spreadAttributes() + ",\n  ");
        print("defineStyleVars as " + names.defineStyleVars() + ",\n  ");
        print("defineScriptVars as " + names.defineScriptVars() + ",\n  ");
        print("createMetadata as " + names.createMetadata());
        print("\n} from \"");
        print(importSpecifier);
        print("\";\n");
        internalImports = EmissionState.EMITTED;
    }

    public void printTopLevelAstro() {
        addNilSourceMapping();
        println(String.format("const $$Astro = %s(import.meta.url, '%s');\nconst Astro = $$Astro;",
            names.createAstro(), Escapes.escapeSingleQuote(options.site())));
    }

    public void printFuncPrelude(String componentName) {
        if (funcPrelude == EmissionState.EMITTED) {
            return;
        }
        addNilSourceMapping();
        println("\n//@ts-ignore");
        println(String.format("const %s = %s(async (%s, $$props, %s) => {",
            componentName, names.createComponent(), names.result(), names.slots()));
        println(String.format("const Astro = %s.createAstro($$Astro, $$props, %s);",
            names.result(), names.slots()));
        funcPrelude = EmissionState.EMITTED;
    }

    public void printFuncSuffix(String componentName) {
        if (funcSuffix == EmissionState.EMITTED) {
            return;
        }
        addNilSourceMapping();
        println("});");
        println(String.format("export default %s;", componentName));
        funcSuffix = EmissionState.EMITTED;
    }

    public void printReturnOpen() {
        addNilSourceMapping();
        print("return ");
        printTemplateLiteralOpen();
    }

    public void printReturnClose() {
        addNilSourceMapping();
        printTemplateLiteralClose();
        println(";");
    }

    public void printTemplateLiteralOpen() {
        addNilSourceMapping();
        print(names.render() + BACKTICK);
    }

    public void printTemplateLiteralClose() {
        addNilSourceMapping();
        print(BACKTICK);
    }

    // ========================================================================
    // Attributes
    // ========================================================================

    /**
     * Prints an attribute inside template text, where dynamic values go through the runtime's
     * attribute helpers.
     */
    public void printAttribute(Attribute attribute) {
        if (DEFINE_VARS.equals(attribute.key())) {
            return;
        }

        if (attribute.hasNamespace() || attribute instanceof QuotedAttribute || attribute instanceof EmptyAttribute) {
            print(" ");
        }
        if (attribute.hasNamespace()) {
            print(attribute.namespace());
            print(":");
        }

        if (attribute instanceof QuotedAttribute quoted) {
            addSourceMapping(quoted.keyLoc());
            print(quoted.key());
            print("=");
            addSourceMapping(quoted.valueLoc());
            print("\"" + Escapes.escapeText(Escapes.encodeDoubleQuote(quoted.value())) + "\"");
        } else if (attribute instanceof EmptyAttribute empty) {
            addSourceMapping(empty.keyLoc());
            print(empty.key());
        } else if (attribute instanceof ExpressionAttribute expression) {
            print("${" + names.addAttribute() + "(");
            addSourceMapping(expression.valueLoc());
            print(expression.value().trim());
            addSourceMapping(expression.keyLoc());
            print(", \"" + expression.key().trim() + "\")}");
        } else if (attribute instanceof SpreadAttribute spread) {
            print("${" + names.spreadAttributes() + "(");
            addSourceMapping(spreadLoc(spread));
            print(spread.key().trim());
            print(", \"" + spread.key().trim() + "\")}");
        } else if (attribute instanceof ShorthandAttribute shorthand) {
            print("${" + names.addAttribute() + "(");
            addSourceMapping(shorthand.keyLoc());
            print(shorthand.key().trim());
            addSourceMapping(shorthand.keyLoc());
            print(", \"" + shorthand.key().trim() + "\")}");
        } else if (attribute instanceof TemplateLiteralAttribute template) {
            print("${" + names.addAttribute() + "(`");
            addSourceMapping(template.valueLoc());
            print(template.value().trim());
            addSourceMapping(template.keyLoc());
            print("`, \"" + template.key().trim() + "\")}");
        }
    }

    /**
     * Prints the attributes of {@code element} as a JavaScript object literal.
     */
    public void printAttributesToObject(Element element) {
        print("{");
        List<Attribute> attributes = attributesOf(element);
        for (int i = 0; i < attributes.size(); i++) {
            if (i != 0) {
                print(",");
            }
            Attribute a = attributes.get(i);
            if (a instanceof QuotedAttribute quoted) {
                addSourceMapping(quoted.keyLoc());
                print("\"" + quoted.key() + "\"");
                print(":");
                addSourceMapping(quoted.valueLoc());
                print("\"" + Escapes.escapeDoubleQuote(quoted.value()) + "\"");
            } else if (a instanceof EmptyAttribute empty) {
                addSourceMapping(empty.keyLoc());
                print("\"" + empty.key() + "\"");
                print(":");
                print("true");
            } else if (a instanceof ExpressionAttribute expression) {
                addSourceMapping(expression.keyLoc());
                print("\"" + expression.key() + "\"");
                print(":");
                addSourceMapping(expression.valueLoc());
                print("(" + expression.value() + ")");
            } else if (a instanceof SpreadAttribute spread) {
                addSourceMapping(spreadLoc(spread));
                print("...(" + spread.key().trim() + ")");
            } else if (a instanceof ShorthandAttribute shorthand) {
                addSourceMapping(shorthand.keyLoc());
                print("\"" + shorthand.key().trim() + "\"");
                print(":");
                addSourceMapping(shorthand.keyLoc());
                print("(" + shorthand.key().trim() + ")");
            } else if (a instanceof TemplateLiteralAttribute template) {
                addSourceMapping(template.keyLoc());
                print("\"" + template.key().trim() + "\"");
                print(":");
                addSourceMapping(template.valueLoc());
                print("`" + template.value().trim() + "`");
            }
        }
        print("}");
    }

    private static Loc spreadLoc(SpreadAttribute spread) {
        if (spread.keyLoc() == null) {
            return null;
        }
        int start = spread.keyLoc().start() - SPREAD_PREFIX_LENGTH;
        if (start < 0) {
            throw new PrintException("Spread attribute {..." + spread.key().trim()
                + "} has its expression at offset " + spread.keyLoc().start()
                + ", before the end of its \"...\"");
        }
        return new Loc(start);
    }

    // ========================================================================
    // <script> and <style>
    // ========================================================================

    /**
     * Prints the runtime call that injects {@code define:vars} values into a script or style
     * body. Does nothing for other elements, when the attribute is absent, or when it is a
     * spread or shorthand attribute.
     */
    public void printDefineVars(Element element) {
        if (!(element.isScript() || element.isStyle())) {
            return;
        }
        for (Attribute attribute : element.attributes()) {
            if (!DEFINE_VARS.equals(attribute.key())) {
                continue;
            }
            String defineCall = element.isScript() ? names.defineScriptVars() : names.defineStyleVars();
            String value;
            Loc valueLoc;
            if (attribute instanceof QuotedAttribute quoted) {
                value = "\"" + Escapes.escapeDoubleQuote(quoted.value()) + "\"";
                valueLoc = quoted.valueLoc();
            } else if (attribute instanceof ExpressionAttribute expression) {
                value = expression.value().trim();
                valueLoc = expression.valueLoc();
            } else if (attribute instanceof TemplateLiteralAttribute template) {
                value = "`" + template.value().trim() + "`";
                valueLoc = template.valueLoc();
            } else if (attribute instanceof EmptyAttribute empty) {
                value = empty.key();
                valueLoc = empty.keyLoc();
            } else {
                // {...define:vars} and {define:vars} carry no value
                return;
            }
            addNilSourceMapping();
            print("${" + defineCall + "(");
            addSourceMapping(valueLoc);
            print(value);
            addNilSourceMapping();
            print(")}");
            return;
        }
    }

    /**
     * Prints a script or style element as a {@code {props, children}} object followed by a comma,
     * for use inside an array literal.
     */
    public void printStyleOrScript(Element element) {
        addNilSourceMapping();
        print("{props:");
        printAttributesToObject(element);
        if (element.firstChild() instanceof Text text && !text.isBlank()) {
            print(",children:`");
            addSourceMapping(element.loc());
            print(Escapes.escapeText(text.data().trim()));
            addNilSourceMapping();
            print("`");
        }
        print("},\n");
    }

    // ========================================================================
    // Metadata
    // ========================================================================

    /**
     * Prints the namespace imports and the {@code $$metadata} export describing the component's
     * dependencies, hydrated components and hoisted scripts.
     *
     * <p>Import statements that provide a client-only component are not imported again; instead
     * the component receives {@code client:component-path} and {@code client:component-export}
     * attributes so the client can load it. Must run before any element is printed.</p>
     *
     * @param document the component
     * @param source the frontmatter script the imports are read from
     */
    public void printComponentMetadata(Document document, String source) {
        List<String> specifiers = new ArrayList<>();

        addNilSourceMapping();
        ScanResult scan = scanner.nextImportStatement(source, 0);
        while (scan.found()) {
            ImportStatement statement = scan.statement();
            if (!statement.typeOnly() && !injectClientOnlyAttributes(document, statement)) {
                specifiers.add(statement.specifier());
                print(String.format("\nimport * as $$module%d from '%s';",
                    specifiers.size(), Escapes.escapeSingleQuote(statement.specifier())));
            }
            scan = scanner.nextImportStatement(source, scan.next());
        }
        if (!specifiers.isEmpty()) {
            print("\n");
        }

        print(String.format("\nexport const %s = %s(import.meta.url, { ", names.metadata(), names.createMetadata()));

        print("modules: [");
        for (int i = 0; i < specifiers.size(); i++) {
            if (i > 0) {
                print(", ");
            }
            print(String.format("{ module: $$module%d, specifier: '%s' }",
                i + 1, Escapes.escapeSingleQuote(specifiers.get(i))));
        }
        print("]");

        print(", hydratedComponents: [");
        List<Element> hydrated = document.hydratedComponents();
        for (int i = 0; i < hydrated.size(); i++) {
            if (i > 0) {
                print(", ");
            }
            Element component = hydrated.get(i);
            if (component.customElement()) {
                print("'" + Escapes.escapeSingleQuote(component.name()) + "'");
            } else {
                print(component.name());
            }
        }

        print("], hoisted: [");
        boolean first = true;
        for (Element script : document.scripts()) {
            String hoisted = hoistedScript(script);
            if (hoisted == null) {
                continue;
            }
            if (!first) {
                print(", ");
            }
            print(hoisted);
            first = false;
        }
        print("] });\n\n");
    }

    /**
     * Adds the client-only attributes to the first client-only component bound by
     * {@code statement}. Returns true if one was found.
     */
    private boolean injectClientOnlyAttributes(Document document, ImportStatement statement) {
        for (Element component : document.clientOnlyComponents()) {
            for (ImportedName imported : statement.imports()) {
                String exportName = null;
                if (imported.isNamespace()) {
                    String prefix = imported.localName() + ".";
                    if (component.name().startsWith(prefix)) {
                        exportName = component.name().substring(prefix.length()).split("\\.")[0];
                    }
                } else if (imported.localName().equals(component.name())) {
                    exportName = imported.exportName();
                }
                if (exportName != null) {
                    LOGGER.debug("Client-only component {} resolves to export '{}' of {}",
                        component.name(), exportName, statement.specifier());
                    List<Attribute> injected = injectedAttributes.computeIfAbsent(ElementKey.of(component), c -> new ArrayList<>());
                    injected.add(new ExpressionAttribute(COMPONENT_PATH,
                        String.format("%s.resolvePath(\"%s\")", names.metadata(), Escapes.escapeDoubleQuote(statement.specifier()))));
                    injected.add(new QuotedAttribute(COMPONENT_EXPORT, exportName));
                    return true;
                }
            }
        }
        return false;
    }

    private static String hoistedScript(Element script) {
        Attribute src = script.attribute("src");
        if (src != null) {
            return String.format("{ type: 'remote', src: '%s' }", Escapes.escapeSingleQuote(attributeText(src)));
        }
        if (script.firstChild() instanceof Text text) {
            return String.format("{ type: 'inline', value: `%s` }", Escapes.escapeText(text.data()));
        }
        return null;
    }

    private static String attributeText(Attribute attribute) {
        if (attribute instanceof QuotedAttribute quoted) {
            return quoted.value();
        } else if (attribute instanceof ExpressionAttribute expression) {
            return expression.value().trim();
        } else if (attribute instanceof TemplateLiteralAttribute template) {
            return template.value();
        }
        return "";
    }
}
