package com.jsprinter.printer;

import com.jsprinter.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterWrapperTest {

    private static final String INTERNAL_IMPORTS = """
        import {
          Fragment,
          render as $$render,
          createAstro as $$createAstro,
          createComponent as $$createComponent,
          renderComponent as $$renderComponent,
          renderSlot as $$renderSlot,
          addAttribute as $$addAttribute,
          spreadAttributes as $$spreadAttributes,
          defineStyleVars as $$defineStyleVars,
          defineScriptVars as $$defineScriptVars,
          createMetadata as $$createMetadata
        } from "astro/internal";
        """;

    private static final String PRELUDE = """

        //@ts-ignore
        const $$Component = $$createComponent(async ($$result, $$props, $$slots) => {
        const Astro = $$result.createAstro($$Astro, $$props, $$slots);
        """;

    private final Printer printer = new Printer(TransformOptions.defaults(), "");

    @Test
    void internalImports() {
        printer.printInternalImports("astro/internal");
        assertEquals(INTERNAL_IMPORTS, printer.output().toString());
    }

    @Test
    void internalImportsAreEmittedOnce() {
        printer.printInternalImports("astro/internal");
        int mappings = printer.mappingCount();
        printer.printInternalImports("astro/internal");
        printer.printInternalImports("somewhere/else");

        assertEquals(INTERNAL_IMPORTS, printer.output().toString());
        assertEquals(mappings, printer.mappingCount());
    }

    @Test
    void preludeAndSuffixAreEmittedOnce() {
        printer.printFuncPrelude("$$Component");
        printer.printFuncPrelude("$$Component");
        printer.printFuncSuffix("$$Component");
        printer.printFuncSuffix("$$Component");

        assertEquals(PRELUDE + "});\nexport default $$Component;\n", printer.output().toString());
    }

    @Test
    void topLevelAstroEscapesTheSite() {
        Printer sited = new Printer(TransformOptions.defaults().withSite("https://example.com/it's"), "");
        sited.printTopLevelAstro();
        assertEquals("const $$Astro = $$createAstro(import.meta.url, 'https://example.com/it\\'s');\n"
            + "const Astro = $$Astro;\n", sited.output().toString());
    }

    @Test
    void returnWrapsATemplateLiteral() {
        printer.printReturnOpen();
        printer.print("<p>hi</p>");
        printer.printReturnClose();
        assertEquals("return $$render`<p>hi</p>`;\n", printer.output().toString());
    }

    @Test
    void customRuntimeNames() {
        RuntimeNames names = new RuntimeNames("$r", "$ca", "$cc", "$rc", "$rs", "$aa", "$sa", "$dsv", "$dcv",
            "$cm", "$meta", "$res", "$sl", "Frag");
        Printer custom = new Printer(new TransformOptions("Card.astro", "@runtime/server", "", names), "");
        custom.printInternalImports("@runtime/server");
        custom.printFuncPrelude("Card");
        custom.printAttribute(new ExpressionAttribute("x", "y"));

        String output = custom.output().toString();
        assertTrue(output.startsWith("import {\n  Frag,\n  render as $r,\n"), output);
        assertTrue(output.contains("} from \"@runtime/server\";\n"), output);
        assertTrue(output.contains("const Card = $cc(async ($res, $$props, $sl) => {\n"), output);
        assertTrue(output.contains("const Astro = $res.createAstro($$Astro, $$props, $sl);\n"), output);
        assertTrue(output.endsWith("${$aa(y, \"x\")}"), output);
    }

    @Test
    void defineVarsOnStyleAndScript() {
        Element style = new Element(0, "style",
            List.of(new ExpressionAttribute("define:vars", " { color } ")), List.of());
        Element script = new Element(0, "script",
            List.of(new QuotedAttribute("is", "inline"), new QuotedAttribute("define:vars", "x")), List.of());

        printer.printDefineVars(style);
        printer.print("|");
        printer.printDefineVars(script);
        assertEquals("${$$defineStyleVars({ color })}|${$$defineScriptVars(\"x\")}", printer.output().toString());
    }

    @Test
    void defineVarsWithoutValueUsesTheKey() {
        Element script = new Element(0, "script", List.of(new EmptyAttribute("define:vars", null)), List.of());
        printer.printDefineVars(script);
        assertEquals("${$$defineScriptVars(define:vars)}", printer.output().toString());
    }

    @Test
    void defineVarsTemplateLiteralIsPrintedAsALiteral() {
        Element style = new Element(0, "style",
            List.of(new TemplateLiteralAttribute("define:vars", "x", null, null)), List.of());
        printer.printDefineVars(style);
        assertEquals("${$$defineStyleVars(`x`)}", printer.output().toString());
    }

    @Test
    void defineVarsSpreadOrShorthandPrintsNothing() {
        printer.printDefineVars(new Element(0, "style",
            List.of(new SpreadAttribute("define:vars", null)), List.of()));
        printer.printDefineVars(new Element(0, "script",
            List.of(new ShorthandAttribute("define:vars", null)), List.of()));
        assertEquals("", printer.output().toString());
    }

    @Test
    void defineVarsIgnoresOtherElements() {
        printer.printDefineVars(new Element(0, "div",
            List.of(new ExpressionAttribute("define:vars", "{ a }")), List.of()));
        printer.printDefineVars(new Element(0, "style", List.of(), List.of()));
        assertEquals("", printer.output().toString());
    }

    @Test
    void styleWithBody() {
        Element style = new Element(0, "style", List.of(new QuotedAttribute("lang", "scss")),
            List.of(new Text(20, "\n  h1 { content: `x`; }\n")));
        printer.printStyleOrScript(style);
        assertEquals("{props:{\"lang\":\"scss\"},children:`h1 { content: \\`x\\`; }`},\n", printer.output().toString());
    }

    @Test
    void styleWithoutBodyOmitsChildren() {
        printer.printStyleOrScript(new Element(0, "style", List.of(), List.of()));
        printer.printStyleOrScript(new Element(0, "style", List.of(), List.of(new Text(7, "  \n "))));
        printer.printStyleOrScript(new Element(0, "style", List.of(), List.of(new Comment(7, 20, "x"))));
        assertEquals("{props:{}},\n{props:{}},\n{props:{}},\n", printer.output().toString());
    }
}
