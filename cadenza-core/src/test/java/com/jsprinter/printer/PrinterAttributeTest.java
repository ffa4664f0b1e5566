package com.jsprinter.printer;

import com.jsprinter.ast.*;
import com.jsprinter.sourcemap.Mapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterAttributeTest {

    private static String printAttribute(Attribute attribute) {
        Printer printer = new Printer(TransformOptions.defaults(), "");
        printer.printAttribute(attribute);
        return printer.output().toString();
    }

    private static String printObject(List<Attribute> attributes) {
        Printer printer = new Printer(TransformOptions.defaults(), "");
        printer.printAttributesToObject(new Element(0, "Widget", attributes, List.of()));
        return printer.output().toString();
    }

    @Test
    void quotedAttributeIsEncodedForTemplateText() {
        String output = printAttribute(new QuotedAttribute("title", "say \"hi\" `now` ${x}"));
        assertEquals(" title=\"say &quot;hi&quot; \\`now\\` \\${x}\"", output);
    }

    @Test
    void quotedAttributeKeepsBackslashes() {
        assertEquals(" pattern=\"\\\\d+\"", printAttribute(new QuotedAttribute("pattern", "\\d+")));
    }

    @Test
    @DisplayName("A backslash before a backtick cannot close the template literal")
    void quotedAttributeBackslashBeforeBacktick() {
        assertEquals(" title=\"a\\\\\\`b\"", printAttribute(new QuotedAttribute("title", "a\\`b")));
    }

    @Test
    void emptyAttribute() {
        assertEquals(" disabled", printAttribute(new EmptyAttribute("disabled", null)));
    }

    @Test
    void expressionAttributeGoesThroughAddAttribute() {
        assertEquals("${$$addAttribute(count + 1, \"value\")}",
            printAttribute(new ExpressionAttribute("value", "  count + 1 ")));
    }

    @Test
    void spreadAttribute() {
        assertEquals("${$$spreadAttributes(props, \"props\")}",
            printAttribute(new SpreadAttribute("props", new Loc(9))));
    }

    @Test
    void shorthandAttribute() {
        assertEquals("${$$addAttribute(name, \"name\")}",
            printAttribute(new ShorthandAttribute("name", new Loc(4))));
    }

    @Test
    void templateLiteralAttribute() {
        assertEquals("${$$addAttribute(`/post/${slug}`, \"href\")}",
            printAttribute(new TemplateLiteralAttribute("href", "/post/${slug}", null, null)));
    }

    @Test
    void namespacePrefixesTheKey() {
        assertEquals(" xlink:href=\"#icon\"",
            printAttribute(new QuotedAttribute("href", "#icon", null, null, "xlink")));
        assertEquals(" on:click",
            printAttribute(new EmptyAttribute("click", null, "on")));
    }

    @Test
    void defineVarsIsNeverPrintedAsAnAttribute() {
        assertEquals("", printAttribute(new ExpressionAttribute("define:vars", "{ color }")));
        assertEquals("", printAttribute(new QuotedAttribute("define:vars", "x")));
    }

    @Test
    @DisplayName("A spread whose expression starts before offset 3 cannot be mapped")
    void spreadTooCloseToStartThrows() {
        PrintException e = assertThrows(PrintException.class,
            () -> printAttribute(new SpreadAttribute("props", new Loc(2))));
        assertTrue(e.getMessage().contains("props"), e.getMessage());
    }

    @Test
    void spreadWithoutLocationIsSynthetic() {
        assertDoesNotThrow(() -> printAttribute(new SpreadAttribute("props", null)));
    }

    @Test
    void spreadMapsToTheStartOfItsEllipsis() {
        String source = "<div {...props}>";
        Printer printer = new Printer(TransformOptions.defaults(), source);
        printer.printAttribute(new SpreadAttribute("props", new Loc(9)));

        List<Mapping> mappings = printer.result().sourceMapChunk().mappings();
        assertEquals(1, mappings.size());
        assertEquals(new Mapping(0, "${$$spreadAttributes(".length(), 6, 0, 6), mappings.get(0));
    }

    @Test
    void quotedAttributeMapsKeyAndValue() {
        String source = "<a href=\"/x\">";
        Printer printer = new Printer(TransformOptions.defaults(), source);
        printer.printAttribute(new QuotedAttribute("href", "/x", new Loc(3), new Loc(8)));

        assertEquals(" href=\"/x\"", printer.output().toString());
        List<Mapping> mappings = printer.result().sourceMapChunk().mappings();
        assertEquals(List.of(new Mapping(0, 1, 3, 0, 3), new Mapping(0, 6, 8, 0, 8)), mappings);
    }

    @Test
    void allAttributeKindsAsObjectLiteral() {
        String output = printObject(List.of(
            new QuotedAttribute("class", "a \"b\""),
            new EmptyAttribute("hidden", null),
            new ExpressionAttribute("count", " n + 1 "),
            new SpreadAttribute("rest", null),
            new ShorthandAttribute("name", null),
            new TemplateLiteralAttribute("href", "/p/${id}", null, null)
        ));
        assertEquals("{\"class\":\"a \\\"b\\\"\",\"hidden\":true,\"count\":( n + 1 ),...(rest),"
            + "\"name\":(name),\"href\":`/p/${id}`}", output);
    }

    @Test
    void emptyObjectLiteral() {
        assertEquals("{}", printObject(List.of()));
    }

    @Test
    void objectLiteralEscapesLineBreaksInQuotedValues() {
        assertEquals("{\"title\":\"one\\ntwo\"}", printObject(List.of(new QuotedAttribute("title", "one\ntwo"))));
    }

    static List<Attribute> everyAttributeKind() {
        return List.of(
            new QuotedAttribute("title", "say \"hi\" \\d+ a\\`b ${x}\nnext"),
            new EmptyAttribute("hidden", null),
            new ExpressionAttribute("count", " n + 1 "),
            new SpreadAttribute("rest", null),
            new ShorthandAttribute("name", null),
            new TemplateLiteralAttribute("href", "/post/${slug}", null, null)
        );
    }

    @ParameterizedTest
    @MethodSource("everyAttributeKind")
    @DisplayName("Template text and object literal agree on key and value")
    void templateAndObjectFormsAgree(Attribute attribute) {
        String template = printAttribute(attribute);
        String object = printObject(List.of(attribute));
        System.out.println(template + "  <->  " + object);

        Map.Entry<String, String> fromTemplate = decodeTemplateForm(template);
        Map.Entry<String, String> fromObject = decodeObjectForm(object);
        assertEquals(fromObject, fromTemplate);
    }

    /**
     * Reads the key and the value (raw text for quoted values, expression text otherwise) back
     * out of template text.
     */
    private static Map.Entry<String, String> decodeTemplateForm(String printed) {
        String addAttribute = "${$$addAttribute(";
        String spread = "${$$spreadAttributes(";
        if (printed.startsWith(addAttribute) || printed.startsWith(spread)) {
            int keyStart = printed.lastIndexOf(", \"");
            String expression = printed.substring(printed.indexOf('(') + 1, keyStart);
            String key = printed.substring(keyStart + 3, printed.length() - "\")}".length());
            return printed.startsWith(spread) ? Map.entry("...", expression) : Map.entry(key, expression);
        }
        int equals = printed.indexOf("=\"");
        if (equals < 0) {
            return Map.entry(printed.substring(1), "true");
        }
        String value = printed.substring(equals + 2, printed.length() - 1);
        return Map.entry(printed.substring(1, equals), unescape(value).replace("&quot;", "\""));
    }

    private static Map.Entry<String, String> decodeObjectForm(String printed) {
        String pair = printed.substring(1, printed.length() - 1);
        if (pair.startsWith("...(")) {
            return Map.entry("...", pair.substring(4, pair.length() - 1).trim());
        }
        int colon = pair.indexOf("\":");
        String key = pair.substring(1, colon);
        String value = pair.substring(colon + 2);
        if (value.startsWith("(")) {
            value = value.substring(1, value.length() - 1).trim();
        } else if (value.startsWith("\"")) {
            value = unescape(value.substring(1, value.length() - 1));
        }
        return Map.entry(key, value);
    }

    // Undoes backslash escapes as a JavaScript string or template literal would
    private static String unescape(String text) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(++i);
                out.append(next == 'n' ? '\n' : next == 'r' ? '\r' : next);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
