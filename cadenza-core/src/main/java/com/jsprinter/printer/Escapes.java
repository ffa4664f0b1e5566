package com.jsprinter.printer;

/**
 * Escaping for text placed in generated JavaScript.
 */
final class Escapes {

    private Escapes() {
        // Utility class
    }

    /**
     * Escapes text for the body of a template literal.
     */
    static String escapeText(String text) {
        return escapeInterpolation(escapeBackticks(escapeBackslashes(text)));
    }

    static String escapeBackslashes(String text) {
        return text.replace("\\", "\\\\");
    }

    static String escapeBackticks(String text) {
        return text.replace("`", "\\`");
    }

    static String escapeInterpolation(String text) {
        return text.replace("${", "\\${");
    }

    static String escapeSingleQuote(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }

    /**
     * Escapes an attribute value for a double-quoted HTML attribute.
     */
    static String encodeDoubleQuote(String text) {
        return text.replace("\"", "&quot;");
    }

    /**
     * Escapes text for a double-quoted JavaScript string literal.
     */
    static String escapeDoubleQuote(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\u2028' -> out.append("\\u2028");
                case '\u2029' -> out.append("\\u2029");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
