package com.jsprinter.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Best-effort import scanner that works on characters rather than on a syntax tree.
 *
 * <p>The scanner skips strings, comments, template literals and regular expression literals,
 * tracks bracket nesting, and only considers {@code import} keywords that appear at nesting depth
 * zero. Dynamic {@code import(...)} and {@code import.meta} are ignored. A statement whose clause
 * cannot be read is skipped and scanning continues after its keyword.</p>
 */
public final class LexicalImportScanner implements ImportScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(LexicalImportScanner.class);

    // Keywords after which '/' starts a regular expression rather than a division
    private static final Set<String> REGEX_PREFIX_KEYWORDS = Set.of(
        "return", "typeof", "instanceof", "in", "of", "new", "delete", "void",
        "throw", "case", "do", "else", "yield", "await");

    @Override
    public ScanResult nextImportStatement(String source, int from) {
        if (source == null || from < 0 || from >= source.length()) {
            return ScanResult.NOT_FOUND;
        }
        return new Cursor(source, from).scan();
    }

    private enum Previous {
        NOTHING,
        IDENTIFIER,
        VALUE,
        PUNCTUATOR
    }

    private static final class Cursor {
        private final String src;
        private final int length;
        private int pos;
        private int depth = 0;
        // Nesting depth outside each open ${ ... } substitution
        private final Deque<Integer> templateDepths = new ArrayDeque<>();

        private Previous previous = Previous.NOTHING;
        private char lastPunctuator = 0;
        private String lastWord = null;

        Cursor(String src, int from) {
            this.src = src;
            this.length = src.length();
            this.pos = from;
        }

        ScanResult scan() {
            while (pos < length) {
                char c = src.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                    continue;
                }
                if (c == '/' && peek(1) == '/') {
                    pos = skipLineComment(src, pos);
                    continue;
                }
                if (c == '/' && peek(1) == '*') {
                    pos = skipBlockComment(src, pos);
                    continue;
                }
                switch (c) {
                    case '\'', '"' -> {
                        pos = skipString(src, pos);
                        markValue();
                    }
                    case '`' -> {
                        pos = skipTemplate(pos + 1);
                        markValue();
                    }
                    case '{', '(', '[' -> {
                        depth++;
                        pos++;
                        markPunctuator(c);
                    }
                    case ')', ']' -> {
                        depth = Math.max(0, depth - 1);
                        pos++;
                        markValue();
                    }
                    case '}' -> closeBrace();
                    case '/' -> {
                        if (regexAllowed()) {
                            pos = skipRegex(pos);
                            markValue();
                        } else {
                            pos++;
                            markPunctuator(c);
                        }
                    }
                    default -> {
                        if (Character.isJavaIdentifierStart(c)) {
                            int wordStart = pos;
                            String word = readWord();
                            if (word.equals("import") && atTopLevel()) {
                                ImportStatement statement = new ImportClauseReader(src, wordStart, pos).read();
                                if (statement != null) {
                                    return new ScanResult(statement.end(), statement);
                                }
                            }
                            previous = Previous.IDENTIFIER;
                            lastWord = word;
                        } else if (Character.isDigit(c)) {
                            while (pos < length && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '.' || src.charAt(pos) == '_')) {
                                pos++;
                            }
                            markValue();
                        } else {
                            pos++;
                            markPunctuator(c);
                        }
                    }
                }
            }
            return ScanResult.NOT_FOUND;
        }

        private boolean atTopLevel() {
            boolean memberAccess = previous == Previous.PUNCTUATOR && lastPunctuator == '.';
            return depth == 0 && templateDepths.isEmpty() && !memberAccess;
        }

        private void closeBrace() {
            pos++;
            if (depth > 0) {
                depth--;
            }
            if (!templateDepths.isEmpty() && templateDepths.peek() == depth) {
                templateDepths.pop();
                pos = skipTemplate(pos);
                markValue();
                return;
            }
            markPunctuator('}');
        }

        private boolean regexAllowed() {
            return switch (previous) {
                case NOTHING, PUNCTUATOR -> true;
                case IDENTIFIER -> REGEX_PREFIX_KEYWORDS.contains(lastWord);
                case VALUE -> false;
            };
        }

        /**
         * Skips template text up to and including the closing backtick, or up to and including
         * the next {@code ${}, in which case the substitution is entered.
         */
        private int skipTemplate(int from) {
            int i = from;
            while (i < length) {
                char c = src.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (c == '`') {
                    return i + 1;
                } else if (c == '$' && i + 1 < length && src.charAt(i + 1) == '{') {
                    templateDepths.push(depth);
                    depth++;
                    return i + 2;
                } else {
                    i++;
                }
            }
            return length;
        }

        private int skipRegex(int from) {
            int i = from + 1;
            boolean inClass = false;
            while (i < length) {
                char c = src.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == '\n') {
                    // Not a regular expression after all
                    return from + 1;
                }
                if (c == '[') {
                    inClass = true;
                } else if (c == ']') {
                    inClass = false;
                } else if (c == '/' && !inClass) {
                    i++;
                    break;
                }
                i++;
            }
            while (i < length && Character.isJavaIdentifierPart(src.charAt(i))) {
                i++;
            }
            return Math.min(i, length);
        }

        private String readWord() {
            int start = pos;
            pos++;
            while (pos < length && Character.isJavaIdentifierPart(src.charAt(pos))) {
                pos++;
            }
            return src.substring(start, pos);
        }

        private char peek(int ahead) {
            int i = pos + ahead;
            return i < length ? src.charAt(i) : 0;
        }

        private void markValue() {
            previous = Previous.VALUE;
            lastWord = null;
        }

        private void markPunctuator(char c) {
            previous = Previous.PUNCTUATOR;
            lastPunctuator = c;
            lastWord = null;
        }
    }

    /**
     * Reads the clause of a single import statement, starting just after the keyword.
     * Every method returns null or false when the text does not match.
     */
    private static final class ImportClauseReader {
        private final String src;
        private final int length;
        private final int start;
        private int pos;

        ImportClauseReader(String src, int start, int afterKeyword) {
            this.src = src;
            this.length = src.length();
            this.start = start;
            this.pos = afterKeyword;
        }

        ImportStatement read() {
            skipTrivia();
            if (pos >= length) {
                return fail("end of input");
            }
            char c = src.charAt(pos);
            if (c == '(' || c == '.') {
                // import(...) or import.meta
                return null;
            }
            if (c == '\'' || c == '"') {
                String specifier = stringLiteral();
                return specifier != null ? finish(specifier, List.of(), false) : fail("unterminated specifier");
            }

            boolean typeOnly = false;
            if ("type".equals(peekWord())) {
                int save = pos;
                identifier();
                skipTrivia();
                String following = peekWord();
                if (at('{') || at('*') || (following != null && !following.equals("from"))) {
                    typeOnly = true;
                } else {
                    // "type" is the default binding
                    pos = save;
                }
            }

            List<ImportedName> names = new ArrayList<>();
            if (at('*')) {
                if (!namespaceClause(names)) {
                    return fail("malformed namespace import");
                }
            } else if (at('{')) {
                if (!namedClause(names)) {
                    return fail("malformed named imports");
                }
            } else {
                String local = identifier();
                if (local == null) {
                    return fail("expected import clause");
                }
                names.add(new ImportedName(local, ImportedName.DEFAULT));
                skipTrivia();
                if (at(',')) {
                    pos++;
                    skipTrivia();
                    boolean ok = at('*') ? namespaceClause(names) : at('{') && namedClause(names);
                    if (!ok) {
                        return fail("malformed import clause after default binding");
                    }
                }
            }

            skipTrivia();
            if (!"from".equals(identifier())) {
                return fail("expected 'from'");
            }
            skipTrivia();
            String specifier = stringLiteral();
            if (specifier == null) {
                return fail("expected module specifier");
            }
            return finish(specifier, names, typeOnly);
        }

        private ImportStatement finish(String specifier, List<ImportedName> names, boolean typeOnly) {
            int end = pos;
            skipTrivia();
            String word = peekWord();
            if ("assert".equals(word) || "with".equals(word)) {
                identifier();
                skipTrivia();
                if (at('{') && skipBalancedBraces()) {
                    end = pos;
                }
            }
            pos = end;
            while (pos < length && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
                pos++;
            }
            if (at(';')) {
                end = pos + 1;
            }
            return new ImportStatement(specifier, names, start, end, typeOnly);
        }

        private boolean namespaceClause(List<ImportedName> names) {
            pos++;
            skipTrivia();
            if (!"as".equals(identifier())) {
                return false;
            }
            skipTrivia();
            String local = identifier();
            if (local == null) {
                return false;
            }
            names.add(new ImportedName(local, ImportedName.NAMESPACE));
            return true;
        }

        private boolean namedClause(List<ImportedName> names) {
            pos++;
            while (true) {
                skipTrivia();
                if (pos >= length) {
                    return false;
                }
                if (at('}')) {
                    pos++;
                    return true;
                }
                boolean quoted = at('\'') || at('"');
                String imported = quoted ? stringLiteral() : identifier();
                if (imported == null) {
                    return false;
                }
                skipTrivia();

                boolean typeModifier = false;
                if (!quoted && imported.equals("type") && !at(',') && !at('}') && !"as".equals(peekWord())) {
                    // { type Foo } imports a type only; it binds nothing at runtime
                    imported = identifier();
                    if (imported == null) {
                        return false;
                    }
                    typeModifier = true;
                    skipTrivia();
                }

                String local = imported;
                if ("as".equals(peekWord())) {
                    identifier();
                    skipTrivia();
                    local = identifier();
                    if (local == null) {
                        return false;
                    }
                    skipTrivia();
                } else if (quoted) {
                    return false;
                }
                if (!typeModifier) {
                    names.add(new ImportedName(local, imported));
                }

                if (at(',')) {
                    pos++;
                } else if (!at('}')) {
                    return false;
                }
            }
        }

        private boolean skipBalancedBraces() {
            int nesting = 0;
            while (pos < length) {
                char c = src.charAt(pos);
                if (c == '\'' || c == '"') {
                    pos = skipString(src, pos);
                    continue;
                }
                pos++;
                if (c == '{') {
                    nesting++;
                } else if (c == '}' && --nesting == 0) {
                    return true;
                }
            }
            return false;
        }

        private String stringLiteral() {
            if (!(at('\'') || at('"'))) {
                return null;
            }
            char quote = src.charAt(pos);
            StringBuilder value = new StringBuilder();
            int i = pos + 1;
            while (i < length) {
                char c = src.charAt(i);
                if (c == '\\' && i + 1 < length) {
                    value.append(src.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    pos = i + 1;
                    return value.toString();
                }
                if (c == '\n') {
                    return null;
                }
                value.append(c);
                i++;
            }
            return null;
        }

        private String identifier() {
            if (pos >= length || !Character.isJavaIdentifierStart(src.charAt(pos))) {
                return null;
            }
            int begin = pos;
            pos++;
            while (pos < length && Character.isJavaIdentifierPart(src.charAt(pos))) {
                pos++;
            }
            return src.substring(begin, pos);
        }

        private String peekWord() {
            int save = pos;
            String word = identifier();
            pos = save;
            return word;
        }

        private boolean at(char c) {
            return pos < length && src.charAt(pos) == c;
        }

        private void skipTrivia() {
            while (pos < length) {
                char c = src.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '/' && pos + 1 < length && src.charAt(pos + 1) == '/') {
                    pos = skipLineComment(src, pos);
                } else if (c == '/' && pos + 1 < length && src.charAt(pos + 1) == '*') {
                    pos = skipBlockComment(src, pos);
                } else {
                    return;
                }
            }
        }

        private ImportStatement fail(String reason) {
            LOGGER.trace("Skipping import at offset {}: {}", start, reason);
            return null;
        }
    }

    private static int skipLineComment(String src, int from) {
        int newline = src.indexOf('\n', from);
        return newline < 0 ? src.length() : newline + 1;
    }

    private static int skipBlockComment(String src, int from) {
        int close = src.indexOf("*/", from + 2);
        return close < 0 ? src.length() : close + 2;
    }

    private static int skipString(String src, int from) {
        char quote = src.charAt(from);
        int i = from + 1;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n') {
                return i;
            } else {
                i++;
            }
        }
        return src.length();
    }
}
