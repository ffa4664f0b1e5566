package com.jsprinter;

import com.jsprinter.ast.Document;
import com.jsprinter.printer.PrintResult;
import com.jsprinter.printer.PrintToJs;
import com.jsprinter.printer.TransformOptions;
import com.jsprinter.sourcemap.SourceMap;

/**
 * Entry point for turning a parsed component into a JavaScript module.
 *
 * Usage:
 * <pre>
 * PrintResult result = Cadenza.printToJs(document, source, new TransformOptions("Card.astro", null, "https://example.com"));
 * String js = result.output();
 * SourceMap map = Cadenza.sourceMap(result, source, "Card.astro");
 * </pre>
 */
public final class Cadenza {

    private Cadenza() {
        // Utility class
    }

    public static PrintResult printToJs(Document document, String source, TransformOptions options) {
        return PrintToJs.printToJs(document, source, options);
    }

    public static PrintResult printToJs(Document document, String source) {
        return printToJs(document, source, TransformOptions.defaults());
    }

    /**
     * Builds the version 3 source map for a print result. The generated file is named after the
     * source with a {@code .js} suffix.
     */
    public static SourceMap sourceMap(PrintResult result, String source, String sourceName) {
        return result.sourceMapChunk().toSourceMap(sourceName + ".js", sourceName, source);
    }
}
