package com.jsprinter.sourcemap;

import java.util.List;

/**
 * A Source Map Revision 3 document.
 */
public record SourceMap(
    int version,
    String file,
    List<String> sources,
    List<String> sourcesContent,
    List<String> names,
    String mappings
) {
    public static final int VERSION = 3;
}
