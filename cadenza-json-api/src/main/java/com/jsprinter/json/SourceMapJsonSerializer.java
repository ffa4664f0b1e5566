package com.jsprinter.json;

import com.jsprinter.sourcemap.SourceMap;

/**
 * Writes source maps in the JSON form consumed by browsers and bundlers.
 */
public interface SourceMapJsonSerializer {

    /**
     * @throws DocumentJsonException if serialization fails
     */
    String serialize(SourceMap sourceMap) throws DocumentJsonException;
}
