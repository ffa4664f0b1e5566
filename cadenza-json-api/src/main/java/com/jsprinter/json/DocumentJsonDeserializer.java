package com.jsprinter.json;

import com.jsprinter.ast.Document;
import com.jsprinter.ast.Node;
import com.jsprinter.printer.TransformOptions;

/**
 * Reads the output of the parser and transform stages from JSON.
 */
public interface DocumentJsonDeserializer {

    /**
     * Deserializes a JSON string to a Document (root node).
     *
     * @param json the JSON string to deserialize
     * @return the deserialized Document
     * @throws DocumentJsonException if deserialization fails
     */
    Document deserializeDocument(String json) throws DocumentJsonException;

    /**
     * Deserializes a JSON string to a specific node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws DocumentJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws DocumentJsonException;

    /**
     * Deserializes transform options. Missing fields take their default values.
     *
     * @param json the JSON string to deserialize
     * @return the options
     * @throws DocumentJsonException if deserialization fails
     */
    TransformOptions deserializeOptions(String json) throws DocumentJsonException;
}
