package com.jsprinter.json;

import com.jsprinter.ast.Node;

/**
 * Interface for serializing document tree nodes to JSON.
 */
public interface DocumentJsonSerializer {

    /**
     * Serializes a node to a JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws DocumentJsonException if serialization fails
     */
    String serialize(Node node) throws DocumentJsonException;

    /**
     * Serializes a node to a pretty-printed JSON string.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws DocumentJsonException if serialization fails
     */
    String serializePretty(Node node) throws DocumentJsonException;
}
