package com.rbparser.json;

import com.rbparser.ast.Node;

/**
 * Writes syntax tree nodes as JSON. Every node becomes an object with a
 * {@code type} tag, a {@code location} array and its fields in declaration
 * order; attached comments follow as {@code comments}.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented for reading.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
