package com.syntree.json;

import com.syntree.ast.Node;

/**
 * Writes syntax trees as JSON.
 */
public interface AstJsonSerializer {

    /**
     * @param node root of the tree to write
     * @return compact JSON for the tree
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * @param node root of the tree to write
     * @return indented JSON for the tree
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
