package com.syntree.json;

import com.syntree.ast.Node;

/**
 * Reads syntax trees from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a tree and checks every node against the shape table.
     *
     * @param json JSON produced by an {@link AstJsonSerializer}
     * @return the root of a freshly built tree
     * @throws AstJsonException if the JSON is unreadable or describes a malformed tree
     */
    Node deserialize(String json) throws AstJsonException;
}
