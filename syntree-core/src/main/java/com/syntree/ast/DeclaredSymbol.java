package com.syntree.ast;

import java.util.Objects;

/**
 * Plain value implementation of {@link Symbol}.
 */
public record DeclaredSymbol(
    long id,
    String name,
    String scope,
    String declaredType
) implements Symbol {
    public DeclaredSymbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(declaredType, "declaredType");
    }

    public DeclaredSymbol(long id, String name, String scope) {
        this(id, name, scope, "");
    }
}
