package com.syntree.ast;

import com.syntree.InvalidAccessException;

import java.util.List;

/**
 * Named access to the seven slots of a routine definition:
 * name, pattern, generic parameters, formal parameters, pragma, reserved,
 * body.
 */
public final class Routines {

    public static final int NAME = 0;
    public static final int PATTERN = 1;
    public static final int GENERIC_PARAMS = 2;
    public static final int PARAMS = 3;
    public static final int PRAGMA = 4;
    public static final int RESERVED = 5;
    public static final int BODY = 6;

    private Routines() {
        // Utility class
    }

    public static Node name(Node routine) {
        return require(routine).get(NAME);
    }

    /**
     * The routine's plain name, without export marker; empty for lambdas.
     */
    public static String basename(Node routine) {
        Node name = name(routine);
        return name.isAbsent() ? "" : Identifiers.basename(name);
    }

    public static boolean isExported(Node routine) {
        return Identifiers.isExported(name(routine));
    }

    public static Node genericParams(Node routine) {
        return require(routine).get(GENERIC_PARAMS);
    }

    public static Node params(Node routine) {
        return require(routine).get(PARAMS);
    }

    public static Node returnType(Node routine) {
        return params(routine).get(0);
    }

    /**
     * Parameter entries, i.e. the formal parameter list without its return
     * type slot.
     */
    public static List<Node> paramEntries(Node routine) {
        List<Node> all = params(routine).children();
        return all.subList(1, all.size());
    }

    public static Node pragma(Node routine) {
        return require(routine).get(PRAGMA);
    }

    public static Node body(Node routine) {
        return require(routine).get(BODY);
    }

    /**
     * Replaces the body.
     *
     * @return the previous body, detached
     */
    public static Node setBody(Node routine, Node body) {
        return require(routine).set(BODY, body);
    }

    /**
     * Appends a pragma entry, creating the pragma list when the slot is
     * absent.
     */
    public static Node addPragma(Node routine, Node entry) {
        Node current = pragma(routine);
        if (current.isAbsent()) {
            routine.set(PRAGMA, Nodes.pragma(entry));
        } else {
            current.add(entry);
        }
        return routine;
    }

    private static Node require(Node routine) {
        if (!routine.kind().isRoutineDefinition()) {
            throw new InvalidAccessException(routine.kind().displayName() + " node is not a routine definition");
        }
        return routine;
    }
}
