package com.syntree.ast;

import com.syntree.InvalidAccessException;

/**
 * Name handling shared by macro code and the resolution pass.
 *
 * <p>Identifiers are compared style-insensitively: the first character must
 * match exactly, the rest ignores letter case and underscores, so
 * {@code fooBar}, {@code foo_bar} and {@code foobar} name the same thing
 * while {@code FooBar} does not.</p>
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    public static boolean eqIdent(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        if (a.charAt(0) != b.charAt(0)) {
            return false;
        }
        int i = 1;
        int j = 1;
        while (true) {
            while (i < a.length() && a.charAt(i) == '_') {
                i++;
            }
            while (j < b.length() && b.charAt(j) == '_') {
                j++;
            }
            if (i == a.length() || j == b.length()) {
                return i == a.length() && j == b.length();
            }
            if (Character.toLowerCase(a.charAt(i)) != Character.toLowerCase(b.charAt(j))) {
                return false;
            }
            i++;
            j++;
        }
    }

    public static boolean eqIdent(Node node, String name) {
        return eqIdent(basename(node), name);
    }

    public static boolean eqIdent(Node a, Node b) {
        return eqIdent(basename(a), basename(b));
    }

    /**
     * The plain name behind a name node, looking through export markers
     * ({@code name*}), pragma annotations, backtick quoting and symbol choices.
     *
     * @throws InvalidAccessException if the node cannot name anything
     */
    public static String basename(Node node) {
        switch (node.kind()) {
            case IDENT:
            case SYM:
                return node.textValue();
            case POSTFIX:
                return basename(node.get(1));
            case PRAGMA_EXPR:
            case OPEN_SYM_CHOICE:
            case CLOSED_SYM_CHOICE:
            case OPEN_SYM:
                return basename(node.get(0));
            case ACC_QUOTED:
                StringBuilder sb = new StringBuilder();
                for (Node part : node) {
                    sb.append(basename(part));
                }
                return sb.toString();
            default:
                throw new InvalidAccessException(node.kind().displayName() + " node does not carry a name");
        }
    }

    /**
     * True for a name marked for export, i.e. {@code Postfix(Ident "*", name)},
     * possibly wrapped in a pragma expression.
     */
    public static boolean isExported(Node node) {
        if (node.kind() == NodeKind.PRAGMA_EXPR) {
            return isExported(node.get(0));
        }
        return node.kind() == NodeKind.POSTFIX
            && node.size() == 2
            && node.get(0).kind() == NodeKind.IDENT
            && node.get(0).textValue().equals("*");
    }
}
