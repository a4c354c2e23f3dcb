package io.gambit.core.token;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/// Renders token trees for diagnostics.
///
/// Leaves print as their kind, literal-only tokens inline (`Number { value: 50 }`) and tokens
/// with operands as an indented block:
///
/// ```
/// Strike {
///   target: ActingCharacter
/// }
/// ```
///
/// A token reached again on its own path prints as `<cycle: Kind>`.
public final class TokenPrinter {

    private static final String INDENT = "  ";

    private TokenPrinter() {}

    /// Renders a token as an indented multi-line block.
    ///
    /// @param token root token, not null
    /// @return rendered text without a trailing newline, never null
    public static String pretty(Token token) {
        StringBuilder out = new StringBuilder();
        appendPretty(token, 0, out, Collections.newSetFromMap(new IdentityHashMap<>()));
        return out.toString();
    }

    /// Renders a token on a single line.
    ///
    /// @param token root token, not null
    /// @return rendered text, never null
    public static String inline(Token token) {
        StringBuilder out = new StringBuilder();
        appendInline(token, out, Collections.newSetFromMap(new IdentityHashMap<>()));
        return out.toString();
    }

    private static void appendPretty(Token token, int depth, StringBuilder out, Set<Token> path) {
        if (!path.add(token)) {
            out.append("<cycle: ").append(token.getKind()).append('>');
            return;
        }
        if (token.getArguments().isEmpty()) {
            appendInline(token, out, path);
            path.remove(token);
            return;
        }
        String padding = INDENT.repeat(depth + 1);
        out.append(token.getKind()).append(" {\n");
        for (Map.Entry<String, Object> attribute : token.getAttributes().entrySet()) {
            out.append(padding)
                    .append(attribute.getKey())
                    .append(": ")
                    .append(attribute.getValue())
                    .append('\n');
        }
        for (Map.Entry<String, Token> argument : token.getArguments().entrySet()) {
            out.append(padding).append(argument.getKey()).append(": ");
            if (argument.getValue() == null) {
                out.append("<missing>");
            } else {
                appendPretty(argument.getValue(), depth + 1, out, path);
            }
            out.append('\n');
        }
        out.append(INDENT.repeat(depth)).append('}');
        path.remove(token);
    }

    private static void appendInline(Token token, StringBuilder out, Set<Token> path) {
        if (token.isLeaf()) {
            out.append(token.getKind());
            return;
        }
        boolean added = path.add(token);
        if (!added && !token.getArguments().isEmpty()) {
            out.append("<cycle: ").append(token.getKind()).append('>');
            return;
        }
        StringJoiner fields = new StringJoiner(", ", " { ", " }");
        token.getAttributes().forEach((name, value) -> fields.add(name + ": " + value));
        for (Map.Entry<String, Token> argument : token.getArguments().entrySet()) {
            StringBuilder child = new StringBuilder();
            if (argument.getValue() == null) {
                child.append("<missing>");
            } else {
                appendInline(argument.getValue(), child, path);
            }
            fields.add(argument.getKey() + ": " + child);
        }
        out.append(token.getKind()).append(fields);
        if (added) {
            path.remove(token);
        }
    }
}
