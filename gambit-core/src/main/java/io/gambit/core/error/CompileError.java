package io.gambit.core.error;

import io.gambit.core.token.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// A compile-time failure reported to a rule author.
///
/// Carries the {@link ErrorKind}, the location as a path of enclosing operand slots (outermost
/// first) and, when known, the offending token.
///
/// @implNote Immutable. {@link #withContext} and {@link #withToken} return copies.
public final class CompileError {

    private final ErrorKind kind;
    private final List<PathSegment> path;
    private final Token token;

    private CompileError(ErrorKind kind, List<PathSegment> path, Token token) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = List.copyOf(path);
        this.token = token;
    }

    /// Creates an error at the root of the tree.
    ///
    /// @param kind what went wrong, not null
    /// @return new error, never null
    public static CompileError of(ErrorKind kind) {
        return new CompileError(kind, List.of(), null);
    }

    /// Creates an error attached to the token that caused it.
    ///
    /// @param kind what went wrong, not null
    /// @param token offending token, may be null
    /// @return new error, never null
    public static CompileError of(ErrorKind kind, Token token) {
        return new CompileError(kind, List.of(), token);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /// Returns the location, outermost slot first.
    ///
    /// @return unmodifiable path, empty for errors at the root, never null
    public List<PathSegment> getPath() {
        return path;
    }

    public Optional<Token> getToken() {
        return Optional.ofNullable(token);
    }

    public String getMessage() {
        return kind.message();
    }

    /// Returns the location rendered as `Check.condition → GreaterThan.left`.
    ///
    /// @return rendered path, empty string at the root, never null
    public String getLocation() {
        return path.stream().map(PathSegment::toString).collect(Collectors.joining(" → "));
    }

    /// Returns a copy with an enclosing slot prepended to the path.
    ///
    /// @param segment enclosing slot, not null
    /// @return new error, never null
    public CompileError withContext(PathSegment segment) {
        List<PathSegment> extended = new ArrayList<>(path.size() + 1);
        extended.add(Objects.requireNonNull(segment, "segment"));
        extended.addAll(path);
        return new CompileError(kind, extended, token);
    }

    /// Returns a copy carrying the token, unless one is already attached.
    ///
    /// @param offending token to attach, may be null
    /// @return this error or a copy, never null
    public CompileError withToken(Token offending) {
        if (token != null || offending == null) {
            return this;
        }
        return new CompileError(kind, path, offending);
    }

    @Override
    public String toString() {
        String location = getLocation();
        return location.isEmpty() ? getMessage() : getMessage() + " at " + location;
    }
}
