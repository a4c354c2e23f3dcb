package io.gambit.core.error;

import io.gambit.core.type.Type;
import java.util.List;

/// What went wrong during compilation.
///
/// The first eight kinds come from the type checker; {@link NoConverter}, {@link MissingChild}
/// and {@link ChildTypeMismatch} come from the code generator.
public sealed interface ErrorKind {

    /// Returns a one-line description without location information.
    String message();

    /// An operand's type does not fit the slot it occupies.
    record TypeMismatch(Type expected, Type actual, String context) implements ErrorKind {
        @Override
        public String message() {
            return "Type mismatch in " + context + ": expected " + expected + ", found " + actual;
        }
    }

    /// No token with this kind is known.
    record UndefinedToken(String kind) implements ErrorKind {
        @Override
        public String message() {
            return "Undefined token: " + kind;
        }
    }

    /// A required operand slot or literal is absent or has the wrong shape.
    record MissingField(String token, String field) implements ErrorKind {
        @Override
        public String message() {
            return "Missing required field '" + field + "' in " + token;
        }
    }

    /// A type could not be determined from the surrounding tree.
    record UnresolvedType(String context) implements ErrorKind {
        @Override
        public String message() {
            return "Cannot resolve type: " + context;
        }
    }

    /// Unification would bind a type variable to a type containing itself.
    record InfiniteType(String variable, String type) implements ErrorKind {
        @Override
        public String message() {
            return "Infinite type: " + variable + " occurs in " + type;
        }
    }

    /// A type lacks a trait its slot requires.
    record TraitBoundError(Type type, String trait, List<String> available)
            implements ErrorKind {
        public TraitBoundError {
            available = List.copyOf(available);
        }

        @Override
        public String message() {
            return "Type " + type + " does not implement trait " + trait;
        }
    }

    /// A token contains itself.
    record CyclicReference(String token) implements ErrorKind {
        @Override
        public String message() {
            return "Cyclic reference through " + token;
        }
    }

    /// A token carries operand slots its kind does not declare.
    record ArgumentCountMismatch(String token, int expected, int actual) implements ErrorKind {
        @Override
        public String message() {
            return token + " expects " + expected + " argument(s), found " + actual;
        }
    }

    /// No converter produces the requested type for this token kind.
    record NoConverter(String token, Type target) implements ErrorKind {
        @Override
        public String message() {
            return "No converter for " + token + " producing " + target;
        }
    }

    /// The typed tree lacks a child a converter needs.
    record MissingChild(String token, String argument) implements ErrorKind {
        @Override
        public String message() {
            return "Missing child '" + argument + "' while converting " + token;
        }
    }

    /// A child's checked type disagrees with the type its converter requested.
    record ChildTypeMismatch(String token, String argument, Type requested, Type actual)
            implements ErrorKind {
        @Override
        public String message() {
            return "Child '"
                    + argument
                    + "' of "
                    + token
                    + " has type "
                    + actual
                    + " but "
                    + requested
                    + " was requested";
        }
    }
}
