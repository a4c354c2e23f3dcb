package io.gambit.core.metadata;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Registry of token signatures, the fact base of the type checker.
///
/// The element reference (`Element`) has no signature here: its type comes from the enclosing
/// list combinator, not from a signature.
public interface TokenMetadataRegistry {

    /// Registers a signature, replacing any previous one for the same kind.
    ///
    /// @param metadata signature to register, not null
    void register(TokenMetadata metadata);

    /// Looks up the signature of a token kind.
    ///
    /// @param kind token kind, not null
    /// @return the signature, or empty if the kind is unknown
    Optional<TokenMetadata> get(String kind);

    boolean has(String kind);

    /// Returns every registered signature in registration order.
    Collection<TokenMetadata> all();

    /// Returns registered kinds grouped by category, in category declaration order.
    Map<TokenCategory, List<String>> kindsByCategory();
}
