// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Metadata of one token type, stored under its creator.
 *
 * <p>
 * {@code supply} is the running total of outstanding value for the identity. It is
 * {@code null} when the creator did not ask for supply monitoring, in which case
 * {@code maximum} is recorded but not enforced.
 *
 * @param collection  the collection the token type belongs to
 * @param description free-form description
 * @param uri         metadata URI
 * @param maximum     supply cap, {@code null} for unlimited
 * @param supply      tracked supply, {@code null} when untracked
 * @param royalty     royalty terms
 * @since 0.1.0
 */
public record TokenTypeMeta(
        String collection,
        String description,
        String uri,
        @Nullable Long maximum,
        @Nullable Long supply,
        Royalty royalty) {

    public TokenTypeMeta {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(royalty, "royalty");
        if (maximum != null) {
            Amounts.requireNonNegative(maximum, "maximum");
        }
        if (supply != null) {
            Amounts.requireNonNegative(supply, "supply");
        }
    }

    public boolean supplyTracked() {
        return supply != null;
    }

    TokenTypeMeta withSupply(final long newSupply) {
        return new TokenTypeMeta(collection, description, uri, maximum, newSupply, royalty);
    }
}
