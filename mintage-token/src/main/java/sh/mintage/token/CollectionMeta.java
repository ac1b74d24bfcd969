// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * One named collection in a creator's registry.
 *
 * @param name        collection name, unique per creator
 * @param description free-form description
 * @param uri         metadata URI
 * @param count       number of token types defined so far; never decreases
 * @param maximum     cap on {@code count}, {@code null} for unlimited
 * @since 0.1.0
 */
public record CollectionMeta(
        String name,
        String description,
        String uri,
        long count,
        @Nullable Long maximum) {

    public CollectionMeta {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(uri, "uri");
        Amounts.requireNonNegative(count, "count");
        if (maximum != null) {
            Amounts.requireNonNegative(maximum, "maximum");
        }
    }

    public boolean isLimited() {
        return maximum != null;
    }

    CollectionMeta withCount(final long newCount) {
        return new CollectionMeta(name, description, uri, newCount, maximum);
    }
}
