// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.mintage.core.types.Address;

/**
 * A creator defined a collection.
 *
 * @param creator     the registry owner
 * @param name        collection name
 * @param uri         metadata URI
 * @param description description
 * @param maximum     token-type cap, {@code null} for unlimited
 */
public record CollectionCreated(
        Address creator,
        String name,
        String uri,
        String description,
        @Nullable Long maximum) implements LedgerEvent {

    public CollectionCreated {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(description, "description");
    }
}
