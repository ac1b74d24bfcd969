// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

import sh.mintage.core.types.Address;

/**
 * Global name of a token type.
 *
 * <p>The {@code (creator, collection, name)} triple identifies at most one token
 * type; equality is structural, so identities built independently from the same
 * parts are interchangeable as table keys.
 *
 * @param creator    account that created the token type
 * @param collection name of the collection inside the creator's registry
 * @param name       token name inside the collection
 * @since 0.1.0
 */
public record AssetIdentity(Address creator, String collection, String name) {

    public AssetIdentity {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(name, "name");
    }

    public static AssetIdentity of(Address creator, String collection, String name) {
        return new AssetIdentity(creator, collection, name);
    }

    /** Renders as {@code 0xc::Sets::A}. */
    @Override
    public String toString() {
        return creator.toShortString() + "::" + collection + "::" + name;
    }
}
