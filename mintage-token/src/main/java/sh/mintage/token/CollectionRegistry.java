// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import sh.mintage.core.InternalApi;
import sh.mintage.core.types.Address;
import sh.mintage.token.event.Burned;
import sh.mintage.token.event.CollectionCreated;
import sh.mintage.token.event.Minted;
import sh.mintage.token.event.TokenTypeCreated;
import sh.mintage.token.store.EventHandle;
import sh.mintage.token.store.EventKey;
import sh.mintage.token.store.HashTable;
import sh.mintage.token.store.Resource;
import sh.mintage.token.store.ResourceStore;
import sh.mintage.token.store.Table;

/**
 * Per-creator resource: the collections and token types an account defined, and
 * the capabilities that authorize minting and burning them.
 *
 * <p>
 * Published lazily by the account's first collection and never removed. Only
 * {@link TokenLedger} mutates it; the public surface is read-only.
 *
 * @since 0.1.0
 */
public final class CollectionRegistry implements Resource<CollectionRegistry> {

    private final Address owner;
    private final Table<String, CollectionMeta> collections;
    private final Table<AssetIdentity, TokenTypeMeta> tokenTypes;
    private final Table<AssetIdentity, MintCapability> mintCapabilities;
    private final Table<AssetIdentity, BurnCapability> burnCapabilities;
    private final EventHandle<CollectionCreated> collectionEvents;
    private final EventHandle<TokenTypeCreated> tokenTypeEvents;
    private final EventHandle<Minted> mintEvents;
    private final EventHandle<Burned> burnEvents;

    private CollectionRegistry(
            final Address owner,
            final Table<String, CollectionMeta> collections,
            final Table<AssetIdentity, TokenTypeMeta> tokenTypes,
            final Table<AssetIdentity, MintCapability> mintCapabilities,
            final Table<AssetIdentity, BurnCapability> burnCapabilities,
            final EventHandle<CollectionCreated> collectionEvents,
            final EventHandle<TokenTypeCreated> tokenTypeEvents,
            final EventHandle<Minted> mintEvents,
            final EventHandle<Burned> burnEvents) {
        this.owner = owner;
        this.collections = collections;
        this.tokenTypes = tokenTypes;
        this.mintCapabilities = mintCapabilities;
        this.burnCapabilities = burnCapabilities;
        this.collectionEvents = collectionEvents;
        this.tokenTypeEvents = tokenTypeEvents;
        this.mintEvents = mintEvents;
        this.burnEvents = burnEvents;
    }

    static CollectionRegistry create(final ResourceStore store, final Address owner) {
        Objects.requireNonNull(owner, "owner");
        return new CollectionRegistry(
                owner,
                new HashTable<>(),
                new HashTable<>(),
                new HashTable<>(),
                new HashTable<>(),
                store.newEventHandle(owner),
                store.newEventHandle(owner),
                store.newEventHandle(owner),
                store.newEventHandle(owner));
    }

    public Address owner() {
        return owner;
    }

    public Optional<CollectionMeta> collection(final String name) {
        return collections.get(name);
    }

    public Optional<TokenTypeMeta> tokenType(final AssetIdentity identity) {
        return tokenTypes.get(identity);
    }

    public Set<AssetIdentity> tokenTypeIdentities() {
        return tokenTypes.keys();
    }

    public boolean hasMintCapability(final AssetIdentity identity) {
        return mintCapabilities.contains(identity);
    }

    public boolean hasBurnCapability(final AssetIdentity identity) {
        return burnCapabilities.contains(identity);
    }

    public EventKey collectionEventKey() {
        return collectionEvents.key();
    }

    public EventKey tokenTypeEventKey() {
        return tokenTypeEvents.key();
    }

    public EventKey mintEventKey() {
        return mintEvents.key();
    }

    public EventKey burnEventKey() {
        return burnEvents.key();
    }

    Table<String, CollectionMeta> collections() {
        return collections;
    }

    Table<AssetIdentity, TokenTypeMeta> tokenTypes() {
        return tokenTypes;
    }

    Table<AssetIdentity, MintCapability> mintCapabilities() {
        return mintCapabilities;
    }

    Table<AssetIdentity, BurnCapability> burnCapabilities() {
        return burnCapabilities;
    }

    EventHandle<CollectionCreated> collectionEvents() {
        return collectionEvents;
    }

    EventHandle<TokenTypeCreated> tokenTypeEvents() {
        return tokenTypeEvents;
    }

    EventHandle<Minted> mintEvents() {
        return mintEvents;
    }

    EventHandle<Burned> burnEvents() {
        return burnEvents;
    }

    @InternalApi
    @Override
    public CollectionRegistry copy() {
        return new CollectionRegistry(
                owner,
                collections.copy(UnaryOperator.identity()),
                tokenTypes.copy(UnaryOperator.identity()),
                mintCapabilities.copy(UnaryOperator.identity()),
                burnCapabilities.copy(UnaryOperator.identity()),
                collectionEvents.copy(),
                tokenTypeEvents.copy(),
                mintEvents.copy(),
                burnEvents.copy());
    }
}
