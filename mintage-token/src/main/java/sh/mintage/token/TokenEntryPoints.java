// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

import sh.mintage.core.types.Address;

/**
 * Transaction entry points: each method is one atomic host transaction.
 *
 * <p>
 * Token identities are addressed by their {@code (creator, collection, name)}
 * parts, the way an external caller names them. Failures surface as
 * {@link sh.mintage.core.error.LedgerAbortException} with state unchanged.
 *
 * @since 0.1.0
 */
public final class TokenEntryPoints {

    private final LedgerHost host;

    public TokenEntryPoints(final LedgerHost host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    public void createLimitedCollection(
            final Address creator,
            final String name,
            final String description,
            final String uri,
            final long maximum) {
        host.run("createLimitedCollection",
                ledger -> ledger.createCollection(creator, name, description, uri, maximum));
    }

    public void createUnlimitedCollection(
            final Address creator,
            final String name,
            final String description,
            final String uri) {
        host.run("createUnlimitedCollection",
                ledger -> ledger.createCollection(creator, name, description, uri, null));
    }

    public AssetIdentity createLimitedToken(
            final Address creator,
            final String collection,
            final String name,
            final String description,
            final boolean monitorSupply,
            final long initialAmount,
            final long maximum,
            final String uri,
            final long royaltyRate) {
        return host.execute("createLimitedToken", ledger -> ledger.createTokenType(
                creator, collection, name, description, monitorSupply, initialAmount, maximum, uri, royaltyRate));
    }

    public AssetIdentity createUnlimitedToken(
            final Address creator,
            final String collection,
            final String name,
            final String description,
            final boolean monitorSupply,
            final long initialAmount,
            final String uri,
            final long royaltyRate) {
        return host.execute("createUnlimitedToken", ledger -> ledger.createTokenType(
                creator, collection, name, description, monitorSupply, initialAmount, null, uri, royaltyRate));
    }

    public void directTransfer(
            final Address sender,
            final Address receiver,
            final Address creator,
            final String collection,
            final String name,
            final long amount) {
        final AssetIdentity identity = AssetIdentity.of(creator, collection, name);
        host.run("directTransfer", ledger -> ledger.directTransfer(sender, receiver, identity, amount));
    }

    public void initializeInventory(final Address account) {
        host.run("initializeInventory", ledger -> ledger.ensureInitialized(account));
    }

    public void initializeSlotFor(
            final Address account,
            final Address creator,
            final String collection,
            final String name) {
        final AssetIdentity identity = AssetIdentity.of(creator, collection, name);
        host.run("initializeSlotFor", ledger -> ledger.initializeSlot(account, identity));
    }

    public void mintTo(
            final Address authorizer,
            final Address destination,
            final Address creator,
            final String collection,
            final String name,
            final long amount) {
        final AssetIdentity identity = AssetIdentity.of(creator, collection, name);
        host.run("mintTo", ledger -> ledger.mint(authorizer, destination, identity, amount));
    }

    /**
     * Withdraws {@code amount} from {@code owner}'s inventory and burns it.
     */
    public void burnFrom(
            final Address owner,
            final Address creator,
            final String collection,
            final String name,
            final long amount) {
        final AssetIdentity identity = AssetIdentity.of(creator, collection, name);
        host.run("burnFrom", ledger -> ledger.burn(owner, ledger.withdraw(owner, identity, amount)));
    }
}
