// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.mintage.core.DebugLogger;
import sh.mintage.core.LogFormatter;
import sh.mintage.core.error.AbortCode;
import sh.mintage.core.types.Address;
import sh.mintage.token.event.Burned;
import sh.mintage.token.event.CollectionCreated;
import sh.mintage.token.event.Deposited;
import sh.mintage.token.event.Minted;
import sh.mintage.token.event.TokenTypeCreated;
import sh.mintage.token.event.Withdrawn;
import sh.mintage.token.store.ResourceStore;

/**
 * Token and collection ledger over a host {@link ResourceStore}.
 *
 * <p>
 * Each account may own one {@link CollectionRegistry} (if it creates token types)
 * and one {@link HolderInventory} (if it holds value). This class implements
 * every operation on them:
 * <ul>
 * <li><b>Registry:</b> {@link #createCollection}, {@link #createTokenType},
 * {@link #mint}, {@link #burn}</li>
 * <li><b>Inventory:</b> {@link #ensureInitialized}, {@link #initializeSlot},
 * {@link #deposit}, {@link #depositWithoutEvent}, {@link #withdraw},
 * {@link #transfer}, {@link #directTransfer}</li>
 * <li><b>Queries:</b> {@link #balanceOf}, {@link #balancesOf},
 * {@link #supplyOf}, {@link #tokenType}, {@link #collection}</li>
 * </ul>
 *
 * <p>
 * <strong>Atomicity:</strong> operations mutate the store as they go and throw
 * {@link sh.mintage.core.error.LedgerAbortException} on failure without undoing
 * earlier writes. Run them through {@link LedgerHost#execute} (or a host with the
 * same rollback guarantee) so an abort discards the whole transaction.
 *
 * <p>
 * <strong>Conservation:</strong> apart from {@link #mint} and {@link #burn}, no
 * operation changes the total amount of an identity across all inventories plus
 * units in flight. Tracked supply always equals that total at commit.
 *
 * <p>
 * Not thread-safe.
 *
 * @since 0.1.0
 */
public final class TokenLedger {

    private static final Logger LOG = LoggerFactory.getLogger(TokenLedger.class);

    private final ResourceStore store;
    private final LedgerConfig config;
    private final UnitTracker tracker = new UnitTracker();

    public TokenLedger(final ResourceStore store) {
        this(store, LedgerConfig.defaults());
    }

    public TokenLedger(final ResourceStore store, final LedgerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
    }

    public LedgerConfig config() {
        return config;
    }

    // ==================== Registry ====================

    /**
     * Defines a collection under {@code creator}, publishing the creator's
     * registry if needed.
     *
     * @param maximum cap on the number of token types, {@code null} for unlimited
     * @throws sh.mintage.core.error.LedgerAbortException {@code COLLECTION_ALREADY_EXISTS},
     *         {@code NAME_TOO_LONG}, {@code URI_TOO_LONG}
     */
    public void createCollection(
            final Address creator,
            final String name,
            final String description,
            final String uri,
            final @Nullable Long maximum) {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(description, "description");
        checkName(name);
        checkUri(uri);
        if (maximum != null) {
            Amounts.requireNonNegative(maximum, "maximum");
        }

        final CollectionRegistry registry = store.getOrCreate(
                creator, CollectionRegistry.class, () -> CollectionRegistry.create(store, creator));
        registry.collections().add(
                name, new CollectionMeta(name, description, uri, 0, maximum), AbortCode.COLLECTION_ALREADY_EXISTS);
        registry.collectionEvents().emit(new CollectionCreated(creator, name, uri, description, maximum));

        DebugLogger.logLedger(LogFormatter.formatCollection(creator, name, maximum));
    }

    /**
     * Defines a token type in one of {@code creator}'s collections and installs
     * its mint and burn capabilities in the creator's registry.
     *
     * <p>
     * A positive {@code initialAmount} is minted to the creator's own inventory
     * with the usual supply accounting and events.
     *
     * @param monitorSupply whether to track supply (and so enforce {@code maximum})
     * @param maximum       supply cap, {@code null} for unlimited
     * @return the new identity
     * @throws sh.mintage.core.error.LedgerAbortException {@code REGISTRY_NOT_PUBLISHED},
     *         {@code COLLECTION_NOT_PUBLISHED}, {@code TOKEN_ALREADY_EXISTS},
     *         {@code COLLECTION_LIMIT_EXCEEDED}, {@code MINT_LIMIT_EXCEEDED}
     *         (initial amount above the cap), {@code NAME_TOO_LONG}, {@code URI_TOO_LONG}
     */
    public AssetIdentity createTokenType(
            final Address creator,
            final String collectionName,
            final String name,
            final String description,
            final boolean monitorSupply,
            final long initialAmount,
            final @Nullable Long maximum,
            final String uri,
            final long royaltyRate) {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(collectionName, "collectionName");
        Objects.requireNonNull(description, "description");
        checkName(name);
        checkUri(uri);
        Amounts.requireNonNegative(initialAmount, "initialAmount");
        if (maximum != null) {
            Amounts.requireNonNegative(maximum, "maximum");
        }

        final CollectionRegistry registry = store.find(creator, CollectionRegistry.class)
                .orElseThrow(() -> AbortCode.REGISTRY_NOT_PUBLISHED.abort(creator.toShortString()));
        final CollectionMeta collection =
                registry.collections().borrow(collectionName, AbortCode.COLLECTION_NOT_PUBLISHED);
        final AssetIdentity identity = AssetIdentity.of(creator, collectionName, name);
        if (registry.tokenTypes().contains(identity)) {
            throw AbortCode.TOKEN_ALREADY_EXISTS.abort(identity.toString());
        }

        final long count = Amounts.add(collection.count(), 1);
        if (collection.maximum() != null && count > collection.maximum()) {
            throw AbortCode.COLLECTION_LIMIT_EXCEEDED.abort(
                    creator.toShortString() + "::" + collectionName + " holds " + collection.maximum() + " token types");
        }
        registry.collections().put(collectionName, collection.withCount(count));

        final TokenTypeMeta metadata = new TokenTypeMeta(
                collectionName,
                description,
                uri,
                maximum,
                monitorSupply ? Long.valueOf(0L) : null,
                new Royalty(royaltyRate, creator));
        registry.tokenTypes().put(identity, metadata);
        registry.mintCapabilities().put(identity, new MintCapability(identity));
        registry.burnCapabilities().put(identity, new BurnCapability(identity));
        registry.tokenTypeEvents().emit(new TokenTypeCreated(identity, metadata, initialAmount));

        DebugLogger.logLedger(LogFormatter.formatTokenType(identity.toString(), maximum, monitorSupply, initialAmount));

        if (initialAmount > 0) {
            issue(creator, creator, identity, initialAmount);
        }
        return identity;
    }

    /**
     * Mints {@code amount} of {@code identity} into {@code destination}'s inventory.
     *
     * <p>
     * Authority is looked up in the <em>authorizer's own</em> registry, while the
     * supply counter lives in the registry of the identity's creator.
     *
     * @throws sh.mintage.core.error.LedgerAbortException {@code NO_MINT_CAPABILITY}
     *         (also when the authorizer has no registry), {@code TOKEN_NOT_PUBLISHED},
     *         {@code MINT_LIMIT_EXCEEDED}
     */
    public void mint(
            final Address authorizer,
            final Address destination,
            final AssetIdentity identity,
            final long amount) {
        Objects.requireNonNull(authorizer, "authorizer");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(identity, "identity");
        Amounts.requireNonNegative(amount, "amount");

        final boolean authorized = store.find(authorizer, CollectionRegistry.class)
                .map(registry -> registry.hasMintCapability(identity))
                .orElse(false);
        if (!authorized) {
            throw AbortCode.NO_MINT_CAPABILITY.abort(authorizer.toShortString() + " for " + identity);
        }
        if (!authorizer.equals(identity.creator())) {
            LOG.debug("Mint of {} authorized by non-creator {}", identity, authorizer);
        }
        issue(authorizer, destination, identity, amount);
    }

    /**
     * Destroys {@code unit}, decreasing tracked supply by its amount.
     *
     * @throws sh.mintage.core.error.LedgerAbortException {@code NO_BURN_CAPABILITY}
     *         (also when the owner has no registry), {@code TOKEN_NOT_PUBLISHED}
     * @throws sh.mintage.core.error.ConsumedValueException if {@code unit} was already consumed
     */
    public void burn(final Address owner, final ValueUnit unit) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(unit, "unit");
        final AssetIdentity identity = unit.identity();

        final boolean authorized = store.find(owner, CollectionRegistry.class)
                .map(registry -> registry.hasBurnCapability(identity))
                .orElse(false);
        if (!authorized) {
            throw AbortCode.NO_BURN_CAPABILITY.abort(owner.toShortString() + " for " + identity);
        }
        final CollectionRegistry creatorRegistry = creatorRegistryOf(identity);
        final TokenTypeMeta metadata = creatorRegistry.tokenTypes().borrow(identity, AbortCode.TOKEN_NOT_PUBLISHED);

        final long amount = unit.amount();
        Long supply = metadata.supply();
        if (supply != null) {
            supply = Amounts.subtract(supply, amount);
            creatorRegistry.tokenTypes().put(identity, metadata.withSupply(supply));
        }
        unit.consume();
        if (config.emitBurnEvents()) {
            creatorRegistry.burnEvents().emit(new Burned(identity, amount));
        }

        DebugLogger.logLedger(LogFormatter.formatBurn(owner, identity.toString(), amount, supply));
    }

    private void issue(
            final Address authorizer,
            final Address destination,
            final AssetIdentity identity,
            final long amount) {
        final CollectionRegistry creatorRegistry = creatorRegistryOf(identity);
        final TokenTypeMeta metadata = creatorRegistry.tokenTypes().borrow(identity, AbortCode.TOKEN_NOT_PUBLISHED);

        Long supply = metadata.supply();
        if (supply != null) {
            supply = Amounts.add(supply, amount);
            if (metadata.maximum() != null && supply > metadata.maximum()) {
                throw AbortCode.MINT_LIMIT_EXCEEDED.abort(
                        identity + ": supply " + metadata.supply() + " + " + amount + " exceeds " + metadata.maximum());
            }
            creatorRegistry.tokenTypes().put(identity, metadata.withSupply(supply));
        }

        deposit(destination, ValueUnit.issue(identity, amount, tracker));
        if (config.emitMintEvents()) {
            creatorRegistry.mintEvents().emit(new Minted(identity, amount));
        }

        DebugLogger.logLedger(LogFormatter.formatMint(authorizer, destination, identity.toString(), amount, supply));
    }

    private CollectionRegistry creatorRegistryOf(final AssetIdentity identity) {
        return store.find(identity.creator(), CollectionRegistry.class)
                .orElseThrow(() -> AbortCode.TOKEN_NOT_PUBLISHED.abort(identity.toString()));
    }

    // ==================== Inventory ====================

    /**
     * Publishes an empty inventory for {@code account} unless one exists.
     *
     * @return the account's inventory
     */
    public HolderInventory ensureInitialized(final Address account) {
        Objects.requireNonNull(account, "account");
        return store.getOrCreate(account, HolderInventory.class, () -> HolderInventory.create(store, account));
    }

    /**
     * Creates a zero slot for {@code identity}, publishing the inventory if needed.
     *
     * @throws sh.mintage.core.error.LedgerAbortException {@code ALREADY_HAS_BALANCE}
     */
    public void initializeSlot(final Address account, final AssetIdentity identity) {
        Objects.requireNonNull(identity, "identity");
        final HolderInventory inventory = ensureInitialized(account);
        inventory.slots().add(identity, ValueUnit.emptySlot(identity, tracker), AbortCode.ALREADY_HAS_BALANCE);
    }

    /**
     * Merges {@code unit} into {@code account}'s slot for its identity and emits
     * {@link Deposited}. Inventory and slot are created as needed.
     */
    public void deposit(final Address account, final ValueUnit unit) {
        final AssetIdentity identity = Objects.requireNonNull(unit, "unit").identity();
        final long amount = unit.amount();
        final HolderInventory inventory = mergeIntoSlot(account, unit);
        inventory.depositEvents().emit(new Deposited(identity, amount));

        DebugLogger.logLedger(LogFormatter.formatDeposit(account, identity.toString(), amount));
    }

    /**
     * Same as {@link #deposit} without the event, for flows that log the
     * movement themselves.
     */
    public void depositWithoutEvent(final Address account, final ValueUnit unit) {
        mergeIntoSlot(account, Objects.requireNonNull(unit, "unit"));
    }

    private HolderInventory mergeIntoSlot(final Address account, final ValueUnit unit) {
        final AssetIdentity identity = unit.identity();
        final HolderInventory inventory = ensureInitialized(account);
        final ValueUnit slot = inventory.slots().get(identity).orElseGet(() -> {
            final ValueUnit empty = ValueUnit.emptySlot(identity, tracker);
            inventory.slots().put(identity, empty);
            return empty;
        });
        ValueUnit.merge(slot, unit);
        return inventory;
    }

    /**
     * Takes {@code amount} out of {@code account}'s slot and emits {@link Withdrawn}.
     *
     * <p>
     * There is no balance pre-check: withdrawing more than the slot holds hits the
     * unsigned-subtraction trap ({@code ARITHMETIC_ERROR}).
     *
     * @return a unit of {@code amount} that the caller must deposit or burn
     * @throws sh.mintage.core.error.LedgerAbortException {@code STORE_NOT_PUBLISHED},
     *         {@code BALANCE_NOT_PUBLISHED}, {@code ARITHMETIC_ERROR}
     */
    public ValueUnit withdraw(final Address account, final AssetIdentity identity, final long amount) {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(identity, "identity");
        final HolderInventory inventory = store.find(account, HolderInventory.class)
                .orElseThrow(() -> AbortCode.STORE_NOT_PUBLISHED.abort(account.toShortString()));
        final ValueUnit slot = inventory.slots().borrow(identity, AbortCode.BALANCE_NOT_PUBLISHED);
        final ValueUnit withdrawn = slot.withdraw(amount);
        inventory.withdrawEvents().emit(new Withdrawn(identity, amount));

        DebugLogger.logLedger(LogFormatter.formatWithdraw(account, identity.toString(), amount));
        return withdrawn;
    }

    /**
     * Moves {@code amount} from one inventory to another.
     */
    public void transfer(final Address from, final Address to, final AssetIdentity identity, final long amount) {
        Objects.requireNonNull(to, "to");
        final ValueUnit unit = withdraw(from, identity, amount);
        deposit(to, unit);
    }

    /**
     * Transfer in a transaction signed by both sender and receiver, so the
     * receiver's inventory may be published on its behalf.
     */
    public void directTransfer(
            final Address sender,
            final Address receiver,
            final AssetIdentity identity,
            final long amount) {
        transfer(sender, receiver, identity, amount);
    }

    // ==================== Queries ====================

    /**
     * Balance of {@code identity} held by {@code account}; 0 when the account has
     * no inventory or no slot.
     */
    public long balanceOf(final Address account, final AssetIdentity identity) {
        Objects.requireNonNull(identity, "identity");
        return inventory(account).map(inventory -> inventory.balanceOf(identity)).orElse(0L);
    }

    /**
     * Every slot of {@code account}, empty when it has no inventory.
     */
    public Map<AssetIdentity, Long> balancesOf(final Address account) {
        return inventory(account).map(HolderInventory::balances).orElse(Map.of());
    }

    /**
     * Tracked supply of {@code identity}; empty when untracked or unknown.
     */
    public OptionalLong supplyOf(final AssetIdentity identity) {
        final Long supply = tokenType(identity).map(TokenTypeMeta::supply).orElse(null);
        return supply == null ? OptionalLong.empty() : OptionalLong.of(supply);
    }

    public Optional<TokenTypeMeta> tokenType(final AssetIdentity identity) {
        Objects.requireNonNull(identity, "identity");
        return registry(identity.creator()).flatMap(registry -> registry.tokenType(identity));
    }

    public Optional<CollectionMeta> collection(final Address creator, final String name) {
        return registry(creator).flatMap(registry -> registry.collection(name));
    }

    public Optional<CollectionRegistry> registry(final Address creator) {
        return store.find(Objects.requireNonNull(creator, "creator"), CollectionRegistry.class);
    }

    public Optional<HolderInventory> inventory(final Address account) {
        return store.find(Objects.requireNonNull(account, "account"), HolderInventory.class);
    }

    // ==================== Host support ====================

    long outstandingUnits() {
        return tracker.outstanding();
    }

    void discardOutstandingUnits() {
        tracker.reset();
    }

    private void checkName(final String name) {
        Objects.requireNonNull(name, "name");
        if (name.length() > config.maxNameLength()) {
            throw AbortCode.NAME_TOO_LONG.abort(name.length() + " > " + config.maxNameLength());
        }
    }

    private void checkUri(final String uri) {
        Objects.requireNonNull(uri, "uri");
        if (uri.length() > config.maxUriLength()) {
            throw AbortCode.URI_TOO_LONG.abort(uri.length() + " > " + config.maxUriLength());
        }
    }
}
