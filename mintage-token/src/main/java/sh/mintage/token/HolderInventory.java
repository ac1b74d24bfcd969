// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import sh.mintage.core.InternalApi;
import sh.mintage.core.types.Address;
import sh.mintage.token.event.Deposited;
import sh.mintage.token.event.Withdrawn;
import sh.mintage.token.store.EventHandle;
import sh.mintage.token.store.EventKey;
import sh.mintage.token.store.HashTable;
import sh.mintage.token.store.Resource;
import sh.mintage.token.store.ResourceStore;
import sh.mintage.token.store.Table;

/**
 * Per-account resource holding one value slot per identity the account has
 * touched, plus its deposit and withdraw event logs.
 *
 * <p>
 * Slots are created on first deposit or by explicit initialization and are never
 * removed, even at zero balance.
 *
 * @since 0.1.0
 */
public final class HolderInventory implements Resource<HolderInventory> {

    private final Address owner;
    private final Table<AssetIdentity, ValueUnit> slots;
    private final EventHandle<Deposited> depositEvents;
    private final EventHandle<Withdrawn> withdrawEvents;

    private HolderInventory(
            final Address owner,
            final Table<AssetIdentity, ValueUnit> slots,
            final EventHandle<Deposited> depositEvents,
            final EventHandle<Withdrawn> withdrawEvents) {
        this.owner = owner;
        this.slots = slots;
        this.depositEvents = depositEvents;
        this.withdrawEvents = withdrawEvents;
    }

    static HolderInventory create(final ResourceStore store, final Address owner) {
        Objects.requireNonNull(owner, "owner");
        return new HolderInventory(
                owner,
                new HashTable<>(),
                store.newEventHandle(owner),
                store.newEventHandle(owner));
    }

    public Address owner() {
        return owner;
    }

    public boolean hasSlot(final AssetIdentity identity) {
        return slots.contains(identity);
    }

    /**
     * Balance of {@code identity}; 0 when there is no slot.
     */
    public long balanceOf(final AssetIdentity identity) {
        return slots.get(identity).map(ValueUnit::amount).orElse(0L);
    }

    /**
     * Every slot with its amount, in slot creation order.
     */
    public Map<AssetIdentity, Long> balances() {
        final Map<AssetIdentity, Long> balances = new LinkedHashMap<>();
        slots.forEach((identity, unit) -> balances.put(identity, unit.amount()));
        return Collections.unmodifiableMap(balances);
    }

    public EventKey depositEventKey() {
        return depositEvents.key();
    }

    public EventKey withdrawEventKey() {
        return withdrawEvents.key();
    }

    Table<AssetIdentity, ValueUnit> slots() {
        return slots;
    }

    EventHandle<Deposited> depositEvents() {
        return depositEvents;
    }

    EventHandle<Withdrawn> withdrawEvents() {
        return withdrawEvents;
    }

    @InternalApi
    @Override
    public HolderInventory copy() {
        return new HolderInventory(
                owner,
                slots.copy(ValueUnit::slotCopy),
                depositEvents.copy(),
                withdrawEvents.copy());
    }
}
