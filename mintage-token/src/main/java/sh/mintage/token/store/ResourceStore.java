// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.Optional;
import java.util.function.Supplier;

import sh.mintage.core.types.Address;

/**
 * Host-provided global storage of account-addressed resources.
 * <p>
 * Atomicity and isolation of transactions are the host's concern; the ledger
 * only reads and creates resources through this interface and never caches them
 * across operations.
 *
 * @since 0.1.0
 */
public interface ResourceStore {

    <R extends Resource<R>> Optional<R> find(Address account, Class<R> type);

    /**
     * Returns the account's resource of {@code type}, publishing the one built by
     * {@code factory} when none exists.
     */
    <R extends Resource<R>> R getOrCreate(Address account, Class<R> type, Supplier<R> factory);

    /**
     * Creates an event handle under {@code account} with the next creation number.
     */
    <E> EventHandle<E> newEventHandle(Address account);
}
