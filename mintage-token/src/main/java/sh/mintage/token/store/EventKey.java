// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.Objects;

import sh.mintage.core.types.Address;

/**
 * Globally unique identifier of an event handle.
 * <p>
 * Each account numbers the handles created under it sequentially, so the
 * {@code (account, creationNumber)} pair never repeats.
 *
 * @param account        the account whose resource owns the handle
 * @param creationNumber position of the handle among the account's handles
 * @since 0.1.0
 */
public record EventKey(Address account, long creationNumber) {

    public EventKey {
        Objects.requireNonNull(account, "account");
        if (creationNumber < 0) {
            throw new IllegalArgumentException("creationNumber must be non-negative, got " + creationNumber);
        }
    }

    @Override
    public String toString() {
        return account.toShortString() + "#" + creationNumber;
    }
}
