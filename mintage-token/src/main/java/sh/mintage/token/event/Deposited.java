// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.Objects;

import sh.mintage.token.AssetIdentity;

/**
 * Value was merged into the emitting inventory.
 *
 * @param identity the token type
 * @param amount   the amount
 */
public record Deposited(AssetIdentity identity, long amount) implements LedgerEvent {

    public Deposited {
        Objects.requireNonNull(identity, "identity");
    }
}
