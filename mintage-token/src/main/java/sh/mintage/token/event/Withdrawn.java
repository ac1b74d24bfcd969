// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.Objects;

import sh.mintage.token.AssetIdentity;

/**
 * Value was taken out of the emitting inventory.
 *
 * @param identity the token type
 * @param amount   the amount
 */
public record Withdrawn(AssetIdentity identity, long amount) implements LedgerEvent {

    public Withdrawn {
        Objects.requireNonNull(identity, "identity");
    }
}
