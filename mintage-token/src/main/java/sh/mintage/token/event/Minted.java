// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.Objects;

import sh.mintage.token.AssetIdentity;

/**
 * New value of {@code identity} was created.
 *
 * @param identity the token type
 * @param amount   the amount
 */
public record Minted(AssetIdentity identity, long amount) implements LedgerEvent {

    public Minted {
        Objects.requireNonNull(identity, "identity");
    }
}
