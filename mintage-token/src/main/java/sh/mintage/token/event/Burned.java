// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.Objects;

import sh.mintage.token.AssetIdentity;

/**
 * Value of {@code identity} was destroyed.
 *
 * @param identity the token type
 * @param amount   the amount
 */
public record Burned(AssetIdentity identity, long amount) implements LedgerEvent {

    public Burned {
        Objects.requireNonNull(identity, "identity");
    }
}
