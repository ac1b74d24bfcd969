// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

import sh.mintage.core.types.Address;

/**
 * Royalty terms recorded with a token type.
 *
 * @param rate  royalty rate as supplied at creation
 * @param payee account entitled to the royalty (the creator)
 * @since 0.1.0
 */
public record Royalty(long rate, Address payee) {

    public Royalty {
        Amounts.requireNonNegative(rate, "royalty rate");
        Objects.requireNonNull(payee, "payee");
    }
}
