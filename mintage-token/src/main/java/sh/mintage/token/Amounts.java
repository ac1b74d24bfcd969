// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import sh.mintage.core.error.AbortCode;

/**
 * Unsigned-amount arithmetic with the host's trap semantics.
 * <p>
 * Amounts are non-negative {@code long}s. Overflow past {@link Long#MAX_VALUE} and
 * subtraction below zero abort with {@link AbortCode#ARITHMETIC_ERROR}.
 */
final class Amounts {

    private Amounts() {
    }

    static long add(final long a, final long b) {
        final long sum = a + b;
        if (sum < 0) {
            throw AbortCode.ARITHMETIC_ERROR.abort(a + " + " + b + " overflows");
        }
        return sum;
    }

    static long subtract(final long a, final long b) {
        if (b > a) {
            throw AbortCode.ARITHMETIC_ERROR.abort(a + " - " + b + " underflows");
        }
        return a - b;
    }

    static long requireNonNegative(final long amount, final String what) {
        if (amount < 0) {
            throw new IllegalArgumentException(what + " cannot be negative: " + amount);
        }
        return amount;
    }
}
