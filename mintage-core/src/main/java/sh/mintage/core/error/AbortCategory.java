// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

/**
 * Coarse classification of ledger aborts.
 * <p>
 * The numeric {@link #id()} occupies the upper bits of
 * {@link AbortCode#canonical()}.
 *
 * @since 0.1.0
 */
public enum AbortCategory {
    /** Malformed input such as an over-long name. */
    INVALID_ARGUMENT(0x1),
    /** Value-integrity violations: mismatched merge, over-split, arithmetic trap. */
    INVALID_VALUE(0x2),
    /** Missing capability. */
    PERMISSION_DENIED(0x5),
    /** Registry, inventory, collection, token type or slot absent. */
    NOT_FOUND(0x6),
    /** Duplicate creation. */
    ALREADY_EXISTS(0x8),
    /** Collection or supply cap reached. */
    LIMIT_EXCEEDED(0x9);

    private final int id;

    AbortCategory(final int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }
}
