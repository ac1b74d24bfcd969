// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every reason a ledger transaction can abort.
 * <p>
 * Codes carry a {@link AbortCategory} and a reason number; {@link #canonical()}
 * packs both as {@code category << 16 | reason}, the form surfaced to clients.
 *
 * @since 0.1.0
 */
public enum AbortCode {
    ALREADY_HAS_BALANCE(AbortCategory.ALREADY_EXISTS, 1),
    BALANCE_NOT_PUBLISHED(AbortCategory.NOT_FOUND, 2),
    COLLECTION_ALREADY_EXISTS(AbortCategory.ALREADY_EXISTS, 3),
    COLLECTION_NOT_PUBLISHED(AbortCategory.NOT_FOUND, 4),
    COLLECTION_LIMIT_EXCEEDED(AbortCategory.LIMIT_EXCEEDED, 5),
    INVALID_MERGE(AbortCategory.INVALID_VALUE, 6),
    MINT_LIMIT_EXCEEDED(AbortCategory.LIMIT_EXCEEDED, 7),
    NO_BURN_CAPABILITY(AbortCategory.PERMISSION_DENIED, 8),
    NO_MINT_CAPABILITY(AbortCategory.PERMISSION_DENIED, 9),
    REGISTRY_NOT_PUBLISHED(AbortCategory.NOT_FOUND, 10),
    SPLIT_AMOUNT_EXCEEDS_BALANCE(AbortCategory.INVALID_VALUE, 11),
    STORE_NOT_PUBLISHED(AbortCategory.NOT_FOUND, 12),
    TOKEN_ALREADY_EXISTS(AbortCategory.ALREADY_EXISTS, 13),
    TOKEN_NOT_PUBLISHED(AbortCategory.NOT_FOUND, 14),
    DESTROY_NON_ZERO(AbortCategory.INVALID_VALUE, 15),
    NAME_TOO_LONG(AbortCategory.INVALID_ARGUMENT, 16),
    URI_TOO_LONG(AbortCategory.INVALID_ARGUMENT, 17),
    /** Unsigned overflow or underflow, the host VM's arithmetic trap. */
    ARITHMETIC_ERROR(AbortCategory.INVALID_VALUE, 0xFFFF);

    private final AbortCategory category;
    private final int reason;

    AbortCode(final AbortCategory category, final int reason) {
        this.category = category;
        this.reason = reason;
    }

    public AbortCategory category() {
        return category;
    }

    public int reason() {
        return reason;
    }

    public int canonical() {
        return category.id() << 16 | reason;
    }

    /**
     * Creates the exception for this code; callers {@code throw} the result.
     *
     * @param detail what was being attempted, for the message
     * @return a new abort carrying this code
     */
    public LedgerAbortException abort(final String detail) {
        return new LedgerAbortException(this, detail);
    }

    /**
     * Looks up a code by its canonical value, e.g. one reported by a client.
     */
    public static Optional<AbortCode> fromCanonical(final int canonical) {
        return Arrays.stream(values())
                .filter(code -> code.canonical() == canonical)
                .findFirst();
    }
}
