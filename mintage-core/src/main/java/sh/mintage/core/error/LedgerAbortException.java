// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

import java.util.Objects;

/**
 * A ledger operation aborted; the enclosing transaction is rolled back in full.
 *
 * <p>
 * The {@link AbortCode} identifies the reason. Nothing inside the ledger retries
 * or recovers: the abort is fatal to the current transaction only, never to other
 * accounts' state.
 *
 * <pre>{@code
 * try {
 *     ledger.withdraw(holder, identity, 5);
 * } catch (LedgerAbortException e) {
 *     switch (e.category()) {
 *         case NOT_FOUND -> System.err.println("nothing to withdraw: " + e.code());
 *         case INVALID_VALUE -> System.err.println("insufficient balance");
 *         default -> throw e;
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LedgerAbortException extends MintageException {

    private final AbortCode code;
    private final String detail;

    public LedgerAbortException(final AbortCode code, final String detail) {
        super(messageFor(Objects.requireNonNull(code, "code"), detail));
        this.code = code;
        this.detail = detail;
    }

    private static String messageFor(final AbortCode code, final String detail) {
        final String prefix = "Ledger abort [" + code.category() + "] " + code
                + " (0x" + Integer.toHexString(code.canonical()) + ")";
        return detail != null ? prefix + ": " + detail : prefix;
    }

    public AbortCode code() {
        return code;
    }

    public AbortCategory category() {
        return code.category();
    }

    public String detail() {
        return detail;
    }

    public boolean isNotFound() {
        return code.category() == AbortCategory.NOT_FOUND;
    }

    public boolean isPermissionDenied() {
        return code.category() == AbortCategory.PERMISSION_DENIED;
    }
}
