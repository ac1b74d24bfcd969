// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

/**
 * Base runtime exception for all Mintage ledger failures.
 *
 * <p>
 * This sealed class forms the root of the ledger's exception hierarchy, so that
 * every ledger failure can be caught with a single catch clause while the
 * subtypes stay exhaustive.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * MintageException
 * ├── {@link LedgerAbortException} - categorized transaction aborts ({@link AbortCode})
 * ├── {@link ConsumedValueException} - use of a value unit after it was merged, burned or destroyed
 * ├── {@link UnconsumedValueException} - a transaction ended with value still in flight
 * └── {@link EventEncodingException} - an event could not be rendered for indexers
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     entryPoints.directTransfer(sender, receiver, creator, "Sets", "A", 1);
 * } catch (LedgerAbortException e) {
 *     if (e.code() == AbortCode.BALANCE_NOT_PUBLISHED) {
 *         // receiver-side setup missing
 *     }
 * } catch (MintageException e) {
 *     // any other ledger failure
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class MintageException extends RuntimeException
        permits LedgerAbortException,
        ConsumedValueException,
        UnconsumedValueException,
        EventEncodingException {

    public MintageException(final String message) {
        super(message);
    }

    public MintageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
