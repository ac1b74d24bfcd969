// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

/**
 * Thrown when a transaction finishes while value units it created are neither
 * deposited, merged, burned nor destroyed.
 * <p>
 * The transaction is rolled back before this exception reaches the caller.
 *
 * @since 0.1.0
 */
public final class UnconsumedValueException extends MintageException {

    private final long outstanding;

    public UnconsumedValueException(final String transaction, final long outstanding) {
        super("Transaction '" + transaction + "' left " + outstanding + " value unit(s) unconsumed");
        this.outstanding = outstanding;
    }

    /**
     * Number of units still in flight when the transaction ended.
     */
    public long outstanding() {
        return outstanding;
    }
}
