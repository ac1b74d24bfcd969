// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

/**
 * Thrown when a value unit is read or modified after it has been consumed.
 * <p>
 * A unit is consumed exactly once: by merging it into another unit, burning it,
 * or destroying it at zero amount. Any later use is a programming error in the
 * caller, not a transaction abort.
 *
 * @since 0.1.0
 */
public final class ConsumedValueException extends MintageException {

    public ConsumedValueException(final String message) {
        super(message);
    }
}
