// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

/**
 * Thrown when a ledger event cannot be serialized for off-chain consumers.
 *
 * @since 0.1.0
 */
public final class EventEncodingException extends MintageException {

    public EventEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
