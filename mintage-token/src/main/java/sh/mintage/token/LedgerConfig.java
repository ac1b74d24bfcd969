// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

/**
 * Tunables of a {@link TokenLedger}.
 *
 * <pre>{@code
 * LedgerConfig config = LedgerConfig.builder()
 *         .maxNameLength(64)
 *         .emitBurnEvents(false)
 *         .build();
 * }</pre>
 *
 * @param maxNameLength  longest collection or token name accepted; longer aborts
 *                       with {@code NAME_TOO_LONG}
 * @param maxUriLength   longest URI accepted; longer aborts with {@code URI_TOO_LONG}
 * @param emitMintEvents whether mints emit {@link sh.mintage.token.event.Minted}
 *                       into the creator's registry
 * @param emitBurnEvents whether burns emit {@link sh.mintage.token.event.Burned}
 *                       into the creator's registry
 * @since 0.1.0
 */
public record LedgerConfig(
        int maxNameLength,
        int maxUriLength,
        boolean emitMintEvents,
        boolean emitBurnEvents) {

    static final int DEFAULT_MAX_NAME_LENGTH = 128;
    static final int DEFAULT_MAX_URI_LENGTH = 512;

    public LedgerConfig {
        if (maxNameLength <= 0) {
            throw new IllegalArgumentException("maxNameLength must be positive, got " + maxNameLength);
        }
        if (maxUriLength <= 0) {
            throw new IllegalArgumentException("maxUriLength must be positive, got " + maxUriLength);
        }
    }

    public static LedgerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link LedgerConfig}; every field starts at its default.
     */
    public static final class Builder {
        private int maxNameLength = DEFAULT_MAX_NAME_LENGTH;
        private int maxUriLength = DEFAULT_MAX_URI_LENGTH;
        private boolean emitMintEvents = true;
        private boolean emitBurnEvents = true;

        private Builder() {
        }

        public Builder maxNameLength(final int maxNameLength) {
            this.maxNameLength = maxNameLength;
            return this;
        }

        public Builder maxUriLength(final int maxUriLength) {
            this.maxUriLength = maxUriLength;
            return this;
        }

        public Builder emitMintEvents(final boolean emitMintEvents) {
            this.emitMintEvents = emitMintEvents;
            return this;
        }

        public Builder emitBurnEvents(final boolean emitBurnEvents) {
            this.emitBurnEvents = emitBurnEvents;
            return this;
        }

        public LedgerConfig build() {
            return new LedgerConfig(maxNameLength, maxUriLength, emitMintEvents, emitBurnEvents);
        }
    }
}
