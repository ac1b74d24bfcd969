// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.Objects;

import sh.mintage.token.AssetIdentity;
import sh.mintage.token.TokenTypeMeta;

/**
 * A creator defined a token type.
 *
 * @param identity      the new identity
 * @param metadata      metadata as installed, before the initial mint
 * @param initialAmount amount minted to the creator at creation
 */
public record TokenTypeCreated(AssetIdentity identity, TokenTypeMeta metadata, long initialAmount)
        implements LedgerEvent {

    public TokenTypeCreated {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(metadata, "metadata");
    }
}
