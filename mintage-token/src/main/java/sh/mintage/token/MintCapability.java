// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

/**
 * Authorizes minting new value of one identity.
 *
 * @since 0.1.0
 */
public final class MintCapability implements Capability {

    private final AssetIdentity identity;

    MintCapability(final AssetIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public AssetIdentity identity() {
        return identity;
    }

    @Override
    public String toString() {
        return "MintCapability[" + identity + "]";
    }
}
