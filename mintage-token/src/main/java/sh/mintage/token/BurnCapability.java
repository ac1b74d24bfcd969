// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

/**
 * Authorizes destroying value of one identity.
 *
 * @since 0.1.0
 */
public final class BurnCapability implements Capability {

    private final AssetIdentity identity;

    BurnCapability(final AssetIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public AssetIdentity identity() {
        return identity;
    }

    @Override
    public String toString() {
        return "BurnCapability[" + identity + "]";
    }
}
