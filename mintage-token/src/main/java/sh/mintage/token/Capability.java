// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

/**
 * Proof of authority over one token type.
 * <p>
 * Capabilities are created once, when the token type is defined, and stored in
 * the creator's {@link CollectionRegistry}. They are never handed out by value;
 * authority is checked by looking one up in the caller's own registry.
 *
 * @since 0.1.0
 */
public sealed interface Capability permits MintCapability, BurnCapability {

    /** The identity this capability authorizes. */
    AssetIdentity identity();
}
