// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

/**
 * Notification emitted by a ledger resource and consumed by off-chain indexers.
 *
 * <table border="1">
 * <tr><th>Event</th><th>Emitted into</th><th>When</th></tr>
 * <tr><td>{@link CollectionCreated}</td><td>creator's registry</td><td>collection defined</td></tr>
 * <tr><td>{@link TokenTypeCreated}</td><td>creator's registry</td><td>token type defined</td></tr>
 * <tr><td>{@link Minted}</td><td>creator's registry</td><td>new value minted</td></tr>
 * <tr><td>{@link Burned}</td><td>creator's registry</td><td>value burned</td></tr>
 * <tr><td>{@link Deposited}</td><td>holder's inventory</td><td>value merged into a slot</td></tr>
 * <tr><td>{@link Withdrawn}</td><td>holder's inventory</td><td>value taken out of a slot</td></tr>
 * </table>
 *
 * @since 0.1.0
 */
public sealed interface LedgerEvent
        permits CollectionCreated, TokenTypeCreated, Minted, Burned, Deposited, Withdrawn {
}
