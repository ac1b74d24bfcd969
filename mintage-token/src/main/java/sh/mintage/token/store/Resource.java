// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import sh.mintage.core.InternalApi;

/**
 * A value stored under an account address in the host's global resource store.
 * <p>
 * An account holds at most one resource of each type.
 *
 * @param <R> the concrete resource type
 * @since 0.1.0
 */
public interface Resource<R extends Resource<R>> {

    /**
     * Deep copy used by the host to snapshot state before a transaction.
     * Event handles in the copy keep their keys and counters.
     *
     * @return an independent copy
     */
    @InternalApi
    R copy();
}
