// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Records value units that exist outside any inventory slot.
 * <p>
 * A unit is opened when mint, withdraw or split hands it out and settled when it
 * is merged, burned or destroyed. Empty at every commit. {@link #reset()} revokes
 * every open unit, so a reference kept past a rollback is unusable.
 */
final class UnitTracker {

    private final Set<ValueUnit> inFlight = Collections.newSetFromMap(new IdentityHashMap<>());

    void opened(final ValueUnit unit) {
        inFlight.add(unit);
    }

    void settled(final ValueUnit unit) {
        inFlight.remove(unit);
    }

    long outstanding() {
        return inFlight.size();
    }

    /**
     * Consumes every open unit and forgets it.
     *
     * @return the number of units revoked
     */
    int reset() {
        final List<ValueUnit> open = new ArrayList<>(inFlight);
        inFlight.clear();
        open.forEach(ValueUnit::revoke);
        return open.size();
    }
}
