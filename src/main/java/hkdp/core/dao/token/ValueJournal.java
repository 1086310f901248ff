/*
 * This file is part of Bisq.
 *
 * Bisq is free software: you can redistribute it and/or modify it
 * under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or (at
 * your option) any later version.
 *
 * Bisq is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public
 * License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with Bisq. If not, see <http://www.gnu.org/licenses/>.
 */
package hkdp.core.dao.token;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the value each key of {@code values} had before its first change since {@link #begin()}.
 * Only touched keys get recorded.
 */
class ValueJournal<K, V> {
    private final Map<K, V> values;
    // Empty for keys which were absent
    private final Map<K, Optional<V>> priorValues = new HashMap<>();
    private boolean active;

    ValueJournal(Map<K, V> values) {
        this.values = values;
    }

    void begin() {
        priorValues.clear();
        active = true;
    }

    // Must be called before values.put or values.remove
    void record(K key) {
        if (active && !priorValues.containsKey(key))
            priorValues.put(key, Optional.ofNullable(values.get(key)));
    }

    void commit() {
        priorValues.clear();
        active = false;
    }

    void revert() {
        priorValues.forEach((key, prior) -> {
            if (prior.isPresent())
                values.put(key, prior.get());
            else
                values.remove(key);
        });
        commit();
    }

    boolean isActive() {
        return active;
    }
}
