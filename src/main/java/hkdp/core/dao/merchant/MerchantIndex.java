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

package hkdp.core.dao.merchant;

import hkdp.core.dao.Address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Unordered list of merchant addresses with O(1) lookup and removal. A removed entry is replaced by the last
 * element of the list and the list is truncated by one.
 */
public class MerchantIndex {
    private final List<Address> addresses;
    private final Map<Address, Integer> positions;

    public MerchantIndex() {
        this.addresses = new ArrayList<>();
        this.positions = new HashMap<>();
    }

    private MerchantIndex(MerchantIndex other) {
        this.addresses = new ArrayList<>(other.addresses);
        this.positions = new HashMap<>(other.positions);
    }

    public MerchantIndex getClone() {
        return new MerchantIndex(this);
    }

    public void add(Address address) {
        checkArgument(!contains(address), "Address is already indexed. address=%s", address);
        positions.put(address, addresses.size());
        addresses.add(address);
    }

    public boolean remove(Address address) {
        Integer position = positions.remove(address);
        if (position == null)
            return false;

        int lastPosition = addresses.size() - 1;
        Address last = addresses.remove(lastPosition);
        if (position != lastPosition) {
            addresses.set(position, last);
            positions.put(last, position);
        }
        return true;
    }

    public boolean contains(Address address) {
        return positions.containsKey(address);
    }

    public int indexOf(Address address) {
        return positions.getOrDefault(address, -1);
    }

    public Address get(int position) {
        return addresses.get(position);
    }

    public int size() {
        return addresses.size();
    }

    public List<Address> getAddresses() {
        return Collections.unmodifiableList(addresses);
    }
}
