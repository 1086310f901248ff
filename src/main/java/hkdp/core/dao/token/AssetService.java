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

import hkdp.core.dao.Address;

/**
 * Holdings of several assets. {@link Address#NATIVE} stands for the native currency which has no allowances.
 * The journal covers the native currency and all registered tokens.
 */
public interface AssetService extends Revertible {

    long balanceOf(Address asset, Address holder);

    long allowance(Address asset, Address owner, Address spender);

    boolean transfer(Address asset, Address from, Address to, long amount);

    boolean transferFrom(Address asset, Address spender, Address from, Address to, long amount);
}
