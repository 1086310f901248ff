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

import java.time.Instant;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Mutable record of a registered merchant. Only the {@link MerchantLedger} changes it.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class MerchantAccount {
    private final Address address;
    private final String name;
    private final long registrationTime;
    private long printQuota;
    private long totalCashReceived;
    private long totalRecycled;
    private int rebate;
    private boolean frozen;
    private Address guardian;

    MerchantAccount(Address address, String name, long printQuota, Address guardian, long registrationTime) {
        this.address = address;
        this.name = name;
        this.printQuota = printQuota;
        this.guardian = guardian;
        this.registrationTime = registrationTime;
    }

    private MerchantAccount(MerchantAccount other) {
        this.address = other.address;
        this.name = other.name;
        this.registrationTime = other.registrationTime;
        this.printQuota = other.printQuota;
        this.totalCashReceived = other.totalCashReceived;
        this.totalRecycled = other.totalRecycled;
        this.rebate = other.rebate;
        this.frozen = other.frozen;
        this.guardian = other.guardian;
    }

    public MerchantAccount getClone() {
        return new MerchantAccount(this);
    }

    // Can be negative if more was recycled through this merchant than it has minted
    public long getNetOutstanding() {
        return totalCashReceived - totalRecycled;
    }

    public long getRemainingQuota() {
        return printQuota - getNetOutstanding();
    }

    @Override
    public String toString() {
        return "MerchantAccount{" +
                "\n     address=" + address +
                ",\n     name='" + name + '\'' +
                ",\n     printQuota=" + printQuota +
                ",\n     totalCashReceived=" + totalCashReceived +
                ",\n     totalRecycled=" + totalRecycled +
                ",\n     rebate=" + rebate +
                ",\n     frozen=" + frozen +
                ",\n     guardian=" + guardian +
                ",\n     registrationTime=" + Instant.ofEpochSecond(registrationTime) +
                "\n}";
    }
}
