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

package hkdp.core.dao;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.regex.Pattern;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import javax.annotation.concurrent.Immutable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 20 byte account identifier in its hex form (0x prefixed, lower case).
 * The zero address is used as marker for the native currency in withdrawals.
 */
@Immutable
@Getter
@EqualsAndHashCode
public final class Address implements Comparable<Address> {
    private static final Pattern HEX_PATTERN = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");
    public static final Address NATIVE = ZERO;

    private final String hex;

    private Address(String hex) {
        this.hex = hex;
    }

    public static Address of(String hex) {
        checkNotNull(hex, "hex must not be null");
        String normalized = hex.trim().toLowerCase(Locale.ROOT);
        if (!normalized.startsWith("0x"))
            normalized = "0x" + normalized;
        checkArgument(HEX_PATTERN.matcher(normalized).matches(), "Invalid address: %s", hex);
        return new Address(normalized);
    }

    public static boolean isValid(String hex) {
        if (hex == null)
            return false;
        String normalized = hex.trim().toLowerCase(Locale.ROOT);
        if (!normalized.startsWith("0x"))
            normalized = "0x" + normalized;
        return HEX_PATTERN.matcher(normalized).matches();
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    public String getShortId() {
        return hex.substring(0, 10);
    }

    @Override
    public int compareTo(@NotNull Address other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
