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

public class DaoOptionKeys {
    public static final String OWNER_ADDRESS = "ownerAddress";
    public static final String GOVERNANCE_ADDRESS = "governanceAddress";
    // Account holding the ledger's funds and deposits
    public static final String LEDGER_ADDRESS = "ledgerAddress";
    public static final String SHARE_TOKEN = "shareToken";
    public static final String SHARE_TOKEN_ADDRESS = "shareTokenAddress";
    public static final String CURRENCY_TOKEN = "currencyToken";
    public static final String CURRENCY_TOKEN_ADDRESS = "currencyTokenAddress";
    public static final String VOTING_WINDOW_SEC = "votingWindowSec";
    public static final String DEFAULT_MAJORITY_PERCENTAGE = "defaultMajorityPercentage";
    public static final String REGISTRATION_REWARD = "registrationReward";
    public static final String EVENT_LOG_CAPACITY = "eventLogCapacity";
}
