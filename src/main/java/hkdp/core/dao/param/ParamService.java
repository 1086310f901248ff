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

package hkdp.core.dao.param;

import hkdp.core.dao.governance.GovernanceConsensus;
import hkdp.core.dao.state.StateService;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.state.events.ParamChangeEvent;

import javax.inject.Inject;

import java.time.Clock;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Holds the majority percentage and the list of its changes. The value is only changed by an executed
 * CHANGE_PARAM proposal, the list of changes is never pruned.
 */
@Slf4j
public class ParamService {
    private final StateService stateService;
    private final DaoEventService daoEventService;
    private final Clock clock;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public ParamService(StateService stateService, DaoEventService daoEventService, Clock clock) {
        this.stateService = stateService;
        this.daoEventService = daoEventService;
        this.clock = clock;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    public int getMajorityPercentage() {
        return stateService.getMajorityPercentage();
    }

    public void changeMajorityPercentage(int majorityPercentage) {
        checkArgument(GovernanceConsensus.isValidMajorityPercentage(majorityPercentage),
                "Invalid majority percentage %s", majorityPercentage);
        ParamChange paramChange = new ParamChange(getMajorityPercentage(), majorityPercentage,
                clock.instant().getEpochSecond());
        stateService.setMajorityPercentage(paramChange);
        log.info("Majority percentage changed from {} to {}", paramChange.getOldValue(), paramChange.getNewValue());
        daoEventService.emit(new ParamChangeEvent(paramChange));
    }

    public List<ParamChange> getParamChanges() {
        return stateService.getParamChanges();
    }
}
