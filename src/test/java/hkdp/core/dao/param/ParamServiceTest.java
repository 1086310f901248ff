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

import hkdp.core.dao.MutableClock;
import hkdp.core.dao.state.DaoState;
import hkdp.core.dao.state.StateService;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.state.events.ParamChangeEvent;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ParamServiceTest {
    private MutableClock clock;
    private DaoEventService daoEventService;
    private ParamService paramService;

    @Before
    public void setup() {
        clock = new MutableClock(1_000L);
        daoEventService = new DaoEventService();
        paramService = new ParamService(new StateService(new DaoState(15)), daoEventService, clock);
    }

    @Test
    public void testChangeMajorityPercentage() {
        assertEquals(15, paramService.getMajorityPercentage());
        assertTrue(paramService.getParamChanges().isEmpty());

        paramService.changeMajorityPercentage(20);
        clock.advanceSeconds(10);
        paramService.changeMajorityPercentage(30);

        assertEquals(30, paramService.getMajorityPercentage());
        List<ParamChange> paramChanges = paramService.getParamChanges();
        assertEquals(2, paramChanges.size());
        assertEquals(new ParamChange(15, 20, 1_000L), paramChanges.get(0));
        assertEquals(new ParamChange(20, 30, 1_010L), paramChanges.get(1));

        ParamChangeEvent event = (ParamChangeEvent) daoEventService.getEventLog().get(1);
        assertEquals(20, event.getOldValue());
        assertEquals(30, event.getNewValue());
        assertEquals(1_010L, event.getTime());
    }

    @Test
    public void testInvalidValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> paramService.changeMajorityPercentage(0));
        assertThrows(IllegalArgumentException.class, () -> paramService.changeMajorityPercentage(31));
        assertEquals(15, paramService.getMajorityPercentage());
        assertTrue(paramService.getParamChanges().isEmpty());
    }
}
