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

package hkdp.core.dao.state.events;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import static hkdp.core.dao.DaoAddresses.MERCHANT;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class DaoEventServiceTest {
    private DaoEventService daoEventService;
    private List<DaoEvent> received;

    @Before
    public void setup() {
        daoEventService = new DaoEventService();
        received = new ArrayList<>();
        daoEventService.addListener(received::add);
    }

    @Test
    public void testEmitWithoutBuffering() {
        DaoEvent event = new MerchantFrozenEvent(MERCHANT, 1);
        daoEventService.emit(event);
        assertThat(received, contains(event));
        assertThat(daoEventService.getEventLog(), contains(event));
    }

    @Test
    public void testBufferedEventsArePublishedInOrder() {
        DaoEvent frozen = new MerchantFrozenEvent(MERCHANT, 1);
        DaoEvent unfrozen = new MerchantUnfrozenEvent(MERCHANT, 2);
        daoEventService.beginBuffering();
        daoEventService.emit(frozen);
        daoEventService.emit(unfrozen);
        assertThat(received, empty());
        assertThat(daoEventService.getEventLog(), empty());

        daoEventService.publishBuffered();
        assertThat(received, contains(frozen, unfrozen));
        assertThat(daoEventService.getEventLog(), contains(frozen, unfrozen));
    }

    @Test
    public void testDiscardedEventsAreNeverPublished() {
        daoEventService.beginBuffering();
        daoEventService.emit(new MerchantFrozenEvent(MERCHANT, 1));
        daoEventService.discardBuffered();
        daoEventService.publishBuffered();
        assertThat(received, empty());
        assertThat(daoEventService.getEventLog(), empty());
    }

    @Test
    public void testFailingListenerDoesNotStopDelivery() {
        List<DaoEvent> receivedByLast = new ArrayList<>();
        daoEventService.addListener(event -> {
            throw new IllegalStateException("listener failure");
        });
        daoEventService.addListener(receivedByLast::add);

        DaoEvent event = new MerchantRemovedEvent(MERCHANT, 1);
        daoEventService.emit(event);
        assertThat(received, contains(event));
        assertThat(receivedByLast, contains(event));
        assertThat(daoEventService.getEventLog(), contains(event));
    }

    @Test
    public void testRemoveListener() {
        List<DaoEvent> other = new ArrayList<>();
        DaoEventListener otherListener = other::add;
        daoEventService.addListener(otherListener);
        daoEventService.removeListener(otherListener);
        daoEventService.emit(new MerchantRemovedEvent(MERCHANT, 1));
        assertThat(other, empty());
    }

    @Test
    public void testEventLogKeepsMostRecentEvents() {
        DaoEventService service = new DaoEventService(2);
        List<DaoEvent> all = new ArrayList<>();
        service.addListener(all::add);
        DaoEvent first = new MerchantFrozenEvent(MERCHANT, 1);
        DaoEvent second = new MerchantUnfrozenEvent(MERCHANT, 2);
        DaoEvent third = new MerchantFrozenEvent(MERCHANT, 3);
        service.emit(first);
        service.emit(second);
        service.emit(third);
        assertThat(service.getEventLog(), contains(second, third));
        assertThat(all, contains(first, second, third));
    }

    @Test
    public void testDisabledEventLog() {
        DaoEventService service = new DaoEventService(0);
        List<DaoEvent> all = new ArrayList<>();
        service.addListener(all::add);
        DaoEvent event = new MerchantFrozenEvent(MERCHANT, 1);
        service.emit(event);
        assertThat(service.getEventLog(), empty());
        assertThat(all, contains(event));
    }
}
