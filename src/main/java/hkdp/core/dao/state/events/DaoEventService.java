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

import hkdp.core.dao.DaoOptionKeys;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;

import javax.inject.Inject;
import javax.inject.Named;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.extern.slf4j.Slf4j;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Delivers DAO events to the registered listeners and appends them to the event log. While a guarded call is in
 * progress events are held back and only delivered once the call has completed successfully.
 * <p>
 * The event log keeps the most recent events up to its capacity, older ones get dropped. A capacity of 0 disables
 * it. Listeners see every event.
 */
@Slf4j
public class DaoEventService {
    public static final int DEFAULT_EVENT_LOG_CAPACITY = 10_000;

    private final List<DaoEventListener> listeners = new CopyOnWriteArrayList<>();
    private final EvictingQueue<DaoEvent> eventLog;
    private final List<DaoEvent> pendingEvents = new ArrayList<>();
    private boolean buffering;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    public DaoEventService() {
        this(DEFAULT_EVENT_LOG_CAPACITY);
    }

    @Inject
    public DaoEventService(@Named(DaoOptionKeys.EVENT_LOG_CAPACITY) int eventLogCapacity) {
        checkArgument(eventLogCapacity >= 0, "eventLogCapacity must not be negative");
        this.eventLog = EvictingQueue.create(eventLogCapacity);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Listeners
    ///////////////////////////////////////////////////////////////////////////////////////////

    public void addListener(DaoEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DaoEventListener listener) {
        listeners.remove(listener);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Emit
    ///////////////////////////////////////////////////////////////////////////////////////////

    public synchronized void emit(DaoEvent event) {
        if (buffering)
            pendingEvents.add(event);
        else
            publish(event);
    }

    public synchronized void beginBuffering() {
        if (!pendingEvents.isEmpty()) {
            log.warn("{} events of an aborted call were not delivered", pendingEvents.size());
            pendingEvents.clear();
        }
        buffering = true;
    }

    public synchronized void publishBuffered() {
        buffering = false;
        List<DaoEvent> events = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        events.forEach(this::publish);
    }

    public synchronized void discardBuffered() {
        buffering = false;
        if (!pendingEvents.isEmpty())
            log.debug("Discard {} events of a failed call", pendingEvents.size());
        pendingEvents.clear();
    }

    // Oldest first
    public synchronized List<DaoEvent> getEventLog() {
        return ImmutableList.copyOf(eventLog);
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Private
    ///////////////////////////////////////////////////////////////////////////////////////////

    private void publish(DaoEvent event) {
        log.debug("Publish {}", event);
        eventLog.add(event);
        listeners.forEach(listener -> {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener failed to handle event {}", event, e);
            }
        });
    }
}
