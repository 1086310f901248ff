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

package hkdp.core.dao.state;

import hkdp.core.dao.exceptions.DaoException;
import hkdp.core.dao.exceptions.ReentrantCallException;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.token.AssetService;

import javax.inject.Inject;

import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * Runs DAO calls one at a time and all-or-nothing. A call that fails leaves the state and the asset holdings as
 * they were at its start and none of its events get delivered. A call started while another one is in progress on
 * the same thread (e.g. from a token or listener callback) fails with a {@link ReentrantCallException}; calls from
 * other threads wait.
 * <p>
 * Reads go through {@link #read(Supplier)} so they never see a call half done.
 */
@Slf4j
public class CallGuard {
    private final StateService stateService;
    private final AssetService assetService;
    private final DaoEventService daoEventService;

    @Nullable
    private String callInProgress;


    ///////////////////////////////////////////////////////////////////////////////////////////
    // Constructor
    ///////////////////////////////////////////////////////////////////////////////////////////

    @Inject
    public CallGuard(StateService stateService, AssetService assetService, DaoEventService daoEventService) {
        this.stateService = stateService;
        this.assetService = assetService;
        this.daoEventService = daoEventService;
    }


    ///////////////////////////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////////////////////////

    public synchronized <T> T execute(String name, DaoCall<T> call) throws DaoException {
        if (callInProgress != null)
            throw new ReentrantCallException("Call " + name + " rejected as " + callInProgress + " is in progress");

        callInProgress = name;
        DaoState snapshot = stateService.getClone();
        daoEventService.beginBuffering();
        assetService.beginJournal();
        boolean completed = false;
        T result;
        try {
            result = call.call();
            completed = true;
        } finally {
            try {
                if (completed) {
                    assetService.commitJournal();
                } else {
                    log.info("{} failed, state gets restored", name);
                    stateService.applySnapshot(snapshot);
                    assetService.revertJournal();
                    daoEventService.discardBuffered();
                }
            } finally {
                callInProgress = null;
            }
        }
        daoEventService.publishBuffered();
        return result;
    }

    public synchronized <T> T read(Supplier<T> reader) {
        return reader.get();
    }

    public synchronized boolean isCallInProgress() {
        return callInProgress != null;
    }
}
