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

import hkdp.core.app.AppModule;
import hkdp.core.dao.governance.ExecutionDispatcher;
import hkdp.core.dao.governance.GovernanceService;
import hkdp.core.dao.governance.proposal.ProposalValidator;
import hkdp.core.dao.merchant.MerchantLedger;
import hkdp.core.dao.param.ParamService;
import hkdp.core.dao.state.CallGuard;
import hkdp.core.dao.state.DaoState;
import hkdp.core.dao.state.StateService;
import hkdp.core.dao.state.events.DaoEventService;
import hkdp.core.dao.token.AssetService;
import hkdp.core.dao.token.FungibleToken;
import hkdp.core.dao.token.InMemoryAssetService;
import hkdp.core.dao.token.InMemoryToken;
import hkdp.core.dao.token.TokenVotingPowerSource;
import hkdp.core.dao.token.VotingPowerSource;

import org.springframework.core.env.Environment;

import com.google.inject.Singleton;

import java.time.Clock;

import static com.google.inject.name.Names.named;

public class DaoModule extends AppModule {
    public static final String SHARE_TOKEN_SYMBOL = "SHARE";
    public static final String CURRENCY_TOKEN_SYMBOL = "HKDP";

    public DaoModule(Environment environment) {
        super(environment);
    }

    @Override
    protected void configure() {
        bind(DaoFacade.class).in(Singleton.class);
        bind(CallGuard.class).in(Singleton.class);

        bind(DaoState.class).in(Singleton.class);
        bind(StateService.class).in(Singleton.class);
        bind(DaoEventService.class).in(Singleton.class);

        bind(GovernanceService.class).in(Singleton.class);
        bind(ProposalValidator.class).in(Singleton.class);
        bind(ExecutionDispatcher.class).in(Singleton.class);
        bind(ParamService.class).in(Singleton.class);
        bind(MerchantLedger.class).in(Singleton.class);

        bind(VotingPowerSource.class).to(TokenVotingPowerSource.class).in(Singleton.class);
        bind(InMemoryAssetService.class).in(Singleton.class);
        bind(AssetService.class).to(InMemoryAssetService.class);
        bind(FungibleToken.class).annotatedWith(named(DaoOptionKeys.SHARE_TOKEN))
                .toInstance(new InMemoryToken(getAddress(DaoOptionKeys.SHARE_TOKEN_ADDRESS), SHARE_TOKEN_SYMBOL));
        bind(FungibleToken.class).annotatedWith(named(DaoOptionKeys.CURRENCY_TOKEN))
                .toInstance(new InMemoryToken(getAddress(DaoOptionKeys.CURRENCY_TOKEN_ADDRESS),
                        CURRENCY_TOKEN_SYMBOL));

        bind(Clock.class).toInstance(Clock.systemUTC());

        bind(Address.class).annotatedWith(named(DaoOptionKeys.OWNER_ADDRESS))
                .toInstance(getAddress(DaoOptionKeys.OWNER_ADDRESS));
        bind(Address.class).annotatedWith(named(DaoOptionKeys.GOVERNANCE_ADDRESS))
                .toInstance(getAddress(DaoOptionKeys.GOVERNANCE_ADDRESS));
        bind(Address.class).annotatedWith(named(DaoOptionKeys.LEDGER_ADDRESS))
                .toInstance(getAddress(DaoOptionKeys.LEDGER_ADDRESS));

        bindConstant().annotatedWith(named(DaoOptionKeys.VOTING_WINDOW_SEC))
                .to(environment.getRequiredProperty(DaoOptionKeys.VOTING_WINDOW_SEC));
        bindConstant().annotatedWith(named(DaoOptionKeys.DEFAULT_MAJORITY_PERCENTAGE))
                .to(environment.getRequiredProperty(DaoOptionKeys.DEFAULT_MAJORITY_PERCENTAGE));
        bindConstant().annotatedWith(named(DaoOptionKeys.REGISTRATION_REWARD))
                .to(environment.getRequiredProperty(DaoOptionKeys.REGISTRATION_REWARD));
        bindConstant().annotatedWith(named(DaoOptionKeys.EVENT_LOG_CAPACITY))
                .to(environment.getRequiredProperty(DaoOptionKeys.EVENT_LOG_CAPACITY));
    }

    private Address getAddress(String key) {
        return Address.of(environment.getRequiredProperty(key));
    }
}
