package com.riskengine.sim.service.feed;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.ledger.ComputeBudget;
import com.riskengine.sim.ledger.LedgerInstructions;
import com.riskengine.sim.ledger.LedgerKeypair;
import com.riskengine.sim.ledger.LedgerPublicKey;
import com.riskengine.sim.ledger.LedgerSession;
import com.riskengine.sim.ledger.TransactionSubmitter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

/**
 * Push then crank, as two transactions signed by the operator. The crank reads the freshly pushed price.
 */
@Slf4j
public class LedgerOracleGateway implements OracleGateway {

    private final LedgerSession session;
    private final TransactionSubmitter submitter;
    private final LedgerInstructions instructions;
    private final LedgerKeypair operator;
    private final ComputeBudget pushBudget;
    private final ComputeBudget crankBudget;

    public LedgerOracleGateway(
            @NonNull LedgerSession session,
            @NonNull TransactionSubmitter submitter,
            @NonNull LedgerKeypair operator,
            @NonNull SimProperties.Feed feed
    ) {
        this.session = session;
        this.submitter = submitter;
        this.instructions = new LedgerInstructions(session.programId());
        this.operator = operator;
        this.pushBudget = new ComputeBudget(feed.pushComputeUnits(), feed.priorityFeeMicroLamports());
        this.crankBudget = new ComputeBudget(feed.crankComputeUnits(), feed.priorityFeeMicroLamports());
    }

    @Override
    public String pushAndCrank(@NonNull SimProperties.Market market, long priceE6) throws IOException {
        session.ensureNetwork();
        LedgerPublicKey slab = LedgerPublicKey.fromBase58(market.slab());
        LedgerPublicKey oracle = LedgerPublicKey.fromBase58(market.oracleOrSlab());
        long timestamp = session.clusterTimestampSeconds();

        String pushSig = submitter.sendAndConfirm(
                List.of(instructions.pushOraclePrice(operator.publicKey(), slab, priceE6, timestamp)),
                pushBudget, operator, List.of());
        log.debug("pushed {} priceE6={} ts={} sig={}", slab, priceE6, timestamp, pushSig);

        return submitter.sendAndConfirm(
                List.of(instructions.keeperCrank(operator.publicKey(), slab, oracle)),
                crankBudget, operator, List.of());
    }
}
