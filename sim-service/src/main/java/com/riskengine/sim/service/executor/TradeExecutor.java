package com.riskengine.sim.service.executor;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.ledger.ComputeBudget;
import com.riskengine.sim.ledger.LedgerInstruction;
import com.riskengine.sim.ledger.LedgerInstructions;
import com.riskengine.sim.ledger.LedgerKeypair;
import com.riskengine.sim.ledger.LedgerPublicKey;
import com.riskengine.sim.ledger.LedgerSession;
import com.riskengine.sim.ledger.SignatureStatus;
import com.riskengine.sim.ledger.SubmittedTransaction;
import com.riskengine.sim.ledger.TransactionExpiredException;
import com.riskengine.sim.ledger.TransactionFailedException;
import com.riskengine.sim.ledger.TransactionSubmitter;
import com.riskengine.sim.math.I128;
import com.riskengine.sim.service.agent.Agent;
import com.riskengine.sim.service.agent.Position;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Submits position changes for agents. Every trade is co-signed by the operator, which is the liquidity-provider
 * counterparty and the fee payer.
 * <p>
 * An expired confirmation gets at most one resubmission, and only after the original signature is known not to
 * have landed. A landed original counts as success.
 */
@Slf4j
public class TradeExecutor {

    private final TransactionSubmitter submitter;
    private final LedgerInstructions instructions;
    private final LedgerKeypair operator;
    private final ComputeBudget budget;
    private final int lpIndex;

    private final Counter submitted;
    private final Counter expiries;
    private final Counter resubmissions;
    private final Counter landedAfterExpiry;

    public TradeExecutor(
            @NonNull LedgerSession session,
            @NonNull TransactionSubmitter submitter,
            @NonNull LedgerKeypair operator,
            @NonNull SimProperties.Agents config,
            @NonNull MeterRegistry meterRegistry
    ) {
        this.submitter = submitter;
        this.instructions = new LedgerInstructions(session.programId());
        this.operator = operator;
        this.budget = new ComputeBudget(config.tradeComputeUnits(), config.priorityFeeMicroLamports());
        this.lpIndex = config.lpIndex();

        this.submitted = Counter.builder("sim.tx.trades").register(meterRegistry);
        this.expiries = Counter.builder("sim.tx.expiries").register(meterRegistry);
        this.resubmissions = Counter.builder("sim.tx.resubmissions").register(meterRegistry);
        this.landedAfterExpiry = Counter.builder("sim.tx.landed.after.expiry").register(meterRegistry);
    }

    public String open(@NonNull Agent agent, @NonNull SimProperties.Market market, @NonNull I128 signedSize) throws IOException {
        if (!agent.isFlat()) {
            throw new IllegalStateException(agent.id() + " must be flat to open");
        }
        return execute(agent, market, signedSize);
    }

    /**
     * Trades the negation of the open position.
     */
    public CloseResult close(@NonNull Agent agent, @NonNull SimProperties.Market market, double exitPrice) throws IOException {
        Position position = agent.position()
                .orElseThrow(() -> new IllegalStateException(agent.id() + " has no position to close"));
        String signature = execute(agent, market, position.signedSize().negate());
        return CloseResult.of(signature, position, exitPrice);
    }

    private String execute(Agent agent, SimProperties.Market market, I128 size) throws IOException {
        if (agent.slot() < 0) {
            throw new IllegalStateException(agent.id() + " has no ledger slot");
        }
        LedgerPublicKey slab = LedgerPublicKey.fromBase58(market.slab());
        LedgerPublicKey oracle = LedgerPublicKey.fromBase58(market.oracleOrSlab());
        List<LedgerInstruction> ixs = List.of(instructions.tradeNoCpi(
                agent.identity(), operator.publicKey(), slab, oracle, lpIndex, agent.slot(), size));
        List<LedgerKeypair> signers = List.of(agent.keypair());

        SubmittedTransaction original = submitter.submit(ixs, budget, operator, signers);
        submitted.increment();
        try {
            submitter.awaitConfirmation(original);
            return original.signature();
        } catch (TransactionExpiredException e) {
            expiries.increment();
            log.warn("{} trade {} expired: {}", agent.id(), original.signature(), e.getMessage());
        }

        if (landed(original)) {
            return original.signature();
        }
        if (!submitter.isBlockhashExpired(original)) {
            // still inside its validity window: give the original the rest of it
            try {
                submitter.awaitConfirmation(original);
                return original.signature();
            } catch (TransactionExpiredException e) {
                if (landed(original)) {
                    return original.signature();
                }
                if (!submitter.isBlockhashExpired(original)) {
                    // cannot rule out a late landing, so no resubmission
                    throw e;
                }
            }
        }

        log.warn("{} trade {} did not land, resubmitting once", agent.id(), original.signature());
        resubmissions.increment();
        SubmittedTransaction retry = submitter.submit(ixs, budget, operator, signers);
        submitted.increment();
        submitter.awaitConfirmation(retry);
        return retry.signature();
    }

    /**
     * @throws TransactionFailedException the original landed with a program error
     */
    private boolean landed(SubmittedTransaction tx) throws IOException {
        Optional<SignatureStatus> status = submitter.status(tx.signature());
        if (status.isEmpty()) {
            return false;
        }
        if (status.get().isFailed()) {
            throw new TransactionFailedException(tx.signature(), status.get().error());
        }
        landedAfterExpiry.increment();
        log.info("trade {} landed ({}) after expiry, not resubmitting", tx.signature(), status.get().confirmationStatus());
        return true;
    }
}
