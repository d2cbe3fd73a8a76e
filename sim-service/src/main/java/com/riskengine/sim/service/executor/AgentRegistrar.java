package com.riskengine.sim.service.executor;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.ledger.ComputeBudget;
import com.riskengine.sim.ledger.LedgerInstructions;
import com.riskengine.sim.ledger.LedgerKeypair;
import com.riskengine.sim.ledger.LedgerPublicKey;
import com.riskengine.sim.ledger.LedgerRpcException;
import com.riskengine.sim.ledger.LedgerSession;
import com.riskengine.sim.ledger.SlabLayout;
import com.riskengine.sim.ledger.TransactionSubmitter;
import com.riskengine.sim.math.I128;
import com.riskengine.sim.service.agent.Agent;
import com.riskengine.sim.service.agent.Position;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Brings an agent onto its market: adopts an existing slot (after a restart) or registers a new one.
 * <p>
 * A slot whose opening deposit failed is remembered and funded on the next attempt instead of being adopted.
 * That memory is per process, so an unfunded slot left by a previous run is adopted as is.
 */
@Slf4j
public class AgentRegistrar {

    static final Duration RECOVERED_HOLD = Duration.ofSeconds(5);
    static final Duration RECOVERED_AGE = Duration.ofSeconds(10);

    public enum Outcome {
        /**
         * Existing slot adopted; the agent skips trading for this tick.
         */
        RECOVERED,
        /**
         * Fresh slot registered and funded; the agent may trade in the same tick.
         */
        REGISTERED
    }

    private final LedgerSession session;
    private final TransactionSubmitter submitter;
    private final LedgerInstructions instructions;
    private final LedgerKeypair operator;
    private final ComputeBudget budget;
    private final long initialDeposit;
    private final long registrationFee;
    private final Set<String> awaitingDeposit = new HashSet<>();

    public AgentRegistrar(
            @NonNull LedgerSession session,
            @NonNull TransactionSubmitter submitter,
            @NonNull LedgerKeypair operator,
            @NonNull SimProperties.Agents config
    ) {
        this.session = session;
        this.submitter = submitter;
        this.instructions = new LedgerInstructions(session.programId());
        this.operator = operator;
        this.budget = new ComputeBudget(config.setupComputeUnits(), config.priorityFeeMicroLamports());
        this.initialDeposit = config.initialDeposit();
        this.registrationFee = config.registrationFee();
    }

    /**
     * On failure the agent is left uninitialized so the next due tick tries again.
     *
     * @param currentPrice adjusted price used as the approximate entry of a recovered position
     */
    public Outcome ensureRegistered(
            @NonNull Agent agent,
            @NonNull SimProperties.Market market,
            double currentPrice,
            @NonNull Instant now
    ) throws IOException {
        agent.markInitializing();
        try {
            session.ensureNetwork();
            LedgerPublicKey slab = LedgerPublicKey.fromBase58(market.slab());
            SlabLayout layout = readSlab(slab);
            int existing = layout.findSlot(agent.identity());
            if (existing >= 0 && awaitingDeposit.contains(agent.id())) {
                deposit(agent, market, slab, existing);
                agent.activate(existing);
                log.info("{} registered (slot={}, deposit completed)", agent.id(), existing);
                return Outcome.REGISTERED;
            }
            if (existing >= 0) {
                recover(agent, layout, existing, currentPrice, now);
                return Outcome.RECOVERED;
            }
            int slot = register(agent, market, slab);
            agent.activate(slot);
            log.info("{} registered (slot={})", agent.id(), slot);
            return Outcome.REGISTERED;
        } catch (IOException | RuntimeException e) {
            agent.markUninitialized();
            throw e;
        }
    }

    private void recover(Agent agent, SlabLayout layout, int slot, double currentPrice, Instant now) {
        agent.activate(slot);
        I128 onLedger = layout.positionSize(slot);
        if (onLedger.isZero() || !agent.isFlat()) {
            log.info("{} recovered (slot={}, flat)", agent.id(), slot);
            return;
        }
        // close on the next due tick
        agent.openPosition(new Position(onLedger, now.minus(RECOVERED_AGE), RECOVERED_HOLD, currentPrice));
        log.info("{} recovered (slot={}, {} {})", agent.id(), slot, onLedger.signum() > 0 ? "LONG" : "SHORT", onLedger);
    }

    private int register(Agent agent, SimProperties.Market market, LedgerPublicKey slab) throws IOException {
        LedgerPublicKey collateral = agent.collateralAccount()
                .orElseThrow(() -> new IllegalStateException(agent.id() + " has no collateral account configured"));
        LedgerPublicKey mint = requiredKey(market.collateralMint(), "collateral-mint");
        LedgerPublicKey vault = requiredKey(market.vault(), "vault");

        submitter.sendAndConfirm(
                List.of(LedgerInstructions.mintTo(mint, collateral, operator.publicKey(), initialDeposit + registrationFee)),
                budget, operator, List.of());

        submitter.sendAndConfirm(
                List.of(instructions.initUser(agent.identity(), slab, collateral, vault, registrationFee)),
                budget, operator, List.of(agent.keypair()));

        awaitingDeposit.add(agent.id());

        int slot = readSlab(slab).findSlot(agent.identity());
        if (slot < 0) {
            throw new LedgerRpcException(agent.id() + " slot not found after registration");
        }
        deposit(agent, market, slab, slot);
        return slot;
    }

    private void deposit(Agent agent, SimProperties.Market market, LedgerPublicKey slab, int slot) throws IOException {
        LedgerPublicKey collateral = agent.collateralAccount()
                .orElseThrow(() -> new IllegalStateException(agent.id() + " has no collateral account configured"));
        LedgerPublicKey vault = requiredKey(market.vault(), "vault");
        submitter.sendAndConfirm(
                List.of(instructions.depositCollateral(agent.identity(), slab, collateral, vault, slot, initialDeposit)),
                budget, operator, List.of(agent.keypair()));
        awaitingDeposit.remove(agent.id());
    }

    private SlabLayout readSlab(LedgerPublicKey slab) throws IOException {
        byte[] data = session.client().accountData(slab)
                .orElseThrow(() -> new LedgerRpcException("slab " + slab + " not found"));
        return SlabLayout.parse(data);
    }

    private static LedgerPublicKey requiredKey(String base58, String name) {
        if (base58 == null || base58.isBlank()) {
            throw new IllegalStateException("market " + name + " is not configured");
        }
        return LedgerPublicKey.fromBase58(base58);
    }
}
