package com.riskengine.sim.service.agent;

import com.riskengine.sim.ledger.LedgerKeypair;
import com.riskengine.sim.ledger.LedgerPublicKey;
import com.riskengine.sim.service.agent.strategy.StrategyType;
import lombok.NonNull;

import java.time.Instant;
import java.util.Optional;

/**
 * One simulated trader. Mutable state is confined to the scheduler thread; the status and trade count are read
 * by the health endpoint.
 */
public class Agent {

    private final String id;
    private final StrategyType strategyType;
    private final String market;
    private final LedgerKeypair keypair;
    private final LedgerPublicKey collateralAccount;
    private final String displayName;
    private final PriceWindow window = new PriceWindow();

    private volatile AgentStatus status = AgentStatus.UNINITIALIZED;
    private volatile int tradeCount;
    private int slot = -1;
    private Position position;
    private Instant nextActionAt = Instant.EPOCH;

    public Agent(
            @NonNull String id,
            @NonNull StrategyType strategyType,
            @NonNull String market,
            @NonNull LedgerKeypair keypair,
            LedgerPublicKey collateralAccount,
            @NonNull String displayName
    ) {
        this.id = id;
        this.strategyType = strategyType;
        this.market = market;
        this.keypair = keypair;
        this.collateralAccount = collateralAccount;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public StrategyType strategyType() {
        return strategyType;
    }

    public String market() {
        return market;
    }

    public LedgerKeypair keypair() {
        return keypair;
    }

    public LedgerPublicKey identity() {
        return keypair.publicKey();
    }

    public Optional<LedgerPublicKey> collateralAccount() {
        return Optional.ofNullable(collateralAccount);
    }

    public String displayName() {
        return displayName;
    }

    public PriceWindow window() {
        return window;
    }

    public AgentStatus status() {
        return status;
    }

    public int slot() {
        return slot;
    }

    public int tradeCount() {
        return tradeCount;
    }

    public Instant nextActionAt() {
        return nextActionAt;
    }

    public boolean isFlat() {
        return position == null;
    }

    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextActionAt);
    }

    public void scheduleNext(@NonNull Instant at) {
        this.nextActionAt = at;
    }

    public void markInitializing() {
        this.status = AgentStatus.INITIALIZING;
    }

    public void markUninitialized() {
        this.status = AgentStatus.UNINITIALIZED;
        this.slot = -1;
    }

    public void activate(int slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative: " + slot);
        }
        this.slot = slot;
        this.status = AgentStatus.ACTIVE;
    }

    /**
     * Flat to positioned. A positioned agent must close before it can open again.
     */
    public void openPosition(@NonNull Position opened) {
        if (position != null) {
            throw new IllegalStateException(id + " already holds a position");
        }
        this.position = opened;
    }

    public Position closePosition() {
        if (position == null) {
            throw new IllegalStateException(id + " has no open position");
        }
        Position closed = position;
        this.position = null;
        return closed;
    }

    public void recordTrade() {
        tradeCount++;
    }

    @Override
    public String toString() {
        return id + "(" + strategyType.id() + ", " + market + ")";
    }
}
