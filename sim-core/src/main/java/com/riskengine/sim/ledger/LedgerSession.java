package com.riskengine.sim.ledger;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Process-wide ledger state shared by the feed and the agent fleet: whether the configured program exists on the
 * connected network, and the estimated offset between the local clock and cluster time.
 */
@Slf4j
public class LedgerSession {

  public static final Duration DEFAULT_DRIFT_TTL = Duration.ofMinutes(1);

  private final LedgerClient client;
  private final LedgerPublicKey programId;
  private final Clock clock;
  private final Duration driftTtl;

  private volatile boolean networkValidated;
  private volatile long driftSeconds;
  private volatile Instant driftRefreshedAt;

  public LedgerSession(@NonNull LedgerClient client, @NonNull LedgerPublicKey programId, @NonNull Clock clock) {
    this(client, programId, clock, DEFAULT_DRIFT_TTL);
  }

  public LedgerSession(
      @NonNull LedgerClient client,
      @NonNull LedgerPublicKey programId,
      @NonNull Clock clock,
      @NonNull Duration driftTtl
  ) {
    this.client = client;
    this.programId = programId;
    this.clock = clock;
    this.driftTtl = driftTtl;
  }

  public LedgerClient client() {
    return client;
  }

  public LedgerPublicKey programId() {
    return programId;
  }

  /**
   * Checks once per process that the program account is deployed on the connected network.
   */
  public void ensureNetwork() throws IOException {
    if (networkValidated) {
      return;
    }
    synchronized (this) {
      if (networkValidated) {
        return;
      }
      if (client.accountData(programId).isEmpty()) {
        throw new LedgerRpcException("program " + programId + " not found on the connected network");
      }
      networkValidated = true;
      log.info("ledger network validated (program={})", programId);
    }
  }

  public boolean isNetworkValidated() {
    return networkValidated;
  }

  /**
   * Local time shifted by the cached drift, in epoch seconds. A failed drift refresh keeps the previous estimate.
   */
  public long clusterTimestampSeconds() {
    Instant now = clock.instant();
    Instant refreshedAt = driftRefreshedAt;
    if (refreshedAt == null || !now.isBefore(refreshedAt.plus(driftTtl))) {
      refreshDrift(now);
    }
    return now.getEpochSecond() + driftSeconds;
  }

  public long driftSeconds() {
    return driftSeconds;
  }

  private synchronized void refreshDrift(Instant now) {
    Instant refreshedAt = driftRefreshedAt;
    if (refreshedAt != null && now.isBefore(refreshedAt.plus(driftTtl))) {
      return;
    }
    driftRefreshedAt = now;
    try {
      long slot = client.slot();
      OptionalLong blockTime = client.blockTime(slot);
      if (blockTime.isEmpty()) {
        log.debug("no block time for slot {}, keeping drift {}s", slot, driftSeconds);
        return;
      }
      long drift = blockTime.getAsLong() - now.getEpochSecond();
      if (drift != driftSeconds) {
        log.info("ledger clock drift updated {}s -> {}s (slot={})", driftSeconds, drift, slot);
      }
      driftSeconds = drift;
    } catch (IOException e) {
      log.warn("clock drift refresh failed, keeping {}s: {}", driftSeconds, e.toString());
    }
  }
}
