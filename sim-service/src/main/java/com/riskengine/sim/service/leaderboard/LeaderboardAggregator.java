package com.riskengine.sim.service.leaderboard;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.store.LeaderboardDelta;
import com.riskengine.sim.store.LeaderboardRepository;
import com.riskengine.sim.store.LeaderboardRow;
import com.riskengine.sim.store.StoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Buffers closed-trade deltas and merges them into weekly standings. Confined to the agent scheduler thread.
 */
@Slf4j
public class LeaderboardAggregator {

    private final SimProperties.Leaderboard config;
    private final LeaderboardRepository repository;
    private final Deque<LeaderboardDelta> buffer = new ArrayDeque<>();
    private Instant lastFlushAt;

    private final Counter merged;
    private final Counter failures;
    private final Counter dropped;

    public LeaderboardAggregator(
            @NonNull SimProperties.Leaderboard config,
            @NonNull LeaderboardRepository repository,
            @NonNull Clock clock,
            @NonNull MeterRegistry meterRegistry
    ) {
        this.config = config;
        this.repository = repository;
        this.lastFlushAt = clock.instant();

        this.merged = Counter.builder("sim.leaderboard.merged").register(meterRegistry);
        this.failures = Counter.builder("sim.leaderboard.write.failures").register(meterRegistry);
        this.dropped = Counter.builder("sim.leaderboard.dropped").register(meterRegistry);
    }

    public void record(@NonNull LeaderboardDelta delta) {
        buffer.addLast(delta);
        trimToCap();
    }

    public int pendingCount() {
        return buffer.size();
    }

    /**
     * Writes up to one batch when the flush interval has elapsed or enough deltas are waiting.
     */
    public void flushIfDue(@NonNull Instant now) {
        if (buffer.isEmpty()) {
            return;
        }
        boolean intervalElapsed = !now.isBefore(lastFlushAt.plusMillis(config.flushIntervalMillis()));
        if (!intervalElapsed && buffer.size() < config.flushThreshold()) {
            return;
        }
        lastFlushAt = now;

        List<LeaderboardDelta> batch = new ArrayList<>();
        while (!buffer.isEmpty() && batch.size() < config.batchSize()) {
            batch.add(buffer.pollFirst());
        }
        Instant weekStart = LeaderboardRow.weekStartOf(now);
        List<LeaderboardDelta> failed = new ArrayList<>();
        int written = 0;
        for (LeaderboardDelta delta : batch) {
            Optional<LeaderboardRow> existing;
            try {
                existing = repository.find(delta.identity(), weekStart);
            } catch (StoreException e) {
                // nothing was written yet, safe to retry on the next flush
                failures.increment();
                log.warn("leaderboard read for {} failed, requeueing: {}", delta.identity(), e.getMessage());
                failed.add(delta);
                continue;
            }
            try {
                write(existing, delta, weekStart, now);
                merged.increment();
                written++;
            } catch (StoreException | ArithmeticException e) {
                // the write may have landed, a retry could apply the delta twice
                failures.increment();
                dropped.increment();
                log.warn("leaderboard write for {} failed, dropping delta {}: {}",
                        delta.identity(), delta.pnlDelta(), e.getMessage());
            }
        }
        if (!failed.isEmpty()) {
            for (int i = failed.size() - 1; i >= 0; i--) {
                buffer.addFirst(failed.get(i));
            }
            trimToCap();
        }
        log.debug("leaderboard flush: {} written, {} requeued, {} pending", written, failed.size(), buffer.size());
    }

    private void write(Optional<LeaderboardRow> existing, LeaderboardDelta delta, Instant weekStart, Instant now) {
        if (existing.isPresent()) {
            repository.update(existing.get().merge(delta, now));
        } else {
            repository.insert(LeaderboardRow.first(delta, weekStart, now));
        }
    }

    private void trimToCap() {
        int over = 0;
        while (buffer.size() > config.bufferCap()) {
            buffer.pollFirst();
            over++;
        }
        if (over > 0) {
            dropped.increment(over);
            log.warn("leaderboard buffer over cap {}, dropped {} oldest deltas", config.bufferCap(), over);
        }
    }
}
