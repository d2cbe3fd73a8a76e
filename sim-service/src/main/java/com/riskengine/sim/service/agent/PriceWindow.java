package com.riskengine.sim.service.agent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Rolling window of observed prices, oldest first. Not thread-safe; owned by the scheduler thread.
 */
public class PriceWindow {

    public record Sample(double price, Instant ts) {
    }

    private final Deque<Sample> samples = new ArrayDeque<>();

    public void append(double price, Instant ts) {
        samples.addLast(new Sample(price, ts));
    }

    /**
     * Drops samples observed before {@code cutoff}.
     */
    public void prune(Instant cutoff) {
        while (!samples.isEmpty() && samples.peekFirst().ts().isBefore(cutoff)) {
            samples.pollFirst();
        }
    }

    public int size() {
        return samples.size();
    }

    public Optional<Sample> oldestSince(Instant from) {
        return samples.stream().filter(s -> !s.ts().isBefore(from)).findFirst();
    }

    public List<Sample> since(Instant from) {
        return samples.stream().filter(s -> !s.ts().isBefore(from)).toList();
    }

    public Optional<Instant> oldestTimestamp() {
        return Optional.ofNullable(samples.peekFirst()).map(Sample::ts);
    }

    public List<Sample> snapshot() {
        return List.copyOf(samples);
    }
}
