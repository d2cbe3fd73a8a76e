package com.riskengine.sim.service.web;

import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.service.agent.AgentScheduler;
import com.riskengine.sim.service.feed.PriceFeed;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
public class HealthController {

    static final String OK = "ok";
    static final String DEGRADED = "degraded";

    private final PriceFeed feed;
    private final AgentScheduler agents;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(@NonNull PriceFeed feed, @NonNull AgentScheduler agents, @NonNull Clock clock) {
        this.feed = feed;
        this.agents = agents;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping({"/health", "/"})
    public ResponseEntity<HealthReport> health() {
        Instant now = clock.instant();
        Map<String, Double> lastPrices = new LinkedHashMap<>();
        for (Map.Entry<String, ReferencePrice> e : feed.latestPrices().entrySet()) {
            lastPrices.put(e.getKey(), e.getValue().adjustedPrice());
        }
        String status = isHealthy(now) ? OK : DEGRADED;
        HealthReport report = new HealthReport(
                status,
                Duration.between(startedAt, now).toSeconds(),
                new HealthReport.Feed(feed.isRunning(), lastPrices),
                new HealthReport.Agents(agents.isRunning(), agents.agentCount()),
                now.toString()
        );
        if (!OK.equals(status)) {
            log.debug("health degraded (feedRunning={}, lastPriceAt={})", feed.isRunning(), feed.lastPriceAt().orElse(null));
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(report);
        }
        return ResponseEntity.ok(report);
    }

    private boolean isHealthy(Instant now) {
        if (!feed.isRunning()) {
            return false;
        }
        Duration staleness = feed.staleness();
        Optional<Instant> lastPriceAt = feed.lastPriceAt();
        // a fresh feed gets one staleness window to publish its first prices
        Instant reference = lastPriceAt.orElse(feed.createdAt());
        return Duration.between(reference, now).compareTo(staleness) <= 0;
    }
}
