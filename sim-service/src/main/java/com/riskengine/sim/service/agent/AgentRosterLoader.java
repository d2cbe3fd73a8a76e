package com.riskengine.sim.service.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.ledger.LedgerKeypair;
import com.riskengine.sim.ledger.LedgerPublicKey;
import com.riskengine.sim.service.agent.strategy.StrategyType;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the fleet from the roster document: either {@code {"bots": [...]}} or a bare array of entries
 * {@code {botId, type, market, publicKey, secretKey, collateralAccount?}}.
 */
@Slf4j
@RequiredArgsConstructor
public class AgentRosterLoader {

    private final @NonNull ObjectMapper objectMapper;

    public AgentRoster load(@NonNull SimProperties.Agents config) {
        String inline = config.rosterJson();
        if (inline != null && !inline.isBlank()) {
            AgentRoster roster = parse(inline);
            log.info("loaded {} agents from inline roster", roster.size());
            return roster;
        }
        String file = config.rosterFile();
        if (file != null && !file.isBlank()) {
            Path path = Path.of(file);
            if (!Files.isRegularFile(path)) {
                log.warn("agent roster file {} not found, running without agents", path);
                return new AgentRoster(List.of());
            }
            try {
                AgentRoster roster = parse(Files.readString(path));
                log.info("loaded {} agents from {}", roster.size(), path);
                return roster;
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read agent roster " + path, e);
            }
        }
        log.warn("no agent roster configured (sim.agents.roster-json / sim.agents.roster-file)");
        return new AgentRoster(List.of());
    }

    public AgentRoster parse(@NonNull String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("agent roster is not valid JSON", e);
        }
        JsonNode entries = root.isArray() ? root : root.path("bots");
        if (!entries.isArray()) {
            throw new IllegalArgumentException("agent roster must be an array or an object with a 'bots' array");
        }
        List<Agent> agents = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            agents.add(toAgent(entry));
        }
        return new AgentRoster(agents);
    }

    static Agent toAgent(JsonNode entry) {
        String botId = requiredText(entry, "botId");
        StrategyType type = StrategyType.fromId(requiredText(entry, "type"));
        String market = requiredText(entry, "market");
        LedgerKeypair keypair = LedgerKeypair.fromJson(entry.path("secretKey"));

        String declared = entry.path("publicKey").asText("");
        if (!declared.isBlank() && !keypair.publicKey().equals(LedgerPublicKey.fromBase58(declared))) {
            throw new IllegalArgumentException("agent " + botId + ": publicKey does not match secretKey");
        }
        String collateral = entry.path("collateralAccount").asText("");
        LedgerPublicKey collateralAccount = collateral.isBlank() ? null : LedgerPublicKey.fromBase58(collateral);
        return new Agent(botId, type, market, keypair, collateralAccount, displayName(type, botId));
    }

    /**
     * "TrendBot #3" for {@code trend_follower_3}.
     */
    static String displayName(StrategyType type, String botId) {
        String suffix = botId.substring(botId.lastIndexOf('_') + 1);
        if (suffix.isEmpty()) {
            suffix = "1";
        }
        return type.displayPrefix() + " #" + suffix;
    }

    private static String requiredText(JsonNode entry, String field) {
        String value = entry.path(field).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException("agent roster entry missing '" + field + "'");
        }
        return value;
    }
}
