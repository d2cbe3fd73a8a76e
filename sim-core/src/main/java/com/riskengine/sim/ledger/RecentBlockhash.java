package com.riskengine.sim.ledger;

public record RecentBlockhash(String blockhash, long lastValidBlockHeight) {
}
