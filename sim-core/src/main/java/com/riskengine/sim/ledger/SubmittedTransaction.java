package com.riskengine.sim.ledger;

/**
 * A transaction handed to the node, with the block height after which its blockhash is no longer accepted.
 */
public record SubmittedTransaction(String signature, long lastValidBlockHeight) {
}
