package com.riskengine.sim.ledger;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The subset of the ledger's JSON-RPC surface this service uses.
 */
public interface LedgerClient {

  RecentBlockhash latestBlockhash() throws IOException;

  /**
   * Submits a signed wire transaction (preflight skipped) and returns its signature.
   */
  String sendTransaction(byte[] wireTransaction) throws IOException;

  Optional<SignatureStatus> signatureStatus(String signature) throws IOException;

  long blockHeight() throws IOException;

  Optional<byte[]> accountData(LedgerPublicKey account) throws IOException;

  long slot() throws IOException;

  OptionalLong blockTime(long slot) throws IOException;
}
