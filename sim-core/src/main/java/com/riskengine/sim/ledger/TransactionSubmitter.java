package com.riskengine.sim.ledger;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiles, signs and sends transactions, then polls the node until they confirm, fail or expire.
 */
@Slf4j
public class TransactionSubmitter {

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
  public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(60);

  private final LedgerClient client;
  private final Sleeper sleeper;
  private final long pollIntervalMillis;
  private final int maxPolls;

  public TransactionSubmitter(@NonNull LedgerClient client) {
    this(client, Sleeper.THREAD, DEFAULT_POLL_INTERVAL, DEFAULT_CONFIRM_TIMEOUT);
  }

  public TransactionSubmitter(
      @NonNull LedgerClient client,
      @NonNull Sleeper sleeper,
      @NonNull Duration pollInterval,
      @NonNull Duration confirmTimeout
  ) {
    this.client = client;
    this.sleeper = sleeper;
    this.pollIntervalMillis = Math.max(1L, pollInterval.toMillis());
    this.maxPolls = (int) Math.max(1L, confirmTimeout.toMillis() / pollIntervalMillis);
  }

  /**
   * Builds a transaction with a fresh blockhash and sends it without waiting for confirmation.
   * The fee payer signs first; any further signers are matched against the compiled signer set.
   */
  public SubmittedTransaction submit(
      @NonNull List<LedgerInstruction> instructions,
      @NonNull ComputeBudget budget,
      @NonNull LedgerKeypair feePayer,
      @NonNull List<LedgerKeypair> signers
  ) throws IOException {
    List<LedgerInstruction> all = new ArrayList<>(instructions.size() + 2);
    all.add(LedgerInstructions.computeUnitLimit(budget.unitLimit()));
    all.add(LedgerInstructions.computeUnitPrice(budget.microLamportsPerUnit()));
    all.addAll(instructions);

    List<LedgerKeypair> allSigners = new ArrayList<>(signers.size() + 1);
    allSigners.add(feePayer);
    allSigners.addAll(signers);

    RecentBlockhash blockhash = client.latestBlockhash();
    TransactionMessage message = TransactionMessage.compile(feePayer.publicKey(), blockhash.blockhash(), all);
    TransactionMessage.SignedTransaction signed = message.sign(allSigners);

    String returned = client.sendTransaction(signed.wire());
    if (!signed.signature().equals(returned)) {
      log.warn("node returned signature {} for locally signed {}", returned, signed.signature());
    }
    log.debug("tx sent (sig={}, lastValidBlockHeight={})", signed.signature(), blockhash.lastValidBlockHeight());
    return new SubmittedTransaction(signed.signature(), blockhash.lastValidBlockHeight());
  }

  /**
   * Polls until the transaction reaches confirmed commitment.
   *
   * @throws TransactionFailedException  the transaction landed with an error
   * @throws TransactionExpiredException the blockhash window lapsed or the poll budget ran out first
   */
  public void awaitConfirmation(@NonNull SubmittedTransaction tx) throws IOException {
    for (int i = 0; i < maxPolls; i++) {
      Optional<SignatureStatus> status = client.signatureStatus(tx.signature());
      if (status.isPresent()) {
        SignatureStatus s = status.get();
        if (s.isFailed()) {
          throw new TransactionFailedException(tx.signature(), s.error());
        }
        if (s.isConfirmed()) {
          return;
        }
      }
      if (isBlockhashExpired(tx)) {
        throw new TransactionExpiredException(tx.signature(), "blockhash expired before confirmation");
      }
      pause();
    }
    throw new TransactionExpiredException(tx.signature(),
        "not confirmed after " + Duration.ofMillis(pollIntervalMillis * maxPolls));
  }

  public Optional<SignatureStatus> status(@NonNull String signature) throws IOException {
    return client.signatureStatus(signature);
  }

  /**
   * True once the node's block height is past the transaction's last valid height; it can no longer land.
   */
  public boolean isBlockhashExpired(@NonNull SubmittedTransaction tx) throws IOException {
    return client.blockHeight() > tx.lastValidBlockHeight();
  }

  /**
   * Submit and confirm in one call. No retry.
   */
  public String sendAndConfirm(
      @NonNull List<LedgerInstruction> instructions,
      @NonNull ComputeBudget budget,
      @NonNull LedgerKeypair feePayer,
      @NonNull List<LedgerKeypair> signers
  ) throws IOException {
    SubmittedTransaction tx = submit(instructions, budget, feePayer, signers);
    awaitConfirmation(tx);
    return tx.signature();
  }

  private void pause() throws IOException {
    try {
      sleeper.sleep(pollIntervalMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while awaiting confirmation");
    }
  }
}
