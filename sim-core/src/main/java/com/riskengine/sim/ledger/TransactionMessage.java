package com.riskengine.sim.ledger;

import lombok.NonNull;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Legacy-format transaction message: header, ordered account keys, recent blockhash, compiled instructions.
 * <p>
 * Account ordering: fee payer first, then writable signers, read-only signers, writable non-signers,
 * read-only non-signers. Program ids are read-only non-signers.
 */
public final class TransactionMessage {

  private final List<LedgerPublicKey> accountKeys;
  private final int requiredSignatures;
  private final int readonlySigned;
  private final int readonlyUnsigned;
  private final byte[] serialized;

  private TransactionMessage(
      List<LedgerPublicKey> accountKeys,
      int requiredSignatures,
      int readonlySigned,
      int readonlyUnsigned,
      byte[] serialized
  ) {
    this.accountKeys = accountKeys;
    this.requiredSignatures = requiredSignatures;
    this.readonlySigned = readonlySigned;
    this.readonlyUnsigned = readonlyUnsigned;
    this.serialized = serialized;
  }

  public static TransactionMessage compile(
      @NonNull LedgerPublicKey feePayer,
      @NonNull String recentBlockhash,
      @NonNull List<LedgerInstruction> instructions
  ) {
    if (instructions.isEmpty()) {
      throw new IllegalArgumentException("transaction needs at least one instruction");
    }
    byte[] blockhash = Base58.decode(recentBlockhash);
    if (blockhash.length != 32) {
      throw new IllegalArgumentException("Expected 32-byte blockhash, got len=" + blockhash.length);
    }

    Map<LedgerPublicKey, Flags> flagsByKey = new LinkedHashMap<>();
    flagsByKey.put(feePayer, new Flags(true, true));
    for (LedgerInstruction ix : instructions) {
      for (AccountMeta meta : ix.accounts()) {
        flagsByKey.merge(meta.pubkey(), new Flags(meta.signer(), meta.writable()), Flags::or);
      }
      flagsByKey.merge(ix.programId(), new Flags(false, false), Flags::or);
    }

    List<LedgerPublicKey> keys = new ArrayList<>(flagsByKey.size());
    keys.add(feePayer);
    addMatching(keys, flagsByKey, feePayer, true, true);
    addMatching(keys, flagsByKey, feePayer, true, false);
    addMatching(keys, flagsByKey, feePayer, false, true);
    addMatching(keys, flagsByKey, feePayer, false, false);

    int required = 0;
    int readonlySigned = 0;
    int readonlyUnsigned = 0;
    for (LedgerPublicKey key : keys) {
      Flags f = flagsByKey.get(key);
      if (f.signer()) {
        required++;
        if (!f.writable()) readonlySigned++;
      } else if (!f.writable()) {
        readonlyUnsigned++;
      }
    }
    if (required > 255 || keys.size() > 255) {
      throw new IllegalArgumentException("too many accounts in transaction: " + keys.size());
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(required);
    out.write(readonlySigned);
    out.write(readonlyUnsigned);
    writeCompactU16(out, keys.size());
    for (LedgerPublicKey key : keys) {
      out.writeBytes(key.toBytes());
    }
    out.writeBytes(blockhash);
    writeCompactU16(out, instructions.size());
    for (LedgerInstruction ix : instructions) {
      out.write(keys.indexOf(ix.programId()));
      writeCompactU16(out, ix.accounts().size());
      for (AccountMeta meta : ix.accounts()) {
        out.write(keys.indexOf(meta.pubkey()));
      }
      byte[] data = ix.data();
      writeCompactU16(out, data.length);
      out.writeBytes(data);
    }

    return new TransactionMessage(List.copyOf(keys), required, readonlySigned, readonlyUnsigned, out.toByteArray());
  }

  /**
   * Signs the message with every required signer and returns the wire-format transaction.
   * Signers may be given in any order; each required signer key must be covered.
   */
  public SignedTransaction sign(@NonNull List<LedgerKeypair> signers) {
    List<byte[]> signatures = new ArrayList<>(requiredSignatures);
    for (int i = 0; i < requiredSignatures; i++) {
      LedgerPublicKey required = accountKeys.get(i);
      LedgerKeypair keypair = signers.stream()
          .filter(Objects::nonNull)
          .filter(k -> k.publicKey().equals(required))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("missing signer " + required));
      signatures.add(keypair.sign(serialized));
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeCompactU16(out, signatures.size());
    for (byte[] sig : signatures) {
      out.writeBytes(sig);
    }
    out.writeBytes(serialized);
    return new SignedTransaction(Base58.encode(signatures.get(0)), out.toByteArray());
  }

  public List<LedgerPublicKey> accountKeys() {
    return accountKeys;
  }

  public int requiredSignatures() {
    return requiredSignatures;
  }

  public int readonlySigned() {
    return readonlySigned;
  }

  public int readonlyUnsigned() {
    return readonlyUnsigned;
  }

  public byte[] serialize() {
    return serialized.clone();
  }

  static void writeCompactU16(ByteArrayOutputStream out, int value) {
    int rem = value;
    while (true) {
      int elem = rem & 0x7f;
      rem >>>= 7;
      if (rem == 0) {
        out.write(elem);
        return;
      }
      out.write(elem | 0x80);
    }
  }

  private static void addMatching(
      List<LedgerPublicKey> keys,
      Map<LedgerPublicKey, Flags> flagsByKey,
      LedgerPublicKey feePayer,
      boolean signer,
      boolean writable
  ) {
    for (Map.Entry<LedgerPublicKey, Flags> e : flagsByKey.entrySet()) {
      if (e.getKey().equals(feePayer)) continue;
      if (e.getValue().signer() == signer && e.getValue().writable() == writable) {
        keys.add(e.getKey());
      }
    }
  }

  private record Flags(boolean signer, boolean writable) {
    Flags or(Flags other) {
      return new Flags(signer || other.signer, writable || other.writable);
    }
  }

  /**
   * Wire bytes plus the transaction id (base58 of the fee payer's signature).
   */
  public record SignedTransaction(String signature, byte[] wire) {
  }
}
