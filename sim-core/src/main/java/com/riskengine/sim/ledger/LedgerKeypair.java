package com.riskengine.sim.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Arrays;

/**
 * Ed25519 signing identity. The 64-byte secret form is {@code seed(32) || publicKey(32)}.
 */
public final class LedgerKeypair {

  private final Ed25519PrivateKeyParameters privateKey;
  private final LedgerPublicKey publicKey;

  private LedgerKeypair(Ed25519PrivateKeyParameters privateKey) {
    this.privateKey = privateKey;
    this.publicKey = LedgerPublicKey.of(privateKey.generatePublicKey().getEncoded());
  }

  public static LedgerKeypair fromSeed(byte[] seed) {
    if (seed.length != 32) {
      throw new IllegalArgumentException("Expected 32-byte seed, got len=" + seed.length);
    }
    return new LedgerKeypair(new Ed25519PrivateKeyParameters(seed, 0));
  }

  /**
   * Accepts the 64-byte secret form; the trailing public key must match the seed.
   */
  public static LedgerKeypair fromSecretKey(byte[] secretKey) {
    if (secretKey.length != 64) {
      throw new IllegalArgumentException("Expected 64-byte secret key, got len=" + secretKey.length);
    }
    LedgerKeypair keypair = fromSeed(Arrays.copyOfRange(secretKey, 0, 32));
    if (!keypair.publicKey.matches(secretKey, 32)) {
      throw new IllegalArgumentException("Secret key public half does not match its seed");
    }
    return keypair;
  }

  public static LedgerKeypair fromBase58(@NonNull String secretKeyBase58) {
    return fromSecretKey(Base58.decode(secretKeyBase58.trim()));
  }

  /**
   * Secret key given either as a JSON byte array ({@code [12, 200, ...]}) or a base58 string.
   */
  public static LedgerKeypair fromJson(@NonNull JsonNode node) {
    if (node.isTextual()) {
      return fromBase58(node.asText());
    }
    if (!node.isArray()) {
      throw new IllegalArgumentException("secret key must be a byte array or base58 string");
    }
    byte[] secret = new byte[node.size()];
    for (int i = 0; i < node.size(); i++) {
      int b = node.get(i).asInt();
      if (b < 0 || b > 255) {
        throw new IllegalArgumentException("secret key byte out of range at index " + i + ": " + b);
      }
      secret[i] = (byte) b;
    }
    return fromSecretKey(secret);
  }

  public LedgerPublicKey publicKey() {
    return publicKey;
  }

  public byte[] sign(byte[] message) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKey);
    signer.update(message, 0, message.length);
    return signer.generateSignature();
  }

  @Override
  public String toString() {
    return "LedgerKeypair(" + publicKey + ")";
  }
}
