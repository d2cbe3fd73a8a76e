package com.riskengine.sim.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerKeypairTest {

  @Test
  void signatureVerifiesAgainstPublicKey() {
    LedgerKeypair keypair = TestKeys.keypair(7);
    byte[] message = "push 148.25".getBytes(StandardCharsets.UTF_8);

    byte[] signature = keypair.sign(message);

    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(keypair.publicKey().toBytes(), 0));
    verifier.update(message, 0, message.length);
    assertThat(signature).hasSize(64);
    assertThat(verifier.verifySignature(signature)).isTrue();
  }

  @Test
  void secretKeyFormsAgree() throws Exception {
    LedgerKeypair original = TestKeys.keypair(9);
    byte[] secret = secretKey(original, 9);

    assertThat(LedgerKeypair.fromBase58(Base58.encode(secret)).publicKey()).isEqualTo(original.publicKey());

    StringBuilder json = new StringBuilder("[");
    for (int i = 0; i < secret.length; i++) {
      json.append(i == 0 ? "" : ",").append(secret[i] & 0xFF);
    }
    json.append("]");
    LedgerKeypair fromJson = LedgerKeypair.fromJson(new ObjectMapper().readTree(json.toString()));
    assertThat(fromJson.publicKey()).isEqualTo(original.publicKey());
  }

  @Test
  void rejectsSecretKeyWithForeignPublicHalf() {
    byte[] secret = secretKey(TestKeys.keypair(1), 1);
    System.arraycopy(TestKeys.keypair(2).publicKey().toBytes(), 0, secret, 32, 32);

    assertThatThrownBy(() -> LedgerKeypair.fromSecretKey(secret))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not match");
  }

  private static byte[] secretKey(LedgerKeypair keypair, int seedFill) {
    byte[] secret = new byte[64];
    java.util.Arrays.fill(secret, 0, 32, (byte) seedFill);
    System.arraycopy(keypair.publicKey().toBytes(), 0, secret, 32, 32);
    return secret;
  }
}
