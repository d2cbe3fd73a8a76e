package com.riskengine.sim.ledger;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Bitcoin-alphabet base58, the textual form of ledger keys and signatures.
 */
public final class Base58 {

  private static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
  private static final int[] INDEXES = new int[128];

  static {
    Arrays.fill(INDEXES, -1);
    for (int i = 0; i < ALPHABET.length; i++) {
      INDEXES[ALPHABET[i]] = i;
    }
  }

  private Base58() {
  }

  public static String encode(byte[] input) {
    if (input.length == 0) {
      return "";
    }
    int zeros = 0;
    while (zeros < input.length && input[zeros] == 0) {
      zeros++;
    }
    byte[] digits = Arrays.copyOf(input, input.length);
    char[] encoded = new char[input.length * 2];
    int outputStart = encoded.length;
    for (int inputStart = zeros; inputStart < digits.length; ) {
      encoded[--outputStart] = ALPHABET[divmod(digits, inputStart, 256, 58)];
      if (digits[inputStart] == 0) {
        inputStart++;
      }
    }
    while (outputStart < encoded.length && encoded[outputStart] == ALPHABET[0]) {
      outputStart++;
    }
    while (--zeros >= 0) {
      encoded[--outputStart] = ALPHABET[0];
    }
    return new String(encoded, outputStart, encoded.length - outputStart);
  }

  public static byte[] decode(String input) {
    if (input == null || input.isEmpty()) {
      return new byte[0];
    }
    byte[] input58 = new byte[input.length()];
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      int digit = c < 128 ? INDEXES[c] : -1;
      if (digit < 0) {
        throw new IllegalArgumentException("Invalid base58 character '" + c + "' at position " + i);
      }
      input58[i] = (byte) digit;
    }
    int zeros = 0;
    while (zeros < input58.length && input58[zeros] == 0) {
      zeros++;
    }
    ByteArrayOutputStream reversed = new ByteArrayOutputStream(input.length());
    for (int inputStart = zeros; inputStart < input58.length; ) {
      reversed.write(divmod(input58, inputStart, 58, 256));
      if (input58[inputStart] == 0) {
        inputStart++;
      }
    }
    byte[] tail = reversed.toByteArray();
    int tailLen = tail.length;
    while (tailLen > 0 && tail[tailLen - 1] == 0) {
      tailLen--;
    }
    byte[] out = new byte[zeros + tailLen];
    for (int i = 0; i < tailLen; i++) {
      out[zeros + i] = tail[tailLen - 1 - i];
    }
    return out;
  }

  private static byte divmod(byte[] number, int firstDigit, int base, int divisor) {
    int remainder = 0;
    for (int i = firstDigit; i < number.length; i++) {
      int digit = number[i] & 0xFF;
      int temp = remainder * base + digit;
      number[i] = (byte) (temp / divisor);
      remainder = temp % divisor;
    }
    return (byte) remainder;
  }
}
