package com.agenthums.backend.auth.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

record PkceCodes(String verifier, String challenge) {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  static PkceCodes generate() {
    byte[] bytes = new byte[48];
    RANDOM.nextBytes(bytes);
    String verifier = ENCODER.encodeToString(bytes);
    return new PkceCodes(verifier, challengeFor(verifier));
  }

  static String challengeFor(String verifier) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return ENCODER.encodeToString(digest.digest(verifier.getBytes(StandardCharsets.US_ASCII)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }
}
