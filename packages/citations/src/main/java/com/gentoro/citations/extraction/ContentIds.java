package com.gentoro.citations.extraction;

import com.gentoro.citations.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Content-addressed identifiers: the first 16 hex characters of the SHA-256 of the text. */
public final class ContentIds {
  private static final int LENGTH = 16;

  private ContentIds() {}

  public static String of(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.substring(0, LENGTH);
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 algorithm not available", e);
    }
  }
}
