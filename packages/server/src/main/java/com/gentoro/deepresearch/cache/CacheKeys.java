package com.gentoro.deepresearch.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds deterministic cache keys of the form {@code namespace:md5hex}. The input is lower-cased
 * and trimmed first so that logically identical requests collide.
 */
public final class CacheKeys {

  private CacheKeys() {}

  public static String generate(String namespace, String input) {
    Objects.requireNonNull(namespace, "namespace");
    String normalized = input == null ? "" : input.trim().toLowerCase(Locale.ROOT);
    return namespace + ":" + md5Hex(normalized);
  }

  private static String md5Hex(String value) {
    try {
      MessageDigest md = MessageDigest.getInstance("MD5");
      byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(digest.length * 2);
      for (byte b : digest) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      // Every JRE is required to ship MD5.
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
