package com.intentregistry.domain.intents;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fixed-size (32 byte) symbol identifier. Intents never carry the human readable ticker, only
 * its hash, so two registries agree on a symbol as long as they hash the same ticker.
 */
public record SymbolHash(String value) {
  private static final Pattern HEX_32 = Pattern.compile("^0x[0-9a-f]{64}$");

  public SymbolHash {
    if (value == null) {
      throw new RegistryValidationException(
          RegistryErrorCode.INVALID_SYMBOL, "symbol hash must not be null");
    }
    value = value.trim().toLowerCase(Locale.ROOT);
    if (!HEX_32.matcher(value).matches()) {
      throw new RegistryValidationException(
          RegistryErrorCode.INVALID_SYMBOL, "Malformed symbol hash: " + value);
    }
  }

  public static SymbolHash fromHex(String hex) {
    return new SymbolHash(hex);
  }

  /** SHA-256 of the upper-cased ticker. */
  public static SymbolHash ofTicker(String ticker) {
    if (ticker == null || ticker.isBlank()) {
      throw new RegistryValidationException(
          RegistryErrorCode.INVALID_SYMBOL, "ticker must not be blank");
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash =
          digest.digest(ticker.trim().toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
      return new SymbolHash("0x" + HexFormat.of().formatHex(hash));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
