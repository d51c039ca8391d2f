package com.intentregistry.domain.intents;

import java.util.Locale;
import java.util.regex.Pattern;

/** A 20-byte account identity rendered as {@code 0x}-prefixed lower-case hex. */
public record Address(String value) {
  private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

  public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

  public Address {
    if (value == null) {
      throw new RegistryValidationException(
          RegistryErrorCode.INVALID_ADDRESS, "address must not be null");
    }
    value = value.trim().toLowerCase(Locale.ROOT);
    if (!HEX_ADDRESS.matcher(value).matches()) {
      throw new RegistryValidationException(
          RegistryErrorCode.INVALID_ADDRESS, "Malformed address: " + value);
    }
  }

  public static Address of(String value) {
    return new Address(value);
  }

  public boolean isZero() {
    return ZERO.equals(this);
  }

  @Override
  public String toString() {
    return value;
  }
}
