package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.SymbolHash;
import org.springframework.security.oauth2.jwt.Jwt;

final class RequestValues {
  private RequestValues() {}

  /** The authenticated caller: the token subject, read as an address. */
  static Address caller(Jwt jwt) {
    return Address.of(jwt.getSubject());
  }

  /** Accepts either a {@code 0x}-prefixed 32-byte hash or a plain ticker such as {@code ETH}. */
  static SymbolHash symbol(String value) {
    if (value != null && value.trim().startsWith("0x")) {
      return SymbolHash.fromHex(value);
    }
    return SymbolHash.ofTicker(value);
  }
}
