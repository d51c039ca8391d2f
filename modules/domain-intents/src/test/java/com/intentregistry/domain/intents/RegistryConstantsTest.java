package com.intentregistry.domain.intents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class RegistryConstantsTest {
  @Test
  void shouldComputeFeeWithFloorDivision() {
    BigInteger amount = BigInteger.TEN.pow(15);
    assertEquals(
        new BigInteger("2500000000000"), RegistryConstants.requiredFee(amount, 25));
    assertEquals(BigInteger.ZERO, RegistryConstants.requiredFee(BigInteger.valueOf(399), 25));
    assertEquals(BigInteger.ONE, RegistryConstants.requiredFee(BigInteger.valueOf(400), 25));
  }

  @Test
  void shouldComputeBasisPoints() {
    assertEquals(5_000L, RegistryConstants.toBps(BigInteger.ONE, BigInteger.TWO));
    assertEquals(0L, RegistryConstants.toBps(BigInteger.ONE, BigInteger.ZERO));
  }

  @Test
  void shouldMapEveryCodeToItsCategorySubclass() {
    assertInstanceOf(
        RegistryCapacityException.class,
        RegistryException.of(RegistryErrorCode.BULK_QUERY_TOO_LARGE, "too many"));
    assertInstanceOf(
        RegistryAuthorizationException.class,
        RegistryException.of(RegistryErrorCode.NOT_KEEPER, "nope"));
    for (RegistryErrorCode code : RegistryErrorCode.values()) {
      assertEquals(code.category(), RegistryException.of(code, "x").category());
    }
  }
}
