package com.intentregistry.domain.intents;

import java.math.BigInteger;

/** Limits and codes shared with integrators. */
public final class RegistryConstants {
  public static final int FEE_DENOMINATOR = 10_000;
  public static final int MAX_FEE_BPS = FEE_DENOMINATOR;
  public static final int SIDE_BUY = 1;
  public static final int SIDE_SELL = 2;
  public static final int MAX_INTENTS = 10_000;
  public static final int MAX_BULK_QUERY = 200;

  private static final BigInteger DENOMINATOR = BigInteger.valueOf(FEE_DENOMINATOR);

  private RegistryConstants() {}

  /** Fee owed for {@code amount} at {@code feeBps}, rounded down. */
  public static BigInteger requiredFee(BigInteger amount, int feeBps) {
    return amount.multiply(BigInteger.valueOf(feeBps)).divide(DENOMINATOR);
  }

  /** {@code numerator / denominator} in basis points, 0 when the denominator is 0. */
  public static long toBps(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) {
      return 0L;
    }
    return numerator.multiply(DENOMINATOR).divide(denominator).longValueExact();
  }
}
