package com.intentregistry.registryapi.api;

import com.intentregistry.registryapi.intents.SubmitIntentCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

/** {@code side} is 1 for buy and 2 for sell; {@code fee} is paid into the treasury. */
public record SubmitIntentRequest(
    @NotNull Integer side,
    @NotNull @PositiveOrZero BigInteger amount,
    @PositiveOrZero BigInteger limitPrice,
    @NotBlank String symbol,
    @PositiveOrZero BigInteger fee) {

  SubmitIntentCommand toCommand() {
    return new SubmitIntentCommand(side, amount, limitPrice, RequestValues.symbol(symbol));
  }
}
