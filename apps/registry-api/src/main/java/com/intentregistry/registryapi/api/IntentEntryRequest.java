package com.intentregistry.registryapi.api;

import com.intentregistry.registryapi.intents.SubmitIntentCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public record IntentEntryRequest(
    @NotNull Integer side,
    @NotNull @PositiveOrZero BigInteger amount,
    @PositiveOrZero BigInteger limitPrice,
    @NotBlank String symbol) {

  SubmitIntentCommand toCommand() {
    return new SubmitIntentCommand(side, amount, limitPrice, RequestValues.symbol(symbol));
  }
}
