package com.intentregistry.registryapi.treasury;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.treasury.TransferResult;
import com.intentregistry.domain.treasury.ValueTransfer;
import java.math.BigInteger;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stand-in transfer used until a real payout rail is wired in; always succeeds. */
public class LoggingValueTransfer implements ValueTransfer {
  private static final Logger log = LoggerFactory.getLogger(LoggingValueTransfer.class);

  @Override
  public TransferResult transfer(Address to, BigInteger amount) {
    String reference = UUID.randomUUID().toString();
    log.info("Value transfer to={} amount={} reference={}", to, amount, reference);
    return TransferResult.succeeded(reference);
  }
}
