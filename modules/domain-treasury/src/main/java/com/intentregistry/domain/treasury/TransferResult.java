package com.intentregistry.domain.treasury;

public record TransferResult(boolean success, String reference, String failureReason) {
  public static TransferResult succeeded(String reference) {
    return new TransferResult(true, reference, null);
  }

  public static TransferResult failed(String failureReason) {
    return new TransferResult(false, null, failureReason);
  }
}
