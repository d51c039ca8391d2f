package com.intentregistry.domain.intents;

public enum IntentSide {
  BUY(RegistryConstants.SIDE_BUY),
  SELL(RegistryConstants.SIDE_SELL);

  private final int code;

  IntentSide(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static IntentSide fromCode(int code) {
    for (IntentSide side : values()) {
      if (side.code == code) {
        return side;
      }
    }
    throw new RegistryValidationException(
        RegistryErrorCode.INVALID_SIDE, "Unknown side code " + code + "; expected 1 or 2");
  }
}
