package com.intentregistry.registryapi.config;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.registryapi.registry.RegistrySettings;
import java.math.BigInteger;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Initial registry configuration; only read the first time the store is empty. */
@Component
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {
  private String owner;
  private String controller = Address.ZERO.value();
  private String keeper = Address.ZERO.value();
  private int feeBps = 0;
  private BigInteger minAmount = BigInteger.ONE;
  private BigInteger maxAmount = BigInteger.TEN.pow(30);
  private boolean paused = false;
  private Store store = new Store();

  public String getOwner() {
    return owner;
  }

  public void setOwner(String owner) {
    this.owner = owner;
  }

  public String getController() {
    return controller;
  }

  public void setController(String controller) {
    this.controller = controller;
  }

  public String getKeeper() {
    return keeper;
  }

  public void setKeeper(String keeper) {
    this.keeper = keeper;
  }

  public int getFeeBps() {
    return feeBps;
  }

  public void setFeeBps(int feeBps) {
    this.feeBps = feeBps;
  }

  public BigInteger getMinAmount() {
    return minAmount;
  }

  public void setMinAmount(BigInteger minAmount) {
    this.minAmount = minAmount;
  }

  public BigInteger getMaxAmount() {
    return maxAmount;
  }

  public void setMaxAmount(BigInteger maxAmount) {
    this.maxAmount = maxAmount;
  }

  public boolean isPaused() {
    return paused;
  }

  public void setPaused(boolean paused) {
    this.paused = paused;
  }

  public Store getStore() {
    return store;
  }

  public void setStore(Store store) {
    this.store = store;
  }

  public RegistrySettings toInitialSettings() {
    if (owner == null || owner.isBlank()) {
      throw new IllegalStateException("registry.owner must be configured");
    }
    return RegistrySettings.initial(
        Address.of(owner),
        Address.of(controller),
        Address.of(keeper),
        paused,
        feeBps,
        minAmount,
        maxAmount);
  }

  public static class Store {
    private String type = "memory";
    private Jdbc jdbc = new Jdbc();

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public Jdbc getJdbc() {
      return jdbc;
    }

    public void setJdbc(Jdbc jdbc) {
      this.jdbc = jdbc;
    }
  }

  public static class Jdbc {
    private String url = "jdbc:postgresql://localhost:5432/registry";
    private String username = "registry";
    private String password = "registry";

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }
  }
}
