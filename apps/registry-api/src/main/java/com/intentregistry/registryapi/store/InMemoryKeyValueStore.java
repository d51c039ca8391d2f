package com.intentregistry.registryapi.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class InMemoryKeyValueStore implements KeyValueStore {
  private final Map<String, String> entries = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  public Optional<String> get(String key) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(entries.get(key));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void putAll(Map<String, String> updates) {
    if (updates.isEmpty()) {
      return;
    }
    lock.writeLock().lock();
    try {
      entries.putAll(updates);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return entries.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
