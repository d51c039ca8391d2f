package com.intentregistry.registryapi.store;

import java.util.ArrayList;
import java.util.List;

/**
 * A list of ids laid out as a length slot plus one slot per position. Entries are only ever
 * appended.
 */
public final class AppendOnlyIndex {
  private final String name;

  private AppendOnlyIndex(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("index name must not be blank");
    }
    this.name = name;
  }

  public static AppendOnlyIndex named(String name) {
    return new AppendOnlyIndex(name);
  }

  public long length(KeyValueTransaction tx) {
    return tx.readLong(lengthKey());
  }

  public void append(KeyValueTransaction tx, long id) {
    long length = length(tx);
    tx.writeLong(slotKey(length), id);
    tx.writeLong(lengthKey(), length + 1);
  }

  /** Value at {@code position}, or 0 when the position is out of range. */
  public long get(KeyValueTransaction tx, long position) {
    if (position < 0 || position >= length(tx)) {
      return 0L;
    }
    return tx.readLong(slotKey(position));
  }

  public List<Long> all(KeyValueTransaction tx) {
    long length = length(tx);
    return collect(tx, 0, length - 1);
  }

  /**
   * Inclusive slice {@code [from, to]}. {@code to} is clamped to the last position; the slice is
   * empty when {@code from} is out of range or greater than {@code to}.
   */
  public List<Long> slice(KeyValueTransaction tx, long from, long to) {
    long length = length(tx);
    if (from < 0 || from >= length || from > to) {
      return List.of();
    }
    return collect(tx, from, Math.min(to, length - 1));
  }

  /** The last {@code count} values, newest first. */
  public List<Long> latest(KeyValueTransaction tx, long count) {
    long length = length(tx);
    long take = Math.min(Math.max(count, 0L), length);
    List<Long> values = new ArrayList<>();
    for (long position = length - 1; position >= length - take; position--) {
      values.add(tx.readLong(slotKey(position)));
    }
    return values;
  }

  private List<Long> collect(KeyValueTransaction tx, long from, long to) {
    List<Long> values = new ArrayList<>();
    for (long position = from; position <= to; position++) {
      values.add(tx.readLong(slotKey(position)));
    }
    return values;
  }

  private String lengthKey() {
    return "idx:" + name + ":length";
  }

  private String slotKey(long position) {
    return "idx:" + name + ":" + position;
  }
}
