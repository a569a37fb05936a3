package com.acme.amqp.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class Chunks {

  private Chunks() {}

  /**
   * Split a sequence into consecutive chunks of {@code size} elements. Every chunk except the last
   * has exactly {@code size} elements; the last holds the remainder.
   *
   * @throws IllegalArgumentException if {@code size < 1}
   */
  public static <T> List<List<T>> of(Iterable<? extends T> source, int size) {
    Objects.requireNonNull(source, "source");
    if (size < 1) {
      throw new IllegalArgumentException("chunk size must be >= 1 but was " + size);
    }

    List<List<T>> chunks = new ArrayList<>();
    List<T> current = new ArrayList<>(size);
    for (T item : source) {
      current.add(item);
      if (current.size() == size) {
        chunks.add(Collections.unmodifiableList(current));
        current = new ArrayList<>(size);
      }
    }
    if (!current.isEmpty()) {
      chunks.add(Collections.unmodifiableList(current));
    }
    return chunks;
  }
}
