/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdigest.sketches.tdigest;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Centroids kept sorted by mean in a packed array. Bound queries return positions; a position equal
 * to {@link #size()} means "past the end". Means and cumulative counts share the same order, so the
 * rank view is a second binary search over the same array rather than a second structure.
 *
 * <p>Not thread-safe.
 */
class CentroidIndex implements Iterable<Centroid> {
  private static final int INITIAL_CAPACITY = 16;

  private Centroid[] keys;
  private int len;

  CentroidIndex() {
    this.keys = new Centroid[INITIAL_CAPACITY];
    this.len = 0;
  }

  int size() {
    return len;
  }

  boolean isEmpty() {
    return len == 0;
  }

  Centroid get(int idx) {
    if (idx < 0 || idx >= len) {
      throw new IndexOutOfBoundsException("Index " + idx + " out of bounds for size " + len);
    }
    return keys[idx];
  }

  /** Smallest-mean centroid, or null when empty. */
  Centroid min() {
    return len == 0 ? null : keys[0];
  }

  /** Largest-mean centroid, or null when empty. */
  Centroid max() {
    return len == 0 ? null : keys[len - 1];
  }

  /**
   * Inserts a centroid after any centroid with an equal mean.
   *
   * @return the position the centroid now occupies
   */
  int insert(Centroid c) {
    int idx = upperBoundMean(c.mean);
    if (len == keys.length) {
      keys = Arrays.copyOf(keys, keys.length * 2);
    }
    System.arraycopy(keys, idx, keys, idx + 1, len - idx);
    keys[idx] = c;
    len++;
    return idx;
  }

  Centroid remove(int idx) {
    Centroid removed = get(idx);
    System.arraycopy(keys, idx + 1, keys, idx, len - idx - 1);
    keys[--len] = null;
    return removed;
  }

  void clear() {
    Arrays.fill(keys, 0, len, null);
    len = 0;
  }

  /** First position whose mean is {@code >= x}. */
  int lowerBoundMean(double x) {
    int low = 0, high = len;
    while (low < high) {
      int mid = (high + low) >>> 1;
      if (keys[mid].mean < x) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /** First position whose mean is {@code > x}. */
  int upperBoundMean(double x) {
    int low = 0, high = len;
    while (low < high) {
      int mid = (high + low) >>> 1;
      if (keys[mid].mean <= x) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /**
   * First position whose mean cumulative count is {@code > cumn}. Only meaningful while the
   * cumulative fields are fresh.
   */
  int upperBoundMeanCumn(double cumn) {
    int low = 0, high = len;
    while (low < high) {
      int mid = (high + low) >>> 1;
      if (keys[mid].meanCumn <= cumn) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  @Override
  public Iterator<Centroid> iterator() {
    return new Iterator<Centroid>() {
      private int idx = 0;

      @Override
      public boolean hasNext() {
        return idx < len;
      }

      @Override
      public Centroid next() {
        if (idx >= len) {
          throw new NoSuchElementException();
        }
        return keys[idx++];
      }
    };
  }
}
