/*
 * Copyright 2025 The Stepgen Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stepgen.util;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * A Bits represents an immutable, finite set of non-negative integers.
 *
 * <p>Every operation that would modify a Bits instead returns a new one, so instances can be shared
 * freely. Values are stored as an array of longs with no trailing zero words, which makes {@link
 * #equals} a simple array comparison.
 */
public final class Bits {

  /** A Bits value containing no integers. */
  public static final Bits EMPTY = new Bits(new long[0]);

  /** Never empty in its last element; never shared with another Bits or modified. */
  private final long[] words;

  private Bits(long[] words) {
    assert words.length == 0 || words[words.length - 1] != 0;
    this.words = words;
  }

  /** Returns a Bits using the given words, which may have trailing zeros. */
  private static Bits fromWords(long[] words) {
    int n = words.length;
    while (n > 0 && words[n - 1] == 0) {
      n--;
    }
    if (n == 0) {
      return EMPTY;
    }
    return new Bits(n == words.length ? words : Arrays.copyOf(words, n));
  }

  /** Returns true if this Bits contains no integers. */
  @SuppressWarnings("ReferenceEquality")
  public boolean isEmpty() {
    // fromWords() canonicalizes empty results.
    return this == EMPTY;
  }

  /** Returns true if {@code i} is an element of this Bits. */
  public boolean test(int i) {
    int word = i / Long.SIZE;
    return i >= 0 && word < words.length && (words[word] & (1L << i)) != 0;
  }

  /** Returns a Bits that contains each element of this Bits, plus {@code i}. */
  public Bits set(int i) {
    Preconditions.checkArgument(i >= 0, "Negative element %s", i);
    if (test(i)) {
      return this;
    }
    int word = i / Long.SIZE;
    long[] result = Arrays.copyOf(words, Math.max(words.length, word + 1));
    result[word] |= 1L << i;
    return new Bits(result);
  }

  /** Returns a Bits that contains each element of this Bits except {@code i}. */
  public Bits clear(int i) {
    if (!test(i)) {
      return this;
    }
    long[] result = words.clone();
    result[i / Long.SIZE] &= ~(1L << i);
    return fromWords(result);
  }

  /** Returns a Bits containing the elements that are in both this and {@code other}. */
  public Bits and(Bits other) {
    if (isEmpty() || other.isEmpty()) {
      return EMPTY;
    }
    long[] result = new long[Math.min(words.length, other.words.length)];
    for (int i = 0; i < result.length; i++) {
      result[i] = words[i] & other.words[i];
    }
    return fromWords(result);
  }

  /** Returns true if this and {@code other} have at least one element in common. */
  public boolean testAny(Bits other) {
    int n = Math.min(words.length, other.words.length);
    for (int i = 0; i < n; i++) {
      if ((words[i] & other.words[i]) != 0) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bits other && Arrays.equals(words, other.words);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(words);
  }
}
