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

package org.stepgen.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.stepgen.util.Bits;

/**
 * A FlagAnalysis records what is known about a fixed set of boolean flags at some point in the
 * control flow graph: each flag is definitely true, definitely false, or unknown.
 *
 * <p>FlagAnalysis values are immutable; {@link #setTrue}, {@link #setFalse}, {@link #setUnknown}
 * and {@link #and} return new values. Values derived from the same {@link #of} call share their
 * flag universe.
 */
public final class FlagAnalysis {

  /** The tracked flags, and the bit index used for each. */
  private static final class Universe {
    final ImmutableList<String> flags;
    final ImmutableMap<String, Integer> index;

    Universe(Iterable<String> flags) {
      this.flags = ImmutableSet.copyOf(flags).asList();
      this.index =
          IntStream.range(0, this.flags.size())
              .boxed()
              .collect(ImmutableMap.toImmutableMap(this.flags::get, i -> i));
    }

    int indexOf(String flag) {
      Integer result = index.get(flag);
      Preconditions.checkArgument(result != null, "Unknown flag %s", flag);
      return result;
    }

    boolean sameFlags(Universe other) {
      return this == other || index.keySet().equals(other.index.keySet());
    }
  }

  private final Universe universe;
  private final Bits mustBeTrue;
  private final Bits mustBeFalse;

  private FlagAnalysis(Universe universe, Bits mustBeTrue, Bits mustBeFalse) {
    assert !mustBeTrue.testAny(mustBeFalse);
    this.universe = universe;
    this.mustBeTrue = mustBeTrue;
    this.mustBeFalse = mustBeFalse;
  }

  /** Returns a FlagAnalysis that tracks the given flags, all of which are initially unknown. */
  public static FlagAnalysis of(Iterable<String> flags) {
    return new FlagAnalysis(new Universe(flags), Bits.EMPTY, Bits.EMPTY);
  }

  /** Returns a FlagAnalysis that tracks the given flags, all of which are initially unknown. */
  public static FlagAnalysis of(String... flags) {
    return of(ImmutableList.copyOf(flags));
  }

  /** The flags tracked by this FlagAnalysis. */
  public ImmutableList<String> flags() {
    return universe.flags;
  }

  /** Returns a FlagAnalysis in which {@code flag} is definitely true. */
  public FlagAnalysis setTrue(String flag) {
    int i = universe.indexOf(flag);
    return new FlagAnalysis(universe, mustBeTrue.set(i), mustBeFalse.clear(i));
  }

  /** Returns a FlagAnalysis in which {@code flag} is definitely false. */
  public FlagAnalysis setFalse(String flag) {
    int i = universe.indexOf(flag);
    return new FlagAnalysis(universe, mustBeTrue.clear(i), mustBeFalse.set(i));
  }

  /** Returns a FlagAnalysis in which nothing is known about {@code flag}. */
  public FlagAnalysis setUnknown(String flag) {
    int i = universe.indexOf(flag);
    return new FlagAnalysis(universe, mustBeTrue.clear(i), mustBeFalse.clear(i));
  }

  public boolean isDefinitelyTrue(String flag) {
    return mustBeTrue.test(universe.indexOf(flag));
  }

  public boolean isDefinitelyFalse(String flag) {
    return mustBeFalse.test(universe.indexOf(flag));
  }

  public boolean isUnknown(String flag) {
    int i = universe.indexOf(flag);
    return !mustBeTrue.test(i) && !mustBeFalse.test(i);
  }

  /**
   * Returns the FlagAnalysis that holds where control flow from two paths joins: a flag is only
   * known if both inputs agree on its value. {@code other} must track the same flags.
   */
  public FlagAnalysis and(FlagAnalysis other) {
    Preconditions.checkArgument(
        universe.sameFlags(other.universe),
        "Mismatched flags: %s and %s",
        universe.flags,
        other.universe.flags);
    if (universe.flags.equals(other.universe.flags)) {
      return new FlagAnalysis(
          universe, mustBeTrue.and(other.mustBeTrue), mustBeFalse.and(other.mustBeFalse));
    }
    // Same flags in a different order; translate other's indices into ours.
    FlagAnalysis result = new FlagAnalysis(universe, Bits.EMPTY, Bits.EMPTY);
    for (String flag : universe.flags) {
      if (isDefinitelyTrue(flag) && other.isDefinitelyTrue(flag)) {
        result = result.setTrue(flag);
      } else if (isDefinitelyFalse(flag) && other.isDefinitelyFalse(flag)) {
        result = result.setFalse(flag);
      }
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FlagAnalysis other)) {
      return false;
    }
    if (!universe.sameFlags(other.universe)) {
      return false;
    }
    return universe.flags.stream()
        .allMatch(
            f ->
                isDefinitelyTrue(f) == other.isDefinitelyTrue(f)
                    && isDefinitelyFalse(f) == other.isDefinitelyFalse(f));
  }

  @Override
  public int hashCode() {
    // Order-independent, so that equal values over reordered universes hash alike.
    int result = 0;
    for (String flag : universe.flags) {
      int state = isDefinitelyTrue(flag) ? 1 : (isDefinitelyFalse(flag) ? 2 : 0);
      result += flag.hashCode() * 31 + state;
    }
    return result;
  }

  /** Returns e.g. {@code {a=true, b=false, c=?}}. */
  @Override
  public String toString() {
    return universe.flags.stream()
        .map(f -> f + "=" + (isUnknown(f) ? "?" : String.valueOf(isDefinitelyTrue(f))))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
