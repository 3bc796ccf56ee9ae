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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Static-only class with string formatting helpers. */
public class StringUtil {

  // Statics only
  private StringUtil() {}

  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  /**
   * Breaks {@code text} into lines of at most {@code width} characters, splitting at whitespace
   * where possible. Every line after the first is prefixed with {@code indent}, which counts
   * towards its width. Runs of whitespace between words are collapsed to a single space; a word
   * that does not fit on a line by itself is split.
   */
  public static ImmutableList<String> wrap(String text, int width, String indent) {
    Preconditions.checkArgument(width > indent.length(), "Width %s too small", width);
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    StringBuilder line = new StringBuilder();
    // The length of line when it contains no words yet
    int prefixLength = 0;
    for (String word : WORDS.split(text)) {
      if (line.length() > prefixLength && line.length() + 1 + word.length() > width) {
        lines.add(line.toString());
        line.setLength(0);
        line.append(indent);
        prefixLength = indent.length();
      }
      if (line.length() > prefixLength) {
        line.append(' ');
      }
      // A word that is too long for an empty line gets split across as many lines as it needs.
      while (line.length() + word.length() > width) {
        int fit = width - line.length();
        line.append(word, 0, fit);
        lines.add(line.toString());
        word = word.substring(fit);
        line.setLength(0);
        line.append(indent);
        prefixLength = indent.length();
      }
      line.append(word);
    }
    if (line.length() > prefixLength) {
      lines.add(line.toString());
    }
    return lines.build();
  }
}
