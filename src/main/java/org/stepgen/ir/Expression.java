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

import com.google.common.collect.ImmutableSet;

/**
 * An immutable symbolic expression, as produced by the front end.
 *
 * <p>The IR never looks inside an Expression; it only needs to print it and to know which
 * variables it reads, so that the {@link SymbolTable} can track references.
 */
public interface Expression {

  /** Returns the expression's source rendering, as it appears in instruction listings. */
  String render();

  /** Returns the names of all variables read by this expression. */
  ImmutableSet<String> referencedVariables();
}
