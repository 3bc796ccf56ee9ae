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
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A SymbolTable holds the variables of a code fragment, and for each variable the instructions that
 * currently define or use it.
 *
 * <p>The reference sets are maintained by {@link BasicBlock}: each instruction is registered when it
 * is added to a block and unregistered when it is deleted. When a variable's last reference is
 * unregistered the variable is removed from the table, but its name is never reused by {@link
 * #getFreshVariableName}.
 *
 * <p>The table also numbers the blocks built against it (see {@link #newBlock}).
 */
public class SymbolTable implements Iterable<String> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Properties of a variable that later passes care about. */
  public enum Attribute {
    /** The variable is part of the state that persists between steps. */
    GLOBAL,
    /** The variable holds (part of) the generated function's result. */
    RETURN_VALUE,
    /** The variable is a boolean tracked by {@link FlagAnalysis}. */
    FLAG
  }

  /** The entry for one variable. */
  public static final class Variable {
    private final String name;
    private final EnumSet<Attribute> attributes;

    /** Instructions currently in a block that define or use this variable. */
    private final Set<Instruction> references = Sets.newLinkedHashSet();

    private Variable(String name, EnumSet<Attribute> attributes) {
      this.name = name;
      this.attributes = attributes;
    }

    public String name() {
      return name;
    }

    public boolean hasAttribute(Attribute attribute) {
      return attributes.contains(attribute);
    }

    public boolean isGlobal() {
      return hasAttribute(Attribute.GLOBAL);
    }

    public boolean isReturnValue() {
      return hasAttribute(Attribute.RETURN_VALUE);
    }

    public boolean isFlag() {
      return hasAttribute(Attribute.FLAG);
    }

    /** An unmodifiable view of the instructions that reference this variable. */
    public Set<Instruction> references() {
      return Collections.unmodifiableSet(references);
    }

    /** Returns true if no instruction references this variable. */
    public boolean isUnreferenced() {
      return references.isEmpty();
    }

    @Override
    public String toString() {
      return attributes.isEmpty() ? name : name + attributes;
    }
  }

  /** The currently-known variables, in the order they were added. */
  private final Map<String, Variable> variables = new LinkedHashMap<>();

  /**
   * Every name that has ever been added or returned by {@link #getFreshVariableName}, including
   * those that are no longer in {@link #variables}.
   */
  private final Set<String> namedVariables = new HashSet<>();

  /** The number to be given to the next block created by {@link #newBlock}. */
  private int nextBlockNumber;

  /**
   * Adds a new variable with the given attributes. {@code name} must not be the name of a variable
   * currently in this table.
   */
  @CanIgnoreReturnValue
  public Variable addVariable(String name, Attribute... attributes) {
    Preconditions.checkNotNull(name);
    Preconditions.checkArgument(!variables.containsKey(name), "Duplicate variable %s", name);
    EnumSet<Attribute> attributeSet = EnumSet.noneOf(Attribute.class);
    attributeSet.addAll(Arrays.asList(attributes));
    Variable result = new Variable(name, attributeSet);
    variables.put(name, result);
    namedVariables.add(name);
    return result;
  }

  /**
   * Removes an unreferenced variable from this table. Its name remains reserved, so {@link
   * #getFreshVariableName} will not return it.
   */
  public void dropVariable(String name) {
    Variable v = get(name);
    Preconditions.checkState(v.isUnreferenced(), "%s is still referenced", name);
    variables.remove(name);
  }

  /**
   * Returns a name starting with {@code prefix} that has not previously been used in this table,
   * and reserves it. The result is {@code prefix} itself if that is available, otherwise {@code
   * prefix} followed by the smallest non-negative integer that makes it unique.
   */
  public String getFreshVariableName(String prefix) {
    String name = prefix;
    for (int suffix = 0; namedVariables.contains(name); suffix++) {
      name = prefix + suffix;
    }
    namedVariables.add(name);
    return name;
  }

  /** Returns a new, empty BasicBlock whose number is unique among those created by this table. */
  public BasicBlock newBlock() {
    return new BasicBlock(nextBlockNumber++, this);
  }

  /** Returns true if there is currently a variable with the given name. */
  public boolean contains(String name) {
    return variables.containsKey(name);
  }

  /** Returns the variable with the given name, which must be in this table. */
  public Variable get(String name) {
    Variable result = variables.get(name);
    Preconditions.checkArgument(result != null, "Unknown variable %s", name);
    return result;
  }

  /** An unmodifiable view of the names of the currently-known variables. */
  public Set<String> variables() {
    return Collections.unmodifiableSet(variables.keySet());
  }

  public int size() {
    return variables.size();
  }

  @Override
  public Iterator<String> iterator() {
    return variables().iterator();
  }

  /**
   * Adds {@code inst} to the references of each variable it defines or uses. Should only be called
   * by BasicBlock.
   */
  void registerInstruction(Instruction inst) {
    checkKnown(inst);
    for (String name : inst.referencedVariables()) {
      variables.get(name).references.add(inst);
    }
  }

  /**
   * Removes {@code inst} from the references of each variable it defines or uses, and removes any
   * variable left with no references. Should only be called by BasicBlock.
   */
  void unregisterInstruction(Instruction inst) {
    checkKnown(inst);
    for (String name : inst.referencedVariables()) {
      Variable v = variables.get(name);
      v.references.remove(inst);
      if (v.isUnreferenced()) {
        variables.remove(name);
        logger.atFine().log("Removed unreferenced variable %s", name);
      }
    }
  }

  /** Fails if {@code inst} references a variable that is not in this table. */
  void checkKnown(Instruction inst) {
    for (String name : inst.referencedVariables()) {
      Preconditions.checkArgument(
          variables.containsKey(name), "Unknown variable %s in \"%s\"", name, inst);
    }
  }

  @Override
  public String toString() {
    return variables.values().toString();
  }
}
