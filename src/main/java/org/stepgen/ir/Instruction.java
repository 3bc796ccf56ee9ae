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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.jspecify.annotations.Nullable;

/**
 * An Instruction is one step in a {@link BasicBlock}. There are five kinds of Instruction, each a
 * nested subclass: {@link Assign} is the only one that does not end its block; {@link Branch},
 * {@link Jump}, {@link Return} and {@link Unreachable} are <i>terminal</i>, and a block may have at
 * most one of them, as its last instruction.
 *
 * <p>The fields of an Instruction are fixed when it is created, so the variables it defines and
 * uses, and the blocks it may jump to, are computed on first request and then cached. The only
 * mutable state is {@link #block}, which is set by the BasicBlock that the Instruction is added to.
 */
public abstract class Instruction {

  /** Null unless this Instruction is currently in a BasicBlock. */
  private BasicBlock block;

  private ImmutableSet<String> defined;
  private ImmutableSet<String> used;
  private ImmutableSet<String> referenced;
  private ImmutableSet<BasicBlock> targets;

  /** We define five subclasses, and that's it. */
  private Instruction() {}

  /** The BasicBlock containing this Instruction, or null if it has not been added to one. */
  public @Nullable BasicBlock block() {
    return block;
  }

  /** Should only be called by BasicBlock. */
  void setBlock(@Nullable BasicBlock block) {
    assert (block == null) != (this.block == null);
    this.block = block;
  }

  /** True if this Instruction must be the last in its block. */
  public abstract boolean isTerminal();

  abstract ImmutableSet<String> computeDefinedVariables();

  abstract ImmutableSet<String> computeUsedVariables();

  /** Returns the names of the variables that this Instruction assigns. */
  public final ImmutableSet<String> definedVariables() {
    if (defined == null) {
      defined = computeDefinedVariables();
    }
    return defined;
  }

  /** Returns the names of the variables that this Instruction reads. */
  public final ImmutableSet<String> usedVariables() {
    if (used == null) {
      used = computeUsedVariables();
    }
    return used;
  }

  /**
   * Returns the union of {@link #definedVariables} and {@link #usedVariables}; these are the
   * variables whose {@link SymbolTable.Variable#references} include this Instruction while it is in
   * a block.
   */
  public final ImmutableSet<String> referencedVariables() {
    if (referenced == null) {
      referenced = Sets.union(definedVariables(), usedVariables()).immutableCopy();
    }
    return referenced;
  }

  /** Only Branch and Jump have targets. */
  ImmutableSet<BasicBlock> computeJumpTargets() {
    return ImmutableSet.of();
  }

  /** Returns the blocks that control may pass to after this Instruction. */
  public final ImmutableSet<BasicBlock> jumpTargets() {
    if (targets == null) {
      targets = computeJumpTargets();
    }
    return targets;
  }

  /** Conditionally transfers control to one of two blocks. */
  public static final class Branch extends Instruction {
    public final Expression condition;
    public final BasicBlock onTrue;
    public final BasicBlock onFalse;

    public Branch(Expression condition, BasicBlock onTrue, BasicBlock onFalse) {
      this.condition = Preconditions.checkNotNull(condition);
      this.onTrue = Preconditions.checkNotNull(onTrue);
      this.onFalse = Preconditions.checkNotNull(onFalse);
    }

    @Override
    public boolean isTerminal() {
      return true;
    }

    @Override
    ImmutableSet<String> computeDefinedVariables() {
      return ImmutableSet.of();
    }

    @Override
    ImmutableSet<String> computeUsedVariables() {
      return condition.referencedVariables();
    }

    @Override
    ImmutableSet<BasicBlock> computeJumpTargets() {
      return ImmutableSet.of(onTrue, onFalse);
    }

    @Override
    public String toString() {
      return String.format(
          "if %s then goto block %d else goto block %d",
          condition.render(), onTrue.number(), onFalse.number());
    }
  }

  /** Stores values in one or more variables. */
  public static final class Assign extends Instruction {
    public final Assignment assignment;

    public Assign(Assignment assignment) {
      this.assignment = Preconditions.checkNotNull(assignment);
    }

    @Override
    public boolean isTerminal() {
      return false;
    }

    @Override
    ImmutableSet<String> computeDefinedVariables() {
      return assignment.assignees();
    }

    @Override
    ImmutableSet<String> computeUsedVariables() {
      return assignment.readVariables();
    }

    @Override
    public String toString() {
      return assignment.toString();
    }
  }

  /** Unconditionally transfers control to another block. */
  public static final class Jump extends Instruction {
    public final BasicBlock dest;

    public Jump(BasicBlock dest) {
      this.dest = Preconditions.checkNotNull(dest);
    }

    @Override
    public boolean isTerminal() {
      return true;
    }

    @Override
    ImmutableSet<String> computeDefinedVariables() {
      return ImmutableSet.of();
    }

    @Override
    ImmutableSet<String> computeUsedVariables() {
      return ImmutableSet.of();
    }

    @Override
    ImmutableSet<BasicBlock> computeJumpTargets() {
      return ImmutableSet.of(dest);
    }

    @Override
    public String toString() {
      return "goto block " + dest.number();
    }
  }

  /** Returns the value of an expression from the generated function. */
  public static final class Return extends Instruction {
    public final Expression expression;

    public Return(Expression expression) {
      this.expression = Preconditions.checkNotNull(expression);
    }

    @Override
    public boolean isTerminal() {
      return true;
    }

    @Override
    ImmutableSet<String> computeDefinedVariables() {
      return ImmutableSet.of();
    }

    @Override
    ImmutableSet<String> computeUsedVariables() {
      return expression.referencedVariables();
    }

    @Override
    public String toString() {
      return "return " + expression.render();
    }
  }

  /** Marks a point that analysis has shown can never be reached. */
  public static final class Unreachable extends Instruction {

    @Override
    public boolean isTerminal() {
      return true;
    }

    @Override
    ImmutableSet<String> computeDefinedVariables() {
      return ImmutableSet.of();
    }

    @Override
    ImmutableSet<String> computeUsedVariables() {
      return ImmutableSet.of();
    }

    @Override
    public String toString() {
      return "unreachable";
    }
  }
}
