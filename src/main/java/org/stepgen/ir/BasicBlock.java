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
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A BasicBlock is a sequence of Instructions that is always executed from start to finish. Only the
 * last instruction may be terminal; once a terminal instruction has been added the block is {@link
 * #isTerminated terminated} and no more instructions can be added until it is deleted.
 *
 * <p>Each BasicBlock keeps sets of its predecessors and successors, which are updated as terminal
 * instructions are added and deleted. These are always symmetric: {@code b} is in {@code
 * a.successors()} if and only if {@code a} is in {@code b.predecessors()}.
 *
 * <p>Every instruction added to or deleted from a BasicBlock is registered with or unregistered from
 * the block's {@link SymbolTable}.
 */
public class BasicBlock implements Iterable<Instruction> {

  /** Identifies this block in listings and in the renderings of jumps and branches to it. */
  private final int number;

  private final SymbolTable symbolTable;

  private final List<Instruction> code = new ArrayList<>();

  /** True iff the last element of {@link #code} is terminal. */
  private boolean terminated;

  private final Set<BasicBlock> predecessors = new LinkedHashSet<>();
  private final Set<BasicBlock> successors = new LinkedHashSet<>();

  /**
   * Creates an empty BasicBlock. Most callers should use {@link SymbolTable#newBlock} rather than
   * choosing their own block numbers.
   */
  public BasicBlock(int number, SymbolTable symbolTable) {
    this.number = number;
    this.symbolTable = Preconditions.checkNotNull(symbolTable);
  }

  public int number() {
    return number;
  }

  public SymbolTable symbolTable() {
    return symbolTable;
  }

  /** An unmodifiable view of this block's instructions. */
  public List<Instruction> instructions() {
    return Collections.unmodifiableList(code);
  }

  @Override
  public Iterator<Instruction> iterator() {
    return instructions().iterator();
  }

  public int size() {
    return code.size();
  }

  public boolean isEmpty() {
    return code.isEmpty();
  }

  public boolean isTerminated() {
    return terminated;
  }

  /** Returns this block's terminal instruction, or null if it is not terminated. */
  public @Nullable Instruction terminator() {
    return terminated ? Iterables.getLast(code) : null;
  }

  /** An unmodifiable view of the blocks that may transfer control to this one. */
  public Set<BasicBlock> predecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  /** An unmodifiable view of the blocks that this one may transfer control to. */
  public Set<BasicBlock> successors() {
    return Collections.unmodifiableSet(successors);
  }

  /** Appends the given instruction; see {@link #addInstructions}. */
  public void addInstruction(Instruction instruction) {
    addInstructions(ImmutableList.of(instruction));
  }

  /**
   * Appends the given instructions. This block must not be terminated, and only the last of the
   * instructions may be terminal. Each instruction must not already be in a block, and every
   * variable it references must be in the symbol table.
   *
   * <p>If any of those conditions is not met this method throws without modifying anything.
   */
  public void addInstructions(List<? extends Instruction> instructions) {
    Preconditions.checkState(!terminated, "Block %s is already terminated", number);
    Set<Instruction> seen = Sets.newIdentityHashSet();
    for (int i = 0; i < instructions.size(); i++) {
      Instruction inst = instructions.get(i);
      Preconditions.checkArgument(
          !inst.isTerminal() || i == instructions.size() - 1,
          "Terminal instruction \"%s\" must be last",
          inst);
      Preconditions.checkArgument(
          inst.block() == null && seen.add(inst), "\"%s\" is already in a block", inst);
      symbolTable.checkKnown(inst);
    }
    for (Instruction inst : instructions) {
      code.add(inst);
      inst.setBlock(this);
      symbolTable.registerInstruction(inst);
      if (inst.isTerminal()) {
        terminated = true;
        for (BasicBlock successor : inst.jumpTargets()) {
          addSuccessor(successor);
        }
      }
    }
  }

  /** Adds {@code successor} to our successors, and us to its predecessors. */
  private void addSuccessor(BasicBlock successor) {
    successors.add(successor);
    successor.predecessors.add(this);
  }

  /** Appends {@code name <- expression}. */
  @CanIgnoreReturnValue
  public Instruction.Assign addAssignment(String name, Expression expression) {
    return addAssignment(new Assignment.Simple(name, expression));
  }

  /** Appends an assignment instruction. */
  @CanIgnoreReturnValue
  public Instruction.Assign addAssignment(Assignment assignment) {
    Instruction.Assign result = new Instruction.Assign(assignment);
    addInstruction(result);
    return result;
  }

  /** Terminates this block with a jump to {@code dest}. */
  @CanIgnoreReturnValue
  public Instruction.Jump addJump(BasicBlock dest) {
    Instruction.Jump result = new Instruction.Jump(dest);
    addInstruction(result);
    return result;
  }

  /** Terminates this block with a conditional branch. */
  @CanIgnoreReturnValue
  public Instruction.Branch addBranch(Expression condition, BasicBlock onTrue, BasicBlock onFalse) {
    Instruction.Branch result = new Instruction.Branch(condition, onTrue, onFalse);
    addInstruction(result);
    return result;
  }

  /** Terminates this block with a return of the given expression. */
  @CanIgnoreReturnValue
  public Instruction.Return addReturn(Expression expression) {
    Instruction.Return result = new Instruction.Return(expression);
    addInstruction(result);
    return result;
  }

  /** Terminates this block with an instruction marking it as unreachable. */
  @CanIgnoreReturnValue
  public Instruction.Unreachable addUnreachable() {
    Instruction.Unreachable result = new Instruction.Unreachable();
    addInstruction(result);
    return result;
  }

  /** Deletes the given instruction; see {@link #deleteInstructions}. */
  public void deleteInstruction(Instruction instruction) {
    deleteInstructions(ImmutableList.of(instruction));
  }

  /**
   * Removes the given instructions, all of which must be in this block, and unregisters them from
   * the symbol table. If the terminator is among them this block is no longer terminated and all of
   * its successor links are removed.
   */
  public void deleteInstructions(Collection<? extends Instruction> toDelete) {
    for (Instruction inst : toDelete) {
      Preconditions.checkArgument(
          inst.block() == this, "\"%s\" is not in block %s", inst, number);
    }
    // Copy the argument first, since it may be a view of our own code.
    List<Instruction> deleting = new ArrayList<>(toDelete);
    code.removeAll(deleting);
    for (Instruction inst : deleting) {
      if (inst.block() == null) {
        // Listed twice
        continue;
      }
      inst.setBlock(null);
      symbolTable.unregisterInstruction(inst);
      if (inst.isTerminal()) {
        assert terminated;
        terminated = false;
        clearSuccessors();
      }
    }
    assert terminated == (!code.isEmpty() && Iterables.getLast(code).isTerminal());
  }

  /** Removes all of our successor links, in both directions. */
  private void clearSuccessors() {
    for (BasicBlock successor : successors) {
      successor.predecessors.remove(this);
    }
    successors.clear();
  }

  /** Deletes all instructions. */
  public void clear() {
    deleteInstructions(code);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("===== basic block ").append(number).append(" =====");
    for (Instruction inst : code) {
      sb.append('\n').append(inst);
    }
    return sb.toString();
  }
}
