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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.stepgen.ir.Exprs.binary;
import static org.stepgen.ir.Exprs.constant;
import static org.stepgen.ir.Exprs.var;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BasicBlockTest {
  SymbolTable table;
  BasicBlock b0;
  BasicBlock b1;
  BasicBlock b2;

  @Before
  public void setup() {
    table = new SymbolTable();
    table.addVariable("x");
    table.addVariable("y");
    b0 = table.newBlock();
    b1 = table.newBlock();
    b2 = table.newBlock();
  }

  /** Checks that successor and predecessor sets agree for every pair of the given blocks. */
  private static void assertEdgesSymmetric(BasicBlock... blocks) {
    for (BasicBlock a : blocks) {
      for (BasicBlock b : blocks) {
        assertThat(a.successors().contains(b)).isEqualTo(b.predecessors().contains(a));
      }
    }
  }

  @Test
  public void appendAndTerminate() {
    Instruction assign = b0.addAssignment("x", constant(1));
    Instruction jump = b0.addJump(b1);
    assertThat(b0.instructions()).containsExactly(assign, jump).inOrder();
    assertThat(b0.isTerminated()).isTrue();
    assertThat(b0.terminator()).isSameInstanceAs(jump);
    assertThat(b0.successors()).containsExactly(b1);
    assertThat(b1.predecessors()).containsExactly(b0);
    assertThat(b0.toString()).isEqualTo("===== basic block 0 =====\nx <- 1\ngoto block 1");
    assertEdgesSymmetric(b0, b1, b2);
  }

  @Test
  public void addToTerminatedBlockFails() {
    b0.addReturn(var("x"));
    List<Instruction> before = ImmutableList.copyOf(b0.instructions());
    Instruction extra = new Instruction.Assign(new Assignment.Simple("y", constant(2)));
    assertThrows(IllegalStateException.class, () -> b0.addInstruction(extra));
    assertThrows(IllegalStateException.class, () -> b0.addJump(b1));
    assertThat(b0.instructions()).isEqualTo(before);
    assertThat(extra.block()).isNull();
    assertThat(table.get("y").references()).isEmpty();
    assertThat(b0.successors()).isEmpty();
    assertThat(b1.predecessors()).isEmpty();
  }

  @Test
  public void rejectedBatchChangesNothing() {
    Instruction assign = new Instruction.Assign(new Assignment.Simple("x", constant(1)));
    Instruction jump = new Instruction.Jump(b1);
    // A terminal instruction that isn't last
    assertThrows(
        IllegalArgumentException.class, () -> b0.addInstructions(ImmutableList.of(jump, assign)));
    // An unknown variable
    Instruction unknown = new Instruction.Assign(new Assignment.Simple("z", var("x")));
    assertThrows(
        IllegalArgumentException.class,
        () -> b0.addInstructions(ImmutableList.of(assign, unknown, jump)));
    // The same instruction twice
    assertThrows(
        IllegalArgumentException.class, () -> b0.addInstructions(ImmutableList.of(assign, assign)));
    assertThat(b0.isEmpty()).isTrue();
    assertThat(b0.isTerminated()).isFalse();
    assertThat(assign.block()).isNull();
    assertThat(jump.block()).isNull();
    assertThat(table.get("x").references()).isEmpty();
    assertThat(b1.predecessors()).isEmpty();
  }

  @Test
  public void instructionCanOnlyBeInOneBlock() {
    Instruction assign = b0.addAssignment("x", constant(1));
    assertThrows(IllegalArgumentException.class, () -> b1.addInstruction(assign));
    assertThat(b1.isEmpty()).isTrue();
  }

  @Test
  public void branchLinksBothTargets() {
    b0.addBranch(binary(var("x"), "<", var("y")), b1, b2);
    assertThat(b0.successors()).containsExactly(b1, b2);
    assertThat(b1.predecessors()).containsExactly(b0);
    assertThat(b2.predecessors()).containsExactly(b0);
    assertThat(table.get("x").references()).containsExactly(b0.terminator());
    assertEdgesSymmetric(b0, b1, b2);
  }

  @Test
  public void deleteTerminatorClearsEdges() {
    b0.addAssignment("x", constant(1));
    Instruction branch = b0.addBranch(var("y"), b1, b2);
    b1.addJump(b2);
    b0.deleteInstruction(branch);
    assertThat(b0.isTerminated()).isFalse();
    assertThat(b0.terminator()).isNull();
    assertThat(b0.size()).isEqualTo(1);
    assertThat(b0.successors()).isEmpty();
    assertThat(b1.predecessors()).isEmpty();
    assertThat(b2.predecessors()).containsExactly(b1);
    assertThat(branch.block()).isNull();
    assertEdgesSymmetric(b0, b1, b2);
    // Now the block can be terminated again
    b0.addJump(b2);
    assertThat(b2.predecessors()).containsExactly(b1, b0);
    assertEdgesSymmetric(b0, b1, b2);
  }

  @Test
  public void deleteNonTerminalKeepsEdges() {
    Instruction assign = b0.addAssignment("x", constant(1));
    b0.addJump(b1);
    b0.deleteInstruction(assign);
    assertThat(b0.isTerminated()).isTrue();
    assertThat(b0.successors()).containsExactly(b1);
    assertThat(b1.predecessors()).containsExactly(b0);
  }

  @Test
  public void selfLoop() {
    b0.addJump(b0);
    assertThat(b0.successors()).containsExactly(b0);
    assertThat(b0.predecessors()).containsExactly(b0);
    b0.clear();
    assertThat(b0.successors()).isEmpty();
    assertThat(b0.predecessors()).isEmpty();
  }

  @Test
  public void deleteInstructionFromOtherBlockFails() {
    Instruction assign = b0.addAssignment("x", constant(1));
    assertThrows(IllegalArgumentException.class, () -> b1.deleteInstruction(assign));
    assertThat(assign.block()).isSameInstanceAs(b0);
  }

  @Test
  public void clearUnregistersEverything() {
    b0.addAssignment("x", constant(1));
    b0.addAssignment("y", var("x"));
    b0.addBranch(var("y"), b1, b2);
    b0.clear();
    assertThat(b0.isEmpty()).isTrue();
    assertThat(b0.isTerminated()).isFalse();
    assertThat(b1.predecessors()).isEmpty();
    assertThat(b2.predecessors()).isEmpty();
    // Both variables lost their last reference
    assertThat(table.contains("x")).isFalse();
    assertThat(table.contains("y")).isFalse();
  }

  @Test
  public void addUnreachableRegistersAndTerminates() {
    Instruction unreachable = b0.addUnreachable();
    assertThat(b0.isTerminated()).isTrue();
    assertThat(unreachable.block()).isSameInstanceAs(b0);
    assertThat(b0.successors()).isEmpty();
    assertThrows(IllegalStateException.class, () -> b0.addAssignment("x", constant(1)));
    b0.deleteInstruction(unreachable);
    assertThat(b0.isTerminated()).isFalse();
  }

  @Test
  public void componentCallRegistersEveryVariable() {
    table.addVariable("t");
    table.addVariable("k");
    Instruction call =
        b0.addAssignment(
            new Assignment.ComponentCall(
                ImmutableList.of("k", "y"),
                "rhs",
                var("t"),
                ImmutableList.of(
                    ImmutableList.of(new Assignment.Argument("y", var("x"))),
                    ImmutableList.of(new Assignment.Argument("y", var("k"))))));
    for (String name : ImmutableList.of("t", "k", "x", "y")) {
      assertThat(table.get(name).references()).containsExactly(call);
    }
  }
}
