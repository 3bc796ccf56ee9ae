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
import com.google.common.collect.ImmutableSet;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stepgen.ir.Assignment.Argument;

@RunWith(JUnit4.class)
public class InstructionTest {
  SymbolTable table;
  BasicBlock b1;
  BasicBlock b2;

  @Before
  public void setup() {
    table = new SymbolTable();
    b1 = new BasicBlock(1, table);
    b2 = new BasicBlock(2, table);
  }

  @Test
  public void branch() {
    Instruction inst = new Instruction.Branch(binary(var("x"), "<", var("n")), b1, b2);
    assertThat(inst.toString()).isEqualTo("if x < n then goto block 1 else goto block 2");
    assertThat(inst.isTerminal()).isTrue();
    assertThat(inst.definedVariables()).isEmpty();
    assertThat(inst.usedVariables()).containsExactly("x", "n");
    assertThat(inst.jumpTargets()).containsExactly(b1, b2);
  }

  @Test
  public void branchToSameBlock() {
    Instruction inst = new Instruction.Branch(var("c"), b2, b2);
    assertThat(inst.toString()).isEqualTo("if c then goto block 2 else goto block 2");
    assertThat(inst.jumpTargets()).containsExactly(b2);
  }

  @Test
  public void jump() {
    Instruction inst = new Instruction.Jump(b2);
    assertThat(inst.toString()).isEqualTo("goto block 2");
    assertThat(inst.isTerminal()).isTrue();
    assertThat(inst.referencedVariables()).isEmpty();
    assertThat(inst.jumpTargets()).containsExactly(b2);
  }

  @Test
  public void returnInstruction() {
    Instruction inst = new Instruction.Return(binary(var("y"), "+", constant(1)));
    assertThat(inst.toString()).isEqualTo("return y + 1");
    assertThat(inst.isTerminal()).isTrue();
    assertThat(inst.definedVariables()).isEmpty();
    assertThat(inst.usedVariables()).containsExactly("y");
    assertThat(inst.jumpTargets()).isEmpty();
  }

  @Test
  public void unreachable() {
    Instruction inst = new Instruction.Unreachable();
    assertThat(inst.toString()).isEqualTo("unreachable");
    assertThat(inst.isTerminal()).isTrue();
    assertThat(inst.referencedVariables()).isEmpty();
    assertThat(inst.jumpTargets()).isEmpty();
  }

  @Test
  public void simpleAssign() {
    Instruction inst =
        new Instruction.Assign(new Assignment.Simple("x", binary(var("x"), "*", var("h"))));
    assertThat(inst.toString()).isEqualTo("x <- x * h");
    assertThat(inst.isTerminal()).isFalse();
    assertThat(inst.definedVariables()).containsExactly("x");
    assertThat(inst.usedVariables()).containsExactly("x", "h");
    assertThat(inst.referencedVariables()).containsExactly("x", "h");
    assertThat(inst.jumpTargets()).isEmpty();
  }

  @Test
  public void componentCall() {
    Assignment call =
        new Assignment.ComponentCall(
            ImmutableList.of("k1", "k2"),
            "f",
            binary(var("t"), "+", var("dt")),
            ImmutableList.of(
                ImmutableList.<Argument>of(),
                ImmutableList.of(
                    new Argument("y", var("y")),
                    new Argument("z", binary(var("y"), "+", var("k1"))))));
    Instruction inst = new Instruction.Assign(call);
    assertThat(inst.toString()).isEqualTo("k1 <- f(t + dt)\nk2 <- f(t + dt, y=y, z=y + k1)");
    assertThat(inst.definedVariables()).containsExactly("k1", "k2").inOrder();
    assertThat(inst.usedVariables()).containsExactly("t", "dt", "y", "k1");
    assertThat(inst.referencedVariables()).containsExactly("k1", "k2", "t", "dt", "y");
  }

  @Test
  public void componentCallArgumentsMustMatchAssignees() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new Assignment.ComponentCall(
                ImmutableList.of("k1", "k2"),
                "f",
                var("t"),
                ImmutableList.of(ImmutableList.<Argument>of())));
  }

  @Test
  public void variablesAreComputedOnce() {
    AtomicInteger calls = new AtomicInteger();
    Expression counting =
        new Expression() {
          @Override
          public String render() {
            return "c";
          }

          @Override
          public ImmutableSet<String> referencedVariables() {
            calls.incrementAndGet();
            return ImmutableSet.of("c");
          }
        };
    Instruction inst = new Instruction.Return(counting);
    ImmutableSet<String> first = inst.usedVariables();
    assertThat(inst.usedVariables()).isSameInstanceAs(first);
    assertThat(inst.referencedVariables()).containsExactly("c");
    assertThat(inst.referencedVariables()).containsExactly("c");
    assertThat(calls.get()).isEqualTo(1);

    Instruction branch = new Instruction.Branch(counting, b1, b2);
    assertThat(branch.jumpTargets()).isSameInstanceAs(branch.jumpTargets());
    Instruction jump = new Instruction.Jump(b1);
    assertThat(jump.jumpTargets()).isSameInstanceAs(jump.jumpTargets());
  }

  @Test
  public void blockIsSetWhileInserted() {
    table.addVariable("x");
    Instruction inst = new Instruction.Assign(new Assignment.Simple("x", constant(0)));
    assertThat(inst.block()).isNull();
    b1.addInstruction(inst);
    assertThat(inst.block()).isSameInstanceAs(b1);
    b1.deleteInstruction(inst);
    assertThat(inst.block()).isNull();
  }
}
