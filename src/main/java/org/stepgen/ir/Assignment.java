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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The right-hand side of an {@link Instruction.Assign}. An Assignment is either {@link Simple} (one
 * variable gets the value of one expression) or a {@link ComponentCall} (several variables are each
 * bound to an evaluation of the same external component).
 */
public abstract class Assignment {

  /** We define two subclasses (Simple and ComponentCall), and that's it. */
  private Assignment() {}

  /** Returns the names of the variables written by this assignment. */
  public abstract ImmutableSet<String> assignees();

  /** Returns the names of the variables read by this assignment. */
  public abstract ImmutableSet<String> readVariables();

  /** {@code name <- expression} */
  public static final class Simple extends Assignment {
    public final String name;
    public final Expression expression;

    public Simple(String name, Expression expression) {
      this.name = Preconditions.checkNotNull(name);
      this.expression = Preconditions.checkNotNull(expression);
    }

    @Override
    public ImmutableSet<String> assignees() {
      return ImmutableSet.of(name);
    }

    @Override
    public ImmutableSet<String> readVariables() {
      return expression.referencedVariables();
    }

    @Override
    public String toString() {
      return name + " <- " + expression.render();
    }
  }

  /** A named argument passed to a component. */
  public static final class Argument {
    public final String name;
    public final Expression expression;

    public Argument(String name, Expression expression) {
      this.name = Preconditions.checkNotNull(name);
      this.expression = Preconditions.checkNotNull(expression);
    }

    @Override
    public String toString() {
      return name + "=" + expression.render();
    }
  }

  /**
   * One evaluation step of the external component {@link #componentId} at time {@link #time}, whose
   * results are stored in several state variables. Each assignee has its own argument list: {@code
   * arguments.get(i)} is passed when computing {@code assignees.get(i)}.
   */
  public static final class ComponentCall extends Assignment {
    public final ImmutableList<String> assigneeList;
    public final String componentId;
    public final Expression time;
    public final ImmutableList<ImmutableList<Argument>> arguments;

    public ComponentCall(
        List<String> assignees,
        String componentId,
        Expression time,
        List<? extends List<Argument>> arguments) {
      Preconditions.checkArgument(
          assignees.size() == arguments.size(),
          "%s assignees but %s argument lists",
          assignees.size(),
          arguments.size());
      this.assigneeList = ImmutableList.copyOf(assignees);
      this.componentId = Preconditions.checkNotNull(componentId);
      this.time = Preconditions.checkNotNull(time);
      this.arguments =
          arguments.stream()
              .map(argList -> ImmutableList.<Argument>copyOf(argList))
              .collect(ImmutableList.toImmutableList());
    }

    @Override
    public ImmutableSet<String> assignees() {
      return ImmutableSet.copyOf(assigneeList);
    }

    @Override
    public ImmutableSet<String> readVariables() {
      ImmutableSet.Builder<String> result = ImmutableSet.builder();
      result.addAll(time.referencedVariables());
      for (List<Argument> argList : arguments) {
        for (Argument arg : argList) {
          result.addAll(arg.expression.referencedVariables());
        }
      }
      return result.build();
    }

    @Override
    public String toString() {
      String prefix = componentId + "(" + time.render();
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < assigneeList.size(); i++) {
        if (i != 0) {
          sb.append('\n');
        }
        sb.append(assigneeList.get(i)).append(" <- ").append(prefix);
        List<Argument> argList = arguments.get(i);
        if (!argList.isEmpty()) {
          sb.append(
              argList.stream().map(Argument::toString).collect(Collectors.joining(", ", ", ", "")));
        }
        sb.append(')');
      }
      return sb.toString();
    }
  }
}
