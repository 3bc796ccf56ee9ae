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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.flogger.FluentLogger;
import com.google.common.html.HtmlEscapers;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Collectors;
import org.stepgen.util.StringUtil;

/**
 * A ControlFlowGraph is the set of BasicBlocks reachable from a start block by following successor
 * links.
 *
 * <p>The graph does not track changes to its blocks: {@link #postorder}, {@link #reversePostorder}
 * and {@link #isAcyclic} describe the blocks as they were at the most recent call to {@link
 * #update}, which must be called again after any change to the block graph.
 */
public class ControlFlowGraph implements Iterable<BasicBlock> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The width at which {@link #toDot()} wraps instruction text. */
  public static final int DEFAULT_WRAP_WIDTH = 80;

  private static final String WRAP_INDENT = "    ";

  private final BasicBlock startBlock;

  /** The reachable blocks, in the order that a depth-first traversal finished them. */
  private ImmutableList<BasicBlock> postorderTraversal;

  private boolean acyclic;

  /** The traversal state of a block during {@link #update}; unvisited blocks have no state. */
  private enum State {
    /** The block is on the current traversal path. */
    VISITING,
    /** The block and everything reachable from it has been traversed. */
    FINISHED
  }

  /** An entry on the explicit stack used by {@link #update}. */
  private static class Frame {
    final BasicBlock block;

    /** The successors of {@code block} that have not yet been examined. */
    final Iterator<BasicBlock> remaining;

    Frame(BasicBlock block) {
      this.block = block;
      this.remaining = block.successors().iterator();
    }
  }

  public ControlFlowGraph(BasicBlock startBlock) {
    this.startBlock = Preconditions.checkNotNull(startBlock);
    update();
  }

  public BasicBlock startBlock() {
    return startBlock;
  }

  public SymbolTable symbolTable() {
    return startBlock.symbolTable();
  }

  /**
   * Recomputes the postorder traversal and acyclicity from the current block graph.
   *
   * <p>The traversal is a depth-first search with an explicit stack. A block is VISITING from when
   * it is pushed until all its successors have been examined; a link to a VISITING block is a back
   * edge, which means the graph has a cycle. A block that is reachable along several paths is only
   * traversed once.
   */
  public void update() {
    ImmutableList.Builder<BasicBlock> postorder = ImmutableList.builder();
    Map<BasicBlock, State> states = new IdentityHashMap<>();
    Deque<Frame> stack = new ArrayDeque<>();
    boolean foundBackEdge = false;
    states.put(startBlock, State.VISITING);
    stack.push(new Frame(startBlock));
    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.remaining.hasNext()) {
        BasicBlock successor = top.remaining.next();
        State state = states.get(successor);
        if (state == null) {
          states.put(successor, State.VISITING);
          stack.push(new Frame(successor));
        } else if (state == State.VISITING) {
          foundBackEdge = true;
        }
      } else {
        stack.pop();
        states.put(top.block, State.FINISHED);
        postorder.add(top.block);
      }
    }
    postorderTraversal = postorder.build();
    acyclic = !foundBackEdge;
    logger.atFine().log(
        "Updated graph from block %d: %d blocks, acyclic=%s\n%s",
        startBlock.number(), postorderTraversal.size(), acyclic, lazy(this::toString));
  }

  /** Returns true if there were no cycles at the most recent {@link #update}. */
  public boolean isAcyclic() {
    return acyclic;
  }

  /**
   * Returns the reachable blocks in postorder: each block appears after every block that was first
   * reached through it.
   */
  public ImmutableList<BasicBlock> postorder() {
    return postorderTraversal;
  }

  /**
   * Returns the reachable blocks in reverse postorder, which is the natural order for forward
   * dataflow. The start block is always first.
   */
  public ImmutableList<BasicBlock> reversePostorder() {
    return postorderTraversal.reverse();
  }

  /** Iterates over the blocks in postorder. */
  @Override
  public Iterator<BasicBlock> iterator() {
    return postorderTraversal.iterator();
  }

  /** The number of reachable blocks. */
  public int size() {
    return postorderTraversal.size();
  }

  /** Returns a Graphviz rendering of this graph, wrapping instructions at 80 characters. */
  public String toDot() {
    return toDot(DEFAULT_WRAP_WIDTH);
  }

  /**
   * Returns a Graphviz rendering of this graph: one box per block, listing its instructions, an
   * edge for each successor link, and an invisible {@code entry} node linked to the start block.
   * Instruction lines longer than {@code wrapWidth} are wrapped.
   */
  public String toDot(int wrapWidth) {
    Escaper escaper = HtmlEscapers.htmlEscaper();
    StringBuilder sb = new StringBuilder();
    sb.append("digraph ControlFlowGraph {\n");
    for (BasicBlock block : postorderTraversal) {
      int name = block.number();
      sb.append(name).append(" [shape=box,label=<\n");
      sb.append("<table border=\"0\">\n");
      sb.append("<tr>\n<td align=\"center\"><font face=\"Helvetica\">\n");
      sb.append("<b>basic block ").append(name).append("</b>\n");
      sb.append("</font></td>\n</tr>\n");
      for (Instruction inst : block) {
        // Multi-line instructions (component calls) are wrapped one line at a time.
        for (String instLine : inst.toString().split("\n")) {
          for (String line : StringUtil.wrap(instLine, wrapWidth, WRAP_INDENT)) {
            sb.append("<tr>\n<td align=\"left\">\n<font face=\"Courier\">\n");
            sb.append(escaper.escape(line).replace(" ", "&nbsp;")).append('\n');
            sb.append("</font>\n</td>\n</tr>\n");
          }
        }
      }
      sb.append("</table>>]\n");
      for (BasicBlock successor : block.successors()) {
        sb.append(name).append(" -> ").append(successor.number()).append(";\n");
      }
    }
    sb.append("entry [style=invisible];\n");
    sb.append("entry -> ").append(startBlock.number()).append(";\n");
    sb.append("}");
    return sb.toString();
  }

  /** Returns the listing of each block, in reverse postorder. */
  @Override
  public String toString() {
    return reversePostorder().stream().map(BasicBlock::toString).collect(Collectors.joining("\n"));
  }
}
