/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.segdict.util.fst;

import java.io.IOException;

/**
 * Finds an already frozen node equal to the one about to be frozen, so
 * equal suffixes are written once. The table stores node addresses only;
 * frozen nodes are hashed and compared by reading their arcs back from
 * the FST bytes.
 *
 * 节点去重表 只保存节点地址 比较时从字节中把arc读回来
 */
final class NodeHash<T> {

  private final FSTCompiler<T> compiler;
  private final FST<T> fst;
  private final FST.BytesReader in;
  private final FST.Arc<T> scratch = new FST.Arc<>();

  // open addressing, 0 marks a free slot (no node lives at address 0)
  private long[] table = new long[16];
  private long count;

  NodeHash(FSTCompiler<T> compiler, FST<T> fst, FST.BytesReader in) {
    this.compiler = compiler;
    this.fst = fst;
    this.in = in;
  }

  /** Returns the address of a frozen node equal to {@code node}, writing it first if there is none. */
  long add(FSTCompiler.UnCompiledNode<T> node) throws IOException {
    final long h = hash(node);
    int slot = (int) h & (table.length - 1);
    while (table[slot] != 0) {
      if (sameNode(node, table[slot])) {
        return table[slot];
      }
      slot = (slot + 1) & (table.length - 1);
    }
    final long address = compiler.writeNode(node);
    assert hash(address) == h : "node " + address + " hashes differently once frozen";
    table[slot] = address;
    if (++count * 3 > table.length * 2L) {
      grow();
    }
    return address;
  }

  /** Number of distinct nodes in the table. */
  long size() {
    return count;
  }

  private static long mix(long h, int label, long target, Object output, Object finalOutput, boolean isFinal) {
    h = 31 * h + label;
    h = 31 * h + Long.hashCode(target);
    h = 31 * h + output.hashCode();
    h = 31 * h + finalOutput.hashCode();
    return isFinal ? h + 17 : h;
  }

  private long hash(FSTCompiler.UnCompiledNode<T> node) {
    long h = 0;
    for (int i = 0; i < node.numArcs; i++) {
      final FSTCompiler.Arc<T> arc = node.arcs[i];
      h = mix(h, arc.label, ((FSTCompiler.CompiledNode) arc.target).node, arc.output, arc.nextFinalOutput, arc.isFinal);
    }
    return h & Long.MAX_VALUE;
  }

  private long hash(long address) throws IOException {
    long h = 0;
    fst.readFirstRealTargetArc(address, scratch, in);
    while (true) {
      h = mix(h, scratch.label(), scratch.target(), scratch.output(), scratch.nextFinalOutput(), scratch.isFinal());
      if (scratch.isLast()) {
        return h & Long.MAX_VALUE;
      }
      fst.readNextRealArc(scratch, in);
    }
  }

  private boolean sameNode(FSTCompiler.UnCompiledNode<T> node, long address) throws IOException {
    fst.readFirstRealTargetArc(address, scratch, in);
    if (scratch.bytesPerArc() != 0 && scratch.numArcs() != node.numArcs) {
      return false;
    }
    for (int i = 0; ; i++) {
      final FSTCompiler.Arc<T> arc = node.arcs[i];
      if (arc.label != scratch.label()
          || arc.isFinal != scratch.isFinal()
          || ((FSTCompiler.CompiledNode) arc.target).node != scratch.target()
          || !arc.output.equals(scratch.output())
          || !arc.nextFinalOutput.equals(scratch.nextFinalOutput())) {
        return false;
      }
      final boolean lastInNode = i == node.numArcs - 1;
      if (scratch.isLast() || lastInNode) {
        return scratch.isLast() && lastInNode;
      }
      fst.readNextRealArc(scratch, in);
    }
  }

  private void grow() throws IOException {
    final long[] old = table;
    if (old.length >= 1 << 30) {
      throw new IllegalStateException("too many distinct nodes to deduplicate: " + count);
    }
    table = new long[old.length * 2];
    for (long address : old) {
      if (address != 0) {
        int slot = (int) hash(address) & (table.length - 1);
        while (table[slot] != 0) {
          slot = (slot + 1) & (table.length - 1);
        }
        table[slot] = address;
      }
    }
  }
}
