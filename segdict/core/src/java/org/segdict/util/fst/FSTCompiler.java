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

import org.segdict.store.ByteArrayDataOutput;
import org.segdict.util.ArrayUtil;
import org.segdict.util.IntsRef;
import org.segdict.util.IntsRefBuilder;
import org.segdict.util.fst.FST.INPUT_TYPE;

/**
 * Compiles sorted (input, output) pairs into a minimal acyclic {@link FST}.
 *
 * <p>Inputs are sequences of int labels and must arrive in strictly
 * increasing order; an out of order or repeated input is rejected with an
 * {@link IllegalArgumentException}. The empty input, if present, has to be
 * the first one. Outputs are pushed as close to the start node as the
 * {@link Outputs} algebra allows, so inputs sharing a prefix share the
 * output of that prefix.
 *
 * <p>Only the nodes along the last input (the frontier) are kept in
 * memory. Once a node can no longer change it is frozen: serialized into
 * the FST bytes or, with suffix sharing on, replaced by an equal node that
 * was frozen before. After {@link #compile()} the compiler refuses any
 * further call.
 *
 * <p>Not thread safe.
 *
 * 通过预先排序好的term 构建FST  公共前缀共享arc 公共后缀共享节点
 */
public class FSTCompiler<T> {

  /** Nodes at most this deep get fixed length arcs once they reach {@link #FIXED_LENGTH_ARC_SHALLOW_NUM_ARCS} arcs. */
  static final int FIXED_LENGTH_ARC_SHALLOW_DEPTH = 3;

  static final int FIXED_LENGTH_ARC_SHALLOW_NUM_ARCS = 5;

  /** Nodes at any depth get fixed length arcs from this many arcs on. */
  static final int FIXED_LENGTH_ARC_DEEP_NUM_ARCS = 10;

  final FST<T> fst;
  final BytesStore bytes;
  private final NodeHash<T> dedupHash;
  private final T NO_OUTPUT;

  private final boolean doShareNonSingletonNodes;
  private final int shareMaxTailLength;
  private final boolean allowFixedLengthArcs;

  private final IntsRefBuilder lastInput = new IntsRefBuilder();
  private boolean started;
  private boolean compiled;

  // frontier[d] is the unfrozen node reached after the first d labels of lastInput
  private UnCompiledNode<T>[] frontier;

  // Address of the node written last. An arc pointing at it is flagged
  // BIT_TARGET_NEXT instead of storing the address.
  private long lastFrozenNode;

  // byte length of each arc of the node being written, for fixed length nodes
  private int[] arcLengths = new int[4];

  private long arcCount;
  private long nodeCount;
  private long binarySearchNodeCount;

  /**
   * A compiler with the default settings: full suffix sharing, fixed
   * length arcs allowed, 32 KB arena blocks.
   */
  public FSTCompiler(INPUT_TYPE inputType, Outputs<T> outputs) {
    this(inputType, true, true, Integer.MAX_VALUE, outputs, true, 15);
  }

  private FSTCompiler(INPUT_TYPE inputType, boolean doShareSuffix, boolean doShareNonSingletonNodes,
                      int shareMaxTailLength, Outputs<T> outputs, boolean allowFixedLengthArcs, int bytesPageBits) {
    if (shareMaxTailLength < 0) {
      throw new IllegalArgumentException("shareMaxTailLength must be >= 0, got: " + shareMaxTailLength);
    }
    if (bytesPageBits < 1 || bytesPageBits > 30) {
      throw new IllegalArgumentException("bytesPageBits must be in [1, 30], got: " + bytesPageBits);
    }
    this.doShareNonSingletonNodes = doShareNonSingletonNodes;
    this.shareMaxTailLength = shareMaxTailLength;
    this.allowFixedLengthArcs = allowFixedLengthArcs;
    NO_OUTPUT = outputs.getNoOutput();

    bytes = new BytesStore(bytesPageBits);
    // address 0 stands for "no target", so no node may start there
    bytes.writeByte((byte) 0);
    fst = new FST<>(inputType, outputs, bytes);
    dedupHash = doShareSuffix ? new NodeHash<>(this, fst, bytes.getReverseReader()) : null;

    @SuppressWarnings({"rawtypes","unchecked"}) final UnCompiledNode<T>[] nodes = (UnCompiledNode<T>[]) new UnCompiledNode[10];
    frontier = nodes;
    for (int depth = 0; depth < frontier.length; depth++) {
      frontier[depth] = new UnCompiledNode<>(this, depth);
    }
  }

  /**
   * Configures and creates an {@link FSTCompiler}. Every setting has a
   * default that yields a fully minimal FST.
   */
  public static class Builder<T> {

    private final INPUT_TYPE inputType;
    private final Outputs<T> outputs;
    private boolean shouldShareSuffix = true;
    private boolean shouldShareNonSingletonNodes = true;
    private int shareMaxTailLength = Integer.MAX_VALUE;
    private boolean allowFixedLengthArcs = true;
    private int bytesPageBits = 15;

    /**
     * @param inputType range of the labels; use {@link INPUT_TYPE#BYTE1} for
     *                  byte strings and {@link INPUT_TYPE#BYTE4} for code points
     * @param outputs   the output algebra
     */
    public Builder(INPUT_TYPE inputType, Outputs<T> outputs) {
      this.inputType = inputType;
      this.outputs = outputs;
    }

    /**
     * Whether equal suffixes are stored once. Turning it off skips the
     * dedup table and builds a plain trie: faster, less memory while
     * building, bigger result. Default {@code true}.
     */
    public Builder<T> shouldShareSuffix(boolean shouldShareSuffix) {
      this.shouldShareSuffix = shouldShareSuffix;
      return this;
    }

    /**
     * With suffix sharing on, whether nodes with more than one arc are
     * shared too. Default {@code true}.
     */
    public Builder<T> shouldShareNonSingletonNodes(boolean shouldShareNonSingletonNodes) {
      this.shouldShareNonSingletonNodes = shouldShareNonSingletonNodes;
      return this;
    }

    /**
     * With suffix sharing on, only nodes at most this far from the end of
     * an input are shared. Default {@link Integer#MAX_VALUE}.
     */
    public Builder<T> shareMaxTailLength(int shareMaxTailLength) {
      this.shareMaxTailLength = shareMaxTailLength;
      return this;
    }

    /**
     * Whether nodes with many arcs are written with fixed length arcs so
     * lookups can binary search them. Default {@code true}.
     */
    public Builder<T> allowFixedLengthArcs(boolean allowFixedLengthArcs) {
      this.allowFixedLengthArcs = allowFixedLengthArcs;
      return this;
    }

    /**
     * Log2 of the arena block size used while building. Default 15.
     */
    public Builder<T> bytesPageBits(int bytesPageBits) {
      this.bytesPageBits = bytesPageBits;
      return this;
    }

    public FSTCompiler<T> build() {
      return new FSTCompiler<>(inputType, shouldShareSuffix, shouldShareNonSingletonNodes,
          shareMaxTailLength, outputs, allowFixedLengthArcs, bytesPageBits);
    }
  }

  /** Number of inputs added so far. */
  public long getTermCount() {
    return frontier[0].inputCount;
  }

  /** Number of nodes written, plus one for the shared final node without arcs. */
  public long getNodeCount() {
    return 1 + nodeCount;
  }

  public long getArcCount() {
    return arcCount;
  }

  /** Number of distinct nodes in the dedup table, 0 without suffix sharing. */
  public long getMappedStateCount() {
    return dedupHash == null ? 0 : dedupHash.size();
  }

  /** Number of nodes written with fixed length arcs. */
  public long getBinarySearchNodeCount() {
    return binarySearchNodeCount;
  }

  public long fstRamBytesUsed() {
    return fst.ramBytesUsed();
  }

  /**
   * Adds the next input and its output.
   *
   * @throws IllegalArgumentException if the input is not greater than the
   *         previous one, has a label outside the input type, or the
   *         output is null
   * @throws IllegalStateException if {@link #compile()} was already called
   */
  public void add(IntsRef input, T output) throws IOException {
    if (compiled) {
      throw new IllegalStateException("FST was already compiled");
    }
    if (output == null) {
      throw new IllegalArgumentException("output must not be null");
    }
    if (started && input.compareTo(lastInput.get()) <= 0) {
      throw new IllegalArgumentException("inputs are added out of order or duplicate: lastInput=" + lastInput.get() + " vs input=" + input);
    }
    checkLabels(input);
    // readers compare against NO_OUTPUT by identity
    if (output.equals(NO_OUTPUT)) {
      output = NO_OUTPUT;
    }
    started = true;

    if (input.length == 0) {
      // finality lives on incoming arcs and the start node has none, so the
      // empty input is kept aside on the FST itself
      frontier[0].inputCount++;
      frontier[0].isFinal = true;
      fst.setEmptyOutput(output);
      return;
    }

    final int prefixLength = countSharedPrefix(input);
    if (frontier.length <= input.length) {
      final UnCompiledNode<T>[] grown = ArrayUtil.grow(frontier, input.length + 1);
      for (int depth = frontier.length; depth < grown.length; depth++) {
        grown[depth] = new UnCompiledNode<>(this, depth);
      }
      frontier = grown;
    }

    freezeTail(prefixLength + 1);

    for (int depth = prefixLength + 1; depth <= input.length; depth++) {
      frontier[depth - 1].addArc(input.ints[input.offset + depth - 1], frontier[depth]);
      frontier[depth].inputCount++;
    }
    final UnCompiledNode<T> last = frontier[input.length];
    last.isFinal = true;
    last.output = NO_OUTPUT;

    // what is left goes on the first arc of the new suffix
    output = pushOutputsForward(input, prefixLength, output);
    frontier[prefixLength].setLastOutput(input.ints[input.offset + prefixLength], output);

    lastInput.copyInts(input);
  }

  // Returns how many leading labels input shares with lastInput, counting
  // the input on every frontier node along that prefix.
  private int countSharedPrefix(IntsRef input) {
    final int limit = Math.min(lastInput.length(), input.length);
    int length = 0;
    frontier[0].inputCount++;
    while (length < limit && lastInput.intAt(length) == input.ints[input.offset + length]) {
      length++;
      frontier[length].inputCount++;
    }
    return length;
  }

  // Each arc of the shared prefix keeps only what its output has in common
  // with the new output; the remainder moves onto the arcs one node deeper.
  // Returns the part of output not yet placed on the prefix.
  private T pushOutputsForward(IntsRef input, int prefixLength, T output) {
    final Outputs<T> outputs = fst.outputs;
    for (int depth = 1; depth <= prefixLength; depth++) {
      final UnCompiledNode<T> parent = frontier[depth - 1];
      final int label = input.ints[input.offset + depth - 1];
      final T arcOutput = parent.getLastOutput(label);
      if (arcOutput == NO_OUTPUT) {
        continue;
      }
      final T common = outputs.common(output, arcOutput);
      assert validOutput(common);
      parent.setLastOutput(label, common);
      frontier[depth].prependOutput(outputs.subtract(arcOutput, common));
      output = outputs.subtract(output, common);
      assert validOutput(output);
    }
    return output;
  }

  private void checkLabels(IntsRef input) {
    final int maxLabel;
    switch (fst.inputType) {
      case BYTE1:
        maxLabel = 0xFF;
        break;
      case BYTE2:
        maxLabel = 0xFFFF;
        break;
      default:
        maxLabel = Integer.MAX_VALUE;
        break;
    }
    for (int i = 0; i < input.length; i++) {
      final int label = input.ints[input.offset + i];
      if (label < 0 || label > maxLabel) {
        throw new IllegalArgumentException("label " + label + " at position " + i + " is out of range for input type " + fst.inputType);
      }
    }
  }

  private boolean validOutput(T output) {
    return output == NO_OUTPUT || !output.equals(NO_OUTPUT);
  }

  /**
   * Freezes the remaining nodes and returns the FST, or null when nothing
   * was added.
   *
   * @throws IllegalStateException if called more than once
   */
  public FST<T> compile() throws IOException {
    if (compiled) {
      throw new IllegalStateException("FST was already compiled");
    }
    compiled = true;

    freezeTail(0);
    final UnCompiledNode<T> root = frontier[0];
    if (root.numArcs == 0 && fst.emptyOutput == null) {
      return null;
    }
    fst.finish(compileNode(root, lastInput.length()).node);
    return fst;
  }

  // Freezes the nodes of lastInput deeper than keepDepth - 1, deepest first,
  // and points their parents' last arcs at the frozen copies.
  private void freezeTail(int keepDepth) throws IOException {
    final int length = lastInput.length();
    for (int depth = length; depth >= Math.max(1, keepDepth); depth--) {
      final UnCompiledNode<T> node = frontier[depth];
      final T finalOutput = node.output;
      // a dead end is always accepting
      final boolean isFinal = node.isFinal || node.numArcs == 0;
      final CompiledNode frozen = compileNode(node, 1 + length - depth);
      frontier[depth - 1].replaceLast(lastInput.intAt(depth - 1), frozen, finalOutput, isFinal);
    }
  }

  private CompiledNode compileNode(UnCompiledNode<T> nodeIn, int tailLength) throws IOException {
    final long before = bytes.getPosition();
    final boolean share = dedupHash != null && nodeIn.numArcs > 0
        && (doShareNonSingletonNodes || nodeIn.numArcs == 1) && tailLength <= shareMaxTailLength;
    final long address = share ? dedupHash.add(nodeIn) : writeNode(nodeIn);
    if (bytes.getPosition() != before) {
      lastFrozenNode = address;
    }
    nodeIn.clear();

    final CompiledNode frozen = new CompiledNode();
    frozen.node = address;
    return frozen;
  }

  /**
   * Appends a node and returns its address, the position of its last byte.
   * Arcs are written front to back and the whole node is then reversed, so
   * readers walk it backwards from the address.
   */
  long writeNode(UnCompiledNode<T> nodeIn) throws IOException {
    if (nodeIn.numArcs == 0) {
      return nodeIn.isFinal ? FST.FINAL_END_NODE : FST.NON_FINAL_END_NODE;
    }
    final long start = bytes.getPosition();
    final boolean fixedLength = useFixedLengthArcs(nodeIn);
    if (fixedLength && arcLengths.length < nodeIn.numArcs) {
      arcLengths = new int[ArrayUtil.oversize(nodeIn.numArcs, Integer.BYTES)];
    }

    int maxArcLength = 0;
    long arcStart = start;
    for (int i = 0; i < nodeIn.numArcs; i++) {
      writeArc(nodeIn.arcs[i], i == nodeIn.numArcs - 1, fixedLength);
      if (fixedLength) {
        final long arcEnd = bytes.getPosition();
        arcLengths[i] = (int) (arcEnd - arcStart);
        maxArcLength = Math.max(maxArcLength, arcLengths[i]);
        arcStart = arcEnd;
      }
    }
    arcCount += nodeIn.numArcs;

    if (fixedLength) {
      widenArcs(nodeIn.numArcs, start, maxArcLength);
      binarySearchNodeCount++;
    }

    final long address = bytes.getPosition() - 1;
    bytes.reverse(start, address);
    nodeCount++;
    return address;
  }

  private boolean useFixedLengthArcs(UnCompiledNode<T> node) {
    if (!allowFixedLengthArcs) {
      return false;
    }
    if (node.depth <= FIXED_LENGTH_ARC_SHALLOW_DEPTH) {
      return node.numArcs >= FIXED_LENGTH_ARC_SHALLOW_NUM_ARCS;
    }
    return node.numArcs >= FIXED_LENGTH_ARC_DEEP_NUM_ARCS;
  }

  private void writeArc(Arc<T> arc, boolean last, boolean fixedLength) throws IOException {
    final long target = ((CompiledNode) arc.target).node;
    final boolean hasOutput = arc.output != NO_OUTPUT;
    final boolean hasFinalOutput = arc.nextFinalOutput != NO_OUTPUT;
    assert arc.isFinal || !hasFinalOutput;

    int flags = 0;
    if (last) {
      flags |= FST.BIT_LAST_ARC;
    }
    // fixed length arcs must each carry their target
    if (!fixedLength && target == lastFrozenNode) {
      flags |= FST.BIT_TARGET_NEXT;
    }
    if (arc.isFinal) {
      flags |= FST.BIT_FINAL_ARC;
      if (hasFinalOutput) {
        flags |= FST.BIT_ARC_HAS_FINAL_OUTPUT;
      }
    }
    if (target <= 0) {
      flags |= FST.BIT_STOP_NODE;
    }
    if (hasOutput) {
      flags |= FST.BIT_ARC_HAS_OUTPUT;
    }

    bytes.writeByte((byte) flags);
    fst.writeLabel(bytes, arc.label);
    if (hasOutput) {
      fst.outputs.write(arc.output, bytes);
    }
    if (hasFinalOutput) {
      fst.outputs.writeFinalOutput(arc.nextFinalOutput, bytes);
    }
    if (target > 0 && (flags & FST.BIT_TARGET_NEXT) == 0) {
      bytes.writeVLong(target);
    }
  }

  // Spreads the arcs written since start to arcLength bytes each and puts
  // the node header (marker, arc count, arc length) in front of them.
  private void widenArcs(int numArcs, long start, int arcLength) throws IOException {
    assert arcLength > 0;
    final byte[] header = new byte[11];
    final ByteArrayDataOutput headerOut = new ByteArrayDataOutput(header);
    headerOut.writeByte(FST.ARCS_FOR_BINARY_SEARCH);
    headerOut.writeVInt(numArcs);
    headerOut.writeVInt(arcLength);
    final int headerLength = headerOut.getPosition();

    final long firstArc = start + headerLength;
    long src = bytes.getPosition();
    bytes.extend((int) (firstArc + numArcs * (long) arcLength - src));
    // last arc first, so no arc is overwritten before it has moved
    for (int i = numArcs - 1; i >= 0; i--) {
      src -= arcLengths[i];
      final long dest = firstArc + i * (long) arcLength;
      if (dest != src) {
        bytes.moveBytes(src, dest, arcLengths[i]);
      }
    }
    bytes.setBytes(start, header, 0, headerLength);
  }

  /** An arc of a node that is not frozen yet. */
  static class Arc<T> {
    int label;
    // UnCompiledNode until the target is frozen, CompiledNode after
    Node target;
    boolean isFinal;
    T output;
    T nextFinalOutput;
  }

  interface Node {
    boolean isCompiled();
  }

  static final class CompiledNode implements Node {
    long node;

    @Override
    public boolean isCompiled() {
      return true;
    }
  }

  /** A frontier node: its arcs may still change while inputs are added. */
  static final class UnCompiledNode<T> implements Node {
    final FSTCompiler<T> owner;
    /** Distance from the start node; fixed for a frontier slot. */
    final int depth;
    int numArcs;
    Arc<T>[] arcs;
    T output;
    boolean isFinal;
    long inputCount;

    @SuppressWarnings({"rawtypes","unchecked"})
    UnCompiledNode(FSTCompiler<T> owner, int depth) {
      this.owner = owner;
      this.depth = depth;
      arcs = (Arc<T>[]) new Arc[1];
      arcs[0] = new Arc<>();
      output = owner.NO_OUTPUT;
    }

    @Override
    public boolean isCompiled() {
      return false;
    }

    void clear() {
      numArcs = 0;
      isFinal = false;
      output = owner.NO_OUTPUT;
      inputCount = 0;
    }

    T getLastOutput(int label) {
      assert numArcs > 0 && arcs[numArcs - 1].label == label;
      return arcs[numArcs - 1].output;
    }

    void addArc(int label, Node target) {
      assert label >= 0;
      assert numArcs == 0 || label > arcs[numArcs - 1].label : "label " + label + " after " + arcs[numArcs - 1].label;
      if (numArcs == arcs.length) {
        final Arc<T>[] grown = ArrayUtil.grow(arcs, numArcs + 1);
        for (int i = numArcs; i < grown.length; i++) {
          grown[i] = new Arc<>();
        }
        arcs = grown;
      }
      final Arc<T> arc = arcs[numArcs++];
      arc.label = label;
      arc.target = target;
      arc.output = owner.NO_OUTPUT;
      arc.nextFinalOutput = owner.NO_OUTPUT;
      arc.isFinal = false;
    }

    void replaceLast(int label, Node target, T nextFinalOutput, boolean isFinal) {
      final Arc<T> arc = arcs[numArcs - 1];
      assert arc.label == label : "last arc has label " + arc.label + ", expected " + label;
      arc.target = target;
      arc.nextFinalOutput = nextFinalOutput;
      arc.isFinal = isFinal;
    }

    void setLastOutput(int label, T output) {
      assert owner.validOutput(output);
      final Arc<T> arc = arcs[numArcs - 1];
      assert arc.label == label;
      arc.output = output;
    }

    // adds prefix in front of the output of every arc and of the node itself
    void prependOutput(T prefix) {
      final Outputs<T> outputs = owner.fst.outputs;
      for (int i = 0; i < numArcs; i++) {
        arcs[i].output = outputs.add(prefix, arcs[i].output);
      }
      if (isFinal) {
        output = outputs.add(prefix, output);
      }
    }
  }
}
