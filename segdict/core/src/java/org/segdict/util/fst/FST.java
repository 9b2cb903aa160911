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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.segdict.codecs.CodecUtil;
import org.segdict.index.CorruptIndexException;
import org.segdict.store.ChecksumDataInput;
import org.segdict.store.ChecksumDataOutput;
import org.segdict.store.DataInput;
import org.segdict.store.DataOutput;
import org.segdict.store.GrowableByteArrayDataOutput;
import org.segdict.store.InputStreamDataInput;
import org.segdict.store.OutputStreamDataOutput;
import org.segdict.util.Accountable;
import org.segdict.util.RamUsageEstimator;

/**
 * A finite state transducer held in a compact byte array.
 * <p>
 * Nodes are written back to front: a node's address is the position of its
 * last byte, and readers walk the bytes in reverse. Byte 0 is never a node,
 * so address 0 can mean "no target". A node is either a list of variable
 * length arcs, each starting with a flags byte, or, when it has many arcs,
 * a header followed by arcs padded to one fixed length so a label can be
 * binary searched.
 * <p>
 * An FST is immutable once built or loaded and can be shared by any number
 * of threads; each thread must use its own {@link BytesReader}
 * (see {@link #getBytesReader()}) and its own {@link Arc} instances.
 * <p>
 * The arcs leaving the start node are decoded once, when the FST is
 * created, and every {@link #findTargetArc} from the start node is answered
 * from that cache.
 *
 * 有限状态机
 */
public final class FST<T> implements Accountable {

  /** Range of the int labels of an FST. */
  public enum INPUT_TYPE {BYTE1, BYTE2, BYTE4}

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(8, 2 * Long.BYTES);

  private static final long ARC_SHALLOW_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(2, 3 * Long.BYTES + 3 * Integer.BYTES + 2);

  // arc flags
  static final int BIT_FINAL_ARC = 1;
  static final int BIT_LAST_ARC = 1 << 1;
  static final int BIT_TARGET_NEXT = 1 << 2;
  static final int BIT_STOP_NODE = 1 << 3;

  /** This flag is set if the arc has an output. */
  public static final int BIT_ARC_HAS_OUTPUT = 1 << 4;

  static final int BIT_ARC_HAS_FINAL_OUTPUT = 1 << 5;

  /**
   * First byte of a node with fixed length arcs. A real arc never has the
   * final output bit without the final bit, so this cannot be an arc's flags.
   */
  public static final byte ARCS_FOR_BINARY_SEARCH = BIT_ARC_HAS_FINAL_OUTPUT;

  private static final String FILE_FORMAT_NAME = "FST";
  private static final int VERSION_START = 0;
  private static final int VERSION_CURRENT = VERSION_START;

  // in-memory only: target of arcs into a node without arcs, final or not
  static final long FINAL_END_NODE = -1;
  static final long NON_FINAL_END_NODE = 0;

  /** Label of the virtual arc that marks "the input may end here". */
  public static final int END_LABEL = -1;

  final INPUT_TYPE inputType;

  public final Outputs<T> outputs;

  // output of the empty input, null if the empty input is not accepted
  T emptyOutput;

  /** The bytes being built, null for a loaded FST. */
  final BytesStore bytes;

  /** The bytes of a loaded FST, null for a built one. */
  private final FSTStore fstStore;

  private long startNode = -1;

  /** Sorted labels of the arcs leaving the start node. */
  private int[] cachedRootLabels;

  /** Decoded arcs leaving the start node, parallel to {@link #cachedRootLabels}. Never handed out. */
  private Arc<T>[] cachedRootArcs;

  /**
   * One arc, decoded. Also serves as a cursor over the arcs of its node:
   * {@link #readNextArc} moves it to the following sibling.
   */
  public static final class Arc<T> {

    private int label;

    private T output;

    private long target;

    private byte flags;

    private T nextFinalOutput;

    // list nodes: address of the next arc. END arc: address of the node's first real arc
    private long nextArc;

    private byte nodeFlags;

    // only meaningful for fixed length nodes, ie bytesPerArc != 0
    private int bytesPerArc;

    private long posArcsStart;

    private int arcIdx;

    private int numArcs;

    /** Copies every field of {@code other}; returns this. */
    public Arc<T> copyFrom(Arc<T> other) {
      label = other.label;
      output = other.output;
      target = other.target;
      flags = other.flags;
      nextFinalOutput = other.nextFinalOutput;
      nextArc = other.nextArc;
      nodeFlags = other.nodeFlags;
      bytesPerArc = other.bytesPerArc;
      posArcsStart = other.posArcsStart;
      arcIdx = other.arcIdx;
      numArcs = other.numArcs;
      return this;
    }

    boolean flag(int bit) {
      return FST.flag(flags, bit);
    }

    public boolean isLast() {
      return flag(BIT_LAST_ARC);
    }

    public boolean isFinal() {
      return flag(BIT_FINAL_ARC);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder("Arc(label=");
      b.append(label == END_LABEL ? "END" : "0x" + Integer.toHexString(label));
      b.append(" target=").append(target);
      if (flag(BIT_ARC_HAS_OUTPUT)) {
        b.append(" output=").append(output);
      }
      if (isFinal()) {
        b.append(" final");
        if (flag(BIT_ARC_HAS_FINAL_OUTPUT)) {
          b.append('=').append(nextFinalOutput);
        }
      }
      if (isLast()) {
        b.append(" last");
      }
      if (flag(BIT_TARGET_NEXT)) {
        b.append(" targetNext");
      }
      if (flag(BIT_STOP_NODE)) {
        b.append(" stop");
      }
      if (bytesPerArc != 0) {
        b.append(" fixed[").append(arcIdx).append('/').append(numArcs).append(']');
      }
      return b.append(')').toString();
    }

    public int label() {
      return label;
    }

    public T output() {
      return output;
    }

    /** Address of the target node; 0 or negative when the target has no arcs. */
    public long target() {
      return target;
    }

    public byte flags() {
      return flags;
    }

    public T nextFinalOutput() {
      return nextFinalOutput;
    }

    long nextArc() {
      return nextArc;
    }

    /** Index of this arc in a fixed length node. */
    public int arcIdx() {
      return arcIdx;
    }

    /** First byte of this arc's node; {@link #ARCS_FOR_BINARY_SEARCH} for fixed length nodes. */
    public byte nodeFlags() {
      return nodeFlags;
    }

    /** Address of the first arc of a fixed length node. */
    public long posArcsStart() {
      return posArcsStart;
    }

    /** Length of every arc of a fixed length node, 0 for a list node. */
    public int bytesPerArc() {
      return bytesPerArc;
    }

    /** Number of arcs of a fixed length node. */
    public int numArcs() {
      return numArcs;
    }
  }

  private static boolean flag(int flags, int bit) {
    return (flags & bit) != 0;
  }

  // for FSTCompiler, which owns the bytes until finish
  FST(INPUT_TYPE inputType, Outputs<T> outputs, BytesStore bytes) {
    this.inputType = inputType;
    this.outputs = outputs;
    this.bytes = bytes;
    this.fstStore = null;
  }

  /** Load a previously saved FST. */
  public FST(DataInput in, Outputs<T> outputs) throws IOException {
    this(in, outputs, new OnHeapFSTStore());
  }

  /** Load a previously saved FST, keeping its bytes in the provided store.
   *
   * @throws CorruptIndexException if the input is truncated, or the header,
   *         the start node or the arcs of the start node are invalid
   */
  public FST(DataInput in, Outputs<T> outputs, FSTStore fstStore) throws IOException {
    this.bytes = null;
    this.fstStore = fstStore;
    this.outputs = outputs;

    CodecUtil.checkHeader(in, FILE_FORMAT_NAME, VERSION_START, VERSION_CURRENT);
    final long numBytes;
    try {
      emptyOutput = readEmptyOutput(in);
      final byte type = in.readByte();
      if (type < 0 || type >= INPUT_TYPE.values().length) {
        throw new CorruptIndexException("invalid input type " + type, in.toString());
      }
      inputType = INPUT_TYPE.values()[type];
      startNode = in.readVLong();
      numBytes = in.readVLong();
      fstStore.init(in, numBytes);
    } catch (EOFException e) {
      throw new CorruptIndexException("truncated FST", in.toString(), e);
    }
    if (startNode < 0 || startNode >= numBytes) {
      throw new CorruptIndexException("start node " + startNode + " is outside of the FST bytes (numBytes=" + numBytes + ")", "offset=" + startNode);
    }
    cacheRootArcs();
  }

  // stored reversed, so it reads back with a reverse reader like any final output
  private T readEmptyOutput(DataInput in) throws IOException {
    final byte present = in.readByte();
    if (present == 0) {
      return null;
    } else if (present != 1) {
      throw new CorruptIndexException("invalid empty output flag " + present, in.toString());
    }
    final int length = in.readVInt();
    if (length < 0) {
      throw new CorruptIndexException("invalid empty output length " + length, in.toString());
    }
    final byte[] encoded = new byte[length];
    in.readBytes(encoded, 0, length);
    final BytesReader reader = new ReverseBytesReader(encoded, length);
    reader.setPosition(length - 1);
    return outputs.readFinalOutput(reader);
  }

  private void writeEmptyOutput(DataOutput out) throws IOException {
    if (emptyOutput == null) {
      out.writeByte((byte) 0);
      return;
    }
    out.writeByte((byte) 1);
    final GrowableByteArrayDataOutput buffer = new GrowableByteArrayDataOutput(16);
    outputs.writeFinalOutput(emptyOutput, buffer);
    final int length = buffer.getPosition();
    final byte[] reversed = new byte[length];
    for (int i = 0; i < length; i++) {
      reversed[i] = buffer.getBytes()[length - 1 - i];
    }
    out.writeVInt(length);
    out.writeBytes(reversed, 0, length);
  }

  @Override
  public long ramBytesUsed() {
    long size = BASE_RAM_BYTES_USED + (fstStore != null ? fstStore.ramBytesUsed() : bytes.ramBytesUsed());
    if (cachedRootArcs != null) {
      size += RamUsageEstimator.sizeOf(cachedRootLabels) + RamUsageEstimator.shallowSizeOfArray(cachedRootArcs);
      final T noOutput = outputs.getNoOutput();
      for (Arc<T> arc : cachedRootArcs) {
        size += ARC_SHALLOW_RAM_BYTES_USED;
        if (arc.output() != noOutput) {
          size += outputs.ramBytesUsed(arc.output());
        }
        if (arc.nextFinalOutput() != noOutput) {
          size += outputs.ramBytesUsed(arc.nextFinalOutput());
        }
      }
    }
    return size;
  }

  @Override
  public String toString() {
    return "FST(input=" + inputType + ",output=" + outputs + ")";
  }

  /** Number of node bytes in this FST. */
  public long numBytes() {
    return fstStore != null ? fstStore.size() : bytes.getPosition();
  }

  void finish(long newStartNode) throws IOException {
    if (startNode != -1) {
      throw new IllegalStateException("already finished");
    }
    assert newStartNode < bytes.getPosition();
    // only the empty input: the start node is the final node without arcs
    startNode = newStartNode == FINAL_END_NODE && emptyOutput != null ? 0 : newStartNode;
    bytes.finish();
    cacheRootArcs();
  }

  // Decodes the start node's arcs once; findTargetArc from the start node
  // then never touches the bytes
  private void cacheRootArcs() throws IOException {
    final Arc<T> arc = getFirstArc(new Arc<>());
    final List<Arc<T>> arcs = new ArrayList<>();
    if (targetHasArcs(arc)) {
      final BytesReader in = getBytesReader();
      readFirstRealTargetArc(arc.target(), arc, in);
      while (true) {
        if (!arcs.isEmpty() && arcs.get(arcs.size() - 1).label() >= arc.label()) {
          throw new CorruptIndexException("arcs of the start node are not sorted by label", "offset=" + startNode);
        }
        arcs.add(new Arc<T>().copyFrom(arc));
        if (arc.isLast()) {
          break;
        }
        readNextRealArc(arc, in);
      }
    }
    @SuppressWarnings({"rawtypes","unchecked"}) final Arc<T>[] cached = arcs.toArray(new Arc[0]);
    final int[] labels = new int[cached.length];
    for (int i = 0; i < cached.length; i++) {
      labels[i] = cached[i].label();
    }
    cachedRootLabels = labels;
    cachedRootArcs = cached;
  }

  /** Number of arcs leaving the start node, all of them served from the root arc cache. */
  public int getCachedRootArcCount() {
    return cachedRootArcs == null ? 0 : cachedRootArcs.length;
  }

  public T getEmptyOutput() {
    return emptyOutput;
  }

  void setEmptyOutput(T v) {
    assert emptyOutput == null : "empty output was already set";
    emptyOutput = v;
  }

  public INPUT_TYPE getInputType() {
    return inputType;
  }

  /** Writes the header and the node bytes. */
  public void save(DataOutput out) throws IOException {
    if (startNode == -1) {
      throw new IllegalStateException("call finish first");
    }
    CodecUtil.writeHeader(out, FILE_FORMAT_NAME, VERSION_CURRENT);
    writeEmptyOutput(out);
    out.writeByte((byte) inputType.ordinal());
    out.writeVLong(startNode);
    if (bytes != null) {
      out.writeVLong(bytes.getPosition());
      bytes.writeTo(out);
    } else {
      fstStore.writeTo(out);
    }
  }

  /**
   * Writes an automaton to a file, followed by a checksum footer.
   */
  public void save(final Path path) throws IOException {
    try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(path))) {
      final ChecksumDataOutput out = new ChecksumDataOutput(new OutputStreamDataOutput(os));
      save(out);
      CodecUtil.writeFooter(out);
    }
  }

  /**
   * Reads an automaton from a file written by {@link #save(Path)}.
   *
   * @throws CorruptIndexException if the file is truncated, its checksum does
   *         not match, or its content is not a valid FST
   */
  public static <T> FST<T> read(Path path, Outputs<T> outputs) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      final ChecksumDataInput in = new ChecksumDataInput(new InputStreamDataInput(new BufferedInputStream(is)));
      final FST<T> fst = new FST<>(in, outputs);
      CodecUtil.checkFooter(in);
      return fst;
    } catch (EOFException e) {
      throw new CorruptIndexException("unexpected end of file", path.toString(), e);
    }
  }

  void writeLabel(DataOutput out, int label) throws IOException {
    assert label >= 0 : "label=" + label;
    switch (inputType) {
      case BYTE1:
        assert label <= 0xFF : "label=" + label;
        out.writeByte((byte) label);
        break;
      case BYTE2:
        assert label <= 0xFFFF : "label=" + label;
        out.writeShort((short) label);
        break;
      default:
        out.writeVInt(label);
        break;
    }
  }

  /** Reads one label in this FST's input type. */
  public int readLabel(DataInput in) throws IOException {
    switch (inputType) {
      case BYTE1:
        return in.readByte() & 0xFF;
      case BYTE2:
        return in.readShort() & 0xFFFF;
      default:
        return in.readVInt();
    }
  }

  /** Whether the arc's target node has outgoing arcs. */
  public static <T> boolean targetHasArcs(Arc<T> arc) {
    return arc.target() > 0;
  }

  /** Fills {@code arc} with the virtual arc into the start node. */
  public Arc<T> getFirstArc(Arc<T> arc) {
    final T noOutput = outputs.getNoOutput();
    arc.flags = BIT_LAST_ARC;
    arc.output = noOutput;
    arc.nextFinalOutput = noOutput;
    if (emptyOutput != null) {
      arc.flags |= BIT_FINAL_ARC;
      arc.nextFinalOutput = emptyOutput;
      if (emptyOutput != noOutput) {
        arc.flags |= BIT_ARC_HAS_FINAL_OUTPUT;
      }
    }
    // 0 when the FST only accepts the empty input
    arc.target = startNode;
    return arc;
  }

  // The END arc of a final follow arc. Sorts before every real arc of the
  // node; its nextArc is the node itself, or 0 when the node has no arcs.
  private static <T> Arc<T> endArc(Arc<T> follow, Arc<T> arc) {
    arc.label = END_LABEL;
    arc.output = follow.nextFinalOutput();
    arc.target = FINAL_END_NODE;
    if (targetHasArcs(follow)) {
      arc.flags = BIT_FINAL_ARC;
      arc.nextArc = follow.target();
    } else {
      arc.flags = BIT_FINAL_ARC | BIT_LAST_ARC;
      arc.nextArc = 0;
    }
    arc.nodeFlags = arc.flags;
    return arc;
  }

  /**
   * Reads into {@code arc} the first arc leaving {@code follow}'s target,
   * which is the END arc when {@code follow} is final.
   *
   * @return {@code arc}
   */
  public Arc<T> readFirstTargetArc(Arc<T> follow, Arc<T> arc, BytesReader in) throws IOException {
    if (follow.isFinal()) {
      return endArc(follow, arc);
    }
    return readFirstRealTargetArc(follow.target(), arc, in);
  }

  /**
   * Reads into {@code arc} the last arc leaving {@code follow}'s target;
   * the END arc if the target has no arcs.
   *
   * @return {@code arc}
   */
  Arc<T> readLastTargetArc(Arc<T> follow, Arc<T> arc, BytesReader in) throws IOException {
    if (!targetHasArcs(follow)) {
      if (!follow.isFinal()) {
        throw new CorruptIndexException("non-final arc " + follow + " leads to a node without arcs", "offset=" + follow.target());
      }
      return endArc(follow, arc);
    }
    readFirstRealTargetArc(follow.target(), arc, in);
    if (arc.bytesPerArc() != 0) {
      return readArcByIndex(arc, in, arc.numArcs() - 1);
    }
    while (!arc.isLast()) {
      readNextRealArc(arc, in);
    }
    return arc;
  }

  /** Reads the first real arc of the node at {@code nodeAddress}, never the END arc. */
  public Arc<T> readFirstRealTargetArc(long nodeAddress, Arc<T> arc, BytesReader in) throws IOException {
    if (nodeAddress <= 0) {
      throw new CorruptIndexException("no node at address " + nodeAddress, "offset=" + nodeAddress);
    }
    in.setPosition(nodeAddress);
    arc.nodeFlags = in.readByte();
    if (arc.nodeFlags == ARCS_FOR_BINARY_SEARCH) {
      final long headerEnd = in.getPosition() + 1;
      arc.numArcs = in.readVInt();
      arc.bytesPerArc = in.readVInt();
      if (arc.numArcs <= 0 || arc.bytesPerArc <= 0) {
        throw new CorruptIndexException("invalid fixed length node header: numArcs=" + arc.numArcs + " bytesPerArc=" + arc.bytesPerArc, "offset=" + headerEnd);
      }
      arc.posArcsStart = in.getPosition();
      return readArcByIndex(arc, in, 0);
    }
    arc.bytesPerArc = 0;
    arc.nextArc = nodeAddress;
    return readNextRealArc(arc, in);
  }

  /** Moves {@code arc} to its next sibling, possibly leaving the END arc. */
  public Arc<T> readNextArc(Arc<T> arc, BytesReader in) throws IOException {
    if (arc.label() != END_LABEL) {
      return readNextRealArc(arc, in);
    }
    if (arc.nextArc() <= 0) {
      throw new IllegalArgumentException("cannot readNextArc when arc.isLast()=true");
    }
    return readFirstRealTargetArc(arc.nextArc(), arc, in);
  }

  /** Moves {@code arc} to its next real sibling; {@code arc} must not be the last one. */
  public Arc<T> readNextRealArc(Arc<T> arc, BytesReader in) throws IOException {
    if (arc.nodeFlags() == ARCS_FOR_BINARY_SEARCH) {
      final int next = arc.arcIdx() + 1;
      if (next >= arc.numArcs()) {
        throw new CorruptIndexException("arc index " + next + " out of range (numArcs=" + arc.numArcs() + ")", "offset=" + arc.posArcsStart());
      }
      return readArcByIndex(arc, in, next);
    }
    in.setPosition(arc.nextArc());
    arc.flags = in.readByte();
    return readArcBody(arc, in);
  }

  /** Reads arc {@code idx} of the fixed length node {@code arc} belongs to. */
  public Arc<T> readArcByIndex(Arc<T> arc, BytesReader in, int idx) throws IOException {
    assert arc.bytesPerArc() > 0 && idx >= 0 && idx < arc.numArcs() : "idx=" + idx + " " + arc;
    in.setPosition(arcAddress(arc, idx));
    arc.arcIdx = idx;
    arc.flags = in.readByte();
    return readArcBody(arc, in);
  }

  /** Peeks at the label of the arc after {@code arc}, which must not be the last one. */
  int readNextArcLabel(Arc<T> arc, BytesReader in) throws IOException {
    assert !arc.isLast();
    if (arc.label() == END_LABEL) {
      in.setPosition(arc.nextArc());
      if (in.readByte() == ARCS_FOR_BINARY_SEARCH) {
        // numArcs, bytesPerArc, then the first arc's flags
        in.readVInt();
        in.readVInt();
        in.readByte();
      }
    } else if (arc.bytesPerArc() != 0) {
      in.setPosition(arcAddress(arc, arc.arcIdx() + 1) - 1);
    } else {
      // just past the next arc's flags
      in.setPosition(arc.nextArc() - 1);
    }
    return readLabel(in);
  }

  private static long arcAddress(Arc<?> arc, int idx) {
    return arc.posArcsStart() - idx * (long) arc.bytesPerArc();
  }

  // Everything after the flags byte: label, outputs, target.
  private Arc<T> readArcBody(Arc<T> arc, BytesReader in) throws IOException {
    arc.label = readLabel(in);
    arc.output = arc.flag(BIT_ARC_HAS_OUTPUT) ? outputs.read(in) : outputs.getNoOutput();
    arc.nextFinalOutput = arc.flag(BIT_ARC_HAS_FINAL_OUTPUT) ? outputs.readFinalOutput(in) : outputs.getNoOutput();
    if (arc.flag(BIT_STOP_NODE)) {
      arc.target = arc.isFinal() ? FINAL_END_NODE : NON_FINAL_END_NODE;
      arc.nextArc = in.getPosition();
    } else if (arc.flag(BIT_TARGET_NEXT)) {
      arc.nextArc = in.getPosition();
      arc.target = nodeAfter(arc, in);
    } else {
      arc.target = readTarget(in);
      arc.nextArc = in.getPosition();
    }
    return arc;
  }

  // The node written just before arc's node, which starts where arc's node ends.
  private long nodeAfter(Arc<T> arc, BytesReader in) throws IOException {
    if (arc.isLast()) {
      return in.getPosition();
    }
    if (arc.bytesPerArc() != 0) {
      return arcAddress(arc, arc.numArcs());
    }
    int flags;
    do {
      flags = in.readByte();
      readLabel(in);
      if (flag(flags, BIT_ARC_HAS_OUTPUT)) {
        outputs.skipOutput(in);
      }
      if (flag(flags, BIT_ARC_HAS_FINAL_OUTPUT)) {
        outputs.skipFinalOutput(in);
      }
      if (!flag(flags, BIT_STOP_NODE) && !flag(flags, BIT_TARGET_NEXT)) {
        readTarget(in);
      }
    } while (!flag(flags, BIT_LAST_ARC));
    return in.getPosition();
  }

  // Nodes are written children first, so a target always lies below the
  // bytes of the arc pointing at it. Anything else would be a cycle.
  private long readTarget(BytesReader in) throws IOException {
    final long target = in.readVLong();
    if (target <= 0 || target >= numBytes()) {
      throw new CorruptIndexException("arc target " + target + " is outside of the FST bytes (numBytes=" + numBytes() + ")", "offset=" + target);
    }
    if (target > in.getPosition()) {
      throw new CorruptIndexException("arc target " + target + " does not precede its node", "offset=" + in.getPosition());
    }
    return target;
  }

  /**
   * Binary searches a fixed length node for {@code targetLabel}, starting at
   * {@code arc}'s index. Returns the arc index, or {@code -1 - insertionPoint}.
   */
  int binarySearch(Arc<T> arc, int targetLabel, BytesReader in) throws IOException {
    assert arc.nodeFlags() == ARCS_FOR_BINARY_SEARCH : "not a fixed length node: " + arc;
    int low = arc.arcIdx();
    int high = arc.numArcs() - 1;
    while (low <= high) {
      final int mid = (low + high) >>> 1;
      // skip the flags byte
      in.setPosition(arcAddress(arc, mid) - 1);
      final int label = readLabel(in);
      if (label < targetLabel) {
        low = mid + 1;
      } else if (label > targetLabel) {
        high = mid - 1;
      } else {
        return mid;
      }
    }
    return -1 - low;
  }

  /**
   * Finds the arc labeled {@code labelToMatch} leaving {@code follow}'s
   * target and reads it into {@code arc}. {@link #END_LABEL} matches when
   * {@code follow} is final.
   *
   * @return {@code arc}, or null if there is no such arc
   */
  public Arc<T> findTargetArc(int labelToMatch, Arc<T> follow, Arc<T> arc, BytesReader in) throws IOException {
    if (labelToMatch == END_LABEL) {
      return follow.isFinal() ? endArc(follow, arc) : null;
    }
    if (follow.target() == startNode && cachedRootArcs != null) {
      final int idx = Arrays.binarySearch(cachedRootLabels, labelToMatch);
      return idx < 0 ? null : arc.copyFrom(cachedRootArcs[idx]);
    }
    if (!targetHasArcs(follow)) {
      return null;
    }
    readFirstRealTargetArc(follow.target(), arc, in);
    if (arc.bytesPerArc() != 0) {
      final int idx = binarySearch(arc, labelToMatch, in);
      return idx < 0 ? null : readArcByIndex(arc, in, idx);
    }
    // list nodes are sorted by label
    while (arc.label() < labelToMatch && !arc.isLast()) {
      readNextRealArc(arc, in);
    }
    return arc.label() == labelToMatch ? arc : null;
  }

  /** Returns a new reader over this FST's bytes; one per thread. */
  public BytesReader getBytesReader() {
    if (fstStore != null) {
      return fstStore.getReverseBytesReader();
    } else if (startNode == -1) {
      // still building: the arena may grow under the reader
      return bytes.getReverseReader();
    } else {
      return new ReverseBytesReader(bytes.getBytes(), (int) bytes.getPosition());
    }
  }

  /** Reads FST bytes, backwards. */
  public static abstract class BytesReader extends DataInput {
    public abstract long getPosition();

    public abstract void setPosition(long pos);

    /** Whether reads move towards lower positions. */
    public abstract boolean reversed();
  }
}
