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

import org.segdict.index.CorruptIndexException;
import org.segdict.util.ArrayUtil;

/**
 * Walks the inputs of an FST in sorted order. One frame is kept per depth:
 * frame {@code d} holds the arc taken at that depth and the output summed
 * over the path up to and including it. Frame 0 is the virtual arc into the
 * start node, and a positioned enum always ends on an {@link FST#END_LABEL}
 * arc, so the current input has {@code upto - 1} labels.
 *
 * 子类只负责保存 label 以及提供 seek 的目标
 */
abstract class FSTEnum<T> {
  protected final FST<T> fst;
  protected final FST.BytesReader fstReader;
  protected final T NO_OUTPUT;

  @SuppressWarnings({"rawtypes","unchecked"}) private FST.Arc<T>[] arcs = new FST.Arc[10];
  @SuppressWarnings({"rawtypes","unchecked"}) protected T[] output = (T[]) new Object[10];

  /** Depth of the END arc of the current input, or 0 when not positioned. */
  protected int upto;

  protected FSTEnum(FST<T> fst) {
    this.fst = fst;
    fstReader = fst.getBytesReader();
    NO_OUTPUT = fst.outputs.getNoOutput();
    fst.getFirstArc(getArc(0));
    output[0] = NO_OUTPUT;
  }

  /** Returns label {@code idx} of the seek target, or {@link FST#END_LABEL} once past its end. */
  protected abstract int getTargetLabel(int idx);

  /** Stores label {@code idx} of the current input. */
  protected abstract void setCurrentLabel(int idx, int label);

  /** Ensures room for {@code length} labels. */
  protected abstract void grow(int length);

  /** Advances to the next input; starts over from the smallest one when not positioned. */
  protected final void doNext() throws IOException {
    if (upto == 0) {
      upto = 1;
      fst.readFirstTargetArc(getArc(0), getArc(1), fstReader);
      pushFirst();
    } else if (advanceSibling()) {
      pushFirst();
    }
  }

  /** Positions on the smallest input &gt;= the target, or unpositions when there is none. */
  protected final void doSeekCeil() throws IOException {
    upto = 1;
    FST.Arc<T> arc = fst.readFirstTargetArc(getArc(0), getArc(1), fstReader);
    while (true) {
      final int targetLabel = getTargetLabel(upto - 1);
      if (!ceilArc(arc, targetLabel)) {
        // every arc of this node sorts before the target
        upto--;
        if (advanceSibling()) {
          pushFirst();
        }
        return;
      }
      if (arc.label() != targetLabel) {
        pushFirst();
        return;
      }
      if (enter(arc)) {
        return;
      }
      arc = fst.readFirstTargetArc(arc, getArc(upto), fstReader);
    }
  }

  /** Positions on the largest input &lt;= the target, or unpositions when there is none. */
  protected final void doSeekFloor() throws IOException {
    upto = 1;
    FST.Arc<T> arc = fst.readFirstTargetArc(getArc(0), getArc(1), fstReader);
    while (true) {
      final int targetLabel = getTargetLabel(upto - 1);
      if (!floorArc(arc, targetLabel)) {
        // every arc of this node sorts after the target
        retreatSibling();
        return;
      }
      if (arc.label() != targetLabel) {
        pushLast();
        return;
      }
      if (enter(arc)) {
        return;
      }
      arc = fst.readFirstTargetArc(arc, getArc(upto), fstReader);
    }
  }

  /** Positions on the target and returns true, or unpositions and returns false if it is absent. */
  protected final boolean doSeekExact() throws IOException {
    upto = 1;
    FST.Arc<T> follow = getArc(0);
    while (true) {
      final FST.Arc<T> arc = fst.findTargetArc(getTargetLabel(upto - 1), follow, getArc(upto), fstReader);
      if (arc == null) {
        upto = 0;
        return false;
      }
      if (enter(arc)) {
        return true;
      }
      follow = arc;
    }
  }

  // Records the arc at frame upto. Returns true on the END arc, otherwise
  // opens the next frame and returns false.
  private boolean enter(FST.Arc<T> arc) {
    output[upto] = fst.outputs.add(output[upto - 1], arc.output());
    if (arc.label() == FST.END_LABEL) {
      return true;
    }
    setCurrentLabel(upto - 1, arc.label());
    upto++;
    grow(upto);
    if (upto >= arcs.length) {
      arcs = ArrayUtil.grow(arcs, upto + 1);
    }
    if (upto >= output.length) {
      output = ArrayUtil.grow(output, upto + 1);
    }
    return false;
  }

  // Follows first arcs from frame upto down to an END arc.
  private void pushFirst() throws IOException {
    FST.Arc<T> arc = arcs[upto];
    while (!enter(arc)) {
      arc = fst.readFirstTargetArc(arc, getArc(upto), fstReader);
    }
  }

  // Follows last arcs from frame upto down to an END arc.
  private void pushLast() throws IOException {
    FST.Arc<T> arc = arcs[upto];
    while (!enter(arc)) {
      arc = fst.readLastTargetArc(arc, getArc(upto), fstReader);
    }
  }

  // Pops frames until one has a following sibling and moves it there.
  // Unpositions and returns false when the stack runs out.
  private boolean advanceSibling() throws IOException {
    while (upto > 0 && arcs[upto].isLast()) {
      upto--;
    }
    if (upto == 0) {
      return false;
    }
    fst.readNextArc(arcs[upto], fstReader);
    return true;
  }

  // Pops frames until one has a smaller sibling and moves to the largest
  // such sibling, then descends along last arcs.
  private void retreatSibling() throws IOException {
    while (--upto > 0) {
      final int matched = arcs[upto].label();
      final FST.Arc<T> arc = fst.readFirstTargetArc(arcs[upto - 1], arcs[upto], fstReader);
      // END sorts before every real label, so matched - 1 == END_LABEL still works
      if (arc.label() < matched && floorArc(arc, matched - 1)) {
        pushLast();
        return;
      }
    }
  }

  // Moves arc, the first arc of its node, to the smallest arc with label >= targetLabel.
  private boolean ceilArc(FST.Arc<T> arc, int targetLabel) throws IOException {
    if (arc.label() == FST.END_LABEL) {
      if (targetLabel == FST.END_LABEL) {
        return true;
      }
      if (arc.isLast()) {
        return false;
      }
      fst.readNextArc(arc, fstReader);
    }
    if (arc.bytesPerArc() != 0) {
      int idx = fst.binarySearch(arc, targetLabel, fstReader);
      if (idx < 0) {
        idx = -1 - idx;
        if (idx == arc.numArcs()) {
          return false;
        }
      }
      fst.readArcByIndex(arc, fstReader, idx);
      return true;
    }
    while (arc.label() < targetLabel) {
      if (arc.isLast()) {
        return false;
      }
      fst.readNextArc(arc, fstReader);
    }
    return true;
  }

  // Moves arc, the first arc of its node, to the largest arc with label <= targetLabel.
  private boolean floorArc(FST.Arc<T> arc, int targetLabel) throws IOException {
    if (arc.label() == FST.END_LABEL) {
      if (targetLabel == FST.END_LABEL || arc.isLast() || fst.readNextArcLabel(arc, fstReader) > targetLabel) {
        return true;
      }
      fst.readNextArc(arc, fstReader);
    } else if (arc.label() > targetLabel) {
      return false;
    }
    if (arc.bytesPerArc() != 0) {
      int idx = fst.binarySearch(arc, targetLabel, fstReader);
      if (idx < 0) {
        idx = -2 - idx;
        if (idx < 0) {
          // arc's label is <= targetLabel, so only unsorted labels get here
          throw new CorruptIndexException("arcs are not sorted by label", "offset=" + arc.posArcsStart());
        }
      }
      fst.readArcByIndex(arc, fstReader, idx);
    } else {
      while (!arc.isLast() && fst.readNextArcLabel(arc, fstReader) <= targetLabel) {
        fst.readNextArc(arc, fstReader);
      }
    }
    return true;
  }

  private FST.Arc<T> getArc(int idx) {
    if (arcs[idx] == null) {
      arcs[idx] = new FST.Arc<>();
    }
    return arcs[idx];
  }
}
