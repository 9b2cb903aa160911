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

import org.segdict.util.BytesRef;
import org.segdict.util.IntsRef;
import org.segdict.util.IntsRefBuilder;

/**
 * Static helpers for looking up inputs and converting them to labels.
 *
 * FST 相关的静态工具方法
 */
public final class Util {
  private Util() {
  }

  /** Returns the output for {@code input}, or null if the FST does not accept it. */
  public static <T> T get(FST<T> fst, IntsRef input) throws IOException {
    final int[] labels = new int[input.length];
    System.arraycopy(input.ints, input.offset, labels, 0, input.length);
    return lookup(fst, labels);
  }

  /** Returns the output for the byte string {@code input}, or null if the FST does not accept it. */
  public static <T> T get(FST<T> fst, BytesRef input) throws IOException {
    assert fst.inputType == FST.INPUT_TYPE.BYTE1;
    final int[] labels = new int[input.length];
    for (int i = 0; i < input.length; i++) {
      labels[i] = input.bytes[input.offset + i] & 0xFF;
    }
    return lookup(fst, labels);
  }

  private static <T> T lookup(FST<T> fst, int[] labels) throws IOException {
    final FST.BytesReader in = fst.getBytesReader();
    final FST.Arc<T> arc = fst.getFirstArc(new FST.Arc<>());
    T output = fst.outputs.getNoOutput();
    for (int label : labels) {
      if (fst.findTargetArc(label, arc, arc, in) == null) {
        return null;
      }
      output = fst.outputs.add(output, arc.output());
    }
    return arc.isFinal() ? fst.outputs.add(output, arc.nextFinalOutput()) : null;
  }

  /** Returns true if the FST accepts the given input. */
  public static <T> boolean accepts(FST<T> fst, BytesRef input) throws IOException {
    return get(fst, input) != null;
  }

  /** Fills {@code scratch} with the code points of {@code s}. */
  public static IntsRef toUTF32(CharSequence s, IntsRefBuilder scratch) {
    scratch.clear();
    for (int i = 0; i < s.length(); ) {
      final int codePoint = Character.codePointAt(s, i);
      scratch.append(codePoint);
      i += Character.charCount(codePoint);
    }
    return scratch.get();
  }

  /** Fills {@code scratch} with the unsigned byte values of {@code input}. */
  public static IntsRef toIntsRef(BytesRef input, IntsRefBuilder scratch) {
    scratch.clear();
    for (int i = 0; i < input.length; i++) {
      scratch.append(input.bytes[input.offset + i] & 0xFF);
    }
    return scratch.get();
  }

  /** Number of arcs leaving the target node of {@code follow}. */
  static <T> int countArcs(FST<T> fst, FST.Arc<T> follow) throws IOException {
    if (!FST.targetHasArcs(follow)) {
      return 0;
    }
    final FST.BytesReader in = fst.getBytesReader();
    final FST.Arc<T> arc = fst.readFirstRealTargetArc(follow.target(), new FST.Arc<>(), in);
    if (arc.bytesPerArc() != 0) {
      return arc.numArcs();
    }
    int count = 1;
    while (!arc.isLast()) {
      fst.readNextRealArc(arc, in);
      count++;
    }
    return count;
  }
}
