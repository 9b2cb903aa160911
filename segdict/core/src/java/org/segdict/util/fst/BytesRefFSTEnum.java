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

import org.segdict.util.ArrayUtil;
import org.segdict.util.BytesRef;

/**
 * Iterates the (input, output) pairs of an FST whose inputs are byte
 * strings, in unsigned byte order. The empty input, when accepted, comes
 * first.
 *
 * <p>The {@link InputOutput} handed out is shared across calls, so copy
 * its input before advancing if you need to keep it.
 */
public final class BytesRefFSTEnum<T> extends FSTEnum<T> {
  private final BytesRef current = new BytesRef(10);
  private final InputOutput<T> result = new InputOutput<>();
  private BytesRef target;

  /** One input and the output the FST maps it to. */
  public static class InputOutput<T> {
    public BytesRef input;
    public T output;
  }

  public BytesRefFSTEnum(FST<T> fst) {
    super(fst);
    result.input = current;
  }

  /** The pair the enum is positioned on, or null if it is not positioned. */
  public InputOutput<T> current() {
    return position();
  }

  /** Moves to the next pair; null after the last one, and the call after that starts over. */
  public InputOutput<T> next() throws IOException {
    doNext();
    return position();
  }

  /** Moves to the smallest input &gt;= target. */
  public InputOutput<T> seekCeil(BytesRef target) throws IOException {
    this.target = target;
    doSeekCeil();
    return position();
  }

  /** Moves to the largest input &lt;= target. */
  public InputOutput<T> seekFloor(BytesRef target) throws IOException {
    this.target = target;
    doSeekFloor();
    return position();
  }

  /** Moves to exactly target, returning null (and unpositioning) if the FST does not accept it. */
  public InputOutput<T> seekExact(BytesRef target) throws IOException {
    this.target = target;
    return doSeekExact() ? position() : null;
  }

  @Override
  protected int getTargetLabel(int idx) {
    return idx == target.length ? FST.END_LABEL : target.bytes[target.offset + idx] & 0xFF;
  }

  @Override
  protected void setCurrentLabel(int idx, int label) {
    current.bytes[idx] = (byte) label;
  }

  @Override
  protected void grow(int length) {
    current.bytes = ArrayUtil.grow(current.bytes, length);
  }

  private InputOutput<T> position() {
    if (upto == 0) {
      return null;
    }
    current.length = upto - 1;
    result.output = output[upto];
    return result;
  }
}
