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

import org.segdict.store.DataOutput;
import org.segdict.util.Accountable;
import org.segdict.util.ByteArena;
import org.segdict.util.RamUsageEstimator;

/**
 * Where the compiler appends frozen nodes, on top of a {@link ByteArena}.
 * Besides appending, bytes already written can be overwritten, moved up
 * or reversed in place: a node is written front to back and then turned
 * around, and fixed length nodes are widened after their arcs are known.
 *
 * 构建期间节点字节都写在这里 底层是 ByteArena
 */
final class BytesStore extends DataOutput implements Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(1, 0);

  private final ByteArena arena;

  /** The arena grows {@code 1 << blockBits} bytes at a time. */
  BytesStore(int blockBits) {
    if (blockBits < 1 || blockBits > 30) {
      throw new IllegalArgumentException("blockBits must be in [1, 30] (got " + blockBits + ")");
    }
    arena = new ByteArena(1 << blockBits);
  }

  @Override
  public void writeByte(byte b) {
    arena.put(arena.alloc(1), b);
  }

  @Override
  public void writeBytes(byte[] b, int offset, int len) {
    System.arraycopy(b, offset, arena.getArray(), arena.alloc(len), len);
  }

  /** Appends {@code len} bytes whose content is filled in later. */
  void extend(int len) {
    arena.alloc(len);
  }

  /** Overwrites {@code len} already written bytes starting at {@code dest}. */
  void setBytes(long dest, byte[] b, int offset, int len) {
    assert dest + len <= getPosition() : "dest=" + dest + " len=" + len + " pos=" + getPosition();
    System.arraycopy(b, offset, arena.getArray(), (int) dest, len);
  }

  /** Moves {@code len} written bytes from {@code src} up to {@code dest}; the ranges may overlap. */
  void moveBytes(long src, long dest, int len) {
    assert src < dest && dest + len <= getPosition() : "src=" + src + " dest=" + dest + " len=" + len;
    final byte[] array = arena.getArray();
    System.arraycopy(array, (int) src, array, (int) dest, len);
  }

  /** Reverses the written bytes between {@code from} and {@code to}, both inclusive. */
  void reverse(long from, long to) {
    assert from <= to && to < getPosition();
    final byte[] array = arena.getArray();
    for (int lo = (int) from, hi = (int) to; lo < hi; lo++, hi--) {
      final byte b = array[lo];
      array[lo] = array[hi];
      array[hi] = b;
    }
  }

  long getPosition() {
    return arena.length();
  }

  /** Releases the unused tail of the arena; called once no more nodes will be written. */
  void finish() {
    arena.trimToSize();
  }

  void writeTo(DataOutput out) throws IOException {
    out.writeBytes(arena.getArray(), 0, arena.length());
  }

  /** The written bytes, exactly sized; only valid after {@link #finish()}. */
  byte[] getBytes() {
    assert arena.capacity() == arena.length();
    return arena.getArray();
  }

  /**
   * Reads the written bytes backwards. Goes through the arena on every
   * read, so it stays valid while the compiler keeps appending.
   */
  FST.BytesReader getReverseReader() {
    return new FST.BytesReader() {
      private long pos;

      @Override
      public byte readByte() {
        return arena.get((int) pos--);
      }

      @Override
      public void readBytes(byte[] b, int offset, int len) {
        for (int i = offset; i < offset + len; i++) {
          b[i] = arena.get((int) pos--);
        }
      }

      @Override
      public void skipBytes(long count) {
        pos -= count;
      }

      @Override
      public long getPosition() {
        return pos;
      }

      @Override
      public void setPosition(long pos) {
        this.pos = pos;
      }

      @Override
      public boolean reversed() {
        return true;
      }
    };
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + arena.ramBytesUsed();
  }

  @Override
  public String toString() {
    return "BytesStore(" + arena + ")";
  }
}
