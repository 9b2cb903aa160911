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
package org.segdict.util;

/**
 * A growable, append-only byte buffer handing out integer offsets.
 * <p>
 * Space is reserved with {@link #alloc(int)}, which returns the start offset
 * of the reserved region. Offsets stay valid across growth: the backing array
 * is replaced by a larger copy, never re-based. Reads and writes through
 * {@link #get(int)} / {@link #put(int, byte)} are only bounds checked when
 * assertions are enabled.
 * <p>
 * An arena is owned by a single builder and is not thread safe. Once building
 * is done call {@link #trimToSize()} to drop the slack.
 *
 * 连续内存块 FST 的节点以及 taxonomy 的父节点负载 都写在这里
 */
public final class ByteArena implements Accountable {

  /** Default number of bytes the arena grows by. */
  public static final int DEFAULT_BLOCK_SIZE = 2048;

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(1, 2 * Integer.BYTES);

  private final int blockSize;

  private byte[] array;

  /** Logical length: number of allocated bytes. */
  private int n;

  public ByteArena() {
    this(DEFAULT_BLOCK_SIZE);
  }

  public ByteArena(int blockSize) {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("blockSize must be > 0 (got " + blockSize + ")");
    }
    this.blockSize = blockSize;
    this.array = new byte[blockSize];
    this.n = 0;
  }

  /**
   * Wraps bytes that were already written, eg. when loading from disk.
   * The first {@code length} bytes count as allocated.
   */
  public ByteArena(byte[] bytes, int length) {
    if (length < 0 || length > bytes.length) {
      throw new IllegalArgumentException("length must be in [0, " + bytes.length + "] (got " + length + ")");
    }
    this.blockSize = DEFAULT_BLOCK_SIZE;
    this.array = bytes;
    this.n = length;
  }

  /** Returns the backing array. Only valid until the next {@link #alloc(int)} call. */
  public byte[] getArray() {
    return array;
  }

  /** Number of allocated bytes. */
  public int length() {
    return n;
  }

  /** Size of the backing array. */
  public int capacity() {
    return array.length;
  }

  public int getBlockSize() {
    return blockSize;
  }

  public void put(int index, byte b) {
    assert index >= 0 && index < n : "index=" + index + " length=" + n;
    array[index] = b;
  }

  public byte get(int index) {
    assert index >= 0 && index < n : "index=" + index + " length=" + n;
    return array[index];
  }

  /**
   * Reserves {@code size} bytes and returns the offset of the first one.
   * Growth adds at least one block.
   *
   * @throws IllegalArgumentException if size is negative
   * @throws OutOfMemoryError if the arena would exceed the maximum array length
   */
  public int alloc(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("cannot allocate a negative number of bytes (got " + size + ")");
    }
    final int index = n;
    if (size > ArrayUtil.MAX_ARRAY_LENGTH - n) {
      throw new OutOfMemoryError("arena cannot grow past " + ArrayUtil.MAX_ARRAY_LENGTH + " bytes (length=" + n + ", requested=" + size + ")");
    }
    final int required = n + size;
    if (required > array.length) {
      // 至少增长一个块 大数组时按比例增长 保证均摊线性
      long grown = Math.max((long) array.length + blockSize, ArrayUtil.oversize(required, Byte.BYTES));
      int newLength = (int) Math.min(grown, ArrayUtil.MAX_ARRAY_LENGTH);
      byte[] newArray = new byte[newLength];
      System.arraycopy(array, 0, newArray, 0, n);
      array = newArray;
    }
    n = required;
    return index;
  }

  /**
   * Shrinks the logical length to {@code newLength}. Bytes past it are
   * handed out again by later {@link #alloc(int)} calls.
   */
  public void truncate(int newLength) {
    if (newLength < 0 || newLength > n) {
      throw new IllegalArgumentException("newLength must be in [0, " + n + "] (got " + newLength + ")");
    }
    n = newLength;
  }

  /** Shrinks the backing array to exactly {@link #length()} bytes. */
  public void trimToSize() {
    if (n < array.length) {
      byte[] trimmed = new byte[n];
      System.arraycopy(array, 0, trimmed, 0, n);
      array = trimmed;
    }
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(array);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(length=" + n + ",capacity=" + array.length + ")";
  }
}
