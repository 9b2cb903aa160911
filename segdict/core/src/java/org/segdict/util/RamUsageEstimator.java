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
 * Rough heap size estimates for the objects in this library.
 * Assumes a 64 bit JVM with compressed object pointers.
 */
public final class RamUsageEstimator {

  private RamUsageEstimator() {}

  public static final int NUM_BYTES_OBJECT_REF = 4;
  public static final int NUM_BYTES_OBJECT_HEADER = 12;
  public static final int NUM_BYTES_ARRAY_HEADER = 16;
  public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

  /** Aligns an object size to be the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}. */
  public static long alignObjectSize(long size) {
    size += (long) NUM_BYTES_OBJECT_ALIGNMENT - 1L;
    return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
  }

  /** Returns the size in bytes of the byte[] object. */
  public static long sizeOf(byte[] arr) {
    return arr == null ? 0 : alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + arr.length);
  }

  /** Returns the size in bytes of the int[] object. */
  public static long sizeOf(int[] arr) {
    return arr == null ? 0 : alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Integer.BYTES * arr.length);
  }

  /** Returns the size in bytes of the long[] object. */
  public static long sizeOf(long[] arr) {
    return arr == null ? 0 : alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Long.BYTES * arr.length);
  }

  /** Returns the size in bytes of the float[] object. */
  public static long sizeOf(float[] arr) {
    return arr == null ? 0 : alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Float.BYTES * arr.length);
  }

  /** Returns the size in bytes of the array and of everything its elements account for. */
  public static long sizeOf(Accountable[] accountables) {
    if (accountables == null) {
      return 0;
    }
    long size = shallowSizeOfArray(accountables);
    for (Accountable accountable : accountables) {
      if (accountable != null) {
        size += accountable.ramBytesUsed();
      }
    }
    return size;
  }

  /** Returns the shallow size in bytes of an Object[] of the given length. */
  public static long shallowSizeOfArray(Object[] arr) {
    return arr == null ? 0 : alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_OBJECT_REF * arr.length);
  }

  /** Estimated shallow size of an instance holding {@code refs} references and {@code primitiveBytes} of fields. */
  public static long shallowSizeOfInstance(int refs, int primitiveBytes) {
    return alignObjectSize((long) NUM_BYTES_OBJECT_HEADER + (long) refs * NUM_BYTES_OBJECT_REF + primitiveBytes);
  }
}
