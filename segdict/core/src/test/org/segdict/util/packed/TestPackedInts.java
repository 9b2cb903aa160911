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
package org.segdict.util.packed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class TestPackedInts {

  @Test
  public void testBitsRequired() {
    assertEquals(1, PackedInts.bitsRequired(0));
    assertEquals(1, PackedInts.bitsRequired(1));
    assertEquals(2, PackedInts.bitsRequired(2));
    assertEquals(8, PackedInts.bitsRequired(255));
    assertEquals(9, PackedInts.bitsRequired(256));
    assertEquals(63, PackedInts.bitsRequired(Long.MAX_VALUE));
    assertEquals(64, PackedInts.unsignedBitsRequired(-1));
    assertThrows(IllegalArgumentException.class, () -> PackedInts.bitsRequired(-1));

    assertEquals(7, PackedInts.maxValue(3));
    assertEquals(Long.MAX_VALUE, PackedInts.maxValue(64));
  }

  @Test
  public void testPacked64AllWidths() {
    Random random = new Random(17);
    for (int bits = 1; bits <= 64; bits++) {
      int valueCount = 1 + random.nextInt(300);
      long max = PackedInts.maxValue(bits);
      PackedInts.Mutable mutable = new Packed64(valueCount, bits);
      long[] expected = new long[valueCount];
      for (int i = 0; i < valueCount; i++) {
        expected[i] = bits == 64 ? random.nextLong() : random.nextLong() & max;
        mutable.set(i, expected[i]);
      }
      // overwriting a value must not disturb its neighbours
      int middle = valueCount / 2;
      expected[middle] = bits == 64 ? -1L : max;
      mutable.set(middle, expected[middle]);
      for (int i = 0; i < valueCount; i++) {
        assertEquals(expected[i], mutable.get(i), "bits=" + bits + " index=" + i);
      }
      long[] bulk = new long[valueCount];
      int read = 0;
      while (read < valueCount) {
        read += mutable.get(read, bulk, read, valueCount - read);
      }
      for (int i = 0; i < valueCount; i++) {
        assertEquals(expected[i], bulk[i], "bits=" + bits + " index=" + i);
      }
      mutable.clear();
      assertEquals(0, mutable.get(valueCount - 1));
    }
  }

  @Test
  public void testGetMutableRoundsUpWithOverhead() {
    assertEquals(5, PackedInts.getMutable(10, 5, PackedInts.COMPACT).getBitsPerValue());
    assertEquals(8, PackedInts.getMutable(10, 5, PackedInts.FASTEST).getBitsPerValue());
    assertEquals(16, PackedInts.getMutable(10, 13, PackedInts.DEFAULT).getBitsPerValue());
    assertEquals(20, PackedInts.getMutable(10, 20, PackedInts.DEFAULT).getBitsPerValue());
    assertEquals(64, PackedInts.getMutable(10, 60, PackedInts.DEFAULT).getBitsPerValue());
    assertThrows(IllegalArgumentException.class, () -> PackedInts.getMutable(10, 0, PackedInts.COMPACT));
    assertThrows(IllegalArgumentException.class, () -> PackedInts.getMutable(10, 65, PackedInts.COMPACT));
  }

  private static void assertValues(long[] expected, PackedLongValues values) {
    assertEquals(expected.length, values.size());
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], values.get(i), "index=" + i);
    }
    PackedLongValues.Iterator it = values.iterator();
    for (int i = 0; i < expected.length; i++) {
      assertTrue(it.hasNext());
      assertEquals(expected[i], it.next(), "index=" + i);
    }
    assertFalse(it.hasNext());
  }

  @Test
  public void testPackedLongValues() {
    Random random = new Random(23);
    for (int iter = 0; iter < 10; iter++) {
      int pageSize = 1 << (6 + random.nextInt(4));
      int size = random.nextInt(5000);
      long[] random31 = new long[size];
      long[] close = new long[size];
      long[] monotonic = new long[size];
      long base = random.nextInt(1 << 20) - (1 << 19);
      long last = random.nextInt(100);
      for (int i = 0; i < size; i++) {
        random31[i] = random.nextInt() & Integer.MAX_VALUE;
        close[i] = base + random.nextInt(16);
        last += random.nextInt(7);
        monotonic[i] = last;
      }
      for (float ratio : new float[] {PackedInts.COMPACT, PackedInts.FAST}) {
        assertValues(random31, fill(PackedLongValues.packedBuilder(pageSize, ratio), random31));
        assertValues(close, fill(PackedLongValues.deltaPackedBuilder(pageSize, ratio), close));
        assertValues(monotonic, fill(PackedLongValues.monotonicBuilder(pageSize, ratio), monotonic));
        // mixed signs end up in 64 bit pages
        assertValues(close, fill(PackedLongValues.packedBuilder(pageSize, ratio), close));
      }
    }
  }

  private static PackedLongValues fill(PackedLongValues.Builder builder, long[] values) {
    for (long v : values) {
      builder.add(v);
    }
    assertEquals(values.length, builder.size());
    assertTrue(builder.ramBytesUsed() > 0);
    return builder.build();
  }

  @Test
  public void testCompression() {
    PackedLongValues.Builder plain = PackedLongValues.packedBuilder(PackedInts.COMPACT);
    PackedLongValues.Builder monotonic = PackedLongValues.monotonicBuilder(PackedInts.COMPACT);
    PackedLongValues.Builder zeros = PackedLongValues.packedBuilder(PackedInts.COMPACT);
    for (int i = 0; i < 10000; i++) {
      plain.add(1_000_000L + 3L * i);
      monotonic.add(1_000_000L + 3L * i);
      zeros.add(0);
    }
    PackedLongValues plainValues = plain.build();
    PackedLongValues monotonicValues = monotonic.build();
    // a straight line needs next to nothing per value
    assertTrue(monotonicValues.ramBytesUsed() * 4 < plainValues.ramBytesUsed(),
        monotonicValues.ramBytesUsed() + " vs " + plainValues.ramBytesUsed());
    assertEquals(1_000_000L + 3L * 9999, monotonicValues.get(9999));
    PackedLongValues zeroValues = zeros.build();
    assertEquals(0, zeroValues.get(4321));
    assertSame(PackedInts.NullReader.class, zeroValues.values[0].getClass());
  }

  @Test
  public void testBuilderErrors() {
    assertThrows(IllegalArgumentException.class, () -> PackedLongValues.packedBuilder(100, PackedInts.COMPACT));
    assertThrows(IllegalArgumentException.class, () -> PackedLongValues.monotonicBuilder(32, PackedInts.COMPACT));
    PackedLongValues.Builder builder = PackedLongValues.deltaPackedBuilder(PackedInts.DEFAULT);
    builder.add(3);
    assertEquals(3, builder.build().get(0));
    assertThrows(IllegalStateException.class, () -> builder.add(4));
  }

  @Test
  public void testEmpty() {
    PackedLongValues values = PackedLongValues.monotonicBuilder(PackedInts.COMPACT).build();
    assertEquals(0, values.size());
    assertFalse(values.iterator().hasNext());
  }
}
