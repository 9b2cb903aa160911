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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class TestByteArena {

  @Test
  public void testAllocReturnsConsecutiveOffsets() {
    ByteArena arena = new ByteArena(8);
    assertEquals(0, arena.alloc(3));
    assertEquals(3, arena.alloc(5));
    assertEquals(8, arena.length());
    assertEquals(8, arena.alloc(0));
    assertEquals(8, arena.length());
  }

  @Test
  public void testGrowthKeepsContent() {
    ByteArena arena = new ByteArena(4);
    Random random = new Random(42);
    byte[] expected = new byte[1000];
    random.nextBytes(expected);
    int upto = 0;
    while (upto < expected.length) {
      int chunk = Math.min(1 + random.nextInt(17), expected.length - upto);
      int offset = arena.alloc(chunk);
      assertEquals(upto, offset);
      for (int i = 0; i < chunk; i++) {
        arena.put(offset + i, expected[upto + i]);
      }
      upto += chunk;
    }
    assertEquals(expected.length, arena.length());
    assertTrue(arena.capacity() >= arena.length());
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], arena.get(i));
    }
  }

  @Test
  public void testGrowsByAtLeastOneBlock() {
    ByteArena arena = new ByteArena(100);
    arena.alloc(100);
    assertEquals(100, arena.capacity());
    arena.alloc(1);
    assertTrue(arena.capacity() >= 200, "capacity=" + arena.capacity());
  }

  @Test
  public void testTruncateAndTrim() {
    ByteArena arena = new ByteArena(16);
    int offset = arena.alloc(10);
    for (int i = 0; i < 10; i++) {
      arena.put(offset + i, (byte) i);
    }
    arena.truncate(4);
    assertEquals(4, arena.length());
    assertEquals(4, arena.alloc(2));
    arena.trimToSize();
    assertEquals(6, arena.capacity());
    assertEquals(3, arena.get(3));

    assertThrows(IllegalArgumentException.class, () -> arena.truncate(7));
    assertThrows(IllegalArgumentException.class, () -> arena.truncate(-1));
  }

  @Test
  public void testWrapExistingBytes() {
    byte[] bytes = new byte[] {1, 2, 3, 4};
    ByteArena arena = new ByteArena(bytes, 3);
    assertEquals(3, arena.length());
    assertSame(bytes, arena.getArray());
    assertEquals(3, arena.alloc(1));
    assertEquals(4, arena.get(3));
    arena.alloc(1);
    assertArrayEquals(new byte[] {1, 2, 3, 4}, ArrayUtil.copyOfSubArray(arena.getArray(), 0, 4));

    assertThrows(IllegalArgumentException.class, () -> new ByteArena(bytes, 5));
  }

  @Test
  public void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ByteArena(0));
    assertThrows(IllegalArgumentException.class, () -> new ByteArena().alloc(-1));
  }

  @Test
  public void testRamBytesUsedFollowsCapacity() {
    ByteArena arena = new ByteArena(64);
    long before = arena.ramBytesUsed();
    arena.alloc(1000);
    assertTrue(arena.ramBytesUsed() >= before + 1000 - 64);
  }
}
