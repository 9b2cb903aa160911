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
package org.segdict.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.segdict.util.LongValues;
import org.segdict.util.packed.PackedInts;

public class TestOrdinalMap {

  @Test
  public void testSegmentHoldingEveryTerm() {
    OrdinalMap.Builder builder = new OrdinalMap.Builder(new long[] {3, 1});
    assertEquals(0, builder.nextGlobalOrd());
    builder.add(0, 0);
    assertEquals(1, builder.nextGlobalOrd());
    builder.add(0, 1);
    builder.add(1, 0);
    assertEquals(2, builder.nextGlobalOrd());
    builder.add(0, 2);
    OrdinalMap map = builder.build();

    assertEquals(3, map.getValueCount());
    assertSame(LongValues.IDENTITY, map.getGlobalOrds(0));
    assertNotSame(LongValues.IDENTITY, map.getGlobalOrds(1));
    assertEquals(1, map.getGlobalOrds(1).get(0));
    assertEquals(1, map.getGlobalOrd(1, 0));
    assertEquals(0, map.getFirstSegmentNumber(1));
    assertEquals(1, map.getFirstSegmentOrd(1));
    assertThrows(IllegalArgumentException.class, () -> map.getGlobalOrds(2));
    assertThrows(IllegalArgumentException.class, () -> map.getGlobalOrd(1, 1));
  }

  @Test
  public void testBuilderMisuse() {
    OrdinalMap.Builder notStarted = new OrdinalMap.Builder(new long[] {2});
    assertThrows(IllegalStateException.class, () -> notStarted.add(0, 0));

    OrdinalMap.Builder skipping = new OrdinalMap.Builder(new long[] {2});
    skipping.nextGlobalOrd();
    assertThrows(IllegalArgumentException.class, () -> skipping.add(0, 1));

    OrdinalMap.Builder unmapped = new OrdinalMap.Builder(new long[] {2});
    unmapped.nextGlobalOrd();
    unmapped.add(0, 0);
    assertThrows(IllegalStateException.class, unmapped::build);

    OrdinalMap.Builder orphan = new OrdinalMap.Builder(new long[] {1});
    orphan.nextGlobalOrd();
    assertThrows(IllegalStateException.class, orphan::nextGlobalOrd);
  }

  @Test
  public void testRandomSegments() {
    Random random = new Random(41);
    for (float ratio : new float[] {PackedInts.COMPACT, PackedInts.FAST, PackedInts.FASTEST}) {
      int valueCount = 1 + random.nextInt(5000);
      int numSegments = 1 + random.nextInt(6);
      // segmentTerms.get(s) lists the global ordinals of segment s in order
      List<List<Integer>> segmentTerms = new ArrayList<>();
      for (int s = 0; s < numSegments; s++) {
        segmentTerms.add(new ArrayList<>());
      }
      int[][] localOrds = new int[valueCount][numSegments];
      for (int g = 0; g < valueCount; g++) {
        boolean any = false;
        for (int s = 0; s < numSegments; s++) {
          localOrds[g][s] = -1;
          // a sparse segment next to denser ones
          if (random.nextInt(s + 2) == 0 || (any == false && s == numSegments - 1)) {
            localOrds[g][s] = segmentTerms.get(s).size();
            segmentTerms.get(s).add(g);
            any = true;
          }
        }
      }

      long[] sizes = new long[numSegments];
      for (int s = 0; s < numSegments; s++) {
        sizes[s] = segmentTerms.get(s).size();
      }
      OrdinalMap.Builder builder = new OrdinalMap.Builder(sizes, ratio);
      for (int g = 0; g < valueCount; g++) {
        assertEquals(g, builder.nextGlobalOrd());
        for (int s = 0; s < numSegments; s++) {
          if (localOrds[g][s] >= 0) {
            builder.add(s, localOrds[g][s]);
          }
        }
      }
      OrdinalMap map = builder.build();

      assertEquals(valueCount, map.getValueCount());
      assertEquals(numSegments, map.getSegmentCount());
      for (int s = 0; s < numSegments; s++) {
        LongValues globalOrds = map.getGlobalOrds(s);
        List<Integer> terms = segmentTerms.get(s);
        for (int ord = 0; ord < terms.size(); ord++) {
          assertEquals(terms.get(ord).longValue(), map.getGlobalOrd(s, ord));
          assertEquals(terms.get(ord).longValue(), globalOrds.get(ord));
        }
      }
      for (int g = 0; g < valueCount; g++) {
        int first = 0;
        while (localOrds[g][first] < 0) {
          first++;
        }
        assertEquals(first, map.getFirstSegmentNumber(g), "global " + g);
        assertEquals(localOrds[g][first], map.getFirstSegmentOrd(g), "global " + g);
      }
    }
  }
}
