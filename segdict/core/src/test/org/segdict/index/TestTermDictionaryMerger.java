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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;
import org.segdict.util.BytesRef;
import org.segdict.util.InfoStream;

public class TestTermDictionaryMerger {

  /** Records every message. */
  static final class CapturingInfoStream extends InfoStream {
    final List<String> messages = new ArrayList<>();

    @Override
    public void message(String component, String message) {
      messages.add(component + ": " + message);
    }

    @Override
    public boolean isEnabled(String component) {
      return true;
    }

    @Override
    public void close() {
    }
  }

  @Test
  public void testMergeThreeSegments() throws IOException {
    TermDictionary a = TestTermDictionary.dictionary("apple", 1, 2, "cherry", 2, 2);
    TermDictionary b = TestTermDictionary.dictionary("banana", 4, 4, "cherry", 1, 3);
    TermDictionary c = TestTermDictionary.dictionary("apple", 2, 2, "date", 1, 1);

    CapturingInfoStream infoStream = new CapturingInfoStream();
    TermDictionaryMerger merger = new TermDictionaryMerger(Arrays.asList(a, b, c), infoStream);
    assertThrows(IllegalStateException.class, merger::getOrdinalMap);
    TermDictionary merged = merger.merge();

    assertEquals(4, merged.size());
    assertEquals(new TermStats(3, 4), merged.stats(new BytesRef("apple")));
    assertEquals(new TermStats(4, 4), merged.stats(new BytesRef("banana")));
    assertEquals(new TermStats(3, 5), merged.stats(new BytesRef("cherry")));
    assertEquals(new TermStats(1, 1), merged.stats(new BytesRef("date")));

    OrdinalMap map = merger.getOrdinalMap();
    assertEquals(3, map.getSegmentCount());
    assertEquals(4, map.getValueCount());
    assertEquals(0, map.getGlobalOrd(0, 0));
    assertEquals(2, map.getGlobalOrd(0, 1));
    assertEquals(1, map.getGlobalOrd(1, 0));
    assertEquals(2, map.getGlobalOrd(1, 1));
    assertEquals(0, map.getGlobalOrd(2, 0));
    assertEquals(3, map.getGlobalOrd(2, 1));

    // cherry is in segments 0 and 1; the lowest wins
    assertEquals(0, map.getFirstSegmentNumber(2));
    assertEquals(1, map.getFirstSegmentOrd(2));
    assertEquals(1, map.getFirstSegmentNumber(1));
    assertEquals(2, map.getFirstSegmentNumber(3));
    assertEquals(1, map.getFirstSegmentOrd(3));

    assertThrows(IllegalArgumentException.class, () -> map.getGlobalOrd(3, 0));
    assertThrows(IllegalArgumentException.class, () -> map.getGlobalOrd(0, 2));
    assertThrows(IllegalArgumentException.class, () -> map.getFirstSegmentNumber(4));
    assertTrue(map.ramBytesUsed() > 0);

    assertEquals(1, infoStream.messages.size());
    assertTrue(infoStream.messages.get(0).startsWith(TermDictionaryMerger.INFO_STREAM_COMPONENT + ": merged 3 segments (6 terms) into 4 terms"),
        infoStream.messages.get(0));

    assertThrows(IllegalStateException.class, merger::merge);
  }

  @Test
  public void testMergeWithEmptySegments() throws IOException {
    TermDictionary empty = new TermDictionaryBuilder().finish();
    TermDictionary one = TestTermDictionary.dictionary("x", 1, 1);
    TermDictionaryMerger merger = new TermDictionaryMerger(Arrays.asList(empty, one, empty), InfoStream.NO_OUTPUT);
    TermDictionary merged = merger.merge();
    assertEquals(1, merged.size());
    assertEquals(0, merger.getOrdinalMap().getGlobalOrd(1, 0));
    assertEquals(1, merger.getOrdinalMap().getFirstSegmentNumber(0));

    TermDictionaryMerger none = new TermDictionaryMerger(Collections.emptyList(), InfoStream.NO_OUTPUT);
    assertEquals(0, none.merge().size());
    assertEquals(0, none.getOrdinalMap().getValueCount());
  }

  @Test
  public void testNullSegments() {
    assertThrows(IllegalArgumentException.class, () -> new TermDictionaryMerger(null));
    assertThrows(IllegalArgumentException.class, () -> new TermDictionaryMerger(Arrays.asList((TermDictionary) null)));
  }

  @Test
  public void testStatsOverflow() throws IOException {
    TermDictionary a = TestTermDictionary.dictionary("t", Integer.MAX_VALUE, Integer.MAX_VALUE);
    TermDictionary b = TestTermDictionary.dictionary("t", 1, 1);
    TermDictionaryMerger merger = new TermDictionaryMerger(Arrays.asList(a, b), InfoStream.NO_OUTPUT);
    assertThrows(ArithmeticException.class, merger::merge);
  }

  @Test
  public void testRandomMerge() throws IOException {
    Random random = new Random(7);
    int numSegments = 2 + random.nextInt(5);
    List<TermDictionary> segments = new ArrayList<>();
    List<TreeMap<String,TermStats>> expectedSegments = new ArrayList<>();
    TreeMap<String,TermStats> expected = new TreeMap<>();
    for (int s = 0; s < numSegments; s++) {
      TreeMap<String,TermStats> terms = new TreeMap<>();
      int numTerms = random.nextInt(200);
      for (int i = 0; i < numTerms; i++) {
        StringBuilder sb = new StringBuilder();
        int len = 1 + random.nextInt(6);
        for (int j = 0; j < len; j++) {
          sb.append((char) ('a' + random.nextInt(5)));
        }
        int docFreq = 1 + random.nextInt(10);
        terms.put(sb.toString(), new TermStats(docFreq, docFreq + random.nextInt(10)));
      }
      TermDictionaryBuilder builder = new TermDictionaryBuilder();
      for (Map.Entry<String,TermStats> entry : terms.entrySet()) {
        builder.add(new BytesRef(entry.getKey()), entry.getValue());
        expected.merge(entry.getKey(), entry.getValue(), TermStats::add);
      }
      segments.add(builder.finish());
      expectedSegments.add(terms);
    }

    TermDictionaryMerger merger = new TermDictionaryMerger(segments, InfoStream.NO_OUTPUT);
    TermDictionary merged = merger.merge();
    assertEquals(expected.size(), merged.size());

    TermsEnum termsEnum = merged.iterator();
    List<String> globalTerms = new ArrayList<>();
    for (Map.Entry<String,TermStats> entry : expected.entrySet()) {
      BytesRef term = termsEnum.next();
      assertEquals(new BytesRef(entry.getKey()), term);
      assertEquals(globalTerms.size(), termsEnum.ord());
      assertEquals(entry.getValue(), termsEnum.stats());
      globalTerms.add(entry.getKey());
    }
    assertNull(termsEnum.next());

    OrdinalMap map = merger.getOrdinalMap();
    for (int s = 0; s < numSegments; s++) {
      int segmentOrd = 0;
      for (String term : expectedSegments.get(s).keySet()) {
        long globalOrd = map.getGlobalOrd(s, segmentOrd);
        assertEquals(term, globalTerms.get((int) globalOrd));
        int first = map.getFirstSegmentNumber(globalOrd);
        assertTrue(first <= s);
        assertTrue(expectedSegments.get(first).containsKey(term));
        segmentOrd++;
      }
    }
  }
}
