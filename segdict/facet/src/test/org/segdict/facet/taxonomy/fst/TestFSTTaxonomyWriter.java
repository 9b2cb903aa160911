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
package org.segdict.facet.taxonomy.fst;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import org.junit.jupiter.api.Test;
import org.segdict.facet.taxonomy.FacetLabel;
import org.segdict.facet.taxonomy.ParallelTaxonomyArrays;
import org.segdict.facet.taxonomy.TaxonomyReader;
import org.segdict.facet.taxonomy.TaxonomyReader.ChildrenIterator;
import org.segdict.facet.taxonomy.writercache.LruTaxonomyWriterCache;
import org.segdict.facet.taxonomy.writercache.LruTaxonomyWriterCache.LRUType;
import org.segdict.util.InfoStream;

public class TestFSTTaxonomyWriter {

  static final class CapturingInfoStream extends InfoStream {
    final List<String> messages = new ArrayList<>();

    @Override
    public synchronized void message(String component, String message) {
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

  private static FSTTaxonomyWriter newWriter() throws IOException {
    return new FSTTaxonomyWriter(new LruTaxonomyWriterCache(100), InfoStream.NO_OUTPUT);
  }

  @Test
  public void testNewTaxonomyHasOnlyRoot() throws IOException {
    try (FSTTaxonomyWriter writer = newWriter()) {
      assertEquals(1, writer.getSize());
      assertEquals(TaxonomyReader.INVALID_ORDINAL, writer.getParent(TaxonomyReader.ROOT_ORDINAL));
      assertEquals(TaxonomyReader.ROOT_ORDINAL, writer.addCategory(new FacetLabel()));

      FSTTaxonomyReader reader = writer.getReader();
      assertEquals(1, reader.getSize());
      assertEquals(TaxonomyReader.ROOT_ORDINAL, reader.getOrdinal(new FacetLabel()));
      assertEquals(new FacetLabel(), reader.getPath(0));
      assertEquals(TaxonomyReader.INVALID_ORDINAL, reader.getParent(0));
      assertEquals(TaxonomyReader.INVALID_ORDINAL, reader.getChildren(0).next());
      assertEquals(TaxonomyReader.INVALID_ORDINAL, reader.getOrdinal(new FacetLabel("a")));
    }
  }

  @Test
  public void testAddCategoryAddsAncestors() throws IOException {
    try (FSTTaxonomyWriter writer = newWriter()) {
      assertEquals(3, writer.addCategory(new FacetLabel("Author", "Mark", "Twain")));
      assertEquals(4, writer.getSize());
      assertEquals(2, writer.getParent(3));
      assertEquals(1, writer.getParent(2));
      assertEquals(0, writer.getParent(1));
      assertEquals(2, writer.addCategory(new FacetLabel("Author", "Mark")));
      assertEquals(3, writer.addCategory(new FacetLabel("Author", "Mark", "Twain")));
      assertEquals(4, writer.addCategory(new FacetLabel("Author", "Bob")));
      assertEquals(5, writer.getSize());
      assertEquals(1, writer.getParent(4));
      assertThrows(IllegalArgumentException.class, () -> writer.getParent(5));
      assertThrows(IllegalArgumentException.class, () -> writer.getParent(-1));
      assertThrows(IllegalArgumentException.class, () -> writer.addCategory(null));
    }
  }

  @Test
  public void testReadersSeeCommittedCategoriesOnly() throws IOException {
    try (FSTTaxonomyWriter writer = newWriter()) {
      writer.addCategory(new FacetLabel("a", "b"));
      FSTTaxonomyReader before = writer.getReader();
      assertEquals(1, before.getSize());
      assertEquals(TaxonomyReader.INVALID_ORDINAL, before.getOrdinal(new FacetLabel("a")));

      writer.commit();
      FSTTaxonomyReader after = writer.getReader();
      assertEquals(3, after.getSize());
      assertEquals(1, after.getOrdinal(new FacetLabel("a")));
      assertEquals(2, after.getOrdinal("a", new String[] {"b"}));
      assertEquals(new FacetLabel("a", "b"), after.getPath(2));
      assertNull(after.getPath(3));
      assertNull(after.getPath(-1));
      assertEquals(1, after.getParent(2));
      assertThrows(IllegalArgumentException.class, () -> after.getParent(3));

      // older readers are point in time
      assertEquals(1, before.getSize());
      assertTrue(after.ramBytesUsed() > before.ramBytesUsed());
    }
  }

  @Test
  public void testIncrementalReaders() throws IOException {
    try (FSTTaxonomyWriter writer = newWriter()) {
      writer.addCategory(new FacetLabel("a", "x"));
      writer.addCategory(new FacetLabel("b"));
      writer.commit();
      FSTTaxonomyReader r1 = writer.getReader();
      ParallelTaxonomyArrays arrays1 = r1.getParallelTaxonomyArrays();
      assertEquals(3, arrays1.children()[0]);
      assertEquals(1, arrays1.siblings()[3]);

      // lookups span the committed FST and the pending labels
      writer.addCategory(new FacetLabel("a", "y"));
      writer.addCategory(new FacetLabel("a", "y", "z"));
      writer.addCategory(new FacetLabel("c"));
      writer.commit();
      FSTTaxonomyReader r2 = writer.getReader();
      assertEquals(7, r2.getSize());
      for (int ord = 0; ord < r2.getSize(); ord++) {
        FacetLabel label = r2.getPath(ord);
        assertEquals(ord, r2.getOrdinal(label));
        if (ord > 0) {
          assertEquals(r2.getOrdinal(label.subpath(label.length - 1)), r2.getParent(ord));
        }
      }

      ChildrenIterator children = r2.getChildren(1);
      assertEquals(4, children.next());
      assertEquals(2, children.next());
      assertEquals(TaxonomyReader.INVALID_ORDINAL, children.next());
      assertEquals(6, r2.getParallelTaxonomyArrays().children()[0]);

      // a commit without new categories keeps the same content
      writer.commit();
      FSTTaxonomyReader r3 = writer.getReader();
      assertEquals(7, r3.getSize());
      assertEquals(5, r3.getOrdinal(new FacetLabel("a", "y", "z")));
    }
  }

  @Test
  public void testSmallCacheFallsBackToFST() throws IOException {
    try (FSTTaxonomyWriter writer = new FSTTaxonomyWriter(new LruTaxonomyWriterCache(2, LRUType.LRU_HASHED), InfoStream.NO_OUTPUT)) {
      Map<FacetLabel,Integer> expected = new HashMap<>();
      for (int i = 0; i < 50; i++) {
        FacetLabel label = new FacetLabel("dim" + (i % 5), "v" + i);
        expected.put(label, writer.addCategory(label));
        if (i % 7 == 0) {
          writer.commit();
        }
      }
      // 5 dimensions and 50 values on top of the root
      assertEquals(56, writer.getSize());
      for (Map.Entry<FacetLabel,Integer> entry : expected.entrySet()) {
        assertEquals(entry.getValue().intValue(), writer.addCategory(entry.getKey()));
      }
      assertEquals(56, writer.getSize());
    }
  }

  @Test
  public void testDelimiterRejected() throws IOException {
    try (FSTTaxonomyWriter writer = newWriter()) {
      assertThrows(IllegalArgumentException.class, () -> writer.addCategory(new FacetLabel("a\u001Fb")));
      assertEquals(1, writer.getSize());
      FSTTaxonomyReader reader = writer.getReader();
      assertThrows(IllegalArgumentException.class, () -> reader.getOrdinal(new FacetLabel("a", "b\u001F")));
    }
  }

  @Test
  public void testAddTaxonomy() throws IOException {
    FSTTaxonomyReader source;
    try (FSTTaxonomyWriter writer = newWriter()) {
      writer.addCategory(new FacetLabel("color", "red"));
      writer.addCategory(new FacetLabel("size", "xl"));
      writer.commit();
      source = writer.getReader();
    }

    try (FSTTaxonomyWriter writer = newWriter()) {
      writer.addCategory(new FacetLabel("size", "s"));
      writer.addCategory(new FacetLabel("color", "blue"));
      FSTTaxonomyWriter.MemoryOrdinalMap map = new FSTTaxonomyWriter.MemoryOrdinalMap();
      writer.addTaxonomy(source, map);
      writer.commit();

      int[] ordinals = map.getMap();
      assertEquals(source.getSize(), ordinals.length);
      assertEquals(TaxonomyReader.ROOT_ORDINAL, ordinals[0]);
      FSTTaxonomyReader merged = writer.getReader();
      assertEquals(7, merged.getSize());
      for (int ord = 0; ord < source.getSize(); ord++) {
        assertEquals(source.getPath(ord), merged.getPath(ordinals[ord]));
      }
      assertEquals(1, ordinals[source.getOrdinal(new FacetLabel("size"))]);
      assertEquals(3, ordinals[source.getOrdinal(new FacetLabel("color"))]);
    }
  }

  @Test
  public void testCloseCommits() throws IOException {
    CapturingInfoStream infoStream = new CapturingInfoStream();
    FSTTaxonomyWriter writer = new FSTTaxonomyWriter(new LruTaxonomyWriterCache(10), infoStream);
    FSTTaxonomyReader reader = writer.getReader();
    writer.addCategory(new FacetLabel("a"));
    writer.close();
    writer.close();

    assertThrows(IllegalStateException.class, () -> writer.addCategory(new FacetLabel("b")));
    assertThrows(IllegalStateException.class, writer::getReader);
    assertThrows(IllegalStateException.class, writer::commit);
    assertThrows(IllegalStateException.class, writer::getSize);

    reader.close();
    assertThrows(IllegalStateException.class, reader::getSize);
    assertThrows(IllegalStateException.class, () -> reader.getOrdinal(new FacetLabel()));

    List<String> messages = infoStream.messages;
    assertTrue(messages.get(0).startsWith("TW: commit: 0 new categories, 1 total"), messages.get(0));
    assertTrue(messages.contains("TW: getReader: 1 categories"), messages.toString());
    assertTrue(messages.stream().anyMatch(m -> m.startsWith("TW: commit: 1 new categories, 2 total")), messages.toString());
    assertEquals("TW: close: 2 categories", messages.get(messages.size() - 1));
  }

  @Test
  public void testRandomTaxonomy() throws IOException {
    Random random = new Random(17);
    try (FSTTaxonomyWriter writer = new FSTTaxonomyWriter(new LruTaxonomyWriterCache(16), InfoStream.NO_OUTPUT)) {
      Map<FacetLabel,Integer> expected = new HashMap<>();
      expected.put(new FacetLabel(), 0);
      for (int i = 0; i < 2000; i++) {
        String[] components = new String[1 + random.nextInt(4)];
        for (int j = 0; j < components.length; j++) {
          components[j] = Character.toString((char) ('a' + random.nextInt(4))) + (char) ('à' + random.nextInt(3));
        }
        FacetLabel label = new FacetLabel(components);
        int ord = writer.addCategory(label);
        Integer previous = expected.get(label);
        if (previous == null || previous < 0) {
          expected.put(label, ord);
        } else {
          assertEquals(previous.intValue(), ord);
        }
        // ancestors were added implicitly, their ordinals are checked through the reader
        for (int len = 1; len < label.length; len++) {
          expected.putIfAbsent(label.subpath(len), -1);
        }
        if (random.nextInt(100) == 0) {
          writer.commit();
          assertEquals(writer.getSize(), writer.getReader().getSize());
        }
      }
      writer.commit();
      FSTTaxonomyReader reader = writer.getReader();
      assertEquals(expected.size(), reader.getSize());

      Set<Integer> seen = new HashSet<>();
      for (int ord = 0; ord < reader.getSize(); ord++) {
        FacetLabel label = reader.getPath(ord);
        assertTrue(seen.add(ord));
        assertEquals(ord, reader.getOrdinal(label));
        Integer expectedOrd = expected.get(label);
        assertTrue(expectedOrd != null);
        if (expectedOrd >= 0) {
          assertEquals(ord, expectedOrd.intValue());
        }
        if (ord > 0) {
          int parent = reader.getParent(ord);
          assertTrue(parent < ord);
          assertEquals(label.subpath(label.length - 1), reader.getPath(parent));
        }
      }
    }
  }

  @Test
  public void testConcurrentAddCategory() throws Exception {
    try (FSTTaxonomyWriter writer = newWriter()) {
      int numThreads = 4;
      CountDownLatch start = new CountDownLatch(1);
      List<Thread> threads = new ArrayList<>();
      List<Throwable> failures = new ArrayList<>();
      for (int t = 0; t < numThreads; t++) {
        final int seed = t;
        Thread thread = new Thread(() -> {
          try {
            start.await();
            Random random = new Random(seed);
            for (int i = 0; i < 500; i++) {
              writer.addCategory(new FacetLabel("d" + random.nextInt(3), "v" + random.nextInt(100)));
              if (i % 100 == 0) {
                writer.commit();
              }
            }
          } catch (Throwable e) {
            synchronized (failures) {
              failures.add(e);
            }
          }
        });
        threads.add(thread);
        thread.start();
      }
      start.countDown();
      for (Thread thread : threads) {
        thread.join();
      }
      assertTrue(failures.isEmpty(), failures.toString());

      writer.commit();
      FSTTaxonomyReader reader = writer.getReader();
      assertEquals(writer.getSize(), reader.getSize());
      Set<FacetLabel> labels = new HashSet<>();
      for (int ord = 0; ord < reader.getSize(); ord++) {
        assertTrue(labels.add(reader.getPath(ord)));
        assertEquals(ord, reader.getOrdinal(reader.getPath(ord)));
      }
    }
  }
}
