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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.segdict.index.TermsEnum.SeekStatus;
import org.segdict.store.ByteArrayDataInput;
import org.segdict.store.GrowableByteArrayDataOutput;
import org.segdict.util.BytesRef;

public class TestTermDictionary {

  @TempDir
  Path tempDir;

  static TermDictionary dictionary(Object... termsAndStats) throws IOException {
    TermDictionaryBuilder builder = new TermDictionaryBuilder();
    for (int i = 0; i < termsAndStats.length; i += 3) {
      builder.add(new BytesRef((String) termsAndStats[i]),
          new TermStats((Integer) termsAndStats[i + 1], ((Number) termsAndStats[i + 2]).longValue()));
    }
    return builder.finish();
  }

  @Test
  public void testTermStatsValidation() {
    assertThrows(IllegalArgumentException.class, () -> new TermStats(0, 0));
    assertThrows(IllegalArgumentException.class, () -> new TermStats(3, 2));
    TermStats stats = new TermStats(2, 5).add(new TermStats(1, 1));
    assertEquals(new TermStats(3, 6), stats);
    assertThrows(ArithmeticException.class, () -> new TermStats(Integer.MAX_VALUE, Integer.MAX_VALUE).add(new TermStats(1, 1)));
  }

  @Test
  public void testLookups() throws IOException {
    TermDictionary dict = dictionary("apple", 3, 10, "banana", 1, 1, "band", 2, 7, "cherry", 5, 5);
    assertEquals(4, dict.size());
    assertEquals(0, dict.ord(new BytesRef("apple")));
    assertEquals(2, dict.ord(new BytesRef("band")));
    assertEquals(3, dict.ord(new BytesRef("cherry")));
    assertEquals(-1, dict.ord(new BytesRef("ban")));
    assertEquals(new TermStats(2, 7), dict.stats(new BytesRef("band")));
    assertEquals(new TermStats(1, 1), dict.stats(new BytesRef("banana")));
    assertNull(dict.stats(new BytesRef("bandana")));
    assertTrue(dict.ramBytesUsed() > 0);
  }

  @Test
  public void testIterator() throws IOException {
    TermDictionary dict = dictionary("apple", 3, 10, "banana", 1, 1, "band", 2, 7, "cherry", 5, 5);
    TermsEnum termsEnum = dict.iterator();
    assertThrows(IllegalStateException.class, termsEnum::term);

    String[] expected = {"apple", "banana", "band", "cherry"};
    for (int i = 0; i < expected.length; i++) {
      assertEquals(new BytesRef(expected[i]), termsEnum.next());
      assertEquals(i, termsEnum.ord());
    }
    assertNull(termsEnum.next());
    assertThrows(IllegalStateException.class, termsEnum::stats);
    // exhausted enums start over
    assertEquals(new BytesRef("apple"), termsEnum.next());

    assertEquals(SeekStatus.NOT_FOUND, termsEnum.seekCeil(new BytesRef("bana")));
    assertEquals(new BytesRef("banana"), termsEnum.term());
    assertEquals(SeekStatus.FOUND, termsEnum.seekCeil(new BytesRef("band")));
    assertEquals(new TermStats(2, 7), termsEnum.stats());
    assertEquals(new BytesRef("cherry"), termsEnum.next());
    assertEquals(SeekStatus.END, termsEnum.seekCeil(new BytesRef("date")));

    assertTrue(termsEnum.seekExact(new BytesRef("apple")));
    assertEquals(0, termsEnum.ord());
    assertFalse(termsEnum.seekExact(new BytesRef("apricot")));
    assertEquals(new BytesRef("apple"), termsEnum.next());
  }

  @Test
  public void testBuilderErrors() throws IOException {
    TermDictionaryBuilder builder = new TermDictionaryBuilder();
    assertThrows(IllegalArgumentException.class, () -> builder.add(new BytesRef(""), new TermStats(1, 1)));
    builder.add(new BytesRef("b"), new TermStats(1, 1));
    assertThrows(IllegalArgumentException.class, () -> builder.add(new BytesRef("a"), new TermStats(1, 1)));
    assertThrows(IllegalArgumentException.class, () -> builder.add(new BytesRef("b"), new TermStats(1, 1)));
    assertEquals(1, builder.getTermCount());
    builder.finish();
    assertThrows(IllegalStateException.class, () -> builder.add(new BytesRef("c"), new TermStats(1, 1)));
    assertThrows(IllegalStateException.class, builder::finish);
  }

  @Test
  public void testEmptyDictionary() throws IOException {
    TermDictionary dict = new TermDictionaryBuilder().finish();
    assertEquals(0, dict.size());
    assertEquals(-1, dict.ord(new BytesRef("a")));
    assertNull(dict.stats(new BytesRef("a")));
    assertSame(TermsEnum.EMPTY, dict.iterator());
    assertNull(dict.iterator().next());

    Path path = tempDir.resolve("empty.dict");
    dict.save(path);
    assertEquals(0, TermDictionary.read(path).size());
  }

  @Test
  public void testSaveAndRead() throws IOException {
    TermDictionary dict = dictionary("apple", 3, 10, "banana", 1, 1, "band", 2, 7, "cherry", 5, 1L << 40);
    Path path = tempDir.resolve("terms.dict");
    dict.save(path);
    TermDictionary loaded = TermDictionary.read(path);
    assertEquals(4, loaded.size());
    assertEquals(new TermStats(5, 1L << 40), loaded.stats(new BytesRef("cherry")));
    assertEquals(1, loaded.ord(new BytesRef("banana")));
  }

  @Test
  public void testCorruptFiles() throws IOException {
    TermDictionary dict = dictionary("apple", 3, 10, "banana", 1, 1);
    Path path = tempDir.resolve("corrupt.dict");
    dict.save(path);
    byte[] bytes = Files.readAllBytes(path);

    Files.write(path, Arrays.copyOf(bytes, bytes.length - 5));
    assertThrows(CorruptIndexException.class, () -> TermDictionary.read(path));

    byte[] flipped = bytes.clone();
    flipped[flipped.length - 20] ^= 0x11;
    Files.write(path, flipped);
    assertThrows(CorruptIndexException.class, () -> TermDictionary.read(path));
  }

  @Test
  public void testTermCountMustMatchFST() throws IOException {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(32);
    dictionary("apple", 1, 1).save(out);
    byte[] bytes = Arrays.copyOf(out.getBytes(), out.getPosition());
    // the term count follows the header; 0 terms with an FST is inconsistent
    int sizeOffset = org.segdict.codecs.CodecUtil.headerLength(TermDictionary.CODEC_NAME);
    assertEquals(1, bytes[sizeOffset]);
    bytes[sizeOffset] = 0;
    assertThrows(CorruptIndexException.class, () -> TermDictionary.read(new ByteArrayDataInput(bytes)));

    bytes[sizeOffset] = 1;
    bytes[sizeOffset + 1] = 9;
    assertThrows(CorruptIndexException.class, () -> TermDictionary.read(new ByteArrayDataInput(bytes)));
  }

  @Test
  public void testInvalidEncodedStats() {
    assertThrows(CorruptIndexException.class, () -> TermDictionary.decodeStats(new BytesRef(new byte[] {0, 0})));
    assertThrows(CorruptIndexException.class, () -> TermDictionary.decodeStats(new BytesRef(new byte[] {1, 0, 0})));
  }
}
