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
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.segdict.codecs.CodecUtil;
import org.segdict.facet.taxonomy.TaxonomyReader;
import org.segdict.index.CorruptIndexException;
import org.segdict.store.ByteArrayDataInput;
import org.segdict.store.GrowableByteArrayDataOutput;

public class TestParentPayloadStore {

  @Test
  public void testAppendAndRead() throws IOException {
    ParentPayloadStore store = new ParentPayloadStore();
    assertNull(store.parentPositions());
    assertEquals(0, store.append(TaxonomyReader.INVALID_ORDINAL));
    assertEquals(1, store.append(0));
    assertEquals(2, store.append(1));
    assertEquals(3, store.append(0));
    assertEquals(4, store.maxDoc());
    assertEquals(TaxonomyReader.INVALID_ORDINAL, store.parent(0));
    assertEquals(1, store.parent(2));
    assertEquals(0, store.parent(3));
    assertThrows(IllegalArgumentException.class, () -> store.parent(4));
    assertThrows(IllegalArgumentException.class, () -> store.parent(-1));
  }

  @Test
  public void testInvalidParents() {
    ParentPayloadStore store = new ParentPayloadStore();
    assertThrows(IllegalArgumentException.class, () -> store.append(0));
    store.append(TaxonomyReader.INVALID_ORDINAL);
    assertThrows(IllegalArgumentException.class, () -> store.append(1));
    assertThrows(IllegalArgumentException.class, () -> store.append(TaxonomyReader.INVALID_ORDINAL));
    assertEquals(1, store.maxDoc());
  }

  @Test
  public void testMultiBytePayloads() throws IOException {
    ParentPayloadStore store = new ParentPayloadStore();
    store.append(TaxonomyReader.INVALID_ORDINAL);
    Random random = new Random(11);
    int[] parents = new int[5000];
    parents[0] = TaxonomyReader.INVALID_ORDINAL;
    for (int i = 1; i < parents.length; i++) {
      parents[i] = random.nextInt(i);
      store.append(parents[i]);
    }
    for (int i = 0; i < parents.length; i++) {
      assertEquals(parents[i], store.parent(i));
    }
    assertTrue(store.ramBytesUsed() > parents.length);
  }

  @Test
  public void testPositionsEnum() throws IOException {
    ParentPayloadStore store = new ParentPayloadStore();
    store.append(TaxonomyReader.INVALID_ORDINAL);
    store.append(0);
    store.append(1);

    ParentPositionsEnum positions = store.parentPositions();
    assertEquals(-1, positions.docID());
    assertThrows(IllegalStateException.class, positions::nextPosition);
    assertEquals(0, positions.nextDoc());
    assertEquals(1, positions.freq());
    assertEquals(TaxonomyReader.INVALID_ORDINAL, positions.nextPosition());
    assertThrows(IllegalStateException.class, positions::nextPosition);
    assertEquals(2, positions.advance(2));
    assertEquals(1, positions.nextPosition());
    assertEquals(ParentPositionsEnum.NO_MORE_DOCS, positions.nextDoc());
    assertThrows(IllegalStateException.class, positions::nextPosition);
  }

  @Test
  public void testView() throws IOException {
    ParentPayloadStore store = new ParentPayloadStore();
    store.append(TaxonomyReader.INVALID_ORDINAL);
    store.append(0);
    ParentOrdinalsSource view = store.view(1);
    store.append(1);

    assertEquals(1, view.maxDoc());
    ParentPositionsEnum positions = view.parentPositions();
    assertEquals(0, positions.nextDoc());
    assertEquals(ParentPositionsEnum.NO_MORE_DOCS, positions.nextDoc());
    assertNull(store.view(0).parentPositions());
    assertThrows(IllegalArgumentException.class, () -> store.view(4));
  }

  @Test
  public void testSaveAndRead() throws IOException {
    ParentPayloadStore store = new ParentPayloadStore();
    store.append(TaxonomyReader.INVALID_ORDINAL);
    for (int i = 1; i < 300; i++) {
      store.append(i / 2);
    }
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(64);
    store.save(out);

    ParentPayloadStore loaded = ParentPayloadStore.read(new ByteArrayDataInput(out.getBytes(), 0, out.getPosition()));
    assertEquals(300, loaded.maxDoc());
    for (int i = 0; i < 300; i++) {
      assertEquals(store.parent(i), loaded.parent(i));
    }
    // still appendable after loading
    assertEquals(300, loaded.append(299));
    assertEquals(299, loaded.parent(300));
  }

  private static ByteArrayDataInput encoded(int size, byte... payloads) throws IOException {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(32);
    CodecUtil.writeHeader(out, Consts.PARENTS_CODEC, ParentPayloadStore.VERSION_CURRENT);
    out.writeVInt(size);
    out.writeVInt(payloads.length);
    out.writeBytes(payloads, 0, payloads.length);
    return new ByteArrayDataInput(out.getBytes(), 0, out.getPosition());
  }

  @Test
  public void testCorruptPayloads() throws IOException {
    assertEquals(2, ParentPayloadStore.read(encoded(2, (byte) 0, (byte) 1)).maxDoc());

    // parent of ordinal 1 is 4
    assertThrows(CorruptIndexException.class, () -> ParentPayloadStore.read(encoded(2, (byte) 0, (byte) 5)));
    // root with a parent
    assertThrows(CorruptIndexException.class, () -> ParentPayloadStore.read(encoded(1, (byte) 1)));
    // truncated vInt
    assertThrows(CorruptIndexException.class, () -> ParentPayloadStore.read(encoded(2, (byte) 0, (byte) 0x80)));
    // trailing bytes
    assertThrows(CorruptIndexException.class, () -> ParentPayloadStore.read(encoded(1, (byte) 0, (byte) 1)));
    // fewer bytes than payloads
    assertThrows(CorruptIndexException.class, () -> ParentPayloadStore.read(encoded(2, (byte) 0)));
    // more bytes than payloads can take
    assertThrows(CorruptIndexException.class, () -> ParentPayloadStore.read(encoded(1, new byte[6])));
  }
}
