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
package org.segdict.facet.taxonomy.writercache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.segdict.facet.taxonomy.FacetLabel;
import org.segdict.facet.taxonomy.writercache.LruTaxonomyWriterCache.LRUType;

public class TestLruTaxonomyWriterCache {

  @ParameterizedTest
  @EnumSource(LRUType.class)
  public void testEvictsLeastRecentlyUsed(LRUType type) {
    LruTaxonomyWriterCache cache = new LruTaxonomyWriterCache(3, type);
    assertFalse(cache.put(new FacetLabel("a"), 1));
    assertFalse(cache.put(new FacetLabel("b"), 2));
    assertFalse(cache.isFull());
    assertFalse(cache.put(new FacetLabel("c"), 3));
    assertTrue(cache.isFull());

    // touch "a" so "b" and "c" are the least recently used
    assertEquals(1, cache.get(new FacetLabel("a")));
    assertTrue(cache.put(new FacetLabel("d"), 4));
    assertEquals(2, cache.size());
    assertEquals(1, cache.get(new FacetLabel("a")));
    assertEquals(4, cache.get(new FacetLabel("d")));
    assertEquals(-1, cache.get(new FacetLabel("b")));
    assertEquals(-1, cache.get(new FacetLabel("c")));
  }

  @Test
  public void testNeverExceedsCapacity() {
    LruTaxonomyWriterCache cache = new LruTaxonomyWriterCache(10);
    for (int i = 0; i < 1000; i++) {
      cache.put(new FacetLabel("dim", Integer.toString(i)), i);
      assertTrue(cache.size() <= 10, "size=" + cache.size());
    }
    // the latest entry always survives eviction
    assertEquals(999, cache.get(new FacetLabel("dim", "999")));
  }

  @Test
  public void testFullWhenEvictionLagsBehind() {
    // a cache that never makes room grows past its capacity
    LruTaxonomyWriterCache cache = new LruTaxonomyWriterCache(new NameIntCacheLRU(2) {
      @Override
      boolean makeRoomLRU() {
        return false;
      }
    });
    cache.put(new FacetLabel("a"), 1);
    assertFalse(cache.isFull());
    cache.put(new FacetLabel("b"), 2);
    assertTrue(cache.isFull());
    assertTrue(cache.put(new FacetLabel("c"), 3));
    assertEquals(3, cache.size());
    assertTrue(cache.isFull());
  }

  @Test
  public void testUpdateExistingEntry() {
    LruTaxonomyWriterCache cache = new LruTaxonomyWriterCache(2);
    cache.put(new FacetLabel("a"), 1);
    assertFalse(cache.put(new FacetLabel("a"), 5));
    assertEquals(1, cache.size());
    assertEquals(5, cache.get(new FacetLabel("a")));
  }

  @Test
  public void testClearAndClose() {
    LruTaxonomyWriterCache cache = new LruTaxonomyWriterCache(4);
    cache.put(new FacetLabel("a"), 1);
    cache.clear();
    assertEquals(0, cache.size());
    assertEquals(-1, cache.get(new FacetLabel("a")));
    assertEquals("#miss=1 #hit=0", cache.stats());

    cache.close();
    cache.close();
    assertThrows(IllegalStateException.class, () -> cache.get(new FacetLabel("a")));
    assertThrows(IllegalStateException.class, () -> cache.put(new FacetLabel("a"), 1));
  }

  @Test
  public void testInvalidSize() {
    assertThrows(IllegalArgumentException.class, () -> new LruTaxonomyWriterCache(0));
    assertThrows(IllegalArgumentException.class, () -> new LruTaxonomyWriterCache(-1, LRUType.LRU_HASHED));
  }

  @Test
  public void testNameIntCacheLRU() {
    NameIntCacheLRU lru = new NameIntCacheLRU(3);
    assertEquals(3, lru.getMaxSize());
    assertNull(lru.get(new FacetLabel("x")));
    for (int i = 0; i < 4; i++) {
      lru.put(new FacetLabel("x", Integer.toString(i)), i);
    }
    assertTrue(lru.makeRoomLRU());
    assertEquals(2, lru.getSize());
    assertFalse(lru.makeRoomLRU());
    assertEquals(Integer.valueOf(3), lru.get(new FacetLabel("x", "3")));
    assertNull(lru.get(new FacetLabel("x", "0")));
  }

  @Test
  public void testHashedKeys() {
    NameHashIntCacheLRU lru = new NameHashIntCacheLRU(8);
    FacetLabel label = new FacetLabel("a", "b");
    assertEquals(label.longHashCode(), lru.key(label));
    lru.put(label, 7);
    assertEquals(Integer.valueOf(7), lru.get(new FacetLabel("a", "b", "c").subpath(2)));
  }
}
