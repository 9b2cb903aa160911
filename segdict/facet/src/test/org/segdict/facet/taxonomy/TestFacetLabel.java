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
package org.segdict.facet.taxonomy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class TestFacetLabel {

  @Test
  public void testBasic() {
    assertEquals(0, new FacetLabel().length);
    assertEquals(1, new FacetLabel("hello").length);
    assertEquals(2, new FacetLabel("hello", "world").length);
    assertEquals(3, new FacetLabel("Author", new String[] {"a", "b"}).length);
    assertEquals(new FacetLabel("Author", "a", "b"), new FacetLabel("Author", new String[] {"a", "b"}));
  }

  @Test
  public void testToString() {
    assertEquals("FacetLabel: []", new FacetLabel().toString());
    assertEquals("FacetLabel: [hello, world]", new FacetLabel("hello", "world").toString());
    assertEquals("FacetLabel: [hello]", new FacetLabel("hello", "world").subpath(1).toString());
  }

  @Test
  public void testEqualsAndHashCode() {
    FacetLabel a = new FacetLabel("a", "b", "c");
    assertEquals(a, new FacetLabel("a", "b", "c"));
    assertEquals(a.hashCode(), new FacetLabel("a", "b", "c").hashCode());
    assertEquals(a.longHashCode(), new FacetLabel("a", "b", "c").longHashCode());
    assertNotEquals(a, new FacetLabel("a", "b"));
    assertNotEquals(a, new FacetLabel("a", "b", "d"));
    assertEquals(new FacetLabel("a", "b"), a.subpath(2));
    assertEquals(new FacetLabel("a", "b").hashCode(), a.subpath(2).hashCode());
    assertEquals(0, new FacetLabel().hashCode());
    assertNotEquals(a, "a/b/c");
  }

  @Test
  public void testSubpath() {
    FacetLabel p = new FacetLabel("hi", "there", "man");
    assertSame(p, p.subpath(3));
    assertSame(p, p.subpath(5));
    assertSame(p, p.subpath(-1));
    assertEquals(0, p.subpath(0).length);
    assertEquals(new FacetLabel("hi", "there"), p.subpath(2));
  }

  @Test
  public void testCompareTo() {
    FacetLabel[] labels = {
        new FacetLabel("b"), new FacetLabel("a", "z"), new FacetLabel(), new FacetLabel("a"), new FacetLabel("a", "b")
    };
    Arrays.sort(labels);
    assertEquals(new FacetLabel(), labels[0]);
    assertEquals(new FacetLabel("a"), labels[1]);
    assertEquals(new FacetLabel("a", "b"), labels[2]);
    assertEquals(new FacetLabel("a", "z"), labels[3]);
    assertEquals(new FacetLabel("b"), labels[4]);
    assertEquals(0, new FacetLabel("x", "y").compareTo(new FacetLabel("x", "y")));
    assertTrue(new FacetLabel("x", "y").compareTo(new FacetLabel("x", "y", "z").subpath(2)) == 0);
  }

  @Test
  public void testEmptyNullComponents() {
    assertThrows(IllegalArgumentException.class, () -> new FacetLabel("a", ""));
    assertThrows(IllegalArgumentException.class, () -> new FacetLabel("a", null, "b"));
    assertThrows(IllegalArgumentException.class, () -> new FacetLabel("", new String[] {"a"}));
    assertThrows(IllegalArgumentException.class, () -> new FacetLabel("dim", new String[] {"a", ""}));
  }

  @Test
  public void testLongPath() {
    char[] chars = new char[FacetLabel.MAX_CATEGORY_PATH_LENGTH];
    Arrays.fill(chars, 'x');
    String longComponent = new String(chars);
    assertEquals(1, new FacetLabel(longComponent).length);
    // the separator pushes it over the limit
    assertThrows(IllegalArgumentException.class, () -> new FacetLabel("a", longComponent.substring(1)));
  }
}
