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

import java.io.IOException;
import java.util.Arrays;

import org.segdict.facet.taxonomy.ParallelTaxonomyArrays;
import org.segdict.facet.taxonomy.TaxonomyReader;
import org.segdict.index.CorruptIndexException;
import org.segdict.util.Accountable;
import org.segdict.util.RamUsageEstimator;

/**
 * A {@link ParallelTaxonomyArrays} that is initialized from the parent
 * entries of a {@link ParentOrdinalsSource}.
 * <p>
 * The parents array may be longer than the number of categories after
 * {@link #add(int, int)} grew it; unused slots hold
 * {@link TaxonomyReader#INVALID_ORDINAL}.
 */
class TaxonomyIndexArrays extends ParallelTaxonomyArrays implements Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(3, Integer.BYTES + 1);

  private final int[] parents;
  // number of ordinals with a parent entry
  private int size;

  // the following two arrays are lazily initialized. note that we only keep a
  // single boolean member as volatile, instead of declaring the arrays
  // volatile. the code guarantees that only after the boolean is set to true,
  // the arrays are returned.
  private volatile boolean initializedChildren = false;
  private int[] children, siblings;

  /** Used by {@link #add(int, int)} after the array grew. */
  private TaxonomyIndexArrays(int[] parents, int size) {
    this.parents = parents;
    this.size = size;
  }

  TaxonomyIndexArrays(ParentOrdinalsSource source) throws IOException {
    parents = new int[source.maxDoc()];
    size = parents.length;
    if (parents.length > 0) {
      initParents(source, 0);
      // the root's entry is not trusted, ordinal 0 never has a parent
      parents[0] = TaxonomyReader.INVALID_ORDINAL;
    }
  }

  TaxonomyIndexArrays(ParentOrdinalsSource source, TaxonomyIndexArrays copyFrom) throws IOException {
    assert copyFrom != null;

    // copyFrom may hold as many ordinals as the source, eg. when nothing was
    // added in between, in which case there is nothing left to read
    final int maxDoc = source.maxDoc();
    final int copySize = copyFrom.size();
    final int first = Math.min(copySize, maxDoc);
    parents = new int[maxDoc];
    size = maxDoc;
    System.arraycopy(copyFrom.parents, 0, parents, 0, first);
    initParents(source, first);
    if (maxDoc > 0) {
      parents[0] = TaxonomyReader.INVALID_ORDINAL;
    }

    if (copyFrom.initializedChildren && copySize <= maxDoc) {
      initChildrenSiblings(copyFrom, copySize);
    }
  }

  private synchronized void initChildrenSiblings(TaxonomyIndexArrays copyFrom, int copySize) {
    if (!initializedChildren) { // must do this check !
      children = new int[parents.length];
      siblings = new int[parents.length];
      if (copyFrom != null) {
        // called from the ctor, after we know copyFrom has initialized children/siblings
        System.arraycopy(copyFrom.children, 0, children, 0, copySize);
        System.arraycopy(copyFrom.siblings, 0, siblings, 0, copySize);
        computeChildrenSiblings(copySize);
      } else {
        computeChildrenSiblings(0);
      }
      initializedChildren = true;
    }
  }

  private void computeChildrenSiblings(int first) {
    // reset the youngest child of all ordinals. while this should be done only
    // for the leaves, we don't know up front which are the leaves, so we reset
    // all of them.
    for (int i = first; i < parents.length; i++) {
      children[i] = TaxonomyReader.INVALID_ORDINAL;
    }

    // the root category has no parent, and therefore no siblings
    if (first == 0 && parents.length > 0) {
      first = 1;
      siblings[0] = TaxonomyReader.INVALID_ORDINAL;
    }

    for (int i = first; i < parents.length; i++) {
      final int parent = parents[i];
      if (parent == TaxonomyReader.INVALID_ORDINAL) {
        // unused slot
        siblings[i] = TaxonomyReader.INVALID_ORDINAL;
        continue;
      }
      // note that parents[i] is always < i, so the right-hand-side of
      // the following line is already set when we get here
      siblings[i] = children[parent];
      children[parent] = i;
    }
  }

  // Read the parents of the new categories
  private void initParents(ParentOrdinalsSource source, int first) throws IOException {
    final int num = source.maxDoc();
    if (num == first) {
      return;
    }

    final ParentPositionsEnum positions = source.parentPositions();

    // shouldn't really happen, if it does, something's wrong
    if (positions == null || positions.advance(first) == ParentPositionsEnum.NO_MORE_DOCS) {
      throw new CorruptIndexException("Missing parent data for category " + first, source.toString());
    }

    for (int i = first; i < num; i++) {
      if (positions.docID() == i) {
        if (positions.freq() == 0) { // shouldn't happen
          throw new CorruptIndexException("Missing parent data for category " + i, source.toString());
        }

        final int parent = positions.nextPosition();
        if (i > 0 && (parent < 0 || parent >= i)) {
          throw new CorruptIndexException("Invalid parent " + parent + " for category " + i, source.toString());
        }
        parents[i] = parent;

        if (positions.nextDoc() == ParentPositionsEnum.NO_MORE_DOCS) {
          if (i + 1 < num) {
            throw new CorruptIndexException("Missing parent data for category " + (i + 1), source.toString());
          }
          break;
        }
      } else { // this shouldn't happen
        throw new CorruptIndexException("Missing parent data for category " + i, source.toString());
      }
    }
  }

  /**
   * Adds the given ordinal/parent info and returns either a new instance if the
   * underlying array had to grow, or this instance otherwise. The returned
   * instance has its children and siblings computed lazily again.
   * <p>
   * <b>NOTE:</b> you should call this method from a thread-safe code.
   *
   * @throws IllegalArgumentException if the parent is not in
   *         {@code [0, ordinal)} or the ordinal already has another parent
   */
  synchronized TaxonomyIndexArrays add(int ordinal, int parentOrdinal) {
    if (parentOrdinal < 0 || parentOrdinal >= ordinal) {
      throw new IllegalArgumentException("parent " + parentOrdinal + " of category " + ordinal + " must be in [0, " + ordinal + ")");
    }
    if (ordinal < size && parents[ordinal] != TaxonomyReader.INVALID_ORDINAL && parents[ordinal] != parentOrdinal) {
      throw new IllegalArgumentException("category " + ordinal + " already has parent " + parents[ordinal] + ", cannot change it to " + parentOrdinal);
    }
    if (ordinal >= parents.length) {
      final int[] newarray = Arrays.copyOf(parents, Math.max(ordinal + 1, 2 * parents.length));
      Arrays.fill(newarray, parents.length, newarray.length, TaxonomyReader.INVALID_ORDINAL);
      newarray[ordinal] = parentOrdinal;
      return new TaxonomyIndexArrays(newarray, ordinal + 1);
    }
    final boolean isNew = ordinal >= size || parents[ordinal] == TaxonomyReader.INVALID_ORDINAL;
    parents[ordinal] = parentOrdinal;
    size = Math.max(size, ordinal + 1);
    if (initializedChildren && isNew) {
      // keep the derived arrays in step, the new ordinal is now the youngest child
      siblings[ordinal] = children[parentOrdinal];
      children[parentOrdinal] = ordinal;
    }
    return this;
  }

  /** Number of ordinals, including unused slots below the largest one. */
  synchronized int size() {
    return size;
  }

  /**
   * Returns the parents array, where {@code parents[i]} denotes the parent of
   * category ordinal {@code i}.
   */
  @Override
  public int[] parents() {
    return parents;
  }

  /**
   * Returns the children array, where {@code children[i]} denotes the youngest
   * child of category ordinal {@code i}. The youngest child is defined as the
   * category that was added last to the taxonomy as an immediate child of
   * {@code i}.
   */
  @Override
  public int[] children() {
    if (!initializedChildren) {
      initChildrenSiblings(null, 0);
    }

    // the array is guaranteed to be populated
    return children;
  }

  /**
   * Returns the siblings array, where {@code siblings[i]} denotes the sibling
   * of category ordinal {@code i}. The sibling is defined as the previous
   * youngest child of {@code parents[i]}.
   */
  @Override
  public int[] siblings() {
    if (!initializedChildren) {
      initChildrenSiblings(null, 0);
    }

    // the array is guaranteed to be populated
    return siblings;
  }

  @Override
  public synchronized long ramBytesUsed() {
    long ramBytesUsed = BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(parents);
    if (children != null) {
      ramBytesUsed += RamUsageEstimator.sizeOf(children) + RamUsageEstimator.sizeOf(siblings);
    }
    return ramBytesUsed;
  }
}
