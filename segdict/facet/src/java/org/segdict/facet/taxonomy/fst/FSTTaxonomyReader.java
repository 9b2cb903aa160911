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

import org.segdict.facet.taxonomy.FacetLabel;
import org.segdict.facet.taxonomy.ParallelTaxonomyArrays;
import org.segdict.facet.taxonomy.TaxonomyReader;
import org.segdict.util.Accountable;
import org.segdict.util.BytesRefBuilder;
import org.segdict.util.RamUsageEstimator;
import org.segdict.util.fst.FST;
import org.segdict.util.fst.Util;

/**
 * A point in time {@link TaxonomyReader} opened by
 * {@link FSTTaxonomyWriter#getReader()}. Labels are resolved through an
 * {@link FST} from encoded label to ordinal, ordinals through an array.
 * <p>
 * Instances are thread safe; the FST is shared and each lookup uses its own
 * bytes reader.
 */
public class FSTTaxonomyReader extends TaxonomyReader implements Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(3, 0);

  private final FST<Long> fst;
  private final FacetLabel[] labels;
  private final TaxonomyIndexArrays taxoArrays;

  FSTTaxonomyReader(FST<Long> fst, FacetLabel[] labels, TaxonomyIndexArrays taxoArrays) {
    this.fst = fst;
    this.labels = labels;
    this.taxoArrays = taxoArrays;
  }

  FacetLabel[] labels() {
    return labels;
  }

  TaxonomyIndexArrays arrays() {
    return taxoArrays;
  }

  @Override
  public ParallelTaxonomyArrays getParallelTaxonomyArrays() {
    ensureOpen();
    return taxoArrays;
  }

  /**
   * {@inheritDoc}
   * @throws IllegalArgumentException if a component contains the label
   *         delimiter, such a category can never be added
   */
  @Override
  public int getOrdinal(FacetLabel categoryPath) throws IOException {
    ensureOpen();
    if (categoryPath.length == 0) {
      return ROOT_ORDINAL;
    }
    final Long ord = Util.get(fst, Consts.pathToBytes(categoryPath, new BytesRefBuilder()));
    return ord == null ? INVALID_ORDINAL : ord.intValue();
  }

  @Override
  public FacetLabel getPath(int ordinal) {
    ensureOpen();
    if (ordinal < 0 || ordinal >= labels.length) {
      return null;
    }
    return labels[ordinal];
  }

  @Override
  public int getSize() {
    ensureOpen();
    return labels.length;
  }

  /** Returns the parent of {@code ordinal}. Shortcut for {@code getParallelTaxonomyArrays().parents()[ordinal]}. */
  public int getParent(int ordinal) {
    ensureOpen();
    if (ordinal < 0 || ordinal >= labels.length) {
      throw new IllegalArgumentException("requested ordinal " + ordinal + " is out of bounds (size=" + labels.length + ")");
    }
    return taxoArrays.parents()[ordinal];
  }

  @Override
  protected void doClose() {
    // nothing to release, the FST and arrays are on heap
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + fst.ramBytesUsed() + taxoArrays.ramBytesUsed()
        + RamUsageEstimator.shallowSizeOfArray(labels);
  }

  @Override
  public String toString() {
    return "FSTTaxonomyReader(size=" + labels.length + ")";
  }
}
