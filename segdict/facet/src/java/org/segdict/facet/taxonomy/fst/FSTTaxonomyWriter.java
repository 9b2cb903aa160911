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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import org.segdict.facet.taxonomy.FacetLabel;
import org.segdict.facet.taxonomy.TaxonomyReader;
import org.segdict.facet.taxonomy.writercache.LruTaxonomyWriterCache;
import org.segdict.facet.taxonomy.writercache.TaxonomyWriterCache;
import org.segdict.util.ArrayUtil;
import org.segdict.util.BytesRef;
import org.segdict.util.BytesRefBuilder;
import org.segdict.util.InfoStream;
import org.segdict.util.IntsRefBuilder;
import org.segdict.util.fst.BytesRefFSTEnum;
import org.segdict.util.fst.FST;
import org.segdict.util.fst.FSTCompiler;
import org.segdict.util.fst.PositiveIntOutputs;
import org.segdict.util.fst.Util;

/**
 * Taxonomy writer that keeps the label to ordinal mapping in an {@link FST}
 * and the parent of every ordinal in a {@link ParentPayloadStore}.
 * <p>
 * Categories added since the last {@link #commit()} are kept in a sorted map;
 * {@link #commit()} merges them with the committed labels into a new FST.
 * Readers returned by {@link #getReader()} only see committed categories.
 * <p>
 * There is a single writer; all public methods are synchronized.
 *
 * 分类法写入器  新增的标签先放在 pending 中  commit 时与已提交的 FST 归并生成新的 FST
 */
public class FSTTaxonomyWriter implements Closeable {

  /** {@link InfoStream} component name used by this writer. */
  public static final String INFO_STREAM_COMPONENT = "TW";

  /** Default number of labels kept by the writer cache. */
  public static final int DEFAULT_CACHE_SIZE = 4096;

  private final TaxonomyWriterCache cache;
  private final InfoStream infoStream;

  private final ParentPayloadStore parentStore = new ParentPayloadStore();
  // ordinal -> label, committed and pending
  private final List<FacetLabel> labels = new ArrayList<>();
  // encoded label -> ordinal, only categories added since the last commit
  private final TreeMap<BytesRef,Integer> pending = new TreeMap<>();
  private final BytesRefBuilder scratchBytes = new BytesRefBuilder();
  private final IntsRefBuilder scratchInts = new IntsRefBuilder();

  private volatile TaxonomyIndexArrays taxoArrays;
  private FST<Long> committedFst;
  private int committedSize;
  private FSTTaxonomyReader lastReader;
  private boolean closed;

  /** Creates a writer with an {@link LruTaxonomyWriterCache} of {@link #DEFAULT_CACHE_SIZE} labels. */
  public FSTTaxonomyWriter() throws IOException {
    this(new LruTaxonomyWriterCache(DEFAULT_CACHE_SIZE), InfoStream.getDefault());
  }

  /**
   * Creates a writer holding only the root category, which is committed
   * right away.
   */
  public FSTTaxonomyWriter(TaxonomyWriterCache cache, InfoStream infoStream) throws IOException {
    if (cache == null) {
      throw new IllegalArgumentException("cache must not be null");
    }
    if (infoStream == null) {
      throw new IllegalArgumentException("infoStream must not be null");
    }
    this.cache = cache;
    this.infoStream = infoStream;

    final FacetLabel root = new FacetLabel();
    parentStore.append(TaxonomyReader.INVALID_ORDINAL);
    labels.add(root);
    cache.put(root, TaxonomyReader.ROOT_ORDINAL);
    taxoArrays = new TaxonomyIndexArrays(parentStore);
    commit();
  }

  /**
   * Adds a category and any missing ancestors, returning its ordinal. Adding
   * an existing category returns its ordinal and changes nothing.
   *
   * @throws IllegalArgumentException if a component contains the label delimiter
   */
  public synchronized int addCategory(FacetLabel categoryPath) throws IOException {
    ensureOpen();
    if (categoryPath == null) {
      throw new IllegalArgumentException("categoryPath must not be null");
    }
    int res = findCategory(categoryPath);
    if (res < 0) {
      res = internalAddCategory(categoryPath);
    }
    return res;
  }

  // Look up the ordinal in the cache first, then in the pending labels and the committed FST.
  private int findCategory(FacetLabel categoryPath) throws IOException {
    int res = cache.get(categoryPath);
    if (res >= 0) {
      return res;
    }

    final BytesRef key = Consts.pathToBytes(categoryPath, scratchBytes);
    final Integer pendingOrd = pending.get(key);
    if (pendingOrd != null) {
      res = pendingOrd;
    } else {
      final Long committedOrd = Util.get(committedFst, key);
      if (committedOrd == null) {
        return TaxonomyReader.INVALID_ORDINAL;
      }
      res = committedOrd.intValue();
    }
    cache.put(categoryPath, res);
    return res;
  }

  // Adds the category after making sure its parent exists, adding the parent first if needed.
  private int internalAddCategory(FacetLabel cp) throws IOException {
    final int parent;
    if (cp.length > 1) {
      final FacetLabel parentPath = cp.subpath(cp.length - 1);
      final int found = findCategory(parentPath);
      parent = found < 0 ? internalAddCategory(parentPath) : found;
    } else {
      assert cp.length == 1 : "the root category always exists";
      parent = TaxonomyReader.ROOT_ORDINAL;
    }

    final BytesRef key = BytesRef.deepCopyOf(Consts.pathToBytes(cp, scratchBytes));
    final int ordinal = parentStore.append(parent);
    labels.add(cp);
    pending.put(key, ordinal);
    taxoArrays = taxoArrays.add(ordinal, parent);
    cache.put(cp, ordinal);
    return ordinal;
  }

  /**
   * Returns the parent of the given ordinal, or
   * {@link TaxonomyReader#INVALID_ORDINAL} for the root.
   *
   * @throws IllegalArgumentException if the ordinal is out of range
   */
  public synchronized int getParent(int ordinal) {
    ensureOpen();
    if (ordinal < 0 || ordinal >= labels.size()) {
      throw new IllegalArgumentException("requested ordinal " + ordinal + " is out of bounds (size=" + labels.size() + ")");
    }
    return taxoArrays.parents()[ordinal];
  }

  /** Number of categories, including the root and uncommitted ones. */
  public synchronized int getSize() {
    ensureOpen();
    return labels.size();
  }

  /**
   * Makes all categories added so far visible to readers opened afterwards.
   * Does nothing when there are no pending categories.
   */
  public synchronized void commit() throws IOException {
    ensureOpen();
    if (committedFst != null && pending.isEmpty()) {
      return;
    }
    final long startNS = System.nanoTime();
    final int numPending = pending.size();

    final FSTCompiler<Long> fstCompiler =
        new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton()).build();
    // the root is the empty input
    scratchInts.clear();
    fstCompiler.add(scratchInts.get(), (long) TaxonomyReader.ROOT_ORDINAL);

    final Iterator<Map.Entry<BytesRef,Integer>> pendingIt = pending.entrySet().iterator();
    Map.Entry<BytesRef,Integer> nextPending = pendingIt.hasNext() ? pendingIt.next() : null;
    if (committedFst != null) {
      final BytesRefFSTEnum<Long> committed = new BytesRefFSTEnum<>(committedFst);
      BytesRefFSTEnum.InputOutput<Long> nextCommitted;
      while ((nextCommitted = committed.next()) != null) {
        if (nextCommitted.input.length == 0) {
          // the root, already added
          continue;
        }
        // a label is either committed or pending, never both
        while (nextPending != null && nextPending.getKey().compareTo(nextCommitted.input) < 0) {
          fstCompiler.add(Util.toIntsRef(nextPending.getKey(), scratchInts), (long) nextPending.getValue());
          nextPending = pendingIt.hasNext() ? pendingIt.next() : null;
        }
        fstCompiler.add(Util.toIntsRef(nextCommitted.input, scratchInts), nextCommitted.output);
      }
    }
    while (nextPending != null) {
      fstCompiler.add(Util.toIntsRef(nextPending.getKey(), scratchInts), (long) nextPending.getValue());
      nextPending = pendingIt.hasNext() ? pendingIt.next() : null;
    }

    committedFst = fstCompiler.compile();
    committedSize = labels.size();
    pending.clear();

    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, String.format(Locale.ROOT,
          "commit: %d new categories, %d total, fst %d nodes %d bytes [%.1f msec]",
          numPending, committedSize, fstCompiler.getNodeCount(), committedFst.ramBytesUsed(),
          (System.nanoTime() - startNS) / (double) TimeUnit.MILLISECONDS.toNanos(1)));
    }
  }

  /**
   * Returns a reader over the committed categories. The parents of the
   * categories the previous reader already had are copied instead of read
   * again.
   */
  public synchronized FSTTaxonomyReader getReader() throws IOException {
    ensureOpen();
    final ParentOrdinalsSource source = parentStore.view(committedSize);
    final FacetLabel[] snapshot;
    final TaxonomyIndexArrays arrays;
    if (lastReader == null) {
      snapshot = labels.subList(0, committedSize).toArray(new FacetLabel[0]);
      arrays = new TaxonomyIndexArrays(source);
    } else {
      final FacetLabel[] previous = lastReader.labels();
      snapshot = Arrays.copyOf(previous, committedSize);
      for (int i = previous.length; i < committedSize; i++) {
        snapshot[i] = labels.get(i);
      }
      arrays = new TaxonomyIndexArrays(source, lastReader.arrays());
    }
    lastReader = new FSTTaxonomyReader(committedFst, snapshot, arrays);
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "getReader: " + committedSize + " categories");
    }
    return lastReader;
  }

  /**
   * Adds all categories of the given taxonomy and records in {@code map} the
   * ordinal each of them has in this taxonomy.
   */
  public synchronized void addTaxonomy(TaxonomyReader taxo, OrdinalMap map) throws IOException {
    ensureOpen();
    final int size = taxo.getSize();
    map.setSize(size);
    for (int ordinal = 0; ordinal < size; ordinal++) {
      final FacetLabel label = taxo.getPath(ordinal);
      map.addMapping(ordinal, addCategory(label));
    }
    map.addDone();
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "addTaxonomy: mapped " + size + " categories");
    }
  }

  /** Commits pending categories and releases the cache. */
  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    commit();
    closed = true;
    cache.close();
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "close: " + committedSize + " categories");
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("this FSTTaxonomyWriter is closed");
    }
  }

  /**
   * Mapping from the ordinals of an added taxonomy to the ordinals the same
   * categories have in this taxonomy, filled by {@link #addTaxonomy}.
   */
  public interface OrdinalMap {
    /**
     * Set the size of the map. This MUST be called before addMapping().
     * It is assumed (but not verified) that addMapping() will then be
     * called exactly 'size' times, with different origOrdinals between 0
     * and size-1.
     */
    void setSize(int size) throws IOException;

    /** Record a mapping. */
    void addMapping(int origOrdinal, int newOrdinal) throws IOException;

    /**
     * Call addDone() to say that all addMapping() have been done.
     * In some implementations this might free some resources.
     */
    void addDone() throws IOException;

    /**
     * Return the map from the taxonomy's original (consecutive) ordinals
     * to the new taxonomy's ordinals.
     */
    int[] getMap() throws IOException;
  }

  /**
   * {@link OrdinalMap} maintained in memory
   */
  public static final class MemoryOrdinalMap implements OrdinalMap {
    int[] map;

    /** Sole constructor. */
    public MemoryOrdinalMap() {
      map = new int[0];
    }

    @Override
    public void setSize(int taxonomySize) {
      map = new int[taxonomySize];
    }

    @Override
    public void addMapping(int origOrdinal, int newOrdinal) {
      if (origOrdinal >= map.length) {
        map = ArrayUtil.grow(map, origOrdinal + 1);
      }
      map[origOrdinal] = newOrdinal;
    }

    @Override
    public void addDone() { /* nothing to do */ }

    @Override
    public int[] getMap() {
      return map;
    }
  }
}
