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

import org.segdict.util.Accountable;
import org.segdict.util.LongValues;
import org.segdict.util.RamUsageEstimator;
import org.segdict.util.packed.PackedInts;
import org.segdict.util.packed.PackedLongValues;

/**
 * Maps per-segment ordinals to/from global ordinal space.
 * <p>
 * Filled by {@link TermDictionaryMerger} while it walks the union of its
 * segments' terms: global ordinal {@code g} is the rank of a term among the
 * distinct terms of all segments, and for every segment containing that term
 * the map records which segment ordinal it had there.
 * <p>
 * Every mapping is stored as a delta {@code globalOrd - segmentOrd}, which
 * never decreases along a segment, in {@link PackedLongValues}.
 * <p>
 * Immutable once built; safe to share between threads.
 *
 * 段内序号与合并后全局序号之间的映射
 */
public final class OrdinalMap implements Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(4, 2 * Long.BYTES);

  // globalOrd -> first segment
  private final PackedLongValues firstSegments;
  // globalOrd -> globalOrd - segmentOrd where segmentOrd is the ordinal in the first segment that contains this term
  private final PackedLongValues globalOrdDeltas;
  // segmentOrd -> globalOrd
  private final LongValues[] segmentToGlobalOrds;
  private final long[] segmentSizes;
  private final long ramBytesUsed;

  private OrdinalMap(PackedLongValues firstSegments, PackedLongValues globalOrdDeltas, LongValues[] segmentToGlobalOrds,
                     long[] segmentSizes, long ramBytesUsed) {
    this.firstSegments = firstSegments;
    this.globalOrdDeltas = globalOrdDeltas;
    this.segmentToGlobalOrds = segmentToGlobalOrds;
    this.segmentSizes = segmentSizes;
    this.ramBytesUsed = ramBytesUsed;
  }

  /**
   * Given a segment number, return a {@link LongValues} instance that maps
   * segment ordinals to global ordinals. Lookups are not range checked.
   * @throws IllegalArgumentException if the segment is out of range
   */
  public LongValues getGlobalOrds(int segmentIndex) {
    checkSegment(segmentIndex);
    return segmentToGlobalOrds[segmentIndex];
  }

  /**
   * Given a segment number and segment ordinal, returns the corresponding global ordinal.
   * @throws IllegalArgumentException if the segment or the ordinal is out of range
   */
  public long getGlobalOrd(int segmentIndex, long segmentOrd) {
    checkSegment(segmentIndex);
    if (segmentOrd < 0 || segmentOrd >= segmentSizes[segmentIndex]) {
      throw new IllegalArgumentException("ordinal " + segmentOrd + " is out of bounds for segment " + segmentIndex + " (size=" + segmentSizes[segmentIndex] + ")");
    }
    return segmentToGlobalOrds[segmentIndex].get(segmentOrd);
  }

  /**
   * Given global ordinal, returns the ordinal of the term in the first segment
   * which contains it (that segment is {@link #getFirstSegmentNumber}).
   */
  public long getFirstSegmentOrd(long globalOrd) {
    checkGlobalOrd(globalOrd);
    return globalOrd - globalOrdDeltas.get(globalOrd);
  }

  /**
   * Given a global ordinal, returns the index of the first
   * segment that contains this term.
   */
  public int getFirstSegmentNumber(long globalOrd) {
    checkGlobalOrd(globalOrd);
    return (int) firstSegments.get(globalOrd);
  }

  /**
   * Returns the total number of unique terms in global ord space.
   */
  public long getValueCount() {
    return globalOrdDeltas.size();
  }

  /** Number of segments this map was built over. */
  public int getSegmentCount() {
    return segmentToGlobalOrds.length;
  }

  private void checkSegment(int segmentIndex) {
    if (segmentIndex < 0 || segmentIndex >= segmentToGlobalOrds.length) {
      throw new IllegalArgumentException("segment " + segmentIndex + " is out of bounds (segments=" + segmentToGlobalOrds.length + ")");
    }
  }

  private void checkGlobalOrd(long globalOrd) {
    if (globalOrd < 0 || globalOrd >= getValueCount()) {
      throw new IllegalArgumentException("global ordinal " + globalOrd + " is out of bounds (valueCount=" + getValueCount() + ")");
    }
  }

  @Override
  public long ramBytesUsed() {
    return ramBytesUsed;
  }

  @Override
  public String toString() {
    return "OrdinalMap(segments=" + segmentToGlobalOrds.length + ",valueCount=" + getValueCount() + ")";
  }

  /**
   * Accumulates the mapping while terms are visited in global order. Each
   * segment's ordinals must arrive in increasing order without gaps, which is
   * how a merge over sorted segments visits them.
   */
  static final class Builder {
    // even though we accept an overhead ratio, we keep these ones with COMPACT
    // since they are only used to resolve values given a global ord, which is
    // slow anyway
    private final PackedLongValues.Builder globalOrdDeltas = PackedLongValues.monotonicBuilder(PackedInts.COMPACT);
    private final PackedLongValues.Builder firstSegments = PackedLongValues.packedBuilder(PackedInts.COMPACT);
    private final PackedLongValues.Builder[] ordDeltas;
    // OR of all deltas of a segment, 0 when the segment holds every term
    private final long[] ordDeltaBits;
    private final long[] segmentSizes;
    private final float acceptableOverheadRatio;
    private long globalOrd = -1;
    private int firstSegmentIndex;
    private long globalOrdDelta;

    Builder(long[] segmentSizes) {
      this(segmentSizes, PackedInts.FAST);
    }

    Builder(long[] segmentSizes, float acceptableOverheadRatio) {
      this.segmentSizes = segmentSizes.clone();
      this.acceptableOverheadRatio = acceptableOverheadRatio;
      ordDeltas = new PackedLongValues.Builder[segmentSizes.length];
      for (int i = 0; i < ordDeltas.length; i++) {
        ordDeltas[i] = PackedLongValues.monotonicBuilder(acceptableOverheadRatio);
      }
      ordDeltaBits = new long[segmentSizes.length];
    }

    /** Starts the next global term; returns its global ordinal. */
    long nextGlobalOrd() {
      finishGlobalOrd();
      globalOrd++;
      firstSegmentIndex = Integer.MAX_VALUE;
      globalOrdDelta = Long.MAX_VALUE;
      return globalOrd;
    }

    // for each unique term, just mark the first segment index/delta where it occurs
    private void finishGlobalOrd() {
      if (globalOrd < 0) {
        return;
      }
      if (firstSegmentIndex == Integer.MAX_VALUE) {
        throw new IllegalStateException("global ordinal " + globalOrd + " has no segment");
      }
      firstSegments.add(firstSegmentIndex);
      globalOrdDeltas.add(globalOrdDelta);
    }

    /** Records that the current global term is {@code segmentOrd} in {@code segment}. */
    void add(int segment, long segmentOrd) {
      if (globalOrd < 0) {
        throw new IllegalStateException("call nextGlobalOrd first");
      }
      if (segmentOrd != ordDeltas[segment].size()) {
        throw new IllegalArgumentException("segment " + segment + " must map ordinal " + ordDeltas[segment].size() + " next, got " + segmentOrd);
      }
      final long delta = globalOrd - segmentOrd;
      // we compute the least segment where the term occurs
      if (segment < firstSegmentIndex) {
        firstSegmentIndex = segment;
        globalOrdDelta = delta;
      }
      ordDeltaBits[segment] |= delta;
      ordDeltas[segment].add(delta);
    }

    OrdinalMap build() {
      finishGlobalOrd();
      final PackedLongValues firstSegments = this.firstSegments.build();
      final PackedLongValues globalOrdDeltas = this.globalOrdDeltas.build();
      final LongValues[] segmentToGlobalOrds = new LongValues[ordDeltas.length];
      long ramBytesUsed = BASE_RAM_BYTES_USED + firstSegments.ramBytesUsed() + globalOrdDeltas.ramBytesUsed()
          + RamUsageEstimator.shallowSizeOfArray(segmentToGlobalOrds) + RamUsageEstimator.sizeOf(segmentSizes);

      for (int i = 0; i < ordDeltas.length; ++i) {
        if (ordDeltas[i].size() != segmentSizes[i]) {
          throw new IllegalStateException("segment " + i + " has unmapped ordinals: mapped " + ordDeltas[i].size() + " of " + segmentSizes[i]);
        }
        final PackedLongValues deltas = ordDeltas[i].build();
        if (ordDeltaBits[i] == 0L) {
          // segment ords perfectly match global ordinals
          // likely in case of low cardinalities and large segments
          segmentToGlobalOrds[i] = LongValues.IDENTITY;
        } else {
          final int bitsRequired = ordDeltaBits[i] < 0 ? 64 : PackedInts.bitsRequired(ordDeltaBits[i]);
          final long monotonicBits = deltas.ramBytesUsed() * 8;
          final long packedBits = bitsRequired * deltas.size();
          if (deltas.size() <= Integer.MAX_VALUE
              && packedBits <= monotonicBits * (1 + acceptableOverheadRatio)) {
            // monotonic compression mostly adds overhead, let's keep the mapping in plain packed ints
            final int size = (int) deltas.size();
            final PackedInts.Mutable newDeltas = PackedInts.getMutable(size, bitsRequired, acceptableOverheadRatio);
            final PackedLongValues.Iterator it = deltas.iterator();
            for (int ord = 0; ord < size; ++ord) {
              newDeltas.set(ord, it.next());
            }
            assert it.hasNext() == false;
            segmentToGlobalOrds[i] = new LongValues() {
              @Override
              public long get(long ord) {
                return ord + newDeltas.get((int) ord);
              }
            };
            ramBytesUsed += newDeltas.ramBytesUsed();
          } else {
            segmentToGlobalOrds[i] = new LongValues() {
              @Override
              public long get(long ord) {
                return ord + deltas.get(ord);
              }
            };
            ramBytesUsed += deltas.ramBytesUsed();
          }
        }
      }
      return new OrdinalMap(firstSegments, globalOrdDeltas, segmentToGlobalOrds, segmentSizes, ramBytesUsed);
    }
  }
}
