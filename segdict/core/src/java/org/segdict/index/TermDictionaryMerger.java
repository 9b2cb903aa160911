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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.segdict.util.BytesRef;
import org.segdict.util.BytesRefBuilder;
import org.segdict.util.InfoStream;
import org.segdict.util.PriorityQueue;

/**
 * Merges the term dictionaries of several segments into one.
 * <p>
 * The result holds every distinct term of the inputs, in unsigned byte
 * order, numbered with new dense ordinals; the statistics of a term found
 * in several segments are summed. The {@link OrdinalMap} built along the
 * way translates each segment's ordinals to the merged ones.
 * <p>
 * A merger runs once; the input dictionaries are only read.
 *
 * 多个段的词典合并  用优先队列按字典序归并
 */
public final class TermDictionaryMerger {

  /** {@link InfoStream} component used by this class. */
  public static final String INFO_STREAM_COMPONENT = "TM";

  private final List<TermDictionary> segments;
  private final InfoStream infoStream;
  private OrdinalMap ordinalMap;
  private boolean merged;

  public TermDictionaryMerger(List<TermDictionary> segments) {
    this(segments, InfoStream.getDefault());
  }

  public TermDictionaryMerger(List<TermDictionary> segments, InfoStream infoStream) {
    if (segments == null) {
      throw new IllegalArgumentException("segments must not be null");
    }
    for (int i = 0; i < segments.size(); i++) {
      if (segments.get(i) == null) {
        throw new IllegalArgumentException("segment " + i + " is null");
      }
    }
    this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    this.infoStream = infoStream;
  }

  private static class TermsEnumIndex {
    final int subIndex;
    final TermsEnum termsEnum;
    BytesRef currentTerm;

    TermsEnumIndex(TermsEnum termsEnum, int subIndex) {
      this.termsEnum = termsEnum;
      this.subIndex = subIndex;
    }

    BytesRef next() throws IOException {
      currentTerm = termsEnum.next();
      return currentTerm;
    }
  }

  /**
   * Merges all segments.
   * @throws IllegalStateException if called more than once
   */
  public TermDictionary merge() throws IOException {
    if (merged) {
      throw new IllegalStateException("merge was already called");
    }
    merged = true;

    final long startNS = System.nanoTime();
    final long[] segmentSizes = new long[segments.size()];
    long inputTerms = 0;
    for (int i = 0; i < segmentSizes.length; i++) {
      segmentSizes[i] = segments.get(i).size();
      inputTerms += segmentSizes[i];
    }

    final OrdinalMap.Builder ordinalMapBuilder = new OrdinalMap.Builder(segmentSizes);
    final TermDictionaryBuilder builder = new TermDictionaryBuilder();

    final PriorityQueue<TermsEnumIndex> queue = new PriorityQueue<TermsEnumIndex>(Math.max(1, segments.size())) {
      @Override
      protected boolean lessThan(TermsEnumIndex a, TermsEnumIndex b) {
        final int cmp = a.currentTerm.compareTo(b.currentTerm);
        if (cmp != 0) {
          return cmp < 0;
        }
        return a.subIndex < b.subIndex;
      }
    };
    for (int i = 0; i < segments.size(); i++) {
      final TermsEnumIndex sub = new TermsEnumIndex(segments.get(i).iterator(), i);
      if (sub.next() != null) {
        queue.add(sub);
      }
    }

    final BytesRefBuilder scratch = new BytesRefBuilder();
    while (queue.size() != 0) {
      TermsEnumIndex top = queue.top();
      scratch.copyBytes(top.currentTerm);
      ordinalMapBuilder.nextGlobalOrd();
      TermStats stats = null;
      // pop every segment positioned on the same term
      while (true) {
        top = queue.top();
        final TermStats segmentStats = top.termsEnum.stats();
        stats = stats == null ? segmentStats : stats.add(segmentStats);
        ordinalMapBuilder.add(top.subIndex, top.termsEnum.ord());
        if (top.next() == null) {
          queue.pop();
          if (queue.size() == 0) {
            break;
          }
        } else {
          queue.updateTop();
        }
        if (queue.top().currentTerm.equals(scratch.get()) == false) {
          break;
        }
      }
      builder.add(scratch.get(), stats);
    }

    final TermDictionary result = builder.finish();
    ordinalMap = ordinalMapBuilder.build();
    assert ordinalMap.getValueCount() == result.size();

    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, String.format(Locale.ROOT,
          "merged %d segments (%d terms) into %d terms in %.1f msec; ramBytesUsed=%d",
          segments.size(), inputTerms, result.size(),
          (System.nanoTime() - startNS) / (double) TimeUnit.MILLISECONDS.toNanos(1),
          result.ramBytesUsed()));
    }
    return result;
  }

  /**
   * The ordinal map of the last {@link #merge()}.
   * @throws IllegalStateException if {@link #merge()} has not completed
   */
  public OrdinalMap getOrdinalMap() {
    if (ordinalMap == null) {
      throw new IllegalStateException("merge has not completed");
    }
    return ordinalMap;
  }
}
