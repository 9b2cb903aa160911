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

/**
 * Per-term statistics kept by a {@link TermDictionary}: the number of
 * documents containing the term and the total number of occurrences.
 * Statistics of the same term from several segments are summed by
 * {@link #add(TermStats)}.
 */
public final class TermStats {

  private final int docFreq;
  private final long totalTermFreq;

  /**
   * @throws IllegalArgumentException if {@code docFreq < 1} or
   *         {@code totalTermFreq < docFreq}
   */
  public TermStats(int docFreq, long totalTermFreq) {
    if (docFreq < 1) {
      throw new IllegalArgumentException("docFreq must be >= 1, got " + docFreq);
    }
    if (totalTermFreq < docFreq) {
      throw new IllegalArgumentException("totalTermFreq must be >= docFreq, got totalTermFreq=" + totalTermFreq + " docFreq=" + docFreq);
    }
    this.docFreq = docFreq;
    this.totalTermFreq = totalTermFreq;
  }

  /** Number of documents that contain the term. */
  public int docFreq() {
    return docFreq;
  }

  /** Number of occurrences of the term across all documents. */
  public long totalTermFreq() {
    return totalTermFreq;
  }

  /**
   * Returns the statistics of a term seen in both this and {@code other}'s segment.
   * @throws ArithmeticException if the summed docFreq overflows an int
   */
  public TermStats add(TermStats other) {
    return new TermStats(Math.addExact(docFreq, other.docFreq), Math.addExact(totalTermFreq, other.totalTermFreq));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof TermStats == false) {
      return false;
    }
    TermStats that = (TermStats) other;
    return docFreq == that.docFreq && totalTermFreq == that.totalTermFreq;
  }

  @Override
  public int hashCode() {
    return 31 * docFreq + Long.hashCode(totalTermFreq);
  }

  @Override
  public String toString() {
    return "TermStats(docFreq=" + docFreq + ",totalTermFreq=" + totalTermFreq + ")";
  }
}
