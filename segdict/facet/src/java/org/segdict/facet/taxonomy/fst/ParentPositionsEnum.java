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

/**
 * Iterates the ordinals that carry a parent entry, in increasing order, and
 * exposes each entry as a single position whose value is the parent ordinal.
 * <p>
 * An ordinal without an entry is simply skipped by {@link #nextDoc()}; a
 * {@link #freq()} of zero means the entry is present but empty.
 *
 * 按序号递增遍历父节点负载  每个序号一个 position  其值即父序号
 */
public abstract class ParentPositionsEnum {

  /**
   * When returned by {@link #nextDoc()}, {@link #advance(int)} and
   * {@link #docID()} it means there are no more ordinals in the iterator.
   */
  public static final int NO_MORE_DOCS = Integer.MAX_VALUE;

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected ParentPositionsEnum() {
  }

  /**
   * Returns the current ordinal: -1 before the first call to
   * {@link #nextDoc()} or {@link #advance(int)}, {@link #NO_MORE_DOCS} once
   * exhausted.
   */
  public abstract int docID();

  /** Advances to the next ordinal with an entry and returns it, or {@link #NO_MORE_DOCS}. */
  public abstract int nextDoc() throws IOException;

  /**
   * Advances to the first ordinal &gt;= {@code target} with an entry and
   * returns it, or {@link #NO_MORE_DOCS}.
   */
  public abstract int advance(int target) throws IOException;

  /** Number of positions of the current ordinal. */
  public abstract int freq() throws IOException;

  /** Returns the next position of the current ordinal. Call at most {@link #freq()} times. */
  public abstract int nextPosition() throws IOException;
}
