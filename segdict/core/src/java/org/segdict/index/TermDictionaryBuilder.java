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

import org.segdict.store.GrowableByteArrayDataOutput;
import org.segdict.util.BytesRef;
import org.segdict.util.BytesRefBuilder;
import org.segdict.util.IntsRefBuilder;
import org.segdict.util.fst.FST;
import org.segdict.util.fst.FSTCompiler;
import org.segdict.util.fst.PairOutputs.Pair;
import org.segdict.util.fst.Util;

/**
 * Builds a {@link TermDictionary} from terms added in strictly increasing
 * unsigned byte order. The n-th added term gets ordinal {@code n}.
 * <p>
 * Not thread safe.
 */
public final class TermDictionaryBuilder {

  private final FSTCompiler<Pair<Long,BytesRef>> fstCompiler;
  private final IntsRefBuilder scratchInts = new IntsRefBuilder();
  private final GrowableByteArrayDataOutput scratchStats = new GrowableByteArrayDataOutput(16);
  private final BytesRefBuilder lastTerm = new BytesRefBuilder();
  private long termCount;
  private boolean finished;

  public TermDictionaryBuilder() {
    this(new FSTCompiler.Builder<>(FST.INPUT_TYPE.BYTE1, TermDictionary.outputs()));
  }

  /** Expert: builds the underlying automaton with the given compiler settings. */
  public TermDictionaryBuilder(FSTCompiler.Builder<Pair<Long,BytesRef>> compilerBuilder) {
    this.fstCompiler = compilerBuilder.build();
  }

  /**
   * Adds the next term.
   * @throws IllegalArgumentException if {@code term} is empty or not greater than the previous term
   * @throws IllegalStateException if {@link #finish()} was already called
   */
  public void add(BytesRef term, TermStats stats) throws IOException {
    if (finished) {
      throw new IllegalStateException("this builder is already finished");
    }
    if (term.length == 0) {
      throw new IllegalArgumentException("term must not be empty");
    }
    if (termCount > 0 && term.compareTo(lastTerm.get()) <= 0) {
      throw new IllegalArgumentException("terms are out of order or duplicate: lastTerm=" + lastTerm.get() + " term=" + term);
    }
    final Pair<Long,BytesRef> output = TermDictionary.outputs().newPair(termCount, TermDictionary.encodeStats(stats, scratchStats));
    fstCompiler.add(Util.toIntsRef(term, scratchInts), output);
    lastTerm.copyBytes(term);
    termCount++;
  }

  /** Number of terms added so far. */
  public long getTermCount() {
    return termCount;
  }

  /**
   * Returns the dictionary of all added terms; the builder can not be used afterwards.
   */
  public TermDictionary finish() throws IOException {
    if (finished) {
      throw new IllegalStateException("this builder is already finished");
    }
    finished = true;
    final FST<Pair<Long,BytesRef>> fst = fstCompiler.compile();
    return new TermDictionary(fst, termCount);
  }
}
