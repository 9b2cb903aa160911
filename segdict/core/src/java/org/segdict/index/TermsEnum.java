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

import org.segdict.util.BytesRef;

/**
 * Iterator over the terms of a {@link TermDictionary}, in unsigned byte
 * order. The enum starts unpositioned: call {@link #next()} or one of the
 * seek methods before {@link #term()}, {@link #ord()} or {@link #stats()}.
 *
 * <p>The {@link BytesRef} returned by {@link #term()} and {@link #next()}
 * is reused by the enum; copy it to keep it.
 */
public abstract class TermsEnum {

  /** Represents returned result from {@link #seekCeil}. */
  public enum SeekStatus {
    /** The term was not found, and the end of iteration was hit. */
    END,
    /** The precise term was found. */
    FOUND,
    /** A different term was found after the requested term */
    NOT_FOUND
  };

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected TermsEnum() {
  }

  /** Increments the iteration to the next term, or returns null when the
   *  end of the dictionary is reached. */
  public abstract BytesRef next() throws IOException;

  /** Seeks to the specified term, if it exists, or to the
   *  next (ceiling) term.  Returns SeekStatus to
   *  indicate whether exact term was found, a different
   *  term was found, or EOF was hit.  The target term may
   *  be before or after the current term.  If this returns
   *  SeekStatus.END, the enum is unpositioned. */
  public abstract SeekStatus seekCeil(BytesRef text) throws IOException;

  /** Attempts to seek to the exact term, returning
   *  true if the term is found.  If this returns false, the
   *  enum is unpositioned. */
  public abstract boolean seekExact(BytesRef text) throws IOException;

  /** Returns current term. Do not call this when the enum
   *  is unpositioned. */
  public abstract BytesRef term() throws IOException;

  /** Returns ordinal position for current term. Do not call this when
   *  the enum is unpositioned. */
  public abstract long ord() throws IOException;

  /** Returns the statistics of the current term. Do not call this when
   *  the enum is unpositioned. */
  public abstract TermStats stats() throws IOException;

  /** An empty TermsEnum for quickly returning an empty instance e.g.
   * in {@link TermDictionary#iterator()}.
   */
  public static final TermsEnum EMPTY = new TermsEnum() {
    @Override
    public SeekStatus seekCeil(BytesRef term) { return SeekStatus.END; }

    @Override
    public boolean seekExact(BytesRef text) { return false; }

    @Override
    public BytesRef term() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public long ord() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public TermStats stats() {
      throw new IllegalStateException("this method should never be called");
    }

    @Override
    public BytesRef next() {
      return null;
    }
  };
}
