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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.segdict.codecs.CodecUtil;
import org.segdict.store.ByteArrayDataInput;
import org.segdict.store.ChecksumDataInput;
import org.segdict.store.ChecksumDataOutput;
import org.segdict.store.DataInput;
import org.segdict.store.DataOutput;
import org.segdict.store.GrowableByteArrayDataOutput;
import org.segdict.store.InputStreamDataInput;
import org.segdict.store.OutputStreamDataOutput;
import org.segdict.util.Accountable;
import org.segdict.util.BytesRef;
import org.segdict.util.RamUsageEstimator;
import org.segdict.util.fst.ByteSequenceOutputs;
import org.segdict.util.fst.BytesRefFSTEnum;
import org.segdict.util.fst.FST;
import org.segdict.util.fst.PairOutputs;
import org.segdict.util.fst.PairOutputs.Pair;
import org.segdict.util.fst.PositiveIntOutputs;
import org.segdict.util.fst.Util;

/**
 * An immutable, sorted term dictionary of one segment. Each term maps to a
 * dense ordinal (its rank in the dictionary) and its {@link TermStats}.
 * <p>
 * Terms are stored in an {@link FST} whose output is a pair of the ordinal
 * and the encoded statistics ({@code vInt docFreq, vLong totalTermFreq - docFreq}).
 * A dictionary is built with {@link TermDictionaryBuilder}, merged with
 * {@link TermDictionaryMerger} and persisted with {@link #save(Path)}.
 * <p>
 * Instances are safe to share between threads; each {@link #iterator()} is not.
 *
 * 单个段的词典 term -> (序号, 统计信息)
 */
public final class TermDictionary implements Accountable {

  static final String CODEC_NAME = "TermDictionary";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(1, Long.BYTES);

  private static final PairOutputs<Long,BytesRef> OUTPUTS =
      new PairOutputs<>(PositiveIntOutputs.getSingleton(), ByteSequenceOutputs.getSingleton());

  /** Null if the dictionary has no terms. */
  private final FST<Pair<Long,BytesRef>> fst;
  private final long size;

  TermDictionary(FST<Pair<Long,BytesRef>> fst, long size) {
    assert (fst == null) == (size == 0) : "fst=" + fst + " size=" + size;
    this.fst = fst;
    this.size = size;
  }

  static PairOutputs<Long,BytesRef> outputs() {
    return OUTPUTS;
  }

  /** Number of terms. */
  public long size() {
    return size;
  }

  /** Returns the ordinal of {@code term}, or -1 if the term is not in this dictionary. */
  public long ord(BytesRef term) throws IOException {
    if (fst == null) {
      return -1;
    }
    final Pair<Long,BytesRef> output = Util.get(fst, term);
    return output == null ? -1 : output.output1;
  }

  /** Returns the statistics of {@code term}, or null if the term is not in this dictionary. */
  public TermStats stats(BytesRef term) throws IOException {
    if (fst == null) {
      return null;
    }
    final Pair<Long,BytesRef> output = Util.get(fst, term);
    return output == null ? null : decodeStats(output.output2);
  }

  /** Returns a new unpositioned enum over all terms. */
  public TermsEnum iterator() {
    if (fst == null) {
      return TermsEnum.EMPTY;
    }
    return new FSTTermsEnum(fst);
  }

  /** The underlying automaton, or null if the dictionary is empty. */
  public FST<Pair<Long,BytesRef>> getFST() {
    return fst;
  }

  static BytesRef encodeStats(TermStats stats, GrowableByteArrayDataOutput scratch) throws IOException {
    scratch.reset();
    scratch.writeVInt(stats.docFreq());
    scratch.writeVLong(stats.totalTermFreq() - stats.docFreq());
    // a copy: the FST keeps references into the output bytes
    return scratch.toBytesRef();
  }

  static TermStats decodeStats(BytesRef encoded) throws IOException {
    final ByteArrayDataInput in = new ByteArrayDataInput(encoded.bytes, encoded.offset, encoded.length);
    final int docFreq = in.readVInt();
    final long extra = in.readVLong();
    if (docFreq < 1 || extra < 0 || in.eof() == false) {
      throw new CorruptIndexException("invalid term statistics: docFreq=" + docFreq + " extraFreq=" + extra, in.toString());
    }
    return new TermStats(docFreq, docFreq + extra);
  }

  /** Writes this dictionary, starting with a codec header. */
  public void save(DataOutput out) throws IOException {
    CodecUtil.writeHeader(out, CODEC_NAME, VERSION_CURRENT);
    out.writeVLong(size);
    if (fst == null) {
      out.writeByte((byte) 0);
    } else {
      out.writeByte((byte) 1);
      fst.save(out);
    }
  }

  /** Writes this dictionary to a file, followed by a checksum footer. */
  public void save(Path path) throws IOException {
    try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(path))) {
      ChecksumDataOutput out = new ChecksumDataOutput(new OutputStreamDataOutput(os));
      save(out);
      CodecUtil.writeFooter(out);
    }
  }

  /**
   * Reads a dictionary written by {@link #save(DataOutput)}.
   * @throws CorruptIndexException if the header, the term count or the automaton is invalid
   */
  public static TermDictionary read(DataInput in) throws IOException {
    CodecUtil.checkHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT);
    final long size = in.readVLong();
    final byte hasFST = in.readByte();
    final FST<Pair<Long,BytesRef>> fst;
    if (hasFST == 0) {
      fst = null;
    } else if (hasFST == 1) {
      fst = new FST<>(in, OUTPUTS);
    } else {
      throw new CorruptIndexException("invalid FST marker: " + hasFST, in.toString());
    }
    if ((fst == null) != (size == 0)) {
      throw new CorruptIndexException("term count " + size + " does not match the presence of an FST", in.toString());
    }
    return new TermDictionary(fst, size);
  }

  /**
   * Reads a dictionary from a file written by {@link #save(Path)}, verifying its checksum.
   */
  public static TermDictionary read(Path path) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      ChecksumDataInput in = new ChecksumDataInput(new InputStreamDataInput(new BufferedInputStream(is)));
      final TermDictionary dict = read(in);
      CodecUtil.checkFooter(in);
      return dict;
    } catch (EOFException e) {
      throw new CorruptIndexException("unexpected end of file", path.toString(), e);
    }
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + (fst == null ? 0 : fst.ramBytesUsed());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(size=" + size + ")";
  }

  // Enumerates the terms of the FST. The FST enum unpositions itself on a
  // miss or at the end, so next() after either starts from the first term.
  private static final class FSTTermsEnum extends TermsEnum {
    private final BytesRefFSTEnum<Pair<Long,BytesRef>> fstEnum;
    private BytesRefFSTEnum.InputOutput<Pair<Long,BytesRef>> current;

    FSTTermsEnum(FST<Pair<Long,BytesRef>> fst) {
      this.fstEnum = new BytesRefFSTEnum<>(fst);
    }

    @Override
    public BytesRef next() throws IOException {
      current = fstEnum.next();
      if (current == null) {
        return null;
      }
      return current.input;
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) throws IOException {
      current = fstEnum.seekCeil(text);
      if (current == null) {
        return SeekStatus.END;
      } else if (current.input.equals(text)) {
        return SeekStatus.FOUND;
      } else {
        return SeekStatus.NOT_FOUND;
      }
    }

    @Override
    public boolean seekExact(BytesRef text) throws IOException {
      current = fstEnum.seekExact(text);
      return current != null;
    }

    @Override
    public BytesRef term() {
      return current().input;
    }

    @Override
    public long ord() {
      return current().output.output1;
    }

    @Override
    public TermStats stats() throws IOException {
      return decodeStats(current().output.output2);
    }

    private BytesRefFSTEnum.InputOutput<Pair<Long,BytesRef>> current() {
      if (current == null) {
        throw new IllegalStateException("enum is not positioned");
      }
      return current;
    }
  }
}
