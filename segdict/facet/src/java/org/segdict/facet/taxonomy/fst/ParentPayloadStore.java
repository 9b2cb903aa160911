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

import java.io.EOFException;
import java.io.IOException;

import org.segdict.codecs.CodecUtil;
import org.segdict.facet.taxonomy.TaxonomyReader;
import org.segdict.index.CorruptIndexException;
import org.segdict.store.ByteArrayDataInput;
import org.segdict.store.DataInput;
import org.segdict.store.DataOutput;
import org.segdict.util.Accountable;
import org.segdict.util.ArrayUtil;
import org.segdict.util.ByteArena;
import org.segdict.util.RamUsageEstimator;

/**
 * Append-only store of parent ordinals, one vInt payload per ordinal written
 * into a {@link ByteArena}. The payload of ordinal {@code i} is
 * {@code parent(i) + 1}, so the root's {@link TaxonomyReader#INVALID_ORDINAL}
 * parent encodes as 0.
 * <p>
 * Not thread safe: the taxonomy writer appends and reads under its own lock.
 *
 * 父节点负载的存储 每个序号对应 arena 中的一段 vInt
 */
public final class ParentPayloadStore implements ParentOrdinalsSource, Accountable {

  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(2, Integer.BYTES);

  private final ByteArena arena;
  // offsets[i] is where the payload of ordinal i starts in the arena
  private int[] offsets;
  private int size;

  public ParentPayloadStore() {
    this(new ByteArena(), new int[16], 0);
  }

  private ParentPayloadStore(ByteArena arena, int[] offsets, int size) {
    this.arena = arena;
    this.offsets = offsets;
    this.size = size;
  }

  /**
   * Appends the parent of the next ordinal and returns that ordinal.
   * @throws IllegalArgumentException if the parent is not a smaller ordinal
   *         ({@link TaxonomyReader#INVALID_ORDINAL} for the root)
   */
  public int append(int parent) {
    final int ordinal = size;
    if (ordinal == TaxonomyReader.ROOT_ORDINAL) {
      if (parent != TaxonomyReader.INVALID_ORDINAL) {
        throw new IllegalArgumentException("the root category must have parent " + TaxonomyReader.INVALID_ORDINAL + ", got " + parent);
      }
    } else if (parent < 0 || parent >= ordinal) {
      throw new IllegalArgumentException("parent " + parent + " of category " + ordinal + " must be in [0, " + ordinal + ")");
    }
    if (size == offsets.length) {
      offsets = ArrayUtil.grow(offsets, size + 1);
    }
    offsets[size] = writeVInt(parent + 1);
    size++;
    return ordinal;
  }

  private int writeVInt(int i) {
    int len = 1;
    for (int v = i >>> 7; v != 0; v >>>= 7) {
      len++;
    }
    final int start = arena.alloc(len);
    int pos = start;
    while ((i & ~0x7F) != 0) {
      arena.put(pos++, (byte) ((i & 0x7F) | 0x80));
      i >>>= 7;
    }
    arena.put(pos, (byte) i);
    return start;
  }

  /**
   * Returns the parent of {@code ordinal}.
   * @throws IllegalArgumentException if the ordinal is out of range
   * @throws CorruptIndexException if its payload is malformed
   */
  public int parent(int ordinal) throws IOException {
    if (ordinal < 0 || ordinal >= size) {
      throw new IllegalArgumentException("ordinal " + ordinal + " is out of bounds (size=" + size + ")");
    }
    return readParent(newInput(), ordinal);
  }

  private ByteArrayDataInput newInput() {
    return new ByteArrayDataInput(arena.getArray(), 0, arena.length());
  }

  private int readParent(ByteArrayDataInput in, int ordinal) throws IOException {
    in.setPosition(offsets[ordinal]);
    return in.readVInt() - 1;
  }

  /** Number of ordinals stored. */
  @Override
  public int maxDoc() {
    return size;
  }

  @Override
  public ParentPositionsEnum parentPositions() {
    return size == 0 ? null : new PayloadPositionsEnum(newInput(), size);
  }

  /**
   * A point-in-time view of the first {@code maxDoc} ordinals. Only valid
   * until the next {@link #append(int)}.
   */
  public ParentOrdinalsSource view(final int maxDoc) {
    if (maxDoc < 0 || maxDoc > size) {
      throw new IllegalArgumentException("maxDoc must be in [0, " + size + "], got " + maxDoc);
    }
    return new ParentOrdinalsSource() {
      @Override
      public int maxDoc() {
        return maxDoc;
      }

      @Override
      public ParentPositionsEnum parentPositions() {
        return maxDoc == 0 ? null : new PayloadPositionsEnum(newInput(), maxDoc);
      }
    };
  }

  private final class PayloadPositionsEnum extends ParentPositionsEnum {
    private final ByteArrayDataInput in;
    private final int limit;
    private int doc = -1;
    private boolean positionRead;

    PayloadPositionsEnum(ByteArrayDataInput in, int limit) {
      this.in = in;
      this.limit = limit;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() {
      return advance(doc + 1);
    }

    @Override
    public int advance(int target) {
      positionRead = false;
      if (target >= limit) {
        doc = NO_MORE_DOCS;
      } else {
        doc = Math.max(target, 0);
      }
      return doc;
    }

    @Override
    public int freq() {
      return 1;
    }

    @Override
    public int nextPosition() throws IOException {
      if (doc < 0 || doc == NO_MORE_DOCS || positionRead) {
        throw new IllegalStateException("no position left for ordinal " + doc);
      }
      positionRead = true;
      return readParent(in, doc);
    }
  }

  /** Writes all payloads, starting with a codec header. */
  public void save(DataOutput out) throws IOException {
    CodecUtil.writeHeader(out, Consts.PARENTS_CODEC, VERSION_CURRENT);
    out.writeVInt(size);
    out.writeVInt(arena.length());
    out.writeBytes(arena.getArray(), 0, arena.length());
  }

  /**
   * Reads payloads written by {@link #save(DataOutput)}. Each payload is
   * decoded once to rebuild the offsets.
   * @throws CorruptIndexException if the counts are invalid, a payload is
   *         malformed or names an invalid parent, or the payloads do not
   *         exactly fill the stored bytes
   */
  public static ParentPayloadStore read(DataInput in) throws IOException {
    CodecUtil.checkHeader(in, Consts.PARENTS_CODEC, VERSION_START, VERSION_CURRENT);
    final int size = in.readVInt();
    final int numBytes = in.readVInt();
    if (size < 0 || numBytes < 0 || numBytes < size || (long) numBytes > 5L * size) {
      throw new CorruptIndexException("invalid parent payload sizes: size=" + size + " numBytes=" + numBytes, in.toString());
    }
    final byte[] bytes = new byte[numBytes];
    in.readBytes(bytes, 0, numBytes);

    final int[] offsets = new int[Math.max(size, 1)];
    final ByteArrayDataInput payloads = new ByteArrayDataInput(bytes);
    for (int i = 0; i < size; i++) {
      if (payloads.eof()) {
        throw new CorruptIndexException("missing parent payload", "ordinal=" + i);
      }
      offsets[i] = payloads.getPosition();
      final int parent;
      try {
        parent = payloads.readVInt() - 1;
      } catch (EOFException e) {
        throw new CorruptIndexException("truncated parent payload", "ordinal=" + i, e);
      }
      if (i == TaxonomyReader.ROOT_ORDINAL ? parent != TaxonomyReader.INVALID_ORDINAL : (parent < 0 || parent >= i)) {
        throw new CorruptIndexException("invalid parent " + parent, "ordinal=" + i);
      }
    }
    if (payloads.eof() == false) {
      throw new CorruptIndexException("trailing bytes after " + size + " parent payloads", "offset=" + payloads.getPosition());
    }
    return new ParentPayloadStore(new ByteArena(bytes, numBytes), offsets, size);
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + arena.ramBytesUsed() + RamUsageEstimator.sizeOf(offsets);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(size=" + size + ",bytes=" + arena.length() + ")";
  }
}
