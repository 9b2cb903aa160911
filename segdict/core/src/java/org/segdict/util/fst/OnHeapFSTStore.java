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
package org.segdict.util.fst;

import java.io.IOException;
import java.util.Arrays;

import org.segdict.index.CorruptIndexException;
import org.segdict.store.DataInput;
import org.segdict.store.DataOutput;
import org.segdict.util.ArrayUtil;
import org.segdict.util.RamUsageEstimator;

/**
 * Provides storage of finite state machine (FST),
 * using a single byte array on heap.
 *
 * 将加载出来的FST数据存储在堆内存中
 */
public final class OnHeapFSTStore implements FSTStore {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(1, 0);
  private static final int INITIAL_CHUNK = 1 << 16;

  /** The bytes of a loaded FST. */
  private byte[] bytesArray;

  @Override
  public void init(DataInput in, long numBytes) throws IOException {
    if (numBytes < 0 || numBytes > ArrayUtil.MAX_ARRAY_LENGTH) {
      throw new CorruptIndexException("invalid FST byte count " + numBytes, in.toString());
    }
    // grows while reading, a bogus count runs out of input before it runs out of heap
    byte[] bytes = new byte[(int) Math.min(numBytes, INITIAL_CHUNK)];
    int read = 0;
    while (true) {
      in.readBytes(bytes, read, bytes.length - read);
      read = bytes.length;
      if (read == numBytes) {
        break;
      }
      bytes = Arrays.copyOf(bytes, (int) Math.min(numBytes, 2L * read));
    }
    bytesArray = bytes;
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(bytesArray);
  }

  @Override
  public long size() {
    return bytesArray.length;
  }

  @Override
  public FST.BytesReader getReverseBytesReader() {
    return new ReverseBytesReader(bytesArray, bytesArray.length);
  }

  @Override
  public void writeTo(DataOutput out) throws IOException {
    out.writeVLong(bytesArray.length);
    out.writeBytes(bytesArray, 0, bytesArray.length);
  }
}
