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

import org.segdict.index.CorruptIndexException;

/** Reads in reverse from a single byte[]. Every read is bounds checked,
 *  since the bytes may come from an untrusted file. */
final class ReverseBytesReader extends FST.BytesReader {
  private final byte[] bytes;
  private final int length;
  private long pos;

  public ReverseBytesReader(byte[] bytes, int length) {
    assert length <= bytes.length;
    this.bytes = bytes;
    this.length = length;
  }

  @Override
  public byte readByte() throws CorruptIndexException {
    if (pos < 0 || pos >= length) {
      throw new CorruptIndexException("read outside of the FST bytes (length=" + length + ")", "offset=" + pos);
    }
    return bytes[(int) pos--];
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws CorruptIndexException {
    for(int i=0;i<len;i++) {
      b[offset+i] = readByte();
    }
  }

  @Override
  public void skipBytes(long count) {
    pos -= count;
  }

  @Override
  public long getPosition() {
    return pos;
  }

  @Override
  public void setPosition(long pos) {
    this.pos = pos;
  }

  @Override
  public boolean reversed() {
    return true;
  }
}
