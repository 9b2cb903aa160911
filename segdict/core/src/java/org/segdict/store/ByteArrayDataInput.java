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
package org.segdict.store;

import java.io.EOFException;
import java.io.IOException;

/**
 * DataInput backed by a byte array.
 * <b>WARNING:</b> This class omits all low-level checks beyond running out of bytes.
 */
public final class ByteArrayDataInput extends DataInput {

  private byte[] bytes;

  private int pos;
  private int limit;

  public ByteArrayDataInput(byte[] bytes) {
    reset(bytes);
  }

  public ByteArrayDataInput(byte[] bytes, int offset, int len) {
    reset(bytes, offset, len);
  }

  public void reset(byte[] bytes) {
    reset(bytes, 0, bytes.length);
  }

  public void reset(byte[] bytes, int offset, int len) {
    this.bytes = bytes;
    pos = offset;
    limit = offset + len;
  }

  public int getPosition() {
    return pos;
  }

  public void setPosition(int pos) {
    this.pos = pos;
  }

  public int length() {
    return limit;
  }

  public boolean eof() {
    return pos == limit;
  }

  @Override
  public void skipBytes(long count) throws IOException {
    if (count < 0 || count > limit - pos) {
      throw new EOFException("cannot skip " + count + " bytes: " + this);
    }
    pos += (int) count;
  }

  @Override
  public byte readByte() throws IOException {
    if (pos >= limit) {
      throw new EOFException("read past EOF: " + this);
    }
    return bytes[pos++];
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws IOException {
    if (len > limit - pos) {
      throw new EOFException("read past EOF: " + this + " len=" + len);
    }
    System.arraycopy(bytes, pos, b, offset, len);
    pos += len;
  }

  @Override
  public String toString() {
    return "ByteArrayDataInput(pos=" + pos + ",limit=" + limit + ")";
  }
}
