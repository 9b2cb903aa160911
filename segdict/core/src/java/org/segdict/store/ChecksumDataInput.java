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

import java.io.IOException;
import java.util.zip.CRC32;
import java.util.zip.Checksum;

/**
 * Reads bytes through a delegate {@link DataInput} while maintaining a
 * CRC32 checksum of everything read so far.
 *
 * @see org.segdict.codecs.CodecUtil#checkFooter(ChecksumDataInput)
 */
public class ChecksumDataInput extends DataInput {
  private final DataInput main;
  private final Checksum digest = new CRC32();
  private long bytesRead;

  public ChecksumDataInput(DataInput main) {
    this.main = main;
  }

  @Override
  public byte readByte() throws IOException {
    final byte b = main.readByte();
    digest.update(b);
    bytesRead++;
    return b;
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) throws IOException {
    main.readBytes(b, offset, len);
    digest.update(b, offset, len);
    bytesRead += len;
  }

  /** Returns the current checksum value */
  public long getChecksum() {
    return digest.getValue();
  }

  /** Number of bytes read so far. */
  public long getFilePointer() {
    return bytesRead;
  }

  @Override
  public ChecksumDataInput clone() {
    throw new UnsupportedOperationException("cannot clone a checksummed input");
  }

  @Override
  public String toString() {
    return "ChecksumDataInput(bytesRead=" + bytesRead + ")";
  }
}
