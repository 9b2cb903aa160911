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
 * Writes bytes through to a delegate {@link DataOutput} while maintaining a
 * CRC32 checksum of everything written so far.
 *
 * @see org.segdict.codecs.CodecUtil#writeFooter(ChecksumDataOutput)
 */
public class ChecksumDataOutput extends DataOutput {
  private final DataOutput main;
  private final Checksum digest = new CRC32();
  private long bytesWritten;

  public ChecksumDataOutput(DataOutput main) {
    this.main = main;
  }

  @Override
  public void writeByte(byte b) throws IOException {
    digest.update(b);
    main.writeByte(b);
    bytesWritten++;
  }

  @Override
  public void writeBytes(byte[] b, int offset, int length) throws IOException {
    digest.update(b, offset, length);
    main.writeBytes(b, offset, length);
    bytesWritten += length;
  }

  /** Returns the current checksum value */
  public long getChecksum() {
    return digest.getValue();
  }

  /** Number of bytes written so far. */
  public long getFilePointer() {
    return bytesWritten;
  }
}
