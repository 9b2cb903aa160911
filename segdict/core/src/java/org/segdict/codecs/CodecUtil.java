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
package org.segdict.codecs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.segdict.index.CorruptIndexException;
import org.segdict.store.ChecksumDataInput;
import org.segdict.store.ChecksumDataOutput;
import org.segdict.store.DataInput;
import org.segdict.store.DataOutput;

/**
 * Utility class for reading and writing versioned headers and
 * checksummed footers.
 * <p>
 * Writing codec headers is useful to ensure that a file is in
 * the format you think it is.
 */
public final class CodecUtil {
  private CodecUtil() {} // no instance

  /**
   * Constant to identify the start of a codec header.
   */
  public final static int CODEC_MAGIC = 0x3fd76c17;
  /**
   * Constant to identify the start of a codec footer.
   */
  public final static int FOOTER_MAGIC = ~CODEC_MAGIC;

  /**
   * Writes a codec header, which records both a string to
   * identify the file and a version number. This header can
   * be parsed and validated with
   * {@link #checkHeader(DataInput, String, int, int) checkHeader()}.
   * <p>
   * CodecHeader --&gt; Magic,CodecName,Version
   * <ul>
   *    <li>Magic --&gt; Uint32. This identifies the start of the header. It is always {@value #CODEC_MAGIC}.
   *    <li>CodecName --&gt; String. This is a string to identify this file.
   *    <li>Version --&gt; Uint32. Records the version of the file.
   * </ul>
   *
   * @param out Output stream
   * @param codec String to identify this file. It should be simple ASCII,
   *              less than 128 characters in length.
   * @param version Version number
   * @throws IOException If there is an I/O error writing to the underlying medium.
   * @throws IllegalArgumentException If the codec name is not simple ASCII, or is more than 127 characters in length
   */
  public static void writeHeader(DataOutput out, String codec, int version) throws IOException {
    final byte[] bytes = codec.getBytes(StandardCharsets.UTF_8);
    if (bytes.length != codec.length() || bytes.length >= 128) {
      throw new IllegalArgumentException("codec must be simple ASCII, less than 128 characters in length [got " + codec + "]");
    }
    out.writeInt(CODEC_MAGIC);
    out.writeString(codec);
    out.writeInt(version);
  }

  /**
   * Computes the length of a codec header.
   *
   * @param codec Codec name.
   * @return length of the entire codec header.
   */
  public static int headerLength(String codec) {
    return 9+codec.length();
  }

  /**
   * Reads and validates a header previously written with
   * {@link #writeHeader(DataOutput, String, int)}.
   *
   * @param in Input stream, positioned at the point where the
   *        header was previously written.
   * @param codec The expected codec name.
   * @param minVersion The minimum supported expected version number.
   * @param maxVersion The maximum supported expected version number.
   * @return The actual version found, when a valid header is found
   *         that matches <code>codec</code>, with an actual version
   *         where {@code minVersion <= actual <= maxVersion}.
   * @throws CorruptIndexException If the first four bytes are not
   *         {@link #CODEC_MAGIC}, the codec name does not match, or the
   *         version is out of range.
   * @throws IOException If there is an I/O error reading from the underlying medium.
   */
  public static int checkHeader(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    final int actualHeader = in.readInt();
    if (actualHeader != CODEC_MAGIC) {
      throw new CorruptIndexException("codec header mismatch: actual header=" + actualHeader + " vs expected header=" + CODEC_MAGIC, in.toString());
    }
    return checkHeaderNoMagic(in, codec, minVersion, maxVersion);
  }

  /** Like {@link
   *  #checkHeader(DataInput,String,int,int)} except this
   *  version assumes the first int has already been read
   *  and validated from the input. */
  public static int checkHeaderNoMagic(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    final String actualCodec = in.readString();
    if (!actualCodec.equals(codec)) {
      throw new CorruptIndexException("codec mismatch: actual codec=" + actualCodec + " vs expected codec=" + codec, in.toString());
    }

    final int actualVersion = in.readInt();
    if (actualVersion < minVersion || actualVersion > maxVersion) {
      throw new CorruptIndexException("format version " + actualVersion + " is not supported: must be in [" + minVersion + ", " + maxVersion + "]", in.toString());
    }

    return actualVersion;
  }

  /**
   * Writes a codec footer, which records both a checksum
   * algorithm ID and a checksum. This footer can
   * be parsed and validated with
   * {@link #checkFooter(ChecksumDataInput) checkFooter()}.
   * <p>
   * CodecFooter --&gt; Magic,AlgorithmID,Checksum
   * <ul>
   *    <li>Magic --&gt; Uint32. This identifies the start of the footer. It is always {@value #FOOTER_MAGIC}.
   *    <li>AlgorithmID --&gt; Uint32. This indicates the checksum algorithm used. Currently this is always 0,
   *    for zlib-crc32.
   *    <li>Checksum --&gt; Uint64. The actual checksum value for all previous bytes in the stream, including
   *    the bytes from Magic and AlgorithmID.
   * </ul>
   *
   * @param out Output stream
   * @throws IOException If there is an I/O error writing to the underlying medium.
   */
  public static void writeFooter(ChecksumDataOutput out) throws IOException {
    out.writeInt(FOOTER_MAGIC);
    out.writeInt(0);
    writeCRC(out);
  }

  /**
   * Computes the length of a codec footer.
   *
   * @return length of the entire codec footer.
   */
  public static int footerLength() {
    return 16;
  }

  /**
   * Validates the codec footer previously written by {@link #writeFooter}.
   * @return actual checksum value
   * @throws CorruptIndexException if the footer is invalid or the checksum does not match
   * @throws IOException if the footer is invalid
   */
  public static long checkFooter(ChecksumDataInput in) throws IOException {
    validateFooter(in);
    long actualChecksum = in.getChecksum();
    long expectedChecksum = readCRC(in);
    if (expectedChecksum != actualChecksum) {
      throw new CorruptIndexException("checksum failed (hardware problem?) : expected=" + Long.toHexString(expectedChecksum) +
                                      " actual=" + Long.toHexString(actualChecksum), in.toString());
    }
    return actualChecksum;
  }

  private static void validateFooter(DataInput in) throws IOException {
    final int magic = in.readInt();
    if (magic != FOOTER_MAGIC) {
      throw new CorruptIndexException("codec footer mismatch (file truncated?): actual footer=" + magic + " vs expected footer=" + FOOTER_MAGIC, in.toString());
    }

    final int algorithmID = in.readInt();
    if (algorithmID != 0) {
      throw new CorruptIndexException("codec footer mismatch: unknown algorithmID: " + algorithmID, in.toString());
    }
  }

  /**
   * Reads CRC32 value as a 64-bit long from the input.
   * @throws CorruptIndexException if CRC is formatted incorrectly (wrong bits set)
   * @throws IOException if an i/o error occurs
   */
  static long readCRC(DataInput input) throws IOException {
    long value = input.readLong();
    if ((value & 0xFFFFFFFF00000000L) != 0) {
      throw new CorruptIndexException("Illegal CRC-32 checksum: " + value, input.toString());
    }
    return value;
  }

  /**
   * Writes CRC32 value as a 64-bit long to the output.
   * @throws IllegalStateException if CRC is formatted incorrectly (wrong bits set)
   * @throws IOException if an i/o error occurs
   */
  static void writeCRC(ChecksumDataOutput output) throws IOException {
    long value = output.getChecksum();
    if ((value & 0xFFFFFFFF00000000L) != 0) {
      throw new IllegalStateException("Illegal CRC-32 checksum: " + value + " (resource=" + output + ")");
    }
    output.writeLong(value);
  }
}
