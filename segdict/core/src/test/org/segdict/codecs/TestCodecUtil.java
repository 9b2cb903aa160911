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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.segdict.index.CorruptIndexException;
import org.segdict.store.ByteArrayDataInput;
import org.segdict.store.ChecksumDataInput;
import org.segdict.store.ChecksumDataOutput;
import org.segdict.store.GrowableByteArrayDataOutput;
import org.segdict.store.InputStreamDataInput;
import org.segdict.store.OutputStreamDataOutput;

public class TestCodecUtil {

  @Test
  public void testHeaderRoundTrip() throws IOException {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(32);
    CodecUtil.writeHeader(out, "FooBar", 5);
    out.writeString("this is the data");
    assertEquals(CodecUtil.headerLength("FooBar"), out.getPosition() - 17);

    ByteArrayDataInput in = new ByteArrayDataInput(out.getBytes(), 0, out.getPosition());
    assertEquals(5, CodecUtil.checkHeader(in, "FooBar", 5, 5));
    assertEquals("this is the data", in.readString());
  }

  @Test
  public void testHeaderMismatches() throws IOException {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(32);
    CodecUtil.writeHeader(out, "FooBar", 5);
    byte[] bytes = out.getBytes();
    int length = out.getPosition();

    assertThrows(CorruptIndexException.class,
        () -> CodecUtil.checkHeader(new ByteArrayDataInput(bytes, 0, length), "BazBar", 5, 5));
    assertThrows(CorruptIndexException.class,
        () -> CodecUtil.checkHeader(new ByteArrayDataInput(bytes, 0, length), "FooBar", 6, 7));
    assertThrows(CorruptIndexException.class,
        () -> CodecUtil.checkHeader(new ByteArrayDataInput(bytes, 0, length), "FooBar", 1, 4));

    byte[] badMagic = bytes.clone();
    badMagic[0]++;
    assertThrows(CorruptIndexException.class,
        () -> CodecUtil.checkHeader(new ByteArrayDataInput(badMagic, 0, length), "FooBar", 5, 5));
  }

  @Test
  public void testNonAsciiCodecNameIsRejected() {
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(32);
    assertThrows(IllegalArgumentException.class, () -> CodecUtil.writeHeader(out, "ሴ", 1));
    StringBuilder tooLong = new StringBuilder();
    for (int i = 0; i < 128; i++) {
      tooLong.append('a');
    }
    assertThrows(IllegalArgumentException.class, () -> CodecUtil.writeHeader(out, tooLong.toString(), 1));
  }

  private static byte[] withFooter(String payload) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ChecksumDataOutput out = new ChecksumDataOutput(new OutputStreamDataOutput(bytes));
    CodecUtil.writeHeader(out, "FooBar", 0);
    out.writeString(payload);
    CodecUtil.writeFooter(out);
    return bytes.toByteArray();
  }

  private static long check(byte[] bytes) throws IOException {
    ChecksumDataInput in = new ChecksumDataInput(new InputStreamDataInput(new ByteArrayInputStream(bytes)));
    CodecUtil.checkHeader(in, "FooBar", 0, 0);
    in.readString();
    return CodecUtil.checkFooter(in);
  }

  @Test
  public void testFooter() throws IOException {
    byte[] bytes = withFooter("some payload");
    check(bytes);

    // a flipped payload byte fails the checksum
    byte[] flipped = bytes.clone();
    flipped[flipped.length - CodecUtil.footerLength() - 2] ^= 0x20;
    assertThrows(CorruptIndexException.class, () -> check(flipped));

    // a flipped footer magic is detected before the checksum
    byte[] badFooter = bytes.clone();
    badFooter[badFooter.length - CodecUtil.footerLength()] ^= 0x01;
    CorruptIndexException e = assertThrows(CorruptIndexException.class, () -> check(badFooter));
    assertEquals(true, e.getMessage().contains("footer mismatch"));
  }
}
