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
package org.segdict.util;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.segdict.index.TermDictionary;
import org.segdict.index.TermDictionaryBuilder;
import org.segdict.index.TermDictionaryMerger;
import org.segdict.index.TermStats;

public class TestInfoStream {

  @Test
  public void testPrintStreamInfoStream() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStreamInfoStream infoStream = new PrintStreamInfoStream(new PrintStream(bytes, true, "UTF-8"), 42);
    assertTrue(infoStream.isEnabled("TM"));
    assertFalse(infoStream.isSystemStream());

    TermDictionaryBuilder builder = new TermDictionaryBuilder();
    builder.add(new BytesRef("foo"), new TermStats(1, 1));
    TermDictionary dict = builder.finish();
    new TermDictionaryMerger(Arrays.asList(dict, dict), infoStream).merge();
    infoStream.close();

    String logged = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(logged.startsWith("TM 42 ["), logged);
    assertTrue(logged.contains("]: merged 2 segments (2 terms) into 1 terms"), logged);
  }

  @Test
  public void testDefault() {
    assertSame(InfoStream.NO_OUTPUT, InfoStream.getDefault());
    assertFalse(InfoStream.NO_OUTPUT.isEnabled("TW"));
    assertThrows(IllegalArgumentException.class, () -> InfoStream.setDefault(null));
    assertTrue(new PrintStreamInfoStream(System.out).isSystemStream());
  }
}
