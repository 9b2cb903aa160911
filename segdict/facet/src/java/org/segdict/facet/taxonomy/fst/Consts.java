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

import org.segdict.facet.taxonomy.FacetLabel;
import org.segdict.util.BytesRef;
import org.segdict.util.BytesRefBuilder;

/**
 * Constants and helpers shared by the FST taxonomy writer and reader.
 */
abstract class Consts {
  /** Separates the components of a label once it is encoded as FST input. */
  static final char DELIM_CHAR = '\u001F';

  /** Codec name of the parent payload file. */
  static final String PARENTS_CODEC = "TaxonomyParents";

  /**
   * Encodes a label as the UTF-8 bytes of its components joined by
   * {@link #DELIM_CHAR}. The root (empty) label encodes to the empty sequence.
   * @throws IllegalArgumentException if a component contains {@link #DELIM_CHAR}
   */
  static BytesRef pathToBytes(FacetLabel label, BytesRefBuilder scratch) {
    final StringBuilder sb = new StringBuilder();
    for (int i = 0; i < label.length; i++) {
      final String component = label.components[i];
      if (component.indexOf(DELIM_CHAR) != -1) {
        throw new IllegalArgumentException("delimiter character \\u001F (U+001F) appears in path component \"" + component + "\"");
      }
      if (i > 0) {
        sb.append(DELIM_CHAR);
      }
      sb.append(component);
    }
    scratch.copyChars(sb);
    return scratch.get();
  }
}
