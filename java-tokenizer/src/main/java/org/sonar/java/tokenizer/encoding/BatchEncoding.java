/*
 * SonarSource Java Tokenizer
 * Copyright (C) 2012-2023 SonarSource SA
 * mailto:info AT sonarsource DOT com
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU Lesser General Public
 * License as published by the Free Software Foundation; either
 * version 3 of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU
 * Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program; if not, write to the Free Software Foundation,
 * Inc., 51 Franklin Street, Fifth Floor, Boston, MA  02110-1301, USA.
 */
package org.sonar.java.tokenizer.encoding;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import javax.annotation.CheckForNull;
import org.sonar.java.tokenizer.offset.Offset;

/**
 * The encodings of a batch, one per example or, with sliding windows, one per window. Fields can be read per encoding
 * or as columns over the whole batch.
 */
public final class BatchEncoding {

  private final List<Encoding> encodings;

  public BatchEncoding(List<Encoding> encodings) {
    this.encodings = List.copyOf(encodings);
  }

  public List<Encoding> encodings() {
    return encodings;
  }

  public Encoding get(int index) {
    return encodings.get(index);
  }

  public int size() {
    return encodings.size();
  }

  public List<List<Integer>> inputIds() {
    List<List<Integer>> res = new ArrayList<>(encodings.size());
    encodings.forEach(e -> res.add(e.inputIds()));
    return res;
  }

  @CheckForNull
  public List<List<Integer>> tokenTypeIds() {
    return column(Encoding::tokenTypeIds);
  }

  @CheckForNull
  public List<List<Integer>> attentionMask() {
    return column(Encoding::attentionMask);
  }

  @CheckForNull
  public List<List<Integer>> specialTokensMask() {
    return column(Encoding::specialTokensMask);
  }

  @CheckForNull
  public List<List<Offset>> offsetMapping() {
    return column(Encoding::offsetMapping);
  }

  @CheckForNull
  public List<List<Integer>> positionIds() {
    return column(Encoding::positionIds);
  }

  @CheckForNull
  public List<Integer> length() {
    return column(Encoding::length);
  }

  @CheckForNull
  public List<Integer> overflowToSample() {
    return column(Encoding::overflowToSample);
  }

  /**
   * @return the values of the field for every encoding, {@code null} if one encoding lacks the field
   */
  @CheckForNull
  private <T> List<T> column(Function<Encoding, T> field) {
    List<T> res = new ArrayList<>(encodings.size());
    for (Encoding encoding : encodings) {
      T value = field.apply(encoding);
      if (value == null) {
        return null;
      }
      res.add(value);
    }
    return res;
  }
}
