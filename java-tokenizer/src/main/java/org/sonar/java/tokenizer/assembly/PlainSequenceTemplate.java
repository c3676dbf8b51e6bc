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
package org.sonar.java.tokenizer.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.offset.Offset;

/**
 * Adds no special token: sequences are concatenated, the second one having token type 1.
 */
public class PlainSequenceTemplate implements SequenceTemplate {

  public static final PlainSequenceTemplate INSTANCE = new PlainSequenceTemplate();

  @Override
  public List<Integer> buildInputs(List<Integer> ids, @Nullable List<Integer> pairIds) {
    return concat(ids, pairIds);
  }

  @Override
  public List<Integer> createTokenTypeIds(List<Integer> ids, @Nullable List<Integer> pairIds) {
    List<Integer> res = new ArrayList<>(Collections.nCopies(ids.size(), 0));
    if (pairIds != null) {
      res.addAll(Collections.nCopies(pairIds.size(), 1));
    }
    return res;
  }

  @Override
  public List<Offset> buildOffsetMapping(List<Offset> offsets, @Nullable List<Offset> pairOffsets) {
    return concat(offsets, pairOffsets);
  }

  @Override
  public List<Integer> specialTokensMask(List<Integer> ids, @Nullable List<Integer> pairIds) {
    int size = ids.size() + (pairIds == null ? 0 : pairIds.size());
    return new ArrayList<>(Collections.nCopies(size, 0));
  }

  private static <T> List<T> concat(List<T> first, @Nullable List<T> second) {
    List<T> res = new ArrayList<>(first);
    if (second != null) {
      res.addAll(second);
    }
    return res;
  }
}
