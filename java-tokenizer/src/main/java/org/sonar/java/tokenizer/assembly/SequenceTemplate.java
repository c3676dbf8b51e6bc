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

import java.util.List;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.offset.Offset;

/**
 * Model-specific layout of the special tokens around one sequence or a pair of sequences.
 */
public interface SequenceTemplate {

  List<Integer> buildInputs(List<Integer> ids, @Nullable List<Integer> pairIds);

  List<Integer> createTokenTypeIds(List<Integer> ids, @Nullable List<Integer> pairIds);

  /**
   * @return the offsets aligned with {@link #buildInputs(List, List)}, special tokens spanning {@link Offset#NONE}
   */
  List<Offset> buildOffsetMapping(List<Offset> offsets, @Nullable List<Offset> pairOffsets);

  /**
   * @return for each id of {@link #buildInputs(List, List)}, 1 for a special token and 0 for a sequence token
   */
  List<Integer> specialTokensMask(List<Integer> ids, @Nullable List<Integer> pairIds);

  default int numSpecialTokensToAdd(boolean pair) {
    return buildInputs(List.of(), pair ? List.of() : null).size();
  }
}
