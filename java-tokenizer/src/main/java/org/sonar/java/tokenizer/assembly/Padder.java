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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

/**
 * Pads the fields of encoded sequences up to a common length, on the configured side.
 */
public class Padder {

  private final Side side;

  public Padder(Side side) {
    this.side = side;
  }

  public Side side() {
    return side;
  }

  /**
   * @param lengths length of each sequence of the batch
   * @param maxLength requested length, used by {@link PaddingStrategy#MAX_LENGTH}
   * @return the length every sequence must be padded to, {@code null} when no padding applies
   */
  @CheckForNull
  public static Integer targetLength(Collection<Integer> lengths, PaddingStrategy strategy, @Nullable Integer maxLength, @Nullable Integer padToMultipleOf) {
    Integer target;
    switch (strategy) {
      case LONGEST:
        target = lengths.stream().mapToInt(Integer::intValue).max().orElse(0);
        break;
      case MAX_LENGTH:
        target = maxLength;
        break;
      default:
        return null;
    }
    if (target != null && padToMultipleOf != null && padToMultipleOf > 0 && target % padToMultipleOf != 0) {
      target = ((target / padToMultipleOf) + 1) * padToMultipleOf;
    }
    return target;
  }

  /**
   * @return {@code values} extended with {@code padValue} up to {@code targetLength}, or {@code values} itself when it
   *         is not shorter
   */
  public <T> List<T> pad(List<T> values, int targetLength, T padValue) {
    int difference = targetLength - values.size();
    if (difference <= 0) {
      return values;
    }
    List<T> res = new ArrayList<>(targetLength);
    if (side == Side.LEFT) {
      res.addAll(Collections.nCopies(difference, padValue));
      res.addAll(values);
    } else {
      res.addAll(values);
      res.addAll(Collections.nCopies(difference, padValue));
    }
    return res;
  }

  /**
   * @return 1 for each of the {@code length} real tokens, 0 for each padding token up to {@code targetLength}
   */
  public List<Integer> attentionMask(int length, int targetLength) {
    return pad(new ArrayList<>(Collections.nCopies(length, 1)), targetLength, 0);
  }
}
