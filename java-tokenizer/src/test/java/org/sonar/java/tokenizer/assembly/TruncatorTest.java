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
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

class TruncatorTest {

  private final Truncator right = new Truncator(Side.RIGHT);
  private final Truncator left = new Truncator(Side.LEFT);

  @Test
  void longest_first_removes_from_the_longest_sequence() {
    Truncator.Truncation<Integer> truncation = right.truncate(List.of(1, 2, 3), List.of(4, 5, 6, 7, 8), 3, TruncationStrategy.LONGEST_FIRST, 0);
    assertThat(truncation.ids(), contains(1, 2, 3));
    assertThat(truncation.pairIds(), contains(4, 5));
    assertThat(truncation.overflowing(), contains(6, 7, 8));
  }

  @Test
  void longest_first_alternates_on_equal_lengths() {
    Truncator.Truncation<Integer> truncation = right.truncate(List.of(1, 2, 3, 4), List.of(5, 6, 7), 3, TruncationStrategy.LONGEST_FIRST, 0);
    // 4 > 3: first, then 3 = 3: second, then 3 > 2: first
    assertThat(truncation.ids(), contains(1, 2));
    assertThat(truncation.pairIds(), contains(5, 6));
    assertThat(truncation.overflowing(), contains(3, 4, 7));
  }

  @Test
  void single_sequence_with_stride() {
    Truncator.Truncation<Integer> truncation = right.truncate(List.of(1, 2, 3, 4), null, 1, TruncationStrategy.LONGEST_FIRST, 1);
    assertThat(truncation.ids(), contains(1, 2, 3));
    assertThat(truncation.pairIds(), nullValue());
    assertThat(truncation.overflowing(), contains(3, 4));
  }

  @Test
  void left_side_removes_from_the_start() {
    Truncator.Truncation<Integer> truncation = left.truncate(List.of(1, 2, 3, 4), null, 1, TruncationStrategy.ONLY_FIRST, 1);
    assertThat(left.side(), equalTo(Side.LEFT));
    assertThat(truncation.ids(), contains(2, 3, 4));
    assertThat(truncation.overflowing(), contains(1, 2));
  }

  @Test
  void only_second() {
    Truncator.Truncation<Integer> truncation = right.truncate(List.of(1, 2), List.of(3, 4, 5), 2, TruncationStrategy.ONLY_SECOND, 0);
    assertThat(truncation.ids(), contains(1, 2));
    assertThat(truncation.pairIds(), contains(3));
    assertThat(truncation.overflowing(), contains(4, 5));
  }

  @Test
  void impossible_truncation_leaves_sequences_unchanged() {
    Truncator.Truncation<Integer> truncation = right.truncate(List.of(1, 2), List.of(3, 4, 5), 2, TruncationStrategy.ONLY_FIRST, 0);
    assertThat(truncation.ids(), contains(1, 2));
    assertThat(truncation.pairIds(), contains(3, 4, 5));
    assertThat(truncation.overflowing(), empty());
  }

  @Test
  void nothing_to_remove() {
    Truncator.Truncation<String> truncation = right.truncate(List.of("a"), null, 0, TruncationStrategy.LONGEST_FIRST, 0);
    assertThat(truncation.ids(), contains("a"));
    assertThat(truncation.overflowing(), empty());
  }
}
