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
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

class PadderTest {

  @Test
  void target_length() {
    assertThat(Padder.targetLength(List.of(2, 4), PaddingStrategy.LONGEST, null, null), equalTo(4));
    assertThat(Padder.targetLength(List.of(2, 4), PaddingStrategy.LONGEST, null, 8), equalTo(8));
    assertThat(Padder.targetLength(List.of(2, 4), PaddingStrategy.MAX_LENGTH, 5, 4), equalTo(8));
    assertThat(Padder.targetLength(List.of(2, 4), PaddingStrategy.MAX_LENGTH, 8, 4), equalTo(8));
    assertThat(Padder.targetLength(List.of(2, 4), PaddingStrategy.DO_NOT_PAD, 8, null), nullValue());
  }

  @Test
  void pad_right() {
    Padder padder = new Padder(Side.RIGHT);
    assertThat(padder.pad(List.of(1, 2), 4, 0), contains(1, 2, 0, 0));
    assertThat(padder.attentionMask(2, 4), contains(1, 1, 0, 0));
  }

  @Test
  void pad_left() {
    Padder padder = new Padder(Side.LEFT);
    assertThat(padder.side(), equalTo(Side.LEFT));
    assertThat(padder.pad(List.of(1, 2), 4, 0), contains(0, 0, 1, 2));
    assertThat(padder.attentionMask(2, 4), contains(0, 0, 1, 1));
  }

  @Test
  void longer_sequences_are_left_as_is() {
    List<Integer> values = List.of(1, 2, 3);
    assertThat(new Padder(Side.RIGHT).pad(values, 2, 0), sameInstance(values));
    assertThat(new Padder(Side.RIGHT).attentionMask(3, 3), contains(1, 1, 1));
  }
}
