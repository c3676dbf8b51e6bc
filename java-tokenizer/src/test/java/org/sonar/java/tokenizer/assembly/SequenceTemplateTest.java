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
import org.sonar.java.tokenizer.offset.Offset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

class SequenceTemplateTest {

  private final BertSequenceTemplate bert = new BertSequenceTemplate(101, 102);

  @Test
  void bert_single_sequence() {
    assertThat(bert.buildInputs(List.of(7, 8), null), contains(101, 7, 8, 102));
    assertThat(bert.createTokenTypeIds(List.of(7, 8), null), contains(0, 0, 0, 0));
    assertThat(bert.specialTokensMask(List.of(7, 8), null), contains(1, 0, 0, 1));
    assertThat(bert.numSpecialTokensToAdd(false), equalTo(2));
  }

  @Test
  void bert_pair() {
    assertThat(bert.buildInputs(List.of(7), List.of(8, 9)), contains(101, 7, 102, 8, 9, 102));
    assertThat(bert.createTokenTypeIds(List.of(7), List.of(8, 9)), contains(0, 0, 0, 1, 1, 1));
    assertThat(bert.specialTokensMask(List.of(7), List.of(8, 9)), contains(1, 0, 1, 0, 0, 1));
    assertThat(bert.numSpecialTokensToAdd(true), equalTo(3));
    assertThat(bert.buildOffsetMapping(List.of(new Offset(0, 2)), List.of(new Offset(0, 3))),
      contains(Offset.NONE, new Offset(0, 2), Offset.NONE, new Offset(0, 3), Offset.NONE));
  }

  @Test
  void plain_template_adds_nothing() {
    PlainSequenceTemplate plain = PlainSequenceTemplate.INSTANCE;
    assertThat(plain.buildInputs(List.of(7), List.of(8, 9)), contains(7, 8, 9));
    assertThat(plain.createTokenTypeIds(List.of(7), List.of(8, 9)), contains(0, 1, 1));
    assertThat(plain.specialTokensMask(List.of(7), List.of(8, 9)), contains(0, 0, 0));
    assertThat(plain.numSpecialTokensToAdd(true), equalTo(0));
  }
}
