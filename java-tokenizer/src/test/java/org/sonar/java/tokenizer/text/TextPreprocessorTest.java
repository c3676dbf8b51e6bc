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
package org.sonar.java.tokenizer.text;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

class TextPreprocessorTest {

  @Test
  void identity() {
    assertThat(TextPreprocessor.IDENTITY.prepare("Some Text"), equalTo("Some Text"));
  }

  @Test
  void normalize_then_tokenize_special_chars() {
    TextPreprocessor preprocessor = TextPreprocessor.normalizeChars().andThen(TextPreprocessor.tokenizeSpecialChars());
    assertThat(preprocessor.prepare("Ａα"), equalTo("A α "));
  }

  @Test
  void and_then_applies_in_order() {
    TextPreprocessor first = text -> text + "1";
    TextPreprocessor second = text -> text + "2";
    assertThat(first.andThen(second).prepare("x"), equalTo("x12"));
  }
}
