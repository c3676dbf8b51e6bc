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
package org.sonar.java.tokenizer.subword;

import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

class BasicTokenizerTest {

  @Test
  void splits_on_whitespace_punctuation_and_cjk() {
    BasicTokenizer tokenizer = new BasicTokenizer(true);
    assertThat(tokenizer.tokenize("Hello, World! 你好"), contains("hello", ",", "world", "!", "你", "好"));
  }

  @Test
  void strips_accents_when_lower_casing() {
    assertThat(new BasicTokenizer(true).tokenize("Café"), contains("cafe"));
    assertThat(new BasicTokenizer(true).stripsAccents(), is(true));
    assertThat(new BasicTokenizer(true).lowerCase(), is(true));
    assertThat(new BasicTokenizer(false).tokenize("Café"), contains("Café"));
    assertThat(new BasicTokenizer(true, false, Set.of()).tokenize("Café"), contains("café"));
    assertThat(new BasicTokenizer(false, true, Set.of()).tokenize("Café"), contains("Cafe"));
  }

  @Test
  void never_split_tokens_are_kept() {
    BasicTokenizer tokenizer = new BasicTokenizer(true, null, Set.of("[UNK]"));
    assertThat(tokenizer.tokenize("[UNK] Hi [MASK]"), contains("[UNK]", "hi", "[", "mask", "]"));
  }

  @Test
  void control_characters_are_dropped() {
    BasicTokenizer tokenizer = new BasicTokenizer(false);
    assertThat(tokenizer.tokenize("a\u0000b\tc\uFFFDd"), contains("ab", "cd"));
    assertThat(tokenizer.tokenize(" \u0007 "), empty());
  }
}
