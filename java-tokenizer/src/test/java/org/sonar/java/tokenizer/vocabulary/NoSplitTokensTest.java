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
package org.sonar.java.tokenizer.vocabulary;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

class NoSplitTokensTest {

  @Test
  void tokens_are_sorted() {
    NoSplitTokens noSplitTokens = new NoSplitTokens(false, token -> false);
    assertThat(noSplitTokens.addAll(List.of("[SEP]", "<b>", "[CLS]")), is(true));
    assertThat(noSplitTokens.addAll(List.of("<b>")), is(false));

    assertThat(noSplitTokens.tokens(), contains("<b>", "[CLS]", "[SEP]"));
    assertThat(noSplitTokens.contains("<b>"), is(true));
    assertThat(noSplitTokens.contains("<B>"), is(false));
  }

  @Test
  void split_around_tokens() {
    NoSplitTokens noSplitTokens = new NoSplitTokens(false, token -> false);
    noSplitTokens.addAll(List.of("<SEP>"));
    assertThat(noSplitTokens.split("Hello<SEP>World"), contains("Hello", "<SEP>", "World"));
  }

  @Test
  void case_kept_only_for_protected_tokens() {
    NoSplitTokens noSplitTokens = new NoSplitTokens(true, "[CLS]"::equals);
    noSplitTokens.addAll(List.of("[CLS]", "FooBar"));

    assertThat(noSplitTokens.split("x foobar [CLS]"), contains("x ", "foobar", " ", "[CLS]"));
    assertThat(noSplitTokens.split("[cls]"), contains("[cls]"));
  }
}
