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
package org.sonar.java.tokenizer.trie;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

class TrieTest {

  private static Trie trie(String... words) {
    Trie trie = new Trie();
    for (String word : words) {
      trie.add(word);
    }
    return trie;
  }

  @Test
  void isolates_markers() {
    assertThat(trie("<SEP>").split("Hello<SEP>World"), contains("Hello", "<SEP>", "World"));
    assertThat(trie("[CLS]", "extra_id_1", "extra_id_100").split("[CLS] This is a extra_id_100"),
      contains("[CLS]", " This is a ", "extra_id_100"));
  }

  @Test
  void no_marker_found() {
    assertThat(trie("[CLS]").split("nothing special"), contains("nothing special"));
    assertThat(new Trie().split("nothing special"), contains("nothing special"));
  }

  @Test
  void empty_text() {
    assertThat(trie("[CLS]").split(""), empty());
  }

  @Test
  void earliest_match_wins_then_longest() {
    assertThat(trie("ABC", "B", "CD").split("ABCD"), contains("ABC", "D"));
    assertThat(trie("AB", "B", "C").split("ABC"), contains("AB", "C"));
  }

  @Test
  void partial_prefixes_do_not_match() {
    assertThat(trie("A", "P", "[SPECIAL]").split("This is something [SPECIAL]"), contains("This is something ", "[SPECIAL]"));
  }

  @Test
  void markers_next_to_each_other() {
    assertThat(trie("[A]", "[B]").split("[A][B]x[A]"), contains("[A]", "[B]", "x", "[A]"));
  }

  @Test
  void concatenation_gives_back_the_text() {
    Trie trie = trie("<s>", "</s>", "ab", "abc", "bcd");
    for (String text : List.of("<s>abcd</s>", "xxabcbcdabc", "</s></s>", "a<s b>c")) {
      assertThat(String.join("", trie.split(text)), equalTo(text));
    }
  }

  @Test
  void empty_marker_is_ignored() {
    Trie trie = trie("", "x", "x");
    assertThat(trie.size(), equalTo(1));
    assertThat(trie.split("axb"), contains("a", "x", "b"));
  }
}
