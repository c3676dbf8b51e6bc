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
package org.sonar.java.tokenizer.offset;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.sonar.java.tokenizer.text.TextPreprocessor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OffsetMapperTest {

  private final OffsetMapper mapper = new OffsetMapper(true, true, "##");

  @Test
  void continuation_pieces() {
    assertThat(mapper.map("Elasticsearch", List.of("elastic", "##search"), Set.of()),
      contains(new Offset(0, 7), new Offset(7, 13)));
  }

  @Test
  void punctuation_and_spaces() {
    assertThat(mapper.map("Hello, World!", List.of("hello", ",", "world", "!"), Set.of()),
      contains(new Offset(0, 5), new Offset(5, 6), new Offset(7, 12), new Offset(12, 13)));
  }

  @Test
  void accents_map_to_the_original_character() {
    assertThat(mapper.map("Caf\u00e9 fun", List.of("cafe", "fun"), Set.of()),
      contains(new Offset(0, 4), new Offset(5, 8)));
    // decomposed accent: the mark is dropped, the letter keeps its own span
    assertThat(mapper.map("Cafe\u0301 fun", List.of("cafe", "fun"), Set.of()),
      contains(new Offset(0, 4), new Offset(6, 9)));
  }

  @Test
  void dropped_control_characters() {
    assertThat(mapper.map("hello\u0000world", List.of("helloworld"), Set.of()), contains(new Offset(0, 11)));
  }

  @Test
  void supplementary_characters_span_two_units() {
    assertThat(mapper.map("hello \uD83D\uDE00", List.of("hello", "\uD83D\uDE00"), Set.of()),
      contains(new Offset(0, 5), new Offset(6, 8)));
  }

  @Test
  void special_tokens_are_searched_in_lower_case() {
    assertThat(mapper.map("[CLS] Hello", List.of("[CLS]", "hello"), Set.of("[CLS]")),
      contains(new Offset(0, 5), new Offset(6, 11)));
  }

  @Test
  void final_sigma() {
    assertThat(mapper.map("ΟΔΟΣ", List.of("οδος"), Set.of()), contains(new Offset(0, 4)));
  }

  @Test
  void lone_continuation_prefix_is_searched_as_is() {
    assertThat(mapper.map("a ## b", List.of("a", "##", "b"), Set.of()),
      contains(new Offset(0, 1), new Offset(2, 4), new Offset(5, 6)));
  }

  @Test
  void token_not_found() {
    AlignmentException e = assertThrows(AlignmentException.class, () -> mapper.map("abc", List.of("abc", "d"), Set.of()));
    assertThat(e.getMessage(), containsString("'d'"));
    assertThat(e.getMessage(), containsString("offset 3"));
  }

  @Test
  void case_is_kept_without_lower_casing() {
    OffsetMapper cased = new OffsetMapper(false, false, null);
    assertThrows(AlignmentException.class, () -> cased.map("Hello", List.of("hello"), Set.of()));
    assertThat(cased.map("Hello", List.of("Hello"), Set.of()), contains(new Offset(0, 5)));
  }

  @Test
  void normalized_text() {
    OffsetMapper.NormalizedText normalized = mapper.normalize("A\u00e9\u0007b");
    assertThat(normalized.text, equalTo("aeb"));
    assertThat(normalized.originalStarts[2], equalTo(3));
    assertThat(normalized.originalEnds[2], equalTo(4));
  }

  @Test
  void preprocessed_chars_map_to_their_source_code_point() {
    OffsetMapper preprocessing = new OffsetMapper(TextPreprocessor.normalizeChars(), true, true, "##");
    OffsetMapper.NormalizedText normalized = preprocessing.normalize("A\u2460b");
    assertThat(normalized.text, equalTo("a 1 b"));
    assertThat(normalized.originalStarts[2], equalTo(1));
    assertThat(normalized.originalEnds[2], equalTo(2));
    assertThat(preprocessing.map("A\u2460b", List.of("a", "1", "b"), Set.of()),
      contains(new Offset(0, 1), new Offset(1, 2), new Offset(2, 3)));
  }

  @Test
  void invalid_offset() {
    assertThrows(IllegalArgumentException.class, () -> new Offset(3, 2));
    assertThrows(IllegalArgumentException.class, () -> new Offset(-1, 2));
    assertThat(new Offset(2, 5).length(), equalTo(3));
    assertThat(new Offset(2, 5).toString(), equalTo("(2, 5)"));
  }
}
