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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VocabularyOverlayTest {

  private final VocabularyOverlay overlay = new VocabularyOverlay(Vocabulary.of(List.of("a", "b", "[UNK]"), "[UNK]"), "[UNK]");

  @Test
  void added_tokens_follow_base_ids() {
    List<String> added = overlay.add(List.of("c", "a", "c", "[UNK]", "d"));

    assertThat(added, contains("c", "d"));
    assertThat(overlay.size(), equalTo(5));
    assertThat(overlay.tokenToId("c"), equalTo(3));
    assertThat(overlay.tokenToId("d"), equalTo(4));
    assertThat(overlay.idToToken(4), equalTo("d"));
    assertThat(overlay.idToToken(1), equalTo("b"));
    assertThat(overlay.isAdded("c"), is(true));
    assertThat(overlay.isAdded("a"), is(false));
    assertThat(overlay.addedVocabulary().keySet(), contains("c", "d"));
  }

  @Test
  void adding_known_tokens_again_changes_nothing() {
    overlay.add(List.of("c"));
    assertThat(overlay.add(List.of("c", "b")), empty());
    assertThat(overlay.size(), equalTo(4));
  }

  @Test
  void unknown_lookup() {
    assertThat(overlay.tokenToId("zzz"), equalTo(2));
    assertThat(overlay.exactId("zzz"), equalTo(null));
  }

  @Test
  void restore_saved_tokens() {
    Map<String, Integer> saved = new LinkedHashMap<>();
    saved.put("e", 4);
    saved.put("d", 3);
    saved.put("a", 0);
    overlay.restore(saved);

    assertThat(overlay.size(), equalTo(5));
    assertThat(overlay.tokenToId("d"), equalTo(3));
    assertThat(overlay.tokenToId("e"), equalTo(4));
  }

  @Test
  void restore_with_gap() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> overlay.restore(Map.of("d", 4)));
    assertThat(e.getMessage(), containsString("Non-consecutive added token 'd' found: expected id 3 but got 4"));
  }
}
