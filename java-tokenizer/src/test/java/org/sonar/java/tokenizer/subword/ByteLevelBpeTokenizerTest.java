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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.sonar.java.tokenizer.TestTokenizers;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

class ByteLevelBpeTokenizerTest {

  @Test
  void pre_tokenization() {
    assertThat(ByteLevelBpeTokenizer.preTokenize("I'm here  now"), contains("I", "'m", " here", " ", " now"));
    assertThat(ByteLevelBpeTokenizer.preTokenize("it's 42!"), contains("it", "'s", " 42", "!"));
  }

  @Test
  void byte_encoding() {
    assertThat(ByteLevelBpeTokenizer.byteEncode(" the"), equalTo("Ġthe"));
    assertThat(ByteLevelBpeTokenizer.byteEncode("é"), equalTo("Ã©"));
    assertThat(ByteLevelBpeTokenizer.byteEncode("\n"), equalTo("Ċ"));
  }

  @Test
  void tokenize_and_detokenize() throws IOException {
    ByteLevelBpeTokenizer tokenizer;
    try (InputStream merges = TestTokenizers.resource("merges.txt")) {
      tokenizer = ByteLevelBpeTokenizer.fromMerges(merges);
    }
    List<String> tokens = tokenizer.tokenize("the the low");
    assertThat(tokens, contains("t", "he", "Ġthe", "Ġ", "low"));
    assertThat(tokenizer.detokenize(tokens), equalTo("the the low"));
    assertThat(tokenizer.detokenize(List.of("Ã©")), equalTo("é"));
    assertThat(tokenizer.preservesCharacters(), is(false));
  }

  @Test
  void encodings_are_cached() {
    List<String> calls = new ArrayList<>();
    CachingBPEEncoder cache = new CachingBPEEncoder(word -> {
      calls.add(word);
      return List.of(word);
    });
    ByteLevelBpeTokenizer tokenizer = new ByteLevelBpeTokenizer(cache);

    assertThat(tokenizer.tokenize("a b a b"), contains("a", "Ġb", "Ġa", "Ġb"));
    assertThat(calls, contains("a", "Ġb", "Ġa"));
    assertThat(cache.size(), equalTo(3));
    assertThat(cache.hits(), equalTo(1L));

    cache.clear();
    assertThat(cache.size(), equalTo(0));
    tokenizer.tokenize("a");
    assertThat(calls.size(), equalTo(4));
  }
}
