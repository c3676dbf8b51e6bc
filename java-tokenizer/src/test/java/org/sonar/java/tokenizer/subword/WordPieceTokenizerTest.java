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

import java.util.List;
import org.junit.jupiter.api.Test;
import org.sonar.java.tokenizer.TestTokenizers;
import org.sonar.java.tokenizer.vocabulary.Vocabulary;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

class WordPieceTokenizerTest {

  private final Vocabulary vocabulary = Vocabulary.of(TestTokenizers.BERT_VOCAB, "[UNK]");
  private final WordPieceTokenizer tokenizer = new WordPieceTokenizer(vocabulary, new BasicTokenizer(true), "[UNK]");

  @Test
  void longest_pieces_first() {
    assertThat(tokenizer.tokenize("Elasticsearch is fun"), contains("elastic", "##search", "is", "fun"));
    assertThat(tokenizer.tokenize("unaffable"), contains("un", "##aff", "##able"));
  }

  @Test
  void unknown_word() {
    assertThat(tokenizer.tokenize("hello xyz"), contains("hello", "[UNK]"));
    assertThat(tokenizer.tokenize("helloworld"), contains("[UNK]"));
  }

  @Test
  void too_long_word() {
    WordPieceTokenizer shortWords = new WordPieceTokenizer(vocabulary, new BasicTokenizer(true), "[UNK]", 5);
    assertThat(shortWords.tokenize("elasticsearch hello"), contains("[UNK]", "hello"));
  }

  @Test
  void alignment_tokens_keep_unknown_words() {
    assertThat(tokenizer.alignmentTokens("xyz fun"), contains("xyz", "fun"));
  }

  @Test
  void detokenize_joins_pieces() {
    assertThat(tokenizer.detokenize(List.of("elastic", "##search", "is", "fun")), equalTo("elasticsearch is fun"));
    assertThat(tokenizer.continuationPrefix().orElse(null), equalTo("##"));
    assertThat(tokenizer.basicTokenizer().lowerCase(), equalTo(true));
  }
}
