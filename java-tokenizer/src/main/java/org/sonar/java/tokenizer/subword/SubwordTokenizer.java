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
import java.util.Optional;

/**
 * A sub-word tokenization scheme (WordPiece, byte-level BPE, ...), applied to the runs of text found between no-split
 * tokens.
 * <p>
 * Implementations know nothing about added or special tokens: those are isolated before the scheme is invoked.
 */
public interface SubwordTokenizer {

  /**
   * @return the tokens of {@code text}, which never contains a no-split token
   */
  List<String> tokenize(String text);

  /**
   * @return the tokens of {@code text} as they are searched for in the original text when computing offsets. Schemes
   *         mapping whole words to an unknown token should return the word itself in place of the unknown token.
   */
  default List<String> alignmentTokens(String text) {
    return tokenize(text);
  }

  /**
   * @return the text of a run of tokens produced by {@link #tokenize(String)}
   */
  String detokenize(List<String> tokens);

  /**
   * @return the marker prefixed to the tokens continuing a word, if the scheme uses one
   */
  default Optional<String> continuationPrefix() {
    return Optional.empty();
  }

  /**
   * @return {@code false} when tokens are not substrings of the input (byte-level schemes), in which case offsets can
   *         not be computed by searching tokens in the text
   */
  default boolean preservesCharacters() {
    return true;
  }
}
