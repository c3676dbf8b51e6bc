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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.sonar.java.tokenizer.vocabulary.Vocabulary;

/**
 * WordPiece sub-word tokenization: each word produced by the {@link BasicTokenizer} is split greedily into the longest
 * vocabulary entries, the pieces continuing a word being prefixed with {@value #CONTINUATION}. A word which can not be
 * fully split, or which is too long, becomes the unknown token.
 */
public class WordPieceTokenizer implements SubwordTokenizer {

  public static final String CONTINUATION = "##";
  public static final int DEFAULT_MAX_INPUT_CHARS_PER_WORD = 100;

  private final Vocabulary vocabulary;
  private final BasicTokenizer basicTokenizer;
  private final String unknownToken;
  private final int maxInputCharsPerWord;

  public WordPieceTokenizer(Vocabulary vocabulary, BasicTokenizer basicTokenizer, String unknownToken, int maxInputCharsPerWord) {
    this.vocabulary = vocabulary;
    this.basicTokenizer = basicTokenizer;
    this.unknownToken = unknownToken;
    this.maxInputCharsPerWord = maxInputCharsPerWord;
  }

  public WordPieceTokenizer(Vocabulary vocabulary, BasicTokenizer basicTokenizer, String unknownToken) {
    this(vocabulary, basicTokenizer, unknownToken, DEFAULT_MAX_INPUT_CHARS_PER_WORD);
  }

  public BasicTokenizer basicTokenizer() {
    return basicTokenizer;
  }

  @Override
  public List<String> tokenize(String text) {
    List<String> output = new ArrayList<>();
    for (String word : basicTokenizer.tokenize(text)) {
      output.addAll(wordPieces(word));
    }
    return output;
  }

  /**
   * Same as {@link #tokenize(String)}, except that a word mapped to the unknown token is kept as is.
   */
  @Override
  public List<String> alignmentTokens(String text) {
    List<String> output = new ArrayList<>();
    for (String word : basicTokenizer.tokenize(text)) {
      for (String piece : wordPieces(word)) {
        output.add(unknownToken.equals(piece) ? word : piece);
      }
    }
    return output;
  }

  @Override
  public String detokenize(List<String> tokens) {
    return StringUtils.strip(String.join(" ", tokens).replace(" " + CONTINUATION, ""));
  }

  @Override
  public Optional<String> continuationPrefix() {
    return Optional.of(CONTINUATION);
  }

  List<String> wordPieces(String word) {
    int[] codePoints = word.codePoints().toArray();
    if (codePoints.length > maxInputCharsPerWord) {
      return List.of(unknownToken);
    }
    List<String> pieces = new ArrayList<>();
    int start = 0;
    while (start < codePoints.length) {
      int end = codePoints.length;
      String piece = null;
      while (start < end) {
        String candidate = new String(codePoints, start, end - start);
        if (start > 0) {
          candidate = CONTINUATION + candidate;
        }
        if (vocabulary.contains(candidate)) {
          piece = candidate;
          break;
        }
        end--;
      }
      if (piece == null) {
        return List.of(unknownToken);
      }
      pieces.add(piece);
      start = end;
    }
    return pieces;
  }
}
