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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.text.CharacterClassifier;
import org.sonar.java.tokenizer.text.TextPreprocessor;

/**
 * Finds the span of the original text each token comes from.
 * <p>
 * The text is first normalized the way the tokenizer sees it (preprocessed, lower-cased, accents stripped, control
 * characters dropped), remembering for each normalized char the original code point it comes from. The preprocessor
 * is applied to each code point on its own, so it must rewrite code points independently of their neighbors. Tokens are then searched for
 * one after the other in the normalized text, each search starting where the previous match ended.
 */
public class OffsetMapper {

  private static final char FINAL_SIGMA = 'ς';
  private static final char SIGMA = 'σ';

  private final TextPreprocessor preprocessor;
  private final boolean lowerCase;
  private final boolean stripAccents;
  @Nullable
  private final String continuationPrefix;

  /**
   * @param continuationPrefix marker prefixed to the tokens continuing a word, stripped before searching
   */
  public OffsetMapper(boolean lowerCase, boolean stripAccents, @Nullable String continuationPrefix) {
    this(TextPreprocessor.IDENTITY, lowerCase, stripAccents, continuationPrefix);
  }

  public OffsetMapper(TextPreprocessor preprocessor, boolean lowerCase, boolean stripAccents, @Nullable String continuationPrefix) {
    this.preprocessor = preprocessor;
    this.lowerCase = lowerCase;
    this.stripAccents = stripAccents;
    this.continuationPrefix = continuationPrefix;
  }

  /**
   * @param tokens the tokens of {@code text}, unknown tokens being replaced by the words they stand for
   * @param specialTokens tokens which kept their case during tokenization
   * @return one offset per token
   * @throws AlignmentException if a token is not found in the remaining normalized text
   */
  public List<Offset> map(String text, List<String> tokens, Collection<String> specialTokens) {
    NormalizedText normalized = normalize(text);
    String searched = normalized.text;
    String searchedWithoutFinalSigma = null;

    List<Offset> offsets = new ArrayList<>(tokens.size());
    int searchOffset = 0;
    for (String token : tokens) {
      String needle = token;
      if (continuationPrefix != null && needle.startsWith(continuationPrefix) && needle.length() > continuationPrefix.length()) {
        needle = needle.substring(continuationPrefix.length());
      }
      if (lowerCase && specialTokens.contains(token)) {
        needle = needle.toLowerCase(Locale.ROOT);
      }
      int start;
      if (needle.indexOf(SIGMA) >= 0 || needle.indexOf(FINAL_SIGMA) >= 0) {
        if (searchedWithoutFinalSigma == null) {
          searchedWithoutFinalSigma = searched.replace(FINAL_SIGMA, SIGMA);
        }
        start = searchedWithoutFinalSigma.indexOf(needle.replace(FINAL_SIGMA, SIGMA), searchOffset);
      } else {
        start = needle.isEmpty() ? -1 : searched.indexOf(needle, searchOffset);
      }
      if (start < 0) {
        throw new AlignmentException(token, searchOffset);
      }
      int end = start + needle.length();
      offsets.add(new Offset(normalized.originalStarts[start], normalized.originalEnds[end - 1]));
      searchOffset = end;
    }
    return offsets;
  }

  NormalizedText normalize(String text) {
    StringBuilder normalized = new StringBuilder(text.length());
    int[] starts = new int[text.length()];
    int[] ends = new int[text.length()];
    int count = 0;

    int i = 0;
    while (i < text.length()) {
      int codePoint = text.codePointAt(i);
      int originalEnd = i + Character.charCount(codePoint);
      String ch = preprocessor.prepare(new String(Character.toChars(codePoint)));
      if (lowerCase) {
        ch = ch.toLowerCase(Locale.ROOT);
      }
      if (stripAccents) {
        ch = CharacterClassifier.stripAccents(ch);
      }
      for (int j = 0; j < ch.length(); ) {
        int cp = ch.codePointAt(j);
        int cpLength = Character.charCount(cp);
        if (cp != 0 && cp != 0xFFFD && !CharacterClassifier.isControl(cp)) {
          normalized.appendCodePoint(cp);
          if (count + cpLength > starts.length) {
            starts = Arrays.copyOf(starts, Math.max(starts.length * 2, count + cpLength));
            ends = Arrays.copyOf(ends, starts.length);
          }
          for (int k = 0; k < cpLength; k++) {
            starts[count] = i;
            ends[count] = originalEnd;
            count++;
          }
        }
        j += cpLength;
      }
      i = originalEnd;
    }
    return new NormalizedText(normalized.toString(), starts, ends);
  }

  static final class NormalizedText {
    final String text;
    /**
     * Index in the original text of the code point each normalized char comes from.
     */
    final int[] originalStarts;
    /**
     * End index in the original text of the code point each normalized char comes from.
     */
    final int[] originalEnds;

    private NormalizedText(String text, int[] originalStarts, int[] originalEnds) {
      this.text = text;
      this.originalStarts = originalStarts;
      this.originalEnds = originalEnds;
    }
  }
}
