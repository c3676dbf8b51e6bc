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
package org.sonar.java.tokenizer.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Stateless predicates over a single code point, and the text-level passes built upon them.
 * <p>
 * All predicates take a Unicode code point, so characters outside the BMP are classified like any other character.
 * Range tables below are data: they mirror the ranges the pretrained vocabularies were built with and must not be
 * "fixed" without retraining those vocabularies.
 */
public final class CharacterClassifier {

  private static final Set<Integer> LEGACY_SYMBOLS = Set.of(0x00AD, 0x00B2, 0x00BA, 0x3007, 0x00B5, 0x00D8, 0x014B, 0x01B1);

  /**
   * CJK Unified Ideographs blocks, as inclusive {@code {first, last}} pairs. The Hangul and kana blocks are not part of
   * it: those scripts separate words with spaces.
   */
  private static final int[][] CJK_RANGES = {
    {0x4E00, 0x9FFF},
    {0x3400, 0x4DBF},
    {0x20000, 0x2A6DF},
    {0x2A700, 0x2B73F},
    {0x2B740, 0x2B81F},
    {0x2B820, 0x2CEAF},
    {0xF900, 0xFAFF},
    {0x2F800, 0x2FA1F}
  };

  private static final int[][] NON_NORMALIZED_RANGES = {
    // Halfwidth and Fullwidth Forms
    {0xFF00, 0xFFEF},
    // Small Form Variants
    {0xFE50, 0xFE6B},
    // CJK Compatibility
    {0x3358, 0x33FF},
    // Enclosed Alphanumerics, parenthesized and circled letters
    {0x249C, 0x24E9},
    // Enclosed CJK Letters and Months
    {0x3200, 0x32FF}
  };

  private static final int[][] NON_NORMALIZED_NUMERIC_RANGES = {
    {0x2460, 0x249B},
    {0x24EA, 0x24FF},
    // Dingbat circled digits
    {0x2776, 0x2793},
    // Number Forms, roman numerals
    {0x2160, 0x217F}
  };

  private static final int[][] SPACED_SCRIPT_RANGES = {
    // Hiragana and Katakana
    {0x3040, 0x30FF},
    // Greek, Coptic and Cyrillic
    {0x0370, 0x04FF},
    // IPA Extensions
    {0x0250, 0x02AF}
  };

  private static final int LEGACY_COMPATIBILITY_IDEOGRAPH = 0xF979;
  private static final String LEGACY_COMPATIBILITY_REPLACEMENT = "凉";

  private CharacterClassifier() {
    // utility class
  }

  /**
   * Tab, line feed and carriage return are control characters in Unicode, they are considered whitespace here.
   */
  public static boolean isWhitespace(int codePoint) {
    if (codePoint == ' ' || codePoint == '\t' || codePoint == '\n' || codePoint == '\r') {
      return true;
    }
    return Character.getType(codePoint) == Character.SPACE_SEPARATOR;
  }

  public static boolean isControl(int codePoint) {
    if (codePoint == '\t' || codePoint == '\n' || codePoint == '\r') {
      return false;
    }
    switch (Character.getType(codePoint)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.PRIVATE_USE:
      case Character.SURROGATE:
      case Character.UNASSIGNED:
        return true;
      default:
        return false;
    }
  }

  /**
   * All non-letter, non-digit ASCII characters count as punctuation, even {@code ^}, {@code $} or {@code `} which
   * Unicode classifies as symbols.
   */
  public static boolean isPunctuation(int codePoint) {
    if ((codePoint >= 33 && codePoint <= 47) || (codePoint >= 58 && codePoint <= 64)
      || (codePoint >= 91 && codePoint <= 96) || (codePoint >= 123 && codePoint <= 126)) {
      return true;
    }
    switch (Character.getType(codePoint)) {
      case Character.CONNECTOR_PUNCTUATION:
      case Character.DASH_PUNCTUATION:
      case Character.START_PUNCTUATION:
      case Character.END_PUNCTUATION:
      case Character.INITIAL_QUOTE_PUNCTUATION:
      case Character.FINAL_QUOTE_PUNCTUATION:
      case Character.OTHER_PUNCTUATION:
        return true;
      default:
        return false;
    }
  }

  public static boolean isSymbol(int codePoint) {
    switch (Character.getType(codePoint)) {
      case Character.MATH_SYMBOL:
      case Character.CURRENCY_SYMBOL:
      case Character.MODIFIER_SYMBOL:
      case Character.OTHER_SYMBOL:
        return true;
      default:
        return LEGACY_SYMBOLS.contains(codePoint);
    }
  }

  public static boolean isCjk(int codePoint) {
    return inRanges(codePoint, CJK_RANGES);
  }

  static boolean isNonNormalized(int codePoint) {
    return inRanges(codePoint, NON_NORMALIZED_RANGES);
  }

  static boolean isNonNormalizedNumeric(int codePoint) {
    return inRanges(codePoint, NON_NORMALIZED_NUMERIC_RANGES);
  }

  /**
   * @return {@code true} if the first character of {@code text} is a control, punctuation or whitespace character
   */
  public static boolean isStartOfWord(String text) {
    if (text.isEmpty()) {
      return false;
    }
    int first = text.codePointAt(0);
    return isControl(first) || isPunctuation(first) || isWhitespace(first);
  }

  /**
   * @return {@code true} if the last character of {@code text} is a control, punctuation or whitespace character
   */
  public static boolean isEndOfWord(String text) {
    if (text.isEmpty()) {
      return false;
    }
    int last = text.codePointBefore(text.length());
    return isControl(last) || isPunctuation(last) || isWhitespace(last);
  }

  /**
   * Splits {@code text} so that every CJK character stands alone, the runs of other characters being kept together.
   * Concatenating the result gives back {@code text}.
   */
  public static List<String> splitOnCjk(String text) {
    List<String> fragments = new ArrayList<>();
    StringBuilder run = new StringBuilder();
    text.codePoints().forEach(cp -> {
      if (isCjk(cp)) {
        if (run.length() > 0) {
          fragments.add(run.toString());
          run.setLength(0);
        }
        fragments.add(new String(Character.toChars(cp)));
      } else {
        run.appendCodePoint(cp);
      }
    });
    if (run.length() > 0) {
      fragments.add(run.toString());
    }
    return fragments;
  }

  /**
   * Surrounds with spaces each kana, Greek, Cyrillic, IPA or symbol character.
   */
  public static String insertSpacesAroundScripts(String text) {
    StringBuilder output = new StringBuilder(text.length());
    text.codePoints().forEach(cp -> {
      if (inRanges(cp, SPACED_SCRIPT_RANGES) || isSymbol(cp)) {
        output.append(' ').appendCodePoint(cp).append(' ');
      } else {
        output.appendCodePoint(cp);
      }
    });
    return output.toString();
  }

  /**
   * Rewrites the compatibility forms multilingual vocabularies do not contain:
   * <ul>
   *   <li>fullwidth, small and enclosed forms are replaced by their NFKC decomposition</li>
   *   <li>enclosed and roman numerals are replaced by their decimal value surrounded by spaces</li>
   *   <li>U+F979, a compatibility ideograph, is replaced by its unified counterpart</li>
   * </ul>
   */
  public static String normalize(String text) {
    StringBuilder output = new StringBuilder(text.length());
    text.codePoints().forEach(cp -> {
      if (isNonNormalized(cp)) {
        output.append(Normalizer.normalize(new String(Character.toChars(cp)), Normalizer.Form.NFKC));
      } else if (isNonNormalizedNumeric(cp)) {
        output.append(' ').append(Character.getNumericValue(cp)).append(' ');
      } else if (cp == LEGACY_COMPATIBILITY_IDEOGRAPH) {
        output.append(LEGACY_COMPATIBILITY_REPLACEMENT);
      } else {
        output.appendCodePoint(cp);
      }
    });
    return output.toString();
  }

  /**
   * Decomposes {@code text} (NFD) and drops the resulting non-spacing marks.
   */
  public static String stripAccents(String text) {
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
    StringBuilder output = new StringBuilder(decomposed.length());
    decomposed.codePoints()
      .filter(cp -> Character.getType(cp) != Character.NON_SPACING_MARK)
      .forEach(output::appendCodePoint);
    return output.toString();
  }

  /**
   * Strips {@code text} and splits it on runs of whitespace.
   */
  public static List<String> whitespaceTokenize(String text) {
    String stripped = StringUtils.strip(text);
    if (StringUtils.isEmpty(stripped)) {
      return Collections.emptyList();
    }
    return Arrays.asList(StringUtils.split(stripped));
  }

  private static boolean inRanges(int codePoint, int[][] ranges) {
    for (int[] range : ranges) {
      if (codePoint >= range[0] && codePoint <= range[1]) {
        return true;
      }
    }
    return false;
  }
}
