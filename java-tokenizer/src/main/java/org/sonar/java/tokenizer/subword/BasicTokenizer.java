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
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.text.CharacterClassifier;

/**
 * Word-level splitting run before WordPiece: cleans the text, isolates CJK characters and punctuation, splits on
 * whitespace, optionally lower-cases and strips accents.
 */
public class BasicTokenizer {

  private final boolean lowerCase;
  @Nullable
  private final Boolean stripAccents;
  private final Set<String> neverSplit;

  /**
   * @param stripAccents {@code null} to strip accents only when lower-casing
   */
  public BasicTokenizer(boolean lowerCase, @Nullable Boolean stripAccents, Set<String> neverSplit) {
    this.lowerCase = lowerCase;
    this.stripAccents = stripAccents;
    this.neverSplit = Set.copyOf(neverSplit);
  }

  public BasicTokenizer(boolean lowerCase) {
    this(lowerCase, null, Collections.emptySet());
  }

  public boolean lowerCase() {
    return lowerCase;
  }

  /**
   * @return whether accents are effectively stripped
   */
  public boolean stripsAccents() {
    return stripAccents != null ? stripAccents : lowerCase;
  }

  public List<String> tokenize(String text) {
    String cleaned = isolateCjk(clean(text));
    List<String> splitTokens = new ArrayList<>();
    for (String token : CharacterClassifier.whitespaceTokenize(cleaned)) {
      if (neverSplit.contains(token)) {
        splitTokens.add(token);
        continue;
      }
      String word = token;
      if (lowerCase) {
        word = word.toLowerCase(Locale.ROOT);
      }
      if (stripsAccents()) {
        word = CharacterClassifier.stripAccents(word);
      }
      splitTokens.addAll(splitOnPunctuation(word));
    }
    return CharacterClassifier.whitespaceTokenize(String.join(" ", splitTokens));
  }

  /**
   * Drops NUL, replacement and control characters, turns any whitespace into a plain space.
   */
  private static String clean(String text) {
    StringBuilder output = new StringBuilder(text.length());
    text.codePoints().forEach(cp -> {
      if (cp == 0 || cp == 0xFFFD || CharacterClassifier.isControl(cp)) {
        return;
      }
      if (CharacterClassifier.isWhitespace(cp)) {
        output.append(' ');
      } else {
        output.appendCodePoint(cp);
      }
    });
    return output.toString();
  }

  private static String isolateCjk(String text) {
    StringBuilder output = new StringBuilder(text.length());
    for (String fragment : CharacterClassifier.splitOnCjk(text)) {
      if (fragment.codePointCount(0, fragment.length()) == 1 && CharacterClassifier.isCjk(fragment.codePointAt(0))) {
        output.append(' ').append(fragment).append(' ');
      } else {
        output.append(fragment);
      }
    }
    return output.toString();
  }

  private static List<String> splitOnPunctuation(String word) {
    List<String> output = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    word.codePoints().forEach(cp -> {
      if (CharacterClassifier.isPunctuation(cp)) {
        if (current.length() > 0) {
          output.add(current.toString());
          current.setLength(0);
        }
        output.add(new String(Character.toChars(cp)));
      } else {
        current.appendCodePoint(cp);
      }
    });
    if (current.length() > 0) {
      output.add(current.toString());
    }
    return output;
  }
}
