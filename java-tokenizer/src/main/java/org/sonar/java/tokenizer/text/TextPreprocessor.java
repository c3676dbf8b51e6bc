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

/**
 * Model-specific transformation applied to the raw text before any no-split token is searched for.
 */
@FunctionalInterface
public interface TextPreprocessor {

  TextPreprocessor IDENTITY = text -> text;

  String prepare(String text);

  default TextPreprocessor andThen(TextPreprocessor next) {
    return text -> next.prepare(prepare(text));
  }

  /**
   * @see CharacterClassifier#normalize(String)
   */
  static TextPreprocessor normalizeChars() {
    return CharacterClassifier::normalize;
  }

  /**
   * @see CharacterClassifier#insertSpacesAroundScripts(String)
   */
  static TextPreprocessor tokenizeSpecialChars() {
    return CharacterClassifier::insertSpacesAroundScripts;
  }
}
