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
package org.sonar.java.tokenizer;

import java.util.Objects;

/**
 * A token added to the vocabulary after it was built, with the whitespace it absorbs when found inside a text.
 * <p>
 * {@code lstrip} makes the token eat the whitespace on its left, {@code rstrip} the whitespace on its right.
 * {@code singleWord} and {@code normalized} are carried along for serialization but do not change tokenization.
 */
public final class AddedToken {

  private final String content;
  private final boolean singleWord;
  private final boolean lstrip;
  private final boolean rstrip;
  private final boolean normalized;

  public AddedToken(String content, boolean singleWord, boolean lstrip, boolean rstrip, boolean normalized) {
    this.content = Objects.requireNonNull(content, "content");
    this.singleWord = singleWord;
    this.lstrip = lstrip;
    this.rstrip = rstrip;
    this.normalized = normalized;
  }

  /**
   * A token absorbing no whitespace.
   */
  public static AddedToken of(String content) {
    return new AddedToken(content, false, false, false, true);
  }

  /**
   * A token given without explicit stripping behavior: it absorbs the whitespace on both sides.
   */
  public static AddedToken plain(String content) {
    return new AddedToken(content, false, true, true, true);
  }

  public String content() {
    return content;
  }

  public boolean singleWord() {
    return singleWord;
  }

  public boolean lstrip() {
    return lstrip;
  }

  public boolean rstrip() {
    return rstrip;
  }

  public boolean normalized() {
    return normalized;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AddedToken that = (AddedToken) o;
    return singleWord == that.singleWord
      && lstrip == that.lstrip
      && rstrip == that.rstrip
      && normalized == that.normalized
      && content.equals(that.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(content, singleWord, lstrip, rstrip, normalized);
  }

  @Override
  public String toString() {
    return content;
  }
}
