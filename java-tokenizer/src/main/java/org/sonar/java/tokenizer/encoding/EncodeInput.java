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
package org.sonar.java.tokenizer.encoding;

import java.util.List;
import java.util.Objects;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

/**
 * One sequence to encode: a text, a list of strings (tokens, or words when
 * {@link EncodingOptions#isSplitIntoWords()}), or ids which are used as is.
 */
public final class EncodeInput {

  public enum Kind {
    TEXT,
    STRINGS,
    IDS
  }

  private final Kind kind;
  @Nullable
  private final String text;
  @Nullable
  private final List<String> strings;
  @Nullable
  private final List<Integer> ids;

  private EncodeInput(Kind kind, @Nullable String text, @Nullable List<String> strings, @Nullable List<Integer> ids) {
    this.kind = kind;
    this.text = text;
    this.strings = strings;
    this.ids = ids;
  }

  public static EncodeInput text(@Nullable String text) {
    if (text == null) {
      throw new IllegalArgumentException("text: input is not valid. Should be a string, a list of strings or a list of integers.");
    }
    return new EncodeInput(Kind.TEXT, text, null, null);
  }

  public static EncodeInput strings(@Nullable List<String> strings) {
    if (strings == null || strings.isEmpty() || strings.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("text: input " + strings + " is not valid. Should be a non-empty list of strings.");
    }
    return new EncodeInput(Kind.STRINGS, null, List.copyOf(strings), null);
  }

  public static EncodeInput ids(@Nullable List<Integer> ids) {
    if (ids == null || ids.isEmpty() || ids.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("text: input " + ids + " is not valid. Should be a non-empty list of integers.");
    }
    return new EncodeInput(Kind.IDS, null, null, List.copyOf(ids));
  }

  public Kind kind() {
    return kind;
  }

  @CheckForNull
  public String text() {
    return text;
  }

  @CheckForNull
  public List<String> strings() {
    return strings;
  }

  @CheckForNull
  public List<Integer> ids() {
    return ids;
  }

  @Override
  public String toString() {
    switch (kind) {
      case TEXT:
        return text;
      case STRINGS:
        return String.valueOf(strings);
      default:
        return String.valueOf(ids);
    }
  }
}
