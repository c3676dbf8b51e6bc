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

/**
 * The named special-token roles of a tokenizer, in the order they are listed by
 * {@link PretrainedTokenizer#allSpecialTokensExtended()}.
 */
public enum SpecialTokenSlot {
  BOS("bos_token"),
  EOS("eos_token"),
  UNK("unk_token"),
  SEP("sep_token"),
  PAD("pad_token"),
  CLS("cls_token"),
  MASK("mask_token");

  public static final String ADDITIONAL_SPECIAL_TOKENS_KEY = "additional_special_tokens";

  private final String key;

  SpecialTokenSlot(String key) {
    this.key = key;
  }

  /**
   * @return the name of the slot in JSON configuration files
   */
  public String key() {
    return key;
  }
}
