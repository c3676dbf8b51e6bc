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
package org.sonar.java.tokenizer.assembly;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

class TokenizationCleanupTest {

  @Test
  void spaces_before_punctuation_and_contractions() {
    assertThat(TokenizationCleanup.cleanUp("do n't stop , it 's fine ."), equalTo("don't stop, it's fine."));
    assertThat(TokenizationCleanup.cleanUp("i 'm here ! are you ?"), equalTo("i'm here! are you?"));
    assertThat(TokenizationCleanup.cleanUp("we 've and they 're"), equalTo("we've and they're"));
  }

  @Test
  void nothing_to_clean() {
    assertThat(TokenizationCleanup.cleanUp("hello world"), equalTo("hello world"));
  }
}
