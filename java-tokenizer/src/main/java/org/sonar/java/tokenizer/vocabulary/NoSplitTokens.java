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
package org.sonar.java.tokenizer.vocabulary;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import org.sonar.java.tokenizer.trie.Trie;

/**
 * The sorted set of tokens which must never be split, and the {@link Trie} isolating them in a text.
 * <p>
 * The trie is rebuilt on every change of the set. When the tokenizer lower-cases its input, the tokens which are not
 * protected from lower-casing are registered in the trie in lower case.
 */
public class NoSplitTokens {

  private final NavigableSet<String> tokens = new TreeSet<>();
  private final boolean lowerCase;
  private final Predicate<String> keepsCase;
  private Trie trie = new Trie();

  /**
   * @param lowerCase whether the tokenizer lower-cases its input
   * @param keepsCase tells which tokens are matched in their original case (the special tokens)
   */
  public NoSplitTokens(boolean lowerCase, Predicate<String> keepsCase) {
    this.lowerCase = lowerCase;
    this.keepsCase = keepsCase;
  }

  /**
   * @return {@code true} if the set changed
   */
  public boolean addAll(Collection<String> newTokens) {
    boolean changed = tokens.addAll(newTokens);
    rebuildTrie();
    return changed;
  }

  public boolean contains(String token) {
    return tokens.contains(token);
  }

  /**
   * @return the tokens, sorted
   */
  public NavigableSet<String> tokens() {
    return Collections.unmodifiableNavigableSet(tokens);
  }

  public List<String> split(String text) {
    return trie.split(text);
  }

  private void rebuildTrie() {
    Trie rebuilt = new Trie();
    for (String token : tokens) {
      if (lowerCase && !keepsCase.test(token)) {
        rebuilt.add(token.toLowerCase(Locale.ROOT));
      } else {
        rebuilt.add(token);
      }
    }
    this.trie = rebuilt;
  }
}
