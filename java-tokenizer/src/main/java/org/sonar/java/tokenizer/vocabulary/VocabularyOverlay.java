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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

/**
 * The base {@link Vocabulary} of a tokenizer plus the tokens added to it afterwards.
 * <p>
 * Added tokens get the ids following the last id in use, so an added id is always greater than or equal to the size
 * of the base vocabulary. Lookups check added tokens first.
 */
public class VocabularyOverlay {

  private final Vocabulary base;
  @Nullable
  private final String unknownToken;
  private final Map<String, Integer> addedIdsByToken = new LinkedHashMap<>();
  private final Map<Integer, String> addedTokensById = new HashMap<>();

  public VocabularyOverlay(Vocabulary base, @Nullable String unknownToken) {
    this.base = base;
    this.unknownToken = unknownToken;
  }

  public Vocabulary base() {
    return base;
  }

  @CheckForNull
  public String unknownToken() {
    return unknownToken;
  }

  /**
   * @return size of the base vocabulary plus number of added tokens
   */
  public int size() {
    return base.size() + addedIdsByToken.size();
  }

  /**
   * @return the id of {@code token} if it is known, without falling back to the unknown token
   */
  @CheckForNull
  public Integer exactId(String token) {
    Integer id = addedIdsByToken.get(token);
    return id != null ? id : base.exactId(token);
  }

  /**
   * @return the id of {@code token}, the id of the unknown token when {@code token} is not known, or {@code null} when
   *         there is no unknown token either
   */
  @CheckForNull
  public Integer tokenToId(String token) {
    Integer id = exactId(token);
    if (id == null && unknownToken != null) {
      return exactId(unknownToken);
    }
    return id;
  }

  public String idToToken(int id) {
    String added = addedTokensById.get(id);
    return added != null ? added : base.idToToken(id);
  }

  public boolean isAdded(String token) {
    return addedIdsByToken.containsKey(token);
  }

  /**
   * @return the added tokens and their ids, in insertion order
   */
  public Map<String, Integer> addedVocabulary() {
    return Collections.unmodifiableMap(addedIdsByToken);
  }

  /**
   * Adds the candidates which are neither the unknown token nor already known, each one once.
   *
   * @return the tokens actually added, in the order of their new ids
   */
  public List<String> add(Collection<String> candidates) {
    List<String> toAdd = new ArrayList<>();
    for (String candidate : candidates) {
      if (!candidate.equals(unknownToken) && exactId(candidate) == null && !toAdd.contains(candidate)) {
        toAdd.add(candidate);
      }
    }
    int nextId = size();
    for (String token : toAdd) {
      register(token, nextId++);
    }
    return toAdd;
  }

  /**
   * Restores previously added tokens with their ids, as saved in an {@code added_tokens.json} file. Ids must continue
   * the current id range without gap. Tokens already known with the same id are skipped.
   */
  public void restore(Map<String, Integer> addedTokens) {
    List<Map.Entry<String, Integer>> byId = new ArrayList<>(addedTokens.entrySet());
    byId.sort(Comparator.comparing(Map.Entry::getValue));
    for (Map.Entry<String, Integer> entry : byId) {
      if (entry.getValue().equals(exactId(entry.getKey()))) {
        continue;
      }
      int expected = size();
      if (entry.getValue() != expected) {
        throw new IllegalArgumentException("Non-consecutive added token '" + entry.getKey() + "' found: expected id " + expected
          + " but got " + entry.getValue());
      }
      register(entry.getKey(), entry.getValue());
    }
  }

  private void register(String token, int id) {
    addedIdsByToken.put(token, id);
    addedTokensById.put(id, token);
  }
}
