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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

/**
 * The base vocabulary of a tokenizer: an immutable, dense mapping between tokens and ids {@code [0, size())}.
 * <p>
 * Lookups of unknown tokens fall back to the id of the unknown token, when the vocabulary has one.
 */
public class Vocabulary {

  private final List<String> tokens;
  private final Map<String, Integer> idsByToken;
  @Nullable
  private final String unknownToken;

  private Vocabulary(List<String> tokens, @Nullable String unknownToken) {
    this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    this.idsByToken = new HashMap<>(tokens.size() * 2);
    for (int id = 0; id < tokens.size(); id++) {
      String token = tokens.get(id);
      if (idsByToken.putIfAbsent(token, id) != null) {
        throw new IllegalArgumentException("Duplicate token '" + token + "' at index " + id + " of the vocabulary");
      }
    }
    this.unknownToken = unknownToken;
  }

  /**
   * @param tokens the tokens, in id order
   * @param unknownToken the token standing for out-of-vocabulary tokens, or {@code null} if there is none
   */
  public static Vocabulary of(List<String> tokens, @Nullable String unknownToken) {
    return new Vocabulary(tokens, unknownToken);
  }

  /**
   * @param idsByToken a dense mapping, ids ranging from 0 to {@code idsByToken.size() - 1}
   */
  public static Vocabulary fromMap(Map<String, Integer> idsByToken, @Nullable String unknownToken) {
    String[] ordered = new String[idsByToken.size()];
    idsByToken.forEach((token, id) -> {
      if (id < 0 || id >= ordered.length || ordered[id] != null) {
        throw new IllegalArgumentException("Vocabulary ids must be dense, got " + id + " for token '" + token + "'");
      }
      ordered[id] = token;
    });
    return new Vocabulary(List.of(ordered), unknownToken);
  }

  public int size() {
    return tokens.size();
  }

  public boolean contains(String token) {
    return idsByToken.containsKey(token);
  }

  @CheckForNull
  public String unknownToken() {
    return unknownToken;
  }

  /**
   * @return the id of {@code token}, the id of the unknown token if it is not part of the vocabulary, {@code null}
   *         if the vocabulary has no unknown token or does not contain it
   */
  @CheckForNull
  public Integer tokenToId(String token) {
    Integer id = idsByToken.get(token);
    if (id == null && unknownToken != null) {
      return idsByToken.get(unknownToken);
    }
    return id;
  }

  /**
   * @return the id of {@code token}, without falling back to the unknown token
   */
  @CheckForNull
  public Integer exactId(String token) {
    return idsByToken.get(token);
  }

  public String idToToken(int id) {
    if (id < 0 || id >= tokens.size()) {
      throw new IllegalArgumentException("Token id " + id + " is out of the vocabulary range [0, " + tokens.size() + ")");
    }
    return tokens.get(id);
  }

  /**
   * @return all tokens, in id order
   */
  public List<String> tokens() {
    return tokens;
  }
}
