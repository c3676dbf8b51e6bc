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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link BPEEncoder} driven by a merges file, as distributed with the GPT-2 and RoBERTa vocabularies.
 * <p>
 * The merges file is UTF-8 encoded, may start with a {@code #version} line, and then holds one merge per line: the two
 * symbols to merge separated by a blank space. The line order gives the merge priority, first line first.
 * <p>
 * Encoding a word starts from its characters and repeatedly merges the adjacent pair with the best priority, until no
 * adjacent pair is listed in the merges.
 */
public class MergesBPEEncoder implements BPEEncoder {

  private final Map<SymbolPair, Integer> ranks;

  public MergesBPEEncoder(InputStream mergesFile) throws IOException {
    this.ranks = readRanks(mergesFile);
  }

  MergesBPEEncoder(List<String> merges) {
    this.ranks = new HashMap<>();
    for (String merge : merges) {
      addMerge(ranks, merge);
    }
  }

  private static Map<SymbolPair, Integer> readRanks(InputStream mergesFile) throws IOException {
    Map<SymbolPair, Integer> res = new HashMap<>();
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(mergesFile, UTF_8))) {
      String line = reader.readLine();
      if (line != null && line.startsWith("#")) {
        line = reader.readLine();
      }
      while (line != null) {
        if (!line.isBlank()) {
          addMerge(res, line);
        }
        line = reader.readLine();
      }
    }
    return res;
  }

  private static void addMerge(Map<SymbolPair, Integer> ranks, String line) {
    String[] symbols = line.trim().split(" ");
    if (symbols.length != 2) {
      throw new IllegalStateException("Expected two symbols separated by a blank space in merge '" + line + "'");
    }
    ranks.putIfAbsent(new SymbolPair(symbols[0], symbols[1]), ranks.size());
  }

  public int size() {
    return ranks.size();
  }

  @Override
  public List<String> bpeEncode(String word) {
    List<String> symbols = new ArrayList<>(word.length());
    word.chars().forEach(c -> symbols.add(String.valueOf((char) c)));

    while (symbols.size() > 1) {
      SymbolPair best = bestRankedPair(symbols);
      if (best == null) {
        break;
      }
      merge(symbols, best);
    }
    return symbols;
  }

  /**
   * @return the adjacent pair with the lowest rank, the leftmost one on equal ranks, {@code null} if no adjacent pair
   *         is ranked
   */
  private SymbolPair bestRankedPair(List<String> symbols) {
    SymbolPair best = null;
    int bestRank = Integer.MAX_VALUE;
    for (int i = 1; i < symbols.size(); i++) {
      SymbolPair pair = new SymbolPair(symbols.get(i - 1), symbols.get(i));
      Integer rank = ranks.get(pair);
      if (rank != null && rank < bestRank) {
        best = pair;
        bestRank = rank;
      }
    }
    return best;
  }

  /**
   * Replaces in place every non-overlapping occurrence of {@code target}, scanning left to right, by its merge.
   */
  private static void merge(List<String> symbols, SymbolPair target) {
    String[] merged = new String[symbols.size()];
    int count = 0;
    int i = 0;
    while (i < symbols.size()) {
      if (i + 1 < symbols.size() && target.matches(symbols.get(i), symbols.get(i + 1))) {
        merged[count++] = target.merge();
        i += 2;
      } else {
        merged[count++] = symbols.get(i);
        i++;
      }
    }
    symbols.clear();
    symbols.addAll(Arrays.asList(merged).subList(0, count));
  }

  private static final class SymbolPair {
    private final String left;
    private final String right;

    private SymbolPair(String left, String right) {
      this.left = left;
      this.right = right;
    }

    boolean matches(String otherLeft, String otherRight) {
      return left.equals(otherLeft) && right.equals(otherRight);
    }

    String merge() {
      return left + right;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      SymbolPair other = (SymbolPair) o;
      return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, right);
    }

    @Override
    public String toString() {
      return "{" + left + " " + right + "}";
    }
  }
}
