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
package org.sonar.java.tokenizer.trie;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.sonar.api.utils.log.Logger;
import org.sonar.api.utils.log.Loggers;

/**
 * Prefix tree over a set of marker strings, used to cut a text so that every occurrence of a marker becomes a fragment
 * of its own.
 * <p>
 * {@link #split(String)} is a single left-to-right pass which keeps track of the partial matches currently alive,
 * each one anchored at the offset where it started. As soon as one of them has reached the end of a marker, the
 * partial matches starting no later than it are extended as far as the text allows, the earliest-starting one which
 * completes a marker wins, with its longest reachable marker. Everything up to the end of the match is then committed
 * and never read again.
 * <p>
 * For instance, with markers {@code [CLS]} and {@code extra_id_1}, {@code extra_id_100}:
 * <pre>
 * "[CLS] This is a extra_id_100" -&gt; ["[CLS]", " This is a ", "extra_id_100"]
 * </pre>
 */
public class Trie {

  private static final Logger LOGGER = Loggers.get(Trie.class);

  private final Node root = new Node();
  private int size = 0;

  /**
   * Adds {@code word} to the markers. Empty strings are ignored, they would match everywhere.
   */
  public void add(String word) {
    if (word.isEmpty()) {
      return;
    }
    Node current = root;
    for (char c : word.toCharArray()) {
      current = current.children.computeIfAbsent(c, k -> new Node());
    }
    if (!current.terminal) {
      current.terminal = true;
      size++;
    }
  }

  public int size() {
    return size;
  }

  /**
   * @return the fragments of {@code text}, markers isolated, in order. Their concatenation is {@code text}.
   */
  public List<String> split(String text) {
    // partial matches: start offset -> node reached so far, in ascending start order
    Map<Integer, Node> states = new LinkedHashMap<>();
    List<Integer> offsets = new ArrayList<>();
    offsets.add(0);
    int skip = 0;

    for (int current = 0; current < text.length(); current++) {
      if (current < skip) {
        continue;
      }
      char currentChar = text.charAt(current);
      Set<Integer> toRemove = new HashSet<>();
      boolean reset = false;

      Iterator<Map.Entry<Integer, Node>> iterator = states.entrySet().iterator();
      while (iterator.hasNext()) {
        Map.Entry<Integer, Node> state = iterator.next();
        Node node = state.getValue();
        if (node.terminal) {
          Match match = longestMatch(text, states, toRemove, state.getKey(), current);
          offsets.add(match.start);
          offsets.add(match.end);
          skip = match.end;
          reset = true;
          break;
        }
        Node next = node.children.get(currentChar);
        if (next != null) {
          state.setValue(next);
        } else {
          toRemove.add(state.getKey());
        }
      }

      if (reset) {
        states.clear();
      } else {
        states.keySet().removeAll(toRemove);
      }

      Node first = root.children.get(currentChar);
      if (current >= skip && first != null) {
        states.put(current, first);
      }
    }

    // a marker may end with the text
    for (Map.Entry<Integer, Node> state : states.entrySet()) {
      if (state.getValue().terminal) {
        offsets.add(state.getKey());
        offsets.add(text.length());
        break;
      }
    }
    return cut(text, offsets);
  }

  /**
   * Looks ahead from the partial matches anchored no later than {@code start}, which has just completed a marker. The
   * earlier partial matches have already consumed the character at {@code current}, the one at {@code start} has not.
   */
  private static Match longestMatch(String text, Map<Integer, Node> states, Set<Integer> deadStates, int start, int current) {
    Match match = new Match(start, current);
    for (Map.Entry<Integer, Node> look : states.entrySet()) {
      int lookStart = look.getKey();
      if (lookStart > match.start) {
        break;
      }
      if (deadStates.contains(lookStart)) {
        continue;
      }
      Node lookNode = look.getValue();
      int lookahead = lookStart < match.start ? (current + 1) : current;
      if (lookNode.terminal) {
        match = new Match(lookStart, lookahead);
      }
      while (lookahead < text.length()) {
        Node next = lookNode.children.get(text.charAt(lookahead));
        if (next == null) {
          break;
        }
        lookNode = next;
        lookahead++;
        if (lookNode.terminal) {
          match = new Match(lookStart, lookahead);
        }
      }
    }
    return match;
  }

  private static List<String> cut(String text, List<Integer> offsets) {
    offsets.add(text.length());
    List<String> fragments = new ArrayList<>(offsets.size());
    int start = 0;
    for (int end : offsets) {
      if (start > end) {
        LOGGER.error("Inconsistent cut at offset {} after offset {} while splitting on no-split tokens, ignoring it", end, start);
        continue;
      }
      if (start == end) {
        continue;
      }
      fragments.add(text.substring(start, end));
      start = end;
    }
    return fragments;
  }

  private static final class Match {
    private final int start;
    private final int end;

    private Match(int start, int end) {
      this.start = start;
      this.end = end;
    }
  }

  private static final class Node {
    private final Map<Character, Node> children = new HashMap<>();
    private boolean terminal;
  }
}
