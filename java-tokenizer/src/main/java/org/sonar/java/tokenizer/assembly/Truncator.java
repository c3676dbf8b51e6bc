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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;
import org.sonar.api.utils.log.Logger;
import org.sonar.api.utils.log.Loggers;

/**
 * Removes tokens from one sequence or a pair of sequences so that they fit a maximum length, keeping the removed
 * tokens, plus {@code stride} tokens of context, as overflowing tokens.
 * <p>
 * Elements are ids or offsets alike: both are truncated the same way to stay aligned.
 */
public class Truncator {

  private static final Logger LOGGER = Loggers.get(Truncator.class);

  private final Side side;

  public Truncator(Side side) {
    this.side = side;
  }

  public Side side() {
    return side;
  }

  public <T> Truncation<T> truncate(List<T> ids, @Nullable List<T> pairIds, int numTokensToRemove, TruncationStrategy strategy, int stride) {
    if (numTokensToRemove <= 0 || strategy == TruncationStrategy.DO_NOT_TRUNCATE) {
      return new Truncation<>(ids, pairIds, List.of());
    }
    switch (strategy) {
      case LONGEST_FIRST:
        return truncateLongestFirst(ids, pairIds, numTokensToRemove, stride);
      case ONLY_FIRST: {
        Removal<T> removal = truncateOnly(ids, numTokensToRemove, stride, "first");
        return removal == null ? new Truncation<>(ids, pairIds, List.of()) : new Truncation<>(removal.kept, pairIds, removal.overflowing);
      }
      case ONLY_SECOND: {
        if (pairIds == null) {
          return new Truncation<>(ids, null, List.of());
        }
        Removal<T> removal = truncateOnly(pairIds, numTokensToRemove, stride, "second");
        return removal == null ? new Truncation<>(ids, pairIds, List.of()) : new Truncation<>(ids, removal.kept, removal.overflowing);
      }
      default:
        throw new IllegalArgumentException("Unsupported truncation strategy " + strategy);
    }
  }

  /**
   * Removes one token at a time from the longest sequence, the second one on equal lengths. Overflowing tokens are
   * the ones removed from the first sequence followed by the ones removed from the second, each run with its
   * {@code stride} tokens of context.
   */
  private <T> Truncation<T> truncateLongestFirst(List<T> ids, @Nullable List<T> pairIds, int numTokensToRemove, int stride) {
    int idsLength = ids.size();
    int pairLength = pairIds == null ? 0 : pairIds.size();
    int removeFromIds = 0;
    int removeFromPair = 0;
    for (int i = 0; i < numTokensToRemove; i++) {
      if (pairIds == null || idsLength > pairLength) {
        if (idsLength == 0) {
          break;
        }
        idsLength--;
        removeFromIds++;
      } else {
        if (pairLength == 0) {
          break;
        }
        pairLength--;
        removeFromPair++;
      }
    }
    List<T> overflowing = new ArrayList<>();
    List<T> keptIds = ids;
    if (removeFromIds > 0) {
      Removal<T> removal = remove(ids, removeFromIds, stride);
      keptIds = removal.kept;
      overflowing.addAll(removal.overflowing);
    }
    List<T> keptPair = pairIds;
    if (pairIds != null && removeFromPair > 0) {
      Removal<T> removal = remove(pairIds, removeFromPair, stride);
      keptPair = removal.kept;
      overflowing.addAll(removal.overflowing);
    }
    return new Truncation<>(keptIds, keptPair, overflowing);
  }

  @CheckForNull
  private <T> Removal<T> truncateOnly(List<T> sequence, int numTokensToRemove, int stride, String which) {
    if (sequence.size() > numTokensToRemove) {
      return remove(sequence, numTokensToRemove, stride);
    }
    LOGGER.error("We need to remove {} tokens to truncate the input but the {} sequence has a length {}. "
      + "Please select another truncation strategy than ONLY_{}, for instance LONGEST_FIRST.",
      numTokensToRemove, which, sequence.size(), which.toUpperCase(Locale.ROOT));
    return null;
  }

  private <T> Removal<T> remove(List<T> sequence, int count, int stride) {
    int windowLength = Math.min(sequence.size(), stride + count);
    int size = sequence.size();
    if (side == Side.LEFT) {
      return new Removal<>(
        new ArrayList<>(sequence.subList(count, size)),
        new ArrayList<>(sequence.subList(0, windowLength)));
    }
    return new Removal<>(
      new ArrayList<>(sequence.subList(0, size - count)),
      new ArrayList<>(sequence.subList(size - windowLength, size)));
  }

  private static final class Removal<T> {
    private final List<T> kept;
    private final List<T> overflowing;

    private Removal(List<T> kept, List<T> overflowing) {
      this.kept = kept;
      this.overflowing = overflowing;
    }
  }

  /**
   * Result of a truncation.
   */
  public static final class Truncation<T> {
    private final List<T> ids;
    @Nullable
    private final List<T> pairIds;
    private final List<T> overflowing;

    public Truncation(List<T> ids, @Nullable List<T> pairIds, List<T> overflowing) {
      this.ids = ids;
      this.pairIds = pairIds;
      this.overflowing = overflowing;
    }

    public List<T> ids() {
      return ids;
    }

    @CheckForNull
    public List<T> pairIds() {
      return pairIds;
    }

    public List<T> overflowing() {
      return overflowing;
    }
  }
}
