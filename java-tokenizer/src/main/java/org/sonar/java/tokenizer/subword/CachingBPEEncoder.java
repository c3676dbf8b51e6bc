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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link BPEEncoder} which remembers every encoding computed by its delegate. Pre-tokens repeat a lot in natural
 * text, so the cache is unbounded.
 * <p>
 * Safe for concurrent use, the delegate being called at most once per word.
 */
public class CachingBPEEncoder implements BPEEncoder {
  private final BPEEncoder delegate;
  private final Map<String, List<String>> cache = new ConcurrentHashMap<>();
  private final AtomicLong lookups = new AtomicLong();

  public CachingBPEEncoder(BPEEncoder delegate) {
    this.delegate = delegate;
  }

  @Override
  public List<String> bpeEncode(String word) {
    lookups.incrementAndGet();
    return cache.computeIfAbsent(word, w -> List.copyOf(delegate.bpeEncode(w)));
  }

  public int size() {
    return cache.size();
  }

  /**
   * @return number of encodings served from the cache
   */
  public long hits() {
    return lookups.get() - cache.size();
  }

  public void clear() {
    cache.clear();
    lookups.set(0);
  }
}
