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
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.offset.Offset;

/**
 * BERT layout: {@code [CLS] A [SEP]} for a single sequence, {@code [CLS] A [SEP] B [SEP]} for a pair. Token type is
 * 0 up to the first {@code [SEP]} included, 1 afterwards.
 */
public class BertSequenceTemplate implements SequenceTemplate {

  private final int clsId;
  private final int sepId;

  public BertSequenceTemplate(int clsId, int sepId) {
    this.clsId = clsId;
    this.sepId = sepId;
  }

  @Override
  public List<Integer> buildInputs(List<Integer> ids, @Nullable List<Integer> pairIds) {
    List<Integer> res = new ArrayList<>(ids.size() + (pairIds == null ? 2 : pairIds.size() + 3));
    res.add(clsId);
    res.addAll(ids);
    res.add(sepId);
    if (pairIds != null) {
      res.addAll(pairIds);
      res.add(sepId);
    }
    return res;
  }

  @Override
  public List<Integer> createTokenTypeIds(List<Integer> ids, @Nullable List<Integer> pairIds) {
    List<Integer> res = new ArrayList<>(Collections.nCopies(ids.size() + 2, 0));
    if (pairIds != null) {
      res.addAll(Collections.nCopies(pairIds.size() + 1, 1));
    }
    return res;
  }

  @Override
  public List<Offset> buildOffsetMapping(List<Offset> offsets, @Nullable List<Offset> pairOffsets) {
    List<Offset> res = new ArrayList<>();
    res.add(Offset.NONE);
    res.addAll(offsets);
    res.add(Offset.NONE);
    if (pairOffsets != null) {
      res.addAll(pairOffsets);
      res.add(Offset.NONE);
    }
    return res;
  }

  @Override
  public List<Integer> specialTokensMask(List<Integer> ids, @Nullable List<Integer> pairIds) {
    List<Integer> res = new ArrayList<>();
    res.add(1);
    res.addAll(Collections.nCopies(ids.size(), 0));
    res.add(1);
    if (pairIds != null) {
      res.addAll(Collections.nCopies(pairIds.size(), 0));
      res.add(1);
    }
    return res;
  }
}
