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
package org.sonar.java.tokenizer.encoding;

import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.offset.Offset;

/**
 * The model inputs of one encoded sequence or pair of sequences. Only {@link #inputIds()} is always present, the
 * other fields are {@code null} unless requested through {@link EncodingOptions}.
 */
public final class Encoding {

  private final List<Integer> inputIds;
  @Nullable
  private final List<Integer> tokenTypeIds;
  @Nullable
  private final List<Integer> attentionMask;
  @Nullable
  private final List<Integer> specialTokensMask;
  @Nullable
  private final List<Offset> offsetMapping;
  @Nullable
  private final List<Integer> positionIds;
  @Nullable
  private final Integer length;
  @Nullable
  private final Integer overflowToSample;
  @Nullable
  private final List<Integer> overflowingTokens;
  @Nullable
  private final Integer numTruncatedTokens;

  private Encoding(Builder builder) {
    if (builder.inputIds == null) {
      throw new IllegalStateException("inputIds is mandatory");
    }
    this.inputIds = List.copyOf(builder.inputIds);
    this.tokenTypeIds = copyOf(builder.tokenTypeIds);
    this.attentionMask = copyOf(builder.attentionMask);
    this.specialTokensMask = copyOf(builder.specialTokensMask);
    this.offsetMapping = copyOf(builder.offsetMapping);
    this.positionIds = copyOf(builder.positionIds);
    this.length = builder.length;
    this.overflowToSample = builder.overflowToSample;
    this.overflowingTokens = copyOf(builder.overflowingTokens);
    this.numTruncatedTokens = builder.numTruncatedTokens;
  }

  @CheckForNull
  private static <T> List<T> copyOf(@Nullable List<T> list) {
    return list == null ? null : List.copyOf(list);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
      .inputIds(inputIds)
      .tokenTypeIds(tokenTypeIds)
      .attentionMask(attentionMask)
      .specialTokensMask(specialTokensMask)
      .offsetMapping(offsetMapping)
      .positionIds(positionIds)
      .length(length)
      .overflowToSample(overflowToSample)
      .overflowingTokens(overflowingTokens)
      .numTruncatedTokens(numTruncatedTokens);
  }

  public List<Integer> inputIds() {
    return inputIds;
  }

  @CheckForNull
  public List<Integer> tokenTypeIds() {
    return tokenTypeIds;
  }

  @CheckForNull
  public List<Integer> attentionMask() {
    return attentionMask;
  }

  @CheckForNull
  public List<Integer> specialTokensMask() {
    return specialTokensMask;
  }

  @CheckForNull
  public List<Offset> offsetMapping() {
    return offsetMapping;
  }

  @CheckForNull
  public List<Integer> positionIds() {
    return positionIds;
  }

  /**
   * @return number of input ids, padding excluded for batches and included for single encodings
   */
  @CheckForNull
  public Integer length() {
    return length;
  }

  /**
   * @return index in the batch of the example this window of a sliding-window encoding belongs to
   */
  @CheckForNull
  public Integer overflowToSample() {
    return overflowToSample;
  }

  @CheckForNull
  public List<Integer> overflowingTokens() {
    return overflowingTokens;
  }

  @CheckForNull
  public Integer numTruncatedTokens() {
    return numTruncatedTokens;
  }

  @Override
  public String toString() {
    return "Encoding{inputIds=" + inputIds
      + (tokenTypeIds != null ? ", tokenTypeIds=" + tokenTypeIds : "")
      + (attentionMask != null ? ", attentionMask=" + attentionMask : "")
      + (offsetMapping != null ? ", offsetMapping=" + offsetMapping : "")
      + (overflowToSample != null ? ", overflowToSample=" + overflowToSample : "")
      + "}";
  }

  public static final class Builder {
    private List<Integer> inputIds;
    private List<Integer> tokenTypeIds;
    private List<Integer> attentionMask;
    private List<Integer> specialTokensMask;
    private List<Offset> offsetMapping;
    private List<Integer> positionIds;
    private Integer length;
    private Integer overflowToSample;
    private List<Integer> overflowingTokens;
    private Integer numTruncatedTokens;

    private Builder() {
    }

    public Builder inputIds(List<Integer> inputIds) {
      this.inputIds = inputIds;
      return this;
    }

    public Builder tokenTypeIds(@Nullable List<Integer> tokenTypeIds) {
      this.tokenTypeIds = tokenTypeIds;
      return this;
    }

    public Builder attentionMask(@Nullable List<Integer> attentionMask) {
      this.attentionMask = attentionMask;
      return this;
    }

    public Builder specialTokensMask(@Nullable List<Integer> specialTokensMask) {
      this.specialTokensMask = specialTokensMask;
      return this;
    }

    public Builder offsetMapping(@Nullable List<Offset> offsetMapping) {
      this.offsetMapping = offsetMapping;
      return this;
    }

    public Builder positionIds(@Nullable List<Integer> positionIds) {
      this.positionIds = positionIds;
      return this;
    }

    public Builder length(@Nullable Integer length) {
      this.length = length;
      return this;
    }

    public Builder overflowToSample(@Nullable Integer overflowToSample) {
      this.overflowToSample = overflowToSample;
      return this;
    }

    public Builder overflowingTokens(@Nullable List<Integer> overflowingTokens) {
      this.overflowingTokens = overflowingTokens;
      return this;
    }

    public Builder numTruncatedTokens(@Nullable Integer numTruncatedTokens) {
      this.numTruncatedTokens = numTruncatedTokens;
      return this;
    }

    public Encoding build() {
      return new Encoding(this);
    }
  }
}
