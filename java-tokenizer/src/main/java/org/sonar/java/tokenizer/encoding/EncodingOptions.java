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

import javax.annotation.CheckForNull;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.assembly.PaddingStrategy;
import org.sonar.java.tokenizer.assembly.TruncationStrategy;

/**
 * Per-call settings of {@link BatchEncoder}. Defaults add special tokens, neither pad nor truncate, and return the
 * input ids plus the fields listed in the model input names of the tokenizer.
 */
public final class EncodingOptions {

  public static final EncodingOptions DEFAULT = builder().build();

  private final boolean addSpecialTokens;
  private final PaddingStrategy padding;
  private final TruncationStrategy truncation;
  @Nullable
  private final Integer maxLength;
  private final int stride;
  @Nullable
  private final Integer padToMultipleOf;
  private final boolean isSplitIntoWords;
  @Nullable
  private final Boolean returnTokenTypeIds;
  @Nullable
  private final Boolean returnAttentionMask;
  private final boolean returnOverflowingTokens;
  private final boolean returnSpecialTokensMask;
  private final boolean returnOffsetsMapping;
  private final boolean returnPositionIds;
  private final boolean returnLength;

  private EncodingOptions(Builder builder) {
    this.addSpecialTokens = builder.addSpecialTokens;
    this.padding = builder.padding;
    this.truncation = builder.truncation;
    this.maxLength = builder.maxLength;
    this.stride = builder.stride;
    this.padToMultipleOf = builder.padToMultipleOf;
    this.isSplitIntoWords = builder.isSplitIntoWords;
    this.returnTokenTypeIds = builder.returnTokenTypeIds;
    this.returnAttentionMask = builder.returnAttentionMask;
    this.returnOverflowingTokens = builder.returnOverflowingTokens;
    this.returnSpecialTokensMask = builder.returnSpecialTokensMask;
    this.returnOffsetsMapping = builder.returnOffsetsMapping;
    this.returnPositionIds = builder.returnPositionIds;
    this.returnLength = builder.returnLength;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean addSpecialTokens() {
    return addSpecialTokens;
  }

  public PaddingStrategy padding() {
    return padding;
  }

  public TruncationStrategy truncation() {
    return truncation;
  }

  @CheckForNull
  public Integer maxLength() {
    return maxLength;
  }

  public int stride() {
    return stride;
  }

  @CheckForNull
  public Integer padToMultipleOf() {
    return padToMultipleOf;
  }

  public boolean isSplitIntoWords() {
    return isSplitIntoWords;
  }

  /**
   * @return {@code null} to follow the model input names
   */
  @CheckForNull
  public Boolean returnTokenTypeIds() {
    return returnTokenTypeIds;
  }

  /**
   * @return {@code null} to follow the model input names
   */
  @CheckForNull
  public Boolean returnAttentionMask() {
    return returnAttentionMask;
  }

  public boolean returnOverflowingTokens() {
    return returnOverflowingTokens;
  }

  public boolean returnSpecialTokensMask() {
    return returnSpecialTokensMask;
  }

  public boolean returnOffsetsMapping() {
    return returnOffsetsMapping;
  }

  public boolean returnPositionIds() {
    return returnPositionIds;
  }

  public boolean returnLength() {
    return returnLength;
  }

  public static final class Builder {
    private boolean addSpecialTokens = true;
    private PaddingStrategy padding = PaddingStrategy.DO_NOT_PAD;
    private TruncationStrategy truncation = TruncationStrategy.DO_NOT_TRUNCATE;
    private Integer maxLength = null;
    private int stride = 0;
    private Integer padToMultipleOf = null;
    private boolean isSplitIntoWords = false;
    private Boolean returnTokenTypeIds = null;
    private Boolean returnAttentionMask = null;
    private boolean returnOverflowingTokens = false;
    private boolean returnSpecialTokensMask = false;
    private boolean returnOffsetsMapping = false;
    private boolean returnPositionIds = false;
    private boolean returnLength = false;

    private Builder() {
    }

    public Builder addSpecialTokens(boolean addSpecialTokens) {
      this.addSpecialTokens = addSpecialTokens;
      return this;
    }

    public Builder padding(PaddingStrategy padding) {
      this.padding = padding;
      return this;
    }

    public Builder truncation(TruncationStrategy truncation) {
      this.truncation = truncation;
      return this;
    }

    public Builder maxLength(@Nullable Integer maxLength) {
      if (maxLength != null && maxLength < 0) {
        throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
      }
      this.maxLength = maxLength;
      return this;
    }

    public Builder stride(int stride) {
      if (stride < 0) {
        throw new IllegalArgumentException("stride must be positive, got " + stride);
      }
      this.stride = stride;
      return this;
    }

    public Builder padToMultipleOf(@Nullable Integer padToMultipleOf) {
      if (padToMultipleOf != null && padToMultipleOf <= 0) {
        throw new IllegalArgumentException("padToMultipleOf must be strictly positive, got " + padToMultipleOf);
      }
      this.padToMultipleOf = padToMultipleOf;
      return this;
    }

    public Builder isSplitIntoWords(boolean isSplitIntoWords) {
      this.isSplitIntoWords = isSplitIntoWords;
      return this;
    }

    public Builder returnTokenTypeIds(@Nullable Boolean returnTokenTypeIds) {
      this.returnTokenTypeIds = returnTokenTypeIds;
      return this;
    }

    public Builder returnAttentionMask(@Nullable Boolean returnAttentionMask) {
      this.returnAttentionMask = returnAttentionMask;
      return this;
    }

    public Builder returnOverflowingTokens(boolean returnOverflowingTokens) {
      this.returnOverflowingTokens = returnOverflowingTokens;
      return this;
    }

    public Builder returnSpecialTokensMask(boolean returnSpecialTokensMask) {
      this.returnSpecialTokensMask = returnSpecialTokensMask;
      return this;
    }

    public Builder returnOffsetsMapping(boolean returnOffsetsMapping) {
      this.returnOffsetsMapping = returnOffsetsMapping;
      return this;
    }

    public Builder returnPositionIds(boolean returnPositionIds) {
      this.returnPositionIds = returnPositionIds;
      return this;
    }

    public Builder returnLength(boolean returnLength) {
      this.returnLength = returnLength;
      return this;
    }

    public EncodingOptions build() {
      return new EncodingOptions(this);
    }
  }
}
