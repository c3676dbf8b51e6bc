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
package org.sonar.java.tokenizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;
import org.sonar.java.tokenizer.assembly.Side;

/**
 * Immutable settings of a {@link PretrainedTokenizer}: its special tokens and the behavior of its tokenization and
 * encoding.
 */
public final class TokenizerConfig {

  public static final int DEFAULT_MODEL_MAX_LENGTH = 512;
  public static final String INPUT_IDS = "input_ids";
  public static final String TOKEN_TYPE_IDS = "token_type_ids";
  public static final String ATTENTION_MASK = "attention_mask";

  private final Map<SpecialTokenSlot, AddedToken> specialTokens;
  private final List<AddedToken> additionalSpecialTokens;
  private final boolean doLowerCase;
  @Nullable
  private final Boolean stripAccents;
  private final int modelMaxLength;
  private final Side paddingSide;
  private final Side truncationSide;
  private final int padTokenTypeId;
  private final List<String> modelInputNames;
  private final boolean cleanUpTokenizationSpaces;
  private final boolean verbose;

  private TokenizerConfig(Builder builder) {
    this.specialTokens = Collections.unmodifiableMap(new EnumMap<>(builder.specialTokens));
    this.additionalSpecialTokens = List.copyOf(builder.additionalSpecialTokens);
    this.doLowerCase = builder.doLowerCase;
    this.stripAccents = builder.stripAccents;
    this.modelMaxLength = builder.modelMaxLength;
    this.paddingSide = builder.paddingSide;
    this.truncationSide = builder.truncationSide;
    this.padTokenTypeId = builder.padTokenTypeId;
    this.modelInputNames = List.copyOf(builder.modelInputNames);
    this.cleanUpTokenizationSpaces = builder.cleanUpTokenizationSpaces;
    this.verbose = builder.verbose;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * BERT defaults: {@code [UNK]}, {@code [SEP]}, {@code [PAD]}, {@code [CLS]} and {@code [MASK]}, lower-casing input.
   */
  public static Builder bertDefaults() {
    return builder()
      .specialToken(SpecialTokenSlot.UNK, "[UNK]")
      .specialToken(SpecialTokenSlot.SEP, "[SEP]")
      .specialToken(SpecialTokenSlot.PAD, "[PAD]")
      .specialToken(SpecialTokenSlot.CLS, "[CLS]")
      .specialToken(SpecialTokenSlot.MASK, "[MASK]")
      .doLowerCase(true);
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.specialTokens.putAll(specialTokens);
    builder.additionalSpecialTokens.addAll(additionalSpecialTokens);
    return builder
      .doLowerCase(doLowerCase)
      .stripAccents(stripAccents)
      .modelMaxLength(modelMaxLength)
      .paddingSide(paddingSide)
      .truncationSide(truncationSide)
      .padTokenTypeId(padTokenTypeId)
      .modelInputNames(modelInputNames)
      .cleanUpTokenizationSpaces(cleanUpTokenizationSpaces)
      .verbose(verbose);
  }

  public Optional<AddedToken> specialToken(SpecialTokenSlot slot) {
    return Optional.ofNullable(specialTokens.get(slot));
  }

  /**
   * @return the configured slots, in declaration order of {@link SpecialTokenSlot}
   */
  public Map<SpecialTokenSlot, AddedToken> specialTokens() {
    return specialTokens;
  }

  public List<AddedToken> additionalSpecialTokens() {
    return additionalSpecialTokens;
  }

  public boolean doLowerCase() {
    return doLowerCase;
  }

  /**
   * @return {@code null} when accents are stripped only if the input is lower-cased
   */
  @CheckForNull
  public Boolean stripAccents() {
    return stripAccents;
  }

  public int modelMaxLength() {
    return modelMaxLength;
  }

  public Side paddingSide() {
    return paddingSide;
  }

  public Side truncationSide() {
    return truncationSide;
  }

  public int padTokenTypeId() {
    return padTokenTypeId;
  }

  public List<String> modelInputNames() {
    return modelInputNames;
  }

  public boolean cleanUpTokenizationSpaces() {
    return cleanUpTokenizationSpaces;
  }

  public boolean verbose() {
    return verbose;
  }

  public static final class Builder {
    private final Map<SpecialTokenSlot, AddedToken> specialTokens = new EnumMap<>(SpecialTokenSlot.class);
    private final List<AddedToken> additionalSpecialTokens = new ArrayList<>();
    private boolean doLowerCase = false;
    @Nullable
    private Boolean stripAccents = null;
    private int modelMaxLength = DEFAULT_MODEL_MAX_LENGTH;
    private Side paddingSide = Side.RIGHT;
    private Side truncationSide = Side.RIGHT;
    private int padTokenTypeId = 0;
    private List<String> modelInputNames = List.of(INPUT_IDS, TOKEN_TYPE_IDS, ATTENTION_MASK);
    private boolean cleanUpTokenizationSpaces = true;
    private boolean verbose = true;

    private Builder() {
    }

    /**
     * Sets a special token given without explicit stripping behavior, see {@link AddedToken#plain(String)}.
     */
    public Builder specialToken(SpecialTokenSlot slot, String content) {
      return specialToken(slot, AddedToken.plain(content));
    }

    public Builder specialToken(SpecialTokenSlot slot, @Nullable AddedToken token) {
      if (token == null) {
        specialTokens.remove(slot);
      } else {
        specialTokens.put(slot, token);
      }
      return this;
    }

    public Builder additionalSpecialToken(String content) {
      return additionalSpecialToken(AddedToken.plain(content));
    }

    public Builder additionalSpecialToken(AddedToken token) {
      additionalSpecialTokens.add(token);
      return this;
    }

    public Builder doLowerCase(boolean doLowerCase) {
      this.doLowerCase = doLowerCase;
      return this;
    }

    public Builder stripAccents(@Nullable Boolean stripAccents) {
      this.stripAccents = stripAccents;
      return this;
    }

    public Builder modelMaxLength(int modelMaxLength) {
      if (modelMaxLength <= 0) {
        throw new IllegalArgumentException("modelMaxLength must be strictly positive, got " + modelMaxLength);
      }
      this.modelMaxLength = modelMaxLength;
      return this;
    }

    public Builder paddingSide(Side paddingSide) {
      this.paddingSide = paddingSide;
      return this;
    }

    public Builder truncationSide(Side truncationSide) {
      this.truncationSide = truncationSide;
      return this;
    }

    public Builder padTokenTypeId(int padTokenTypeId) {
      this.padTokenTypeId = padTokenTypeId;
      return this;
    }

    public Builder modelInputNames(List<String> modelInputNames) {
      this.modelInputNames = List.copyOf(modelInputNames);
      return this;
    }

    public Builder cleanUpTokenizationSpaces(boolean cleanUpTokenizationSpaces) {
      this.cleanUpTokenizationSpaces = cleanUpTokenizationSpaces;
      return this;
    }

    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public TokenizerConfig build() {
      return new TokenizerConfig(this);
    }
  }
}
