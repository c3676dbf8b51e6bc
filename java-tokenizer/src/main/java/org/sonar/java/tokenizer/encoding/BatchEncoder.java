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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;
import org.sonar.api.utils.log.Logger;
import org.sonar.api.utils.log.Loggers;
import org.sonar.java.tokenizer.PretrainedTokenizer;
import org.sonar.java.tokenizer.TokenizerConfig;
import org.sonar.java.tokenizer.assembly.Padder;
import org.sonar.java.tokenizer.assembly.PaddingStrategy;
import org.sonar.java.tokenizer.assembly.SequenceTemplate;
import org.sonar.java.tokenizer.assembly.Truncator;
import org.sonar.java.tokenizer.assembly.TruncationStrategy;
import org.sonar.java.tokenizer.offset.Offset;

/**
 * Turns texts, or pairs of texts, into model inputs: ids with special tokens, truncated to a maximum length, padded as
 * a batch, plus the optional fields requested through {@link EncodingOptions}.
 * <p>
 * When a pair is encoded with a positive {@code stride}, the second sequence is not truncated but covered by windows
 * of the width left by the first sequence, consecutive windows overlapping by {@code stride} ids. Each window is a
 * separate {@link Encoding} tagged with the index of its example.
 */
public class BatchEncoder {

  private static final Logger LOGGER = Loggers.get(BatchEncoder.class);

  private final PretrainedTokenizer tokenizer;
  private boolean longSequenceWarned = false;

  public BatchEncoder(PretrainedTokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  public Encoding encode(EncodeInput text, @Nullable EncodeInput pair, EncodingOptions options) {
    checkTokenTypeIds(options);
    Integer maxLength = resolveMaxLength(options);
    List<Integer> ids = inputIds(text, options);
    List<Integer> pairIds = pair == null ? null : inputIds(pair, options);

    Encoding encoding = prepareForModel(ids, pairIds, text, pair, options, maxLength).build();
    encoding = pad(List.of(encoding), options, maxLength).get(0);
    if (options.returnLength()) {
      encoding = encoding.toBuilder().length(encoding.inputIds().size()).build();
    }
    return encoding;
  }

  /**
   * @param pairs second sequences, one per input, or {@code null} to encode single sequences
   */
  public BatchEncoding batchEncode(List<EncodeInput> inputs, @Nullable List<EncodeInput> pairs, EncodingOptions options) {
    if (inputs.isEmpty()) {
      throw new IllegalArgumentException("text: the batch is empty");
    }
    if (pairs != null && pairs.size() != inputs.size()) {
      throw new IllegalArgumentException("textPair: expected " + inputs.size() + " second sequences but got " + pairs.size());
    }
    checkTokenTypeIds(options);
    Integer maxLength = resolveMaxLength(options);

    List<Encoding> encodings = new ArrayList<>();
    for (int exampleId = 0; exampleId < inputs.size(); exampleId++) {
      EncodeInput text = inputs.get(exampleId);
      EncodeInput pair = pairs == null ? null : pairs.get(exampleId);
      List<Integer> ids = inputIds(text, options);
      List<Integer> pairIds = pair == null ? null : inputIds(pair, options);

      if (options.stride() > 0 && pair != null) {
        encodings.addAll(slidingWindows(exampleId, ids, pairIds, text, pair, options, maxLength));
      } else {
        Encoding.Builder builder = prepareForModel(ids, pairIds, text, pair, options, maxLength);
        Encoding encoding = builder.build();
        if (options.returnLength()) {
          encoding = builder.length(encoding.inputIds().size()).build();
        }
        encodings.add(encoding);
      }
    }
    return new BatchEncoding(pad(encodings, options, maxLength));
  }

  private List<Encoding> slidingWindows(int exampleId, List<Integer> firstIds, List<Integer> secondIds, EncodeInput text, EncodeInput pair,
    EncodingOptions options, @Nullable Integer maxLength) {
    if (maxLength == null) {
      throw new IllegalArgumentException("maxLength: a maximum length is required to encode a pair with a stride");
    }
    SequenceTemplate template = tokenizer.sequenceTemplate();
    int maxLenForPair = maxLength - firstIds.size() - (options.addSpecialTokens() ? template.numSpecialTokensToAdd(true) : 0);
    if (maxLenForPair <= 0) {
      throw new IllegalArgumentException("maxLength: " + maxLength + " leaves no room for the second sequence after the "
        + firstIds.size() + " ids of the first one");
    }
    List<Offset> offsets = null;
    List<Offset> pairOffsets = null;
    if (options.returnOffsetsMapping()) {
      offsets = offsetMapping(text);
      pairOffsets = offsetMapping(pair);
    }
    boolean returnTokenTypeIds = returnTokenTypeIds(options);

    List<Encoding> windows = new ArrayList<>();
    int offset = 0;
    while (offset < secondIds.size()) {
      int length = Math.min(secondIds.size() - offset, maxLenForPair);
      List<Integer> pairIds = secondIds.subList(offset, offset + length);

      Encoding.Builder builder = Encoding.builder();
      List<Integer> sequence;
      if (options.addSpecialTokens()) {
        sequence = template.buildInputs(firstIds, pairIds);
        if (returnTokenTypeIds) {
          builder.tokenTypeIds(template.createTokenTypeIds(firstIds, pairIds));
        }
        if (offsets != null) {
          builder.offsetMapping(template.buildOffsetMapping(offsets, pairOffsets.subList(offset, offset + length)));
        }
      } else {
        sequence = concat(firstIds, pairIds);
        if (returnTokenTypeIds) {
          builder.tokenTypeIds(zeros(sequence.size()));
        }
        if (offsets != null) {
          builder.offsetMapping(concat(offsets, pairOffsets.subList(offset, offset + length)));
        }
      }
      builder.inputIds(sequence);
      if (options.returnSpecialTokensMask()) {
        builder.specialTokensMask(options.addSpecialTokens() ? template.specialTokensMask(firstIds, pairIds) : zeros(sequence.size()));
      }
      if (options.returnPositionIds()) {
        builder.positionIds(positions(sequence.size()));
      }
      if (options.returnLength()) {
        builder.length(sequence.size());
      }
      builder.overflowToSample(exampleId);
      windows.add(builder.build());

      if (offset + length == secondIds.size()) {
        break;
      }
      offset += Math.min(length, options.stride());
    }
    return windows;
  }

  private Encoding.Builder prepareForModel(List<Integer> firstIds, @Nullable List<Integer> secondIds, EncodeInput text, @Nullable EncodeInput pair,
    EncodingOptions options, @Nullable Integer maxLength) {
    SequenceTemplate template = tokenizer.sequenceTemplate();
    Truncator truncator = tokenizer.truncator();
    boolean hasPair = secondIds != null;
    int totalLength = firstIds.size() + (hasPair ? secondIds.size() : 0)
      + (options.addSpecialTokens() ? template.numSpecialTokensToAdd(hasPair) : 0);
    boolean truncates = maxLength != null && totalLength > maxLength
      && options.truncation() != TruncationStrategy.DO_NOT_TRUNCATE;

    List<Integer> ids = firstIds;
    List<Integer> pairIds = secondIds;
    List<Integer> overflowing = List.of();
    if (truncates) {
      Truncator.Truncation<Integer> truncation = truncator.truncate(ids, pairIds, totalLength - maxLength, options.truncation(), options.stride());
      ids = truncation.ids();
      pairIds = truncation.pairIds();
      overflowing = truncation.overflowing();
    }

    Encoding.Builder builder = Encoding.builder();
    if (options.returnOverflowingTokens()) {
      builder.overflowingTokens(overflowing);
      builder.numTruncatedTokens(truncates ? (totalLength - maxLength) : 0);
    }

    List<Integer> sequence;
    List<Integer> tokenTypeIds;
    if (options.addSpecialTokens()) {
      sequence = template.buildInputs(ids, pairIds);
      tokenTypeIds = template.createTokenTypeIds(ids, pairIds);
    } else {
      sequence = concat(ids, pairIds);
      tokenTypeIds = zeros(sequence.size());
    }
    builder.inputIds(sequence);
    if (returnTokenTypeIds(options)) {
      builder.tokenTypeIds(tokenTypeIds);
    }
    if (options.returnSpecialTokensMask()) {
      builder.specialTokensMask(options.addSpecialTokens() ? template.specialTokensMask(ids, pairIds) : zeros(sequence.size()));
    }
    if (options.returnOffsetsMapping()) {
      List<Offset> offsets = offsetMapping(text);
      List<Offset> pairOffsets = pair == null ? null : offsetMapping(pair);
      if (truncates) {
        Truncator.Truncation<Offset> truncation = truncator.truncate(offsets, pairOffsets, totalLength - maxLength, options.truncation(), options.stride());
        offsets = truncation.ids();
        pairOffsets = truncation.pairIds();
      }
      builder.offsetMapping(options.addSpecialTokens() ? template.buildOffsetMapping(offsets, pairOffsets) : concat(offsets, pairOffsets));
    }
    warnAboutTooLongSequence(sequence, maxLength);
    if (options.returnPositionIds()) {
      builder.positionIds(positions(sequence.size()));
    }
    return builder;
  }

  private List<Encoding> pad(List<Encoding> encodings, EncodingOptions options, @Nullable Integer maxLength) {
    boolean returnAttentionMask = options.returnAttentionMask() != null
      ? options.returnAttentionMask()
      : tokenizer.config().modelInputNames().contains(TokenizerConfig.ATTENTION_MASK);
    Integer target = Padder.targetLength(
      encodings.stream().map(e -> e.inputIds().size()).collect(Collectors.toList()),
      options.padding(), maxLength, options.padToMultipleOf());
    if (target == null && !returnAttentionMask) {
      return encodings;
    }
    Integer padId = null;
    if (target != null) {
      padId = tokenizer.padTokenId();
      if (padId == null) {
        throw new IllegalArgumentException("padding: asking to pad but the tokenizer does not have a padding token");
      }
    }

    Padder padder = tokenizer.padder();
    int padTypeId = tokenizer.config().padTokenTypeId();
    List<Encoding> padded = new ArrayList<>(encodings.size());
    for (Encoding encoding : encodings) {
      int length = encoding.inputIds().size();
      int targetLength = target == null ? length : target;
      Encoding.Builder builder = encoding.toBuilder();
      if (returnAttentionMask) {
        builder.attentionMask(padder.attentionMask(length, targetLength));
      }
      if (padId != null) {
        builder.inputIds(padder.pad(encoding.inputIds(), targetLength, padId));
        if (encoding.tokenTypeIds() != null) {
          builder.tokenTypeIds(padder.pad(encoding.tokenTypeIds(), targetLength, padTypeId));
        }
        if (encoding.specialTokensMask() != null) {
          builder.specialTokensMask(padder.pad(encoding.specialTokensMask(), targetLength, 1));
        }
        if (encoding.offsetMapping() != null) {
          builder.offsetMapping(padder.pad(encoding.offsetMapping(), targetLength, Offset.NONE));
        }
        if (encoding.positionIds() != null) {
          builder.positionIds(padder.pad(encoding.positionIds(), targetLength, 0));
        }
      }
      padded.add(builder.build());
    }
    return padded;
  }

  private List<Integer> inputIds(EncodeInput input, EncodingOptions options) {
    switch (input.kind()) {
      case TEXT:
        return toIds(tokenizer.tokenize(input.text()), input);
      case STRINGS:
        List<String> tokens = options.isSplitIntoWords() ? tokenizer.tokenize(input.strings()) : input.strings();
        return toIds(tokens, input);
      default:
        return input.ids();
    }
  }

  private List<Integer> toIds(List<String> tokens, EncodeInput input) {
    List<Integer> ids = tokenizer.convertTokensToIds(tokens);
    for (int i = 0; i < ids.size(); i++) {
      if (ids.get(i) == null) {
        throw new IllegalStateException("Token '" + tokens.get(i) + "' of input '" + input + "' has no id and the tokenizer has no unknown token");
      }
    }
    return ids;
  }

  private List<Offset> offsetMapping(EncodeInput input) {
    if (input.kind() != EncodeInput.Kind.TEXT) {
      throw new IllegalArgumentException("returnOffsetsMapping: offsets can only be computed for text inputs, got " + input.kind());
    }
    return tokenizer.getOffsetMapping(input.text());
  }

  private boolean returnTokenTypeIds(EncodingOptions options) {
    return options.returnTokenTypeIds() != null
      ? options.returnTokenTypeIds()
      : tokenizer.config().modelInputNames().contains(TokenizerConfig.TOKEN_TYPE_IDS);
  }

  private static void checkTokenTypeIds(EncodingOptions options) {
    if (Boolean.TRUE.equals(options.returnTokenTypeIds()) && !options.addSpecialTokens()) {
      throw new IllegalArgumentException("returnTokenTypeIds: asking to return token type ids while setting addSpecialTokens to false "
        + "results in an undefined behavior. Please set addSpecialTokens to true or returnTokenTypeIds to null.");
    }
  }

  /**
   * @return the requested maximum length, or the model one when padding or truncating to a maximum length
   */
  @CheckForNull
  private Integer resolveMaxLength(EncodingOptions options) {
    if (options.maxLength() != null) {
      return options.maxLength();
    }
    if (options.padding() == PaddingStrategy.MAX_LENGTH || options.truncation() != TruncationStrategy.DO_NOT_TRUNCATE) {
      return tokenizer.config().modelMaxLength();
    }
    return null;
  }

  private void warnAboutTooLongSequence(List<Integer> ids, @Nullable Integer maxLength) {
    int modelMaxLength = tokenizer.config().modelMaxLength();
    if (maxLength == null && ids.size() > modelMaxLength && tokenizer.config().verbose() && !longSequenceWarned) {
      LOGGER.warn("Token indices sequence length is longer than the specified maximum sequence length for this model ({} > {}). "
        + "Running this sequence through the model will result in indexing errors", ids.size(), modelMaxLength);
      longSequenceWarned = true;
    }
  }

  private static <T> List<T> concat(List<T> first, @Nullable List<T> second) {
    List<T> res = new ArrayList<>(first);
    if (second != null) {
      res.addAll(second);
    }
    return res;
  }

  private static List<Integer> zeros(int size) {
    return new ArrayList<>(Collections.nCopies(size, 0));
  }

  private static List<Integer> positions(int size) {
    return IntStream.range(0, size).boxed().collect(Collectors.toList());
  }
}
