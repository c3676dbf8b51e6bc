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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.CheckForNull;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.sonar.api.utils.log.Logger;
import org.sonar.api.utils.log.Loggers;
import org.sonar.java.tokenizer.assembly.BertSequenceTemplate;
import org.sonar.java.tokenizer.assembly.Padder;
import org.sonar.java.tokenizer.assembly.PlainSequenceTemplate;
import org.sonar.java.tokenizer.assembly.SequenceTemplate;
import org.sonar.java.tokenizer.assembly.TokenizationCleanup;
import org.sonar.java.tokenizer.assembly.Truncator;
import org.sonar.java.tokenizer.encoding.BatchEncoder;
import org.sonar.java.tokenizer.encoding.BatchEncoding;
import org.sonar.java.tokenizer.encoding.EncodeInput;
import org.sonar.java.tokenizer.encoding.Encoding;
import org.sonar.java.tokenizer.encoding.EncodingOptions;
import org.sonar.java.tokenizer.offset.Offset;
import org.sonar.java.tokenizer.offset.OffsetMapper;
import org.sonar.java.tokenizer.subword.BasicTokenizer;
import org.sonar.java.tokenizer.subword.ByteLevelBpeTokenizer;
import org.sonar.java.tokenizer.subword.SubwordTokenizer;
import org.sonar.java.tokenizer.subword.WordPieceTokenizer;
import org.sonar.java.tokenizer.text.TextPreprocessor;
import org.sonar.java.tokenizer.vocabulary.NoSplitTokens;
import org.sonar.java.tokenizer.vocabulary.Vocabulary;
import org.sonar.java.tokenizer.vocabulary.VocabularyOverlay;

/**
 * Tokenizer of a pretrained model: turns text into tokens and ids, never splitting the special and added tokens, and
 * back.
 * <p>
 * Tokenization runs in this order:
 * <ol>
 *   <li>the model-specific {@link TextPreprocessor}</li>
 *   <li>lower-casing, when configured, of everything but the no-split and special tokens</li>
 *   <li>split of the text around the no-split tokens</li>
 *   <li>whitespace stripping around the no-split tokens, following their {@link AddedToken} flags</li>
 *   <li>{@link SubwordTokenizer} on the remaining runs of text</li>
 * </ol>
 * <p>
 * Instances are not thread-safe while tokens are being added. Once tokens are no longer added, tokenization and
 * encoding can be called from multiple threads.
 */
public class PretrainedTokenizer {

  private static final Logger LOGGER = Loggers.get(PretrainedTokenizer.class);

  private final TokenizerConfig config;
  private final VocabularyOverlay vocabulary;
  private final NoSplitTokens noSplitTokens;
  private final SubwordTokenizer subwordTokenizer;
  private final TextPreprocessor preprocessor;
  private final Truncator truncator;
  private final Padder padder;
  private final OffsetMapper offsetMapper;
  private final List<AddedToken> additionalSpecialTokens = new ArrayList<>();
  private final Map<String, AddedToken> addedTokensMetadata = new HashMap<>();
  private final SequenceTemplate sequenceTemplate;
  private final BatchEncoder batchEncoder;
  @Nullable
  private Pattern protectedTokensPattern;

  /**
   * Builds the tokenizer and registers all the special tokens of {@code config} as no-split tokens, adding to the
   * vocabulary the ones it does not know.
   *
   * @param templateFactory creates the layout of special tokens once they all have an id
   */
  public PretrainedTokenizer(TokenizerConfig config, Vocabulary vocabulary, SubwordTokenizer subwordTokenizer, TextPreprocessor preprocessor,
    Function<PretrainedTokenizer, SequenceTemplate> templateFactory) {
    this.config = config;
    this.vocabulary = new VocabularyOverlay(vocabulary, config.specialToken(SpecialTokenSlot.UNK).map(AddedToken::content).orElse(null));
    this.noSplitTokens = new NoSplitTokens(config.doLowerCase(), this::isSpecialToken);
    this.subwordTokenizer = subwordTokenizer;
    this.preprocessor = preprocessor;
    this.truncator = new Truncator(config.truncationSide());
    this.padder = new Padder(config.paddingSide());
    boolean stripAccents = config.stripAccents() != null ? config.stripAccents() : config.doLowerCase();
    this.offsetMapper = new OffsetMapper(preprocessor, config.doLowerCase(), stripAccents, subwordTokenizer.continuationPrefix().orElse(null));
    this.additionalSpecialTokens.addAll(config.additionalSpecialTokens());
    addAddedTokens(allSpecialTokensExtended(), true);
    this.sequenceTemplate = templateFactory.apply(this);
    this.batchEncoder = new BatchEncoder(this);
  }

  /**
   * BERT tokenizer: WordPiece sub-words, {@code [CLS] A [SEP] B [SEP]} layout.
   */
  public static PretrainedTokenizer wordPiece(TokenizerConfig config, Vocabulary vocabulary) {
    return wordPiece(config, vocabulary, TextPreprocessor.IDENTITY);
  }

  public static PretrainedTokenizer wordPiece(TokenizerConfig config, Vocabulary vocabulary, TextPreprocessor preprocessor) {
    String unknownToken = config.specialToken(SpecialTokenSlot.UNK)
      .map(AddedToken::content)
      .orElseThrow(() -> new IllegalArgumentException("unk_token: WordPiece requires an unknown token"));
    Set<String> neverSplit = config.specialTokens().values().stream().map(AddedToken::content).collect(Collectors.toCollection(HashSet::new));
    config.additionalSpecialTokens().forEach(t -> neverSplit.add(t.content()));
    BasicTokenizer basicTokenizer = new BasicTokenizer(config.doLowerCase(), config.stripAccents(), neverSplit);
    return new PretrainedTokenizer(config, vocabulary, new WordPieceTokenizer(vocabulary, basicTokenizer, unknownToken), preprocessor,
      t -> new BertSequenceTemplate(t.requireSpecialTokenId(SpecialTokenSlot.CLS), t.requireSpecialTokenId(SpecialTokenSlot.SEP)));
  }

  /**
   * GPT-2 style tokenizer: byte-level BPE sub-words, no special token around sequences.
   */
  public static PretrainedTokenizer byteLevelBpe(TokenizerConfig config, Vocabulary vocabulary, InputStream mergesFile) throws IOException {
    return new PretrainedTokenizer(config, vocabulary, ByteLevelBpeTokenizer.fromMerges(mergesFile), TextPreprocessor.IDENTITY,
      t -> PlainSequenceTemplate.INSTANCE);
  }

  public TokenizerConfig config() {
    return config;
  }

  public SequenceTemplate sequenceTemplate() {
    return sequenceTemplate;
  }

  public Truncator truncator() {
    return truncator;
  }

  public Padder padder() {
    return padder;
  }

  public SubwordTokenizer subwordTokenizer() {
    return subwordTokenizer;
  }

  /**
   * @return size of the base vocabulary, added tokens excluded
   */
  public int vocabSize() {
    return vocabulary.base().size();
  }

  /**
   * @return size of the full vocabulary, added tokens included
   */
  public int size() {
    return vocabulary.size();
  }

  public Map<String, Integer> addedVocabulary() {
    return vocabulary.addedVocabulary();
  }

  /**
   * @return the no-split tokens, sorted
   */
  public Set<String> noSplitTokens() {
    return noSplitTokens.tokens();
  }

  // Special tokens

  @CheckForNull
  public String specialToken(SpecialTokenSlot slot) {
    return config.specialToken(slot).map(AddedToken::content).orElse(null);
  }

  @CheckForNull
  public Integer specialTokenId(SpecialTokenSlot slot) {
    String token = specialToken(slot);
    return token == null ? null : convertTokenToId(token);
  }

  int requireSpecialTokenId(SpecialTokenSlot slot) {
    Integer id = specialTokenId(slot);
    if (id == null) {
      throw new IllegalStateException(slot.key() + " is not set");
    }
    return id;
  }

  @CheckForNull
  public String unknownToken() {
    return vocabulary.unknownToken();
  }

  @CheckForNull
  public Integer padTokenId() {
    return specialTokenId(SpecialTokenSlot.PAD);
  }

  public List<AddedToken> additionalSpecialTokens() {
    return List.copyOf(additionalSpecialTokens);
  }

  /**
   * @return the special tokens of each configured slot, by slot key
   */
  public Map<String, String> specialTokensMap() {
    Map<String, String> res = new LinkedHashMap<>();
    config.specialTokens().forEach((slot, token) -> res.put(slot.key(), token.content()));
    return res;
  }

  /**
   * @return the special tokens of the slots followed by the additional ones, without duplicates
   */
  public List<AddedToken> allSpecialTokensExtended() {
    Map<String, AddedToken> res = new LinkedHashMap<>();
    config.specialTokens().values().forEach(t -> res.putIfAbsent(t.content(), t));
    additionalSpecialTokens.forEach(t -> res.putIfAbsent(t.content(), t));
    return new ArrayList<>(res.values());
  }

  public List<String> allSpecialTokens() {
    return allSpecialTokensExtended().stream().map(AddedToken::content).collect(Collectors.toList());
  }

  public List<Integer> allSpecialIds() {
    return convertTokensToIds(allSpecialTokens());
  }

  public boolean isSpecialToken(String token) {
    if (additionalSpecialTokens.stream().anyMatch(t -> t.content().equals(token))) {
      return true;
    }
    return config.specialTokens().values().stream().anyMatch(t -> t.content().equals(token));
  }

  // Added tokens

  /**
   * Same as {@link #addTokens(List, boolean)} with {@code special} set to {@code false}.
   */
  public int addTokens(List<String> newTokens) {
    return addTokens(newTokens, false);
  }

  /**
   * Adds to the vocabulary the tokens it does not know yet, in the order given, each one once. Non-special tokens are
   * lower-cased first when the tokenizer lower-cases its input.
   * <p>
   * Special tokens all become no-split tokens, even the ones already known. Non-special tokens become no-split tokens
   * only when actually added.
   *
   * @return the number of tokens actually added to the vocabulary
   * @throws NullPointerException if a token is {@code null}, before anything is added
   */
  public int addTokens(List<String> newTokens, boolean special) {
    checkNoNullToken(newTokens);
    return doAddTokens(newTokens, null, special);
  }

  /**
   * Same as {@link #addTokens(List, boolean)}, the {@link AddedToken} flags driving the whitespace stripping around
   * each token.
   */
  public int addAddedTokens(List<AddedToken> newTokens, boolean special) {
    checkNoNullToken(newTokens);
    return doAddTokens(newTokens.stream().map(AddedToken::content).collect(Collectors.toList()), newTokens, special);
  }

  /**
   * Registers {@code newTokens} as additional special tokens and adds them as special tokens.
   *
   * @return the number of tokens actually added to the vocabulary
   */
  public int addSpecialTokens(List<AddedToken> newTokens) {
    checkNoNullToken(newTokens);
    for (AddedToken token : newTokens) {
      if (!isSpecialToken(token.content())) {
        additionalSpecialTokens.add(token);
      }
    }
    return addAddedTokens(newTokens, true);
  }

  /**
   * Restores tokens saved with their ids, as read by {@link TokenizerConfigReader#readAddedTokens(InputStream)}.
   */
  public void restoreAddedTokens(Map<String, Integer> addedTokens) {
    vocabulary.restore(addedTokens);
    noSplitTokens.addAll(addedTokens.keySet());
    protectedTokensPattern = buildProtectedTokensPattern();
  }

  private static void checkNoNullToken(List<?> newTokens) {
    Objects.requireNonNull(newTokens, "newTokens");
    for (int i = 0; i < newTokens.size(); i++) {
      Objects.requireNonNull(newTokens.get(i), () -> "newTokens: token is not a string but null");
    }
  }

  private int doAddTokens(List<String> contents, @Nullable List<AddedToken> metadata, boolean special) {
    List<String> candidates = new ArrayList<>(contents.size());
    for (String content : contents) {
      if (!special && config.doLowerCase() && !isSpecialToken(content)) {
        candidates.add(content.toLowerCase(Locale.ROOT));
      } else {
        candidates.add(content);
      }
    }
    List<String> added = vocabulary.add(candidates);
    if (config.verbose()) {
      added.forEach(token -> LOGGER.debug("Adding {} to the vocabulary", token));
    }
    if (metadata != null) {
      for (int i = 0; i < candidates.size(); i++) {
        String candidate = candidates.get(i);
        if (special || added.contains(candidate)) {
          addedTokensMetadata.put(candidate, metadata.get(i));
        }
      }
    }
    noSplitTokens.addAll(special ? candidates : added);
    protectedTokensPattern = buildProtectedTokensPattern();
    return added.size();
  }

  /**
   * @return a pattern matching any no-split or special token, longest first, {@code null} when there is none
   */
  @CheckForNull
  private Pattern buildProtectedTokensPattern() {
    Set<String> tokens = new LinkedHashSet<>(noSplitTokens.tokens());
    tokens.addAll(allSpecialTokens());
    tokens.remove("");
    if (tokens.isEmpty()) {
      return null;
    }
    String alternatives = tokens.stream()
      .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
      .map(Pattern::quote)
      .collect(Collectors.joining("|"));
    return Pattern.compile(alternatives);
  }

  // Tokenization

  public List<String> tokenize(String text) {
    return runPipeline(text, false);
  }

  /**
   * Tokenizes pre-split words one by one.
   */
  public List<String> tokenize(Collection<String> words) {
    List<String> tokens = new ArrayList<>();
    for (String word : words) {
      tokens.addAll(tokenize(word));
    }
    return tokens;
  }

  private List<String> runPipeline(String text, boolean forAlignment) {
    String prepared = preprocessor.prepare(text);
    if (config.doLowerCase()) {
      prepared = lowerCaseUnprotected(prepared);
    }
    List<String> fragments = new ArrayList<>(noSplitTokens.split(prepared));
    stripAroundNoSplitTokens(fragments);

    List<String> tokens = new ArrayList<>();
    for (String fragment : fragments) {
      if (fragment.isEmpty()) {
        continue;
      }
      if (noSplitTokens.contains(fragment)) {
        tokens.add(fragment);
      } else if (forAlignment) {
        tokens.addAll(subwordTokenizer.alignmentTokens(fragment));
      } else {
        tokens.addAll(subwordTokenizer.tokenize(fragment));
      }
    }
    return tokens;
  }

  private String lowerCaseUnprotected(String text) {
    Pattern pattern = protectedTokensPattern;
    if (pattern == null) {
      return text.toLowerCase(Locale.ROOT);
    }
    StringBuilder res = new StringBuilder(text.length());
    Matcher matcher = pattern.matcher(text);
    int last = 0;
    while (matcher.find()) {
      res.append(text.substring(last, matcher.start()).toLowerCase(Locale.ROOT));
      res.append(matcher.group());
      last = matcher.end();
    }
    res.append(text.substring(last).toLowerCase(Locale.ROOT));
    return res.toString();
  }

  /**
   * A no-split token absorbs the whitespace of its plain neighbors: by default on both sides, otherwise as its
   * {@link AddedToken#lstrip()} and {@link AddedToken#rstrip()} flags say.
   */
  private void stripAroundNoSplitTokens(List<String> fragments) {
    for (int i = 0; i < fragments.size(); i++) {
      String fragment = fragments.get(i);
      if (!noSplitTokens.contains(fragment)) {
        continue;
      }
      AddedToken metadata = addedTokensMetadata.get(fragment);
      boolean lstrip = metadata == null || metadata.lstrip();
      boolean rstrip = metadata == null || metadata.rstrip();
      if (rstrip && i + 1 < fragments.size() && !noSplitTokens.contains(fragments.get(i + 1))) {
        fragments.set(i + 1, StringUtils.stripStart(fragments.get(i + 1), null));
      }
      if (lstrip && i > 0 && !noSplitTokens.contains(fragments.get(i - 1))) {
        fragments.set(i - 1, StringUtils.stripEnd(fragments.get(i - 1), null));
      }
    }
  }

  // Conversions

  /**
   * @return the id of {@code token}, the id of the unknown token if it is not known, {@code null} if there is no
   *         unknown token
   */
  @CheckForNull
  public Integer convertTokenToId(String token) {
    return vocabulary.tokenToId(token);
  }

  public List<Integer> convertTokensToIds(List<String> tokens) {
    List<Integer> ids = new ArrayList<>(tokens.size());
    tokens.forEach(token -> ids.add(convertTokenToId(token)));
    return ids;
  }

  public String convertIdToToken(int id) {
    return vocabulary.idToToken(id);
  }

  public List<String> convertIdsToTokens(List<Integer> ids) {
    return convertIdsToTokens(ids, false);
  }

  public List<String> convertIdsToTokens(List<Integer> ids, boolean skipSpecialTokens) {
    Set<Integer> specialIds = skipSpecialTokens ? new HashSet<>(allSpecialIds()) : Set.of();
    List<String> tokens = new ArrayList<>(ids.size());
    for (Integer id : ids) {
      if (!specialIds.contains(id)) {
        tokens.add(convertIdToToken(id));
      }
    }
    return tokens;
  }

  public String convertTokensToString(List<String> tokens) {
    return subwordTokenizer.detokenize(tokens);
  }

  /**
   * @return the text of {@code ids}, cleaned up if configured so
   */
  public String decode(List<Integer> ids) {
    return decode(ids, false, config.cleanUpTokenizationSpaces(), true);
  }

  /**
   * Added tokens are decoded as they are, the runs of other tokens through the {@link SubwordTokenizer}.
   *
   * @param spacesBetweenSpecialTokens whether the decoded runs are joined with a space
   */
  public String decode(List<Integer> ids, boolean skipSpecialTokens, boolean cleanUpTokenizationSpaces, boolean spacesBetweenSpecialTokens) {
    List<String> subTexts = new ArrayList<>();
    List<String> currentSubText = new ArrayList<>();
    for (String token : convertIdsToTokens(ids, skipSpecialTokens)) {
      if (vocabulary.isAdded(token)) {
        if (!currentSubText.isEmpty()) {
          subTexts.add(convertTokensToString(currentSubText));
          currentSubText.clear();
        }
        subTexts.add(token);
      } else {
        currentSubText.add(token);
      }
    }
    if (!currentSubText.isEmpty()) {
      subTexts.add(convertTokensToString(currentSubText));
    }
    String text = String.join(spacesBetweenSpecialTokens ? " " : "", subTexts);
    return cleanUpTokenizationSpaces ? TokenizationCleanup.cleanUp(text) : text;
  }

  // Offsets

  /**
   * @return the span of {@code text} each token of {@link #tokenize(String)} comes from, {@code null} for a
   *         {@code null} text
   * @throws UnsupportedOperationException if the sub-word tokenizer does not keep the characters of the text
   * @throws org.sonar.java.tokenizer.offset.AlignmentException if a token can not be found in the text
   */
  @CheckForNull
  public List<Offset> getOffsetMapping(@Nullable String text) {
    if (text == null) {
      return null;
    }
    if (!subwordTokenizer.preservesCharacters()) {
      throw new UnsupportedOperationException("Offsets can not be computed with " + subwordTokenizer.getClass().getSimpleName()
        + ", its tokens are not substrings of the text");
    }
    List<String> tokens = runPipeline(text, true);
    return offsetMapper.map(text, tokens, new HashSet<>(allSpecialTokens()));
  }

  // Encoding

  /**
   * @param alreadyHasSpecialTokens whether {@code ids} already contains the special tokens of the model
   * @return 1 for each special token, 0 for each sequence token
   */
  public List<Integer> getSpecialTokensMask(List<Integer> ids, @Nullable List<Integer> pairIds, boolean alreadyHasSpecialTokens) {
    if (alreadyHasSpecialTokens) {
      if (pairIds != null) {
        throw new IllegalArgumentException("pairIds: you should not supply a second sequence if the provided sequence of ids "
          + "is already formatted with special tokens for the model.");
      }
      Set<Integer> specialIds = new HashSet<>(allSpecialIds());
      return ids.stream().map(id -> specialIds.contains(id) ? 1 : 0).collect(Collectors.toList());
    }
    return sequenceTemplate.specialTokensMask(ids, pairIds);
  }

  public int numSpecialTokensToAdd(boolean pair) {
    return sequenceTemplate.numSpecialTokensToAdd(pair);
  }

  public Encoding encode(String text) {
    return encode(EncodeInput.text(text), null, EncodingOptions.DEFAULT);
  }

  public Encoding encode(String text, String textPair) {
    return encode(EncodeInput.text(text), EncodeInput.text(textPair), EncodingOptions.DEFAULT);
  }

  public Encoding encode(EncodeInput text, @Nullable EncodeInput textPair, EncodingOptions options) {
    return batchEncoder.encode(text, textPair, options);
  }

  public BatchEncoding batchEncode(List<String> texts, EncodingOptions options) {
    return batchEncode(texts.stream().map(EncodeInput::text).collect(Collectors.toList()), null, options);
  }

  public BatchEncoding batchEncode(List<EncodeInput> texts, @Nullable List<EncodeInput> textPairs, EncodingOptions options) {
    return batchEncoder.batchEncode(texts, textPairs, options);
  }
}
