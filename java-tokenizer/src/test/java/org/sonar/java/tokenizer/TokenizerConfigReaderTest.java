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

import com.google.gson.JsonParser;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.sonar.java.tokenizer.assembly.Side;
import org.sonar.java.tokenizer.encoding.Encoding;
import org.sonar.java.tokenizer.vocabulary.Vocabulary;
import org.sonar.java.tokenizer.vocabulary.VocabularyFiles;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TokenizerConfigReaderTest {

  private static TokenizerConfig readConfig() throws IOException {
    TokenizerConfig.Builder builder = TokenizerConfig.builder();
    try (InputStream tokenizerConfig = TestTokenizers.resource("tokenizer_config.json");
      InputStream specialTokensMap = TestTokenizers.resource("special_tokens_map.json")) {
      TokenizerConfigReader.readTokenizerConfig(tokenizerConfig, builder);
      TokenizerConfigReader.readSpecialTokensMap(specialTokensMap, builder);
    }
    return builder.build();
  }

  @Test
  void tokenizer_settings() throws IOException {
    TokenizerConfig config = readConfig();
    assertThat(config.doLowerCase(), is(true));
    assertThat(config.stripAccents(), nullValue());
    assertThat(config.modelMaxLength(), equalTo(128));
    assertThat(config.paddingSide(), equalTo(Side.LEFT));
    assertThat(config.truncationSide(), equalTo(Side.RIGHT));
    assertThat(config.modelInputNames(), contains(TokenizerConfig.INPUT_IDS, TokenizerConfig.ATTENTION_MASK));
    assertThat(config.cleanUpTokenizationSpaces(), is(false));
  }

  @Test
  void special_tokens() throws IOException {
    TokenizerConfig config = readConfig();
    assertThat(config.specialToken(SpecialTokenSlot.UNK).orElseThrow(), equalTo(AddedToken.plain("[UNK]")));
    assertThat(config.specialToken(SpecialTokenSlot.MASK).orElseThrow(), equalTo(new AddedToken("[MASK]", false, true, false, false)));
    assertThat(config.specialToken(SpecialTokenSlot.BOS).isPresent(), is(false));
    assertThat(config.additionalSpecialTokens(), contains(AddedToken.plain("<ENT>")));
  }

  @Test
  void huge_model_max_length_is_clamped() throws IOException {
    String json = "{\"model_max_length\": 1000000000000000019884624838656}";
    TokenizerConfig config = TokenizerConfigReader.readTokenizerConfig(new ByteArrayInputStream(json.getBytes(UTF_8)), TokenizerConfig.builder()).build();
    assertThat(config.modelMaxLength(), equalTo(Integer.MAX_VALUE));
  }

  @Test
  void malformed_files() {
    TokenizerConfig.Builder builder = TokenizerConfig.builder();
    TokenizerException e = assertThrows(TokenizerException.class,
      () -> TokenizerConfigReader.readSpecialTokensMap(new ByteArrayInputStream("{\"unk_token\": ".getBytes(UTF_8)), builder));
    assertThat(e.getMessage(), equalTo("Unable to parse tokenizer file"));

    e = assertThrows(TokenizerException.class,
      () -> TokenizerConfigReader.readAddedTokens(new ByteArrayInputStream("[1, 2]".getBytes(UTF_8))));
    assertThat(e.getMessage(), equalTo("Expected a JSON object but got: [1,2]"));
  }

  @Test
  void added_token_objects() {
    AddedToken token = TokenizerConfigReader.readAddedToken(JsonParser.parseString("{\"content\": \"<x>\", \"rstrip\": true}"));
    assertThat(token.content(), equalTo("<x>"));
    assertThat(token.rstrip(), is(true));
    assertThat(token.lstrip(), is(false));
    assertThat(token.normalized(), is(true));
    assertThat(token.singleWord(), is(false));
    assertThrows(IllegalArgumentException.class, () -> TokenizerConfigReader.readAddedToken(JsonParser.parseString("{\"lstrip\": true}")));
  }

  @Test
  void added_tokens_sorted_by_id() throws IOException {
    Map<String, Integer> addedTokens;
    try (InputStream stream = TestTokenizers.resource("added_tokens.json")) {
      addedTokens = TokenizerConfigReader.readAddedTokens(stream);
    }
    assertThat(addedTokens.keySet(), contains("<ENT>", "newword"));
    assertThat(addedTokens.values(), contains(24, 25));
  }

  @Test
  void tokenizer_from_files() throws IOException {
    TokenizerConfig config = readConfig();
    Vocabulary vocabulary;
    Map<String, Integer> addedTokens;
    try (InputStream vocab = TestTokenizers.resource("vocab.txt");
      InputStream added = TestTokenizers.resource("added_tokens.json")) {
      vocabulary = VocabularyFiles.load(vocab, "[UNK]");
      addedTokens = TokenizerConfigReader.readAddedTokens(added);
    }
    PretrainedTokenizer tokenizer = PretrainedTokenizer.wordPiece(config, vocabulary);
    tokenizer.restoreAddedTokens(addedTokens);

    assertThat(tokenizer.size(), equalTo(26));
    assertThat(tokenizer.vocabSize(), equalTo(24));
    assertThat(tokenizer.tokenize("Hello <ENT> NewWord"), contains("hello", "<ENT>", "newword"));
    assertThat(tokenizer.convertTokensToIds(List.of("hello", "<ENT>", "newword")), contains(5, 24, 25));

    Encoding encoding = tokenizer.encode("hello");
    assertThat(encoding.inputIds(), contains(2, 5, 3));
    assertThat(encoding.tokenTypeIds(), nullValue());
    assertThat(encoding.attentionMask(), contains(1, 1, 1));
  }
}
