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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.sonar.api.utils.log.Logger;
import org.sonar.api.utils.log.Loggers;
import org.sonar.java.tokenizer.assembly.Side;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads the JSON files distributed along a pretrained vocabulary:
 * <ul>
 *   <li>{@code tokenizer_config.json}: tokenizer settings, possibly with special tokens</li>
 *   <li>{@code special_tokens_map.json}: special tokens, each one either a string or an object
 *   {@code {"content", "lstrip", "rstrip", "single_word", "normalized"}}</li>
 *   <li>{@code added_tokens.json}: tokens added to the vocabulary, with their ids</li>
 * </ul>
 */
public final class TokenizerConfigReader {

  private static final Logger LOGGER = Loggers.get(TokenizerConfigReader.class);

  private TokenizerConfigReader() {
    // static use only
  }

  /**
   * Applies the settings and special tokens found in {@code tokenizerConfig} on top of {@code builder}. Unknown keys
   * are ignored.
   */
  public static TokenizerConfig.Builder readTokenizerConfig(InputStream tokenizerConfig, TokenizerConfig.Builder builder) throws IOException {
    JsonObject json = parseObject(tokenizerConfig);
    if (isSet(json, "do_lower_case")) {
      builder.doLowerCase(json.get("do_lower_case").getAsBoolean());
    }
    if (isSet(json, "strip_accents")) {
      builder.stripAccents(json.get("strip_accents").getAsBoolean());
    }
    if (isSet(json, "model_max_length")) {
      // some configurations hold a huge float to mean "no limit"
      double modelMaxLength = json.get("model_max_length").getAsDouble();
      builder.modelMaxLength((int) Math.min(modelMaxLength, Integer.MAX_VALUE));
    }
    if (isSet(json, "padding_side")) {
      builder.paddingSide(readSide(json.get("padding_side")));
    }
    if (isSet(json, "truncation_side")) {
      builder.truncationSide(readSide(json.get("truncation_side")));
    }
    if (isSet(json, "pad_token_type_id")) {
      builder.padTokenTypeId(json.get("pad_token_type_id").getAsInt());
    }
    if (isSet(json, "clean_up_tokenization_spaces")) {
      builder.cleanUpTokenizationSpaces(json.get("clean_up_tokenization_spaces").getAsBoolean());
    }
    if (isSet(json, "model_input_names")) {
      List<String> names = new ArrayList<>();
      json.getAsJsonArray("model_input_names").forEach(e -> names.add(e.getAsString()));
      builder.modelInputNames(names);
    }
    return applySpecialTokens(json, builder);
  }

  public static TokenizerConfig.Builder readSpecialTokensMap(InputStream specialTokensMap, TokenizerConfig.Builder builder) throws IOException {
    return applySpecialTokens(parseObject(specialTokensMap), builder);
  }

  /**
   * @return the added tokens by token, sorted by id
   */
  public static Map<String, Integer> readAddedTokens(InputStream addedTokens) throws IOException {
    JsonObject json = parseObject(addedTokens);
    Map<String, Integer> res = new LinkedHashMap<>();
    json.entrySet().stream()
      .sorted(Map.Entry.comparingByValue((a, b) -> Integer.compare(a.getAsInt(), b.getAsInt())))
      .forEach(e -> res.put(e.getKey(), e.getValue().getAsInt()));
    return res;
  }

  private static TokenizerConfig.Builder applySpecialTokens(JsonObject json, TokenizerConfig.Builder builder) {
    for (SpecialTokenSlot slot : SpecialTokenSlot.values()) {
      if (isSet(json, slot.key())) {
        AddedToken token = readAddedToken(json.get(slot.key()));
        LOGGER.debug("Read special token {}: {}", slot.key(), token.content());
        builder.specialToken(slot, token);
      }
    }
    if (isSet(json, SpecialTokenSlot.ADDITIONAL_SPECIAL_TOKENS_KEY)) {
      for (JsonElement element : json.getAsJsonArray(SpecialTokenSlot.ADDITIONAL_SPECIAL_TOKENS_KEY)) {
        AddedToken token = readAddedToken(element);
        LOGGER.debug("Read additional special token: {}", token.content());
        builder.additionalSpecialToken(token);
      }
    }
    return builder;
  }

  static AddedToken readAddedToken(JsonElement element) {
    if (element.isJsonPrimitive()) {
      return AddedToken.plain(element.getAsString());
    }
    JsonObject object = element.getAsJsonObject();
    if (!isSet(object, "content")) {
      throw new IllegalArgumentException("Special token without content: " + object);
    }
    return new AddedToken(
      object.get("content").getAsString(),
      readFlag(object, "single_word", false),
      readFlag(object, "lstrip", false),
      readFlag(object, "rstrip", false),
      readFlag(object, "normalized", true));
  }

  private static boolean readFlag(JsonObject object, String name, boolean defaultValue) {
    return isSet(object, name) ? object.get(name).getAsBoolean() : defaultValue;
  }

  private static Side readSide(JsonElement element) {
    return Side.valueOf(element.getAsString().toUpperCase(Locale.ROOT));
  }

  private static boolean isSet(JsonObject json, String name) {
    return json.has(name) && !json.get(name).isJsonNull();
  }

  private static JsonObject parseObject(InputStream inputStream) throws IOException {
    try (Reader reader = new InputStreamReader(inputStream, UTF_8)) {
      JsonElement json = JsonParser.parseReader(reader);
      if (!json.isJsonObject()) {
        throw new TokenizerException("Expected a JSON object but got: " + json);
      }
      return json.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new TokenizerException("Unable to parse tokenizer file", e);
    }
  }
}
