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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Byte-level BPE sub-word tokenization, as used by GPT-2 and RoBERTa.
 * <p>
 * Tokenization of a run of text happens in three stages:
 * <ul>
 *     <li>split over a regular expression (see {@link #PRE_TOKENIZATION_SUB_PATTERNS})</li>
 *     <li>byte-level encoding of each piece: every UTF-8 byte is mapped to a printable character</li>
 *     <li>BPE encoding of the byte-level pieces, implemented by a {@link BPEEncoder}</li>
 * </ul>
 * Tokens are therefore not substrings of the input text and {@link #preservesCharacters()} is {@code false}.
 */
public class ByteLevelBpeTokenizer implements SubwordTokenizer {

  /**
   * Sub-patterns of the regular expression splitting the text before byte-level encoding, tried <strong>in order</strong>:
   * <pre>
   * 's|'t|'re|'ve|'m|'ll|'d| ?\p{L}+| ?\p{N}+| ?[^\s\p{L}\p{N}]+|\s+(?!\S)|\s+
   * </pre>
   */
  private static final List<String> PRE_TOKENIZATION_SUB_PATTERNS = List.of(
    "'s",
    "'t",
    "'re",
    "'ve",
    "'m",
    "'ll",
    "'d",
    " ?\\p{L}+",
    " ?\\p{N}+",
    " ?[^\\s\\p{L}\\p{N}]+",
    "\\s+(?!\\S)",
    "\\s+");
  private static final Pattern PRE_TOKENIZATION_PATTERN = Pattern.compile(String.join("|", PRE_TOKENIZATION_SUB_PATTERNS));

  private static final int BYTE_VALUES = 256;
  private static final char[] BYTE_ENCODING_TABLE = buildByteEncodingTable();
  private static final Map<Character, Integer> BYTE_DECODING_TABLE = buildByteDecodingTable();

  private final BPEEncoder bpeEncoder;

  public ByteLevelBpeTokenizer(BPEEncoder bpeEncoder) {
    this.bpeEncoder = bpeEncoder;
  }

  /**
   * @return a tokenizer reading its merges from {@code mergesFile} and caching every encoded pre-token
   */
  public static ByteLevelBpeTokenizer fromMerges(InputStream mergesFile) throws IOException {
    return new ByteLevelBpeTokenizer(new CachingBPEEncoder(new MergesBPEEncoder(mergesFile)));
  }

  /**
   * Printable bytes ({@code !} to {@code ~}, {@code ¡} to {@code ¬}, {@code ®} to {@code ÿ}) map to themselves, the
   * other ones, blank space included, to the character number {@code 256 + n}, n counting the bytes remapped so far.
   */
  private static char[] buildByteEncodingTable() {
    char[] res = new char[BYTE_VALUES];
    int n = 0;
    for (int i = 0; i < BYTE_VALUES; i++) {
      if ((i >= '!' && i <= '~') || (i >= '¡' && i <= '¬') || (i >= '®' && i <= 'ÿ')) {
        res[i] = (char) i;
      } else {
        res[i] = (char) (BYTE_VALUES + n);
        n++;
      }
    }
    return res;
  }

  private static Map<Character, Integer> buildByteDecodingTable() {
    Map<Character, Integer> res = new HashMap<>();
    for (int i = 0; i < BYTE_VALUES; i++) {
      res.put(BYTE_ENCODING_TABLE[i], i);
    }
    return res;
  }

  @Override
  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    for (String piece : preTokenize(text)) {
      tokens.addAll(bpeEncoder.bpeEncode(byteEncode(piece)));
    }
    return tokens;
  }

  @Override
  public String detokenize(List<String> tokens) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    for (String token : tokens) {
      for (int i = 0; i < token.length(); i++) {
        char c = token.charAt(i);
        Integer b = BYTE_DECODING_TABLE.get(c);
        if (b != null) {
          bytes.write(b);
        } else {
          // not produced by the byte-level encoding, kept as is
          bytes.writeBytes(String.valueOf(c).getBytes(UTF_8));
        }
      }
    }
    return bytes.toString(UTF_8);
  }

  @Override
  public boolean preservesCharacters() {
    return false;
  }

  static List<String> preTokenize(String text) {
    List<String> pieces = new ArrayList<>();
    Matcher matcher = PRE_TOKENIZATION_PATTERN.matcher(text);
    while (matcher.find()) {
      pieces.add(matcher.group());
    }
    return pieces;
  }

  /**
   * @return the concatenated mapped chars of the UTF-8 encoding of {@code piece}
   */
  static String byteEncode(String piece) {
    byte[] bytes = piece.getBytes(UTF_8);
    char[] res = new char[bytes.length];
    for (int i = 0; i < bytes.length; i++) {
      // signed byte to unsigned index
      res[i] = BYTE_ENCODING_TABLE[bytes[i] & 0xFF];
    }
    return new String(res);
  }
}
