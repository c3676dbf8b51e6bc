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
package org.sonar.java.tokenizer.vocabulary;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads and writes vocabulary files.
 * <p>
 * A vocabulary file is UTF-8 encoded and holds one token per line, the id of a token being its 0-based line number.
 */
public final class VocabularyFiles {

  private VocabularyFiles() {
    // utility class
  }

  public static Vocabulary load(Path path, @Nullable String unknownToken) throws IOException {
    try (InputStream inputStream = Files.newInputStream(path)) {
      return load(inputStream, unknownToken);
    }
  }

  public static Vocabulary load(InputStream inputStream, @Nullable String unknownToken) throws IOException {
    List<String> tokens = new ArrayList<>();
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        tokens.add(line);
      }
    }
    return Vocabulary.of(tokens, unknownToken);
  }

  /**
   * Writes the tokens of {@code vocabulary} to {@code path}, in ascending id order.
   */
  public static void save(Path path, Vocabulary vocabulary) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path, UTF_8)) {
      for (String token : vocabulary.tokens()) {
        writer.write(token);
        writer.write('\n');
      }
    }
  }
}
