/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.syntax.tokenizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.List;

/** This class has utility constants and helpers for tokenizer. */
public class TokenizerUtils {
  /** Lexer state at the bottom of the state stack. */
  public static final String INITIAL_STATE = "INITIAL";

  /** Start condition of rules that apply in every lexer state. */
  public static final String ANY_STATE = "*";

  public static final char NEW_LINE = '\n';

  private static final ObjectMapper mapper = new ObjectMapper();
  private static final ObjectWriter prettyWriter = mapper.writerWithDefaultPrettyPrinter();

  /**
   * Returns the text of the line that begins at the given offset, without its terminator.
   *
   * @param input The whole tokenized string
   * @param lineBeginOffset Offset of the first character of the line
   * @return The line text
   */
  public static String getLineAt(String input, int lineBeginOffset) {
    if (lineBeginOffset >= input.length()) {
      return "";
    }
    int lineEnd = input.indexOf(NEW_LINE, lineBeginOffset);
    if (lineEnd < 0) {
      lineEnd = input.length();
    }
    if (lineEnd > lineBeginOffset && input.charAt(lineEnd - 1) == '\r') {
      --lineEnd;
    }
    return input.substring(lineBeginOffset, lineEnd);
  }

  public static String toJson(List<Token> tokens) throws JsonProcessingException {
    return toJson(tokens, true);
  }

  public static String toJson(List<Token> tokens, boolean indent) throws JsonProcessingException {
    return indent ? prettyWriter.writeValueAsString(tokens) : mapper.writeValueAsString(tokens);
  }

  public static List<Token> fromJson(String json) throws JsonProcessingException {
    return List.of(mapper.readValue(json, Token[].class));
  }
}
