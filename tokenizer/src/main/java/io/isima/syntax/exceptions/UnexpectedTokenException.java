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
package io.isima.syntax.exceptions;

import lombok.Getter;

/**
 * Thrown when no lexical rule matches at the current position and input remains.
 *
 * <p>The message shows the offending source line with a caret under the failing column, followed
 * by the character and its {@code line:column} location, e.g.
 *
 * <pre>
 *
 * 12 # 4
 *    ^
 * Unexpected token: "#" at 1:3.
 * </pre>
 */
@Getter
public class UnexpectedTokenException extends TokenizerException {

  private static final long serialVersionUID = -2260735118622913508L;

  /** The character no rule could match. */
  private final char symbol;

  /** 1-based line of the character. */
  private final int line;

  /** 0-based column of the character. */
  private final int column;

  /** Text of the source line that contains the character, without the line terminator. */
  private final String sourceLine;

  public UnexpectedTokenException(char symbol, int line, int column, String sourceLine) {
    super(buildMessage(symbol, line, column, sourceLine));
    this.symbol = symbol;
    this.line = line;
    this.column = column;
    this.sourceLine = sourceLine;
  }

  /** Returns the source line followed by a line with the caret marker under the column. */
  public String getSnippet() {
    return sourceLine + "\n" + " ".repeat(column) + "^";
  }

  private static String buildMessage(char symbol, int line, int column, String sourceLine) {
    return "\n\n"
        + sourceLine
        + "\n"
        + " ".repeat(column)
        + "^\n"
        + "Unexpected token: \""
        + symbol
        + "\" at "
        + line
        + ":"
        + column
        + ".";
  }
}
