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

/**
 * Thrown to indicate a malformed lexical rule table, such as a reference to an undeclared lexer
 * state or a rule index outside of the rule list. This is a programming error of whoever supplied
 * the table, so the exception is unchecked.
 */
public class InvalidGrammarException extends RuntimeException {

  private static final long serialVersionUID = -6573407526108367240L;

  public InvalidGrammarException(String message) {
    super(message);
  }

  public InvalidGrammarException(String message, Throwable cause) {
    super(message, cause);
  }
}
