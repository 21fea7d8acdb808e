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
 * Thrown when a rule matches the empty string, its handler discards the match, and the lexer state
 * is left as it was. Scanning would repeat the same step forever from that point.
 */
@Getter
public class TokenizerStalledException extends InvalidGrammarException {

  private static final long serialVersionUID = 5093341937711652090L;

  private final int ruleIndex;
  private final int offset;
  private final String state;

  public TokenizerStalledException(int ruleIndex, int offset, String state) {
    super(
        String.format(
            "Lex rule %d matched an empty string at offset %d in state %s and discarded it;"
                + " the tokenizer cannot make progress",
            ruleIndex, offset, state));
    this.ruleIndex = ruleIndex;
    this.offset = offset;
    this.state = state;
  }
}
