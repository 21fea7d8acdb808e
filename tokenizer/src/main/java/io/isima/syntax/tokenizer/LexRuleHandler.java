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

/**
 * Action run when the pattern of a lex rule matches.
 *
 * <p>A handler receives the matched text and the running tokenizer, so that it can switch lexer
 * states with {@link Tokenizer#pushState(String)} and {@link Tokenizer#popState()}. Returning null
 * is the same as returning {@link HandlerResult#skip()}.
 */
@FunctionalInterface
public interface LexRuleHandler {

  HandlerResult handle(String lexeme, Tokenizer tokenizer);

  static LexRuleHandler token(String type) {
    final HandlerResult result = HandlerResult.emit(type);
    return (lexeme, tokenizer) -> result;
  }

  static LexRuleHandler tokens(String... types) {
    final HandlerResult result = HandlerResult.emitAll(types);
    return (lexeme, tokenizer) -> result;
  }

  static LexRuleHandler skip() {
    return (lexeme, tokenizer) -> HandlerResult.skip();
  }
}
