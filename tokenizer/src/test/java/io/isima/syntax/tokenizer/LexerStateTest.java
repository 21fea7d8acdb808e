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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import io.isima.syntax.exceptions.InvalidGrammarException;
import io.isima.syntax.grammar.LexGrammar;
import io.isima.syntax.grammar.LexRule;
import io.isima.syntax.grammar.StartConditionType;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;

public class LexerStateTest {

  private LexGrammar grammar;

  @Before
  public void setUp() {
    grammar =
        LexGrammar.builder()
            .startCondition("comment", StartConditionType.EXCLUSIVE)
            .rule(List.of("*"), "\\s+", LexRuleHandler.skip())
            .rule(
                "/\\*",
                (lexeme, tokenizer) -> {
                  tokenizer.pushState("comment");
                  return HandlerResult.skip();
                })
            .rule("\\d+", LexRuleHandler.token("NUMBER"))
            .rule(
                List.of("comment"),
                "\\*/",
                (lexeme, tokenizer) -> {
                  tokenizer.popState();
                  return HandlerResult.skip();
                })
            .rule(List.of("comment"), "\\d+", LexRuleHandler.token("NUMBER_IN_COMMENT"))
            .build();
  }

  @Test
  public void testInitialState() {
    final var tokenizer = new Tokenizer(grammar, "5");
    assertThat(tokenizer.getCurrentState(), is("INITIAL"));
    assertEquals(List.of("INITIAL"), tokenizer.getStates());
  }

  @Test
  public void testStateTransitions() throws Exception {
    final var tokenizer = new Tokenizer(grammar, "1 /* 2 */ 3");

    assertThat(tokenizer.getCurrentState(), is("INITIAL"));
    TokenizerTest.assertToken(tokenizer.nextToken(), "NUMBER", "1", 0, 1);

    // Same pattern, different token type while in the comment state.
    TokenizerTest.assertToken(tokenizer.nextToken(), "NUMBER_IN_COMMENT", "2", 5, 6);
    assertThat(tokenizer.getCurrentState(), is("comment"));

    TokenizerTest.assertToken(tokenizer.nextToken(), "NUMBER", "3", 10, 11);
    assertThat(tokenizer.getCurrentState(), is("INITIAL"));
  }

  @Test
  public void testStatesStack() {
    final var tokenizer = new Tokenizer(grammar, "1");

    tokenizer.pushState("first");
    tokenizer.begin("second");

    assertThat(tokenizer.getCurrentState(), is("second"));
    assertEquals(List.of("INITIAL", "first", "second"), tokenizer.getStates());

    assertThat(tokenizer.popState(), is("second"));
    assertThat(tokenizer.getCurrentState(), is("first"));

    tokenizer.begin("INITIAL");
    assertEquals(List.of("INITIAL", "first", "INITIAL"), tokenizer.getStates());

    tokenizer.popState();
    tokenizer.popState();
    assertThat(tokenizer.getCurrentState(), is("INITIAL"));

    // Further pops leave the INITIAL state in place.
    assertThat(tokenizer.popState(), is("INITIAL"));
    assertThat(tokenizer.popState(), is("INITIAL"));
    assertEquals(List.of("INITIAL"), tokenizer.getStates());
  }

  @Test
  public void testUnknownStateFailsAtFirstUse() throws Exception {
    final var tokenizer = new Tokenizer(grammar, "1 2");
    tokenizer.pushState("nowhere");
    assertThrows(InvalidGrammarException.class, tokenizer::nextToken);
  }

  @Test
  public void testUnknownStatePushedByHandler() throws Exception {
    final var badGrammar =
        LexGrammar.builder()
            .rule(
                "\"",
                (lexeme, tokenizer) -> {
                  tokenizer.begin("string");
                  return HandlerResult.emit("QUOTE");
                })
            .build();
    final var tokenizer = new Tokenizer(badGrammar, "\"abc\"");
    assertThat(tokenizer.nextToken().getType(), is("QUOTE"));
    final var e = assertThrows(InvalidGrammarException.class, tokenizer::nextToken);
    assertThat(e.getMessage(), is("Unknown lexer state: string"));
  }

  @Test
  public void testExplicitRuleTable() throws Exception {
    final var rules =
        List.of(
            new LexRule("\\s+", LexRuleHandler.skip()),
            new LexRule(
                "'",
                (lexeme, tokenizer) -> {
                  if (tokenizer.getCurrentState().equals("string")) {
                    tokenizer.popState();
                  } else {
                    tokenizer.pushState("string");
                  }
                  return HandlerResult.emit("QUOTE");
                }),
            new LexRule("[^']+", LexRuleHandler.token("TEXT")),
            new LexRule("\\w+", LexRuleHandler.token("WORD")));
    final var explicit =
        LexGrammar.of(rules, Map.of("INITIAL", List.of(0, 1, 3), "string", List.of(1, 2)));
    final var tokens = new Tokenizer(explicit).tokenize("say 'hello world' now");

    assertThat(tokens.size(), is(6));
    TokenizerTest.assertToken(tokens.get(0), "WORD", "say", 0, 3);
    TokenizerTest.assertToken(tokens.get(1), "QUOTE", "'", 4, 5);
    TokenizerTest.assertToken(tokens.get(2), "TEXT", "hello world", 5, 16);
    TokenizerTest.assertToken(tokens.get(3), "QUOTE", "'", 16, 17);
    TokenizerTest.assertToken(tokens.get(4), "WORD", "now", 18, 21);
  }

  @Test
  public void testCommentStateCountsLines() throws Exception {
    final var lines = new AtomicInteger(1);
    final var lineCounter =
        LexGrammar.builder()
            .startCondition("comment", StartConditionType.EXCLUSIVE)
            .rule(
                "/\\*",
                (lexeme, tokenizer) -> {
                  tokenizer.pushState("comment");
                  return HandlerResult.skip();
                })
            .rule(
                List.of("comment"),
                "\\*+/",
                (lexeme, tokenizer) -> {
                  tokenizer.popState();
                  return HandlerResult.skip();
                })
            .rule(List.of("comment"), "[^*\\n]+", LexRuleHandler.skip())
            .rule(List.of("comment"), "\\*+[^*/\\n]*", LexRuleHandler.skip())
            .rule(
                List.of("comment"),
                "\\n",
                (lexeme, tokenizer) -> {
                  lines.incrementAndGet();
                  return HandlerResult.skip();
                })
            .rule(
                "\\n",
                (lexeme, tokenizer) -> {
                  lines.incrementAndGet();
                  return HandlerResult.skip();
                })
            .rule(List.of("*"), " +", LexRuleHandler.skip())
            .rule("Main", LexRuleHandler.token("MAIN"))
            .build();
    final String input = "\n/* Hello world\n    privet\n\n   OK **/\n\nMain\n";
    final List<Token> tokens = new Tokenizer(lineCounter).tokenize(input);

    assertThat(tokens.size(), is(2));
    final Token main = tokens.get(0);
    assertThat(main.getType(), is("MAIN"));
    assertThat(main.getStartLine(), is(7));
    assertThat(lines.get(), is(8));
  }
}
