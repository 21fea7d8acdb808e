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

import static java.util.Objects.requireNonNull;

import io.isima.syntax.common.TokenizerConfig;
import io.isima.syntax.exceptions.TokenizerStalledException;
import io.isima.syntax.exceptions.UnexpectedTokenException;
import io.isima.syntax.grammar.LexGrammar;
import io.isima.syntax.grammar.LexRule;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Stack;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Rule-table driven tokenizer.
 *
 * <p>On every {@link #nextToken()} call the rules of the current lexer state are tried in table
 * order at the cursor position, and the first rule whose pattern matches there wins. The rule
 * handler decides what the match turns into: nothing (the tokenizer moves on to the next match), a
 * token, or several tokens that are handed out one per call and share the location of the match.
 * After the input is exhausted every call returns the end-of-input token.
 *
 * <p>Handlers switch lexer states with {@link #pushState(String)}/{@link #begin(String)} and
 * {@link #popState()}. The INITIAL state is always at the bottom of the state stack.
 *
 * <p>The class is not thread-safe.
 */
@Slf4j
public class Tokenizer {

  @Getter private final LexGrammar lexGrammar;

  /** Type of the end-of-input token. */
  @Getter private final String eofSymbol;

  private final boolean zeroWidthSkipCheck;

  @Getter private String input;

  /** Absolute offset of the next character to scan. */
  @Getter private int cursor;

  private Stack<String> states;

  /** Token types waiting to be returned; they share the location of the last match. */
  private Queue<String> tokensQueue;

  // Line-based location tracking.
  private int currentLine;
  private int currentColumn;
  private int currentLineBeginOffset;

  // Location of the last match.
  private int tokenStartOffset;
  private int tokenEndOffset;
  private int tokenStartLine;
  private int tokenEndLine;
  private int tokenStartColumn;
  private int tokenEndColumn;

  public Tokenizer(LexGrammar lexGrammar) {
    this(lexGrammar, TokenizerConfig.eofSymbol(), TokenizerConfig.zeroWidthSkipCheckEnabled());
  }

  public Tokenizer(LexGrammar lexGrammar, String input) {
    this(lexGrammar);
    initialize(input);
  }

  /**
   * The constructor.
   *
   * @param lexGrammar The rule table
   * @param eofSymbol Type of the end-of-input token; must differ from the rule token types
   * @param zeroWidthSkipCheck Whether to fail on an empty match discarded without a state change
   */
  public Tokenizer(LexGrammar lexGrammar, String eofSymbol, boolean zeroWidthSkipCheck) {
    this.lexGrammar = requireNonNull(lexGrammar, "lexGrammar is null");
    this.eofSymbol = requireNonNull(eofSymbol, "eofSymbol is null");
    this.zeroWidthSkipCheck = zeroWidthSkipCheck;
    initialize("");
  }

  /** Binds the tokenizer to a new input and resets all scanning state. */
  public void initialize(String input) {
    this.input = requireNonNull(input, "input is null");
    cursor = 0;

    states = new Stack<>();
    states.push(TokenizerUtils.INITIAL_STATE);

    tokensQueue = new LinkedList<>();

    currentLine = 1;
    currentColumn = 0;
    currentLineBeginOffset = 0;

    tokenStartOffset = 0;
    tokenEndOffset = 0;
    tokenStartLine = 0;
    tokenEndLine = 0;
    tokenStartColumn = 0;
    tokenEndColumn = 0;

    logger.debug("Tokenizer initialized; length={}", input.length());
  }

  //
  // Lexer states ////////////////////////////////////////////////////////////////////
  //

  public String getCurrentState() {
    return states.peek();
  }

  /** Returns the state stack, bottom first. */
  public List<String> getStates() {
    return List.copyOf(states);
  }

  public void pushState(String state) {
    requireNonNull(state, "state is null");
    states.push(state);
    logger.debug("Lexer state pushed: {}, stack={}", state, states);
  }

  /** Alias of {@link #pushState(String)}. */
  public void begin(String state) {
    pushState(state);
  }

  /**
   * Pops the current state.
   *
   * @return The popped state, or INITIAL without popping if it is the only state in the stack
   */
  public String popState() {
    if (states.size() > 1) {
      final String state = states.pop();
      logger.debug("Lexer state popped: {}, stack={}", state, states);
      return state;
    }
    return getCurrentState();
  }

  //
  // Tokenizing //////////////////////////////////////////////////////////////////////
  //

  /** Tells whether {@link #nextToken()} has not yet returned the end-of-input token. */
  public boolean hasMoreTokens() {
    return cursor <= input.length();
  }

  /** Tells whether the cursor is at the end of the input, before the end-of-input token. */
  public boolean isEOF() {
    return cursor == input.length();
  }

  /**
   * Returns the next token.
   *
   * @return The next token; the end-of-input token once the input is exhausted
   * @throws UnexpectedTokenException if no rule matches at the cursor and input remains
   * @throws io.isima.syntax.exceptions.InvalidGrammarException if the current lexer state is not
   *     in the rule table, or a discarded empty match would stop progress
   */
  public Token nextToken() throws UnexpectedTokenException {
    if (!tokensQueue.isEmpty()) {
      return toToken(tokensQueue.remove(), "");
    }

    // Discarded matches loop back here.
    while (true) {
      if (!hasMoreTokens()) {
        return eofToken();
      }
      if (isEOF()) {
        ++cursor;
        return eofToken();
      }

      final String state = getCurrentState();
      final int depth = states.size();
      HandlerResult result = null;
      String lexeme = null;
      int ruleIndex = -1;
      for (int index : lexGrammar.getRuleIndicesForState(state)) {
        final LexRule rule = lexGrammar.getRule(index);
        lexeme = rule.matchAt(input, cursor);
        if (lexeme != null) {
          ruleIndex = index;
          captureLocation(lexeme);
          cursor += lexeme.length();
          result = invokeHandler(index, rule, lexeme);
          break;
        }
      }

      if (lexeme == null) {
        throw unexpectedToken();
      }

      switch (result.getKind()) {
        case SKIP:
          if (zeroWidthSkipCheck
              && lexeme.isEmpty()
              && states.size() == depth
              && state.equals(getCurrentState())) {
            throw new TokenizerStalledException(ruleIndex, tokenStartOffset, state);
          }
          continue;
        case EMIT:
          {
            final var emit = (HandlerResult.Emit) result;
            return toToken(emit.getType(), emit.getValue() != null ? emit.getValue() : lexeme);
          }
        case EMIT_AND_QUEUE:
          {
            final var emitAndQueue = (HandlerResult.EmitAndQueue) result;
            tokensQueue.addAll(emitAndQueue.getQueuedTypes());
            return toToken(emitAndQueue.getType(), lexeme);
          }
        default:
          throw new IllegalStateException("Unknown handler result kind: " + result.getKind());
      }
    }
  }

  /** Returns the remaining tokens, up to and including the end-of-input token. */
  public List<Token> getTokens() throws UnexpectedTokenException {
    final var tokens = new ArrayList<Token>();
    Token token;
    do {
      token = nextToken();
      tokens.add(token);
    } while (!token.getType().equals(eofSymbol));
    return tokens;
  }

  /** Initializes the tokenizer with the input and returns all of its tokens. */
  public List<Token> tokenize(String input) throws UnexpectedTokenException {
    initialize(input);
    return getTokens();
  }

  private HandlerResult invokeHandler(int index, LexRule rule, String lexeme) {
    final HandlerResult result;
    try {
      result = rule.getHandler().handle(lexeme, this);
    } catch (RuntimeException e) {
      logger.error(
          "Error in handler of lex rule {} '{}' at {}:{}; lexeme='{}'",
          index,
          rule.getOriginalMatcher(),
          tokenStartLine,
          tokenStartColumn,
          lexeme);
      throw e;
    }
    return result != null ? result : HandlerResult.skip();
  }

  private void captureLocation(String matched) {
    tokenStartOffset = cursor;

    tokenStartLine = currentLine;
    tokenStartColumn = tokenStartOffset - currentLineBeginOffset;

    // Multi-line lexemes move the line counter and the line beginning.
    for (int i = matched.indexOf(TokenizerUtils.NEW_LINE);
        i >= 0;
        i = matched.indexOf(TokenizerUtils.NEW_LINE, i + 1)) {
      ++currentLine;
      currentLineBeginOffset = tokenStartOffset + i + 1;
    }

    tokenEndOffset = cursor + matched.length();

    tokenEndLine = currentLine;
    tokenEndColumn = currentColumn = tokenEndOffset - currentLineBeginOffset;
  }

  private Token toToken(String type, String value) {
    final var token =
        new Token(
            type,
            value,
            tokenStartOffset,
            tokenEndOffset,
            tokenStartLine,
            tokenEndLine,
            tokenStartColumn,
            tokenEndColumn);
    logger.trace("{}", token);
    return token;
  }

  private Token eofToken() {
    final int length = input.length();
    return new Token(
        eofSymbol, "", length, length, currentLine, currentLine, currentColumn, currentColumn);
  }

  private UnexpectedTokenException unexpectedToken() {
    final int column = cursor - currentLineBeginOffset;
    return new UnexpectedTokenException(
        input.charAt(cursor),
        currentLine,
        column,
        TokenizerUtils.getLineAt(input, currentLineBeginOffset));
  }
}
