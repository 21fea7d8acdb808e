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
package io.isima.syntax.grammar;

import static java.util.Objects.requireNonNull;

import io.isima.syntax.exceptions.InvalidGrammarException;
import io.isima.syntax.tokenizer.LexRuleHandler;
import io.isima.syntax.tokenizer.TokenizerUtils;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.Getter;
import lombok.ToString;

/**
 * A lexical rule: a regular expression and the handler run when it matches.
 *
 * <p>The expression is always matched at the current position of the tokenizer only, as if it
 * started with {@code ^}.
 */
@Getter
@ToString(of = {"startConditions", "originalMatcher", "caseInsensitive"})
public class LexRule {

  /** Start conditions the rule is restricted to; empty if the rule has none. */
  private final List<String> startConditions;

  /** Matcher as written, before macro expansion. */
  private final String originalMatcher;

  /** Matcher after macro expansion; this is what the pattern is compiled from. */
  private final String expandedMatcher;

  private final boolean caseInsensitive;

  private final Pattern pattern;

  private final LexRuleHandler handler;

  public LexRule(String matcher, LexRuleHandler handler) {
    this(List.of(), matcher, matcher, handler, false);
  }

  public LexRule(List<String> startConditions, String matcher, LexRuleHandler handler) {
    this(startConditions, matcher, matcher, handler, false);
  }

  public LexRule(
      List<String> startConditions,
      String originalMatcher,
      String expandedMatcher,
      LexRuleHandler handler,
      boolean caseInsensitive) {
    this.startConditions = List.copyOf(requireNonNull(startConditions, "startConditions is null"));
    this.originalMatcher = requireNonNull(originalMatcher, "originalMatcher is null");
    this.expandedMatcher = requireNonNull(expandedMatcher, "expandedMatcher is null");
    this.handler = requireNonNull(handler, "handler is null");
    this.caseInsensitive = caseInsensitive;
    final int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
    try {
      this.pattern = Pattern.compile(expandedMatcher, flags);
    } catch (PatternSyntaxException e) {
      throw new InvalidGrammarException(
          "Invalid lex rule matcher '" + originalMatcher + "': " + e.getDescription(), e);
    }
  }

  public boolean hasStartConditions() {
    return !startConditions.isEmpty();
  }

  /**
   * Tells whether the rule belongs to the given start condition.
   *
   * @param condition Start condition name
   * @param inclusive Whether the condition also takes rules without start conditions
   */
  public boolean appliesTo(String condition, boolean inclusive) {
    if (!hasStartConditions()) {
      return inclusive;
    }
    return startConditions.contains(condition)
        || startConditions.contains(TokenizerUtils.ANY_STATE);
  }

  /**
   * Matches the pattern at the beginning of the input region {@code [from, input.length())}.
   *
   * @return The matched text, or null if the rule does not match there
   */
  public String matchAt(String input, int from) {
    final Matcher matcher = pattern.matcher(input);
    matcher.region(from, input.length());
    return matcher.lookingAt() ? matcher.group() : null;
  }
}
