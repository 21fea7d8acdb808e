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

import io.isima.syntax.common.TokenizerConfig;
import io.isima.syntax.exceptions.InvalidGrammarException;
import io.isima.syntax.tokenizer.LexRuleHandler;
import io.isima.syntax.tokenizer.TokenizerUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered lexical rule table, partitioned by lexer state.
 *
 * <p>For every lexer state the grammar keeps the ordered list of indices of the rules that are
 * tried while the state is on top of the tokenizer's state stack. The partition is either given
 * explicitly, which is what a generated parser does, or derived from the start conditions of the
 * rules:
 *
 * <ul>
 *   <li>an inclusive condition takes the rules without start conditions
 *   <li>every condition takes the rules that list it, and the rules that list {@code *}
 * </ul>
 *
 * <p>The {@code INITIAL} state is always present and inclusive. Rule order is kept in every
 * partition; among the rules of a state the first one that matches wins.
 *
 * <p>Instances are immutable and may be shared by tokenizers running in different threads.
 */
@Slf4j
@Getter
public class LexGrammar {

  private final List<LexRule> rules;

  /** Declared start conditions, INITIAL first. */
  private final Map<String, StartConditionType> startConditions;

  /** Macros that were expanded in the rule matchers. */
  private final Map<String, String> macros;

  private final Map<String, List<Integer>> ruleIndicesByState;

  @Getter(AccessLevel.NONE)
  private final Map<LexRule, Integer> ruleIndices;

  private LexGrammar(
      List<LexRule> rules,
      Map<String, StartConditionType> startConditions,
      Map<String, String> macros,
      Map<String, List<Integer>> ruleIndicesByState) {
    this.rules = List.copyOf(rules);
    this.startConditions = Collections.unmodifiableMap(new LinkedHashMap<>(startConditions));
    this.macros = Collections.unmodifiableMap(new LinkedHashMap<>(macros));
    final var indicesByState = new LinkedHashMap<String, List<Integer>>();
    ruleIndicesByState.forEach((state, indices) -> indicesByState.put(state, List.copyOf(indices)));
    this.ruleIndicesByState = Collections.unmodifiableMap(indicesByState);
    final var indexMap = new IdentityHashMap<LexRule, Integer>();
    for (int i = 0; i < this.rules.size(); ++i) {
      indexMap.put(this.rules.get(i), i);
    }
    this.ruleIndices = Collections.unmodifiableMap(indexMap);
  }

  /**
   * Creates a grammar whose partition is derived from the start conditions of the rules. Only the
   * INITIAL state is declared, so every rule must be free of start conditions or use INITIAL or
   * {@code *}.
   */
  public static LexGrammar of(List<LexRule> rules) {
    final var builder = builder();
    requireNonNull(rules, "rules is null").forEach(builder::rule);
    return builder.build();
  }

  /**
   * Creates a grammar from an explicit rule table.
   *
   * @param rules Ordered rules
   * @param ruleIndicesByState Ordered rule indices for each lexer state; must contain INITIAL
   * @throws InvalidGrammarException if INITIAL is missing or an index is out of range
   */
  public static LexGrammar of(List<LexRule> rules, Map<String, List<Integer>> ruleIndicesByState) {
    requireNonNull(rules, "rules is null");
    requireNonNull(ruleIndicesByState, "ruleIndicesByState is null");
    if (!ruleIndicesByState.containsKey(TokenizerUtils.INITIAL_STATE)) {
      throw new InvalidGrammarException(
          "Rule table has no entry for the " + TokenizerUtils.INITIAL_STATE + " state");
    }
    final var startConditions = new LinkedHashMap<String, StartConditionType>();
    startConditions.put(TokenizerUtils.INITIAL_STATE, StartConditionType.INCLUSIVE);
    for (var entry : ruleIndicesByState.entrySet()) {
      final String state = requireNonNull(entry.getKey(), "state name is null");
      final List<Integer> indices = requireNonNull(entry.getValue(), "indices of " + state);
      for (Integer index : indices) {
        if (index == null || index < 0 || index >= rules.size()) {
          throw new InvalidGrammarException(
              String.format(
                  "Rule index %s of state %s is out of range [0 : %d)",
                  index, state, rules.size()));
        }
      }
      // The subset of an explicitly given state is used verbatim.
      startConditions.putIfAbsent(state, StartConditionType.EXCLUSIVE);
    }
    final var indicesByState = new LinkedHashMap<String, List<Integer>>();
    indicesByState.put(
        TokenizerUtils.INITIAL_STATE, ruleIndicesByState.get(TokenizerUtils.INITIAL_STATE));
    indicesByState.putAll(ruleIndicesByState);
    return new LexGrammar(rules, startConditions, Map.of(), indicesByState);
  }

  public static Builder builder() {
    return new Builder();
  }

  public LexRule getRule(int index) {
    return rules.get(index);
  }

  /** Returns the index of the rule in this grammar, or -1 if it is not one of its rules. */
  public int getRuleIndex(LexRule rule) {
    final Integer index = ruleIndices.get(rule);
    return index != null ? index : -1;
  }

  public boolean hasState(String state) {
    return ruleIndicesByState.containsKey(state);
  }

  /**
   * Returns the ordered indices of the rules active in the lexer state.
   *
   * @throws InvalidGrammarException if the state is not in the rule table
   */
  public List<Integer> getRuleIndicesForState(String state) {
    final List<Integer> indices = ruleIndicesByState.get(state);
    if (indices == null) {
      throw new InvalidGrammarException("Unknown lexer state: " + state);
    }
    return indices;
  }

  /**
   * Returns the ordered rules active in the lexer state.
   *
   * @throws InvalidGrammarException if the state is not in the rule table
   */
  public List<LexRule> getRulesForState(String state) {
    final var stateRules = new ArrayList<LexRule>();
    for (int index : getRuleIndicesForState(state)) {
      stateRules.add(rules.get(index));
    }
    return stateRules;
  }

  /** Assembles a grammar from rule definitions, start conditions, macros and options. */
  public static class Builder {
    private final List<RuleDefinition> definitions = new ArrayList<>();
    private final Map<String, StartConditionType> startConditions = new LinkedHashMap<>();
    private final Map<String, String> macros = new LinkedHashMap<>();
    private Boolean caseInsensitive;

    private Builder() {
      startConditions.put(TokenizerUtils.INITIAL_STATE, StartConditionType.INCLUSIVE);
    }

    /** Defines a macro; {@code {name}} in a matcher is replaced by the body. */
    public Builder macro(String name, String body) {
      macros.put(requireNonNull(name, "name is null"), requireNonNull(body, "body is null"));
      return this;
    }

    public Builder startCondition(String name, StartConditionType type) {
      requireNonNull(name, "name is null");
      requireNonNull(type, "type is null");
      if (name.equals(TokenizerUtils.INITIAL_STATE) || name.equals(TokenizerUtils.ANY_STATE)) {
        throw new InvalidGrammarException("Start condition name is reserved: " + name);
      }
      startConditions.put(name, type);
      return this;
    }

    /** Sets the case-insensitive option of rules that do not set it. */
    public Builder caseInsensitive(boolean caseInsensitive) {
      this.caseInsensitive = caseInsensitive;
      return this;
    }

    public Builder rule(String matcher, LexRuleHandler handler) {
      return rule(List.of(), matcher, handler);
    }

    public Builder rule(List<String> conditions, String matcher, LexRuleHandler handler) {
      definitions.add(new RuleDefinition(conditions, matcher, handler, null));
      return this;
    }

    public Builder rule(
        List<String> conditions, String matcher, LexRuleHandler handler, boolean caseInsensitive) {
      definitions.add(new RuleDefinition(conditions, matcher, handler, caseInsensitive));
      return this;
    }

    /** Adds a rule as it is; macros and options are not applied to it. */
    public Builder rule(LexRule rule) {
      definitions.add(new RuleDefinition(requireNonNull(rule, "rule is null")));
      return this;
    }

    /**
     * Builds the grammar.
     *
     * @throws InvalidGrammarException if a matcher is invalid or a rule refers to an undeclared
     *     start condition
     */
    public LexGrammar build() {
      final boolean defaultCaseInsensitive =
          caseInsensitive != null ? caseInsensitive : TokenizerConfig.caseInsensitiveByDefault();
      final var rules = new ArrayList<LexRule>();
      for (RuleDefinition definition : definitions) {
        final LexRule rule = definition.toRule(macros, defaultCaseInsensitive);
        for (String condition : rule.getStartConditions()) {
          if (!condition.equals(TokenizerUtils.ANY_STATE)
              && !startConditions.containsKey(condition)) {
            throw new InvalidGrammarException(
                "Lex rule '" + rule.getOriginalMatcher() + "' uses undeclared start condition "
                    + condition);
          }
        }
        rules.add(rule);
      }

      final var indicesByState = new LinkedHashMap<String, List<Integer>>();
      for (var entry : startConditions.entrySet()) {
        final boolean inclusive = entry.getValue() == StartConditionType.INCLUSIVE;
        final var indices = new ArrayList<Integer>();
        for (int i = 0; i < rules.size(); ++i) {
          if (rules.get(i).appliesTo(entry.getKey(), inclusive)) {
            indices.add(i);
          }
        }
        indicesByState.put(entry.getKey(), indices);
        logger.debug(
            "Lexer state {} ({}) uses rules {}", entry.getKey(), entry.getValue(), indices);
      }
      return new LexGrammar(rules, startConditions, macros, indicesByState);
    }
  }

  private static class RuleDefinition {
    private final List<String> conditions;
    private final String matcher;
    private final LexRuleHandler handler;
    private final Boolean caseInsensitive;
    private final LexRule rule;

    RuleDefinition(
        List<String> conditions, String matcher, LexRuleHandler handler, Boolean caseInsensitive) {
      this.conditions = requireNonNull(conditions, "conditions is null");
      this.matcher = requireNonNull(matcher, "matcher is null");
      this.handler = requireNonNull(handler, "handler is null");
      this.caseInsensitive = caseInsensitive;
      this.rule = null;
    }

    RuleDefinition(LexRule rule) {
      this.conditions = rule.getStartConditions();
      this.matcher = rule.getOriginalMatcher();
      this.handler = rule.getHandler();
      this.caseInsensitive = rule.isCaseInsensitive();
      this.rule = rule;
    }

    LexRule toRule(Map<String, String> macros, boolean defaultCaseInsensitive) {
      if (rule != null) {
        return rule;
      }
      String expanded = matcher;
      for (var macro : macros.entrySet()) {
        expanded = expanded.replace("{" + macro.getKey() + "}", macro.getValue());
      }
      return new LexRule(
          conditions,
          matcher,
          expanded,
          handler,
          caseInsensitive != null ? caseInsensitive : defaultCaseInsensitive);
    }
  }
}
