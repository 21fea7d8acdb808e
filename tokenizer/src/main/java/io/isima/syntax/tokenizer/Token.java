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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A token produced by the {@link Tokenizer}.
 *
 * <p>Offsets are zero-based indices into the tokenized string, lines are 1-based and columns are
 * 0-based counted from the beginning of their line. The end offset and end column are exclusive.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({
  "type",
  "value",
  "startOffset",
  "endOffset",
  "startLine",
  "endLine",
  "startColumn",
  "endColumn"
})
public class Token {

  /** Token type declared by a lex rule, or the end-of-input symbol. */
  @JsonProperty("type")
  private final String type;

  /** Matched text. */
  @JsonProperty("value")
  private final String value;

  @JsonProperty("startOffset")
  private final int startOffset;

  @JsonProperty("endOffset")
  private final int endOffset;

  @JsonProperty("startLine")
  private final int startLine;

  @JsonProperty("endLine")
  private final int endLine;

  @JsonProperty("startColumn")
  private final int startColumn;

  @JsonProperty("endColumn")
  private final int endColumn;

  @JsonCreator
  public Token(
      @JsonProperty("type") String type,
      @JsonProperty("value") String value,
      @JsonProperty("startOffset") int startOffset,
      @JsonProperty("endOffset") int endOffset,
      @JsonProperty("startLine") int startLine,
      @JsonProperty("endLine") int endLine,
      @JsonProperty("startColumn") int startColumn,
      @JsonProperty("endColumn") int endColumn) {
    this.type = requireNonNull(type, "type is null");
    this.value = requireNonNull(value, "value is null");
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.startLine = startLine;
    this.endLine = endLine;
    this.startColumn = startColumn;
    this.endColumn = endColumn;
  }

  /** Number of characters the token spans in the source. */
  public int length() {
    return endOffset - startOffset;
  }
}
