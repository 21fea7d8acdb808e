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

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a lex rule handler. There are three kinds:
 *
 * <ul>
 *   <li>{@link Skip} - the match is consumed and no token is produced
 *   <li>{@link Emit} - one token of the given type is produced
 *   <li>{@link EmitAndQueue} - a token of the head type is produced now, and one token per queued
 *       type on the following calls, all sharing the location of the match
 * </ul>
 */
public abstract class HandlerResult {

  public enum Kind {
    SKIP,
    EMIT,
    EMIT_AND_QUEUE
  }

  private static final Skip SKIP = new Skip();

  private HandlerResult() {}

  public abstract Kind getKind();

  public static HandlerResult skip() {
    return SKIP;
  }

  public static HandlerResult emit(String type) {
    return new Emit(type, null);
  }

  /**
   * Emits a token whose value is replaced by the given text. The token location still describes
   * the matched lexeme.
   */
  public static HandlerResult emit(String type, String value) {
    return new Emit(type, requireNonNull(value, "value is null"));
  }

  /**
   * Emits the first type now and queues the rest.
   *
   * @param types Token types in emission order; must not be empty
   * @return {@link Emit} for a single type, {@link EmitAndQueue} otherwise
   */
  public static HandlerResult emitAll(String... types) {
    return emitAll(Arrays.asList(types));
  }

  public static HandlerResult emitAll(List<String> types) {
    requireNonNull(types, "types is null");
    if (types.isEmpty()) {
      throw new IllegalArgumentException("At least one token type is required");
    }
    if (types.size() == 1) {
      return emit(types.get(0));
    }
    return new EmitAndQueue(types.get(0), types.subList(1, types.size()));
  }

  /** Match is discarded. */
  @ToString
  public static final class Skip extends HandlerResult {
    private Skip() {}

    @Override
    public Kind getKind() {
      return Kind.SKIP;
    }
  }

  @Getter
  @ToString
  public static final class Emit extends HandlerResult {
    private final String type;

    /** Replacement for the token value, or null to use the matched lexeme. */
    private final String value;

    private Emit(String type, String value) {
      this.type = requireNonNull(type, "type is null");
      this.value = value;
    }

    @Override
    public Kind getKind() {
      return Kind.EMIT;
    }
  }

  @Getter
  @ToString
  public static final class EmitAndQueue extends HandlerResult {
    private final String type;
    private final List<String> queuedTypes;

    private EmitAndQueue(String type, List<String> queuedTypes) {
      this.type = requireNonNull(type, "type is null");
      for (String queuedType : queuedTypes) {
        requireNonNull(queuedType, "queued token type is null");
      }
      this.queuedTypes = List.copyOf(queuedTypes);
    }

    @Override
    public Kind getKind() {
      return Kind.EMIT_AND_QUEUE;
    }
  }
}
