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
package io.isima.syntax.common;

import java.util.Properties;

/** Tokenizer configuration value provider. */
public class TokenizerConfig {

  /** Token type reported once the input is exhausted. */
  public static final String EOF_SYMBOL = "io.isima.syntax.tokenizer.eofSymbol";

  /** Whether an empty match that is discarded without a state change fails the scan. */
  public static final String ZERO_WIDTH_SKIP_CHECK = "io.isima.syntax.tokenizer.zeroWidthSkipCheck";

  /** Default of the case-insensitive option for lex rules that do not set it. */
  public static final String CASE_INSENSITIVE = "io.isima.syntax.tokenizer.caseInsensitive";

  public static final String DEFAULT_EOF_SYMBOL = "$";

  //
  // Utilities ///////////////////////////////////////////////////////////////////////
  //
  protected static SyntaxConfigBase getInstance() {
    return SyntaxConfigBase.getInstance();
  }

  public static void setProperties(Properties properties) {
    SyntaxConfigBase.setProperties(properties);
  }

  //
  // End utilities ///////////////////////////////////////////////////////////////////////

  public static String eofSymbol() {
    final String symbol = getInstance().getString(EOF_SYMBOL, DEFAULT_EOF_SYMBOL);
    return symbol.isEmpty() ? DEFAULT_EOF_SYMBOL : symbol;
  }

  public static boolean zeroWidthSkipCheckEnabled() {
    return getInstance().getBoolean(ZERO_WIDTH_SKIP_CHECK, true);
  }

  public static boolean caseInsensitiveByDefault() {
    return getInstance().getBoolean(CASE_INSENSITIVE, false);
  }
}
