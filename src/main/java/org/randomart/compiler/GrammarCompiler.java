/*
 * Copyright 2025 The Randomart Authors
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

package org.randomart.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.randomart.compiler.ArtGrammarParser.AlternativeContext;
import org.randomart.compiler.ArtGrammarParser.GrammarFileContext;
import org.randomart.compiler.ArtGrammarParser.ProductionContext;
import org.randomart.expr.SourcePos;
import org.randomart.grammar.Grammar;
import org.randomart.grammar.GrammarException;
import org.randomart.grammar.Production;
import org.randomart.grammar.WeightedAlternative;

/** Parses the text of a grammar into a {@link Grammar}. */
public class GrammarCompiler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private GrammarCompiler() {}

  /** Reads and compiles a UTF-8 grammar file. */
  public static Grammar compile(Path path) throws IOException, GrammarException {
    return compile(CharStreams.fromPath(path, StandardCharsets.UTF_8), path.toString());
  }

  /**
   * Compiles the grammar read from {@code input}; {@code sourceName} is used in the positions of
   * grammar elements and error messages.
   *
   * <p>The returned grammar has been {@link Grammar#validate validated}.
   *
   * @throws GrammarException if the input has a syntax error, defines a production more than once,
   *     or has a production with invalid weights
   */
  public static Grammar compile(CharStream input, String sourceName) throws GrammarException {
    ErrorListener errorListener = new ErrorListener(sourceName);
    ArtGrammarLexer lexer = new ArtGrammarLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    ArtGrammarParser parser = new ArtGrammarParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    GrammarFileContext tree;
    try {
      tree = parser.grammarFile();
    } catch (SyntaxError e) {
      throw new GrammarException(e.pos, e.pos + ": " + e.getMessage(), e);
    }
    Grammar grammar = new GrammarBuilder(sourceName).build(tree);
    grammar.validate();
    logger.atFine().log(
        "Compiled %d productions from %s", grammar.productions().size(), sourceName);
    return grammar;
  }

  /** Returns the position of the given token. */
  static SourcePos pos(String sourceName, Token token) {
    return new SourcePos(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
  }

  /** Builds the Grammar model from a parse tree. */
  private static class GrammarBuilder {
    final String sourceName;
    final TemplateBuilder templates;

    GrammarBuilder(String sourceName) {
      this.sourceName = sourceName;
      this.templates = new TemplateBuilder(sourceName);
    }

    Grammar build(GrammarFileContext ctx) {
      ImmutableList.Builder<Production> productions = ImmutableList.builder();
      for (ProductionContext production : ctx.production()) {
        productions.add(production(production));
      }
      return new Grammar(sourceName, productions.build());
    }

    private Production production(ProductionContext ctx) {
      ImmutableList.Builder<WeightedAlternative> alternatives = ImmutableList.builder();
      for (AlternativeContext alternative : ctx.alternative()) {
        alternatives.add(
            new WeightedAlternative(
                pos(sourceName, alternative.start),
                templates.visit(alternative.template()),
                Double.parseDouble(alternative.weight.getText())));
      }
      return new Production(pos(sourceName, ctx.name), ctx.name.getText(), alternatives.build());
    }
  }

  /** Thrown by the ErrorListener, and caught in {@link #compile}. */
  private static class SyntaxError extends RuntimeException {
    final SourcePos pos;

    SyntaxError(SourcePos pos, String message) {
      super(message);
      this.pos = pos;
    }
  }

  /** Stops lexing or parsing at the first error. */
  private static class ErrorListener extends BaseErrorListener {
    final String sourceName;

    ErrorListener(String sourceName) {
      this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e) {
      throw new SyntaxError(new SourcePos(sourceName, line, charPositionInLine + 1), msg);
    }
  }
}
