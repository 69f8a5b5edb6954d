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

import org.antlr.v4.runtime.ParserRuleContext;
import org.randomart.compiler.ArtGrammarParser.BooleanTemplateContext;
import org.randomart.compiler.ArtGrammarParser.ComponentTemplateContext;
import org.randomart.compiler.ArtGrammarParser.IfTemplateContext;
import org.randomart.compiler.ArtGrammarParser.NumberTemplateContext;
import org.randomart.compiler.ArtGrammarParser.OperatorTemplateContext;
import org.randomart.compiler.ArtGrammarParser.RandomTemplateContext;
import org.randomart.compiler.ArtGrammarParser.RuleTemplateContext;
import org.randomart.compiler.ArtGrammarParser.TripletTemplateContext;
import org.randomart.expr.Component;
import org.randomart.expr.Op;
import org.randomart.expr.SourcePos;
import org.randomart.grammar.Template;

/**
 * Converts the parse tree of an alternative's right hand side into a {@link Template}. Each
 * template's position is the position of its first token.
 */
class TemplateBuilder extends ArtGrammarBaseVisitor<Template> {
  private final String sourceName;

  TemplateBuilder(String sourceName) {
    this.sourceName = sourceName;
  }

  private SourcePos pos(ParserRuleContext ctx) {
    return GrammarCompiler.pos(sourceName, ctx.start);
  }

  @Override
  public Template visitTripletTemplate(TripletTemplateContext ctx) {
    return new Template.Triplet(pos(ctx), visit(ctx.one), visit(ctx.two), visit(ctx.three));
  }

  @Override
  public Template visitIfTemplate(IfTemplateContext ctx) {
    return new Template.IfThenElse(
        pos(ctx), visit(ctx.cond), visit(ctx.then), visit(ctx.otherwise));
  }

  @Override
  public Template visitOperatorTemplate(OperatorTemplateContext ctx) {
    return new Template.BinaryOp(
        pos(ctx), Op.forName(ctx.op.getText()), visit(ctx.left), visit(ctx.right));
  }

  @Override
  public Template visitNumberTemplate(NumberTemplateContext ctx) {
    // The lexer only accepts digits with an optional sign and decimal point, all of which
    // parseDouble() handles.
    return new Template.NumberLiteral(pos(ctx), Double.parseDouble(ctx.getText()));
  }

  @Override
  public Template visitBooleanTemplate(BooleanTemplateContext ctx) {
    return new Template.BooleanLiteral(pos(ctx), ctx.value.getType() == ArtGrammarLexer.TRUE);
  }

  @Override
  public Template visitComponentTemplate(ComponentTemplateContext ctx) {
    return new Template.ComponentLiteral(pos(ctx), Component.forSymbol(ctx.getText()));
  }

  @Override
  public Template visitRandomTemplate(RandomTemplateContext ctx) {
    return new Template.RandomLiteral(pos(ctx));
  }

  @Override
  public Template visitRuleTemplate(RuleTemplateContext ctx) {
    return new Template.RuleRef(pos(ctx), ctx.getText());
  }
}
