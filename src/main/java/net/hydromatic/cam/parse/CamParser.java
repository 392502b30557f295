/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cam.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cam.ast.AstBuilder.ast;

import java.math.BigDecimal;
import net.hydromatic.cam.ast.Ast;
import net.hydromatic.cam.ast.Op;
import net.hydromatic.cam.ast.Pos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for lambda terms.
 *
 * <p>The grammar is as follows:
 *
 * <pre>{@code
 * program  := term EOF
 * term     := number | identifier | '(' form ')'
 * form     := 'lambda' identifier [':' type] '.' form
 *           | term ('+' | '*') term
 *           | term term*
 * type     := typeAtom ['->' type]
 * typeAtom := identifier | '(' type ')'
 * }</pre>
 *
 * <p>A sequence of terms in a form is an application, and associates to the
 * left: "{@code (f x y)}" is "{@code ((f x) y)}". A form that contains a
 * single term is a grouping.
 *
 * <p>The parser reads characters with one character of lookahead, and never
 * backtracks except when matching the keyword {@code lambda}.
 */
public class CamParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(CamParser.class);

  static final String LAMBDA = "lambda";

  private final String text;
  private final String file;
  private int offset;

  /** Creates a parser. */
  public CamParser(String text) {
    this(text, "");
  }

  /** Creates a parser for text that came from a given file. The file name is
   * used only in error positions. */
  public CamParser(String text, String file) {
    this.text = requireNonNull(text);
    this.file = requireNonNull(file);
  }

  /** Parses a string as a term. */
  public static Ast.Exp parse(String text) {
    return new CamParser(text).program();
  }

  /** Parses a string as a type. */
  public static Ast.Type parseType(String text) {
    final CamParser parser = new CamParser(text);
    final Ast.Type type = parser.type();
    parser.expectEnd();
    return type;
  }

  /** Parses a complete program, which is a single term followed by the end
   * of the input. */
  public Ast.Exp program() {
    final Ast.Exp exp = term();
    expectEnd();
    LOGGER.debug("parsed [{}]", exp);
    return exp;
  }

  private void expectEnd() {
    skipWhitespace();
    if (offset < text.length()) {
      throw error("unexpected trailing input after complete term");
    }
  }

  /** Parses a term: a number, an identifier, or a parenthesized form. */
  Ast.Exp term() {
    skipWhitespace();
    final int start = offset;
    if (offset >= text.length()) {
      throw expected("term");
    }
    final char c = text.charAt(offset);
    if (isDigit(c)) {
      return number();
    }
    if (isIdentifierStart(c)) {
      final String name = identifier();
      return ast.id(pos(start, offset), name);
    }
    if (c == '(') {
      ++offset;
      final Ast.Exp exp = form(start);
      expect(')');
      return reposition(exp, pos(start, offset));
    }
    throw expected("term");
  }

  /** Parses the contents of a parenthesized form. */
  private Ast.Exp form(int parenOffset) {
    skipWhitespace();
    final int start = offset;
    if (lookingAtKeyword()) {
      offset += LAMBDA.length();
      skipWhitespace();
      if (offset >= text.length() || !isIdentifierStart(text.charAt(offset))) {
        throw expected("parameter name");
      }
      final String param = identifier();
      skipWhitespace();
      Ast.Type paramType = null;
      if (offset < text.length() && text.charAt(offset) == ':') {
        ++offset;
        paramType = type();
        skipWhitespace();
      }
      expect('.');
      final Ast.Exp body = form(parenOffset);
      return ast.fn(pos(parenOffset, offset), param, paramType, body);
    }
    Ast.Exp exp = term();
    skipWhitespace();
    if (offset < text.length()) {
      final Op op = Op.BY_CHAR.get(text.charAt(offset));
      if (op != null) {
        ++offset;
        final Ast.Exp right = term();
        return ast.infixCall(pos(start, offset), op, exp, right);
      }
    }
    for (;;) {
      skipWhitespace();
      if (offset >= text.length() || text.charAt(offset) == ')') {
        return exp;
      }
      final Ast.Exp arg = term();
      exp = ast.apply(pos(start, offset), exp, arg);
    }
  }

  /** Parses a type. The "->" operator is right-associative. */
  Ast.Type type() {
    skipWhitespace();
    final int start = offset;
    final Ast.Type type = typeAtom();
    skipWhitespace();
    if (offset < text.length() && text.charAt(offset) == '-') {
      ++offset;
      expect('>');
      final Ast.Type resultType = type();
      return ast.functionType(pos(start, offset), type, resultType);
    }
    return type;
  }

  private Ast.Type typeAtom() {
    skipWhitespace();
    final int start = offset;
    if (offset < text.length()) {
      final char c = text.charAt(offset);
      if (isIdentifierStart(c)) {
        final String name = identifier();
        return ast.namedType(pos(start, offset), name);
      }
      if (c == '(') {
        ++offset;
        final Ast.Type type = type();
        expect(')');
        return type;
      }
    }
    throw expected("type");
  }

  private Ast.Literal number() {
    final int start = offset;
    while (offset < text.length() && isDigit(text.charAt(offset))) {
      ++offset;
    }
    final BigDecimal value = new BigDecimal(text.substring(start, offset));
    if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
      throw new CamParseException("integer literal out of range: " + value,
          pos(start, offset));
    }
    return ast.intLiteral(pos(start, offset), value);
  }

  /** Reads an identifier, and throws if it is a reserved word. */
  private String identifier() {
    final int start = offset;
    ++offset;
    while (offset < text.length() && isIdentifierPart(text.charAt(offset))) {
      ++offset;
    }
    final String name = text.substring(start, offset);
    if (name.equals(LAMBDA)) {
      throw new CamParseException("reserved word '" + LAMBDA
          + "' cannot be used as an identifier", pos(start, offset));
    }
    return name;
  }

  /** Returns whether the keyword "lambda" starts at the current offset, and is
   * not merely the prefix of a longer identifier. */
  private boolean lookingAtKeyword() {
    if (!text.startsWith(LAMBDA, offset)) {
      return false;
    }
    final int end = offset + LAMBDA.length();
    return end >= text.length() || !isIdentifierPart(text.charAt(end));
  }

  private void expect(char c) {
    skipWhitespace();
    if (offset >= text.length() || text.charAt(offset) != c) {
      throw expected("'" + c + "'");
    }
    ++offset;
  }

  private void skipWhitespace() {
    while (offset < text.length()
        && Character.isWhitespace(text.charAt(offset))) {
      ++offset;
    }
  }

  /** Creates an exception saying that something was expected at the current
   * offset, and describing what was found instead. */
  private CamParseException expected(String expected) {
    final String found = offset >= text.length()
        ? "end of input"
        : "'" + text.charAt(offset) + "'";
    return error("expected " + expected + " but found " + found);
  }

  private CamParseException error(String message) {
    return new CamParseException(message, pos(offset, offset + 1));
  }

  /** Returns the position of a range of characters. A range that starts at
   * the end of the input denotes the position just after the last
   * character. */
  private Pos pos(int startOffset, int endOffset) {
    if (startOffset >= text.length()) {
      final Pos pos = Pos.of(text, file, text.length(), text.length());
      return new Pos(file, pos.startLine, pos.startColumn, pos.endLine,
          pos.endColumn + 1);
    }
    return Pos.of(text, file, startOffset, Math.min(endOffset, text.length()));
  }

  /** Returns a copy of an expression with a wider position, namely including
   * the surrounding parentheses. */
  private static Ast.Exp reposition(Ast.Exp exp, Pos pos) {
    if (exp instanceof Ast.Apply) {
      final Ast.Apply apply = (Ast.Apply) exp;
      return ast.apply(pos, apply.fn, apply.arg);
    } else if (exp instanceof Ast.InfixCall) {
      final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
      return ast.infixCall(pos, infixCall.op, infixCall.a0, infixCall.a1);
    } else if (exp instanceof Ast.Fn) {
      final Ast.Fn fn = (Ast.Fn) exp;
      return ast.fn(pos, fn.param, fn.paramType, fn.body);
    } else {
      // a grouping such as "(x)" keeps the position of its contents
      return exp;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c) || c == '_';
  }
}

// End CamParser.java
