/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.tinyc.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableList;

import exm.tinyc.common.CodeGenerator;
import exm.tinyc.common.exceptions.ArityMismatchError;
import exm.tinyc.common.exceptions.InvalidBreakError;
import exm.tinyc.common.exceptions.NotAddressableError;
import exm.tinyc.common.exceptions.SyntaxError;
import exm.tinyc.common.exceptions.TypeMismatchError;
import exm.tinyc.common.exceptions.UndeclaredNameError;
import exm.tinyc.common.exceptions.UserException;
import exm.tinyc.common.lang.Constants;
import exm.tinyc.common.lang.Operators.BinaryOp;
import exm.tinyc.common.lang.Parameter;
import exm.tinyc.common.lang.Symbol;
import exm.tinyc.common.lang.Symbol.PassingMode;
import exm.tinyc.common.lang.ValueType;
import exm.tinyc.common.util.StackLite;
import exm.tinyc.frontend.ControlFlowLabeler.LoopLabels;

/**
 * Single-pass recursive descent translator.
 *
 * Each production validates its syntax and emits code through the
 * generator as it is recognized; there is no syntax tree.  One token of
 * lookahead is held in {@link #token}.  Keywords are ordinary names
 * matched by text, so a keyword can also be declared as a variable.
 *
 * Every expression method returns the type of the value it left on the
 * stack.
 */
public class Parser {

  private static final String VAR = "VAR";
  private static final String PROCEDURE = "PROCEDURE";
  private static final String FUNCTION = "FUNCTION";
  private static final String PROGRAM = "PROGRAM";
  private static final String BEGIN = "BEGIN";
  private static final String END = "END";
  private static final String IF = "IF";
  private static final String ELSE = "ELSE";
  private static final String WHILE = "WHILE";
  private static final String REPEAT = "REPEAT";
  private static final String UNTIL = "UNTIL";
  private static final String LOOP = "LOOP";
  private static final String FOR = "FOR";
  private static final String TO = "TO";
  private static final String BREAK = "BREAK";
  private static final String READ = "READ";
  private static final String WRITE = "WRITE";
  private static final String REF = "REF";

  private final Scanner scanner;
  private final SymbolTable symbols;
  private final ControlFlowLabeler labeler;
  private final CodeGenerator gen;

  /** Global whose value the entry function returns */
  private final String resultVar;

  /** Labels of enclosing loops, innermost on top */
  private final StackLite<LoopLabels> loops = new StackLite<LoopLabels>();

  private Token token;

  /** Block nesting, for log indentation */
  private int depth = 0;

  public Parser(Scanner scanner, SymbolTable symbols,
                ControlFlowLabeler labeler, CodeGenerator gen,
                String resultVar) {
    this.scanner = scanner;
    this.symbols = symbols;
    this.labeler = labeler;
    this.gen = gen;
    this.resultVar = resultVar.toUpperCase(Locale.ROOT);
  }

  /**
   * Translate a whole program.  On return the generator holds the
   * complete module.
   * @throws UserException on the first error in the input
   */
  public void parseProgram() throws UserException {
    advance();
    topDecls();
    program();
  }

  // <top-decls> ::= ( <var-decl> | <procedure> | <function> )*
  private void topDecls() throws UserException {
    while (true) {
      if (token.isKeyword(VAR)) {
        varDecls();
      } else if (token.isKeyword(PROCEDURE)) {
        procedure(false);
      } else if (token.isKeyword(FUNCTION)) {
        procedure(true);
      } else if (token.isKeyword(PROGRAM)) {
        return;
      } else {
        throw SyntaxError.expected(token,
                        "VAR, PROCEDURE, FUNCTION or PROGRAM");
      }
      semi();
    }
  }

  // <program> ::= PROGRAM <name> BEGIN <block> END '.'
  private void program() throws UserException {
    matchKeyword(PROGRAM);
    Token name = match(TokenKind.NAME);
    semi();
    matchKeyword(BEGIN);
    LogHelper.debug(name.getPosition(), "program " + name.getText());

    gen.startEntryFunction();
    block();
    matchKeyword(END);
    entryResult();
    gen.endEntryFunction();

    match(TokenKind.DOT);
    if (!token.is(TokenKind.EOF)) {
      throw SyntaxError.expected(token, "end of input");
    }
    gen.endModule(symbols.globalFrame().variables());
  }

  /**
   * Leave the entry function's result on the stack
   */
  private void entryResult() {
    Symbol result = symbols.globalFrame().get(resultVar);
    if (result != null && result.isVariable()) {
      gen.getVar(result);
      gen.convert(result.getType(), ValueType.LONG);
    } else {
      gen.constant(ValueType.LONG, 0);
    }
  }

  // <var-decl> ::= VAR <var> ( ',' <var> )*
  private void varDecls() throws UserException {
    matchKeyword(VAR);
    varDecl();
    while (token.is(TokenKind.COMMA)) {
      advance();
      varDecl();
    }
  }

  // <var> ::= <name> [ ':' <type> ] [ '=' [ '-' ] <number> ]
  private void varDecl() throws UserException {
    Token name = match(TokenKind.NAME);
    ValueType type = ValueType.LONG;
    if (token.is(TokenKind.COLON)) {
      advance();
      type = parseType();
    }

    boolean hasInit = false;
    long init = 0;
    if (token.is(TokenKind.EQUAL)) {
      advance();
      boolean negative = false;
      if (token.is(TokenKind.SUB)) {
        advance();
        negative = true;
      }
      Token num = match(TokenKind.NUMBER);
      init = parseLiteral(num, negative);
      if (!ValueType.fits(type, init)) {
        throw new TypeMismatchError(num.getPosition(), "initial value " +
                   init + " of " + name.getText() + " does not fit " +
                   type.sourceName());
      }
      hasInit = true;
    }

    Symbol var;
    if (symbols.inGlobalScope()) {
      var = symbols.declare(name.getText(), name.getPosition(),
                            PassingMode.BY_VALUE, type, init);
    } else {
      var = symbols.declare(name.getText(), name.getPosition(),
                            PassingMode.BY_VALUE, type);
      if (hasInit) {
        // Locals have no static initializer
        gen.prepareSetVar(var);
        gen.constant(type, init);
        gen.setVar(var);
      }
    }
    LogHelper.debug(name.getPosition(), "declared " + var);
  }

  private ValueType parseType() throws UserException {
    Token name = match(TokenKind.NAME);
    ValueType type = ValueType.fromSourceName(name.getText());
    if (type == null) {
      throw SyntaxError.expected(name, "LONG or QUAD");
    }
    return type;
  }

  /*
   * <procedure> ::= PROCEDURE <name> '(' [ <params> ] ')'
   *                   <var-decl>* <block> END
   * <function>  ::= FUNCTION <name> '(' [ <params> ] ')' [ ':' <type> ]
   *                   <var-decl>* <block> END
   */
  private void procedure(boolean isFunction) throws UserException {
    advance();
    Token name = match(TokenKind.NAME);

    match(TokenKind.LPAREN);
    List<Parameter> params = new ArrayList<Parameter>();
    if (!token.is(TokenKind.RPAREN)) {
      params.add(parameter());
      while (token.is(TokenKind.COMMA)) {
        advance();
        params.add(parameter());
      }
    }
    match(TokenKind.RPAREN);

    ValueType resultType = null;
    if (isFunction) {
      resultType = ValueType.LONG;
      if (token.is(TokenKind.COLON)) {
        advance();
        resultType = parseType();
      }
    }

    // Declared before the body so that it may call itself
    Symbol proc = symbols.declareProcedure(name.getText(),
                              name.getPosition(), params, resultType);
    LogHelper.debug(name.getPosition(), "declared " + proc);

    symbols.pushScope(proc);
    gen.startFunction(proc);
    for (Parameter p: params) {
      symbols.declare(p.getName(), p.getPosition(), p.getMode(),
                      p.getType());
    }
    Symbol result = null;
    if (isFunction) {
      result = symbols.declare(Constants.RESULT_VAR, name.getPosition(),
                               PassingMode.BY_VALUE, resultType);
    }

    while (token.isKeyword(VAR)) {
      varDecls();
      semi();
    }
    block();
    matchKeyword(END);

    if (result != null) {
      gen.getVar(result);
    }
    gen.endFunction(proc, symbols.currentFrame().variables());
    symbols.popScope();
  }

  // <param> ::= [ REF ] <name> [ ':' <type> ]
  private Parameter parameter() throws UserException {
    PassingMode mode = PassingMode.BY_VALUE;
    Token name = match(TokenKind.NAME);
    if (name.isKeyword(REF) && token.is(TokenKind.NAME)) {
      mode = PassingMode.BY_REF;
      name = match(TokenKind.NAME);
    }
    ValueType type = ValueType.LONG;
    if (token.is(TokenKind.COLON)) {
      advance();
      type = parseType();
    }
    return new Parameter(name.getText(), name.getPosition(), mode, type);
  }

  /**
   * Statements up to a block-ending keyword or end of input.
   * The caller matches the keyword it expects.
   */
  private void block() throws UserException {
    depth++;
    while (!token.is(TokenKind.EOF) && !atBlockEnd()) {
      statement();
      semi();
    }
    depth--;
  }

  private boolean atBlockEnd() {
    return token.isKeyword(END) || token.isKeyword(ELSE) ||
           token.isKeyword(UNTIL);
  }

  private void statement() throws UserException {
    if (!token.is(TokenKind.NAME)) {
      throw SyntaxError.expected(token, "a statement");
    }
    LogHelper.trace(depth * 2, token.getPosition(), token.getText());

    String word = token.getText();
    if (word.equals(IF)) {
      doIf();
    } else if (word.equals(WHILE)) {
      doWhile();
    } else if (word.equals(REPEAT)) {
      doRepeat();
    } else if (word.equals(LOOP)) {
      doLoop();
    } else if (word.equals(FOR)) {
      doFor();
    } else if (word.equals(BREAK)) {
      doBreak();
    } else if (word.equals(READ)) {
      doRead();
    } else if (word.equals(WRITE)) {
      doWrite();
    } else {
      assignOrCall();
    }
  }

  // <assignment> ::= <name> '=' <bool-expr>
  // <call> ::= <name> '(' [ <args> ] ')'
  private void assignOrCall() throws UserException {
    Token name = match(TokenKind.NAME);
    if (token.is(TokenKind.LPAREN)) {
      Symbol proc = lookupProcedure(name);
      ValueType result = callProcedure(name, proc);
      if (result != null) {
        gen.drop();
      }
      return;
    }

    Symbol target = symbols.lookup(name);
    if (!target.isVariable()) {
      throw new SyntaxError(name.getPosition(),
                            "cannot assign to procedure " + name.getText());
    }
    match(TokenKind.EQUAL);
    gen.prepareSetVar(target);
    ValueType type = boolExpression();
    gen.convert(type, target.getType());
    gen.setVar(target);
  }

  // <if> ::= IF <bool-expr> <block> [ ELSE <block> ] END
  private void doIf() throws UserException {
    matchKeyword(IF);
    condition();
    gen.startIf();
    block();
    if (token.isKeyword(ELSE)) {
      advance();
      gen.startElse();
      block();
    }
    matchKeyword(END);
    gen.end();
  }

  // <while> ::= WHILE <bool-expr> <block> END
  private void doWhile() throws UserException {
    matchKeyword(WHILE);
    LoopLabels labels = labeler.newLoop();
    gen.startBlock(labels.breakLabel);
    gen.startLoop(labels.continueLabel);
    condition();
    gen.eqz(ValueType.LONG);
    gen.branchIf(labels.breakLabel);
    loopBody(labels);
    matchKeyword(END);
    gen.branch(labels.continueLabel);
    gen.end();
    gen.end();
  }

  // <repeat> ::= REPEAT <block> UNTIL <bool-expr>
  private void doRepeat() throws UserException {
    matchKeyword(REPEAT);
    LoopLabels labels = labeler.newLoop();
    gen.startBlock(labels.breakLabel);
    gen.startLoop(labels.continueLabel);
    loopBody(labels);
    matchKeyword(UNTIL);
    condition();
    gen.eqz(ValueType.LONG);
    gen.branchIf(labels.continueLabel);
    gen.end();
    gen.end();
  }

  // <loop> ::= LOOP <block> END
  private void doLoop() throws UserException {
    matchKeyword(LOOP);
    LoopLabels labels = labeler.newLoop();
    gen.startBlock(labels.breakLabel);
    gen.startLoop(labels.continueLabel);
    loopBody(labels);
    matchKeyword(END);
    gen.branch(labels.continueLabel);
    gen.end();
    gen.end();
  }

  /*
   * <for> ::= FOR <name> '=' <bool-expr> TO <bool-expr> <block> END
   *
   * The limit is evaluated once and kept on the shadow stack.  The
   * variable is tested against the limit before it is incremented, so it
   * never steps past the limit.
   */
  private void doFor() throws UserException {
    matchKeyword(FOR);
    Token name = match(TokenKind.NAME);
    Symbol var = symbols.lookup(name);
    if (!var.isVariable()) {
      throw new SyntaxError(name.getPosition(), "FOR loop variable " +
                            name.getText() + " is a procedure");
    }
    if (var.getType() != ValueType.LONG) {
      throw TypeMismatchError.expected(name.getPosition(),
          "FOR loop variable " + name.getText(), ValueType.LONG,
          var.getType());
    }

    match(TokenKind.EQUAL);
    gen.prepareSetVar(var);
    ValueType type = boolExpression();
    gen.convert(type, ValueType.LONG);
    gen.setVar(var);

    matchKeyword(TO);
    gen.comment("limit of FOR " + name.getText());
    gen.reserveStack(ValueType.LONG.size());
    gen.stackPointer();
    type = boolExpression();
    gen.convert(type, ValueType.LONG);
    gen.store(ValueType.LONG, 0);

    LoopLabels labels = labeler.newLoop();
    gen.startBlock(labels.breakLabel);
    gen.startLoop(labels.continueLabel);
    forLimitTest(var, BinaryOp.GT, labels.breakLabel);
    loopBody(labels);
    matchKeyword(END);
    forLimitTest(var, BinaryOp.GE, labels.breakLabel);
    gen.prepareSetVar(var);
    gen.getVar(var);
    gen.constant(ValueType.LONG, 1);
    gen.binaryOp(BinaryOp.ADD, ValueType.LONG);
    gen.setVar(var);
    gen.branch(labels.continueLabel);
    gen.end();
    gen.end();
    gen.releaseStack(ValueType.LONG.size());
  }

  private void forLimitTest(Symbol var, BinaryOp op, String exitLabel) {
    gen.getVar(var);
    gen.stackPointer();
    gen.load(ValueType.LONG, 0);
    gen.binaryOp(op, ValueType.LONG);
    gen.branchIf(exitLabel);
  }

  private void loopBody(LoopLabels labels) throws UserException {
    loops.push(labels);
    block();
    loops.pop();
  }

  private void doBreak() throws UserException {
    Token kw = token;
    matchKeyword(BREAK);
    if (loops.isEmpty()) {
      throw new InvalidBreakError(kw.getPosition());
    }
    gen.branch(loops.peek().breakLabel);
  }

  // <read> ::= READ '(' <name> ( ',' <name> )* ')'
  private void doRead() throws UserException {
    matchKeyword(READ);
    match(TokenKind.LPAREN);
    readInto();
    while (token.is(TokenKind.COMMA)) {
      advance();
      readInto();
    }
    match(TokenKind.RPAREN);
  }

  private void readInto() throws UserException {
    Token name = match(TokenKind.NAME);
    Symbol var = symbols.lookup(name);
    if (!var.isVariable()) {
      throw new SyntaxError(name.getPosition(), "cannot READ into " +
                            "procedure " + name.getText());
    }
    gen.prepareSetVar(var);
    gen.readInput();
    gen.convert(ValueType.LONG, var.getType());
    gen.setVar(var);
  }

  // <write> ::= WRITE '(' <bool-expr> ( ',' <bool-expr> )* ')'
  private void doWrite() throws UserException {
    matchKeyword(WRITE);
    match(TokenKind.LPAREN);
    writeValue();
    while (token.is(TokenKind.COMMA)) {
      advance();
      writeValue();
    }
    match(TokenKind.RPAREN);
  }

  private void writeValue() throws UserException {
    ValueType type = boolExpression();
    gen.convert(type, ValueType.LONG);
    gen.writeOutput();
  }

  private Symbol lookupProcedure(Token name) throws UserException {
    Symbol proc = symbols.lookup(name);
    if (!proc.isProcedure()) {
      throw new UndeclaredNameError(name.getPosition(), name.getText(),
                      "undeclared procedure: " + name.getText() +
                      " is a variable");
    }
    return proc;
  }

  /**
   * Arguments and call, starting at the opening parenthesis.
   *
   * A variable passed by reference is copied into a slot reserved on
   * the shadow stack as its argument is parsed, and the slot address is
   * passed.  After the call the slots are copied back and released.  A
   * by-ref parameter passed on by reference forwards its address.
   * @return the result type, or null for a procedure without result
   */
  private ValueType callProcedure(Token name, Symbol proc)
                                    throws UserException {
    match(TokenKind.LPAREN);
    ImmutableList<Parameter> params = proc.getParams();
    List<Symbol> copied = new ArrayList<Symbol>();
    int nargs = 0;
    if (!token.is(TokenKind.RPAREN)) {
      while (true) {
        if (nargs >= params.size()) {
          throw new ArityMismatchError(token.getPosition(), proc.getName(),
                                       params.size(), nargs + 1);
        }
        Parameter param = params.get(nargs);
        if (param.isByRef()) {
          Symbol var = refArgument(proc, param);
          if (var != null) {
            copied.add(var);
          }
        } else {
          ValueType type = boolExpression();
          gen.convert(type, param.getType());
        }
        nargs++;
        if (token.is(TokenKind.COMMA)) {
          advance();
        } else {
          break;
        }
      }
    }
    match(TokenKind.RPAREN);
    if (nargs != params.size()) {
      throw new ArityMismatchError(name.getPosition(), proc.getName(),
                                   params.size(), nargs);
    }

    gen.call(proc);
    restoreRefArguments(copied);
    return proc.getResultType();
  }

  /**
   * @return the variable to copy back after the call, or null if an
   *         address was forwarded
   */
  private Symbol refArgument(Symbol proc, Parameter param)
                              throws UserException {
    Token arg = token;
    String what = "argument for REF parameter " + param.getName() +
                  " of " + proc.getName();
    if (!arg.is(TokenKind.NAME)) {
      throw new NotAddressableError(arg.getPosition(),
                                    what + " must be a variable");
    }
    advance();
    if (!token.is(TokenKind.COMMA) && !token.is(TokenKind.RPAREN)) {
      throw new NotAddressableError(arg.getPosition(),
                                    what + " must be a variable");
    }
    Symbol var = symbols.lookup(arg);
    if (!var.isVariable()) {
      throw new NotAddressableError(arg.getPosition(), what +
                          " must be a variable, not a procedure");
    }
    if (var.getType() != param.getType()) {
      throw TypeMismatchError.expected(arg.getPosition(), what,
                                       param.getType(), var.getType());
    }

    if (var.isByRef()) {
      gen.getAddress(var);
      return null;
    }
    gen.comment("pass " + var.getName() + " by reference");
    gen.reserveStack(var.getType().size());
    gen.stackPointer();
    gen.getVar(var);
    gen.store(var.getType(), 0);
    gen.stackPointer();
    return var;
  }

  /**
   * Copy by-ref slots back, last argument first: it is on top of
   * the shadow stack.
   */
  private void restoreRefArguments(List<Symbol> copied) {
    if (copied.isEmpty()) {
      return;
    }
    int offset = 0;
    for (int i = copied.size() - 1; i >= 0; i--) {
      Symbol var = copied.get(i);
      gen.comment("restore " + var.getName() + " passed by reference");
      gen.prepareSetVar(var);
      gen.stackPointer();
      gen.load(var.getType(), offset);
      gen.setVar(var);
      offset += var.getType().size();
    }
    gen.releaseStack(offset);
  }

  /**
   * Boolean expression reduced to a LONG truth value
   */
  private void condition() throws UserException {
    ValueType type = boolExpression();
    if (type == ValueType.QUAD) {
      gen.eqz(ValueType.QUAD);
      gen.eqz(ValueType.LONG);
    }
  }

  // <bool-expr> ::= <bool-term> ( ( '|' | '~' ) <bool-term> )*
  private ValueType boolExpression() throws UserException {
    ValueType type = boolTerm();
    while (token.is(TokenKind.OR) || token.is(TokenKind.XOR)) {
      BinaryOp op = token.is(TokenKind.OR) ? BinaryOp.OR : BinaryOp.XOR;
      advance();
      ValueType rhs = boolTerm();
      type = finishBinary(op, type, rhs);
    }
    return type;
  }

  // <bool-term> ::= <not-factor> ( '&' <not-factor> )*
  private ValueType boolTerm() throws UserException {
    ValueType type = notFactor();
    while (token.is(TokenKind.AND)) {
      advance();
      ValueType rhs = notFactor();
      type = finishBinary(BinaryOp.AND, type, rhs);
    }
    return type;
  }

  // <not-factor> ::= [ '!' ] <relation>
  private ValueType notFactor() throws UserException {
    if (token.is(TokenKind.NOT)) {
      advance();
      ValueType type = relation();
      gen.eqz(type);
      return ValueType.LONG;
    }
    return relation();
  }

  // <relation> ::= <expression> [ <relop> <expression> ]
  private ValueType relation() throws UserException {
    ValueType type = expression();
    BinaryOp op = relop(token.getKind());
    if (op != null) {
      advance();
      ValueType rhs = expression();
      type = finishBinary(op, type, rhs);
    }
    return type;
  }

  private static BinaryOp relop(TokenKind kind) {
    switch (kind) {
      case EQUAL:
        return BinaryOp.EQ;
      case NOT_EQUAL:
        return BinaryOp.NE;
      case LESS_THAN:
        return BinaryOp.LT;
      case LESS_EQUAL:
        return BinaryOp.LE;
      case GREATER_THAN:
        return BinaryOp.GT;
      case GREATER_EQUAL:
        return BinaryOp.GE;
      default:
        return null;
    }
  }

  // <expression> ::= <first-term> ( ( '+' | '-' ) <term> )*
  private ValueType expression() throws UserException {
    ValueType type = firstTerm();
    while (token.is(TokenKind.ADD) || token.is(TokenKind.SUB)) {
      BinaryOp op = token.is(TokenKind.ADD) ? BinaryOp.ADD : BinaryOp.SUB;
      advance();
      ValueType rhs = term();
      type = finishBinary(op, type, rhs);
    }
    return type;
  }

  // <first-term> ::= <first-factor> ( ( '*' | '/' ) <factor> )*
  private ValueType firstTerm() throws UserException {
    return termTail(firstFactor());
  }

  // <term> ::= <factor> ( ( '*' | '/' ) <factor> )*
  private ValueType term() throws UserException {
    return termTail(factor());
  }

  private ValueType termTail(ValueType type) throws UserException {
    while (token.is(TokenKind.MUL) || token.is(TokenKind.DIV)) {
      BinaryOp op = token.is(TokenKind.MUL) ? BinaryOp.MUL : BinaryOp.DIV;
      advance();
      ValueType rhs = factor();
      type = finishBinary(op, type, rhs);
    }
    return type;
  }

  // <first-factor> ::= [ '+' | '-' ] <factor>
  private ValueType firstFactor() throws UserException {
    if (token.is(TokenKind.ADD)) {
      advance();
      return factor();
    } else if (token.is(TokenKind.SUB)) {
      advance();
      if (token.is(TokenKind.NUMBER)) {
        return literal(match(TokenKind.NUMBER), true);
      }
      ValueType type = factor();
      gen.constant(type, -1);
      gen.binaryOp(BinaryOp.MUL, type);
      return type;
    }
    return factor();
  }

  // <factor> ::= <number> | <name> | <name> '(' [ <args> ] ')'
  //            | '(' <bool-expr> ')'
  private ValueType factor() throws UserException {
    if (token.is(TokenKind.LPAREN)) {
      advance();
      ValueType type = boolExpression();
      match(TokenKind.RPAREN);
      return type;
    } else if (token.is(TokenKind.NUMBER)) {
      return literal(match(TokenKind.NUMBER), false);
    } else if (token.is(TokenKind.NAME)) {
      Token name = match(TokenKind.NAME);
      if (token.is(TokenKind.LPAREN)) {
        Symbol proc = lookupProcedure(name);
        if (!proc.isFunction()) {
          throw new SyntaxError(name.getPosition(), "procedure " +
              name.getText() + " has no result and cannot be used in " +
              "an expression");
        }
        return callProcedure(name, proc);
      }
      Symbol var = symbols.lookup(name);
      if (!var.isVariable()) {
        throw new SyntaxError(name.getPosition(), "procedure " +
                              name.getText() + " used as a value");
      }
      gen.getVar(var);
      return var.getType();
    }
    throw SyntaxError.expected(token, "an expression");
  }

  private ValueType literal(Token num, boolean negative)
                                    throws SyntaxError {
    long value = parseLiteral(num, negative);
    ValueType type = ValueType.forLiteral(value);
    gen.constant(type, value);
    return type;
  }

  private static long parseLiteral(Token num, boolean negative)
                                    throws SyntaxError {
    String text = negative ? "-" + num.getText() : num.getText();
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new SyntaxError(num.getPosition(),
                            "integer literal out of range: " + text);
    }
  }

  /**
   * Emit a binary operator once both operands are on the stack,
   * widening the narrower operand.  A LONG left operand lies under a
   * QUAD right operand, so the right operand is parked in a scratch
   * variable while the left one is converted.
   * @return type of the result
   */
  private ValueType finishBinary(BinaryOp op, ValueType lhs,
                                 ValueType rhs) {
    ValueType operand = ValueType.widen(lhs, rhs);
    if (lhs != operand) {
      Symbol tmp = symbols.scratch(rhs);
      gen.setVar(tmp);
      gen.convert(lhs, operand);
      gen.getVar(tmp);
    } else {
      gen.convert(rhs, operand);
    }
    gen.binaryOp(op, operand);
    return op.resultType(operand);
  }

  private void advance() throws UserException {
    token = scanner.advance();
  }

  /**
   * Consume a token of the given kind
   * @return the consumed token
   */
  private Token match(TokenKind kind) throws UserException {
    if (!token.is(kind)) {
      throw SyntaxError.expected(token, kind.describe());
    }
    Token matched = token;
    advance();
    return matched;
  }

  private void matchKeyword(String keyword) throws UserException {
    if (!token.isKeyword(keyword)) {
      throw SyntaxError.expected(token, "'" + keyword + "'");
    }
    advance();
  }

  /** Optional statement terminator */
  private void semi() throws UserException {
    if (token.is(TokenKind.SEMICOLON)) {
      advance();
    }
  }
}
