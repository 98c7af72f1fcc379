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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tinyc.common.Logging;
import exm.tinyc.common.exceptions.ArityMismatchError;
import exm.tinyc.common.exceptions.DuplicateDeclarationError;
import exm.tinyc.common.exceptions.InvalidBreakError;
import exm.tinyc.common.exceptions.NotAddressableError;
import exm.tinyc.common.exceptions.SyntaxError;
import exm.tinyc.common.exceptions.TypeMismatchError;
import exm.tinyc.common.exceptions.UndeclaredNameError;
import exm.tinyc.common.exceptions.UserException;
import exm.tinyc.ui.TinyCompiler;

public class ParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ParserTest.tinyc.log", true);
  }

  static String compile(String source) throws UserException {
    return new TinyCompiler(Logging.getTinyLogger())
                    .compileToString("test.tiny", source);
  }

  /**
   * @return instructions of the named function, without locals
   *         and comments
   */
  static List<String> body(String wat, String func) {
    List<String> result = new ArrayList<String>();
    boolean inside = false;
    for (String line: wat.split("\n")) {
      String t = line.trim();
      if (!inside) {
        inside = t.equals("(func $" + func) ||
                 t.startsWith("(func $" + func + " ");
      } else if (t.equals(")")) {
        return result;
      } else if (!t.startsWith("(local ") && !t.startsWith(";;")) {
        result.add(t);
      }
    }
    throw new AssertionError("No function " + func + " in:\n" + wat);
  }

  @Test
  public void testDuplicateGlobal() throws UserException {
    exception.expect(DuplicateDeclarationError.class);
    exception.expectMessage("test.tiny:1:8: duplicate declaration of X");
    compile("VAR X, X PROGRAM P BEGIN END.");
  }

  @Test
  public void testDuplicateParameter() throws UserException {
    exception.expect(DuplicateDeclarationError.class);
    compile("PROCEDURE Q(A, A) END PROGRAM P BEGIN END.");
  }

  @Test
  public void testAssignUndeclared() throws UserException {
    exception.expect(UndeclaredNameError.class);
    exception.expectMessage("undeclared name: Y");
    compile("PROGRAM P BEGIN Y = 1 END.");
  }

  @Test
  public void testCallBeforeDeclaration() throws UserException {
    exception.expect(UndeclaredNameError.class);
    compile("PROCEDURE A() B() END\n" +
            "PROCEDURE B() END\n" +
            "PROGRAM P BEGIN A() END.");
  }

  @Test
  public void testCallVariable() throws UserException {
    exception.expect(UndeclaredNameError.class);
    compile("VAR X PROGRAM P BEGIN X() END.");
  }

  @Test
  public void testTooManyArguments() throws UserException {
    exception.expect(ArityMismatchError.class);
    exception.expectMessage("Q expects 2 argument(s) but got 3");
    compile("PROCEDURE Q(A, B) END PROGRAM P BEGIN Q(1, 2, 3) END.");
  }

  @Test
  public void testTooFewArguments() throws UserException {
    exception.expect(ArityMismatchError.class);
    exception.expectMessage("Q expects 2 argument(s) but got 1");
    compile("PROCEDURE Q(A, B) END PROGRAM P BEGIN Q(1) END.");
  }

  @Test
  public void testRefLiteral() throws UserException {
    exception.expect(NotAddressableError.class);
    compile("PROCEDURE Q(REF A) END PROGRAM P BEGIN Q(5) END.");
  }

  @Test
  public void testRefExpression() throws UserException {
    exception.expect(NotAddressableError.class);
    compile("VAR X PROCEDURE Q(REF A) END PROGRAM P BEGIN Q(X + 1) END.");
  }

  @Test
  public void testRefProcedure() throws UserException {
    exception.expect(NotAddressableError.class);
    compile("PROCEDURE Q(REF A) END PROGRAM P BEGIN Q(Q) END.");
  }

  @Test
  public void testRefTypeMismatch() throws UserException {
    exception.expect(TypeMismatchError.class);
    compile("VAR X: QUAD PROCEDURE Q(REF A) END " +
            "PROGRAM P BEGIN Q(X) END.");
  }

  @Test
  public void testBreakOutsideLoop() throws UserException {
    exception.expect(InvalidBreakError.class);
    compile("PROGRAM P BEGIN IF 1 BREAK END END.");
  }

  @Test
  public void testBreakInProcedureCalledFromLoop() throws UserException {
    exception.expect(InvalidBreakError.class);
    compile("PROCEDURE Q() BREAK END " +
            "PROGRAM P BEGIN LOOP Q() END END.");
  }

  @Test
  public void testProcedureInExpression() throws UserException {
    exception.expect(SyntaxError.class);
    exception.expectMessage("has no result");
    compile("VAR X PROCEDURE Q() END PROGRAM P BEGIN X = Q() END.");
  }

  @Test
  public void testMissingEnd() throws UserException {
    exception.expect(SyntaxError.class);
    exception.expectMessage("expected 'END'");
    compile("VAR X PROGRAM P BEGIN WHILE X X = 0");
  }

  @Test
  public void testTrailingInput() throws UserException {
    exception.expect(SyntaxError.class);
    compile("PROGRAM P BEGIN END. X");
  }

  @Test
  public void testLiteralOutOfRange() throws UserException {
    exception.expect(SyntaxError.class);
    exception.expectMessage("out of range");
    compile("VAR X: QUAD PROGRAM P BEGIN X = 9223372036854775808 END.");
  }

  @Test
  public void testInitializerTooLarge() throws UserException {
    exception.expect(TypeMismatchError.class);
    compile("VAR X = 3000000000 PROGRAM P BEGIN END.");
  }

  @Test
  public void testQuadForVariable() throws UserException {
    exception.expect(TypeMismatchError.class);
    compile("VAR I: QUAD PROGRAM P BEGIN FOR I = 1 TO 2 END END.");
  }

  @Test
  public void testEvaluationOrder() throws UserException {
    String wat = compile("VAR X PROGRAM P BEGIN X = 2 + 3 * 4 END.");
    assertEquals(Arrays.asList(
        "i32.const 2",
        "i32.const 3",
        "i32.const 4",
        "i32.mul",
        "i32.add",
        "global.set $X",
        "global.get $X"),
        body(wat, "main"));
  }

  @Test
  public void testNegativeLiteralFolded() throws UserException {
    String wat = compile("VAR X PROGRAM P BEGIN X = -5; X = -X * 2 END.");
    assertEquals(Arrays.asList(
        "i32.const -5",
        "global.set $X",
        "global.get $X",
        "i32.const -1",
        "i32.mul",
        "i32.const 2",
        "i32.mul",
        "global.set $X",
        "global.get $X"),
        body(wat, "main"));
  }

  @Test
  public void testWhileShape() throws UserException {
    String wat = compile("VAR X PROGRAM P BEGIN WHILE X < 3 " +
                         "X = X + 1 END END.");
    assertEquals(Arrays.asList(
        "block $break1",
        "loop $loop1",
        "global.get $X",
        "i32.const 3",
        "i32.lt_s",
        "i32.eqz",
        "br_if $break1",
        "global.get $X",
        "i32.const 1",
        "i32.add",
        "global.set $X",
        "br $loop1",
        "end",
        "end",
        "global.get $X"),
        body(wat, "main"));
  }

  @Test
  public void testBreakTargetsInnermostLoop() throws UserException {
    String wat = compile("PROGRAM P BEGIN LOOP LOOP BREAK END BREAK END " +
                         "END.");
    assertEquals(Arrays.asList(
        "block $break1",
        "loop $loop1",
        "block $break2",
        "loop $loop2",
        "br $break2",
        "br $loop2",
        "end",
        "end",
        "br $break1",
        "br $loop1",
        "end",
        "end",
        "i32.const 0"),
        body(wat, "main"));
  }

  @Test
  public void testByRefCallShape() throws UserException {
    String wat = compile(
        "VAR X\n" +
        "PROCEDURE INC(REF A) A = A + 1 END\n" +
        "PROGRAM P BEGIN INC(X) END.");
    assertEquals("By-ref parameter accessed through its address",
        Arrays.asList(
        "local.get $A",
        "local.get $A",
        "i32.load",
        "i32.const 1",
        "i32.add",
        "i32.store"),
        body(wat, "INC"));
    assertEquals(Arrays.asList(
        "global.get $__sp",
        "i32.const 4",
        "i32.sub",
        "global.set $__sp",
        "global.get $__sp",
        "global.get $X",
        "i32.store",
        "global.get $__sp",
        "call $INC",
        "global.get $__sp",
        "i32.load",
        "global.set $X",
        "global.get $__sp",
        "i32.const 4",
        "i32.add",
        "global.set $__sp",
        "global.get $X"),
        body(wat, "main"));
  }

  @Test
  public void testRefForwarded() throws UserException {
    String wat = compile(
        "PROCEDURE INC(REF A) A = A + 1 END\n" +
        "PROCEDURE TWICE(REF B) INC(B); INC(B) END\n" +
        "PROGRAM P BEGIN END.");
    assertEquals("Address passed on unchanged",
        Arrays.asList(
        "local.get $B",
        "call $INC",
        "local.get $B",
        "call $INC"),
        body(wat, "TWICE"));
  }

  @Test
  public void testMixedTypes() throws UserException {
    String wat = compile("VAR A, B: QUAD, X PROGRAM P BEGIN X = A + B END.");
    assertEquals(Arrays.asList(
        "global.get $A",
        "global.get $B",
        "global.set $__TMP64",
        "i64.extend_i32_s",
        "global.get $__TMP64",
        "i64.add",
        "i32.wrap_i64",
        "global.set $X",
        "global.get $X"),
        body(wat, "main"));
    assertTrue(wat.contains("(global $__TMP64 (mut i64) (i64.const 0))"));
  }

  @Test
  public void testComparisonIsLong() throws UserException {
    String wat = compile("VAR A: QUAD, X PROGRAM P BEGIN X = A > 1 END.");
    List<String> main = body(wat, "main");
    assertEquals("i64.gt_s", main.get(3));
    assertEquals("Comparison result needs no conversion",
                 "global.set $X", main.get(4));
  }

  @Test
  public void testFunctionResultDroppedAsStatement() throws UserException {
    String wat = compile("FUNCTION F() RESULT = 7 END " +
                         "PROGRAM P BEGIN F() END.");
    assertEquals(Arrays.asList("call $F", "drop", "i32.const 0"),
                 body(wat, "main"));
    assertTrue(wat.contains("(func $F (result i32)"));
  }

  @Test
  public void testKeywordsAsNames() throws UserException {
    String wat = compile("VAR TO, REF, X PROCEDURE Q(REF) X = REF END " +
                         "PROGRAM P BEGIN X = TO + 1; Q(TO) END.");
    assertTrue(wat.contains("(func $Q (param $REF i32)"));
  }

  @Test
  public void testOptionalSemicolons() throws UserException {
    String withSemis = compile("VAR X; PROGRAM P; BEGIN X = 1; X = 2; END.");
    String without = compile("VAR X PROGRAM P BEGIN X = 1 X = 2 END.");
    assertEquals(without, withSemis);
  }

  @Test
  public void testDeterministic() throws UserException {
    String source = "VAR X, Y: QUAD\n" +
        "PROCEDURE Q(REF A, B: QUAD) A = A + B END\n" +
        "PROGRAM P BEGIN FOR X = 1 TO 3 Q(X, Y) END END.";
    assertEquals(compile(source), compile(source));
  }

  @Test
  public void testLocalInitializer() throws UserException {
    String wat = compile("PROCEDURE Q() VAR A = 3, B: QUAD = -4 END " +
                         "PROGRAM P BEGIN END.");
    assertEquals(Arrays.asList(
        "i32.const 3",
        "local.set $A",
        "i64.const -4",
        "local.set $B"),
        body(wat, "Q"));
    assertFalse(wat.contains("(global $A"));
  }
}
