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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tinyc.common.exceptions.DuplicateDeclarationError;
import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.exceptions.UndeclaredNameError;
import exm.tinyc.common.exceptions.UserException;
import exm.tinyc.common.lang.Parameter;
import exm.tinyc.common.lang.Symbol;
import exm.tinyc.common.lang.Symbol.Kind;
import exm.tinyc.common.lang.Symbol.PassingMode;
import exm.tinyc.common.lang.ValueType;

public class SymbolTableTest {
  private static final FilePosition POS = new FilePosition("test.tiny", 1, 1);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Token name(String text) {
    return new Token(TokenKind.NAME, text, POS);
  }

  @Test
  public void testDuplicateInSameFrame() throws UserException {
    SymbolTable table = new SymbolTable();
    table.declare("X", POS, PassingMode.BY_VALUE, ValueType.LONG);
    exception.expect(DuplicateDeclarationError.class);
    table.declare("X", POS, PassingMode.BY_VALUE, ValueType.LONG);
  }

  @Test
  public void testShadowing() throws UserException {
    SymbolTable table = new SymbolTable();
    Symbol global = table.declare("X", POS, PassingMode.BY_VALUE,
                                  ValueType.LONG);
    Symbol proc = table.declareProcedure("P", POS,
                        Collections.<Parameter>emptyList(), null);
    table.pushScope(proc);
    assertSame(proc, table.currentFrame().getOwner());
    Symbol local = table.declare("X", POS, PassingMode.BY_VALUE,
                                 ValueType.QUAD);
    assertSame("Inner declaration wins", local, table.lookup(name("X")));
    assertEquals(Kind.LOCAL, local.getKind());
    table.popScope();
    assertNull(table.currentFrame().getOwner());
    assertSame("Outer declaration visible again", global,
               table.lookup(name("X")));
  }

  @Test
  public void testUndeclared() throws UserException {
    SymbolTable table = new SymbolTable();
    exception.expect(UndeclaredNameError.class);
    exception.expectMessage("undeclared name: Y");
    table.lookup(name("Y"));
  }

  @Test
  public void testSlots() throws UserException {
    SymbolTable table = new SymbolTable();
    assertEquals(0, table.declare("A", POS, PassingMode.BY_VALUE,
                                  ValueType.LONG).getSlot());
    Symbol p = table.declareProcedure("P", POS,
                    Collections.<Parameter>emptyList(), null);
    assertEquals(1, p.getSlot());

    table.pushScope(p);
    assertEquals("Slots start from zero in each frame", 0,
        table.declare("B", POS, PassingMode.BY_REF, ValueType.LONG)
        .getSlot());
    assertEquals(1, table.declare("C", POS, PassingMode.BY_VALUE,
                                  ValueType.LONG).getSlot());
    table.popScope();

    Symbol q = table.declareProcedure("Q", POS,
                    Collections.<Parameter>emptyList(), null);
    table.pushScope(q);
    assertEquals("Sibling procedure reuses slots", 0,
        table.declare("D", POS, PassingMode.BY_VALUE, ValueType.LONG)
        .getSlot());
    table.popScope();
  }

  @Test
  public void testProcedureSignature() throws UserException {
    SymbolTable table = new SymbolTable();
    Parameter a = new Parameter("A", POS, PassingMode.BY_VALUE,
                                ValueType.LONG);
    Parameter b = new Parameter("B", POS, PassingMode.BY_REF,
                                ValueType.QUAD);
    table.declareProcedure("F", POS, Arrays.asList(a, b), ValueType.QUAD);
    Symbol f = table.lookup(name("F"));
    assertTrue(f.isFunction());
    assertEquals(2, f.getParams().size());
    assertTrue(f.getParams().get(1).isByRef());
    assertEquals(ValueType.QUAD, f.getResultType());
  }

  @Test
  public void testProcedureNameClashesWithGlobal() throws UserException {
    SymbolTable table = new SymbolTable();
    table.declare("P", POS, PassingMode.BY_VALUE, ValueType.LONG);
    exception.expect(DuplicateDeclarationError.class);
    table.declareProcedure("P", POS, Collections.<Parameter>emptyList(),
                           null);
  }

  @Test
  public void testScratch() throws UserException {
    SymbolTable table = new SymbolTable();
    Symbol s = table.scratch(ValueType.QUAD);
    assertSame("Scratch variable is reused", s,
               table.scratch(ValueType.QUAD));
    assertEquals(Kind.GLOBAL, s.getKind());
    assertTrue(s.isScratch());
    assertEquals("__TMP64", s.getName());
    assertNull(table.lookupUnsafe("TMP64"));
    assertEquals(Arrays.asList(s), table.globalFrame().variables());
  }

  @Test
  public void testPopGlobal() {
    SymbolTable table = new SymbolTable();
    exception.expect(TinyRuntimeError.class);
    table.popScope();
  }
}
