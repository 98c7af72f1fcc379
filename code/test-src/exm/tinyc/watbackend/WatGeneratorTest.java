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

package exm.tinyc.watbackend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.apache.log4j.Logger;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import exm.tinyc.common.Logging;
import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.lang.Parameter;
import exm.tinyc.common.lang.Symbol;
import exm.tinyc.common.lang.Symbol.PassingMode;
import exm.tinyc.common.lang.ValueType;
import exm.tinyc.frontend.FilePosition;
import exm.tinyc.watbackend.WatGenerator.WatOptions;
import exm.tinyc.watbackend.tree.Func;

public class WatGeneratorTest {

  private static final Logger logger = Logging.getTinyLogger();
  private static final FilePosition POS = new FilePosition("gen.tiny", 1, 1);

  private static WatGenerator generator(boolean comments) {
    return new WatGenerator(logger, new WatOptions(comments, "env", 1,
                                                   65536));
  }

  private static String render(WatGenerator gen) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    gen.generate(out);
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  /**
   * Q(REF A) sets A to 1; main runs a commented block and returns X
   */
  private static String smallModule(boolean comments) throws IOException {
    WatGenerator gen = generator(comments);
    Symbol x = Symbol.global("X", POS, 0, ValueType.LONG, 3);
    Symbol q = Symbol.procedure("Q", POS, 1, ImmutableList.of(
        new Parameter("A", POS, PassingMode.BY_REF, ValueType.LONG)), null);
    Symbol a = Symbol.local("A", POS, 0, PassingMode.BY_REF,
                            ValueType.LONG);
    Symbol t = Symbol.local("T", POS, 1, PassingMode.BY_VALUE,
                            ValueType.QUAD);

    gen.startFunction(q);
    gen.prepareSetVar(a);
    gen.constant(ValueType.LONG, 1);
    gen.setVar(a);
    gen.endFunction(q, Arrays.asList(a, t));

    gen.startEntryFunction();
    gen.startBlock("b1");
    gen.comment("inside");
    gen.getVar(x);
    gen.eqz(ValueType.LONG);
    gen.branchIf("b1");
    gen.end();
    gen.getVar(x);
    gen.endEntryFunction();
    gen.endModule(Collections.singletonList(x));
    return render(gen);
  }

  @Test
  public void testModuleLayout() throws IOException {
    String expected =
        "(module\n" +
        "  (func $read_i32 (import \"env\" \"read_i32\") (result i32))\n" +
        "  (func $write_i32 (import \"env\" \"write_i32\") (param i32))\n" +
        "  (memory 1)\n" +
        "  (global $__sp (mut i32) (i32.const 65536))\n" +
        "  (global $X (mut i32) (i32.const 3))\n" +
        "  (func $Q (param $A i32)\n" +
        "    (local $T i64)\n" +
        "    local.get $A\n" +
        "    i32.const 1\n" +
        "    i32.store\n" +
        "  )\n" +
        "  (func $main (export \"main\") (result i32)\n" +
        "    block $b1\n" +
        "      ;; inside\n" +
        "      global.get $X\n" +
        "      i32.eqz\n" +
        "      br_if $b1\n" +
        "    end\n" +
        "    global.get $X\n" +
        "  )\n" +
        ")\n";
    assertEquals(expected, smallModule(true));
  }

  @Test
  public void testCommentsDisabled() throws IOException {
    assertFalse(smallModule(false).contains(";;"));
  }

  @Test
  public void testMemoryOffsets() throws IOException {
    WatGenerator gen = generator(true);
    gen.startEntryFunction();
    gen.stackPointer();
    gen.load(ValueType.QUAD, 8);
    gen.convert(ValueType.QUAD, ValueType.LONG);
    gen.endEntryFunction();
    gen.endModule(Collections.<Symbol>emptyList());
    String wat = render(gen);
    assertTrue(wat.contains("    i64.load offset=8\n"));
    assertTrue(wat.contains("    i32.wrap_i64\n"));
  }

  @Test(expected=TinyRuntimeError.class)
  public void testUnclosedBlock() {
    WatGenerator gen = generator(true);
    gen.startEntryFunction();
    gen.startLoop("loop1");
    gen.endEntryFunction();
  }

  @Test(expected=TinyRuntimeError.class)
  public void testUnbalancedEnd() {
    WatGenerator gen = generator(true);
    gen.startEntryFunction();
    gen.end();
  }

  @Test(expected=TinyRuntimeError.class)
  public void testElseWithoutIf() {
    WatGenerator gen = generator(true);
    gen.startEntryFunction();
    gen.startBlock("b");
    gen.startElse();
  }

  @Test(expected=TinyRuntimeError.class)
  public void testNestedFunctions() {
    WatGenerator gen = generator(true);
    gen.startEntryFunction();
    gen.startEntryFunction();
  }

  @Test(expected=TinyRuntimeError.class)
  public void testConstantTooWide() {
    WatGenerator gen = generator(true);
    gen.startEntryFunction();
    gen.constant(ValueType.LONG, 1L << 40);
  }

  @Test(expected=TinyRuntimeError.class)
  public void testGenerateUnfinished() throws IOException {
    render(generator(true));
  }

  @Test(expected=TinyRuntimeError.class)
  public void testParameterOrderChecked() {
    WatGenerator gen = generator(true);
    Symbol q = Symbol.procedure("Q", POS, 0, ImmutableList.of(
        new Parameter("A", POS, PassingMode.BY_VALUE, ValueType.LONG)), null);
    gen.startFunction(q);
    gen.endFunction(q, Arrays.asList(Symbol.local("B", POS, 0,
                          PassingMode.BY_VALUE, ValueType.LONG)));
  }

  @Test(expected=TinyRuntimeError.class)
  public void testBadIdentifier() {
    new Func("no-dashes", null);
  }
}
