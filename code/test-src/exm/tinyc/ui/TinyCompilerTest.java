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

package exm.tinyc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.tinyc.common.Logging;
import exm.tinyc.common.Settings;
import exm.tinyc.common.exceptions.TinyFatal;
import exm.tinyc.common.exceptions.UserException;

public class TinyCompilerTest {

  private static final String PROGRAM =
      "VAR X, Y: QUAD\n" +
      "PROCEDURE ADD(REF A, B) A = A + B END\n" +
      "PROGRAM P BEGIN\n" +
      "  WHILE X < 10 ADD(X, 3) END\n" +
      "  FOR X = 1 TO 3 Y = Y + X END\n" +
      "END.\n";

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TinyCompilerTest.tinyc.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private static TinyCompiler compiler() {
    return new TinyCompiler(Logging.getTinyLogger());
  }

  private File write(String name, String source) throws IOException {
    File f = tmp.newFile(name);
    FileUtils.writeStringToFile(f, source, StandardCharsets.UTF_8);
    return f;
  }

  @Test
  public void testDeterministic() throws UserException {
    String first = compiler().compileToString("p.tiny", PROGRAM);
    String second = compiler().compileToString("p.tiny", PROGRAM);
    assertEquals(first, second);
  }

  @Test
  public void testCompilationsIndependent() throws UserException {
    TinyCompiler c = compiler();
    String first = c.compileToString("p.tiny", PROGRAM);
    assertEquals("Labels restart in each compilation",
                 first, c.compileToString("p.tiny", PROGRAM));
    assertTrue(first.contains("block $break1"));
    assertFalse(first.contains("$break3"));
  }

  @Test
  public void testCommentsSetting() throws UserException {
    assertTrue(compiler().compileToString("p.tiny", PROGRAM)
                         .contains(";; pass X by reference"));
    Settings.set(Settings.CODEGEN_COMMENTS, "false");
    assertFalse(compiler().compileToString("p.tiny", PROGRAM)
                          .contains(";;"));
  }

  @Test
  public void testImportModuleSetting() throws UserException {
    Settings.set(Settings.ABI_IMPORT_MODULE, "host");
    assertTrue(compiler().compileToString("p.tiny", PROGRAM)
        .contains("(func $read_i32 (import \"host\" \"read_i32\")"));
  }

  @Test
  public void testCompileFile() throws IOException {
    File input = write("ok.tiny", PROGRAM);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    compiler().compile(input.getPath(), out);
    String wat = new String(out.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(wat.startsWith("(module\n"));
    assertTrue(wat.contains("(func $ADD (param $A i32) (param $B i32)"));
  }

  @Test
  public void testUserErrorExitCode() throws IOException {
    File input = write("bad.tiny", "PROGRAM P BEGIN Y = 1 END.");
    try {
      compiler().compile(input.getPath(), new ByteArrayOutputStream());
      fail("Expected compile error");
    } catch (TinyFatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
  }

  @Test
  public void testMissingFileExitCode() {
    String missing = new File(tmp.getRoot(), "missing.tiny").getPath();
    try {
      compiler().compile(missing, new ByteArrayOutputStream());
      fail("Expected I/O error");
    } catch (TinyFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
  }

  @Test
  public void testErrorPositionUsesFileName() {
    try {
      compiler().compileToString("dir/bad.tiny", "PROGRAM P\nBEGIN ? END.");
      fail("Expected lexical error");
    } catch (UserException e) {
      assertEquals("dir/bad.tiny:2:7: unexpected character '?'",
                   e.getMessage());
    }
  }
}
