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

package exm.tinyc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tinyc.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings.validateProperties();
    assertEquals("X", Settings.get(Settings.ABI_RESULT_VAR));
    assertTrue(Settings.getBoolean(Settings.CODEGEN_COMMENTS));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals(8, Settings.getInt(Settings.MEMORY_PAGES));
    assertEquals(65536, Settings.getLong(Settings.MEMORY_STACK_TOP));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testReset() {
    Settings.set(Settings.ABI_RESULT_VAR, "Y");
    assertEquals("Y", Settings.get(Settings.ABI_RESULT_VAR));
    Settings.reset();
    assertEquals("X", Settings.get(Settings.ABI_RESULT_VAR));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.CODEGEN_COMMENTS, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.validateProperties();
  }

  @Test
  public void testBadResultVar() throws InvalidOptionException {
    Settings.set(Settings.ABI_RESULT_VAR, "1X");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.ABI_RESULT_VAR);
    Settings.validateProperties();
  }

  @Test
  public void testStackTopAligned() throws InvalidOptionException {
    Settings.set(Settings.MEMORY_STACK_TOP, "65530");
    exception.expect(InvalidOptionException.class);
    Settings.validateProperties();
  }

  @Test
  public void testStackTopWithinMemory() throws InvalidOptionException {
    Settings.set(Settings.MEMORY_PAGES, "1");
    Settings.set(Settings.MEMORY_STACK_TOP, "65536");
    Settings.validateProperties();

    Settings.set(Settings.MEMORY_STACK_TOP, "65544");
    exception.expect(InvalidOptionException.class);
    Settings.validateProperties();
  }

  @Test
  public void testNoPages() throws InvalidOptionException {
    Settings.set(Settings.MEMORY_PAGES, "0");
    exception.expect(InvalidOptionException.class);
    Settings.validateProperties();
  }

  @Test
  public void testIntRange() throws InvalidOptionException {
    Settings.set(Settings.MEMORY_PAGES, "4294967296");
    exception.expect(InvalidOptionException.class);
    Settings.getInt(Settings.MEMORY_PAGES);
  }

  @Test
  public void testSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.ABI_IMPORT_MODULE, "env");
    try {
      Settings.initTinyProperties();
      assertEquals("env", Settings.get(Settings.ABI_IMPORT_MODULE));
    } finally {
      System.clearProperty(Settings.ABI_IMPORT_MODULE);
    }
  }
}
