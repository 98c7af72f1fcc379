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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.tinyc.common.Settings;
import exm.tinyc.common.exceptions.InvalidOptionException;
import exm.tinyc.common.exceptions.TinyFatal;
import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.exceptions.UserException;
import exm.tinyc.common.util.Misc;
import exm.tinyc.frontend.ControlFlowLabeler;
import exm.tinyc.frontend.Parser;
import exm.tinyc.frontend.Scanner;
import exm.tinyc.frontend.SymbolTable;
import exm.tinyc.watbackend.WatGenerator;
import exm.tinyc.watbackend.WatGenerator.WatOptions;

/**
 * This is the main entry point to the compiler
 */
public class TinyCompiler {

  private final Logger logger;

  public TinyCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Compile a source file to a WebAssembly text module on the output
   * stream.  Errors are reported on stderr and turned into a
   * {@link TinyFatal} carrying the exit code.
   * @param inputFile
   * @param output closed on success
   */
  public void compile(String inputFile, OutputStream output) {
    try {
      logger.info("tinyc starting: " + Misc.timestamp());
      String source = FileUtils.readFileToString(new File(inputFile),
                                                 StandardCharsets.UTF_8);
      compileSource(inputFile, source, output);
      output.close();
      logger.debug("tinyc done: " + Misc.timestamp());
    }
    catch (TinyFatal e) {
      // Rethrow
      throw e;
    }
    catch (UserException e) {
      System.err.println("tinyc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug(Misc.stackTrace(e));
      throw new TinyFatal(ExitCode.ERROR_USER.code());
    }
    catch (IOException e) {
      System.err.println("I/O error while compiling " + inputFile);
      System.err.println(e.getMessage());
      throw new TinyFatal(ExitCode.ERROR_IO.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new TinyFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Compile source text.  Each call uses fresh compiler state, so
   * compilations are independent.
   * @param fileName name used in error positions
   * @throws UserException the first error in the program
   * @throws IOException if output can't be written
   */
  public void compileSource(String fileName, String source,
          OutputStream output) throws UserException, IOException {
    WatGenerator gen = new WatGenerator(logger, codegenOptions());
    Parser parser = new Parser(new Scanner(fileName, source),
                               new SymbolTable(), new ControlFlowLabeler(),
                               gen, Settings.get(Settings.ABI_RESULT_VAR));
    parser.parseProgram();
    gen.generate(output);
  }

  /**
   * @return the generated module text
   */
  public String compileToString(String fileName, String source)
                                              throws UserException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try {
      compileSource(fileName, source, bytes);
    } catch (IOException e) {
      throw new TinyRuntimeError("I/O error writing to memory: " +
                                 e.getMessage());
    }
    return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
  }

  private static WatOptions codegenOptions() {
    try {
      return WatOptions.fromSettings();
    } catch (InvalidOptionException e) {
      throw new TinyRuntimeError("Invalid code generation settings: " +
                                 e.getMessage());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("TINYC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
