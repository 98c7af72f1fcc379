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

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.tinyc.common.Logging;
import exm.tinyc.common.Settings;
import exm.tinyc.common.exceptions.InvalidOptionException;
import exm.tinyc.common.exceptions.TinyFatal;

/**
 * Command line interface to the compiler.  Some compiler options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String LOG_FLAG = "l";
  private static final String TRACE_FLAG = "t";
  private static final String NO_COMMENTS_FLAG = "C";
  private static final String UPDATE_FLAG = "u";
  private static final String HELP_FLAG = "h";

  static final String SOURCE_EXT = ".tiny";
  static final String OUTPUT_EXT = ".wat";

  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {

    Args tinyArgs = processArgs(args);

    try {
      Settings.initTinyProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    recordArgValues(tinyArgs);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File inputFile = new File(tinyArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.err.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }
    File finalOutput = new File(selectOutputFile(tinyArgs.inputFilename,
                                                 tinyArgs.outputFilename));

    if (skipCompile(tinyArgs, inputFile, finalOutput)) {
      System.exit(ExitCode.SUCCESS.code());
    }

    // Use intermediate file so we don't create invalid output in case of
    // compilation errors
    File tmpOutput = setupTmpOutput();
    OutputStream outStream = openForOutput(tmpOutput);

    try {
      TinyCompiler compiler = new TinyCompiler(logger);
      compiler.compile(inputFile.getPath(), outStream);
      copyToOutput(tmpOutput, finalOutput);
      cleanupFiles(true, finalOutput);
    } catch (TinyFatal ex) {
      cleanupFiles(false, finalOutput);
      System.exit(ex.exitCode);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option log = new Option(LOG_FLAG, "log", true, "Write log to file");
    log.setArgName("file");
    opts.addOption(log);
    opts.addOption(TRACE_FLAG, "trace", false, "Enable trace logging");
    opts.addOption(NO_COMMENTS_FLAG, "no-comments", false,
                   "Omit comments from generated code");
    opts.addOption(UPDATE_FLAG, "update", false,
                   "Update output only if out of date");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts);
      System.exit(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.err.println("Expected input file and optional output file, " +
              "but got " + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    return new Args(input, output, cmd.hasOption(UPDATE_FLAG),
                    cmd.getOptionValue(LOG_FLAG),
                    cmd.hasOption(TRACE_FLAG),
                    cmd.hasOption(NO_COMMENTS_FLAG));
  }

  /**
   * Command line flags override properties.  Also store file names in
   * properties for later logging.
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
    if (args.logFile != null) {
      Settings.set(Settings.LOG_FILE, args.logFile);
    }
    if (args.trace) {
      Settings.set(Settings.LOG_TRACE, "true");
    }
    if (args.noComments) {
      Settings.set(Settings.CODEGEN_COMMENTS, "false");
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("tinyc [options] <input> [<output>]", opts);
  }

  /**
   * Check conditions for skipping compilation entirely
   */
  private static boolean skipCompile(Args args, File infile, File outfile) {
    if (args.updateOutput && outfile.exists() &&
        !olderThan(outfile, infile)) {
      Logging.getTinyLogger().debug("Output up to date. Done.");
      return true;
    }
    return false;
  }

  /**
   * @param output output file name given on command line, or null
   * @return output file name: the given one, or the input file name
   *         with its extension replaced
   */
  static String selectOutputFile(String input, String output) {
    if (output != null) {
      return output;
    }
    String prefix;
    if (input.endsWith(SOURCE_EXT)) {
      prefix = input.substring(0, input.length() - SOURCE_EXT.length());
    } else {
      prefix = input;
    }
    return prefix + OUTPUT_EXT;
  }

  private static File setupTmpOutput() {
    try {
      File result = File.createTempFile("tinyc-out", OUTPUT_EXT);
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: "
          + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  private static OutputStream openForOutput(File outfile) {
    try {
      FileOutputStream stream = new FileOutputStream(outfile);
      return new BufferedOutputStream(stream);
    } catch (FileNotFoundException e) {
      System.err.println("Unexpected error opening " +
                         outfile.getAbsolutePath() + " for output: " +
                         e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  /**
   * Copy input file to output file.  In event of failure, throw a fatal error
   */
  private static void copyToOutput(File inputFile, File output) {
    try {
      // Use output stream since it interacts better with non-seekable
      // devices such as /dev/stdout
      PrintStream outStream = new PrintStream(new FileOutputStream(output));
      try {
        FileUtils.copyFile(inputFile, outStream);
      } finally {
        outStream.close();
      }
    } catch (IOException e) {
      System.err.println("Error copying " + inputFile + " to " + output +
                         ": " + e.getMessage());
      throw new TinyFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static boolean olderThan(File file1, File file2) {
    long modTime1 = file1.lastModified();
    long modTime2 = file2.lastModified();
    return modTime1 < modTime2;
  }

  private static void cleanupFiles(boolean success, File finalOutput) {
    if (!success && finalOutput.exists()) {
      finalOutput.delete();
    }
    for (File temp: temporaries) {
      if (temp.exists()) {
        temp.delete();
      }
    }
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean updateOutput;
    public final String logFile;
    public final boolean trace;
    public final boolean noComments;

    public Args(String inputFilename, String outputFilename,
                boolean updateOutput, String logFile, boolean trace,
                boolean noComments) {
      super();
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.updateOutput = updateOutput;
      this.logFile = logFile;
      this.trace = trace;
      this.noComments = noComments;
    }
  }
}
