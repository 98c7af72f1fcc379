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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.tinyc.common.CodeGenerator;
import exm.tinyc.common.Settings;
import exm.tinyc.common.exceptions.InvalidOptionException;
import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.lang.Constants;
import exm.tinyc.common.lang.Operators.BinaryOp;
import exm.tinyc.common.lang.Parameter;
import exm.tinyc.common.lang.Symbol;
import exm.tinyc.common.lang.Symbol.Kind;
import exm.tinyc.common.lang.ValueType;
import exm.tinyc.common.util.StackLite;
import exm.tinyc.watbackend.tree.Comment;
import exm.tinyc.watbackend.tree.Func;
import exm.tinyc.watbackend.tree.Global;
import exm.tinyc.watbackend.tree.Import;
import exm.tinyc.watbackend.tree.Instruction;
import exm.tinyc.watbackend.tree.Memory;
import exm.tinyc.watbackend.tree.Module;

/**
 * Generates a WebAssembly text module.
 *
 * Variables map directly onto WebAssembly globals and locals.  By-ref
 * parameters are i32 addresses into linear memory.  The top of linear
 * memory is used as a downward-growing shadow stack, addressed by the
 * global $__sp, for values whose address is taken.
 */
public class WatGenerator implements CodeGenerator {

  private static final String ADDRESS_TYPE = "i32";

  private final Logger logger;
  private final WatOptions options;

  /** Completed functions in order of definition */
  private final List<Func> functions = new ArrayList<Func>();

  private Func currentFunc = null;
  /** Procedure being generated, null in the entry function */
  private Symbol currentProc = null;

  /** Open structured instructions: block, loop, if or else */
  private final StackLite<String> structures = new StackLite<String>();

  private Module module = null;

  public WatGenerator(Logger logger, WatOptions options) {
    this.logger = logger;
    this.options = options;
  }

  @Override
  public void startFunction(Symbol proc) {
    if (!proc.isProcedure()) {
      throw new TinyRuntimeError("Not a procedure: " + proc);
    }
    checkNoFunction();
    logger.trace("Generating function " + proc.getName());
    currentFunc = new Func(proc.getName(), null);
    currentProc = proc;
  }

  @Override
  public void endFunction(Symbol proc, List<Symbol> variables) {
    if (currentFunc == null || currentProc != proc) {
      throw new TinyRuntimeError("endFunction(" + proc.getName() +
                                 ") does not match startFunction");
    }
    checkStructuresClosed();

    ImmutableList<Parameter> params = proc.getParams();
    if (variables.size() < params.size()) {
      throw new TinyRuntimeError("Missing parameters for " + proc);
    }
    for (int i = 0; i < variables.size(); i++) {
      Symbol var = variables.get(i);
      if (i < params.size()) {
        if (!var.getName().equals(params.get(i).getName())) {
          throw new TinyRuntimeError("Parameter " + i + " of " +
                proc.getName() + " is " + var.getName() + ", expected " +
                params.get(i).getName());
        }
        currentFunc.addParam(var.getName(), slotType(var));
      } else {
        currentFunc.addLocal(var.getName(), slotType(var));
      }
    }
    if (proc.isFunction()) {
      currentFunc.setResultType(proc.getResultType().machineType());
    }
    finishFunction();
  }

  @Override
  public void startEntryFunction() {
    checkNoFunction();
    currentFunc = new Func(Constants.ENTRY_FUNCTION,
                           Constants.ENTRY_FUNCTION);
    currentFunc.setResultType(ValueType.LONG.machineType());
    currentProc = null;
  }

  @Override
  public void endEntryFunction() {
    if (currentFunc == null || currentProc != null) {
      throw new TinyRuntimeError("endEntryFunction outside entry function");
    }
    checkStructuresClosed();
    finishFunction();
  }

  private void finishFunction() {
    logger.trace("Finished function " + currentFunc.name() + ": " +
                 currentFunc.getBody().size() + " instructions");
    functions.add(currentFunc);
    currentFunc = null;
    currentProc = null;
  }

  @Override
  public void endModule(List<Symbol> globals) {
    checkNoFunction();
    if (module != null) {
      throw new TinyRuntimeError("Module already finished");
    }
    module = new Module();
    module.add(new Import(Constants.READ_FN, options.importModule,
                          ValueType.LONG.machineType()));
    module.add(new Import(Constants.WRITE_FN, options.importModule, null,
                          ValueType.LONG.machineType()));
    module.add(new Memory(options.memoryPages));
    module.add(new Global(Constants.STACK_POINTER, ADDRESS_TYPE,
                          options.stackTop));
    for (Symbol g: globals) {
      if (g.getKind() != Kind.GLOBAL) {
        throw new TinyRuntimeError("Not a global: " + g);
      }
      module.add(new Global(g.getName(), g.getType().machineType(),
                            g.getInitialValue()));
    }
    for (Func f: functions) {
      module.add(f);
    }
  }

  @Override
  public void generate(OutputStream out) throws IOException {
    if (module == null) {
      throw new TinyRuntimeError("Module not finished");
    }
    IOUtils.write(module.toString(), out, StandardCharsets.UTF_8);
    out.flush();
  }

  @Override
  public void constant(ValueType type, long value) {
    if (!ValueType.fits(type, value)) {
      throw new TinyRuntimeError(value + " does not fit " + type);
    }
    emit(type.machineType() + ".const", Long.toString(value));
  }

  @Override
  public void getVar(Symbol var) {
    checkVariable(var);
    if (var.getKind() == Kind.GLOBAL) {
      emit("global.get", ref(var));
    } else if (var.isByRef()) {
      emit("local.get", ref(var));
      load(var.getType(), 0);
    } else {
      emit("local.get", ref(var));
    }
  }

  @Override
  public void getAddress(Symbol var) {
    checkVariable(var);
    if (!var.isByRef()) {
      throw new TinyRuntimeError(var.getName() + " does not hold an address");
    }
    emit("local.get", ref(var));
  }

  @Override
  public void prepareSetVar(Symbol var) {
    checkVariable(var);
    if (var.isByRef()) {
      emit("local.get", ref(var));
    }
  }

  @Override
  public void setVar(Symbol var) {
    checkVariable(var);
    if (var.getKind() == Kind.GLOBAL) {
      emit("global.set", ref(var));
    } else if (var.isByRef()) {
      store(var.getType(), 0);
    } else {
      emit("local.set", ref(var));
    }
  }

  @Override
  public void load(ValueType type, int offset) {
    emit(memoryOp(type, "load", offset));
  }

  @Override
  public void store(ValueType type, int offset) {
    emit(memoryOp(type, "store", offset));
  }

  private static String memoryOp(ValueType type, String op, int offset) {
    String inst = type.machineType() + "." + op;
    if (offset != 0) {
      inst += " offset=" + offset;
    }
    return inst;
  }

  @Override
  public void binaryOp(BinaryOp op, ValueType operandType) {
    emit(operandType.machineType() + "." + op.mnemonic());
  }

  @Override
  public void eqz(ValueType type) {
    emit(type.machineType() + ".eqz");
  }

  @Override
  public void convert(ValueType from, ValueType to) {
    if (from == to) {
      return;
    } else if (from == ValueType.LONG && to == ValueType.QUAD) {
      emit("i64.extend_i32_s");
    } else if (from == ValueType.QUAD && to == ValueType.LONG) {
      emit("i32.wrap_i64");
    } else {
      throw new TinyRuntimeError("Unknown conversion " + from + "->" + to);
    }
  }

  @Override
  public void call(Symbol proc) {
    if (!proc.isProcedure()) {
      throw new TinyRuntimeError("Call to non-procedure " + proc);
    }
    emit("call", ref(proc));
  }

  @Override
  public void readInput() {
    emit("call", "$" + Constants.READ_FN);
  }

  @Override
  public void writeOutput() {
    emit("call", "$" + Constants.WRITE_FN);
  }

  @Override
  public void drop() {
    emit("drop");
  }

  @Override
  public void stackPointer() {
    emit("global.get", "$" + Constants.STACK_POINTER);
  }

  @Override
  public void reserveStack(int bytes) {
    adjustStack(bytes, "sub");
  }

  @Override
  public void releaseStack(int bytes) {
    adjustStack(bytes, "add");
  }

  private void adjustStack(int bytes, String op) {
    if (bytes <= 0) {
      throw new TinyRuntimeError("Bad stack adjustment: " + bytes);
    }
    stackPointer();
    emit(ADDRESS_TYPE + ".const", Integer.toString(bytes));
    emit(ADDRESS_TYPE + "." + op);
    emit("global.set", "$" + Constants.STACK_POINTER);
  }

  @Override
  public void startBlock(String label) {
    emit("block", "$" + label);
    structures.push("block");
  }

  @Override
  public void startLoop(String label) {
    emit("loop", "$" + label);
    structures.push("loop");
  }

  @Override
  public void startIf() {
    emit("if");
    structures.push("if");
  }

  @Override
  public void startElse() {
    if (structures.isEmpty() || !structures.peek().equals("if")) {
      throw new TinyRuntimeError("else without if: " + structures);
    }
    structures.pop();
    emit("else");
    structures.push("else");
  }

  @Override
  public void end() {
    if (structures.isEmpty()) {
      throw new TinyRuntimeError("end without open structure");
    }
    structures.pop();
    emit("end");
  }

  @Override
  public void branch(String label) {
    emit("br", "$" + label);
  }

  @Override
  public void branchIf(String label) {
    emit("br_if", "$" + label);
  }

  @Override
  public void comment(String text) {
    if (options.comments) {
      checkInFunction();
      currentFunc.getBody().add(new Comment(structures.size(), text));
    }
  }

  private void emit(String... tokens) {
    checkInFunction();
    currentFunc.getBody().add(new Instruction(structures.size(), tokens));
  }

  private static String ref(Symbol sym) {
    return "$" + sym.getName();
  }

  private static String slotType(Symbol var) {
    return var.isByRef() ? ADDRESS_TYPE : var.getType().machineType();
  }

  private static void checkVariable(Symbol var) {
    if (!var.isVariable()) {
      throw new TinyRuntimeError("Not a variable: " + var);
    }
  }

  private void checkInFunction() {
    if (currentFunc == null) {
      throw new TinyRuntimeError("Instruction emitted outside function");
    }
  }

  private void checkNoFunction() {
    if (currentFunc != null) {
      throw new TinyRuntimeError("Function " + currentFunc.name() +
                                 " not finished");
    }
  }

  private void checkStructuresClosed() {
    if (!structures.isEmpty()) {
      throw new TinyRuntimeError("Unclosed structures at end of " +
                                 currentFunc.name() + ": " + structures);
    }
  }

  /**
   * Settings that affect the generated module
   */
  public static class WatOptions {
    public final boolean comments;
    public final String importModule;
    public final int memoryPages;
    public final int stackTop;

    public WatOptions(boolean comments, String importModule,
                      int memoryPages, int stackTop) {
      this.comments = comments;
      this.importModule = importModule;
      this.memoryPages = memoryPages;
      this.stackTop = stackTop;
    }

    public static WatOptions fromSettings() throws InvalidOptionException {
      return new WatOptions(Settings.getBoolean(Settings.CODEGEN_COMMENTS),
                            Settings.get(Settings.ABI_IMPORT_MODULE),
                            Settings.getInt(Settings.MEMORY_PAGES),
                            Settings.getInt(Settings.MEMORY_STACK_TOP));
    }
  }
}
