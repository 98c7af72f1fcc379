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

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import exm.tinyc.common.lang.Operators.BinaryOp;
import exm.tinyc.common.lang.Symbol;
import exm.tinyc.common.lang.ValueType;

/**
 * The interface between the parser and a code generation backend.
 *
 * Each instruction method appends exactly one instruction or
 * structural marker to the body of the function currently being
 * generated.  Nothing emitted is ever reordered or patched.  Once the
 * whole program has been parsed, {@link #endModule(List)} assembles the
 * module from the final global declarations.
 */
public interface CodeGenerator {

  /**
   * Begin the body of a procedure.  Its parameters and locals are
   * supplied when it ends, as they are only known then.
   */
  public void startFunction(Symbol proc);

  /**
   * Finish the current procedure.
   * @param variables all variables of the procedure's scope in slot
   *        order, parameters first
   */
  public void endFunction(Symbol proc, List<Symbol> variables);

  /**
   * Begin the exported entry function, which returns a LONG
   */
  public void startEntryFunction();

  public void endEntryFunction();

  /**
   * Called once after all functions.
   * @param globals global variables in declaration order
   */
  public void endModule(List<Symbol> globals);

  /**
   * Write out the finished module
   */
  public void generate(OutputStream out) throws IOException;

  /** Push a constant */
  public void constant(ValueType type, long value);

  /**
   * Push the value of a variable, following the address of a
   * by-ref parameter
   */
  public void getVar(Symbol var);

  /**
   * Push the raw contents of a variable's slot: for a by-ref parameter,
   * the address it holds
   */
  public void getAddress(Symbol var);

  /**
   * Must be called before the value to be assigned is computed.
   * Pushes the target address for a by-ref parameter, nothing otherwise.
   */
  public void prepareSetVar(Symbol var);

  /**
   * Pop value into variable.  Must be paired with an earlier
   * {@link #prepareSetVar(Symbol)}.
   */
  public void setVar(Symbol var);

  /**
   * Pop an address and push the value stored at address + offset
   */
  public void load(ValueType type, int offset);

  /**
   * Pop a value and an address below it, store value at address + offset
   */
  public void store(ValueType type, int offset);

  /**
   * Pop two operands of type operandType and push the result
   */
  public void binaryOp(BinaryOp op, ValueType operandType);

  /**
   * Pop value, push LONG 1 if zero, else 0
   */
  public void eqz(ValueType type);

  /**
   * Convert top of stack between types.  No-op if types are equal.
   */
  public void convert(ValueType from, ValueType to);

  public void call(Symbol proc);

  /** Push a LONG read from the host */
  public void readInput();

  /** Pop a LONG and pass it to the host */
  public void writeOutput();

  public void drop();

  /** Push the shadow stack pointer */
  public void stackPointer();

  /**
   * Reserve bytes on the shadow stack.  The stack grows downwards.
   */
  public void reserveStack(int bytes);

  public void releaseStack(int bytes);

  public void startBlock(String label);

  public void startLoop(String label);

  /** Pop a LONG condition and start an if */
  public void startIf();

  public void startElse();

  /** Close the innermost block, loop or if */
  public void end();

  public void branch(String label);

  /** Pop a LONG and branch if non-zero */
  public void branchIf(String label);

  /**
   * Annotate generated code.  May be ignored.
   */
  public void comment(String text);
}
