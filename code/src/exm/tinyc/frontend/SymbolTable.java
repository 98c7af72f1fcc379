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

import exm.tinyc.common.exceptions.DuplicateDeclarationError;
import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.exceptions.UndeclaredNameError;
import exm.tinyc.common.lang.Constants;
import exm.tinyc.common.lang.Parameter;
import exm.tinyc.common.lang.Symbol;
import exm.tinyc.common.lang.Symbol.Kind;
import exm.tinyc.common.lang.Symbol.PassingMode;
import exm.tinyc.common.lang.ValueType;

/**
 * Scoped map from names to declarations.
 *
 * Frames are kept in an arena and refer to their parent by index.
 * Frame 0 is the global frame and is never popped.  Lookup proceeds
 * from the current frame through its ancestors, so an inner
 * declaration shadows an outer one.
 */
public class SymbolTable {
  public static final int GLOBAL_FRAME = 0;

  private final List<ScopeFrame> frames = new ArrayList<ScopeFrame>();
  private int current;

  public SymbolTable() {
    frames.add(new ScopeFrame(GLOBAL_FRAME, ScopeFrame.NO_PARENT, null));
    current = GLOBAL_FRAME;
  }

  public ScopeFrame currentFrame() {
    return frames.get(current);
  }

  public ScopeFrame globalFrame() {
    return frames.get(GLOBAL_FRAME);
  }

  public boolean inGlobalScope() {
    return current == GLOBAL_FRAME;
  }

  /**
   * Open the frame for a procedure's parameters and locals
   * @param owner the procedure
   * @return the new frame
   */
  public ScopeFrame pushScope(Symbol owner) {
    ScopeFrame frame = new ScopeFrame(frames.size(), current, owner);
    frames.add(frame);
    current = frame.getIndex();
    return frame;
  }

  public void popScope() {
    if (current == GLOBAL_FRAME) {
      throw new TinyRuntimeError("Cannot pop global scope");
    }
    ScopeFrame frame = frames.get(current);
    if (frame.getIndex() != frames.size() - 1) {
      throw new TinyRuntimeError("Popping " + frame + " which is not the "
                                 + "innermost frame");
    }
    frames.remove(frames.size() - 1);
    current = frame.getParent();
  }

  /**
   * Declare a variable in the current frame: a global at global scope,
   * otherwise a local or parameter.
   * @throws DuplicateDeclarationError if already declared in this frame
   */
  public Symbol declare(String name, FilePosition pos, PassingMode mode,
                        ValueType type) throws DuplicateDeclarationError {
    return declare(name, pos, mode, type, 0);
  }

  public Symbol declare(String name, FilePosition pos, PassingMode mode,
      ValueType type, long initialValue) throws DuplicateDeclarationError {
    ScopeFrame frame = currentFrame();
    checkNotDeclared(frame, name, pos);

    Symbol sym;
    if (frame.isGlobal()) {
      if (mode != PassingMode.BY_VALUE) {
        throw new TinyRuntimeError("Global " + name + " cannot be by-ref");
      }
      sym = Symbol.global(name, pos, frame.allocateSlot(), type,
                          initialValue);
    } else {
      if (initialValue != 0) {
        throw new TinyRuntimeError("Local " + name + " has no storage for "
                                 + "an initial value");
      }
      sym = Symbol.local(name, pos, frame.allocateSlot(), mode, type);
      checkShadowing(frame, name, pos);
    }
    frame.add(sym);
    return sym;
  }

  /**
   * Declare a procedure in the global frame.  Must be called before the
   * procedure's own frame is pushed so that it can call itself.
   * @param resultType null for a procedure without result
   */
  public Symbol declareProcedure(String name, FilePosition pos,
        List<Parameter> params, ValueType resultType)
            throws DuplicateDeclarationError {
    if (!inGlobalScope()) {
      throw new TinyRuntimeError("Procedure " + name + " declared inside "
                                 + currentFrame());
    }
    ScopeFrame frame = globalFrame();
    checkNotDeclared(frame, name, pos);
    Symbol sym = Symbol.procedure(name, pos, frame.allocateSlot(), params,
                                  resultType);
    frame.add(sym);
    return sym;
  }

  /**
   * Compiler temporary of the given type in the current frame,
   * declared on first request.
   */
  public Symbol scratch(ValueType type) {
    ScopeFrame frame = currentFrame();
    String name = Constants.SCRATCH_PREFIX + (type.size() * 8);
    Symbol sym = frame.get(name);
    if (sym == null) {
      Kind kind = frame.isGlobal() ? Kind.GLOBAL : Kind.LOCAL;
      sym = Symbol.scratch(name, kind, frame.allocateSlot(), type);
      frame.add(sym);
    }
    return sym;
  }

  /**
   * @return the innermost declaration of the token's name
   * @throws UndeclaredNameError
   */
  public Symbol lookup(Token name) throws UndeclaredNameError {
    Symbol sym = lookupUnsafe(name.getText());
    if (sym == null) {
      throw UndeclaredNameError.fromName(name.getPosition(), name.getText());
    }
    return sym;
  }

  /**
   * @return innermost declaration, or null if not declared
   */
  public Symbol lookupUnsafe(String name) {
    int i = current;
    while (i != ScopeFrame.NO_PARENT) {
      ScopeFrame frame = frames.get(i);
      Symbol sym = frame.get(name);
      if (sym != null) {
        return sym;
      }
      i = frame.getParent();
    }
    return null;
  }

  private static void checkNotDeclared(ScopeFrame frame, String name,
          FilePosition pos) throws DuplicateDeclarationError {
    if (frame.contains(name)) {
      throw new DuplicateDeclarationError(pos, name);
    }
  }

  private void checkShadowing(ScopeFrame frame, String name,
                              FilePosition pos) {
    int i = frame.getParent();
    while (i != ScopeFrame.NO_PARENT) {
      ScopeFrame outer = frames.get(i);
      Symbol shadowed = outer.get(name);
      if (shadowed != null) {
        LogHelper.uniqueWarn(pos, "Local " + name + " shadows " +
            shadowed.getKind().toString().toLowerCase() + " " + name);
        return;
      }
      i = outer.getParent();
    }
  }
}
