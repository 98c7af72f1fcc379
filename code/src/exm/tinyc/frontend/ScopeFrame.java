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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.tinyc.common.lang.Symbol;

/**
 * One scope: the global scope, or the parameters and locals of a
 * procedure.  Symbols keep declaration order.
 */
public class ScopeFrame {
  public static final int NO_PARENT = -1;

  private final int index;
  private final int parent;
  /** Procedure owning this frame; null for the global frame */
  private final Symbol owner;

  private final Map<String, Symbol> symbols =
                          new LinkedHashMap<String, Symbol>();
  private int nextSlot = 0;

  public ScopeFrame(int index, int parent, Symbol owner) {
    this.index = index;
    this.parent = parent;
    this.owner = owner;
  }

  public int getIndex() {
    return index;
  }

  /**
   * @return index of enclosing frame, or NO_PARENT
   */
  public int getParent() {
    return parent;
  }

  public Symbol getOwner() {
    return owner;
  }

  public boolean isGlobal() {
    return parent == NO_PARENT;
  }

  public Symbol get(String name) {
    return symbols.get(name);
  }

  public boolean contains(String name) {
    return symbols.containsKey(name);
  }

  /**
   * @return next free slot, consuming it
   */
  int allocateSlot() {
    return nextSlot++;
  }

  void add(Symbol sym) {
    assert(!symbols.containsKey(sym.getName())) : sym.getName();
    symbols.put(sym.getName(), sym);
  }

  /**
   * @return all symbols in declaration order
   */
  public List<Symbol> symbols() {
    return new ArrayList<Symbol>(symbols.values());
  }

  /**
   * @return variables (not procedures) in declaration order
   */
  public List<Symbol> variables() {
    List<Symbol> result = new ArrayList<Symbol>();
    for (Symbol s: symbols.values()) {
      if (s.isVariable()) {
        result.add(s);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "frame " + index + (owner == null ? "" : " of " + owner.getName())
           + ": " + symbols.keySet();
  }
}
