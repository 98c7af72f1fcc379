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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.tinyc.common.util.StackLite;

/**
 * Executes modules produced by {@link WatGenerator}, for tests.
 *
 * Only understands the layout and instruction subset that the generator
 * emits: one declaration or instruction per line.  Values are held as
 * longs; i32 results are truncated and sign-extended.  Host imports
 * read_i32 and write_i32 are served from an input list and an output
 * list.
 */
public class WatInterpreter {
  private static final int PAGE_SIZE = 65536;
  private static final int MAX_CALL_DEPTH = 1000;

  private static final Pattern FUNC_HEADER =
      Pattern.compile("^\\(func \\$(\\S+)(.*)$");
  private static final Pattern PARAM =
      Pattern.compile("\\(param \\$(\\S+) (i32|i64)\\)");
  private static final Pattern RESULT =
      Pattern.compile("\\(result (i32|i64)\\)");
  private static final Pattern LOCAL =
      Pattern.compile("^\\(local \\$(\\S+) (i32|i64)\\)$");
  private static final Pattern GLOBAL = Pattern.compile(
      "^\\(global \\$(\\S+) \\(mut (i32|i64)\\) \\((i32|i64)\\.const (-?\\d+)\\)\\)$");
  private static final Pattern MEMORY = Pattern.compile("^\\(memory (\\d+)\\)$");
  private static final Pattern EXPORT = Pattern.compile("\\(export \"(\\S+)\"\\)");

  private final Map<String, Function> functions =
                              new HashMap<String, Function>();
  private final Map<String, Long> globals = new LinkedHashMap<String, Long>();
  private final Map<String, String> globalTypes =
                              new HashMap<String, String>();
  private final Map<String, String> imports = new HashMap<String, String>();
  private final Map<String, Function> exports =
                              new HashMap<String, Function>();
  private ByteBuffer memory = null;

  private Deque<Long> input;
  private List<Long> output;
  private int callDepth = 0;

  public WatInterpreter(String moduleText) {
    parse(moduleText);
  }

  /**
   * Run the exported main function
   * @param inputs values returned by successive read_i32 calls
   */
  public Result run(long... inputs) {
    input = new ArrayDeque<Long>();
    for (long in: inputs) {
      input.add(in);
    }
    output = new ArrayList<Long>();
    Function main = exports.get("main");
    if (main == null) {
      throw new IllegalStateException("No main export");
    }
    Long value = invoke(main, new long[0]);
    return new Result(value, output);
  }

  public long global(String name) {
    Long val = globals.get(name);
    if (val == null) {
      throw new IllegalArgumentException("No global " + name);
    }
    return val;
  }

  public boolean hasFunction(String name) {
    return functions.containsKey(name);
  }

  private void parse(String text) {
    Function current = null;
    for (String rawLine: text.split("\n")) {
      String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith(";;")) {
        continue;
      }
      if (current != null) {
        Matcher local = LOCAL.matcher(line);
        if (line.equals(")")) {
          current.resolveStructure();
          current = null;
        } else if (local.matches()) {
          current.addVariable(local.group(1), local.group(2));
        } else {
          current.code.add(line.split(" "));
        }
        continue;
      }

      Matcher m;
      if (line.equals("(module") || line.equals(")")) {
        continue;
      } else if ((m = MEMORY.matcher(line)).matches()) {
        memory = ByteBuffer.allocate(Integer.parseInt(m.group(1)) * PAGE_SIZE);
        memory.order(ByteOrder.LITTLE_ENDIAN);
      } else if ((m = GLOBAL.matcher(line)).matches()) {
        globals.put(m.group(1), Long.parseLong(m.group(4)));
        globalTypes.put(m.group(1), m.group(2));
      } else if ((m = FUNC_HEADER.matcher(line)).matches()) {
        String name = m.group(1);
        String rest = m.group(2);
        if (rest.contains("(import ")) {
          imports.put(name, rest);
          continue;
        }
        current = new Function(name);
        Matcher p = PARAM.matcher(rest);
        while (p.find()) {
          current.addVariable(p.group(1), p.group(2));
          current.paramCount++;
        }
        Matcher r = RESULT.matcher(rest);
        if (r.find()) {
          current.resultType = r.group(1);
        }
        Matcher e = EXPORT.matcher(rest);
        if (e.find()) {
          exports.put(e.group(1), current);
        }
        functions.put(name, current);
      } else {
        throw new IllegalStateException("Unexpected module line: " + line);
      }
    }
  }

  private Long invoke(Function f, long[] args) {
    if (++callDepth > MAX_CALL_DEPTH) {
      throw new IllegalStateException("Call stack exhausted");
    }
    long[] locals = new long[f.types.size()];
    System.arraycopy(args, 0, locals, 0, args.length);

    StackLite<Long> stack = new StackLite<Long>();
    StackLite<Control> control = new StackLite<Control>();
    int pc = 0;
    while (pc < f.code.size()) {
      String[] inst = f.code.get(pc);
      String op = inst[0];
      int next = pc + 1;

      if (op.equals("block") || op.equals("loop")) {
        control.push(new Control(op, label(inst), pc, f.ends.get(pc),
                                 stack.size()));
      } else if (op.equals("if")) {
        long cond = stack.pop();
        Integer elsePc = f.elses.get(pc);
        if (cond != 0) {
          control.push(new Control(op, null, pc, f.ends.get(pc),
                                   stack.size()));
        } else if (elsePc != null) {
          control.push(new Control(op, null, pc, f.ends.get(pc),
                                   stack.size()));
          next = elsePc + 1;
        } else {
          next = f.ends.get(pc) + 1;
        }
      } else if (op.equals("else")) {
        // End of the taken branch
        Control c = control.pop();
        next = c.end + 1;
      } else if (op.equals("end")) {
        control.pop();
      } else if (op.equals("br")) {
        next = branch(control, stack, label(inst));
      } else if (op.equals("br_if")) {
        if (stack.pop() != 0) {
          next = branch(control, stack, label(inst));
        }
      } else if (op.equals("call")) {
        call(label(inst), stack);
      } else if (op.equals("drop")) {
        stack.pop();
      } else if (op.equals("local.get")) {
        stack.push(locals[f.index(label(inst))]);
      } else if (op.equals("local.set")) {
        int i = f.index(label(inst));
        locals[i] = normalize(f.types.get(i), stack.pop());
      } else if (op.equals("global.get")) {
        stack.push(global(label(inst)));
      } else if (op.equals("global.set")) {
        String name = label(inst);
        if (!globals.containsKey(name)) {
          throw new IllegalStateException("No global " + name);
        }
        globals.put(name, normalize(globalTypes.get(name), stack.pop()));
      } else {
        numeric(inst, stack);
      }
      pc = next;
    }

    callDepth--;
    if (f.resultType == null) {
      return null;
    }
    return normalize(f.resultType, stack.pop());
  }

  /**
   * @return pc to continue at
   */
  private static int branch(StackLite<Control> control, StackLite<Long> stack,
                            String label) {
    while (!control.isEmpty()) {
      Control c = control.peek();
      if (label.equals(c.label)) {
        while (stack.size() > c.stackHeight) {
          stack.pop();
        }
        if (c.kind.equals("loop")) {
          return c.start + 1;
        }
        control.pop();
        return c.end + 1;
      }
      control.pop();
    }
    throw new IllegalStateException("Unknown branch label " + label);
  }

  private void call(String name, StackLite<Long> stack) {
    if (imports.containsKey(name)) {
      if (name.equals("read_i32")) {
        if (input.isEmpty()) {
          throw new IllegalStateException("Input exhausted");
        }
        stack.push(normalize("i32", input.poll()));
      } else if (name.equals("write_i32")) {
        output.add(stack.pop());
      } else {
        throw new IllegalStateException("Unknown import " + name);
      }
      return;
    }
    Function callee = functions.get(name);
    if (callee == null) {
      throw new IllegalStateException("Unknown function " + name);
    }
    long[] args = new long[callee.paramCount];
    for (int i = args.length - 1; i >= 0; i--) {
      args[i] = stack.pop();
    }
    Long result = invoke(callee, args);
    if (result != null) {
      stack.push(result);
    }
  }

  private void numeric(String[] inst, StackLite<Long> stack) {
    String op = inst[0];
    int dot = op.indexOf('.');
    if (dot < 0) {
      throw new IllegalStateException("Unknown instruction " + op);
    }
    String type = op.substring(0, dot);
    String name = op.substring(dot + 1);

    if (name.equals("const")) {
      stack.push(normalize(type, Long.parseLong(inst[1])));
    } else if (name.equals("load")) {
      int addr = (int) (stack.pop() + offset(inst));
      stack.push(type.equals("i32") ? (long) memory.getInt(addr)
                                    : memory.getLong(addr));
    } else if (name.equals("store")) {
      long value = stack.pop();
      int addr = (int) (stack.pop() + offset(inst));
      if (type.equals("i32")) {
        memory.putInt(addr, (int) value);
      } else {
        memory.putLong(addr, value);
      }
    } else if (name.equals("eqz")) {
      stack.push(stack.pop() == 0 ? 1L : 0L);
    } else if (name.equals("extend_i32_s")) {
      stack.push((long) (int) (long) stack.pop());
    } else if (name.equals("wrap_i64")) {
      stack.push(normalize("i32", stack.pop()));
    } else {
      long b = stack.pop();
      long a = stack.pop();
      stack.push(binary(type, name, a, b));
    }
  }

  private static long binary(String type, String name, long a, long b) {
    long r;
    if (name.equals("add")) {
      r = a + b;
    } else if (name.equals("sub")) {
      r = a - b;
    } else if (name.equals("mul")) {
      r = a * b;
    } else if (name.equals("div_s")) {
      if (b == 0) {
        throw new ArithmeticException("integer divide by zero");
      }
      r = a / b;
    } else if (name.equals("and")) {
      r = a & b;
    } else if (name.equals("or")) {
      r = a | b;
    } else if (name.equals("xor")) {
      r = a ^ b;
    } else if (name.equals("eq")) {
      return a == b ? 1 : 0;
    } else if (name.equals("ne")) {
      return a != b ? 1 : 0;
    } else if (name.equals("lt_s")) {
      return a < b ? 1 : 0;
    } else if (name.equals("le_s")) {
      return a <= b ? 1 : 0;
    } else if (name.equals("gt_s")) {
      return a > b ? 1 : 0;
    } else if (name.equals("ge_s")) {
      return a >= b ? 1 : 0;
    } else {
      throw new IllegalStateException("Unknown instruction " + type + "." +
                                      name);
    }
    return normalize(type, r);
  }

  private static long normalize(String type, long value) {
    return type.equals("i32") ? (long) (int) value : value;
  }

  private static int offset(String[] inst) {
    if (inst.length > 1 && inst[1].startsWith("offset=")) {
      return Integer.parseInt(inst[1].substring("offset=".length()));
    }
    return 0;
  }

  private static String label(String[] inst) {
    if (inst.length < 2 || !inst[1].startsWith("$")) {
      throw new IllegalStateException("Expected $name operand: " +
                                      String.join(" ", inst));
    }
    return inst[1].substring(1);
  }

  public static class Result {
    /** Return value of main */
    public final Long value;
    /** Values passed to write_i32 */
    public final List<Long> output;

    Result(Long value, List<Long> output) {
      this.value = value;
      this.output = output;
    }
  }

  private static class Control {
    final String kind;
    final String label;
    final int start;
    final int end;
    final int stackHeight;

    Control(String kind, String label, int start, int end, int stackHeight) {
      this.kind = kind;
      this.label = label;
      this.start = start;
      this.end = end;
      this.stackHeight = stackHeight;
    }
  }

  private static class Function {
    final String name;
    final List<String[]> code = new ArrayList<String[]>();
    final Map<String, Integer> indices = new HashMap<String, Integer>();
    final List<String> types = new ArrayList<String>();
    int paramCount = 0;
    String resultType = null;

    /** Matching end of each block, loop and if */
    final Map<Integer, Integer> ends = new HashMap<Integer, Integer>();
    final Map<Integer, Integer> elses = new HashMap<Integer, Integer>();

    Function(String name) {
      this.name = name;
    }

    void addVariable(String var, String type) {
      if (indices.containsKey(var)) {
        throw new IllegalStateException("Duplicate local " + var + " in " +
                                        name);
      }
      indices.put(var, types.size());
      types.add(type);
    }

    int index(String var) {
      Integer i = indices.get(var);
      if (i == null) {
        throw new IllegalStateException("No local " + var + " in " + name);
      }
      return i;
    }

    void resolveStructure() {
      StackLite<Integer> open = new StackLite<Integer>();
      for (int pc = 0; pc < code.size(); pc++) {
        String op = code.get(pc)[0];
        if (op.equals("block") || op.equals("loop") || op.equals("if")) {
          open.push(pc);
        } else if (op.equals("else")) {
          elses.put(open.peek(), pc);
        } else if (op.equals("end")) {
          if (open.isEmpty()) {
            throw new IllegalStateException("Unbalanced end in " + name);
          }
          ends.put(open.pop(), pc);
        }
      }
      if (!open.isEmpty()) {
        throw new IllegalStateException("Unclosed structure in " + name);
      }
    }
  }
}
