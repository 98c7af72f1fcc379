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

package exm.tinyc.watbackend.tree;

import java.util.ArrayList;
import java.util.List;

import exm.tinyc.common.exceptions.TinyRuntimeError;
import exm.tinyc.common.util.Pair;

/**
 * Function definition.  Parameters and locals are (name, type) pairs;
 * the body is a flat instruction sequence.
 */
public class Func extends WatTree
{
  private final String name;
  private final String exportName;
  private final List<Pair<String, String>> params =
                              new ArrayList<Pair<String, String>>();
  private final List<Pair<String, String>> locals =
                              new ArrayList<Pair<String, String>>();
  private String resultType = null;
  private final Sequence body = new Sequence();

  /**
   * @param exportName exported name, or null if not exported
   */
  public Func(String name, String exportName)
  {
    checkIdentifier(name);
    this.name = name;
    this.exportName = exportName;
  }

  public String name()
  {
    return name;
  }

  public void addParam(String paramName, String type)
  {
    checkIdentifier(paramName);
    params.add(Pair.create(paramName, type));
  }

  public void addLocal(String localName, String type)
  {
    checkIdentifier(localName);
    locals.add(Pair.create(localName, type));
  }

  public void setResultType(String type)
  {
    this.resultType = type;
  }

  public Sequence getBody()
  {
    return body;
  }

  /**
   * Check that there are no invalid characters
   */
  static void checkIdentifier(String id)
  {
    if (id.isEmpty()) {
      throw new TinyRuntimeError("Empty WAT identifier");
    }
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.')) {
        throw new TinyRuntimeError("Bad character '" + c +
                                   "' in WAT identifier " + id);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("(func $").append(name);
    if (exportName != null) {
      sb.append(" (export \"").append(exportName).append("\")");
    }
    for (Pair<String, String> p: params) {
      sb.append(" (param $").append(p.val1).append(' ')
        .append(p.val2).append(')');
    }
    if (resultType != null) {
      sb.append(" (result ").append(resultType).append(')');
    }
    sb.append('\n');
    increaseIndent();
    for (Pair<String, String> l: locals) {
      indent(sb);
      sb.append("(local $").append(l.val1).append(' ')
        .append(l.val2).append(")\n");
    }
    body.setIndentation(indentation);
    body.appendTo(sb);
    decreaseIndent();
    indent(sb);
    sb.append(")\n");
  }
}
