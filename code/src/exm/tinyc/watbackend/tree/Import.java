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

import java.util.Arrays;
import java.util.List;

/**
 * Imported host function
 */
public class Import extends WatTree
{
  private final String name;
  private final String module;
  private final List<String> paramTypes;
  private final String resultType;

  /**
   * @param resultType null if no result
   */
  public Import(String name, String module, String resultType,
                String... paramTypes)
  {
    Func.checkIdentifier(name);
    this.name = name;
    this.module = module;
    this.resultType = resultType;
    this.paramTypes = Arrays.asList(paramTypes);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("(func $").append(name).append(" (import \"").append(module)
      .append("\" \"").append(name).append("\")");
    for (String t: paramTypes) {
      sb.append(" (param ").append(t).append(')');
    }
    if (resultType != null) {
      sb.append(" (result ").append(resultType).append(')');
    }
    sb.append(")\n");
  }
}
