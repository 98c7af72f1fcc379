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

/**
 * Mutable global with a constant initializer
 */
public class Global extends WatTree
{
  private final String name;
  private final String type;
  private final long initialValue;

  public Global(String name, String type, long initialValue)
  {
    Func.checkIdentifier(name);
    this.name = name;
    this.type = type;
    this.initialValue = initialValue;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("(global $").append(name).append(" (mut ").append(type)
      .append(") (").append(type).append(".const ").append(initialValue)
      .append("))\n");
  }
}
