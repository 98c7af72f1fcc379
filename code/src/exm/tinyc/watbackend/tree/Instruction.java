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

import org.apache.commons.lang3.StringUtils;

/**
 * A single instruction or structural marker, e.g. "i32.add" or
 * "block $break1".  Nesting depth only affects indentation.
 */
public class Instruction extends WatTree
{
  private final String text;
  private final int depth;

  public Instruction(int depth, String... tokens)
  {
    this.depth = depth;
    this.text = StringUtils.join(tokens, ' ');
  }

  public String text()
  {
    return text;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append(StringUtils.repeat(' ', depth * indentWidth));
    sb.append(text);
    sb.append('\n');
  }
}
