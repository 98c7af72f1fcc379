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

public class Comment extends WatTree
{
  private final String text;
  private final int depth;

  public Comment(int depth, String text)
  {
    this.depth = depth;
    this.text = text;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    for (int i = 0; i < depth * indentWidth; i++)
      sb.append(' ');
    sb.append(";; ");
    sb.append(text);
    sb.append('\n');
  }
}
