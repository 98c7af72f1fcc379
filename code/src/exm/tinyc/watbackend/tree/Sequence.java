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
import java.util.Collections;
import java.util.List;

/**
 * Flat list of nodes rendered one after another
 */
public class Sequence extends WatTree
{
  private final List<WatTree> members = new ArrayList<WatTree>();

  public void add(WatTree tree)
  {
    members.add(tree);
  }

  public List<WatTree> members()
  {
    return Collections.unmodifiableList(members);
  }

  public int size()
  {
    return members.size();
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (WatTree member : members)
    {
      member.setIndentation(indentation);
      member.appendTo(sb);
    }
  }
}
