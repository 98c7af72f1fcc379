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

package exm.tinyc.common.lang;

/**
 * Fixed names shared by the front end and the code generator
 */
public class Constants {
  /** Exported entry function */
  public static final String ENTRY_FUNCTION = "main";

  /** Host import that reads one value */
  public static final String READ_FN = "read_i32";
  /** Host import that writes one value */
  public static final String WRITE_FN = "write_i32";

  /** Shadow stack pointer global */
  public static final String STACK_POINTER = "__sp";

  /** Implicit result variable of a FUNCTION */
  public static final String RESULT_VAR = "RESULT";

  /** Prefix of compiler-generated scratch variables */
  public static final String SCRATCH_PREFIX = "__TMP";
}
