/* Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.bpmnlayout.history;

/**
 * Executes commands on a diagram and allows going back to an earlier position.
 */
public interface CommandHistory {

  /**
   * @return the number of commands executed and not undone
   */
  int position();

  /**
   * Runs the command. When it throws, the diagram is left as it was before the command.
   */
  <T> T execute(DiagramCommand<T> command);

  /**
   * Restores the diagram to the state it had at the given position.
   */
  void rewindTo(int position);

  /**
   * @return false when there was nothing to undo
   */
  boolean undo();
}
