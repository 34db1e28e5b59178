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

import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.model.Diagram;

/**
 * A unit of work on one diagram that the {@link CommandHistory} can undo.
 *
 * @param <T> the result of the command
 */
public interface DiagramCommand<T> {

  String getName();

  T execute(Diagram diagram, DiagramLayoutState state);
}
