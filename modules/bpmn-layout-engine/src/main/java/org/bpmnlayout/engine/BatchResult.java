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

package org.bpmnlayout.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link BatchLayoutRunner} run.
 */
public class BatchResult {

  protected int executedSteps;
  protected List<String> errors = new ArrayList<String>();
  protected int failedStep = -1;
  protected boolean rolledBack;
  protected List<String> touchedDiagramIds = new ArrayList<String>();
  protected Map<String, LayoutResult> layouts = new LinkedHashMap<String, LayoutResult>();

  public boolean isSuccess() {
    return errors.isEmpty();
  }

  public int getExecutedSteps() {
    return executedSteps;
  }

  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  /**
   * @return index of the step that stopped the batch, -1 when none did
   */
  public int getFailedStep() {
    return failedStep;
  }

  public boolean isRolledBack() {
    return rolledBack;
  }

  public List<String> getTouchedDiagramIds() {
    return Collections.unmodifiableList(touchedDiagramIds);
  }

  /**
   * Results of the final layouts by diagram id.
   */
  public Map<String, LayoutResult> getLayouts() {
    return Collections.unmodifiableMap(layouts);
  }

  @Override
  public String toString() {
    return "BatchResult[executed=" + executedSteps + ", errors=" + errors.size() + ", rolledBack=" + rolledBack + "]";
  }
}
