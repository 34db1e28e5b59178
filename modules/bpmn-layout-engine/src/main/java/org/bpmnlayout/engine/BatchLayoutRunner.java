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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies several edits, on one or more diagrams, optionally followed by one layout per touched
 * diagram. With stop-on-error the batch is all or nothing: the first failure rewinds every touched
 * diagram to its history position before the batch.
 */
public class BatchLayoutRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchLayoutRunner.class);

  protected DiagramRegistry registry;

  public BatchLayoutRunner(DiagramRegistry registry) {
    this.registry = registry;
  }

  public BatchResult run(List<BatchStep> steps, boolean stopOnError) {
    return run(steps, stopOnError, null);
  }

  /**
   * @param finalLayout options of the layout run on every touched diagram after the steps, or
   *          {@code null} for none
   */
  public BatchResult run(List<BatchStep> steps, boolean stopOnError, LayoutOptions finalLayout) {
    // Unknown diagrams are rejected before anything changes
    for (BatchStep step : steps) {
      registry.get(step.getDiagramId());
    }

    BatchResult result = new BatchResult();
    Map<String, Integer> positions = new LinkedHashMap<String, Integer>();
    for (int i = 0; i < steps.size(); i++) {
      BatchStep step = steps.get(i);
      DiagramSession session = registry.get(step.getDiagramId());
      if (!positions.containsKey(session.getId())) {
        positions.put(session.getId(), session.position());
        result.touchedDiagramIds.add(session.getId());
      }
      try {
        step.apply(session);
        result.executedSteps++;
      } catch (RuntimeException e) {
        result.errors.add("Step " + i + " (" + step + ") failed: " + e.getMessage());
        if (stopOnError) {
          result.failedStep = i;
          rollback(positions, result);
          return result;
        }
        LOGGER.warn("Batch step {} ({}) failed, continuing: {}", i, step, e.getMessage());
      }
    }

    if (finalLayout != null) {
      for (String diagramId : positions.keySet()) {
        try {
          result.layouts.put(diagramId, registry.get(diagramId).layout(finalLayout));
        } catch (RuntimeException e) {
          result.errors.add("Layout of diagram " + diagramId + " failed: " + e.getMessage());
          if (stopOnError) {
            rollback(positions, result);
            return result;
          }
          LOGGER.warn("Final layout of diagram {} failed, continuing: {}", diagramId, e.getMessage());
        }
      }
    }
    return result;
  }

  protected void rollback(Map<String, Integer> positions, BatchResult result) {
    for (Map.Entry<String, Integer> entry : positions.entrySet()) {
      registry.get(entry.getKey()).rewindTo(entry.getValue());
    }
    result.rolledBack = true;
    LOGGER.warn("Rolled back batch on diagram(s) {}: {}", positions.keySet(), result.errors);
  }
}
