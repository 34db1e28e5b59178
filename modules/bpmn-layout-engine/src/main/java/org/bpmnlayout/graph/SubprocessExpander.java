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

package org.bpmnlayout.graph;

import java.util.ArrayList;
import java.util.List;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns collapsed subprocesses that contain flow nodes into expanded containers, so that their
 * content takes part in the layout. Event subprocesses are left collapsed.
 */
public class SubprocessExpander {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessExpander.class);

  protected LayoutSettings settings;

  public SubprocessExpander(LayoutSettings settings) {
    this.settings = settings;
  }

  /**
   * @return the number of expanded subprocesses
   */
  public int expand(Diagram diagram) {
    List<FlowNode> candidates = new ArrayList<FlowNode>();
    for (FlowNode node : diagram.getNodes()) {
      if (node.getKind() == ElementKind.SUB_PROCESS && !node.isTriggeredByEvent()
          && diagram.getContainer(node.getId()) == null && hasInternalFlow(diagram, node)) {
        candidates.add(node);
      }
    }

    for (FlowNode subProcess : candidates) {
      Container container = new Container(subProcess.getId(), subProcess.getKind())
          .setName(subProcess.getName())
          .setParentId(subProcess.getParentId());
      diagram.addContainer(container);
      subProcess.setExpanded(true);

      Bounds bounds = diagram.getBounds(subProcess.getId());
      double x = bounds != null ? bounds.getX() : settings.getOriginX();
      double y = bounds != null ? bounds.getY() : settings.getOriginY();
      diagram.setBounds(subProcess.getId(), x, y, settings.getSubProcessWidth(), settings.getSubProcessHeight());
      LOGGER.debug("Expanded subprocess {} of diagram {}", subProcess.getId(), diagram.getId());
    }
    return candidates.size();
  }

  protected boolean hasInternalFlow(Diagram diagram, FlowNode subProcess) {
    for (FlowNode node : diagram.getNodes()) {
      if (subProcess.getId().equals(node.getParentId()) && node.getKind().isFlowNode()) {
        return true;
      }
    }
    return false;
  }
}
