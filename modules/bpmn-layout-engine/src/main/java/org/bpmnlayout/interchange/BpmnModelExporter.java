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

package org.bpmnlayout.interchange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.activiti.bpmn.model.Artifact;
import org.activiti.bpmn.model.BaseElement;
import org.activiti.bpmn.model.BpmnModel;
import org.activiti.bpmn.model.FlowElement;
import org.activiti.bpmn.model.GraphicInfo;
import org.activiti.bpmn.model.Lane;
import org.activiti.bpmn.model.MessageFlow;
import org.activiti.bpmn.model.Pool;
import org.activiti.bpmn.model.Process;
import org.activiti.bpmn.model.SubProcess;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;

/**
 * Writes the geometry of a {@link Diagram} back into the diagram interchange of a {@link BpmnModel}:
 * the location map, the flow location map and the label location map.
 */
public class BpmnModelExporter {

  protected Map<String, BaseElement> elements;

  public void exportDiagram(Diagram diagram, BpmnModel bpmnModel) {
    elements = collectElements(bpmnModel);

    for (Shape shape : diagram.getPlane()) {
      GraphicInfo graphicInfo = toGraphicInfo(shape.getBounds(), shape.getElementId());
      FlowNode node = diagram.getNode(shape.getElementId());
      if (node != null && node.getKind().isSubProcess()) {
        graphicInfo.setExpanded(Boolean.valueOf(node.isExpanded()));
      }
      bpmnModel.addGraphicInfo(shape.getElementId(), graphicInfo);
      if (shape.getLabel() != null) {
        bpmnModel.addLabelGraphicInfo(shape.getElementId(), toGraphicInfo(shape.getLabel(), shape.getElementId()));
      }
    }

    for (Edge edge : diagram.getEdges()) {
      if (edge.getWaypoints().isEmpty()) {
        continue;
      }
      List<GraphicInfo> graphicInfoForWaypoints = new ArrayList<GraphicInfo>();
      for (Point waypoint : edge.getWaypoints()) {
        GraphicInfo graphicInfo = new GraphicInfo();
        graphicInfo.setElement(elements.get(edge.getId()));
        graphicInfo.setX(waypoint.getX());
        graphicInfo.setY(waypoint.getY());
        graphicInfoForWaypoints.add(graphicInfo);
      }
      bpmnModel.addFlowGraphicInfoList(edge.getId(), graphicInfoForWaypoints);
      if (edge.getLabel() != null) {
        bpmnModel.addLabelGraphicInfo(edge.getId(), toGraphicInfo(edge.getLabel(), edge.getId()));
      }
    }
  }

  protected GraphicInfo toGraphicInfo(Bounds bounds, String elementId) {
    GraphicInfo graphicInfo = new GraphicInfo();
    graphicInfo.setX(bounds.getX());
    graphicInfo.setY(bounds.getY());
    graphicInfo.setWidth(bounds.getWidth());
    graphicInfo.setHeight(bounds.getHeight());
    graphicInfo.setElement(elements.get(elementId));
    return graphicInfo;
  }

  /**
   * Every element of the model that can carry interchange, by id.
   */
  protected Map<String, BaseElement> collectElements(BpmnModel bpmnModel) {
    Map<String, BaseElement> result = new HashMap<String, BaseElement>();
    for (Pool pool : bpmnModel.getPools()) {
      result.put(pool.getId(), pool);
    }
    for (MessageFlow messageFlow : bpmnModel.getMessageFlows().values()) {
      result.put(messageFlow.getId(), messageFlow);
    }
    for (Process process : bpmnModel.getProcesses()) {
      for (Lane lane : process.getLanes()) {
        result.put(lane.getId(), lane);
      }
      collectFlowElements(process.getFlowElements(), result);
      collectArtifacts(process.getArtifacts(), result);
    }
    return result;
  }

  protected void collectFlowElements(Collection<FlowElement> flowElements, Map<String, BaseElement> result) {
    for (FlowElement flowElement : flowElements) {
      result.put(flowElement.getId(), flowElement);
      if (flowElement instanceof SubProcess) {
        collectFlowElements(((SubProcess) flowElement).getFlowElements(), result);
        collectArtifacts(((SubProcess) flowElement).getArtifacts(), result);
      }
    }
  }

  protected void collectArtifacts(Collection<Artifact> artifacts, Map<String, BaseElement> result) {
    for (Artifact artifact : artifacts) {
      result.put(artifact.getId(), artifact);
    }
  }
}
