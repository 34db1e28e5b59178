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

import org.activiti.bpmn.model.Activity;
import org.activiti.bpmn.model.Artifact;
import org.activiti.bpmn.model.Association;
import org.activiti.bpmn.model.BoundaryEvent;
import org.activiti.bpmn.model.BpmnModel;
import org.activiti.bpmn.model.BusinessRuleTask;
import org.activiti.bpmn.model.CallActivity;
import org.activiti.bpmn.model.DataObject;
import org.activiti.bpmn.model.DataStoreReference;
import org.activiti.bpmn.model.EndEvent;
import org.activiti.bpmn.model.EventGateway;
import org.activiti.bpmn.model.EventSubProcess;
import org.activiti.bpmn.model.FlowElement;
import org.activiti.bpmn.model.Gateway;
import org.activiti.bpmn.model.GraphicInfo;
import org.activiti.bpmn.model.InclusiveGateway;
import org.activiti.bpmn.model.IntermediateCatchEvent;
import org.activiti.bpmn.model.Lane;
import org.activiti.bpmn.model.ManualTask;
import org.activiti.bpmn.model.MessageFlow;
import org.activiti.bpmn.model.ParallelGateway;
import org.activiti.bpmn.model.Pool;
import org.activiti.bpmn.model.Process;
import org.activiti.bpmn.model.ReceiveTask;
import org.activiti.bpmn.model.ScriptTask;
import org.activiti.bpmn.model.SendTask;
import org.activiti.bpmn.model.SequenceFlow;
import org.activiti.bpmn.model.ServiceTask;
import org.activiti.bpmn.model.StartEvent;
import org.activiti.bpmn.model.SubProcess;
import org.activiti.bpmn.model.TextAnnotation;
import org.activiti.bpmn.model.ThrowEvent;
import org.activiti.bpmn.model.UserTask;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link BpmnModel} into a {@link Diagram}: pools, lanes, flow elements (nested
 * subprocesses included), artifacts, sequence flows, associations, message flows and whatever
 * diagram interchange the model already carries.
 * <p>
 * A subprocess is expanded when its DI says so. Without DI, a subprocess with content is expanded.
 */
public class BpmnModelImporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(BpmnModelImporter.class);

  protected BpmnModel bpmnModel;
  protected Diagram diagram;
  protected List<Edge> pendingAssociations;

  public Diagram importModel(BpmnModel bpmnModel, String diagramId) {
    this.bpmnModel = bpmnModel;
    this.diagram = new Diagram(diagramId);
    this.pendingAssociations = new ArrayList<Edge>();

    Map<String, String> poolOfProcess = new HashMap<String, String>();
    for (Pool pool : bpmnModel.getPools()) {
      diagram.addContainer(new Container(pool.getId(), ElementKind.PARTICIPANT).setName(pool.getName()));
      if (pool.getProcessRef() != null) {
        poolOfProcess.put(pool.getProcessRef(), pool.getId());
      }
    }

    for (Process process : bpmnModel.getProcesses()) {
      String poolId = poolOfProcess.get(process.getId());
      Map<String, String> laneOfElement = new HashMap<String, String>();
      for (Lane lane : process.getLanes()) {
        diagram.addContainer(new Container(lane.getId(), ElementKind.LANE).setName(lane.getName()).setParentId(poolId));
        for (String elementId : lane.getFlowReferences()) {
          laneOfElement.put(elementId, lane.getId());
        }
      }
      handleFlowElements(process.getFlowElements(), poolId, laneOfElement);
      handleArtifacts(process.getArtifacts(), poolId);
    }

    for (MessageFlow messageFlow : bpmnModel.getMessageFlows().values()) {
      Edge edge = new Edge(messageFlow.getId(), EdgeKind.MESSAGE_FLOW, messageFlow.getSourceRef(), messageFlow.getTargetRef());
      edge.setName(messageFlow.getName());
      diagram.addEdge(edge);
    }

    // Associations may point at elements of another process
    for (Edge association : pendingAssociations) {
      if (diagram.containsElement(association.getSourceId()) && diagram.containsElement(association.getTargetId())) {
        diagram.addEdge(association);
      } else {
        LOGGER.debug("Association {} does not connect two shapes, skipped", association.getId());
      }
    }

    importDiagramInterchange();
    LOGGER.debug("Imported {}", diagram);
    return diagram;
  }

  // Semantic elements

  protected void handleFlowElements(Collection<FlowElement> flowElements, String parentId, Map<String, String> laneOfElement) {
    List<SequenceFlow> sequenceFlows = new ArrayList<SequenceFlow>();
    for (FlowElement flowElement : flowElements) {
      if (flowElement instanceof SequenceFlow) {
        sequenceFlows.add((SequenceFlow) flowElement);
        continue;
      }
      ElementKind kind = kindOf(flowElement);
      if (kind == null) {
        LOGGER.debug("Element {} of type {} is not drawn, skipped", flowElement.getId(), flowElement.getClass().getSimpleName());
        continue;
      }
      FlowNode node = new FlowNode(flowElement.getId(), kind)
          .setName(flowElement.getName())
          .setParentId(parentId)
          .setLaneId(laneOfElement.get(flowElement.getId()));
      if (flowElement instanceof BoundaryEvent) {
        node.setAttachedToId(((BoundaryEvent) flowElement).getAttachedToRefId());
      }
      if (flowElement instanceof Activity) {
        Activity activity = (Activity) flowElement;
        node.setDefaultFlowId(activity.getDefaultFlow());
        node.setForCompensation(activity.isForCompensation());
      }
      if (flowElement instanceof Gateway) {
        node.setDefaultFlowId(((Gateway) flowElement).getDefaultFlow());
      }
      diagram.addNode(node);

      if (flowElement instanceof SubProcess) {
        SubProcess subProcess = (SubProcess) flowElement;
        if (isExpanded(subProcess)) {
          node.setExpanded(true);
          diagram.addContainer(new Container(subProcess.getId(), kind).setName(subProcess.getName()).setParentId(parentId));
        }
        handleFlowElements(subProcess.getFlowElements(), subProcess.getId(), laneOfElement);
        handleArtifacts(subProcess.getArtifacts(), subProcess.getId());
      }
    }

    for (SequenceFlow sequenceFlow : sequenceFlows) {
      Edge edge = new Edge(sequenceFlow.getId(), EdgeKind.SEQUENCE_FLOW, sequenceFlow.getSourceRef(), sequenceFlow.getTargetRef());
      edge.setName(sequenceFlow.getName());
      diagram.addEdge(edge);
    }
  }

  protected void handleArtifacts(Collection<Artifact> artifacts, String parentId) {
    for (Artifact artifact : artifacts) {
      if (artifact instanceof TextAnnotation) {
        FlowNode annotation = new FlowNode(artifact.getId(), ElementKind.TEXT_ANNOTATION)
            .setName(((TextAnnotation) artifact).getText())
            .setParentId(parentId);
        diagram.addNode(annotation);
      } else if (artifact instanceof Association) {
        Association association = (Association) artifact;
        pendingAssociations.add(new Edge(association.getId(), EdgeKind.ASSOCIATION, association.getSourceRef(), association.getTargetRef()));
      }
    }
  }

  protected boolean isExpanded(SubProcess subProcess) {
    GraphicInfo graphicInfo = bpmnModel.getGraphicInfo(subProcess.getId());
    if (graphicInfo != null && graphicInfo.getExpanded() != null) {
      return graphicInfo.getExpanded().booleanValue();
    }
    return !subProcess.getFlowElements().isEmpty();
  }

  /**
   * @return the kind, or {@code null} for elements without a shape of their own
   */
  protected ElementKind kindOf(FlowElement flowElement) {
    if (flowElement instanceof EventSubProcess) {
      return ElementKind.EVENT_SUB_PROCESS;
    } else if (flowElement instanceof SubProcess) {
      return ElementKind.SUB_PROCESS;
    } else if (flowElement instanceof UserTask) {
      return ElementKind.USER_TASK;
    } else if (flowElement instanceof ServiceTask) {
      return ElementKind.SERVICE_TASK;
    } else if (flowElement instanceof ScriptTask) {
      return ElementKind.SCRIPT_TASK;
    } else if (flowElement instanceof SendTask) {
      return ElementKind.SEND_TASK;
    } else if (flowElement instanceof ReceiveTask) {
      return ElementKind.RECEIVE_TASK;
    } else if (flowElement instanceof ManualTask) {
      return ElementKind.MANUAL_TASK;
    } else if (flowElement instanceof BusinessRuleTask) {
      return ElementKind.BUSINESS_RULE_TASK;
    } else if (flowElement instanceof CallActivity) {
      return ElementKind.CALL_ACTIVITY;
    } else if (flowElement instanceof Activity) {
      return ElementKind.TASK;
    } else if (flowElement instanceof ParallelGateway) {
      return ElementKind.PARALLEL_GATEWAY;
    } else if (flowElement instanceof InclusiveGateway) {
      return ElementKind.INCLUSIVE_GATEWAY;
    } else if (flowElement instanceof EventGateway) {
      return ElementKind.EVENT_BASED_GATEWAY;
    } else if (flowElement instanceof Gateway) {
      return ElementKind.EXCLUSIVE_GATEWAY;
    } else if (flowElement instanceof BoundaryEvent) {
      return ElementKind.BOUNDARY_EVENT;
    } else if (flowElement instanceof StartEvent) {
      return ElementKind.START_EVENT;
    } else if (flowElement instanceof EndEvent) {
      return ElementKind.END_EVENT;
    } else if (flowElement instanceof IntermediateCatchEvent) {
      return ElementKind.INTERMEDIATE_CATCH_EVENT;
    } else if (flowElement instanceof ThrowEvent) {
      return ElementKind.INTERMEDIATE_THROW_EVENT;
    } else if (flowElement instanceof DataObject) {
      return ElementKind.DATA_OBJECT;
    } else if (flowElement instanceof DataStoreReference) {
      return ElementKind.DATA_STORE;
    }
    return null;
  }

  // Diagram interchange

  protected void importDiagramInterchange() {
    for (Map.Entry<String, GraphicInfo> entry : bpmnModel.getLocationMap().entrySet()) {
      if (!diagram.containsElement(entry.getKey())) {
        continue;
      }
      GraphicInfo graphicInfo = entry.getValue();
      Shape shape = new Shape(entry.getKey(), toBounds(graphicInfo));
      GraphicInfo label = bpmnModel.getLabelGraphicInfo(entry.getKey());
      if (label != null) {
        shape.setLabel(toBounds(label));
      }
      diagram.addShape(shape);
    }

    for (Edge edge : diagram.getEdges()) {
      List<GraphicInfo> waypoints = bpmnModel.getFlowLocationGraphicInfo(edge.getId());
      if (waypoints != null) {
        List<Point> points = new ArrayList<Point>();
        for (GraphicInfo waypoint : waypoints) {
          points.add(new Point(waypoint.getX(), waypoint.getY()));
        }
        edge.setWaypoints(points);
      }
      GraphicInfo label = bpmnModel.getLabelGraphicInfo(edge.getId());
      if (label != null) {
        edge.setLabel(toBounds(label));
      }
    }
  }

  protected Bounds toBounds(GraphicInfo graphicInfo) {
    return new Bounds(graphicInfo.getX(), graphicInfo.getY(), graphicInfo.getWidth(), graphicInfo.getHeight());
  }
}
