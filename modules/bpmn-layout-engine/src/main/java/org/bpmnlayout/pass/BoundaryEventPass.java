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

package org.bpmnlayout.pass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts boundary events back on the border of their host and arranges what hangs off them:
 * exception flow targets go below-right of the event, compensation handlers go below the host
 * unless they also take part in the sequence flow.
 */
public class BoundaryEventPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundaryEventPass.class);

  @Override
  public String getName() {
    return "boundary-events";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();

    Map<String, List<FlowNode>> byHost = new LinkedHashMap<String, List<FlowNode>>();
    for (FlowNode node : diagram.getNodes()) {
      if (node.isBoundaryEvent() && node.getAttachedToId() != null
          && diagram.getBounds(node.getAttachedToId()) != null && !diagram.isHidden(node.getId())) {
        List<FlowNode> events = byHost.get(node.getAttachedToId());
        if (events == null) {
          events = new ArrayList<FlowNode>();
          byHost.put(node.getAttachedToId(), events);
        }
        events.add(node);
      }
    }

    for (Map.Entry<String, List<FlowNode>> entry : byHost.entrySet()) {
      String hostId = entry.getKey();
      List<FlowNode> top = new ArrayList<FlowNode>();
      List<FlowNode> bottom = new ArrayList<FlowNode>();
      for (FlowNode event : entry.getValue()) {
        if (!isMovable(context, event, hostId)) {
          continue;
        }
        if (targetsAbove(diagram, event, diagram.getBounds(hostId))) {
          top.add(event);
        } else {
          bottom.add(event);
        }
      }
      attach(context, hostId, top, true);
      attach(context, hostId, bottom, false);
    }

    for (List<FlowNode> events : byHost.values()) {
      for (FlowNode event : events) {
        placeExceptionTargets(context, event);
        placeCompensationHandlers(context, event);
      }
    }
  }

  protected boolean isMovable(LayoutContext context, FlowNode event, String hostId) {
    return !context.isPinned(event.getId()) && (context.isMovable(event.getId()) || context.isMovable(hostId));
  }

  protected boolean targetsAbove(Diagram diagram, FlowNode event, Bounds host) {
    List<Edge> outgoing = diagram.getOutgoingSequenceFlows(event.getId());
    if (outgoing.isEmpty()) {
      return false;
    }
    for (Edge edge : outgoing) {
      Bounds target = diagram.getBounds(edge.getTargetId());
      if (target == null || target.getBottom() >= host.getY()) {
        return false;
      }
    }
    return true;
  }

  protected void attach(LayoutContext context, String hostId, List<FlowNode> events, boolean onTop) {
    if (events.isEmpty()) {
      return;
    }
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();
    Bounds host = diagram.getBounds(hostId);
    double borderY = onTop ? host.getY() : host.getBottom();

    for (int i = 0; i < events.size(); i++) {
      FlowNode event = events.get(i);
      double centerX = events.size() == 1
          ? host.getX() + host.getWidth() * settings.getBoundaryAnchorRatio()
          : host.getX() + host.getWidth() * (i + 1) / (events.size() + 1);

      Bounds current = diagram.getBounds(event.getId());
      double width = current != null && current.getWidth() > 0 ? current.getWidth() : settings.getEventSize();
      double height = current != null && current.getHeight() > 0 ? current.getHeight() : settings.getEventSize();
      if (current != null && distanceToBorder(current.getCenterX(), current.getCenterY(), host) > settings.getBoundaryTolerance()) {
        LOGGER.debug("Reattached boundary event {} to host {}", event.getId(), hostId);
      }
      double dx = 0;
      double dy = 0;
      if (current != null) {
        dx = Math.round(centerX - width / 2) - current.getX();
        dy = Math.round(borderY - height / 2) - current.getY();
      }
      diagram.setBounds(event.getId(), Math.round(centerX - width / 2), Math.round(borderY - height / 2), width, height);
      if (current != null && diagram.getShape(event.getId()).getLabel() != null) {
        diagram.getShape(event.getId()).getLabel().translate(dx, dy);
      }
    }
  }

  protected double distanceToBorder(double x, double y, Bounds host) {
    double dx = Math.max(host.getX() - x, Math.max(0, x - host.getRight()));
    double dy = Math.max(host.getY() - y, Math.max(0, y - host.getBottom()));
    if (dx > 0 || dy > 0) {
      return Math.sqrt(dx * dx + dy * dy);
    }
    return Math.min(Math.min(x - host.getX(), host.getRight() - x), Math.min(y - host.getY(), host.getBottom() - y));
  }

  /**
   * Targets that are reached only through the boundary event start an exception flow. They are
   * placed below-right of the event when that spot is free.
   */
  protected void placeExceptionTargets(LayoutContext context, FlowNode event) {
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();
    Bounds eventBounds = diagram.getBounds(event.getId());
    for (Edge edge : diagram.getOutgoingSequenceFlows(event.getId())) {
      FlowNode target = diagram.getNode(edge.getTargetId());
      Bounds targetBounds = diagram.getBounds(edge.getTargetId());
      if (target == null || targetBounds == null || !context.isMovable(target.getId()) || target.isForCompensation()
          || diagram.getIncomingSequenceFlows(target.getId()).size() != 1
          || (context.getHappyPath() != null && context.getHappyPath().containsNode(target.getId()))) {
        continue;
      }
      double x = Math.round(eventBounds.getCenterX() + settings.getBoundaryTargetOffsetX() - targetBounds.getWidth() / 2);
      double y = Math.round(eventBounds.getCenterY() + settings.getBoundaryTargetOffsetY() - targetBounds.getHeight() / 2);
      if (y < eventBounds.getCenterY()) {
        continue;
      }
      Bounds candidate = new Bounds(x, y, targetBounds.getWidth(), targetBounds.getHeight());
      if (isFree(diagram, candidate, target.getId())) {
        diagram.translateElement(target.getId(), x - targetBounds.getX(), y - targetBounds.getY());
      }
    }
  }

  protected void placeCompensationHandlers(LayoutContext context, FlowNode event) {
    Diagram diagram = context.getDiagram();
    Bounds host = diagram.getBounds(event.getAttachedToId());
    Bounds eventBounds = diagram.getBounds(event.getId());
    for (Edge edge : diagram.getConnectedEdges(event.getId())) {
      if (edge.getKind() != EdgeKind.ASSOCIATION) {
        continue;
      }
      String handlerId = edge.getSourceId().equals(event.getId()) ? edge.getTargetId() : edge.getSourceId();
      FlowNode handler = diagram.getNode(handlerId);
      Bounds handlerBounds = diagram.getBounds(handlerId);
      if (handler == null || handlerBounds == null || !context.isMovable(handlerId)
          || handler.getKind().isEvent() || handler.getKind().isGateway() || handler.getKind().isArtifact()) {
        continue;
      }
      // A handler that is part of the sequence flow keeps its computed position
      if (!diagram.getIncomingSequenceFlows(handlerId).isEmpty() || !diagram.getOutgoingSequenceFlows(handlerId).isEmpty()) {
        continue;
      }
      double x = Math.round(eventBounds.getCenterX() - handlerBounds.getWidth() / 2);
      double y = Math.round(host.getBottom() + context.getSettings().getCompensationOffset() - handlerBounds.getHeight() / 2);
      int attempts = 0;
      while (!isFree(diagram, new Bounds(x, y, handlerBounds.getWidth(), handlerBounds.getHeight()), handlerId) && attempts++ < 10) {
        y += handlerBounds.getHeight() + context.getSettings().getNodeSpacing();
      }
      diagram.translateElement(handlerId, x - handlerBounds.getX(), y - handlerBounds.getY());
      LOGGER.debug("Placed compensation handler {} below {}", handlerId, event.getAttachedToId());
    }
  }

  protected boolean isFree(Diagram diagram, Bounds candidate, String ignoredId) {
    for (FlowNode node : diagram.getNodes()) {
      if (node.getId().equals(ignoredId) || node.isBoundaryEvent() || diagram.getContainer(node.getId()) != null
          || diagram.isHidden(node.getId())) {
        continue;
      }
      Bounds bounds = diagram.getBounds(node.getId());
      if (bounds != null && bounds.intersects(candidate)) {
        return false;
      }
    }
    return true;
  }
}
