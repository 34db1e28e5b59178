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

package org.bpmnlayout.incremental;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.routing.ConnectionRouter;
import org.bpmnlayout.routing.RouteTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual edits outside of layout. Moving or resizing an element pins it, reassigning an element
 * to another lane is structural and does not.
 * <p>
 * Connections of the edited elements are updated right away: translated when both ends moved
 * together, re-routed otherwise.
 */
public class DiagramEditor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiagramEditor.class);

  protected Diagram diagram;
  protected DiagramLayoutState state;
  protected ConnectionRouter router;

  public DiagramEditor(Diagram diagram, DiagramLayoutState state, ConnectionRouter router) {
    this.diagram = diagram;
    this.state = state;
    this.router = router;
  }

  /**
   * Moves the element, its boundary events and its content so that its top-left corner is at
   * the given position. The element is pinned even when it does not actually move.
   */
  public void moveElement(String elementId, double x, double y) {
    Bounds bounds = requireBounds(elementId);
    double dx = x - bounds.getX();
    double dy = y - bounds.getY();
    Set<String> group = diagram.getRigidGroup(elementId);
    diagram.translateElement(elementId, dx, dy);
    state.pin(elementId);
    updateConnections(group, dx, dy);
    LOGGER.debug("Moved {} by ({}, {}) and pinned it", elementId, dx, dy);
  }

  public void resizeElement(String elementId, double width, double height) {
    if (width <= 0 || height <= 0) {
      throw new InvalidLayoutRequestException("Could not resize element '" + elementId + "': size must be positive");
    }
    Bounds bounds = requireBounds(elementId);
    diagram.setBounds(elementId, bounds.getX(), bounds.getY(), width, height);
    state.pin(elementId);
    Set<String> group = diagram.getRigidGroup(elementId);
    updateConnections(group, Double.NaN, Double.NaN);
    LOGGER.debug("Resized {} to {}x{} and pinned it", elementId, width, height);
  }

  /**
   * Moves a node into another lane of its pool and centers it vertically in that lane.
   */
  public void moveToLane(String nodeId, String laneId) {
    FlowNode node = diagram.getNode(nodeId);
    if (node == null) {
      throw new InvalidLayoutRequestException("Could not move to lane: element '" + nodeId + "' does not exist");
    }
    Container lane = diagram.getContainer(laneId);
    if (lane == null || !lane.isLane()) {
      throw new InvalidLayoutRequestException("Could not move to lane: element '" + laneId + "' is not a lane");
    }
    diagram.assignLane(nodeId, laneId);

    Bounds bounds = diagram.getBounds(nodeId);
    Bounds laneBounds = diagram.getBounds(laneId);
    if (bounds != null && laneBounds != null) {
      double dy = Math.round(laneBounds.getCenterY() - bounds.getHeight() / 2) - bounds.getY();
      Set<String> group = diagram.getRigidGroup(nodeId);
      diagram.translateElement(nodeId, 0, dy);
      updateConnections(group, 0, dy);
    }
    LOGGER.debug("Moved {} to lane {}", nodeId, laneId);
  }

  protected Bounds requireBounds(String elementId) {
    if (!diagram.containsElement(elementId)) {
      throw new InvalidLayoutRequestException("Could not edit element '" + elementId + "': it does not exist");
    }
    Bounds bounds = diagram.getBounds(elementId);
    if (bounds == null) {
      throw new InvalidLayoutRequestException("Could not edit element '" + elementId + "': it has no shape");
    }
    return bounds;
  }

  /**
   * Connections inside the group are translated by (dx, dy) unless the delta is NaN, connections
   * leaving it are re-routed.
   */
  protected void updateConnections(Set<String> group, double dx, double dy) {
    for (Edge edge : diagram.getEdges()) {
      boolean sourceIn = group.contains(edge.getSourceId());
      boolean targetIn = group.contains(edge.getTargetId());
      if (!sourceIn && !targetIn) {
        continue;
      }
      if (sourceIn && targetIn && !Double.isNaN(dx)) {
        List<Point> moved = new ArrayList<Point>();
        for (Point point : edge.getWaypoints()) {
          moved.add(point.translate(dx, dy));
        }
        edge.setWaypoints(moved);
        continue;
      }
      Bounds source = diagram.getBounds(edge.getSourceId());
      Bounds target = diagram.getBounds(edge.getTargetId());
      if (source == null || target == null) {
        continue;
      }
      try {
        edge.setWaypoints(router.route(diagram, edge));
      } catch (RuntimeException e) {
        LOGGER.warn("Could not route edge {} after edit, using a template route: {}", edge.getId(), e.getMessage());
        edge.setWaypoints(RouteTemplates.simple(source, target));
      }
    }
  }
}
