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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rounds the position of every shape to the grid pitch of the context, when one is set.
 * <p>
 * Boundary events follow their host and lanes follow their pool instead of being snapped on
 * their own. Connections whose two ends moved by the same delta are translated, the others are
 * re-routed. Message flows are left to the message flow pass.
 */
public class GridSnapPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(GridSnapPass.class);

  @Override
  public String getName() {
    return "grid-snap";
  }

  @Override
  public void apply(LayoutContext context) {
    Integer pitch = context.getGridSnap();
    if (pitch == null || pitch <= 0) {
      return;
    }
    Diagram diagram = context.getDiagram();
    Map<String, Point> deltas = new HashMap<String, Point>();

    for (Container container : diagram.getContainers()) {
      boolean looseLane = container.isLane() && container.getParentId() == null;
      if ((container.isParticipant() || looseLane) && context.isMovable(container.getId())) {
        Point delta = snap(diagram, container.getId(), pitch);
        if (delta != null && container.isParticipant()) {
          for (Container lane : diagram.getLanes(container.getId())) {
            diagram.translateShape(lane.getId(), delta.getX(), delta.getY());
          }
        }
      }
    }

    for (FlowNode node : diagram.getNodes()) {
      if (node.isBoundaryEvent() || diagram.isHidden(node.getId()) || !context.isMovable(node.getId())) {
        continue;
      }
      Point delta = snap(diagram, node.getId(), pitch);
      if (delta == null) {
        continue;
      }
      deltas.put(node.getId(), delta);
      for (FlowNode event : diagram.getBoundaryEvents(node.getId())) {
        diagram.translateShape(event.getId(), delta.getX(), delta.getY());
        deltas.put(event.getId(), delta);
      }
    }

    int translated = 0;
    List<Edge> rerouted = new ArrayList<Edge>();
    for (Edge edge : diagram.getEdges()) {
      Point sourceDelta = deltas.get(edge.getSourceId());
      Point targetDelta = deltas.get(edge.getTargetId());
      if ((sourceDelta == null && targetDelta == null) || edge.getWaypoints().size() < 2) {
        continue;
      }
      if (sourceDelta != null && sourceDelta.equals(targetDelta)) {
        List<Point> moved = new ArrayList<Point>();
        for (Point point : edge.getWaypoints()) {
          moved.add(point.translate(sourceDelta.getX(), sourceDelta.getY()));
        }
        edge.setWaypoints(moved);
        translated++;
      } else if (edge.getKind() != EdgeKind.MESSAGE_FLOW
          && diagram.getBounds(edge.getSourceId()) != null && diagram.getBounds(edge.getTargetId()) != null) {
        edge.setWaypoints(ConnectionRoutingPass.route(context, edge));
        rerouted.add(edge);
      }
    }
    new ParallelFlowBundlingPass().bundle(context, rerouted);
    LOGGER.debug("Snapped {} node(s) of diagram {} to a {}px grid, {} route(s) translated, {} re-routed",
        deltas.size(), diagram.getId(), pitch, translated, rerouted.size());
  }

  /**
   * @return the applied delta, or {@code null} when the shape did not move
   */
  protected Point snap(Diagram diagram, String elementId, int pitch) {
    Bounds bounds = diagram.getBounds(elementId);
    if (bounds == null) {
      return null;
    }
    double dx = Math.round(bounds.getX() / pitch) * (double) pitch - bounds.getX();
    double dy = Math.round(bounds.getY() / pitch) * (double) pitch - bounds.getY();
    if (dx == 0 && dy == 0) {
      return null;
    }
    diagram.translateShape(elementId, dx, dy);
    return new Point(dx, dy);
  }
}
