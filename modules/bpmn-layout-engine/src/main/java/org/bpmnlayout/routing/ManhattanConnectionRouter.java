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

package org.bpmnlayout.routing;

import java.util.ArrayList;
import java.util.List;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;

/**
 * Orthogonal router for left-to-right diagrams.
 * <p>
 * Flows leaving a splitting gateway start at the rhombus corner facing their target, flows
 * entering a merging gateway end at the corner facing their source, flows leaving a boundary
 * event go down first. Everything else is a straight line or a Z shape through the middle of the
 * gap between source and target.
 */
public class ManhattanConnectionRouter implements ConnectionRouter {

  protected LayoutSettings settings;

  public ManhattanConnectionRouter(LayoutSettings settings) {
    this.settings = settings;
  }

  @Override
  public List<Point> route(Diagram diagram, Edge edge) {
    Bounds source = requireBounds(diagram, edge, edge.getSourceId());
    Bounds target = requireBounds(diagram, edge, edge.getTargetId());
    if (source.intersects(target)) {
      throw new IllegalStateException("Could not route edge '" + edge.getId() + "': source and target overlap");
    }

    FlowNode sourceNode = diagram.getNode(edge.getSourceId());
    FlowNode targetNode = diagram.getNode(edge.getTargetId());
    List<Point> points = new ArrayList<Point>();

    boolean rightwards = target.getX() >= source.getRight();
    boolean sameRow = Math.abs(source.getCenterY() - target.getCenterY()) <= 1;

    if (sourceNode != null && sourceNode.isBoundaryEvent() && target.getY() > source.getBottom()) {
      points.add(new Point(source.getCenterX(), source.getBottom()));
      if (target.getX() > source.getCenterX()) {
        points.add(new Point(source.getCenterX(), target.getCenterY()));
        points.add(new Point(target.getX(), target.getCenterY()));
      } else {
        points.add(new Point(source.getCenterX(), target.getY()));
      }

    } else if (rightwards && sameRow) {
      points.add(new Point(source.getRight(), source.getCenterY()));
      points.add(new Point(target.getX(), source.getCenterY()));

    } else if (rightwards && isSplittingGateway(diagram, sourceNode)) {
      // Start at the closest rhombus corner and turn towards the target on its row
      double cornerY = target.getCenterY() < source.getCenterY() ? source.getY() : source.getBottom();
      points.add(new Point(source.getCenterX(), cornerY));
      points.add(new Point(source.getCenterX(), target.getCenterY()));
      points.add(new Point(target.getX(), target.getCenterY()));

    } else if (rightwards && isMergingGateway(diagram, targetNode)) {
      double cornerY = source.getCenterY() < target.getCenterY() ? target.getY() : target.getBottom();
      points.add(new Point(source.getRight(), source.getCenterY()));
      points.add(new Point(target.getCenterX(), source.getCenterY()));
      points.add(new Point(target.getCenterX(), cornerY));

    } else if (rightwards) {
      double midX = (source.getRight() + target.getX()) / 2;
      points.add(new Point(source.getRight(), source.getCenterY()));
      points.add(new Point(midX, source.getCenterY()));
      points.add(new Point(midX, target.getCenterY()));
      points.add(new Point(target.getX(), target.getCenterY()));

    } else if (target.getY() >= source.getBottom() || target.getBottom() <= source.getY()) {
      boolean downwards = target.getY() >= source.getBottom();
      double exitY = downwards ? source.getBottom() : source.getY();
      double entryY = downwards ? target.getY() : target.getBottom();
      double midY = (exitY + entryY) / 2;
      points.add(new Point(source.getCenterX(), exitY));
      points.add(new Point(source.getCenterX(), midY));
      points.add(new Point(target.getCenterX(), midY));
      points.add(new Point(target.getCenterX(), entryY));

    } else {
      // Backward on the same band: a U below both shapes, participant-aware routing refines it
      double detourY = Math.max(source.getBottom(), target.getBottom()) + settings.getLoopbackMargin();
      return RouteTemplates.loopback(source, target, detourY, settings.getLoopbackHorizontalMargin());
    }

    return RouteTemplates.round(points);
  }

  protected Bounds requireBounds(Diagram diagram, Edge edge, String elementId) {
    Bounds bounds = diagram.getBounds(elementId);
    if (bounds == null || bounds.getWidth() <= 0 || bounds.getHeight() <= 0) {
      throw new IllegalStateException("Could not route edge '" + edge.getId() + "': endpoint '" + elementId + "' has no usable shape");
    }
    return bounds;
  }

  protected boolean isSplittingGateway(Diagram diagram, FlowNode node) {
    return node != null && node.getKind().isGateway() && diagram.getOutgoingSequenceFlows(node.getId()).size() > 1;
  }

  protected boolean isMergingGateway(Diagram diagram, FlowNode node) {
    return node != null && node.getKind().isGateway() && diagram.getIncomingSequenceFlows(node.getId()).size() > 1;
  }
}
