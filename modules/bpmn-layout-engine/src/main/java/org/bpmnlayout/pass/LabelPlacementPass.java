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
import java.util.List;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Geometry;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places external labels of events, gateways, data objects and named flows.
 * <p>
 * Four candidates are generated around the element (or around the anchor point of a flow):
 * top, bottom, left and right. Each candidate is scored by the connection segments it
 * intersects, the labels it overlaps and whether it overlaps the host of a boundary event, using
 * the weights of {@link LayoutSettings}. The lowest score wins, ties go to the earlier candidate.
 */
public class LabelPlacementPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(LabelPlacementPass.class);

  @Override
  public String getName() {
    return "label-placement";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();

    List<Bounds> hosts = new ArrayList<Bounds>();
    for (FlowNode node : diagram.getNodes()) {
      if (node.isBoundaryEvent() && node.getAttachedToId() != null && diagram.getBounds(node.getAttachedToId()) != null) {
        hosts.add(diagram.getBounds(node.getAttachedToId()));
      }
    }

    // Labels that stay where they are still count as obstacles
    List<Bounds> placed = new ArrayList<Bounds>();
    List<FlowNode> nodes = new ArrayList<FlowNode>();
    for (FlowNode node : diagram.getNodes()) {
      Shape shape = diagram.getShape(node.getId());
      if (shape == null || diagram.isHidden(node.getId())) {
        continue;
      }
      if (node.getKind().hasExternalLabel() && hasText(node.getName()) && context.isMovable(node.getId())) {
        nodes.add(node);
      } else if (shape.getLabel() != null) {
        placed.add(shape.getLabel());
      }
    }
    List<Edge> edges = new ArrayList<Edge>();
    for (Edge edge : diagram.getEdges()) {
      if (edge.hasName() && edge.getWaypoints().size() >= 2 && context.isInScope(edge)) {
        edges.add(edge);
      } else if (edge.getLabel() != null) {
        placed.add(edge.getLabel());
      }
    }

    for (FlowNode node : nodes) {
      Shape shape = diagram.getShape(node.getId());
      Bounds size = labelSize(settings, shape.getLabel());
      Bounds best = choose(diagram, settings, candidatesAround(shape.getBounds(), size, settings.getLabelDistance()), placed, hosts);
      shape.setLabel(best);
      placed.add(best);
    }
    for (Edge edge : edges) {
      Bounds size = labelSize(settings, edge.getLabel());
      Point anchor = flowLabelAnchor(edge.getWaypoints(), settings);
      Bounds best = choose(diagram, settings, candidatesAround(new Bounds(anchor.getX(), anchor.getY(), 0, 0), size, settings.getLabelDistance() / 2.0), placed, hosts);
      edge.setLabel(best);
      placed.add(best);
    }
    LOGGER.debug("Placed {} element label(s) and {} flow label(s) in diagram {}", nodes.size(), edges.size(), diagram.getId());
  }

  protected boolean hasText(String name) {
    return name != null && !name.trim().isEmpty();
  }

  protected Bounds labelSize(LayoutSettings settings, Bounds existing) {
    if (existing != null && existing.getWidth() > 0 && existing.getHeight() > 0) {
      return new Bounds(0, 0, existing.getWidth(), existing.getHeight());
    }
    return new Bounds(0, 0, settings.getLabelWidth(), settings.getLabelHeight());
  }

  /**
   * Candidates in priority order: top, bottom, left, right.
   */
  protected List<Bounds> candidatesAround(Bounds owner, Bounds size, double distance) {
    double width = size.getWidth();
    double height = size.getHeight();
    List<Bounds> candidates = new ArrayList<Bounds>();
    candidates.add(new Bounds(Math.round(owner.getCenterX() - width / 2), Math.round(owner.getY() - distance - height), width, height));
    candidates.add(new Bounds(Math.round(owner.getCenterX() - width / 2), Math.round(owner.getBottom() + distance), width, height));
    candidates.add(new Bounds(Math.round(owner.getX() - distance - width), Math.round(owner.getCenterY() - height / 2), width, height));
    candidates.add(new Bounds(Math.round(owner.getRight() + distance), Math.round(owner.getCenterY() - height / 2), width, height));
    return candidates;
  }

  protected Bounds choose(Diagram diagram, LayoutSettings settings, List<Bounds> candidates, List<Bounds> placed, List<Bounds> hosts) {
    Bounds best = null;
    int bestScore = Integer.MAX_VALUE;
    for (Bounds candidate : candidates) {
      int score = score(diagram, settings, candidate, placed, hosts);
      if (score < bestScore) {
        best = candidate;
        bestScore = score;
      }
    }
    return best;
  }

  protected int score(Diagram diagram, LayoutSettings settings, Bounds candidate, List<Bounds> placed, List<Bounds> hosts) {
    int score = 0;
    for (Edge edge : diagram.getEdges()) {
      List<Point> points = edge.getWaypoints();
      for (int i = 0; i + 1 < points.size(); i++) {
        if (Geometry.segmentIntersectsRect(points.get(i), points.get(i + 1), candidate)) {
          score += settings.getSegmentIntersectionWeight();
        }
      }
    }
    for (Bounds label : placed) {
      if (label.intersects(candidate)) {
        score += settings.getLabelOverlapWeight();
      }
    }
    for (Bounds host : hosts) {
      if (host.intersects(candidate)) {
        score += settings.getBoundaryHostOverlapWeight();
      }
    }
    return score;
  }

  /**
   * The point a flow label is placed around: the middle of the vertical part of an L shaped
   * route, the middle of the connecting segment of a Z shaped route, otherwise the middle of the
   * visible path (without the arrow head).
   */
  public static Point flowLabelAnchor(List<Point> points, LayoutSettings settings) {
    int preferred = preferredSegment(points, settings.getOrthogonalTolerance());
    if (preferred >= 0) {
      Point a = points.get(preferred);
      Point b = points.get(preferred + 1);
      if (a.distance(b) >= settings.getFlowLabelMinSegment()) {
        return new Point((a.getX() + b.getX()) / 2, (a.getY() + b.getY()) / 2);
      }
    }
    double length = Geometry.pathLength(points);
    return Geometry.pointAlong(points, Math.max(0, length - settings.getArrowHeadLength()) / 2);
  }

  static int preferredSegment(List<Point> points, double tolerance) {
    if (points.size() == 3) {
      boolean firstHorizontal = Geometry.isHorizontal(points.get(0), points.get(1), tolerance);
      boolean secondVertical = Geometry.isVertical(points.get(1), points.get(2), tolerance);
      if (firstHorizontal && secondVertical) {
        return 1;
      }
      if (Geometry.isVertical(points.get(0), points.get(1), tolerance) && Geometry.isHorizontal(points.get(1), points.get(2), tolerance)) {
        return 0;
      }
    }
    if (points.size() == 4) {
      boolean hvh = Geometry.isHorizontal(points.get(0), points.get(1), tolerance)
          && Geometry.isVertical(points.get(1), points.get(2), tolerance)
          && Geometry.isHorizontal(points.get(2), points.get(3), tolerance);
      boolean vhv = Geometry.isVertical(points.get(0), points.get(1), tolerance)
          && Geometry.isHorizontal(points.get(1), points.get(2), tolerance)
          && Geometry.isVertical(points.get(2), points.get(3), tolerance);
      if (hvh || vhv) {
        return 1;
      }
    }
    return -1;
  }
}
