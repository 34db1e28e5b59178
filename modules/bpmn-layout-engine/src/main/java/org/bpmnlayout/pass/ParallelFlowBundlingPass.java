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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.Geometry;
import org.bpmnlayout.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separates flows that share both source and target. The routes of such a group are offset
 * symmetrically around the original route, vertically for routes with horizontal parts and
 * horizontally for a single vertical segment. Offsets are clamped so that endpoints stay on the
 * borders of their shapes. A single flow between two nodes is never changed.
 */
public class ParallelFlowBundlingPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParallelFlowBundlingPass.class);

  @Override
  public String getName() {
    return "parallel-flow-bundling";
  }

  @Override
  public void apply(LayoutContext context) {
    List<Edge> flows = new ArrayList<Edge>();
    for (Edge edge : context.getDiagram().getEdges()) {
      if (context.isInScope(edge)) {
        flows.add(edge);
      }
    }
    bundle(context, flows);
  }

  /**
   * Spreads the parallel groups found among {@code edges}. Passes that re-route flows after this
   * pass ran call it again with the flows they re-routed.
   */
  public void bundle(LayoutContext context, Collection<Edge> edges) {
    Map<String, List<Edge>> groups = new LinkedHashMap<String, List<Edge>>();
    for (Edge edge : edges) {
      if (!edge.getKind().isFlow() || edge.getWaypoints().size() < 2) {
        continue;
      }
      String key = edge.getKind() + ":" + edge.getSourceId() + "->" + edge.getTargetId();
      List<Edge> group = groups.get(key);
      if (group == null) {
        group = new ArrayList<Edge>();
        groups.put(key, group);
      }
      group.add(edge);
    }

    for (List<Edge> group : groups.values()) {
      if (group.size() > 1) {
        spread(context, group);
      }
    }
  }

  protected void spread(LayoutContext context, List<Edge> group) {
    Diagram diagram = context.getDiagram();
    Bounds source = diagram.getBounds(group.get(0).getSourceId());
    Bounds target = diagram.getBounds(group.get(0).getTargetId());
    if (source == null || target == null) {
      return;
    }
    double tolerance = context.getSettings().getOrthogonalTolerance();
    List<Point> reference = group.get(0).getWaypoints();
    boolean vertical = reference.size() == 2 && Geometry.isVertical(reference.get(0), reference.get(1), tolerance);

    double room = vertical
        ? Math.min(source.getWidth(), target.getWidth()) / 2 - 4
        : Math.min(source.getHeight(), target.getHeight()) / 2 - 4;
    double step = context.getSettings().getParallelFlowOffset();
    double half = (group.size() - 1) / 2.0;
    if (half * step > room) {
      step = Math.max(0, room / half);
    }

    for (int i = 0; i < group.size(); i++) {
      double offset = Math.round((i - half) * step);
      if (offset == 0) {
        continue;
      }
      Edge edge = group.get(i);
      edge.setWaypoints(vertical ? shiftX(edge.getWaypoints(), offset) : shiftY(edge.getWaypoints(), offset, tolerance));
    }
    LOGGER.debug("Spread {} parallel flow(s) from {} to {}", group.size(), group.get(0).getSourceId(), group.get(0).getTargetId());
  }

  protected List<Point> shiftX(List<Point> points, double offset) {
    List<Point> shifted = new ArrayList<Point>();
    for (Point point : points) {
      shifted.add(point.translate(offset, 0));
    }
    return shifted;
  }

  /**
   * Interior points always move; an endpoint moves along with them when its segment is horizontal,
   * so that the segment stays horizontal and the endpoint slides along the vertical border.
   * Interior vertical segments also move sideways, against the vertical offset, so that the
   * middle legs of parallel Z routes neither overlap nor cross each other.
   */
  protected List<Point> shiftY(List<Point> points, double offset, double tolerance) {
    List<Point> shifted = new ArrayList<Point>();
    int last = points.size() - 1;
    for (int i = 0; i <= last; i++) {
      Point point = points.get(i);
      boolean move;
      if (i == 0) {
        move = Geometry.isHorizontal(point, points.get(1), tolerance);
      } else if (i == last) {
        move = Geometry.isHorizontal(points.get(last - 1), point, tolerance);
      } else {
        move = true;
      }
      shifted.add(move ? point.translate(0, offset) : point);
    }
    double horizontalDirection = Math.signum(points.get(last).getX() - points.get(0).getX());
    for (int i = 1; i + 1 < last; i++) {
      Point a = shifted.get(i);
      Point b = shifted.get(i + 1);
      if (Geometry.isVertical(a, b, tolerance)) {
        double dx = -offset * Math.signum(b.getY() - a.getY()) * horizontalDirection;
        shifted.set(i, a.translate(dx, 0));
        shifted.set(i + 1, b.translate(dx, 0));
      }
    }
    return shifted;
  }
}
