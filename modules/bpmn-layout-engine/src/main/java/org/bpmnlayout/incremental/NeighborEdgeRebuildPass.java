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

import java.util.List;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.pass.LayoutContext;
import org.bpmnlayout.pass.LayoutPass;
import org.bpmnlayout.routing.LoopbackRouter;
import org.bpmnlayout.routing.RouteTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the connections with exactly one end inside the scope of a partial layout, so that
 * none of them keeps a stale route.
 * <p>
 * A connection whose target lies right of its source gets a forward route: straight when both
 * centers are on the same row, otherwise through the connection router with a Z shaped fallback.
 * Any other connection gets a U shaped loopback route.
 */
public class NeighborEdgeRebuildPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(NeighborEdgeRebuildPass.class);

  @Override
  public String getName() {
    return "neighbor-edge-rebuild";
  }

  @Override
  public void apply(LayoutContext context) {
    if (!context.isScoped()) {
      return;
    }
    Diagram diagram = context.getDiagram();
    int rebuilt = 0;
    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() == EdgeKind.MESSAGE_FLOW || !isNeighborEdge(context, edge)) {
        continue;
      }
      Bounds source = diagram.getBounds(edge.getSourceId());
      Bounds target = diagram.getBounds(edge.getTargetId());
      if (source == null || target == null) {
        continue;
      }
      edge.setWaypoints(isForward(source, target)
          ? forward(context, edge, source, target)
          : backward(context, edge, source, target));
      rebuilt++;
    }
    LOGGER.debug("Rebuilt {} neighbor edge(s) of diagram {}", rebuilt, diagram.getId());
  }

  public static boolean isNeighborEdge(LayoutContext context, Edge edge) {
    return context.isInScope(edge.getSourceId()) != context.isInScope(edge.getTargetId());
  }

  public static boolean isForward(Bounds source, Bounds target) {
    return target.getCenterX() >= source.getCenterX();
  }

  protected List<Point> forward(LayoutContext context, Edge edge, Bounds source, Bounds target) {
    LayoutSettings settings = context.getSettings();
    if (Math.abs(source.getCenterY() - target.getCenterY()) <= settings.getSameRowThreshold()) {
      return RouteTemplates.forward(source, target, settings.getSameRowThreshold());
    }
    try {
      return context.getRouter().route(context.getDiagram(), edge);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not route neighbor edge {}, using a template route: {}", edge.getId(), e.getMessage());
      return RouteTemplates.forward(source, target, settings.getSameRowThreshold());
    }
  }

  protected List<Point> backward(LayoutContext context, Edge edge, Bounds source, Bounds target) {
    LayoutSettings settings = context.getSettings();
    try {
      return new LoopbackRouter(settings).route(context.getDiagram(), edge);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not route neighbor edge {} as a loopback, using a template route: {}", edge.getId(), e.getMessage());
      double detourY = Math.max(source.getBottom(), target.getBottom()) + settings.getLoopbackMargin();
      return RouteTemplates.loopback(source, target, detourY, settings.getLoopbackHorizontalMargin());
    }
  }
}
