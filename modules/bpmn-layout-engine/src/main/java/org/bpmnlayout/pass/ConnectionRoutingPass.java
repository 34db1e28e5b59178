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

import java.util.List;

import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.routing.LoopbackRouter;
import org.bpmnlayout.routing.RouteTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-routes sequence flows and associations from the final node positions through the
 * connection router of the context. Backward sequence flows get a loopback route. A failing
 * edge is logged and falls back to a template route; the other edges are not affected.
 * <p>
 * Scoped layouts only route edges with both ends in scope; edges leaving the scope are rebuilt
 * separately.
 */
public class ConnectionRoutingPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRoutingPass.class);

  @Override
  public String getName() {
    return "connection-routing";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    int routed = 0;
    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() == EdgeKind.MESSAGE_FLOW || !isRoutable(context, edge)) {
        continue;
      }
      if (diagram.getBounds(edge.getSourceId()) == null || diagram.getBounds(edge.getTargetId()) == null
          || diagram.isHidden(edge.getSourceId()) || diagram.isHidden(edge.getTargetId())) {
        continue;
      }
      edge.setWaypoints(route(context, edge));
      routed++;
    }
    LOGGER.debug("Routed {} connection(s) of diagram {}", routed, diagram.getId());
  }

  /**
   * Routes one edge whose endpoints both have a shape, falling back to a template route when the
   * router fails.
   */
  static List<Point> route(LayoutContext context, Edge edge) {
    Diagram diagram = context.getDiagram();
    try {
      if (LoopbackRouter.isBackward(diagram, edge)) {
        return new LoopbackRouter(context.getSettings()).route(diagram, edge);
      }
      return context.getRouter().route(diagram, edge);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not route edge {} of diagram {}, using a template route: {}", edge.getId(), diagram.getId(), e.getMessage());
      return RouteTemplates.simple(diagram.getBounds(edge.getSourceId()), diagram.getBounds(edge.getTargetId()));
    }
  }

  protected boolean isRoutable(LayoutContext context, Edge edge) {
    if (!context.isScoped()) {
      return true;
    }
    return context.isInScope(edge.getSourceId()) && context.isInScope(edge.getTargetId())
        && (context.isMovable(edge.getSourceId()) || context.isMovable(edge.getTargetId()));
  }
}
