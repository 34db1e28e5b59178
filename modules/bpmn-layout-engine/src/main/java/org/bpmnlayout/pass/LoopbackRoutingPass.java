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

import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.routing.LoopbackRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-routes backward sequence flows on the final geometry as U shapes kept inside their own pool
 * or subprocess. Backward flows sharing source and target are nested inside each other.
 *
 * @see LoopbackRouter
 */
public class LoopbackRoutingPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackRoutingPass.class);

  @Override
  public String getName() {
    return "loopback-routing";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    Map<String, List<Edge>> groups = new LinkedHashMap<String, List<Edge>>();
    for (Edge edge : diagram.getEdges()) {
      if (context.isInScope(edge) && LoopbackRouter.isBackward(diagram, edge)
          && !diagram.isHidden(edge.getSourceId()) && !diagram.isHidden(edge.getTargetId())) {
        String key = edge.getSourceId() + "\n" + edge.getTargetId();
        List<Edge> group = groups.get(key);
        if (group == null) {
          group = new ArrayList<Edge>();
          groups.put(key, group);
        }
        group.add(edge);
      }
    }

    LoopbackRouter router = new LoopbackRouter(context.getSettings());
    int routed = 0;
    for (List<Edge> group : groups.values()) {
      for (int i = 0; i < group.size(); i++) {
        Edge edge = group.get(i);
        edge.setWaypoints(route(context, router, edge, i, group.size()));
        routed++;
      }
    }
    if (routed > 0) {
      LOGGER.debug("Routed {} loopback(s) in diagram {}", routed, diagram.getId());
    }
  }

  protected List<Point> route(LayoutContext context, LoopbackRouter router, Edge edge, int index, int count) {
    try {
      return router.route(context.getDiagram(), edge, index, count);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not route loopback {} of diagram {}: {}", edge.getId(), context.getDiagram().getId(), e.getMessage());
      return ConnectionRoutingPass.route(context, edge);
    }
  }
}
