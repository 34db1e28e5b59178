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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.bpmnlayout.graph.HappyPath;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects the happy path and stacks the branches of splitting gateways: the happy branch stays
 * where it is, every further branch is moved strictly below the extent already occupied by the
 * branches before it. Only vertical moves are made.
 */
public class GatewayStackingPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(GatewayStackingPass.class);

  @Override
  public String getName() {
    return "gateway-stacking";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    HappyPath happyPath = HappyPath.detect(diagram);
    context.setHappyPath(happyPath);

    int moved = 0;
    for (FlowNode gateway : new ArrayList<FlowNode>(diagram.getNodes())) {
      if (!gateway.getKind().isGateway() || diagram.getBounds(gateway.getId()) == null || diagram.isHidden(gateway.getId())) {
        continue;
      }
      List<Edge> branches = orderBranches(diagram.getOutgoingSequenceFlows(gateway.getId()), happyPath);
      if (branches.size() < 2) {
        continue;
      }

      Bounds occupied = diagram.getBounds(gateway.getId()).copy();
      Bounds first = extent(diagram, exclusiveChain(diagram, gateway.getId(), branches.get(0).getTargetId()));
      if (first != null) {
        occupied = occupied.union(first);
      }

      for (int i = 1; i < branches.size(); i++) {
        Set<String> chain = exclusiveChain(diagram, gateway.getId(), branches.get(i).getTargetId());
        Bounds chainExtent = extent(diagram, chain);
        if (chainExtent == null) {
          continue;
        }
        if (chainExtent.intersects(occupied) && isMovable(context, chain)) {
          double dy = occupied.getBottom() + context.getSettings().getNodeSpacing() - chainExtent.getY();
          for (String nodeId : chain) {
            diagram.translateElement(nodeId, 0, dy);
          }
          chainExtent.translate(0, dy);
          moved += chain.size();
        }
        occupied = occupied.union(chainExtent);
      }
    }
    if (moved > 0) {
      LOGGER.debug("Stacked {} branch node(s) of diagram {}", moved, diagram.getId());
    }
  }

  protected List<Edge> orderBranches(List<Edge> outgoing, HappyPath happyPath) {
    List<Edge> ordered = new ArrayList<Edge>();
    for (Edge edge : outgoing) {
      if (happyPath.containsEdge(edge.getId())) {
        ordered.add(edge);
      }
    }
    for (Edge edge : outgoing) {
      if (!ordered.contains(edge)) {
        ordered.add(edge);
      }
    }
    return ordered;
  }

  /**
   * Nodes reachable from {@code startId} that are entered only from the gateway or from nodes of
   * the chain itself. The walk stops at merge nodes.
   */
  protected Set<String> exclusiveChain(Diagram diagram, String gatewayId, String startId) {
    Set<String> chain = new LinkedHashSet<String>();
    ArrayDeque<String> queue = new ArrayDeque<String>();
    queue.add(startId);
    while (!queue.isEmpty()) {
      String nodeId = queue.poll();
      if (chain.contains(nodeId) || nodeId.equals(gatewayId) || diagram.getBounds(nodeId) == null) {
        continue;
      }
      boolean exclusive = true;
      for (Edge incoming : diagram.getIncomingSequenceFlows(nodeId)) {
        String sourceId = incoming.getSourceId();
        if (!sourceId.equals(gatewayId) && !chain.contains(sourceId)) {
          exclusive = false;
        }
      }
      if (!exclusive) {
        continue;
      }
      chain.add(nodeId);
      for (Edge outgoing : diagram.getOutgoingSequenceFlows(nodeId)) {
        queue.add(outgoing.getTargetId());
      }
    }
    return chain;
  }

  protected Bounds extent(Diagram diagram, Set<String> nodeIds) {
    Bounds extent = null;
    for (String nodeId : nodeIds) {
      Bounds bounds = diagram.getBounds(nodeId);
      extent = extent == null ? bounds.copy() : extent.union(bounds);
    }
    return extent;
  }

  protected boolean isMovable(LayoutContext context, Set<String> nodeIds) {
    for (String nodeId : nodeIds) {
      if (!context.isMovable(nodeId)) {
        return false;
      }
    }
    return true;
  }
}
