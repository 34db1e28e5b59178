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

package org.bpmnlayout.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;

/**
 * The main flow of a diagram: walking from each start event, a gateway's default flow is
 * followed when it has one, otherwise the first outgoing sequence flow, until a node repeats
 * or no flow leaves the current node.
 */
public class HappyPath {

  protected Set<String> edgeIds = new LinkedHashSet<String>();
  protected List<String> nodeIds = new ArrayList<String>();

  public static HappyPath detect(Diagram diagram) {
    HappyPath happyPath = new HappyPath();
    Set<String> visited = new HashSet<String>();

    for (FlowNode start : diagram.getNodes()) {
      if (start.getKind() != ElementKind.START_EVENT) {
        continue;
      }
      FlowNode current = start;
      while (current != null && visited.add(current.getId())) {
        happyPath.nodeIds.add(current.getId());
        List<Edge> outgoing = diagram.getOutgoingSequenceFlows(current.getId());
        if (outgoing.isEmpty()) {
          break;
        }
        Edge chosen = null;
        if (current.getKind().isGateway() && current.getDefaultFlowId() != null) {
          for (Edge edge : outgoing) {
            if (edge.getId().equals(current.getDefaultFlowId())) {
              chosen = edge;
            }
          }
        }
        if (chosen == null) {
          chosen = outgoing.get(0);
        }
        happyPath.edgeIds.add(chosen.getId());
        current = diagram.getNode(chosen.getTargetId());
      }
    }
    return happyPath;
  }

  public boolean containsEdge(String edgeId) {
    return edgeIds.contains(edgeId);
  }

  public boolean containsNode(String nodeId) {
    return nodeIds.contains(nodeId);
  }

  public Set<String> getEdgeIds() {
    return Collections.unmodifiableSet(edgeIds);
  }

  /**
   * Nodes in walk order.
   */
  public List<String> getNodeIds() {
    return Collections.unmodifiableList(nodeIds);
  }
}
