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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Geometry;
import org.bpmnlayout.model.Point;

/**
 * Measures the laid out diagram.
 * <p>
 * Orthogonality and bends are computed over all routed connections, the average length over
 * sequence flows only. A diagram without connections is 100% orthogonal with no bends.
 */
public class QualityMetricsPass implements LayoutPass {

  @Override
  public String getName() {
    return "quality-metrics";
  }

  @Override
  public void apply(LayoutContext context) {
    context.setQualityMetrics(compute(context.getDiagram(), context.getSettings().getOrthogonalTolerance()));
  }

  public static QualityMetrics compute(Diagram diagram, double tolerance) {
    int counted = 0;
    int orthogonal = 0;
    int bends = 0;
    int flows = 0;
    double flowLength = 0;
    for (Edge edge : diagram.getEdges()) {
      List<Point> waypoints = edge.getWaypoints();
      if (waypoints.size() < 2) {
        continue;
      }
      counted++;
      if (Geometry.isOrthogonal(waypoints, tolerance)) {
        orthogonal++;
      }
      bends += Math.max(0, waypoints.size() - 2);
      if (edge.getKind() == EdgeKind.SEQUENCE_FLOW) {
        flows++;
        flowLength += Geometry.pathLength(waypoints);
      }
    }

    int percent = counted == 0 ? 100 : (int) Math.round(100.0 * orthogonal / counted);
    double averageBends = counted == 0 ? 0 : Math.round(100.0 * bends / counted) / 100.0;
    int averageLength = flows == 0 ? 0 : (int) Math.round(flowLength / flows);
    return new QualityMetrics(percent, averageBends, averageLength, density(diagram));
  }

  protected static Map<String, Integer> density(Diagram diagram) {
    Map<String, Integer> density = new LinkedHashMap<String, Integer>();
    List<Container> lanes = diagram.getAllLanes();
    if (lanes.isEmpty()) {
      int total = 0;
      for (FlowNode node : diagram.getNodes()) {
        if (node.getKind().isFlowNode()) {
          total++;
        }
      }
      density.put("total", total);
      return density;
    }
    for (Container lane : lanes) {
      int count = 0;
      for (FlowNode node : diagram.getNodes()) {
        if (node.getKind().isFlowNode() && lane.getId().equals(node.getLaneId())) {
          count++;
        }
      }
      String name = lane.getName() != null && !lane.getName().isEmpty() ? lane.getName() : lane.getId();
      density.put(name, count);
    }
    return density;
  }
}
