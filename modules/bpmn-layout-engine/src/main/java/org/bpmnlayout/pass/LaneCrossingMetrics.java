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

import java.util.Map;

import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * How well sequence flows stay within lanes. Only flows whose two endpoints have a lane count.
 */
@JsonPropertyOrder({ "totalLaneFlows", "crossingLaneFlows", "laneCoherenceScore" })
public class LaneCrossingMetrics {

  protected int totalLaneFlows;
  protected int crossingLaneFlows;
  protected int laneCoherenceScore;

  public LaneCrossingMetrics(int totalLaneFlows, int crossingLaneFlows, int laneCoherenceScore) {
    this.totalLaneFlows = totalLaneFlows;
    this.crossingLaneFlows = crossingLaneFlows;
    this.laneCoherenceScore = laneCoherenceScore;
  }

  /**
   * @return the metrics, or {@code null} when the diagram has no lanes
   */
  public static LaneCrossingMetrics compute(Diagram diagram) {
    if (diagram.getAllLanes().isEmpty()) {
      return null;
    }
    int total = 0;
    int crossing = 0;
    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() != EdgeKind.SEQUENCE_FLOW) {
        continue;
      }
      String sourceLane = laneOf(diagram, edge.getSourceId());
      String targetLane = laneOf(diagram, edge.getTargetId());
      if (sourceLane == null || targetLane == null) {
        continue;
      }
      total++;
      if (!sourceLane.equals(targetLane)) {
        crossing++;
      }
    }
    int score = total == 0 ? 100 : (int) Math.round(100.0 * (total - crossing) / total);
    return new LaneCrossingMetrics(total, crossing, score);
  }

  /**
   * Counts, per pair of lanes, the sequence flows running between them.
   */
  static void countLanePairs(Diagram diagram, Map<String, Integer> pairCounts) {
    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() != EdgeKind.SEQUENCE_FLOW) {
        continue;
      }
      String sourceLane = laneOf(diagram, edge.getSourceId());
      String targetLane = laneOf(diagram, edge.getTargetId());
      if (sourceLane != null && targetLane != null && !sourceLane.equals(targetLane)) {
        String key = sourceLane.compareTo(targetLane) < 0 ? sourceLane + "\n" + targetLane : targetLane + "\n" + sourceLane;
        Integer count = pairCounts.get(key);
        pairCounts.put(key, count == null ? 1 : count + 1);
      }
    }
  }

  // Boundary events share the lane of their host
  static String laneOf(Diagram diagram, String nodeId) {
    FlowNode node = diagram.getNode(nodeId);
    if (node == null) {
      return null;
    }
    if (node.getLaneId() == null && node.isBoundaryEvent() && node.getAttachedToId() != null) {
      FlowNode host = diagram.getNode(node.getAttachedToId());
      return host != null ? host.getLaneId() : null;
    }
    return node.getLaneId();
  }

  public int getTotalLaneFlows() {
    return totalLaneFlows;
  }

  public int getCrossingLaneFlows() {
    return crossingLaneFlows;
  }

  public int getLaneCoherenceScore() {
    return laneCoherenceScore;
  }

  @Override
  public String toString() {
    return "LaneCrossingMetrics[" + crossingLaneFlows + "/" + totalLaneFlows + " crossing, score " + laneCoherenceScore + "]";
  }
}
