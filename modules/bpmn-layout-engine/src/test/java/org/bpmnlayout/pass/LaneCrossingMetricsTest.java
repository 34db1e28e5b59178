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

import static org.assertj.core.api.Assertions.assertThat;

import org.bpmnlayout.DiagramFixtures;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.junit.jupiter.api.Test;

public class LaneCrossingMetricsTest {

  @Test
  public void allElementsInOneLaneAreFullyCoherent() {
    LaneCrossingMetrics metrics = LaneCrossingMetrics.compute(DiagramFixtures.twoLanePool("coherent"));

    assertThat(metrics.getTotalLaneFlows()).isEqualTo(3);
    assertThat(metrics.getCrossingLaneFlows()).isZero();
    assertThat(metrics.getLaneCoherenceScore()).isEqualTo(100);
  }

  @Test
  public void flowsBetweenLanesLowerTheScore() {
    Diagram diagram = DiagramFixtures.twoLanePool("crossing");
    diagram.assignLane("task2", "lane2");

    LaneCrossingMetrics metrics = LaneCrossingMetrics.compute(diagram);

    assertThat(metrics.getCrossingLaneFlows()).isEqualTo(2);
    assertThat(metrics.getLaneCoherenceScore()).isEqualTo(33);
  }

  @Test
  public void noLanesMeansNoMetrics() {
    assertThat(LaneCrossingMetrics.compute(DiagramFixtures.chain("plain", 2))).isNull();
  }

  @Test
  public void lanesWithoutAssignedFlowsScoreFull() {
    Diagram diagram = DiagramFixtures.twoLanePool("unassigned");
    diagram.addNode(new FlowNode("loose", ElementKind.TASK).setParentId("pool"));
    DiagramFixtures.flow(diagram, "toLoose", "end", "loose");
    for (String nodeId : new String[] { "start", "task1", "task2", "end" }) {
      diagram.getNode(nodeId).setLaneId(null);
    }

    LaneCrossingMetrics metrics = LaneCrossingMetrics.compute(diagram);

    assertThat(metrics.getTotalLaneFlows()).isZero();
    assertThat(metrics.getLaneCoherenceScore()).isEqualTo(100);
  }
}
