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

package org.bpmnlayout.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bpmnlayout.DiagramFixtures.chain;
import static org.bpmnlayout.DiagramFixtures.flow;
import static org.bpmnlayout.DiagramFixtures.messageFlow;
import static org.bpmnlayout.DiagramFixtures.pool;
import static org.bpmnlayout.DiagramFixtures.twoLanePool;

import org.bpmnlayout.DiagramFixtures;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.junit.jupiter.api.Test;

public class StrategySelectorTest {

  private final StrategySelector selector = new StrategySelector(new LayoutSettings());

  @Test
  public void linearChainIsLaidOutDeterministically() {
    Diagram diagram = chain("chain", 2);

    StrategyRecommendation recommendation = selector.recommend(diagram, false);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.DETERMINISTIC);
    assertThat(recommendation.getConfidence()).isEqualTo(Confidence.HIGH);
    assertThat(recommendation.getStats().getFlowNodeCount()).isEqualTo(4);
    assertThat(recommendation.getStats().getSequenceFlowCount()).isEqualTo(3);
  }

  @Test
  public void singleSplitMergeIsStillTrivial() {
    StrategyRecommendation recommendation = selector.recommend(DiagramFixtures.splitMerge("split"), false);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.DETERMINISTIC);
  }

  @Test
  public void subsetRequestWinsOverEverything() {
    StrategyRecommendation recommendation = selector.recommend(twoLanePool("lanes"), true);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.SUBSET);
    assertThat(recommendation.getConfidence()).isEqualTo(Confidence.HIGH);
  }

  @Test
  public void emptyDiagramGetsFullLayoutWithLowConfidence() {
    StrategyRecommendation recommendation = selector.recommend(new Diagram("empty"), false);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.FULL);
    assertThat(recommendation.getConfidence()).isEqualTo(Confidence.LOW);
  }

  @Test
  public void boundaryEventsNeedFullLayout() {
    Diagram diagram = chain("boundary", 1);
    diagram.addNode(new FlowNode("timer", ElementKind.BOUNDARY_EVENT).setAttachedToId("task1"));

    StrategyRecommendation recommendation = selector.recommend(diagram, false);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.FULL);
    assertThat(recommendation.getConfidence()).isEqualTo(Confidence.MEDIUM);
  }

  @Test
  public void collaborationWithMessageFlows() {
    Diagram diagram = new Diagram("collaboration");
    pool(diagram, "customer", 0, 0, 600, 250);
    pool(diagram, "shop", 0, 300, 600, 250);
    diagram.addNode(new FlowNode("order", ElementKind.SEND_TASK).setParentId("customer"));
    diagram.addNode(new FlowNode("receive", ElementKind.RECEIVE_TASK).setParentId("shop"));
    messageFlow(diagram, "m1", "order", "receive");

    StrategyRecommendation recommendation = selector.recommend(diagram, false);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.COLLABORATION);
    assertThat(recommendation.getConfidence()).isEqualTo(Confidence.HIGH);
  }

  @Test
  public void lanesInSinglePool() {
    assertThat(selector.recommend(twoLanePool("lanes"), false).getStrategy()).isEqualTo(LayoutStrategy.LANES);
  }

  @Test
  public void cycleNeedsFullLayout() {
    Diagram diagram = chain("loop", 2);
    flow(diagram, "back", "task2", "task1");

    StrategyRecommendation recommendation = selector.recommend(diagram, false);

    assertThat(recommendation.getStrategy()).isEqualTo(LayoutStrategy.FULL);
    assertThat(recommendation.getStats().isCyclic()).isTrue();
  }

  @Test
  public void strategyIdsAreTheWireIds() {
    assertThat(LayoutStrategy.fromId("elk-lanes")).isEqualTo(LayoutStrategy.LANES);
    assertThat(LayoutStrategy.COLLABORATION.getId()).isEqualTo("elk-collaboration");
  }
}
