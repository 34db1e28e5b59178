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

import static org.assertj.core.api.Assertions.assertThat;
import static org.bpmnlayout.DiagramFixtures.flow;
import static org.bpmnlayout.DiagramFixtures.task;

import java.util.Arrays;
import java.util.Collections;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.pass.LayoutContext;
import org.bpmnlayout.routing.ManhattanConnectionRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class NeighborEdgeRebuildPassTest {

  private final LayoutSettings settings = new LayoutSettings();
  private Diagram diagram;
  private LayoutContext context;

  @BeforeEach
  public void createDiagram() {
    diagram = new Diagram("neighbors");
    task(diagram, "left", 100, 100);
    task(diagram, "right", 300, 100);
    context = new LayoutContext(diagram, settings, new ManhattanConnectionRouter(settings));
  }

  @Test
  public void forwardNeighborOnTheSameRowIsStraight() {
    flow(diagram, "forward", "left", "right");
    context.setScope(Collections.singleton("right"));

    new NeighborEdgeRebuildPass().apply(context);

    assertThat(diagram.getEdge("forward").getWaypoints()).containsExactly(new Point(200, 140), new Point(300, 140));
  }

  @Test
  public void backwardNeighborGetsALoopback() {
    flow(diagram, "back", "right", "left");
    context.setScope(Collections.singleton("right"));

    new NeighborEdgeRebuildPass().apply(context);

    assertThat(diagram.getEdge("back").getWaypoints()).hasSize(6);
    assertThat(diagram.getEdge("back").getWaypoints().get(2).getY()).isEqualTo(210);
  }

  @Test
  public void edgesInsideTheScopeAreNotTouched() {
    flow(diagram, "inner", "left", "right", new Point(1, 1), new Point(2, 1));
    context.setScope(Arrays.asList("left", "right"));

    new NeighborEdgeRebuildPass().apply(context);

    assertThat(diagram.getEdge("inner").getWaypoints()).containsExactly(new Point(1, 1), new Point(2, 1));
  }

  @Test
  public void unscopedLayoutIsLeftToTheRoutingPass() {
    flow(diagram, "forward", "left", "right", new Point(1, 1), new Point(2, 1));

    new NeighborEdgeRebuildPass().apply(context);

    assertThat(diagram.getEdge("forward").getWaypoints()).containsExactly(new Point(1, 1), new Point(2, 1));
  }

  @Test
  public void forwardMeansTargetCenterNotLeftOfSourceCenter() {
    Bounds source = new Bounds(100, 100, 100, 80);

    assertThat(NeighborEdgeRebuildPass.isForward(source, new Bounds(100, 300, 100, 80))).isTrue();
    assertThat(NeighborEdgeRebuildPass.isForward(source, new Bounds(99, 300, 100, 80))).isFalse();
  }
}
