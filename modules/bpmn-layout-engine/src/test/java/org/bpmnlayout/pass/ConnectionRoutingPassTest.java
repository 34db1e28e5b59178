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
import static org.bpmnlayout.DiagramFixtures.flow;
import static org.bpmnlayout.DiagramFixtures.messageFlow;
import static org.bpmnlayout.DiagramFixtures.task;

import java.util.Arrays;
import java.util.List;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.routing.ConnectionRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ConnectionRoutingPassTest {

  private static final List<Point> FIXED = Arrays.asList(new Point(1, 1), new Point(2, 1));

  private final LayoutSettings settings = new LayoutSettings();
  private Diagram diagram;

  @BeforeEach
  public void createDiagram() {
    diagram = new Diagram("routing");
    task(diagram, "left", 100, 100);
    task(diagram, "right", 300, 100);
  }

  @Test
  public void routesThroughTheRouterOfTheContext() {
    flow(diagram, "forward", "left", "right");

    new ConnectionRoutingPass().apply(new LayoutContext(diagram, settings, fixedRouter()));

    assertThat(diagram.getEdge("forward").getWaypoints()).isEqualTo(FIXED);
  }

  @Test
  public void failingRouterFallsBackToTemplateRoute() {
    flow(diagram, "forward", "left", "right");
    ConnectionRouter failing = new ConnectionRouter() {
      @Override
      public List<Point> route(Diagram diagram, Edge edge) {
        throw new IllegalStateException("no route");
      }
    };

    new ConnectionRoutingPass().apply(new LayoutContext(diagram, settings, failing));

    assertThat(diagram.getEdge("forward").getWaypoints()).containsExactly(new Point(200, 140), new Point(300, 140));
  }

  @Test
  public void backwardFlowGetsLoopbackBelowTheContent() {
    flow(diagram, "back", "right", "left");

    new ConnectionRoutingPass().apply(new LayoutContext(diagram, settings, fixedRouter()));

    assertThat(diagram.getEdge("back").getWaypoints()).containsExactly(
        new Point(400, 140), new Point(415, 140), new Point(415, 210),
        new Point(85, 210), new Point(85, 140), new Point(100, 140));
  }

  @Test
  public void leavesMessageFlowsAlone() {
    Edge message = messageFlow(diagram, "message", "left", "right");
    message.setWaypoints(Arrays.asList(new Point(5, 5), new Point(5, 50)));

    new ConnectionRoutingPass().apply(new LayoutContext(diagram, settings, fixedRouter()));

    assertThat(message.getWaypoints()).containsExactly(new Point(5, 5), new Point(5, 50));
  }

  @Test
  public void scopedRoutingSkipsEdgesLeavingTheScope() {
    task(diagram, "outside", 500, 100);
    flow(diagram, "inner", "left", "right");
    flow(diagram, "leaving", "right", "outside");
    LayoutContext context = new LayoutContext(diagram, settings, fixedRouter());
    context.setScope(Arrays.asList("left", "right"));

    new ConnectionRoutingPass().apply(context);

    assertThat(diagram.getEdge("inner").getWaypoints()).isEqualTo(FIXED);
    assertThat(diagram.getEdge("leaving").getWaypoints()).isEmpty();
  }

  private ConnectionRouter fixedRouter() {
    return new ConnectionRouter() {
      @Override
      public List<Point> route(Diagram diagram, Edge edge) {
        return FIXED;
      }
    };
  }
}
