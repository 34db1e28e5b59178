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
import static org.bpmnlayout.DiagramFixtures.node;
import static org.bpmnlayout.DiagramFixtures.task;

import java.util.Arrays;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.Point;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LabelPlacementPassTest {

  private final LayoutSettings settings = new LayoutSettings();
  private Diagram diagram;

  @BeforeEach
  public void createDiagram() {
    diagram = new Diagram("labels");
    node(diagram, "start", ElementKind.START_EVENT, 100, 122);
  }

  @Test
  public void prefersTheTopOfAnEvent() {
    run();

    Bounds label = diagram.getShape("start").getLabel();
    assertThat(label.getX()).isEqualTo(73);
    assertThat(label.getY()).isEqualTo(92);
    assertThat(label.getWidth()).isEqualTo(settings.getLabelWidth());
  }

  @Test
  public void avoidsCandidatesCrossedByConnections() {
    node(diagram, "up", ElementKind.TASK);
    flow(diagram, "north", "start", "up", new Point(118, 122), new Point(118, 0));

    run();

    Bounds label = diagram.getShape("start").getLabel();
    assertThat(label.getY()).isEqualTo(168);
  }

  @Test
  public void keepsTheSizeOfAnExistingLabel() {
    diagram.getShape("start").setLabel(new Bounds(0, 0, 40, 14));

    run();

    Bounds label = diagram.getShape("start").getLabel();
    assertThat(label.getWidth()).isEqualTo(40);
    assertThat(label.getHeight()).isEqualTo(14);
    assertThat(label.getCenterX()).isEqualTo(118);
  }

  @Test
  public void tasksHaveNoExternalLabel() {
    task(diagram, "review", 300, 100);

    run();

    assertThat(diagram.getShape("review").getLabel()).isNull();
  }

  @Test
  public void placesNamedFlowLabelAboveTheRoute() {
    task(diagram, "left", 300, 100);
    task(diagram, "right", 500, 100);
    flow(diagram, "approve", "left", "right", new Point(400, 140), new Point(500, 140)).setName("approved");

    run();

    Bounds label = diagram.getEdge("approve").getLabel();
    assertThat(label.getX()).isEqualTo(400);
    assertThat(label.getY()).isEqualTo(115);
  }

  @Test
  public void anchorsLabelOnTheVerticalPartOfAnLShapedRoute() {
    Point anchor = LabelPlacementPass.flowLabelAnchor(
        Arrays.asList(new Point(0, 0), new Point(100, 0), new Point(100, 100)), settings);

    assertThat(anchor).isEqualTo(new Point(100, 50));
  }

  private void run() {
    new LabelPlacementPass().apply(new LayoutContext(diagram, settings, null));
  }
}
