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

package org.bpmnlayout.repair;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bpmnlayout.DiagramFixtures.pool;
import static org.bpmnlayout.DiagramFixtures.task;

import org.bpmnlayout.DiagramFixtures;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;
import org.junit.jupiter.api.Test;

public class DiRepairTest {

  private final LayoutSettings settings = new LayoutSettings();

  @Test
  public void synthesizesShapesAndPlaceholderRoutes() {
    Diagram diagram = DiagramFixtures.chain("bare", 1);

    DiRepairReport report = new DiRepair(settings).repair(diagram);

    assertThat(report.getShapesSynthesized()).isEqualTo(3);
    assertThat(report.getEdgesRepaired()).isEqualTo(2);
    assertThat(report.getDuplicatesRemoved()).isZero();

    Bounds start = diagram.getBounds("start");
    Bounds task = diagram.getBounds("task1");
    Bounds end = diagram.getBounds("end");
    assertThat(start.getX()).isEqualTo(settings.getOriginX());
    assertThat(start.getWidth()).isEqualTo(settings.getEventSize());
    assertThat(task.getX()).isEqualTo(start.getRight() + settings.getNodeSpacing());
    assertThat(task.getWidth()).isEqualTo(settings.getTaskWidth());
    assertThat(task.getHeight()).isEqualTo(settings.getTaskHeight());
    assertThat(end.getX()).isEqualTo(task.getRight() + settings.getNodeSpacing());
    assertThat(start.getCenterY()).isEqualTo(task.getCenterY());

    assertThat(diagram.getEdge("f1").getWaypoints()).containsExactly(
        new Point(start.getRight(), 120), new Point(task.getX(), 120));
  }

  @Test
  public void lastDuplicateEntryWins() {
    Diagram diagram = new Diagram("duplicates");
    diagram.addNode(new FlowNode("a", ElementKind.TASK));
    diagram.addShape(new Shape("a", new Bounds(0, 0, 100, 80)));
    diagram.addShape(new Shape("a", new Bounds(500, 500, 100, 80)));

    DiRepairReport report = new DiRepair(settings).repair(diagram);

    assertThat(report.getDuplicatesRemoved()).isEqualTo(1);
    assertThat(diagram.getPlane()).hasSize(1);
    assertThat(diagram.getBounds("a").getX()).isEqualTo(500);
  }

  @Test
  public void fixesShapesWithoutSize() {
    Diagram diagram = new Diagram("sizes");
    diagram.addNode(new FlowNode("a", ElementKind.USER_TASK));
    diagram.setBounds("a", 100, 100, 0, -5);

    DiRepairReport report = new DiRepair(settings).repair(diagram);

    assertThat(report.getShapesSynthesized()).isEqualTo(1);
    assertThat(diagram.getBounds("a").getX()).isEqualTo(100);
    assertThat(diagram.getBounds("a").getWidth()).isEqualTo(settings.getTaskWidth());
  }

  @Test
  public void tilesMissingLanesInTheirPool() {
    Diagram diagram = new Diagram("lanes");
    pool(diagram, "pool", 100, 100, 800, 300);
    diagram.addContainer(new Container("lane1", ElementKind.LANE).setParentId("pool"));
    diagram.addContainer(new Container("lane2", ElementKind.LANE).setParentId("pool"));
    diagram.addNode(new FlowNode("work", ElementKind.TASK).setParentId("pool").setLaneId("lane2"));

    new DiRepair(settings).repair(diagram);

    Bounds lane1 = diagram.getBounds("lane1");
    Bounds lane2 = diagram.getBounds("lane2");
    assertThat(lane1.getX()).isEqualTo(100 + settings.getPoolLabelBand());
    assertThat(lane1.getY()).isEqualTo(100);
    assertThat(lane1.getHeight()).isEqualTo(150);
    assertThat(lane2.getY()).isEqualTo(250);
    assertThat(lane2.getRight()).isEqualTo(900);

    Bounds work = diagram.getBounds("work");
    assertThat(work.getX()).isEqualTo(100 + settings.getParticipantPadding());
    assertThat(work.getCenterY()).isEqualTo(lane2.getCenterY());
  }

  @Test
  public void placesMissingBoundaryEventOnTheHostBorder() {
    Diagram diagram = new Diagram("boundary");
    task(diagram, "book", 100, 100);
    diagram.addNode(new FlowNode("cancel", ElementKind.BOUNDARY_EVENT).setAttachedToId("book"));

    new DiRepair(settings).repair(diagram);

    Bounds event = diagram.getBounds("cancel");
    assertThat(event.getCenterX()).isEqualTo(150);
    assertThat(event.getCenterY()).isEqualTo(180);
  }

  @Test
  public void intactDiagramIsReportedEmpty() {
    Diagram diagram = new Diagram("intact");
    task(diagram, "a", 100, 100);

    assertThat(new DiRepair(settings).repair(diagram).isEmpty()).isTrue();
  }
}
