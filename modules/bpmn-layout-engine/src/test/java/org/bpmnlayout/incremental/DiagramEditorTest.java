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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bpmnlayout.DiagramFixtures.flow;
import static org.bpmnlayout.DiagramFixtures.task;

import java.util.Arrays;
import java.util.List;

import org.bpmnlayout.DiagramFixtures;
import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.routing.ConnectionRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DiagramEditorTest {

  private static final List<Point> ROUTED = Arrays.asList(new Point(0, 0), new Point(0, 10));

  private Diagram diagram;
  private DiagramLayoutState state;
  private DiagramEditor editor;

  @BeforeEach
  public void createDiagram() {
    diagram = new Diagram("edit");
    task(diagram, "a", 100, 100);
    task(diagram, "b", 300, 100);
    diagram.addNode(new FlowNode("timer", ElementKind.BOUNDARY_EVENT).setAttachedToId("a"));
    diagram.setBounds("timer", 132, 162, 36, 36);
    flow(diagram, "ab", "a", "b", new Point(200, 140), new Point(300, 140));
    state = new DiagramLayoutState();
    editor = new DiagramEditor(diagram, state, new ConnectionRouter() {
      @Override
      public List<Point> route(Diagram diagram, Edge edge) {
        return ROUTED;
      }
    });
  }

  @Test
  public void moveCarriesBoundaryEventsAndPins() {
    editor.moveElement("a", 100, 300);

    assertThat(diagram.getBounds("a").getY()).isEqualTo(300);
    assertThat(diagram.getBounds("timer").getY()).isEqualTo(362);
    assertThat(state.isPinned("a")).isTrue();
    assertThat(diagram.getEdge("ab").getWaypoints()).isEqualTo(ROUTED);
  }

  @Test
  public void moveWithoutDeltaStillPins() {
    editor.moveElement("b", 300, 100);

    assertThat(state.isPinned("b")).isTrue();
    assertThat(diagram.getBounds("b").getX()).isEqualTo(300);
  }

  @Test
  public void resizePinsAndReroutes() {
    editor.resizeElement("b", 120, 90);

    assertThat(diagram.getBounds("b").getWidth()).isEqualTo(120);
    assertThat(diagram.getBounds("b").getHeight()).isEqualTo(90);
    assertThat(state.isPinned("b")).isTrue();
    assertThat(diagram.getEdge("ab").getWaypoints()).isEqualTo(ROUTED);
  }

  @Test
  public void rejectsNonPositiveSize() {
    assertThatThrownBy(() -> editor.resizeElement("b", 0, 90)).isInstanceOf(InvalidLayoutRequestException.class);
    assertThat(diagram.getBounds("b").getWidth()).isEqualTo(100);
    assertThat(state.isPinned("b")).isFalse();
  }

  @Test
  public void rejectsUnknownElement() {
    assertThatThrownBy(() -> editor.moveElement("ghost", 0, 0))
        .isInstanceOf(InvalidLayoutRequestException.class)
        .hasMessageContaining("'ghost'");
  }

  @Test
  public void moveToLaneCentersWithoutPinning() {
    Diagram lanes = DiagramFixtures.twoLanePool("lanes");
    lanes.setBounds("task1", 300, 135, 100, 80);
    DiagramLayoutState laneState = new DiagramLayoutState();

    new DiagramEditor(lanes, laneState, editorRouter()).moveToLane("task1", "lane2");

    assertThat(lanes.getNode("task1").getLaneId()).isEqualTo("lane2");
    assertThat(lanes.getBounds("task1").getCenterY()).isEqualTo(325);
    assertThat(laneState.isPinned("task1")).isFalse();
  }

  @Test
  public void moveToLaneRejectsNonLanes() {
    Diagram lanes = DiagramFixtures.twoLanePool("lanes");

    assertThatThrownBy(() -> new DiagramEditor(lanes, new DiagramLayoutState(), editorRouter()).moveToLane("task1", "pool"))
        .isInstanceOf(InvalidLayoutRequestException.class);
    assertThat(lanes.getNode("task1").getLaneId()).isEqualTo("lane1");
  }

  private ConnectionRouter editorRouter() {
    return editor.router;
  }
}
