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
import static org.bpmnlayout.DiagramFixtures.association;
import static org.bpmnlayout.DiagramFixtures.node;
import static org.bpmnlayout.DiagramFixtures.task;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.ElementKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArtifactPlacementPassTest {

  private Diagram diagram;

  @BeforeEach
  public void createTask() {
    diagram = new Diagram("artifacts");
    task(diagram, "review", 300, 200);
  }

  @Test
  public void annotationGoesAboveItsElement() {
    node(diagram, "note", ElementKind.TEXT_ANNOTATION, 0, 0);
    association(diagram, "a1", "note", "review");

    run();

    Bounds note = diagram.getBounds("note");
    assertThat(note.getCenterX()).isEqualTo(350);
    assertThat(note.getBottom()).isEqualTo(200 - 80);
  }

  @Test
  public void dataStoreGoesBelowItsElement() {
    node(diagram, "ledger", ElementKind.DATA_STORE, 0, 0);
    diagram.addEdge(new Edge("write", EdgeKind.DATA_ASSOCIATION, "review", "ledger"));

    run();

    Bounds ledger = diagram.getBounds("ledger");
    assertThat(ledger.getY()).isEqualTo(280 + 80);
    assertThat(ledger.getX()).isEqualTo(332);
  }

  @Test
  public void unlinkedAnnotationIsLinedUpAboveTheFlow() {
    node(diagram, "loose", ElementKind.TEXT_ANNOTATION, 1000, 1000);

    run();

    Bounds loose = diagram.getBounds("loose");
    assertThat(loose.getX()).isEqualTo(300);
    assertThat(loose.getBottom()).isEqualTo(120);
  }

  @Test
  public void overlappingArtifactIsShiftedRight() {
    task(diagram, "archive", 300, 50);
    node(diagram, "note", ElementKind.TEXT_ANNOTATION, 0, 0);
    association(diagram, "a1", "note", "review");

    run();

    Bounds note = diagram.getBounds("note");
    assertThat(note.intersects(diagram.getBounds("archive"))).isFalse();
    assertThat(note.getX()).isEqualTo(400 + 20);
  }

  private void run() {
    new ArtifactPlacementPass().apply(new LayoutContext(diagram, new LayoutSettings(), null));
  }
}
