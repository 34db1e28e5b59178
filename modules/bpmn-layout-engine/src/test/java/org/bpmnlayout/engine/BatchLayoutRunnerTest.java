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

package org.bpmnlayout.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bpmnlayout.DiagramFixtures.flow;
import static org.bpmnlayout.DiagramFixtures.task;

import java.util.Arrays;

import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BatchLayoutRunnerTest {

  private DiagramRegistry registry;
  private BatchLayoutRunner runner;

  @BeforeEach
  public void registerDiagrams() {
    registry = new DiagramRegistry();
    registry.register(twoTasks("orders"));
    registry.register(twoTasks("invoices"));
    runner = new BatchLayoutRunner(registry);
  }

  @Test
  public void appliesAllSteps() {
    BatchResult result = runner.run(Arrays.asList(
        BatchStep.move("orders", "a", 100, 300),
        BatchStep.resize("invoices", "b", 150, 90)), true);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getExecutedSteps()).isEqualTo(2);
    assertThat(result.getTouchedDiagramIds()).containsExactly("orders", "invoices");
    assertThat(bounds("orders", "a").getY()).isEqualTo(300);
    assertThat(bounds("invoices", "b").getWidth()).isEqualTo(150);
  }

  @Test
  public void stopOnErrorRollsBackEveryTouchedDiagram() {
    BatchResult result = runner.run(Arrays.asList(
        BatchStep.move("orders", "a", 100, 300),
        BatchStep.move("invoices", "a", 100, 500),
        BatchStep.move("orders", "ghost", 0, 0),
        BatchStep.move("orders", "b", 900, 900)), true);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.isRolledBack()).isTrue();
    assertThat(result.getFailedStep()).isEqualTo(2);
    assertThat(result.getExecutedSteps()).isEqualTo(2);
    assertThat(result.getErrors()).hasSize(1);
    assertThat(bounds("orders", "a").getY()).isEqualTo(100);
    assertThat(bounds("invoices", "a").getY()).isEqualTo(100);
    assertThat(bounds("orders", "b").getX()).isEqualTo(300);
    assertThat(registry.get("orders").getState().isPinned("a")).isFalse();
  }

  @Test
  public void continuesPastFailuresWhenAsked() {
    BatchResult result = runner.run(Arrays.asList(
        BatchStep.move("orders", "ghost", 0, 0),
        BatchStep.move("orders", "b", 300, 300)), false);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.isRolledBack()).isFalse();
    assertThat(result.getFailedStep()).isEqualTo(-1);
    assertThat(result.getExecutedSteps()).isEqualTo(1);
    assertThat(bounds("orders", "b").getY()).isEqualTo(300);
  }

  @Test
  public void unknownDiagramIsRejectedBeforeAnyStep() {
    assertThatThrownBy(() -> runner.run(Arrays.asList(
        BatchStep.move("orders", "a", 100, 300),
        BatchStep.move("ghost", "a", 0, 0)), true))
        .isInstanceOf(InvalidLayoutRequestException.class);

    assertThat(bounds("orders", "a").getY()).isEqualTo(100);
  }

  @Test
  public void finalLayoutRunsOncePerTouchedDiagram() {
    BatchResult result = runner.run(Arrays.asList(
        BatchStep.move("orders", "a", 100, 300),
        BatchStep.move("orders", "b", 300, 300)), true, new LayoutOptions());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getLayouts()).containsOnlyKeys("orders");
    assertThat(registry.get("orders").getState().getPinnedIds()).isEmpty();
  }

  private Diagram twoTasks(String id) {
    Diagram diagram = new Diagram(id);
    task(diagram, "a", 100, 100);
    task(diagram, "b", 300, 100);
    flow(diagram, "ab", "a", "b");
    return diagram;
  }

  private Bounds bounds(String diagramId, String elementId) {
    return registry.get(diagramId).getDiagram().getBounds(elementId);
  }
}
