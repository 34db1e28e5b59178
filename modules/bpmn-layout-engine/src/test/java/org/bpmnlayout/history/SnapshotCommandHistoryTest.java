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

package org.bpmnlayout.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bpmnlayout.DiagramFixtures.task;

import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.model.Diagram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SnapshotCommandHistoryTest {

  private Diagram diagram;
  private DiagramLayoutState state;
  private SnapshotCommandHistory history;

  @BeforeEach
  public void createHistory() {
    diagram = new Diagram("history");
    task(diagram, "a", 100, 100);
    state = new DiagramLayoutState();
    history = new SnapshotCommandHistory(diagram, state);
  }

  @Test
  public void executeReturnsTheCommandResult() {
    String result = history.execute(move(200));

    assertThat(result).isEqualTo("moved to 200");
    assertThat(history.position()).isEqualTo(1);
    assertThat(diagram.getBounds("a").getX()).isEqualTo(200);
    assertThat(state.isPinned("a")).isTrue();
  }

  @Test
  public void undoRestoresGeometryAndPins() {
    history.execute(move(200));

    assertThat(history.undo()).isTrue();

    assertThat(diagram.getBounds("a").getX()).isEqualTo(100);
    assertThat(state.isPinned("a")).isFalse();
    assertThat(history.position()).isZero();
    assertThat(history.undo()).isFalse();
  }

  @Test
  public void rewindsSeveralCommands() {
    history.execute(move(200));
    history.execute(move(300));
    history.execute(move(400));

    history.rewindTo(1);

    assertThat(diagram.getBounds("a").getX()).isEqualTo(200);
    assertThat(history.position()).isEqualTo(1);
  }

  @Test
  public void failingCommandLeavesNoTrace() {
    history.execute(move(200));

    assertThatThrownBy(() -> history.execute(new DiagramCommand<Void>() {
      @Override
      public String getName() {
        return "broken";
      }

      @Override
      public Void execute(Diagram diagram, DiagramLayoutState state) {
        diagram.setBounds("a", 999, 999, 100, 80);
        throw new IllegalStateException("broken");
      }
    })).isInstanceOf(IllegalStateException.class);

    assertThat(diagram.getBounds("a").getX()).isEqualTo(200);
    assertThat(history.position()).isEqualTo(1);
  }

  @Test
  public void rejectsPositionsOutsideTheHistory() {
    history.execute(move(200));

    assertThatThrownBy(() -> history.rewindTo(2)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> history.rewindTo(-1)).isInstanceOf(IllegalArgumentException.class);
  }

  private DiagramCommand<String> move(final double x) {
    return new DiagramCommand<String>() {
      @Override
      public String getName() {
        return "move";
      }

      @Override
      public String execute(Diagram diagram, DiagramLayoutState state) {
        diagram.setBounds("a", x, 100, 100, 80);
        state.pin("a");
        return "moved to " + Math.round(x);
      }
    };
  }
}
