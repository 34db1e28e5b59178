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

import java.util.ArrayList;
import java.util.List;

import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.model.Diagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandHistory} keeping a full copy of the diagram and its layout state before every command.
 */
public class SnapshotCommandHistory implements CommandHistory {

  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotCommandHistory.class);

  protected Diagram diagram;
  protected DiagramLayoutState state;
  protected List<Snapshot> snapshots = new ArrayList<Snapshot>();

  public SnapshotCommandHistory(Diagram diagram, DiagramLayoutState state) {
    this.diagram = diagram;
    this.state = state;
  }

  @Override
  public int position() {
    return snapshots.size();
  }

  @Override
  public <T> T execute(DiagramCommand<T> command) {
    Snapshot before = new Snapshot(diagram.copy(), state.copy());
    T result;
    try {
      result = command.execute(diagram, state);
    } catch (RuntimeException e) {
      LOGGER.debug("Command {} failed on diagram {}, restoring previous state", command.getName(), diagram.getId());
      restore(before);
      throw e;
    }
    snapshots.add(before);
    return result;
  }

  @Override
  public void rewindTo(int position) {
    if (position < 0 || position > snapshots.size()) {
      throw new IllegalArgumentException("Could not rewind diagram '" + diagram.getId() + "': position " + position
          + " is outside 0.." + snapshots.size());
    }
    if (position == snapshots.size()) {
      return;
    }
    restore(snapshots.get(position));
    while (snapshots.size() > position) {
      snapshots.remove(snapshots.size() - 1);
    }
    LOGGER.debug("Rewound diagram {} to position {}", diagram.getId(), position);
  }

  @Override
  public boolean undo() {
    if (snapshots.isEmpty()) {
      return false;
    }
    rewindTo(snapshots.size() - 1);
    return true;
  }

  protected void restore(Snapshot snapshot) {
    diagram.restore(snapshot.diagram);
    state.restore(snapshot.state);
  }

  protected static class Snapshot {

    protected final Diagram diagram;
    protected final DiagramLayoutState state;

    protected Snapshot(Diagram diagram, DiagramLayoutState state) {
      this.diagram = diagram;
      this.state = state;
    }
  }
}
