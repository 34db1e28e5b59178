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

import org.bpmnlayout.history.CommandHistory;
import org.bpmnlayout.history.DiagramCommand;
import org.bpmnlayout.history.SnapshotCommandHistory;
import org.bpmnlayout.incremental.DiagramEditor;
import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.model.Diagram;

/**
 * One diagram together with its layout state and command history. Every operation that changes
 * the diagram goes through the history, so it can be undone and rolled back by batches.
 * Operations on one session are serialized; different sessions are independent.
 */
public class DiagramSession {

  protected final Diagram diagram;
  protected final DiagramLayoutState state;
  protected final CommandHistory history;
  protected final LayoutEngine engine;

  public DiagramSession(Diagram diagram, LayoutEngine engine) {
    this.diagram = diagram;
    this.engine = engine;
    this.state = new DiagramLayoutState();
    this.history = new SnapshotCommandHistory(diagram, state);
  }

  public synchronized LayoutResult layout(final LayoutOptions options) {
    if (options.isDryRun()) {
      return engine.layout(diagram, state, options);
    }
    return history.execute(new DiagramCommand<LayoutResult>() {

      @Override
      public String getName() {
        return "layout";
      }

      @Override
      public LayoutResult execute(Diagram target, DiagramLayoutState targetState) {
        return engine.layout(target, targetState, options);
      }
    });
  }

  public synchronized void moveElement(final String elementId, final double x, final double y) {
    history.execute(new DiagramCommand<Void>() {

      @Override
      public String getName() {
        return "move " + elementId;
      }

      @Override
      public Void execute(Diagram target, DiagramLayoutState targetState) {
        editor(target, targetState).moveElement(elementId, x, y);
        return null;
      }
    });
  }

  public synchronized void resizeElement(final String elementId, final double width, final double height) {
    history.execute(new DiagramCommand<Void>() {

      @Override
      public String getName() {
        return "resize " + elementId;
      }

      @Override
      public Void execute(Diagram target, DiagramLayoutState targetState) {
        editor(target, targetState).resizeElement(elementId, width, height);
        return null;
      }
    });
  }

  public synchronized void moveToLane(final String nodeId, final String laneId) {
    history.execute(new DiagramCommand<Void>() {

      @Override
      public String getName() {
        return "move " + nodeId + " to lane " + laneId;
      }

      @Override
      public Void execute(Diagram target, DiagramLayoutState targetState) {
        editor(target, targetState).moveToLane(nodeId, laneId);
        return null;
      }
    });
  }

  public synchronized <T> T execute(DiagramCommand<T> command) {
    return history.execute(command);
  }

  public synchronized int position() {
    return history.position();
  }

  public synchronized void rewindTo(int position) {
    history.rewindTo(position);
  }

  public synchronized boolean undo() {
    return history.undo();
  }

  protected DiagramEditor editor(Diagram target, DiagramLayoutState targetState) {
    return new DiagramEditor(target, targetState, engine.getRouter());
  }

  public String getId() {
    return diagram.getId();
  }

  public Diagram getDiagram() {
    return diagram;
  }

  public DiagramLayoutState getState() {
    return state;
  }
}
