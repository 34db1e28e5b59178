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

/**
 * One edit or layout of a batch, applied to the session of the diagram it names.
 */
public abstract class BatchStep {

  protected String diagramId;

  protected BatchStep(String diagramId) {
    this.diagramId = diagramId;
  }

  public String getDiagramId() {
    return diagramId;
  }

  public abstract void apply(DiagramSession session);

  public abstract String getDescription();

  @Override
  public String toString() {
    return getDescription() + " on " + diagramId;
  }

  public static BatchStep move(String diagramId, final String elementId, final double x, final double y) {
    return new BatchStep(diagramId) {

      @Override
      public void apply(DiagramSession session) {
        session.moveElement(elementId, x, y);
      }

      @Override
      public String getDescription() {
        return "move " + elementId + " to (" + x + ", " + y + ")";
      }
    };
  }

  public static BatchStep resize(String diagramId, final String elementId, final double width, final double height) {
    return new BatchStep(diagramId) {

      @Override
      public void apply(DiagramSession session) {
        session.resizeElement(elementId, width, height);
      }

      @Override
      public String getDescription() {
        return "resize " + elementId + " to " + width + "x" + height;
      }
    };
  }

  public static BatchStep moveToLane(String diagramId, final String nodeId, final String laneId) {
    return new BatchStep(diagramId) {

      @Override
      public void apply(DiagramSession session) {
        session.moveToLane(nodeId, laneId);
      }

      @Override
      public String getDescription() {
        return "move " + nodeId + " to lane " + laneId;
      }
    };
  }

  public static BatchStep layout(String diagramId, final LayoutOptions options) {
    return new BatchStep(diagramId) {

      @Override
      public void apply(DiagramSession session) {
        session.layout(options);
      }

      @Override
      public String getDescription() {
        return "layout " + options;
      }
    };
  }
}
