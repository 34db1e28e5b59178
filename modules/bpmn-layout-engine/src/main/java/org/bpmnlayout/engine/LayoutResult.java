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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;
import org.bpmnlayout.strategy.LayoutStrategy;

/**
 * What a layout changed: a delta per changed shape, the new waypoints per changed edge, the
 * strategy used and the diagnostics.
 */
public class LayoutResult {

  protected String diagramId;
  protected LayoutStrategy strategy;
  protected Map<String, ShapeDelta> shapeDeltas = new LinkedHashMap<String, ShapeDelta>();
  protected Map<String, List<Point>> edgeWaypoints = new LinkedHashMap<String, List<Point>>();
  protected LayoutDiagnostics diagnostics;

  public LayoutResult(String diagramId, LayoutStrategy strategy, LayoutDiagnostics diagnostics) {
    this.diagramId = diagramId;
    this.strategy = strategy;
    this.diagnostics = diagnostics;
  }

  /**
   * Collects the differences between the diagram before and after a layout.
   */
  public static LayoutResult compare(Diagram before, Diagram after, LayoutStrategy strategy, LayoutDiagnostics diagnostics) {
    LayoutResult result = new LayoutResult(after.getId(), strategy, diagnostics);
    for (Shape shape : after.getPlane()) {
      Bounds previous = before.getBounds(shape.getElementId());
      if (previous == null || !sameBounds(previous, shape.getBounds())) {
        result.shapeDeltas.put(shape.getElementId(), new ShapeDelta(shape.getElementId(), previous, shape.getBounds()));
      }
    }
    for (Edge edge : after.getEdges()) {
      Edge previous = before.getEdge(edge.getId());
      if (previous == null || !previous.getWaypoints().equals(edge.getWaypoints())) {
        result.edgeWaypoints.put(edge.getId(), new ArrayList<Point>(edge.getWaypoints()));
      }
    }
    return result;
  }

  protected static boolean sameBounds(Bounds a, Bounds b) {
    return a.getX() == b.getX() && a.getY() == b.getY() && a.getWidth() == b.getWidth() && a.getHeight() == b.getHeight();
  }

  public String getDiagramId() {
    return diagramId;
  }

  /**
   * @return the strategy used, or {@code null} for a dry run
   */
  public LayoutStrategy getStrategy() {
    return strategy;
  }

  public Map<String, ShapeDelta> getShapeDeltas() {
    return Collections.unmodifiableMap(shapeDeltas);
  }

  public Map<String, List<Point>> getEdgeWaypoints() {
    return Collections.unmodifiableMap(edgeWaypoints);
  }

  public LayoutDiagnostics getDiagnostics() {
    return diagnostics;
  }

  public boolean isDryRun() {
    return strategy == null;
  }

  @Override
  public String toString() {
    return "LayoutResult[" + diagramId + ", strategy=" + strategy + ", shapes=" + shapeDeltas.size() + ", edges=" + edgeWaypoints.size() + "]";
  }
}
