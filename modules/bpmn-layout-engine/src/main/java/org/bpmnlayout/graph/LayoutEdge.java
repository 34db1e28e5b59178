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

package org.bpmnlayout.graph;

import java.util.ArrayList;
import java.util.List;

import org.bpmnlayout.model.Point;

/**
 * Edge of the layout graph. Proxy edges stand in for flows leaving a boundary event and
 * connect the event's host instead, so the host and the exception path stay together.
 */
public class LayoutEdge {

  protected String id;
  protected String edgeId;
  protected String sourceId;
  protected String targetId;
  protected boolean proxy;
  protected List<Point> bendPoints = new ArrayList<Point>();

  public LayoutEdge(String id, String edgeId, String sourceId, String targetId, boolean proxy) {
    this.id = id;
    this.edgeId = edgeId;
    this.sourceId = sourceId;
    this.targetId = targetId;
    this.proxy = proxy;
  }

  public String getId() {
    return id;
  }

  public String getEdgeId() {
    return edgeId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public boolean isProxy() {
    return proxy;
  }

  /**
   * Bend points computed by the algorithm, relative to the node owning this edge.
   */
  public List<Point> getBendPoints() {
    return bendPoints;
  }

  public void setBendPoints(List<Point> bendPoints) {
    this.bendPoints = new ArrayList<Point>(bendPoints);
  }
}
