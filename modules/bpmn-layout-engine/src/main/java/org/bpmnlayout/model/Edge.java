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

package org.bpmnlayout.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence flow, message flow or (data) association with its routed waypoints.
 */
public class Edge {

  protected String id;
  protected EdgeKind kind;
  protected String sourceId;
  protected String targetId;
  protected String name;
  protected List<Point> waypoints = new ArrayList<Point>();
  protected Bounds label;

  public Edge(String id, EdgeKind kind, String sourceId, String targetId) {
    this.id = id;
    this.kind = kind;
    this.sourceId = sourceId;
    this.targetId = targetId;
  }

  public Edge copy() {
    Edge copy = new Edge(id, kind, sourceId, targetId);
    copy.name = name;
    copy.waypoints.addAll(waypoints);
    copy.label = label != null ? label.copy() : null;
    return copy;
  }

  public boolean hasName() {
    return name != null && name.trim().length() > 0;
  }

  public String getId() {
    return id;
  }

  public EdgeKind getKind() {
    return kind;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public String getName() {
    return name;
  }

  public Edge setName(String name) {
    this.name = name;
    return this;
  }

  public List<Point> getWaypoints() {
    return waypoints;
  }

  public void setWaypoints(List<Point> waypoints) {
    this.waypoints = new ArrayList<Point>(waypoints);
  }

  public Bounds getLabel() {
    return label;
  }

  public void setLabel(Bounds label) {
    this.label = label;
  }

  @Override
  public String toString() {
    return kind + "[" + id + ": " + sourceId + " -> " + targetId + "]";
  }
}
