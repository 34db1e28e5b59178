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

package org.bpmnlayout;

import java.util.Arrays;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;

/**
 * Builds small diagrams for tests.
 */
public final class DiagramFixtures {

  private static final LayoutSettings DEFAULTS = new LayoutSettings();

  private DiagramFixtures() {
  }

  public static FlowNode node(Diagram diagram, String id, ElementKind kind) {
    return diagram.addNode(new FlowNode(id, kind).setName(id));
  }

  /**
   * Adds a node with the default size of its kind and its top-left corner at (x, y).
   */
  public static FlowNode node(Diagram diagram, String id, ElementKind kind, double x, double y) {
    FlowNode node = node(diagram, id, kind);
    diagram.setBounds(id, x, y, DEFAULTS.getDefaultWidth(kind), DEFAULTS.getDefaultHeight(kind));
    return node;
  }

  public static FlowNode task(Diagram diagram, String id, double x, double y) {
    return node(diagram, id, ElementKind.TASK, x, y);
  }

  public static Edge flow(Diagram diagram, String id, String sourceId, String targetId) {
    return diagram.addEdge(new Edge(id, EdgeKind.SEQUENCE_FLOW, sourceId, targetId));
  }

  public static Edge flow(Diagram diagram, String id, String sourceId, String targetId, Point... waypoints) {
    Edge edge = flow(diagram, id, sourceId, targetId);
    edge.setWaypoints(Arrays.asList(waypoints));
    return edge;
  }

  public static Edge messageFlow(Diagram diagram, String id, String sourceId, String targetId) {
    return diagram.addEdge(new Edge(id, EdgeKind.MESSAGE_FLOW, sourceId, targetId));
  }

  public static Edge association(Diagram diagram, String id, String sourceId, String targetId) {
    return diagram.addEdge(new Edge(id, EdgeKind.ASSOCIATION, sourceId, targetId));
  }

  public static Container pool(Diagram diagram, String id, double x, double y, double width, double height) {
    Container pool = diagram.addContainer(new Container(id, ElementKind.PARTICIPANT).setName(id));
    diagram.setBounds(id, x, y, width, height);
    return pool;
  }

  public static Container lane(Diagram diagram, String id, String poolId, double x, double y, double width, double height) {
    Container lane = diagram.addContainer(new Container(id, ElementKind.LANE).setName(id).setParentId(poolId));
    diagram.setBounds(id, x, y, width, height);
    return lane;
  }

  /**
   * start, task1..taskN, end connected by flows f1..f(N+1), without any shapes.
   */
  public static Diagram chain(String diagramId, int taskCount) {
    Diagram diagram = new Diagram(diagramId);
    node(diagram, "start", ElementKind.START_EVENT);
    String previous = "start";
    for (int i = 1; i <= taskCount; i++) {
      node(diagram, "task" + i, ElementKind.TASK);
      flow(diagram, "f" + i, previous, "task" + i);
      previous = "task" + i;
    }
    node(diagram, "end", ElementKind.END_EVENT);
    flow(diagram, "f" + (taskCount + 1), previous, "end");
    return diagram;
  }

  /**
   * start, split gateway, branches a and b, merge gateway, end. The split's default flow goes to b.
   */
  public static Diagram splitMerge(String diagramId) {
    Diagram diagram = new Diagram(diagramId);
    node(diagram, "start", ElementKind.START_EVENT);
    node(diagram, "split", ElementKind.EXCLUSIVE_GATEWAY).setDefaultFlowId("toB");
    node(diagram, "a", ElementKind.TASK);
    node(diagram, "b", ElementKind.TASK);
    node(diagram, "merge", ElementKind.EXCLUSIVE_GATEWAY);
    node(diagram, "end", ElementKind.END_EVENT);
    flow(diagram, "toSplit", "start", "split");
    flow(diagram, "toA", "split", "a");
    flow(diagram, "toB", "split", "b");
    flow(diagram, "fromA", "a", "merge");
    flow(diagram, "fromB", "b", "merge");
    flow(diagram, "toEnd", "merge", "end");
    return diagram;
  }

  /**
   * A pool with two lanes; start, task1, task2 and end sit in lane1 of the pool, lane2 is empty.
   */
  public static Diagram twoLanePool(String diagramId) {
    Diagram diagram = new Diagram(diagramId);
    pool(diagram, "pool", 100, 100, 800, 300);
    lane(diagram, "lane1", "pool", 130, 100, 770, 150);
    lane(diagram, "lane2", "pool", 130, 250, 770, 150);
    String[] ids = { "start", "task1", "task2", "end" };
    ElementKind[] kinds = { ElementKind.START_EVENT, ElementKind.TASK, ElementKind.TASK, ElementKind.END_EVENT };
    for (int i = 0; i < ids.length; i++) {
      diagram.addNode(new FlowNode(ids[i], kinds[i]).setName(ids[i]).setParentId("pool").setLaneId("lane1"));
    }
    flow(diagram, "f1", "start", "task1");
    flow(diagram, "f2", "task1", "task2");
    flow(diagram, "f3", "task2", "end");
    return diagram;
  }
}
