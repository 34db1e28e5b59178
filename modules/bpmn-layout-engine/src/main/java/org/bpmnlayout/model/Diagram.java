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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory snapshot of one BPMN diagram: flow nodes, containers and edges addressed by id,
 * plus the diagram interchange plane holding their geometry.
 * <p>
 * Elements never reference each other directly; parent, lane, host and adjacency relations
 * are expressed through ids and resolved through this class.
 */
public class Diagram {

  protected String id;
  protected Map<String, FlowNode> nodes = new LinkedHashMap<String, FlowNode>();
  protected Map<String, Container> containers = new LinkedHashMap<String, Container>();
  protected Map<String, Edge> edges = new LinkedHashMap<String, Edge>();

  // DI plane in definition order, duplicates allowed until repaired
  protected List<Shape> plane = new ArrayList<Shape>();
  protected Map<String, Shape> shapeIndex = new HashMap<String, Shape>();

  protected Map<String, List<String>> outgoing;
  protected Map<String, List<String>> incoming;

  public Diagram(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  // Semantic elements

  public FlowNode addNode(FlowNode node) {
    if (nodes.containsKey(node.getId())) {
      throw new IllegalArgumentException("Could not add node: element '" + node.getId() + "' already exists");
    }
    nodes.put(node.getId(), node);
    registerChild(node.getParentId(), node.getId());
    registerChild(node.getLaneId(), node.getId());
    return node;
  }

  public Container addContainer(Container container) {
    if (containers.containsKey(container.getId())) {
      throw new IllegalArgumentException("Could not add container: element '" + container.getId() + "' already exists");
    }
    containers.put(container.getId(), container);
    registerChild(container.getParentId(), container.getId());

    // Adopt elements that were added before their container
    if (container.isLane()) {
      for (FlowNode node : nodes.values()) {
        if (container.getId().equals(node.getLaneId())) {
          registerChild(container.getId(), node.getId());
        }
      }
    } else {
      for (Container other : containers.values()) {
        if (container.getId().equals(other.getParentId())) {
          registerChild(container.getId(), other.getId());
        }
      }
      for (FlowNode node : nodes.values()) {
        if (container.getId().equals(node.getParentId())) {
          registerChild(container.getId(), node.getId());
        }
      }
    }
    return container;
  }

  public Edge addEdge(Edge edge) {
    if (edges.containsKey(edge.getId())) {
      throw new IllegalArgumentException("Could not add edge: element '" + edge.getId() + "' already exists");
    }
    edges.put(edge.getId(), edge);
    outgoing = null;
    incoming = null;
    return edge;
  }

  public void removeContainer(String containerId) {
    Container removed = containers.remove(containerId);
    if (removed != null && removed.getParentId() != null) {
      Container parent = containers.get(removed.getParentId());
      if (parent != null) {
        parent.getChildIds().remove(containerId);
      }
    }
  }

  protected void registerChild(String parentId, String childId) {
    if (parentId == null) {
      return;
    }
    Container parent = containers.get(parentId);
    if (parent != null && !parent.getChildIds().contains(childId)) {
      parent.getChildIds().add(childId);
    }
  }

  /**
   * Moves a node to another lane of the same pool, keeping both lanes' member lists in sync.
   */
  public void assignLane(String nodeId, String laneId) {
    FlowNode node = requireNode(nodeId);
    if (node.getLaneId() != null) {
      Container previous = containers.get(node.getLaneId());
      if (previous != null) {
        previous.getChildIds().remove(nodeId);
      }
    }
    node.setLaneId(laneId);
    registerChild(laneId, nodeId);
  }

  public FlowNode getNode(String id) {
    return nodes.get(id);
  }

  public FlowNode requireNode(String id) {
    FlowNode node = nodes.get(id);
    if (node == null) {
      throw new IllegalArgumentException("Unknown flow node '" + id + "' in diagram '" + this.id + "'");
    }
    return node;
  }

  public Container getContainer(String id) {
    return containers.get(id);
  }

  public Edge getEdge(String id) {
    return edges.get(id);
  }

  public boolean containsElement(String id) {
    return nodes.containsKey(id) || containers.containsKey(id) || edges.containsKey(id);
  }

  public Collection<FlowNode> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public Collection<Container> getContainers() {
    return Collections.unmodifiableCollection(containers.values());
  }

  public Collection<Edge> getEdges() {
    return Collections.unmodifiableCollection(edges.values());
  }

  public List<Container> getParticipants() {
    List<Container> participants = new ArrayList<Container>();
    for (Container container : containers.values()) {
      if (container.isParticipant()) {
        participants.add(container);
      }
    }
    return participants;
  }

  /**
   * Lanes directly below the given pool in declared order. A {@code null} pool id
   * returns the lanes of a process without a pool.
   */
  public List<Container> getLanes(String poolId) {
    List<Container> lanes = new ArrayList<Container>();
    if (poolId != null && containers.containsKey(poolId)) {
      for (String childId : containers.get(poolId).getChildIds()) {
        Container child = containers.get(childId);
        if (child != null && child.isLane()) {
          lanes.add(child);
        }
      }
    } else {
      for (Container container : containers.values()) {
        if (container.isLane() && container.getParentId() == null) {
          lanes.add(container);
        }
      }
    }
    return lanes;
  }

  public List<Container> getAllLanes() {
    List<Container> lanes = new ArrayList<Container>();
    for (Container container : containers.values()) {
      if (container.isLane()) {
        lanes.add(container);
      }
    }
    return lanes;
  }

  public List<FlowNode> getBoundaryEvents(String hostId) {
    List<FlowNode> result = new ArrayList<FlowNode>();
    for (FlowNode node : nodes.values()) {
      if (node.isBoundaryEvent() && hostId.equals(node.getAttachedToId())) {
        result.add(node);
      }
    }
    return result;
  }

  // Hierarchy

  public String getParentOf(String elementId) {
    FlowNode node = nodes.get(elementId);
    if (node != null) {
      return node.getParentId();
    }
    Container container = containers.get(elementId);
    return container != null ? container.getParentId() : null;
  }

  public boolean isDescendantOf(String elementId, String ancestorId) {
    String current = getParentOf(elementId);
    int guard = 0;
    while (current != null && guard++ < 1000) {
      if (current.equals(ancestorId)) {
        return true;
      }
      current = getParentOf(current);
    }
    return false;
  }

  public int getDepth(String containerId) {
    int depth = 0;
    String current = getParentOf(containerId);
    while (current != null && depth < 1000) {
      depth++;
      current = getParentOf(current);
    }
    return depth;
  }

  /**
   * The nearest pool enclosing the element, or {@code null} for elements of a pool-less process.
   */
  public Container getParticipantOf(String elementId) {
    String current = getParentOf(elementId);
    int guard = 0;
    while (current != null && guard++ < 1000) {
      Container container = containers.get(current);
      if (container != null && container.isParticipant()) {
        return container;
      }
      current = getParentOf(current);
    }
    return null;
  }

  /**
   * True when the element sits inside a subprocess that is not expanded (and therefore not drawn).
   */
  public boolean isHidden(String elementId) {
    String current = getParentOf(elementId);
    int guard = 0;
    while (current != null && guard++ < 1000) {
      FlowNode parentNode = nodes.get(current);
      if (parentNode != null && parentNode.getKind().isSubProcess() && !containers.containsKey(current)) {
        return true;
      }
      current = getParentOf(current);
    }
    return false;
  }

  public List<FlowNode> getDescendantNodes(String containerId) {
    List<FlowNode> result = new ArrayList<FlowNode>();
    for (FlowNode node : nodes.values()) {
      if (isDescendantOf(node.getId(), containerId)) {
        result.add(node);
      }
    }
    return result;
  }

  // Adjacency

  public List<String> getOutgoingIds(String nodeId) {
    ensureAdjacency();
    List<String> ids = outgoing.get(nodeId);
    return ids != null ? Collections.unmodifiableList(ids) : Collections.<String>emptyList();
  }

  public List<String> getIncomingIds(String nodeId) {
    ensureAdjacency();
    List<String> ids = incoming.get(nodeId);
    return ids != null ? Collections.unmodifiableList(ids) : Collections.<String>emptyList();
  }

  public List<Edge> getOutgoingSequenceFlows(String nodeId) {
    return resolve(getOutgoingIds(nodeId), EdgeKind.SEQUENCE_FLOW);
  }

  public List<Edge> getIncomingSequenceFlows(String nodeId) {
    return resolve(getIncomingIds(nodeId), EdgeKind.SEQUENCE_FLOW);
  }

  public List<Edge> getConnectedEdges(String nodeId) {
    List<Edge> result = resolve(getOutgoingIds(nodeId), null);
    result.addAll(resolve(getIncomingIds(nodeId), null));
    return result;
  }

  protected List<Edge> resolve(List<String> edgeIds, EdgeKind kind) {
    List<Edge> result = new ArrayList<Edge>();
    for (String edgeId : edgeIds) {
      Edge edge = edges.get(edgeId);
      if (edge != null && (kind == null || edge.getKind() == kind)) {
        result.add(edge);
      }
    }
    return result;
  }

  protected void ensureAdjacency() {
    if (outgoing != null) {
      return;
    }
    outgoing = new HashMap<String, List<String>>();
    incoming = new HashMap<String, List<String>>();
    for (Edge edge : edges.values()) {
      addAdjacency(outgoing, edge.getSourceId(), edge.getId());
      addAdjacency(incoming, edge.getTargetId(), edge.getId());
    }
  }

  protected void addAdjacency(Map<String, List<String>> adjacency, String nodeId, String edgeId) {
    List<String> ids = adjacency.get(nodeId);
    if (ids == null) {
      ids = new ArrayList<String>();
      adjacency.put(nodeId, ids);
    }
    ids.add(edgeId);
  }

  // Diagram interchange

  public List<Shape> getPlane() {
    return Collections.unmodifiableList(plane);
  }

  public void addShape(Shape shape) {
    plane.add(shape);
    shapeIndex.put(shape.getElementId(), shape);
  }

  /**
   * Replaces the plane, e.g. after duplicate removal. The last entry per element wins.
   */
  public void setPlane(List<Shape> shapes) {
    plane = new ArrayList<Shape>(shapes);
    shapeIndex.clear();
    for (Shape shape : plane) {
      shapeIndex.put(shape.getElementId(), shape);
    }
  }

  public Shape getShape(String elementId) {
    return shapeIndex.get(elementId);
  }

  public boolean hasShape(String elementId) {
    return shapeIndex.containsKey(elementId);
  }

  public Bounds getBounds(String elementId) {
    Shape shape = shapeIndex.get(elementId);
    return shape != null ? shape.getBounds() : null;
  }

  public Shape setBounds(String elementId, double x, double y, double width, double height) {
    Shape shape = shapeIndex.get(elementId);
    if (shape == null) {
      shape = new Shape(elementId, new Bounds(x, y, width, height));
      addShape(shape);
    } else {
      shape.getBounds().setLocation(x, y);
      shape.getBounds().setSize(width, height);
    }
    return shape;
  }

  /**
   * Moves a shape and its external label by the given delta.
   */
  public void translateShape(String elementId, double dx, double dy) {
    Shape shape = shapeIndex.get(elementId);
    if (shape == null) {
      return;
    }
    shape.getBounds().translate(dx, dy);
    if (shape.getLabel() != null) {
      shape.getLabel().translate(dx, dy);
    }
  }

  /**
   * The element together with everything drawn on or inside it: attached boundary events and,
   * for containers, all nested nodes and containers.
   */
  public Set<String> getRigidGroup(String elementId) {
    Set<String> group = new LinkedHashSet<String>();
    group.add(elementId);
    if (containers.containsKey(elementId)) {
      for (Container container : containers.values()) {
        if (isDescendantOf(container.getId(), elementId)) {
          group.add(container.getId());
        }
      }
      for (FlowNode node : getDescendantNodes(elementId)) {
        group.add(node.getId());
      }
    }
    for (FlowNode node : nodes.values()) {
      if (node.isBoundaryEvent() && group.contains(node.getAttachedToId())) {
        group.add(node.getId());
      }
    }
    return group;
  }

  /**
   * Moves the rigid group of an element by the given delta.
   */
  public void translateElement(String elementId, double dx, double dy) {
    if (dx == 0 && dy == 0) {
      return;
    }
    for (String id : getRigidGroup(elementId)) {
      translateShape(id, dx, dy);
    }
  }

  public Diagram copy() {
    Diagram copy = new Diagram(id);
    for (FlowNode node : nodes.values()) {
      copy.nodes.put(node.getId(), node.copy());
    }
    for (Container container : containers.values()) {
      copy.containers.put(container.getId(), container.copy());
    }
    for (Edge edge : edges.values()) {
      copy.edges.put(edge.getId(), edge.copy());
    }
    List<Shape> shapes = new ArrayList<Shape>();
    for (Shape shape : plane) {
      shapes.add(shape.copy());
    }
    copy.setPlane(shapes);
    return copy;
  }

  /**
   * Overwrites this diagram's content with the content of the given snapshot.
   */
  public void restore(Diagram snapshot) {
    Diagram source = snapshot.copy();
    nodes = source.nodes;
    containers = source.containers;
    edges = source.edges;
    setPlane(source.plane);
    outgoing = null;
    incoming = null;
  }

  @Override
  public String toString() {
    return "Diagram[" + id + ", nodes=" + nodes.size() + ", containers=" + containers.size() + ", edges=" + edges.size() + "]";
  }
}
