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
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.bpmnlayout.LayoutAlgorithmException;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a {@link Diagram} into the hierarchical layout graph: pools and expanded
 * subprocesses become compound nodes, every visible flow node a leaf with its current size.
 * <p>
 * Boundary events and artifacts are left out: boundary events are re-attached to their host
 * afterwards and their outgoing flows are represented by proxy edges leaving the host.
 * Message flows are left out as well, they are routed by the collaboration passes.
 */
public class LayoutGraphBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutGraphBuilder.class);

  public static final String ROOT_ID = "__root__";

  protected LayoutSettings settings;

  protected Diagram diagram;
  protected Map<String, LayoutNode> generatedNodes;
  protected Map<String, LayoutNode> nodeParent;
  protected Set<String> visitedContainers;

  public LayoutGraphBuilder(LayoutSettings settings) {
    this.settings = settings;
  }

  /**
   * Builds the layout graph of the whole diagram, or of the subtree of {@code scopeId} when given.
   */
  public LayoutNode build(Diagram diagram, String scopeId) {
    this.diagram = diagram;
    generatedNodes = new HashMap<String, LayoutNode>();
    nodeParent = new HashMap<String, LayoutNode>();
    visitedContainers = new HashSet<String>();

    LayoutNode root = LayoutNode.compound(ROOT_ID, 0, 0, 0);
    if (scopeId != null) {
      FlowNode scopeNode = diagram.getNode(scopeId);
      if (scopeNode != null) {
        handleFlowNode(root, scopeNode);
      } else {
        handleContainer(root, diagram.getContainer(scopeId));
      }
    } else {
      for (Container participant : diagram.getParticipants()) {
        handleContainer(root, participant);
      }
      handleTopLevel(root);
    }

    handleSequenceFlows(root);
    LOGGER.debug("Built layout graph for diagram {} with {} node(s)", diagram.getId(), generatedNodes.size());
    return root;
  }

  /**
   * Builds a flat graph of the given flow nodes and the sequence flows between them.
   */
  public LayoutNode buildSubset(Diagram diagram, Collection<String> nodeIds) {
    this.diagram = diagram;
    generatedNodes = new HashMap<String, LayoutNode>();
    nodeParent = new HashMap<String, LayoutNode>();
    visitedContainers = new HashSet<String>();

    LayoutNode root = LayoutNode.compound(ROOT_ID, 0, 0, 0);
    for (String nodeId : nodeIds) {
      FlowNode node = diagram.getNode(nodeId);
      if (node != null && isLayoutable(node)) {
        addLeaf(root, node);
      }
    }
    handleSequenceFlows(root);
    return root;
  }

  // Element handling

  protected void handleTopLevel(LayoutNode root) {
    for (FlowNode node : diagram.getNodes()) {
      if (node.getParentId() == null && !generatedNodes.containsKey(node.getId())) {
        handleFlowNode(root, node);
      }
    }
  }

  protected void handleContainer(LayoutNode parent, Container container) {
    if (!visitedContainers.add(container.getId())) {
      throw new LayoutAlgorithmException("Could not build layout graph: container '" + container.getId() + "' is nested in itself");
    }
    Bounds bounds = diagram.getBounds(container.getId());
    int padding = container.isParticipant() ? settings.getParticipantPadding() : settings.getSubProcessPadding();
    LayoutNode compound = LayoutNode.compound(container.getId(),
        bounds != null ? bounds.getWidth() : settings.getDefaultWidth(container.getKind()),
        bounds != null ? bounds.getHeight() : settings.getDefaultHeight(container.getKind()),
        padding);
    register(parent, compound);

    for (String childId : container.getChildIds()) {
      FlowNode child = diagram.getNode(childId);
      if (child != null && !generatedNodes.containsKey(childId)) {
        handleFlowNode(compound, child);
      }
    }
  }

  protected void handleFlowNode(LayoutNode parent, FlowNode node) {
    if (!isLayoutable(node)) {
      return;
    }
    Container container = diagram.getContainer(node.getId());
    if (container != null) {
      handleContainer(parent, container);
    } else {
      addLeaf(parent, node);
    }
  }

  protected void addLeaf(LayoutNode parent, FlowNode node) {
    Bounds bounds = diagram.getBounds(node.getId());
    double width = bounds != null && bounds.getWidth() > 0 ? bounds.getWidth() : settings.getDefaultWidth(node.getKind());
    double height = bounds != null && bounds.getHeight() > 0 ? bounds.getHeight() : settings.getDefaultHeight(node.getKind());
    register(parent, new LayoutNode(node.getId(), width, height));
  }

  protected boolean isLayoutable(FlowNode node) {
    return node.getKind().isFlowNode() && !node.isBoundaryEvent() && !diagram.isHidden(node.getId());
  }

  protected void register(LayoutNode parent, LayoutNode child) {
    if (generatedNodes.containsKey(child.getId())) {
      throw new LayoutAlgorithmException("Could not build layout graph: element '" + child.getId() + "' appears twice");
    }
    parent.addChild(child);
    generatedNodes.put(child.getId(), child);
    nodeParent.put(child.getId(), parent);
  }

  // Edge handling

  /**
   * Emits one layout edge per connected pair of nodes. Parallel flows, including flows that only
   * become parallel once proxied to a boundary event's host, collapse into the first of them;
   * the layered algorithm cannot rank several edges between the same two vertices.
   */
  protected void handleSequenceFlows(LayoutNode root) {
    Set<String> connectedPairs = new HashSet<String>();
    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() != EdgeKind.SEQUENCE_FLOW) {
        continue;
      }
      String sourceId = edge.getSourceId();
      boolean proxy = false;
      FlowNode source = diagram.getNode(sourceId);
      if (source != null && source.isBoundaryEvent()) {
        // Hold the exception path together with the host of the boundary event
        sourceId = source.getAttachedToId();
        proxy = true;
      }
      LayoutNode sourceNode = sourceId != null ? generatedNodes.get(sourceId) : null;
      LayoutNode targetNode = generatedNodes.get(edge.getTargetId());
      if (sourceNode == null || targetNode == null || sourceNode == targetNode) {
        continue;
      }
      if (!connectedPairs.add(sourceNode.getId() + "\n" + targetNode.getId())) {
        LOGGER.debug("Flow {} runs parallel to an earlier flow from {} to {}, not added to the layout graph",
            edge.getId(), sourceNode.getId(), targetNode.getId());
        continue;
      }
      LayoutNode owner = lowestCommonAncestor(root, sourceNode, targetNode);
      String layoutEdgeId = proxy ? "proxy-" + edge.getId() : edge.getId();
      owner.addEdge(new LayoutEdge(layoutEdgeId, edge.getId(), sourceNode.getId(), targetNode.getId(), proxy));
    }
  }

  protected LayoutNode lowestCommonAncestor(LayoutNode root, LayoutNode source, LayoutNode target) {
    List<LayoutNode> sourcePath = ancestors(source);
    Set<LayoutNode> targetPath = new HashSet<LayoutNode>(ancestors(target));
    for (LayoutNode candidate : sourcePath) {
      if (targetPath.contains(candidate) && candidate != source && candidate != target) {
        return candidate;
      }
    }
    return root;
  }

  // Nearest first, including the node itself
  protected List<LayoutNode> ancestors(LayoutNode node) {
    List<LayoutNode> path = new ArrayList<LayoutNode>();
    LayoutNode current = node;
    while (current != null) {
      path.add(current);
      current = nodeParent.get(current.getId());
    }
    return path;
  }
}
