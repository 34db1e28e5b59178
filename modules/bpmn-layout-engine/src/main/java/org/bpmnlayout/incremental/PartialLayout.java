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

package org.bpmnlayout.incremental;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.graph.LayeredLayoutAlgorithm;
import org.bpmnlayout.graph.LayoutGraphBuilder;
import org.bpmnlayout.graph.LayoutNode;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.pass.ConnectionRoutingPass;
import org.bpmnlayout.pass.LayoutContext;
import org.bpmnlayout.pass.PostLayoutPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layout restricted to part of a diagram: either an explicit set of flow nodes, or the subtree
 * of a pool or expanded subprocess. Pinned elements are left untouched, elements outside the
 * scope keep their geometry, and connections leaving the scope are rebuilt.
 */
public class PartialLayout {

  private static final Logger LOGGER = LoggerFactory.getLogger(PartialLayout.class);

  protected LayoutSettings settings;
  protected LayeredLayoutAlgorithm algorithm;
  protected LayoutGraphBuilder graphBuilder;

  public PartialLayout(LayoutSettings settings, LayeredLayoutAlgorithm algorithm) {
    this.settings = settings;
    this.algorithm = algorithm;
    this.graphBuilder = new LayoutGraphBuilder(settings);
  }

  /**
   * Checks that every requested id exists. Nothing is changed when the request is rejected.
   */
  public static void validateSubset(Diagram diagram, Collection<String> elementIds) {
    if (elementIds == null || elementIds.isEmpty()) {
      throw new InvalidLayoutRequestException("Could not lay out subset of diagram '" + diagram.getId() + "': no element ids given");
    }
    List<String> unknown = new ArrayList<String>();
    for (String elementId : elementIds) {
      if (!diagram.containsElement(elementId)) {
        unknown.add(elementId);
      }
    }
    if (!unknown.isEmpty()) {
      throw new InvalidLayoutRequestException("Could not lay out subset of diagram '" + diagram.getId() + "': elements " + unknown + " do not exist");
    }
  }

  /**
   * Checks that the scope names a pool or an expanded subprocess.
   */
  public static void validateScope(Diagram diagram, String scopeElementId) {
    Container container = diagram.getContainer(scopeElementId);
    if (container == null || container.isLane()) {
      throw new InvalidLayoutRequestException("Could not scope layout of diagram '" + diagram.getId() + "': element '"
          + scopeElementId + "' is not a pool or an expanded subprocess");
    }
  }

  /**
   * Lays out the given flow nodes as a flat graph placed at their previous top-left corner.
   */
  public void layoutSubset(LayoutContext context, Collection<String> elementIds) {
    Diagram diagram = context.getDiagram();
    validateSubset(diagram, elementIds);

    List<String> pinnedSkipped = new ArrayList<String>();
    Set<String> movable = new LinkedHashSet<String>();
    for (String elementId : elementIds) {
      FlowNode node = diagram.getNode(elementId);
      if (context.isPinned(elementId)) {
        pinnedSkipped.add(elementId);
      } else if (node != null && node.getKind().isFlowNode() && !node.isBoundaryEvent() && !diagram.isHidden(elementId)) {
        movable.add(elementId);
      } else {
        LOGGER.debug("Element {} is not a flow node and is left out of the subset layout", elementId);
      }
    }
    context.setPinnedSkipped(pinnedSkipped);
    if (movable.isEmpty()) {
      LOGGER.debug("Nothing to lay out in subset of diagram {}", diagram.getId());
      return;
    }

    LayoutNode graph = graphBuilder.buildSubset(diagram, movable);
    algorithm.layout(graph);

    double previousX = Double.MAX_VALUE;
    double previousY = Double.MAX_VALUE;
    for (String nodeId : movable) {
      Bounds bounds = diagram.getBounds(nodeId);
      if (bounds != null) {
        previousX = Math.min(previousX, bounds.getX());
        previousY = Math.min(previousY, bounds.getY());
      }
    }
    if (previousX == Double.MAX_VALUE) {
      previousX = settings.getOriginX();
      previousY = settings.getOriginY();
    }
    double layoutX = Double.MAX_VALUE;
    double layoutY = Double.MAX_VALUE;
    for (LayoutNode child : graph.getChildren()) {
      layoutX = Math.min(layoutX, child.getX());
      layoutY = Math.min(layoutY, child.getY());
    }
    context.setLayoutGraph(graph);
    context.setOrigin(previousX - layoutX, previousY - layoutY);
    context.setScope(withBoundaryEvents(diagram, movable));
    run(context);
  }

  /**
   * Lays out the content of a pool or expanded subprocess, keeping the container in place.
   */
  public void layoutScope(LayoutContext context, String scopeElementId) {
    Diagram diagram = context.getDiagram();
    validateScope(diagram, scopeElementId);

    LayoutNode graph = graphBuilder.build(diagram, scopeElementId);
    algorithm.layout(graph);

    Bounds current = diagram.getBounds(scopeElementId);
    LayoutNode scopeNode = graph.find(scopeElementId);
    if (current != null && scopeNode != null) {
      context.setOrigin(current.getX() - scopeNode.getX(), current.getY() - scopeNode.getY());
    }
    Set<String> scope = new LinkedHashSet<String>(diagram.getRigidGroup(scopeElementId));
    context.setLayoutGraph(graph);
    context.setScope(scope);
    run(context);
  }

  protected void run(LayoutContext context) {
    PostLayoutPipeline.standard()
        .insertAfter(ConnectionRoutingPass.class, new NeighborEdgeRebuildPass())
        .run(context);
  }

  protected Set<String> withBoundaryEvents(Diagram diagram, Set<String> nodeIds) {
    Set<String> scope = new LinkedHashSet<String>(nodeIds);
    for (String nodeId : nodeIds) {
      for (FlowNode event : diagram.getBoundaryEvents(nodeId)) {
        scope.add(event.getId());
      }
    }
    return scope;
  }
}
