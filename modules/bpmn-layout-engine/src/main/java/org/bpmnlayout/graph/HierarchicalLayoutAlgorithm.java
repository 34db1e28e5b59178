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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.swing.SwingConstants;

import org.bpmnlayout.LayoutAlgorithmException;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mxgraph.layout.hierarchical.mxHierarchicalLayout;
import com.mxgraph.model.mxGeometry;
import com.mxgraph.model.mxIGraphModel;
import com.mxgraph.util.mxConstants;
import com.mxgraph.util.mxPoint;
import com.mxgraph.view.mxGraph;

/**
 * {@link LayeredLayoutAlgorithm} backed by the JGraphX hierarchical layout, flowing left to right.
 * <p>
 * Compound nodes are laid out bottom-up: the content of every compound is laid out first and the
 * compound resized around it, then the compound takes part in the layout of its own parent.
 */
public class HierarchicalLayoutAlgorithm implements LayeredLayoutAlgorithm {

  private static final Logger LOGGER = LoggerFactory.getLogger(HierarchicalLayoutAlgorithm.class);

  protected LayoutSettings settings;

  protected mxGraph graph;
  protected Map<String, Object> generatedVertices;
  protected Map<String, Object> generatedEdges;

  public HierarchicalLayoutAlgorithm(LayoutSettings settings) {
    this.settings = settings;
  }

  @Override
  public void layout(LayoutNode root) {
    validate(root);
    try {
      execute(root);
    } catch (LayoutAlgorithmException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LayoutAlgorithmException("Could not lay out graph: " + e.getMessage(), e);
    }
  }

  protected void execute(LayoutNode root) {
    graph = new mxGraph();
    configureStyles();
    generatedVertices = new HashMap<String, Object>();
    generatedEdges = new HashMap<String, Object>();

    Object cellParent = graph.getDefaultParent();
    graph.getModel().beginUpdate();
    try {
      // All cells are created before any edge, so that both ends of each edge exist
      for (LayoutNode child : root.getChildren()) {
        createVertex(cellParent, child);
      }
      createEdges(root, cellParent);

      CustomLayout layout = new CustomLayout(graph, SwingConstants.WEST);
      layout.setIntraCellSpacing(settings.getNodeSpacing());
      layout.setInterRankCellSpacing(settings.getLayerSpacing());
      layout.setInterHierarchySpacing(settings.getNodeSpacing());
      layout.setResizeParent(true);
      layout.setMoveParent(false);
      layout.setFineTuning(true);
      layout.setDisableEdgeStyle(false);
      layout.setUseBoundingBox(false);

      for (LayoutNode child : root.getChildren()) {
        layoutCompound(layout, child);
      }
      layout.setParentBorder(0);
      layout.execute(cellParent);
    } finally {
      graph.getModel().endUpdate();
    }

    readBack(root);
    LOGGER.debug("Hierarchical layout computed for {} vertices and {} edges", generatedVertices.size(), generatedEdges.size());
  }

  // Labels are never rendered, filling the cell avoids font metrics during view validation
  protected void configureStyles() {
    graph.getStylesheet().getDefaultVertexStyle().put(mxConstants.STYLE_OVERFLOW, "fill");
    graph.getStylesheet().getDefaultEdgeStyle().put(mxConstants.STYLE_OVERFLOW, "fill");
    graph.getStylesheet().getDefaultEdgeStyle().put(mxConstants.STYLE_NOLABEL, "1");
  }

  protected void createVertex(Object parentCell, LayoutNode node) {
    Object vertex = graph.insertVertex(parentCell, node.getId(), null, 0, 0, node.getWidth(), node.getHeight(), "");
    generatedVertices.put(node.getId(), vertex);
    for (LayoutNode child : node.getChildren()) {
      createVertex(vertex, child);
    }
  }

  protected void createEdges(LayoutNode node, Object cell) {
    for (LayoutEdge edge : node.getEdges()) {
      Object edgeCell = graph.insertEdge(cell, edge.getId(), null,
          generatedVertices.get(edge.getSourceId()), generatedVertices.get(edge.getTargetId()));
      generatedEdges.put(edge.getId(), edgeCell);
    }
    for (LayoutNode child : node.getChildren()) {
      createEdges(child, generatedVertices.get(child.getId()));
    }
  }

  protected void layoutCompound(CustomLayout layout, LayoutNode node) {
    if (!node.isCompound()) {
      return;
    }
    for (LayoutNode child : node.getChildren()) {
      layoutCompound(layout, child);
    }
    if (node.getChildren().isEmpty()) {
      return;
    }

    layout.setParentBorder(node.getPadding());
    layout.execute(generatedVertices.get(node.getId()));
  }

  protected void readBack(LayoutNode node) {
    mxIGraphModel model = graph.getModel();
    for (LayoutNode child : node.getChildren()) {
      mxGeometry geometry = model.getGeometry(generatedVertices.get(child.getId()));
      child.setX(geometry.getX());
      child.setY(geometry.getY());
      if (child.isCompound()) {
        child.setWidth(geometry.getWidth());
        child.setHeight(geometry.getHeight());
      }
      readBack(child);
    }
    for (LayoutEdge edge : node.getEdges()) {
      mxGeometry geometry = model.getGeometry(generatedEdges.get(edge.getId()));
      List<Point> bendPoints = new ArrayList<Point>();
      if (geometry != null && geometry.getPoints() != null) {
        for (mxPoint point : geometry.getPoints()) {
          bendPoints.add(new Point(point.getX(), point.getY()));
        }
      }
      edge.setBendPoints(bendPoints);
    }
  }

  /**
   * Rejects graphs JGraphX would silently mangle: duplicate ids, non-positive leaf sizes and
   * edges whose ends are not inside the node owning the edge.
   */
  protected void validate(LayoutNode root) {
    Map<String, LayoutNode> nodes = new HashMap<String, LayoutNode>();
    collect(root, nodes);
    validateEdges(root, nodes);
  }

  protected void collect(LayoutNode node, Map<String, LayoutNode> nodes) {
    for (LayoutNode child : node.getChildren()) {
      if (nodes.put(child.getId(), child) != null) {
        throw new LayoutAlgorithmException("Could not lay out graph: node '" + child.getId() + "' is defined more than once");
      }
      if (!child.isCompound() && (child.getWidth() <= 0 || child.getHeight() <= 0)) {
        throw new LayoutAlgorithmException("Could not lay out graph: node '" + child.getId() + "' has no size");
      }
      collect(child, nodes);
    }
  }

  protected void validateEdges(LayoutNode node, Map<String, LayoutNode> nodes) {
    for (LayoutEdge edge : node.getEdges()) {
      if (!nodes.containsKey(edge.getSourceId()) || !nodes.containsKey(edge.getTargetId())) {
        throw new LayoutAlgorithmException("Could not lay out graph: edge '" + edge.getId() + "' references an unknown node");
      }
      if (node.find(edge.getSourceId()) == null || node.find(edge.getTargetId()) == null) {
        throw new LayoutAlgorithmException("Could not lay out graph: edge '" + edge.getId() + "' is not nested in the node owning it");
      }
    }
    for (LayoutNode child : node.getChildren()) {
      validateEdges(child, nodes);
    }
  }

  // The default hierarchical layout follows edges into the ancestors of the laid out parent,
  // which breaks the bottom-up layout of compound cells.
  static class CustomLayout extends mxHierarchicalLayout {

    public CustomLayout(mxGraph graph, int orientation) {
      super(graph, orientation);
      this.traverseAncestors = false;
    }
  }
}
