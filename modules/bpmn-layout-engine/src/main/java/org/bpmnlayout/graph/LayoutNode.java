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

/**
 * Node of the hierarchical layout graph handed to a {@link LayeredLayoutAlgorithm}.
 * Coordinates are relative to the parent node's top-left corner.
 */
public class LayoutNode {

  protected String id;
  protected double x;
  protected double y;
  protected double width;
  protected double height;
  protected boolean compound;
  protected int padding;
  protected List<LayoutNode> children = new ArrayList<LayoutNode>();
  protected List<LayoutEdge> edges = new ArrayList<LayoutEdge>();

  public LayoutNode(String id, double width, double height) {
    this.id = id;
    this.width = width;
    this.height = height;
  }

  public static LayoutNode compound(String id, double width, double height, int padding) {
    LayoutNode node = new LayoutNode(id, width, height);
    node.compound = true;
    node.padding = padding;
    return node;
  }

  public LayoutNode addChild(LayoutNode child) {
    children.add(child);
    return child;
  }

  public LayoutEdge addEdge(LayoutEdge edge) {
    edges.add(edge);
    return edge;
  }

  /**
   * Depth-first search for a node with the given id in this subtree.
   */
  public LayoutNode find(String nodeId) {
    if (id.equals(nodeId)) {
      return this;
    }
    for (LayoutNode child : children) {
      LayoutNode found = child.find(nodeId);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  public String getId() {
    return id;
  }

  public double getX() {
    return x;
  }

  public void setX(double x) {
    this.x = x;
  }

  public double getY() {
    return y;
  }

  public void setY(double y) {
    this.y = y;
  }

  public double getWidth() {
    return width;
  }

  public void setWidth(double width) {
    this.width = width;
  }

  public double getHeight() {
    return height;
  }

  public void setHeight(double height) {
    this.height = height;
  }

  public boolean isCompound() {
    return compound;
  }

  public int getPadding() {
    return padding;
  }

  public List<LayoutNode> getChildren() {
    return children;
  }

  public List<LayoutEdge> getEdges() {
    return edges;
  }

  @Override
  public String toString() {
    return "LayoutNode[" + id + " (" + x + ", " + y + ") " + width + "x" + height + "]";
  }
}
