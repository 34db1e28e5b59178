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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places trivially shaped diagrams (a chain or a single split/merge) without the layered
 * algorithm: nodes are layered by longest path, the happy path forms the first row and each
 * remaining branch gets a row of its own below it.
 */
public class DeterministicLayout {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicLayout.class);

  protected LayoutSettings settings;

  public DeterministicLayout(LayoutSettings settings) {
    this.settings = settings;
  }

  public void layout(Diagram diagram) {
    Map<String, FlowNode> nodes = new LinkedHashMap<String, FlowNode>();
    for (FlowNode node : diagram.getNodes()) {
      if (node.getKind().isFlowNode() && !node.isBoundaryEvent() && !diagram.isHidden(node.getId())) {
        nodes.put(node.getId(), node);
      }
    }
    if (nodes.isEmpty()) {
      return;
    }

    Map<String, Integer> layers = assignLayers(diagram, nodes);
    Map<String, Integer> rows = assignRows(diagram, nodes, layers);

    int layerCount = 0;
    double rowHeight = 0;
    for (FlowNode node : nodes.values()) {
      layerCount = Math.max(layerCount, layers.get(node.getId()) + 1);
      rowHeight = Math.max(rowHeight, height(diagram, node));
    }

    double[] layerWidth = new double[layerCount];
    ElementKind[] layerKind = new ElementKind[layerCount];
    for (FlowNode node : nodes.values()) {
      int layer = layers.get(node.getId());
      double width = width(diagram, node);
      if (layerKind[layer] == null || width > layerWidth[layer]) {
        layerWidth[layer] = width;
        layerKind[layer] = node.getKind();
      }
    }

    double originX = settings.getOriginX();
    double originY = settings.getOriginY();
    List<Container> participants = diagram.getParticipants();
    if (participants.size() == 1 && diagram.getBounds(participants.get(0).getId()) != null) {
      Bounds pool = diagram.getBounds(participants.get(0).getId());
      originX = pool.getX() + settings.getPoolLabelBand() + settings.getParticipantPadding();
      originY = pool.getY() + settings.getParticipantPadding();
    }

    double[] layerX = new double[layerCount];
    layerX[0] = originX;
    for (int layer = 1; layer < layerCount; layer++) {
      layerX[layer] = layerX[layer - 1] + layerWidth[layer - 1] + settings.getGap(layerKind[layer - 1], layerKind[layer]);
    }

    double rowPitch = rowHeight + settings.getNodeSpacing();
    for (FlowNode node : nodes.values()) {
      int layer = layers.get(node.getId());
      double width = width(diagram, node);
      double height = height(diagram, node);
      double centerY = originY + rowHeight / 2 + rows.get(node.getId()) * rowPitch;
      diagram.setBounds(node.getId(),
          Math.round(layerX[layer] + (layerWidth[layer] - width) / 2),
          Math.round(centerY - height / 2),
          width, height);
    }
    LOGGER.debug("Deterministic layout placed {} node(s) in {} layer(s)", nodes.size(), layerCount);
  }

  // Longest path layering; nodes left over by a cycle are appended after the last layer
  protected Map<String, Integer> assignLayers(Diagram diagram, Map<String, FlowNode> nodes) {
    Map<String, Integer> inDegree = new HashMap<String, Integer>();
    for (String nodeId : nodes.keySet()) {
      int count = 0;
      for (Edge edge : diagram.getIncomingSequenceFlows(nodeId)) {
        if (nodes.containsKey(edge.getSourceId())) {
          count++;
        }
      }
      inDegree.put(nodeId, count);
    }

    Map<String, Integer> layers = new HashMap<String, Integer>();
    ArrayDeque<String> queue = new ArrayDeque<String>();
    for (String nodeId : nodes.keySet()) {
      if (inDegree.get(nodeId) == 0) {
        queue.add(nodeId);
        layers.put(nodeId, 0);
      }
    }
    while (!queue.isEmpty()) {
      String nodeId = queue.poll();
      for (Edge edge : diagram.getOutgoingSequenceFlows(nodeId)) {
        String targetId = edge.getTargetId();
        if (!nodes.containsKey(targetId)) {
          continue;
        }
        Integer current = layers.get(targetId);
        int candidate = layers.get(nodeId) + 1;
        if (current == null || candidate > current) {
          layers.put(targetId, candidate);
        }
        int remaining = inDegree.get(targetId) - 1;
        inDegree.put(targetId, remaining);
        if (remaining == 0) {
          queue.add(targetId);
        }
      }
    }

    int next = 0;
    for (Integer layer : layers.values()) {
      next = Math.max(next, layer + 1);
    }
    for (String nodeId : nodes.keySet()) {
      Integer layer = layers.get(nodeId);
      if (layer == null || inDegree.get(nodeId) > 0) {
        layers.put(nodeId, next++);
      }
    }
    return layers;
  }

  protected Map<String, Integer> assignRows(Diagram diagram, Map<String, FlowNode> nodes, Map<String, Integer> layers) {
    Map<String, Integer> rows = new HashMap<String, Integer>();
    HappyPath happyPath = HappyPath.detect(diagram);
    for (String nodeId : happyPath.getNodeIds()) {
      if (nodes.containsKey(nodeId)) {
        rows.put(nodeId, 0);
      }
    }

    int nextRow = 1;
    for (FlowNode split : nodes.values()) {
      List<Edge> outgoing = diagram.getOutgoingSequenceFlows(split.getId());
      if (outgoing.size() < 2) {
        continue;
      }
      for (Edge branch : outgoing) {
        if (happyPath.containsEdge(branch.getId())) {
          continue;
        }
        boolean assigned = false;
        String current = branch.getTargetId();
        while (current != null && nodes.containsKey(current) && !rows.containsKey(current)) {
          rows.put(current, nextRow);
          assigned = true;
          List<Edge> next = diagram.getOutgoingSequenceFlows(current);
          current = next.isEmpty() ? null : next.get(0).getTargetId();
        }
        if (assigned) {
          nextRow++;
        }
      }
    }

    // Unreached nodes and cells claimed twice (several start events) move to fresh rows
    Set<String> occupied = new HashSet<String>();
    List<String> ordered = new ArrayList<String>(nodes.keySet());
    for (String nodeId : ordered) {
      Integer row = rows.get(nodeId);
      if (row == null || !occupied.add(layers.get(nodeId) + ":" + row)) {
        row = nextRow++;
        rows.put(nodeId, row);
        occupied.add(layers.get(nodeId) + ":" + row);
      }
    }
    return rows;
  }

  protected double width(Diagram diagram, FlowNode node) {
    Bounds bounds = diagram.getBounds(node.getId());
    return bounds != null && bounds.getWidth() > 0 ? bounds.getWidth() : settings.getDefaultWidth(node.getKind());
  }

  protected double height(Diagram diagram, FlowNode node) {
    Bounds bounds = diagram.getBounds(node.getId());
    return bounds != null && bounds.getHeight() > 0 ? bounds.getHeight() : settings.getDefaultHeight(node.getKind());
  }
}
