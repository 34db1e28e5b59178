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

package org.bpmnlayout.repair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;
import org.bpmnlayout.routing.RouteTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the diagram interchange of a diagram in a state the layout can work with.
 * <ul>
 * <li>duplicate plane entries are removed, the last entry for an element wins</li>
 * <li>visible elements without a shape get one of the default size for their kind, placed inside
 * their parent (lanes are tiled in their pool, boundary events sit on the host border)</li>
 * <li>shapes with a non-positive size get the default size</li>
 * <li>edges with less than two waypoints get a straight placeholder route</li>
 * </ul>
 * Elements inside collapsed subprocesses are not drawn and are skipped.
 */
public class DiRepair {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiRepair.class);

  protected LayoutSettings settings;

  public DiRepair(LayoutSettings settings) {
    this.settings = settings;
  }

  public DiRepairReport repair(Diagram diagram) {
    int duplicates = removeDuplicates(diagram);
    int shapes = synthesizeParticipants(diagram);
    shapes += synthesizeLanes(diagram);
    shapes += synthesizeNodes(diagram);
    shapes += synthesizeBoundaryEvents(diagram);
    shapes += fixSizes(diagram);
    int edges = repairEdges(diagram);

    DiRepairReport report = new DiRepairReport(shapes, edges, duplicates);
    if (!report.isEmpty()) {
      LOGGER.debug("Repaired interchange of diagram {}: {}", diagram.getId(), report);
    }
    return report;
  }

  protected int removeDuplicates(Diagram diagram) {
    Map<String, Shape> lastEntries = new LinkedHashMap<String, Shape>();
    for (Shape shape : diagram.getPlane()) {
      lastEntries.put(shape.getElementId(), shape);
    }
    int removed = diagram.getPlane().size() - lastEntries.size();
    if (removed > 0) {
      diagram.setPlane(new ArrayList<Shape>(lastEntries.values()));
    }
    return removed;
  }

  protected int synthesizeParticipants(Diagram diagram) {
    int count = 0;
    for (Container participant : diagram.getParticipants()) {
      if (diagram.hasShape(participant.getId())) {
        continue;
      }
      double y = contentBottom(diagram);
      y = y > Double.NEGATIVE_INFINITY ? y + settings.getPoolGap() : settings.getOriginY();
      diagram.setBounds(participant.getId(), settings.getOriginX(), y,
          settings.getParticipantWidth(), settings.getParticipantHeight());
      count++;
    }
    return count;
  }

  protected int synthesizeLanes(Diagram diagram) {
    int count = 0;
    for (Container lane : diagram.getAllLanes()) {
      if (diagram.hasShape(lane.getId())) {
        continue;
      }
      Bounds pool = lane.getParentId() != null ? diagram.getBounds(lane.getParentId()) : null;
      if (pool == null) {
        double y = contentBottom(diagram);
        y = y > Double.NEGATIVE_INFINITY ? y + settings.getPoolGap() : settings.getOriginY();
        diagram.setBounds(lane.getId(), settings.getOriginX(), y, settings.getParticipantWidth(), settings.getMinLaneHeight());
      } else {
        List<Container> siblings = diagram.getLanes(lane.getParentId());
        int index = siblings.indexOf(lane);
        double band = pool.getHeight() / siblings.size();
        double labelBand = settings.getPoolLabelBand();
        diagram.setBounds(lane.getId(), pool.getX() + labelBand, pool.getY() + index * band,
            pool.getWidth() - labelBand, band);
      }
      count++;
    }
    return count;
  }

  protected int synthesizeNodes(Diagram diagram) {
    List<FlowNode> missing = new ArrayList<FlowNode>();
    for (FlowNode node : diagram.getNodes()) {
      if (!node.isBoundaryEvent() && !diagram.hasShape(node.getId()) && !diagram.isHidden(node.getId())) {
        missing.add(node);
      }
    }
    final Diagram sorted = diagram;
    Collections.sort(missing, new Comparator<FlowNode>() {
      @Override
      public int compare(FlowNode a, FlowNode b) {
        return Integer.compare(sorted.getDepth(a.getId()), sorted.getDepth(b.getId()));
      }
    });

    for (FlowNode node : missing) {
      double width = settings.getDefaultWidth(node.getKind());
      double height = settings.getDefaultHeight(node.getKind());
      if (node.isExpanded()) {
        width = settings.getSubProcessWidth();
        height = settings.getSubProcessHeight();
      }
      Bounds parent = node.getParentId() != null ? diagram.getBounds(node.getParentId()) : null;
      Bounds lane = node.getLaneId() != null ? diagram.getBounds(node.getLaneId()) : null;

      double x;
      double centerY;
      if (parent != null) {
        double right = rightmostChild(diagram, node.getParentId());
        x = right > Double.NEGATIVE_INFINITY ? right + settings.getNodeSpacing() : parent.getX() + settings.getParticipantPadding();
        centerY = lane != null ? lane.getCenterY() : parent.getCenterY();
      } else {
        double right = rightmostChild(diagram, null);
        x = right > Double.NEGATIVE_INFINITY ? right + settings.getNodeSpacing() : settings.getOriginX();
        centerY = lane != null ? lane.getCenterY() : settings.getOriginY() + settings.getTaskHeight() / 2.0;
      }
      diagram.setBounds(node.getId(), x, Math.round(centerY - height / 2), width, height);
      LOGGER.debug("Synthesized shape for {} of diagram {}", node.getId(), diagram.getId());
    }
    return missing.size();
  }

  protected int synthesizeBoundaryEvents(Diagram diagram) {
    int count = 0;
    for (FlowNode node : diagram.getNodes()) {
      if (!node.isBoundaryEvent() || diagram.hasShape(node.getId()) || diagram.isHidden(node.getId())) {
        continue;
      }
      Bounds host = node.getAttachedToId() != null ? diagram.getBounds(node.getAttachedToId()) : null;
      if (host == null) {
        LOGGER.debug("Boundary event {} has no host shape, leaving it without interchange", node.getId());
        continue;
      }
      List<FlowNode> siblings = diagram.getBoundaryEvents(node.getAttachedToId());
      int index = siblings.indexOf(node);
      double size = settings.getEventSize();
      double centerX = host.getX() + host.getWidth() * (index + 1) / (siblings.size() + 1);
      diagram.setBounds(node.getId(), Math.round(centerX - size / 2), host.getBottom() - size / 2, size, size);
      count++;
    }
    return count;
  }

  protected int fixSizes(Diagram diagram) {
    int count = 0;
    for (Shape shape : diagram.getPlane()) {
      Bounds bounds = shape.getBounds();
      if (bounds.getWidth() > 0 && bounds.getHeight() > 0) {
        continue;
      }
      FlowNode node = diagram.getNode(shape.getElementId());
      Container container = diagram.getContainer(shape.getElementId());
      if (container != null) {
        bounds.setSize(settings.getDefaultWidth(container.getKind()), settings.getDefaultHeight(container.getKind()));
      } else if (node != null) {
        bounds.setSize(settings.getDefaultWidth(node.getKind()), settings.getDefaultHeight(node.getKind()));
      } else {
        continue;
      }
      count++;
    }
    return count;
  }

  protected int repairEdges(Diagram diagram) {
    int count = 0;
    for (Edge edge : diagram.getEdges()) {
      if (edge.getWaypoints().size() >= 2) {
        continue;
      }
      Bounds source = diagram.getBounds(edge.getSourceId());
      Bounds target = diagram.getBounds(edge.getTargetId());
      if (source == null || target == null) {
        LOGGER.debug("Edge {} of diagram {} has an endpoint without shape, not repaired", edge.getId(), diagram.getId());
        continue;
      }
      List<Point> route = RouteTemplates.simple(source, target);
      edge.setWaypoints(route);
      count++;
    }
    return count;
  }

  protected double contentBottom(Diagram diagram) {
    double bottom = Double.NEGATIVE_INFINITY;
    for (Shape shape : diagram.getPlane()) {
      bottom = Math.max(bottom, shape.getBounds().getBottom());
    }
    return bottom;
  }

  protected double rightmostChild(Diagram diagram, String parentId) {
    double right = Double.NEGATIVE_INFINITY;
    for (FlowNode node : diagram.getNodes()) {
      boolean sameParent = parentId == null ? node.getParentId() == null : parentId.equals(node.getParentId());
      if (sameParent && !node.isBoundaryEvent()) {
        Bounds bounds = diagram.getBounds(node.getId());
        if (bounds != null) {
          right = Math.max(right, bounds.getRight());
        }
      }
    }
    return right;
  }
}
