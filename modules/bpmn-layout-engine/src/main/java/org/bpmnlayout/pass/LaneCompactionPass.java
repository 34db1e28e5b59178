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

package org.bpmnlayout.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.config.LaneStrategy;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits containers around their content.
 * <p>
 * Expanded subprocesses grow to contain their children. Lanes are compacted to the height of
 * their content and tiled without gaps, the pool taking the summed height of its lanes. Pools
 * without lanes are expanded to fit their content. Pools are finally stacked vertically in
 * declared order. Scoped layouts only fit the pools in scope and pull the other scoped nodes
 * back into their lanes.
 * <p>
 * The pass also records the lane crossing metrics of the diagram.
 */
public class LaneCompactionPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(LaneCompactionPass.class);

  @Override
  public String getName() {
    return "lane-compaction";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    fitSubProcesses(context);
    for (Container participant : diagram.getParticipants()) {
      List<Container> lanes = diagram.getLanes(participant.getId());
      if (!context.isMovable(participant.getId())) {
        // Pools outside the scope may still grow around moved content
        if (context.isScoped() && context.isPoolExpansion() && lanes.isEmpty() && !context.isPinned(participant.getId())) {
          expandPool(context, participant);
        }
        continue;
      }
      if (!lanes.isEmpty()) {
        compactLanes(context, participant.getId(), lanes);
      } else if (context.isPoolExpansion()) {
        expandPool(context, participant);
      }
    }
    if (context.isScoped()) {
      clampToLanes(context);
    } else {
      List<Container> looseLanes = diagram.getLanes(null);
      if (!looseLanes.isEmpty()) {
        compactLanes(context, null, looseLanes);
      }
      stackParticipants(context);
    }
    context.setLaneCrossingMetrics(LaneCrossingMetrics.compute(diagram));
  }

  // Expanded subprocesses, innermost first

  protected void fitSubProcesses(LayoutContext context) {
    final Diagram diagram = context.getDiagram();
    List<Container> subProcesses = new ArrayList<Container>();
    for (Container container : diagram.getContainers()) {
      if (container.isSubProcess() && diagram.getBounds(container.getId()) != null && context.isMovable(container.getId())) {
        subProcesses.add(container);
      }
    }
    Collections.sort(subProcesses, new Comparator<Container>() {
      @Override
      public int compare(Container a, Container b) {
        return diagram.getDepth(b.getId()) - diagram.getDepth(a.getId());
      }
    });

    int padding = context.getSettings().getSubProcessPadding();
    for (Container subProcess : subProcesses) {
      Bounds content = contentOf(diagram, subProcess.getId());
      if (content == null) {
        continue;
      }
      Bounds bounds = diagram.getBounds(subProcess.getId());
      Bounds required = new Bounds(content.getX() - padding, content.getY() - padding,
          content.getWidth() + 2 * padding, content.getHeight() + 2 * padding);
      if (!bounds.contains(required, 0)) {
        Bounds grown = bounds.union(required);
        bounds.setLocation(grown.getX(), grown.getY());
        bounds.setSize(grown.getWidth(), grown.getHeight());
        LOGGER.debug("Grew subprocess {} to fit its content", subProcess.getId());
      }
    }
  }

  // Lanes

  protected void compactLanes(LayoutContext context, String poolId, List<Container> declaredLanes) {
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();
    List<Container> lanes = context.getLaneStrategy() == LaneStrategy.OPTIMIZE
        ? optimizeOrder(diagram, declaredLanes)
        : declaredLanes;

    Map<String, List<String>> members = collectMembers(diagram, poolId, lanes);
    Bounds pool = poolId != null ? diagram.getBounds(poolId) : null;

    Bounds allContent = null;
    Map<String, Bounds> laneContent = new HashMap<String, Bounds>();
    for (Container lane : lanes) {
      Bounds content = null;
      for (String memberId : members.get(lane.getId())) {
        content = union(content, withBoundaryEvents(diagram, memberId));
      }
      laneContent.put(lane.getId(), content);
      allContent = union(allContent, content);
    }

    double top;
    if (pool != null) {
      top = pool.getY();
    } else if (diagram.getBounds(lanes.get(0).getId()) != null) {
      top = diagram.getBounds(lanes.get(0).getId()).getY();
    } else {
      top = allContent != null ? allContent.getY() - settings.getLanePadding() : settings.getOriginY();
    }

    double bandY = top;
    Map<String, Bounds> bands = new LinkedHashMap<String, Bounds>();
    for (Container lane : lanes) {
      Bounds content = laneContent.get(lane.getId());
      double bandHeight = settings.getMinLaneHeight();
      if (content != null) {
        bandHeight = Math.max(content.getHeight() + 2 * settings.getLanePadding(), settings.getMinLaneHeight());
        double dy = Math.round(bandY + (bandHeight - content.getHeight()) / 2 - content.getY());
        for (String memberId : members.get(lane.getId())) {
          if (context.isMovable(memberId)) {
            diagram.translateElement(memberId, 0, dy);
          }
        }
      }
      bands.put(lane.getId(), new Bounds(0, bandY, 0, bandHeight));
      bandY += bandHeight;
    }

    double left;
    double right;
    if (allContent != null) {
      left = allContent.getX() - settings.getParticipantPadding() - (poolId != null ? settings.getPoolLabelBand() : 0);
      right = allContent.getRight() + settings.getParticipantPadding();
    } else if (pool != null) {
      left = pool.getX();
      right = pool.getRight();
    } else {
      left = settings.getOriginX();
      right = left + settings.getContainerWidth();
    }

    double laneX = left;
    if (poolId != null) {
      diagram.setBounds(poolId, left, top, right - left, bandY - top);
      laneX = left + settings.getPoolLabelBand();
    }
    for (Container lane : lanes) {
      Bounds band = bands.get(lane.getId());
      diagram.setBounds(lane.getId(), laneX, band.getY(), right - laneX, band.getHeight());
    }
    LOGGER.debug("Compacted {} lane(s) of {}", lanes.size(), poolId != null ? poolId : "the process");
  }

  /**
   * Lane members are the top level nodes of each lane. Unassigned nodes of the pool are handled
   * with the lane nearest to them.
   */
  protected Map<String, List<String>> collectMembers(Diagram diagram, String poolId, List<Container> lanes) {
    Map<String, List<String>> members = new LinkedHashMap<String, List<String>>();
    for (Container lane : lanes) {
      members.put(lane.getId(), new ArrayList<String>());
    }
    for (FlowNode node : diagram.getNodes()) {
      if (node.isBoundaryEvent() || diagram.isHidden(node.getId()) || diagram.getBounds(node.getId()) == null
          || diagram.getNode(node.getParentId()) != null) {
        continue;
      }
      if (node.getLaneId() != null && members.containsKey(node.getLaneId())) {
        members.get(node.getLaneId()).add(node.getId());
      } else if (node.getLaneId() == null && poolId != null && poolId.equals(node.getParentId())) {
        members.get(nearestLane(diagram, lanes, diagram.getBounds(node.getId())).getId()).add(node.getId());
      }
    }
    return members;
  }

  protected Container nearestLane(Diagram diagram, List<Container> lanes, Bounds bounds) {
    Container nearest = lanes.get(0);
    double best = Double.MAX_VALUE;
    for (Container lane : lanes) {
      Bounds laneBounds = diagram.getBounds(lane.getId());
      if (laneBounds != null) {
        double distance = Math.abs(laneBounds.getCenterY() - bounds.getCenterY());
        if (distance < best) {
          best = distance;
          nearest = lane;
        }
      }
    }
    return nearest;
  }

  /**
   * Greedy adjacent swaps minimizing the summed lane distance of the flows crossing lanes.
   */
  protected List<Container> optimizeOrder(Diagram diagram, List<Container> lanes) {
    Map<String, Integer> pairCounts = new HashMap<String, Integer>();
    LaneCrossingMetrics.countLanePairs(diagram, pairCounts);
    List<Container> order = new ArrayList<Container>(lanes);
    long cost = cost(order, pairCounts);
    boolean improved = true;
    int rounds = 0;
    while (improved && rounds++ < lanes.size() * lanes.size()) {
      improved = false;
      for (int i = 0; i + 1 < order.size(); i++) {
        Collections.swap(order, i, i + 1);
        long swapped = cost(order, pairCounts);
        if (swapped < cost) {
          cost = swapped;
          improved = true;
        } else {
          Collections.swap(order, i, i + 1);
        }
      }
    }
    return order;
  }

  protected long cost(List<Container> order, Map<String, Integer> pairCounts) {
    long cost = 0;
    for (int i = 0; i < order.size(); i++) {
      for (int j = i + 1; j < order.size(); j++) {
        String a = order.get(i).getId();
        String b = order.get(j).getId();
        Integer count = pairCounts.get(a.compareTo(b) < 0 ? a + "\n" + b : b + "\n" + a);
        if (count != null) {
          cost += (long) count * (j - i);
        }
      }
    }
    return cost;
  }

  protected void clampToLanes(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    for (FlowNode node : diagram.getNodes()) {
      if (node.getLaneId() == null || node.isBoundaryEvent() || !context.isMovable(node.getId())) {
        continue;
      }
      Bounds bounds = diagram.getBounds(node.getId());
      Bounds lane = diagram.getBounds(node.getLaneId());
      if (bounds == null || lane == null) {
        continue;
      }
      if (bounds.getY() < lane.getY() || bounds.getBottom() > lane.getBottom()) {
        double y = bounds.getHeight() < lane.getHeight() ? Math.round(lane.getCenterY() - bounds.getHeight() / 2) : lane.getY();
        diagram.translateElement(node.getId(), 0, y - bounds.getY());
      }
    }
  }

  // Pools

  protected void expandPool(LayoutContext context, Container participant) {
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();
    Bounds content = contentOf(diagram, participant.getId());
    Bounds pool = diagram.getBounds(participant.getId());
    if (content == null || pool == null) {
      return;
    }
    int padding = settings.getParticipantPadding();
    Bounds required = new Bounds(content.getX() - padding - settings.getPoolLabelBand(), content.getY() - padding,
        content.getWidth() + 2 * padding + settings.getPoolLabelBand(), content.getHeight() + 2 * padding);
    if (!pool.contains(required, 0)) {
      Bounds grown = pool.union(required);
      diagram.setBounds(participant.getId(), grown.getX(), grown.getY(), grown.getWidth(), grown.getHeight());
      LOGGER.debug("Expanded pool {} to fit its content", participant.getId());
    }
  }

  protected void stackParticipants(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    Bounds previous = null;
    for (Container participant : diagram.getParticipants()) {
      Bounds bounds = diagram.getBounds(participant.getId());
      if (bounds == null) {
        continue;
      }
      if (previous != null) {
        double dx = previous.getX() - bounds.getX();
        double dy = previous.getBottom() + context.getSettings().getPoolGap() - bounds.getY();
        diagram.translateElement(participant.getId(), dx, dy);
      }
      previous = diagram.getBounds(participant.getId());
    }
  }

  protected Bounds contentOf(Diagram diagram, String containerId) {
    Bounds content = null;
    for (FlowNode node : diagram.getDescendantNodes(containerId)) {
      if (!diagram.isHidden(node.getId())) {
        content = union(content, diagram.getBounds(node.getId()));
      }
    }
    return content;
  }

  protected Bounds withBoundaryEvents(Diagram diagram, String nodeId) {
    Bounds bounds = diagram.getBounds(nodeId).copy();
    for (FlowNode event : diagram.getBoundaryEvents(nodeId)) {
      bounds = union(bounds, diagram.getBounds(event.getId()));
    }
    return bounds;
  }

  protected Bounds union(Bounds a, Bounds b) {
    if (b == null) {
      return a;
    }
    return a == null ? b.copy() : a.union(b);
  }
}
