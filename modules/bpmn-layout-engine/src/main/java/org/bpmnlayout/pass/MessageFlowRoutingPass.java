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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.routing.RouteTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes message flows between pools as vertical-horizontal-vertical dog-legs, or as a single
 * vertical segment when both ends are horizontally aligned. The horizontal leg runs through the
 * gap between the two pools; message flows sharing that gap are spread apart.
 * <p>
 * Message flows attached to the same side of a shape are spread along that side, so that their
 * vertical legs do not overlap. Flows leaving one side are ordered by the position of their other
 * end, and the one turning first takes the horizontal leg closest to the source.
 */
public class MessageFlowRoutingPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageFlowRoutingPass.class);

  private static final double ALIGNMENT_TOLERANCE = 2;

  @Override
  public String getName() {
    return "message-flow-routing";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();

    List<Edge> messageFlows = new ArrayList<Edge>();
    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() == EdgeKind.MESSAGE_FLOW && context.isInScope(edge)
          && diagram.getBounds(edge.getSourceId()) != null && diagram.getBounds(edge.getTargetId()) != null) {
        messageFlows.add(edge);
      }
    }
    Map<String, Double> portOffsets = computePortOffsets(diagram, settings, messageFlows);

    Map<String, List<DogLeg>> byGap = new LinkedHashMap<String, List<DogLeg>>();
    for (Edge edge : messageFlows) {
      Bounds source = diagram.getBounds(edge.getSourceId());
      Bounds target = diagram.getBounds(edge.getTargetId());

      boolean downwards = isDownwards(source, target);
      double exitY = downwards ? source.getBottom() : source.getY();
      double entryY = downwards ? target.getY() : target.getBottom();
      if (downwards ? entryY <= exitY : entryY >= exitY) {
        edge.setWaypoints(RouteTemplates.simple(source, target));
        continue;
      }

      double sourceOffset = portOffsets.get(sourcePort(edge, downwards));
      double sourceX = Math.round(source.getCenterX() + sourceOffset);
      double targetX = Math.round(target.getCenterX() + portOffsets.get(targetPort(edge, downwards)));
      if (Math.abs(sourceX - targetX) <= ALIGNMENT_TOLERANCE) {
        edge.setWaypoints(Arrays.asList(new Point(sourceX, exitY), new Point(sourceX, entryY)));
        continue;
      }

      // The gap between the two pools, or between the two shapes when there is none
      double gapTop = downwards ? exitY : entryY;
      double gapBottom = downwards ? entryY : exitY;
      Bounds sourcePool = poolBounds(diagram, edge.getSourceId());
      Bounds targetPool = poolBounds(diagram, edge.getTargetId());
      if (sourcePool != null && targetPool != null) {
        Bounds upper = downwards ? sourcePool : targetPool;
        Bounds lower = downwards ? targetPool : sourcePool;
        if (upper.getBottom() < lower.getY()) {
          gapTop = Math.max(gapTop, upper.getBottom());
          gapBottom = Math.min(gapBottom, lower.getY());
        }
      }

      DogLeg dogLeg = new DogLeg(edge, sourceX, exitY, targetX, entryY, gapTop, gapBottom);
      dogLeg.sourceSide = edge.getSourceId() + (downwards ? ":bottom" : ":top");
      double key = target.getCenterX() >= source.getCenterX() ? sourceOffset : -sourceOffset;
      dogLeg.rank = downwards ? -key : key;
      String gapKey = Math.round(gapTop) + ":" + Math.round(gapBottom);
      List<DogLeg> group = byGap.get(gapKey);
      if (group == null) {
        group = new ArrayList<DogLeg>();
        byGap.put(gapKey, group);
      }
      group.add(dogLeg);
    }

    for (List<DogLeg> group : byGap.values()) {
      orderBySourcePort(group);
      spread(settings, group);
    }
    LOGGER.debug("Routed {} message flow(s) of diagram {}", messageFlows.size(), diagram.getId());
  }

  /**
   * Horizontal offset of every flow end from the center of its shape. The ends sharing one side of
   * a shape are ordered by the x of their other end and spread symmetrically around the center.
   */
  protected Map<String, Double> computePortOffsets(Diagram diagram, LayoutSettings settings, List<Edge> messageFlows) {
    final Map<String, Double> otherEndX = new HashMap<String, Double>();
    Map<String, List<String>> sides = new LinkedHashMap<String, List<String>>();
    for (Edge edge : messageFlows) {
      Bounds source = diagram.getBounds(edge.getSourceId());
      Bounds target = diagram.getBounds(edge.getTargetId());
      boolean downwards = isDownwards(source, target);
      String sourcePort = sourcePort(edge, downwards);
      String targetPort = targetPort(edge, downwards);
      otherEndX.put(sourcePort, target.getCenterX());
      otherEndX.put(targetPort, source.getCenterX());
      addPort(sides, edge.getSourceId() + (downwards ? ":bottom" : ":top"), sourcePort);
      addPort(sides, edge.getTargetId() + (downwards ? ":top" : ":bottom"), targetPort);
    }

    Map<String, Double> offsets = new HashMap<String, Double>();
    for (Map.Entry<String, List<String>> side : sides.entrySet()) {
      List<String> ports = side.getValue();
      Collections.sort(ports, new Comparator<String>() {
        @Override
        public int compare(String a, String b) {
          return Double.compare(otherEndX.get(a), otherEndX.get(b));
        }
      });
      String elementId = side.getKey().substring(0, side.getKey().lastIndexOf(':'));
      double room = diagram.getBounds(elementId).getWidth() / 2 - 4;
      double step = settings.getParallelFlowOffset();
      double half = (ports.size() - 1) / 2.0;
      if (half > 0 && half * step > room) {
        step = Math.max(0, room / half);
      }
      for (int i = 0; i < ports.size(); i++) {
        offsets.put(ports.get(i), (double) Math.round((i - half) * step));
      }
    }
    return offsets;
  }

  /**
   * Reorders the dog-legs leaving the same side of a shape among the slots they already hold in
   * the gap, so that their legs do not cross each other.
   */
  protected void orderBySourcePort(List<DogLeg> group) {
    Map<String, List<Integer>> slots = new LinkedHashMap<String, List<Integer>>();
    for (int i = 0; i < group.size(); i++) {
      String side = group.get(i).sourceSide;
      List<Integer> indexes = slots.get(side);
      if (indexes == null) {
        indexes = new ArrayList<Integer>();
        slots.put(side, indexes);
      }
      indexes.add(i);
    }
    for (List<Integer> indexes : slots.values()) {
      if (indexes.size() < 2) {
        continue;
      }
      List<DogLeg> members = new ArrayList<DogLeg>();
      for (Integer index : indexes) {
        members.add(group.get(index));
      }
      Collections.sort(members, new Comparator<DogLeg>() {
        @Override
        public int compare(DogLeg a, DogLeg b) {
          return Double.compare(a.rank, b.rank);
        }
      });
      for (int i = 0; i < indexes.size(); i++) {
        group.set(indexes.get(i), members.get(i));
      }
    }
  }

  protected void spread(LayoutSettings settings, List<DogLeg> group) {
    DogLeg first = group.get(0);
    double middle = (first.gapTop + first.gapBottom) / 2;
    double step = settings.getParallelFlowOffset();
    double half = (group.size() - 1) / 2.0;
    double room = (first.gapBottom - first.gapTop) / 2 - 2;
    if (half > 0 && half * step > room) {
      step = Math.max(0, room / half);
    }
    for (int i = 0; i < group.size(); i++) {
      DogLeg dogLeg = group.get(i);
      double midY = Math.round(middle + (i - half) * step);
      dogLeg.edge.setWaypoints(Arrays.asList(
          new Point(dogLeg.sourceX, dogLeg.exitY),
          new Point(dogLeg.sourceX, midY),
          new Point(dogLeg.targetX, midY),
          new Point(dogLeg.targetX, dogLeg.entryY)));
    }
  }

  protected Bounds poolBounds(Diagram diagram, String elementId) {
    Container container = diagram.getContainer(elementId);
    if (container != null && container.isParticipant()) {
      return diagram.getBounds(elementId);
    }
    Container participant = diagram.getParticipantOf(elementId);
    return participant != null ? diagram.getBounds(participant.getId()) : null;
  }

  protected static boolean isDownwards(Bounds source, Bounds target) {
    return target.getCenterY() >= source.getCenterY();
  }

  // A port is one end of one flow on one side of a shape: "element:side#flow"
  protected static String sourcePort(Edge edge, boolean downwards) {
    return edge.getSourceId() + (downwards ? ":bottom#" : ":top#") + edge.getId();
  }

  protected static String targetPort(Edge edge, boolean downwards) {
    return edge.getTargetId() + (downwards ? ":top#" : ":bottom#") + edge.getId();
  }

  protected void addPort(Map<String, List<String>> sides, String side, String port) {
    List<String> ports = sides.get(side);
    if (ports == null) {
      ports = new ArrayList<String>();
      sides.put(side, ports);
    }
    ports.add(port);
  }

  protected static class DogLeg {
    final Edge edge;
    final double sourceX;
    final double exitY;
    final double targetX;
    final double entryY;
    final double gapTop;
    final double gapBottom;
    String sourceSide;
    double rank;

    DogLeg(Edge edge, double sourceX, double exitY, double targetX, double entryY, double gapTop, double gapBottom) {
      this.edge = edge;
      this.sourceX = sourceX;
      this.exitY = exitY;
      this.targetX = targetX;
      this.entryY = entryY;
      this.gapTop = gapTop;
      this.gapBottom = gapBottom;
    }
  }
}
