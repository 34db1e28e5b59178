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

package org.bpmnlayout.strategy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;

/**
 * Shape classification of a diagram, computed from a read-only pass over its elements.
 */
public class DiagramStats {

  protected int flowNodeCount;
  protected int sequenceFlowCount;
  protected int messageFlowCount;
  protected int participantCount;
  protected int laneCount;
  protected int boundaryEventCount;
  protected int expandedSubProcessCount;
  protected int splitCount;
  protected int mergeCount;
  protected boolean nonGatewaySplit;
  protected boolean cyclic;

  public static DiagramStats of(Diagram diagram) {
    DiagramStats stats = new DiagramStats();

    for (FlowNode node : diagram.getNodes()) {
      if (node.isBoundaryEvent()) {
        stats.boundaryEventCount++;
        continue;
      }
      if (!node.getKind().isFlowNode() || diagram.isHidden(node.getId())) {
        continue;
      }
      stats.flowNodeCount++;

      int outgoing = diagram.getOutgoingSequenceFlows(node.getId()).size();
      int incoming = diagram.getIncomingSequenceFlows(node.getId()).size();
      if (outgoing > 1) {
        stats.splitCount++;
        if (!node.getKind().isGateway()) {
          stats.nonGatewaySplit = true;
        }
      }
      if (incoming > 1) {
        stats.mergeCount++;
      }
    }

    for (Container container : diagram.getContainers()) {
      if (container.isParticipant()) {
        stats.participantCount++;
      } else if (container.isLane()) {
        stats.laneCount++;
      } else if (container.isSubProcess()) {
        stats.expandedSubProcessCount++;
      }
    }

    for (Edge edge : diagram.getEdges()) {
      if (edge.getKind() == EdgeKind.SEQUENCE_FLOW) {
        stats.sequenceFlowCount++;
      } else if (edge.getKind() == EdgeKind.MESSAGE_FLOW) {
        stats.messageFlowCount++;
      }
    }

    stats.cyclic = hasCycle(diagram);
    return stats;
  }

  protected static boolean hasCycle(Diagram diagram) {
    // 1 = on the current DFS path, 2 = finished
    Map<String, Integer> state = new HashMap<String, Integer>();
    for (FlowNode start : diagram.getNodes()) {
      if (state.containsKey(start.getId())) {
        continue;
      }
      Deque<String> path = new ArrayDeque<String>();
      Deque<Integer> nextChild = new ArrayDeque<Integer>();
      path.push(start.getId());
      nextChild.push(0);
      state.put(start.getId(), 1);

      while (!path.isEmpty()) {
        String current = path.peek();
        int index = nextChild.pop();
        List<Edge> outgoing = diagram.getOutgoingSequenceFlows(current);
        if (index < outgoing.size()) {
          nextChild.push(index + 1);
          String target = outgoing.get(index).getTargetId();
          Integer targetState = state.get(target);
          if (targetState == null) {
            state.put(target, 1);
            path.push(target);
            nextChild.push(0);
          } else if (targetState == 1) {
            return true;
          }
        } else {
          state.put(current, 2);
          path.pop();
        }
      }
    }
    return false;
  }

  /**
   * A single linear chain or a single split/merge, without cycles, boundary events, lanes,
   * collaborations or expanded subprocesses.
   */
  public boolean isTrivialShape(int maxNodes) {
    return flowNodeCount > 0
        && flowNodeCount <= maxNodes
        && !cyclic
        && boundaryEventCount == 0
        && laneCount == 0
        && participantCount <= 1
        && messageFlowCount == 0
        && expandedSubProcessCount == 0
        && !nonGatewaySplit
        && splitCount <= 1
        && mergeCount <= 1;
  }

  public int getFlowNodeCount() {
    return flowNodeCount;
  }

  public int getSequenceFlowCount() {
    return sequenceFlowCount;
  }

  public int getMessageFlowCount() {
    return messageFlowCount;
  }

  public int getParticipantCount() {
    return participantCount;
  }

  public int getLaneCount() {
    return laneCount;
  }

  public int getBoundaryEventCount() {
    return boundaryEventCount;
  }

  public int getExpandedSubProcessCount() {
    return expandedSubProcessCount;
  }

  public int getSplitCount() {
    return splitCount;
  }

  public int getMergeCount() {
    return mergeCount;
  }

  public boolean isCyclic() {
    return cyclic;
  }

  @Override
  public String toString() {
    return "DiagramStats[nodes=" + flowNodeCount + ", flows=" + sequenceFlowCount + ", messageFlows=" + messageFlowCount
        + ", participants=" + participantCount + ", lanes=" + laneCount + ", boundaryEvents=" + boundaryEventCount
        + ", cyclic=" + cyclic + "]";
  }
}
