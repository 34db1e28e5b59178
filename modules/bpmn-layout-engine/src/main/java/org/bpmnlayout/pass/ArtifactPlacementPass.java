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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;

/**
 * Artifacts take no part in the layered layout. Text annotations are put above the element they
 * are associated with, data objects and data stores below it. Artifacts sharing an element are
 * spread horizontally, unlinked artifacts are lined up above or below the whole flow.
 */
public class ArtifactPlacementPass implements LayoutPass {

  @Override
  public String getName() {
    return "artifact-placement";
  }

  @Override
  public void apply(LayoutContext context) {
    Diagram diagram = context.getDiagram();
    List<Bounds> occupied = new ArrayList<Bounds>();
    Bounds flowBounds = null;
    Map<String, List<FlowNode>> linked = new LinkedHashMap<String, List<FlowNode>>();
    List<FlowNode> unlinked = new ArrayList<FlowNode>();

    for (FlowNode node : diagram.getNodes()) {
      Bounds bounds = diagram.getBounds(node.getId());
      if (bounds == null || diagram.isHidden(node.getId())) {
        continue;
      }
      if (!node.getKind().isArtifact()) {
        if (diagram.getContainer(node.getId()) == null) {
          occupied.add(bounds);
        }
        flowBounds = flowBounds == null ? bounds.copy() : flowBounds.union(bounds);
      } else if (context.isMovable(node.getId())) {
        String linkedId = findLinkedElement(diagram, node);
        if (linkedId != null) {
          List<FlowNode> group = linked.get(linkedId);
          if (group == null) {
            group = new ArrayList<FlowNode>();
            linked.put(linkedId, group);
          }
          group.add(node);
        } else {
          unlinked.add(node);
        }
      } else {
        occupied.add(bounds);
      }
    }
    if (flowBounds == null) {
      return;
    }

    LayoutSettings settings = context.getSettings();
    for (Map.Entry<String, List<FlowNode>> entry : linked.entrySet()) {
      Bounds target = diagram.getBounds(entry.getKey());
      double totalWidth = -settings.getArtifactPadding();
      for (FlowNode artifact : entry.getValue()) {
        totalWidth += diagram.getBounds(artifact.getId()).getWidth() + settings.getArtifactPadding();
      }
      double x = target.getCenterX() - totalWidth / 2;
      for (FlowNode artifact : entry.getValue()) {
        Bounds bounds = diagram.getBounds(artifact.getId());
        double y = isAbove(artifact)
            ? target.getY() - bounds.getHeight() - settings.getArtifactOffset()
            : target.getBottom() + settings.getArtifactOffset();
        Bounds position = new Bounds(Math.round(x), Math.round(y), bounds.getWidth(), bounds.getHeight());
        avoid(position, occupied, settings.getArtifactPadding());
        move(diagram, artifact.getId(), position);
        occupied.add(position);
        x += bounds.getWidth() + settings.getArtifactPadding();
      }
    }

    double x = flowBounds.getX();
    for (FlowNode artifact : unlinked) {
      Bounds bounds = diagram.getBounds(artifact.getId());
      double y = isAbove(artifact)
          ? flowBounds.getY() - bounds.getHeight() - settings.getArtifactOffset()
          : flowBounds.getBottom() + settings.getArtifactOffset();
      Bounds position = new Bounds(Math.round(x), Math.round(y), bounds.getWidth(), bounds.getHeight());
      avoid(position, occupied, settings.getArtifactPadding());
      move(diagram, artifact.getId(), position);
      occupied.add(position);
      x += bounds.getWidth() + settings.getArtifactPadding();
    }
  }

  protected boolean isAbove(FlowNode artifact) {
    return artifact.getKind() == ElementKind.TEXT_ANNOTATION;
  }

  protected String findLinkedElement(Diagram diagram, FlowNode artifact) {
    for (Edge edge : diagram.getConnectedEdges(artifact.getId())) {
      if (edge.getKind() != EdgeKind.ASSOCIATION && edge.getKind() != EdgeKind.DATA_ASSOCIATION) {
        continue;
      }
      String otherId = edge.getSourceId().equals(artifact.getId()) ? edge.getTargetId() : edge.getSourceId();
      FlowNode other = diagram.getNode(otherId);
      if (other != null && !other.getKind().isArtifact() && diagram.getBounds(otherId) != null) {
        return otherId;
      }
    }
    return null;
  }

  // Shifts right past every occupied rectangle the position overlaps
  protected void avoid(Bounds position, List<Bounds> occupied, int padding) {
    boolean moved = true;
    int attempts = 0;
    while (moved && attempts++ < occupied.size() + 1) {
      moved = false;
      for (Bounds rect : occupied) {
        if (position.intersects(rect)) {
          position.setX(rect.getRight() + padding);
          moved = true;
        }
      }
    }
  }

  protected void move(Diagram diagram, String artifactId, Bounds position) {
    Bounds current = diagram.getBounds(artifactId);
    diagram.translateElement(artifactId, position.getX() - current.getX(), position.getY() - current.getY());
  }
}
