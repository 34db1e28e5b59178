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

package org.bpmnlayout.routing;

import java.util.List;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Container;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;

/**
 * Routes backward sequence flows as a U below the content of the innermost pool or expanded
 * subprocess holding both ends. The detour never leaves that container, so it does not run
 * through a neighboring pool.
 */
public class LoopbackRouter {

  protected LayoutSettings settings;

  public LoopbackRouter(LayoutSettings settings) {
    this.settings = settings;
  }

  /**
   * A sequence flow whose target lies entirely left of its source.
   */
  public static boolean isBackward(Diagram diagram, Edge edge) {
    if (edge.getKind() != EdgeKind.SEQUENCE_FLOW) {
      return false;
    }
    Bounds source = diagram.getBounds(edge.getSourceId());
    Bounds target = diagram.getBounds(edge.getTargetId());
    return source != null && target != null && target.getRight() <= source.getX();
  }

  public List<Point> route(Diagram diagram, Edge edge) {
    return route(diagram, edge, 0, 1);
  }

  /**
   * Routes the {@code index}-th of {@code count} loopbacks sharing source and target. The routes
   * are nested: the first one leaves highest and takes the widest, deepest detour, so that none
   * of them overlaps or crosses another.
   */
  public List<Point> route(Diagram diagram, Edge edge, int index, int count) {
    Bounds source = diagram.getBounds(edge.getSourceId());
    Bounds target = diagram.getBounds(edge.getTargetId());
    if (source == null || target == null) {
      throw new IllegalStateException("Could not route loopback '" + edge.getId() + "': an endpoint has no shape");
    }
    String scopeId = findCommonContainer(diagram, edge.getSourceId(), edge.getTargetId());
    Bounds content = contentBounds(diagram, scopeId);
    double bottom = Math.max(source.getBottom(), target.getBottom());
    if (content != null) {
      bottom = Math.max(bottom, content.getBottom());
    }

    double detourY = bottom + settings.getLoopbackMargin();
    Bounds container = scopeId != null ? diagram.getBounds(scopeId) : null;
    if (container != null && detourY >= container.getBottom()) {
      detourY = Math.floor((bottom + container.getBottom()) / 2);
    }
    if (count < 2) {
      return RouteTemplates.loopback(source, target, detourY, settings.getLoopbackHorizontalMargin());
    }

    double step = settings.getParallelFlowOffset();
    double half = (count - 1) / 2.0;
    double endStep = step;
    double room = Math.min(source.getHeight(), target.getHeight()) / 2 - 4;
    if (half * endStep > room) {
      endStep = Math.max(0, room / half);
    }
    double depthStep = step;
    if (container != null && detourY + (count - 1) * depthStep >= container.getBottom()) {
      depthStep = Math.max(0, (container.getBottom() - 1 - detourY) / (count - 1));
    }
    int nesting = count - 1 - index;
    return RouteTemplates.loopback(source, target,
        Math.round(detourY + nesting * depthStep),
        settings.getLoopbackHorizontalMargin() + nesting * step,
        Math.round((index - half) * endStep));
  }

  /**
   * Innermost pool or expanded subprocess enclosing both elements, {@code null} for the process
   * level. Lanes do not count, a detour may cross lanes of its own pool.
   */
  public String findCommonContainer(Diagram diagram, String sourceId, String targetId) {
    String current = diagram.getParentOf(sourceId);
    int guard = 0;
    while (current != null && guard++ < 1000) {
      Container container = diagram.getContainer(current);
      if (container != null && !container.isLane()
          && (current.equals(diagram.getParentOf(targetId)) || diagram.isDescendantOf(targetId, current))) {
        return current;
      }
      current = diagram.getParentOf(current);
    }
    return null;
  }

  protected Bounds contentBounds(Diagram diagram, String scopeId) {
    Bounds content = null;
    for (FlowNode node : diagram.getNodes()) {
      if (diagram.isHidden(node.getId())) {
        continue;
      }
      boolean inScope = scopeId != null
          ? diagram.isDescendantOf(node.getId(), scopeId)
          : diagram.getParticipantOf(node.getId()) == null;
      Bounds bounds = diagram.getBounds(node.getId());
      if (inScope && bounds != null) {
        content = content == null ? bounds.copy() : content.union(bounds);
      }
    }
    return content;
  }
}
