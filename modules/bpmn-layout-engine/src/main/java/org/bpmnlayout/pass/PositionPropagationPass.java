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

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.graph.LayoutNode;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;

/**
 * Applies the relative positions computed by the layered algorithm as absolute coordinates.
 * <p>
 * The tree is walked depth first. Children are placed relative to the already updated position
 * of their parent, root level nodes relative to the origin of the context. Leaf sizes are kept,
 * containers take the computed size only when it differs by more than the resize threshold.
 */
public class PositionPropagationPass implements LayoutPass {

  @Override
  public String getName() {
    return "position-propagation";
  }

  @Override
  public void apply(LayoutContext context) {
    LayoutNode root = context.getLayoutGraph();
    if (root == null) {
      return;
    }
    for (LayoutNode child : root.getChildren()) {
      place(context, child, context.getOriginX(), context.getOriginY());
    }
  }

  protected void place(LayoutContext context, LayoutNode node, double parentX, double parentY) {
    Diagram diagram = context.getDiagram();
    LayoutSettings settings = context.getSettings();
    String id = node.getId();

    if (context.isMovable(id)) {
      double x = Math.round(parentX + node.getX());
      double y = Math.round(parentY + node.getY());
      Bounds current = diagram.getBounds(id);
      double width = node.getWidth();
      double height = node.getHeight();
      if (current != null && current.getWidth() > 0 && current.getHeight() > 0) {
        boolean resize = node.isCompound()
            && (Math.abs(node.getWidth() - current.getWidth()) > settings.getResizeThreshold()
                || Math.abs(node.getHeight() - current.getHeight()) > settings.getResizeThreshold());
        if (!resize) {
          width = current.getWidth();
          height = current.getHeight();
        }
      }
      diagram.setBounds(id, x, y, width, height);
    }

    Bounds updated = diagram.getBounds(id);
    double originX = updated != null ? updated.getX() : parentX + node.getX();
    double originY = updated != null ? updated.getY() : parentY + node.getY();
    for (LayoutNode child : node.getChildren()) {
      place(context, child, originX, originY);
    }
  }
}
