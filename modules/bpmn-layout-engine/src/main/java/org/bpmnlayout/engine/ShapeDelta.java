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

package org.bpmnlayout.engine;

import org.bpmnlayout.model.Bounds;

/**
 * Change of one shape by a layout. A shape that did not exist before the layout has no previous
 * bounds; its delta is measured from the origin.
 */
public class ShapeDelta {

  protected String elementId;
  protected Bounds before;
  protected Bounds after;

  public ShapeDelta(String elementId, Bounds before, Bounds after) {
    this.elementId = elementId;
    this.before = before != null ? before.copy() : null;
    this.after = after.copy();
  }

  public String getElementId() {
    return elementId;
  }

  public Bounds getBefore() {
    return before;
  }

  public Bounds getAfter() {
    return after;
  }

  public boolean isCreated() {
    return before == null;
  }

  public double getDx() {
    return after.getX() - (before != null ? before.getX() : 0);
  }

  public double getDy() {
    return after.getY() - (before != null ? before.getY() : 0);
  }

  public double getDwidth() {
    return after.getWidth() - (before != null ? before.getWidth() : 0);
  }

  public double getDheight() {
    return after.getHeight() - (before != null ? before.getHeight() : 0);
  }

  @Override
  public String toString() {
    return "ShapeDelta[" + elementId + " dx=" + getDx() + " dy=" + getDy() + " dw=" + getDwidth() + " dh=" + getDheight() + "]";
  }
}
