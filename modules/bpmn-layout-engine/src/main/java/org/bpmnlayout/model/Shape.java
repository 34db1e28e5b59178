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

package org.bpmnlayout.model;

/**
 * Diagram interchange entry of a node or container: its bounds and optional external label.
 */
public class Shape {

  protected String elementId;
  protected Bounds bounds;
  protected Bounds label;

  public Shape(String elementId, Bounds bounds) {
    this.elementId = elementId;
    this.bounds = bounds;
  }

  public Shape copy() {
    Shape copy = new Shape(elementId, bounds.copy());
    copy.label = label != null ? label.copy() : null;
    return copy;
  }

  public String getElementId() {
    return elementId;
  }

  public Bounds getBounds() {
    return bounds;
  }

  public Bounds getLabel() {
    return label;
  }

  public void setLabel(Bounds label) {
    this.label = label;
  }

  @Override
  public String toString() {
    return "Shape[" + elementId + " " + bounds + "]";
  }
}
