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
 * Mutable rectangle (top-left corner plus size) of a shape or label.
 */
public class Bounds {

  protected double x;
  protected double y;
  protected double width;
  protected double height;

  public Bounds(double x, double y, double width, double height) {
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
  }

  public Bounds copy() {
    return new Bounds(x, y, width, height);
  }

  public void translate(double dx, double dy) {
    x += dx;
    y += dy;
  }

  public void setLocation(double x, double y) {
    this.x = x;
    this.y = y;
  }

  public void setSize(double width, double height) {
    this.width = width;
    this.height = height;
  }

  public double getRight() {
    return x + width;
  }

  public double getBottom() {
    return y + height;
  }

  public double getCenterX() {
    return x + width / 2;
  }

  public double getCenterY() {
    return y + height / 2;
  }

  public Point getCenter() {
    return new Point(getCenterX(), getCenterY());
  }

  /**
   * Strict overlap: rectangles that only touch along an edge do not overlap.
   */
  public boolean intersects(Bounds other) {
    return x < other.getRight() && other.x < getRight()
        && y < other.getBottom() && other.y < getBottom();
  }

  public boolean contains(Bounds other, double tolerance) {
    return other.x >= x - tolerance && other.y >= y - tolerance
        && other.getRight() <= getRight() + tolerance
        && other.getBottom() <= getBottom() + tolerance;
  }

  public boolean contains(Point point) {
    return point.getX() >= x && point.getX() <= getRight()
        && point.getY() >= y && point.getY() <= getBottom();
  }

  public Bounds union(Bounds other) {
    double minX = Math.min(x, other.x);
    double minY = Math.min(y, other.y);
    double maxX = Math.max(getRight(), other.getRight());
    double maxY = Math.max(getBottom(), other.getBottom());
    return new Bounds(minX, minY, maxX - minX, maxY - minY);
  }

  public double getX() {
    return x;
  }

  public void setX(double x) {
    this.x = x;
  }

  public double getY() {
    return y;
  }

  public void setY(double y) {
    this.y = y;
  }

  public double getWidth() {
    return width;
  }

  public void setWidth(double width) {
    this.width = width;
  }

  public double getHeight() {
    return height;
  }

  public void setHeight(double height) {
    this.height = height;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Bounds)) {
      return false;
    }
    Bounds other = (Bounds) o;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
        && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(x);
    result = 31 * result + Double.hashCode(y);
    result = 31 * result + Double.hashCode(width);
    return 31 * result + Double.hashCode(height);
  }

  @Override
  public String toString() {
    return "[x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "]";
  }
}
