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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Geometry;
import org.bpmnlayout.model.Point;

/**
 * Fixed orthogonal route shapes. They never fail and are used whenever a computed route
 * is not available or not trusted.
 */
public final class RouteTemplates {

  private RouteTemplates() {
  }

  /**
   * Two or three point route: straight when the shapes share a row, an L shape otherwise.
   */
  public static List<Point> simple(Bounds source, Bounds target) {
    double overlapTop = Math.max(source.getY(), target.getY());
    double overlapBottom = Math.min(source.getBottom(), target.getBottom());

    if (target.getX() >= source.getRight() || target.getRight() <= source.getX()) {
      boolean rightwards = target.getX() >= source.getRight();
      double exitX = rightwards ? source.getRight() : source.getX();
      double entryX = rightwards ? target.getX() : target.getRight();
      if (overlapTop <= overlapBottom) {
        double y = clamp(source.getCenterY(), overlapTop, overlapBottom);
        return round(Arrays.asList(new Point(exitX, y), new Point(entryX, y)));
      }
      double entryY = target.getCenterY() > source.getCenterY() ? target.getY() : target.getBottom();
      return round(Arrays.asList(
          new Point(exitX, source.getCenterY()),
          new Point(target.getCenterX(), source.getCenterY()),
          new Point(target.getCenterX(), entryY)));
    }

    if (target.getY() >= source.getBottom() || target.getBottom() <= source.getY()) {
      boolean downwards = target.getY() >= source.getBottom();
      double exitY = downwards ? source.getBottom() : source.getY();
      double overlapLeft = Math.max(source.getX(), target.getX());
      double overlapRight = Math.min(source.getRight(), target.getRight());
      double x = clamp(source.getCenterX(), overlapLeft, overlapRight);
      return round(Arrays.asList(new Point(x, exitY), new Point(x, downwards ? target.getY() : target.getBottom())));
    }

    // Overlapping shapes: a horizontal segment between the two centers is the best we can do
    return round(Arrays.asList(
        new Point(source.getCenterX(), source.getCenterY()),
        new Point(target.getCenterX(), source.getCenterY())));
  }

  /**
   * Forward route: two points when both centers are within {@code sameRowThreshold}, a Z shape
   * through the middle of the horizontal gap otherwise.
   */
  public static List<Point> forward(Bounds source, Bounds target, double sameRowThreshold) {
    if (target.getX() < source.getRight()) {
      return simple(source, target);
    }
    double deltaY = Math.abs(source.getCenterY() - target.getCenterY());
    double overlapTop = Math.max(source.getY(), target.getY());
    double overlapBottom = Math.min(source.getBottom(), target.getBottom());
    if (deltaY <= sameRowThreshold && overlapTop <= overlapBottom) {
      double y = clamp(source.getCenterY(), overlapTop, overlapBottom);
      return round(Arrays.asList(new Point(source.getRight(), y), new Point(target.getX(), y)));
    }
    double midX = (source.getRight() + target.getX()) / 2;
    return round(Arrays.asList(
        new Point(source.getRight(), source.getCenterY()),
        new Point(midX, source.getCenterY()),
        new Point(midX, target.getCenterY()),
        new Point(target.getX(), target.getCenterY())));
  }

  /**
   * U shaped detour for a backward connection. The route leaves the source to the right, runs
   * along {@code detourY} and enters the target from the left.
   */
  public static List<Point> loopback(Bounds source, Bounds target, double detourY, double horizontalMargin) {
    return loopback(source, target, detourY, horizontalMargin, 0);
  }

  /**
   * Loopback whose horizontal end segments are moved by {@code endOffset} from the shape centers.
   */
  public static List<Point> loopback(Bounds source, Bounds target, double detourY, double horizontalMargin, double endOffset) {
    double exitX = source.getRight() + horizontalMargin;
    double entryX = target.getX() - horizontalMargin;
    if (entryX >= exitX) {
      // Not actually backward, keep the U shape but through the shape centers
      return round(Arrays.asList(
          new Point(source.getCenterX(), detourY > source.getCenterY() ? source.getBottom() : source.getY()),
          new Point(source.getCenterX(), detourY),
          new Point(target.getCenterX(), detourY),
          new Point(target.getCenterX(), detourY > target.getCenterY() ? target.getBottom() : target.getY())));
    }
    double exitY = source.getCenterY() + endOffset;
    double entryY = target.getCenterY() + endOffset;
    return round(Arrays.asList(
        new Point(source.getRight(), exitY),
        new Point(exitX, exitY),
        new Point(exitX, detourY),
        new Point(entryX, detourY),
        new Point(entryX, entryY),
        new Point(target.getX(), entryY)));
  }

  static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  static List<Point> round(List<Point> points) {
    List<Point> rounded = new ArrayList<Point>();
    for (Point point : points) {
      rounded.add(new Point(Math.round(point.getX()), Math.round(point.getY())));
    }
    return Geometry.simplify(rounded);
  }
}
