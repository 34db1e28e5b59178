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

import java.util.ArrayList;
import java.util.List;

/**
 * Static geometry helpers shared by the routing and placement passes.
 */
public final class Geometry {

  private Geometry() {
  }

  public static boolean isHorizontal(Point a, Point b, double tolerance) {
    return Math.abs(a.getY() - b.getY()) <= tolerance;
  }

  public static boolean isVertical(Point a, Point b, double tolerance) {
    return Math.abs(a.getX() - b.getX()) <= tolerance;
  }

  public static boolean isOrthogonal(List<Point> waypoints, double tolerance) {
    for (int i = 1; i < waypoints.size(); i++) {
      Point a = waypoints.get(i - 1);
      Point b = waypoints.get(i);
      if (!isHorizontal(a, b, tolerance) && !isVertical(a, b, tolerance)) {
        return false;
      }
    }
    return true;
  }

  // Routers sometimes produce points that visually are not really necessary:
  // duplicates and the middle one of three points on the same horizontal or vertical line.
  public static List<Point> simplify(List<Point> points) {
    List<Point> deduplicated = new ArrayList<Point>();
    for (Point point : points) {
      if (deduplicated.isEmpty() || !sameLocation(deduplicated.get(deduplicated.size() - 1), point)) {
        deduplicated.add(point);
      }
    }

    List<Point> optimized = new ArrayList<Point>();
    for (int i = 0; i < deduplicated.size(); i++) {
      Point current = deduplicated.get(i);
      boolean keepPoint = true;
      if (i > 0 && i != deduplicated.size() - 1) {
        Point previous = optimized.get(optimized.size() - 1);
        Point next = deduplicated.get(i + 1);
        if (current.getY() == previous.getY() && current.getY() == next.getY()
            && between(current.getX(), previous.getX(), next.getX())) {
          keepPoint = false;
        } else if (current.getX() == previous.getX() && current.getX() == next.getX()
            && between(current.getY(), previous.getY(), next.getY())) {
          keepPoint = false;
        }
      }
      if (keepPoint) {
        optimized.add(current);
      }
    }
    return optimized;
  }

  private static boolean between(double value, double a, double b) {
    return value >= Math.min(a, b) && value <= Math.max(a, b);
  }

  private static boolean sameLocation(Point a, Point b) {
    return Math.abs(a.getX() - b.getX()) < 0.01 && Math.abs(a.getY() - b.getY()) < 0.01;
  }

  /**
   * Segment/rectangle intersection (Cohen-Sutherland clipping). Touching the border counts.
   */
  public static boolean segmentIntersectsRect(Point a, Point b, Bounds rect) {
    double x0 = a.getX();
    double y0 = a.getY();
    double x1 = b.getX();
    double y1 = b.getY();
    int code0 = outCode(x0, y0, rect);
    int code1 = outCode(x1, y1, rect);

    for (int iteration = 0; iteration < 8; iteration++) {
      if ((code0 | code1) == 0) {
        return true;
      }
      if ((code0 & code1) != 0) {
        return false;
      }
      int outside = code0 != 0 ? code0 : code1;
      double x;
      double y;
      if ((outside & BOTTOM) != 0) {
        x = x0 + (x1 - x0) * (rect.getBottom() - y0) / (y1 - y0);
        y = rect.getBottom();
      } else if ((outside & TOP) != 0) {
        x = x0 + (x1 - x0) * (rect.getY() - y0) / (y1 - y0);
        y = rect.getY();
      } else if ((outside & RIGHT) != 0) {
        y = y0 + (y1 - y0) * (rect.getRight() - x0) / (x1 - x0);
        x = rect.getRight();
      } else {
        y = y0 + (y1 - y0) * (rect.getX() - x0) / (x1 - x0);
        x = rect.getX();
      }
      if (outside == code0) {
        x0 = x;
        y0 = y;
        code0 = outCode(x0, y0, rect);
      } else {
        x1 = x;
        y1 = y;
        code1 = outCode(x1, y1, rect);
      }
    }
    return false;
  }

  private static final int LEFT = 1;
  private static final int RIGHT = 2;
  private static final int TOP = 4;
  private static final int BOTTOM = 8;

  private static int outCode(double x, double y, Bounds rect) {
    int code = 0;
    if (x < rect.getX()) {
      code |= LEFT;
    } else if (x > rect.getRight()) {
      code |= RIGHT;
    }
    if (y < rect.getY()) {
      code |= TOP;
    } else if (y > rect.getBottom()) {
      code |= BOTTOM;
    }
    return code;
  }

  public static double pathLength(List<Point> points) {
    double length = 0;
    for (int i = 1; i < points.size(); i++) {
      length += points.get(i - 1).distance(points.get(i));
    }
    return length;
  }

  /**
   * The point at the given distance from the start of the polyline, clamped to its ends.
   */
  public static Point pointAlong(List<Point> points, double distance) {
    if (points.isEmpty()) {
      throw new IllegalArgumentException("Could not walk path: no waypoints");
    }
    double remaining = Math.max(0, distance);
    for (int i = 1; i < points.size(); i++) {
      Point a = points.get(i - 1);
      Point b = points.get(i);
      double segment = a.distance(b);
      if (remaining <= segment && segment > 0) {
        double ratio = remaining / segment;
        return new Point(a.getX() + (b.getX() - a.getX()) * ratio, a.getY() + (b.getY() - a.getY()) * ratio);
      }
      remaining -= segment;
    }
    return points.get(points.size() - 1);
  }

  public static double round(double value) {
    return Math.round(value);
  }
}
