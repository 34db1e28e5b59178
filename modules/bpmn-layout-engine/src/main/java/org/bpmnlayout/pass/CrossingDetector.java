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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.Geometry;
import org.bpmnlayout.model.Point;

/**
 * Counts crossings between horizontal and vertical connection segments with a sweep line over x.
 * <p>
 * Horizontal segments are inserted into an ordered map keyed by y when the sweep reaches their
 * left end and removed at their right end; each vertical segment queries the y range strictly
 * between its ends. At equal x removals run before queries and queries before insertions, so
 * segments that only touch are not counted. Each pair of edges is reported once.
 */
public class CrossingDetector {

  private static final int REMOVE = 0;
  private static final int QUERY = 1;
  private static final int INSERT = 2;

  protected double tolerance;

  public CrossingDetector(double tolerance) {
    this.tolerance = tolerance;
  }

  public CrossingReport detect(Collection<Edge> edges) {
    List<SweepEvent> events = new ArrayList<SweepEvent>();
    for (Edge edge : edges) {
      List<Point> points = edge.getWaypoints();
      for (int i = 0; i + 1 < points.size(); i++) {
        Point a = points.get(i);
        Point b = points.get(i + 1);
        if (a.equals(b)) {
          continue;
        }
        if (Geometry.isHorizontal(a, b, tolerance)) {
          Segment segment = new Segment(edge.getId(), Math.min(a.getX(), b.getX()), Math.max(a.getX(), b.getX()), a.getY());
          events.add(new SweepEvent(segment.low, INSERT, segment));
          events.add(new SweepEvent(segment.high, REMOVE, segment));
        } else if (Geometry.isVertical(a, b, tolerance)) {
          Segment segment = new Segment(edge.getId(), Math.min(a.getY(), b.getY()), Math.max(a.getY(), b.getY()), a.getX());
          events.add(new SweepEvent(segment.position, QUERY, segment));
        }
      }
    }
    Collections.sort(events, new Comparator<SweepEvent>() {
      @Override
      public int compare(SweepEvent a, SweepEvent b) {
        int byX = Double.compare(a.x, b.x);
        return byX != 0 ? byX : a.type - b.type;
      }
    });

    TreeMap<Double, List<Segment>> active = new TreeMap<Double, List<Segment>>();
    Set<List<String>> pairs = new LinkedHashSet<List<String>>();
    for (SweepEvent event : events) {
      Segment segment = event.segment;
      switch (event.type) {
        case INSERT:
          List<Segment> row = active.get(segment.position);
          if (row == null) {
            row = new ArrayList<Segment>();
            active.put(segment.position, row);
          }
          row.add(segment);
          break;
        case REMOVE:
          List<Segment> existing = active.get(segment.position);
          if (existing != null) {
            existing.remove(segment);
            if (existing.isEmpty()) {
              active.remove(segment.position);
            }
          }
          break;
        default:
          for (Map.Entry<Double, List<Segment>> entry : active.subMap(segment.low, false, segment.high, false).entrySet()) {
            for (Segment horizontal : entry.getValue()) {
              if (!horizontal.edgeId.equals(segment.edgeId)) {
                pairs.add(pair(horizontal.edgeId, segment.edgeId));
              }
            }
          }
      }
    }
    return new CrossingReport(new ArrayList<List<String>>(pairs));
  }

  protected List<String> pair(String a, String b) {
    return a.compareTo(b) < 0 ? Arrays.asList(a, b) : Arrays.asList(b, a);
  }

  // A horizontal segment spans low..high in x at y = position, a vertical one low..high in y at x = position
  protected static class Segment {
    final String edgeId;
    final double low;
    final double high;
    final double position;

    Segment(String edgeId, double low, double high, double position) {
      this.edgeId = edgeId;
      this.low = low;
      this.high = high;
      this.position = position;
    }
  }

  protected static class SweepEvent {
    final double x;
    final int type;
    final Segment segment;

    SweepEvent(double x, int type, Segment segment) {
      this.x = x;
      this.type = type;
      this.segment = segment;
    }
  }
}
