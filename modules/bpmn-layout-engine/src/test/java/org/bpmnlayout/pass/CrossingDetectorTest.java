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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.EdgeKind;
import org.bpmnlayout.model.Point;
import org.junit.jupiter.api.Test;

public class CrossingDetectorTest {

  private final CrossingDetector detector = new CrossingDetector(2);

  @Test
  public void straightFlowsOnSeparateRowsDoNotCross() {
    List<Edge> edges = new ArrayList<Edge>();
    for (int i = 0; i < 12; i++) {
      double y = 100 + i * 100;
      double x = 100 + i * 150;
      edges.add(edge("flow" + i, new Point(x, y), new Point(x + 100, y)));
    }

    long start = System.nanoTime();
    CrossingReport report = detector.detect(edges);
    long elapsedMillis = (System.nanoTime() - start) / 1000000;

    assertThat(report.getCount()).isZero();
    assertThat(elapsedMillis).isLessThan(200);
  }

  @Test
  public void countsAProperCrossing() {
    Edge horizontal = edge("b", new Point(0, 50), new Point(100, 50));
    Edge vertical = edge("a", new Point(50, 0), new Point(50, 100));

    CrossingReport report = detector.detect(Arrays.asList(horizontal, vertical));

    assertThat(report.getCount()).isEqualTo(1);
    assertThat(report.getPairs()).containsExactly(Arrays.asList("a", "b"));
    assertThat(report.contains("b", "a")).isTrue();
  }

  @Test
  public void touchingEndsDoNotCount() {
    Edge first = edge("first", new Point(0, 0), new Point(100, 0));
    Edge second = edge("second", new Point(100, 0), new Point(100, 100));
    Edge third = edge("third", new Point(0, 0), new Point(0, -100));

    assertThat(detector.detect(Arrays.asList(first, second, third)).getCount()).isZero();
  }

  @Test
  public void countsEachPairOnce() {
    Edge zigzag = edge("zigzag", new Point(0, 0), new Point(0, 100), new Point(100, 100), new Point(100, 0));
    Edge line = edge("line", new Point(-50, 50), new Point(150, 50));

    CrossingReport report = detector.detect(Arrays.asList(zigzag, line));

    assertThat(report.getCount()).isEqualTo(1);
  }

  private Edge edge(String id, Point... points) {
    Edge edge = new Edge(id, EdgeKind.SEQUENCE_FLOW, id + "Source", id + "Target");
    edge.setWaypoints(Arrays.asList(points));
    return edge;
  }
}
