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

import static org.assertj.core.api.Assertions.assertThat;

import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Point;
import org.junit.jupiter.api.Test;

public class RouteTemplatesTest {

  private final Bounds source = new Bounds(100, 100, 100, 80);

  @Test
  public void simpleRouteIsStraightOnTheSameRow() {
    assertThat(RouteTemplates.simple(source, new Bounds(300, 110, 100, 80)))
        .containsExactly(new Point(200, 140), new Point(300, 140));
  }

  @Test
  public void simpleRouteTurnsOnceBetweenRows() {
    assertThat(RouteTemplates.simple(source, new Bounds(300, 300, 100, 80)))
        .containsExactly(new Point(200, 140), new Point(350, 140), new Point(350, 300));
  }

  @Test
  public void simpleRouteGoesStraightDownBetweenStackedShapes() {
    assertThat(RouteTemplates.simple(source, new Bounds(120, 300, 100, 80)))
        .containsExactly(new Point(150, 180), new Point(150, 300));
  }

  @Test
  public void forwardRouteBendsInTheMiddleOfTheGap() {
    assertThat(RouteTemplates.forward(source, new Bounds(300, 300, 100, 80), 15)).containsExactly(
        new Point(200, 140), new Point(250, 140), new Point(250, 340), new Point(300, 340));
  }
}
