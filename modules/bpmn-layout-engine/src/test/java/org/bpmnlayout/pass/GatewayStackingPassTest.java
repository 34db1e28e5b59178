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

import java.util.Collections;

import org.bpmnlayout.DiagramFixtures;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Diagram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GatewayStackingPassTest {

  private Diagram diagram;
  private LayoutContext context;

  @BeforeEach
  public void placeBranchesOnTopOfEachOther() {
    diagram = DiagramFixtures.splitMerge("stacking");
    diagram.setBounds("start", 100, 122, 36, 36);
    diagram.setBounds("split", 200, 115, 50, 50);
    diagram.setBounds("a", 300, 100, 100, 80);
    diagram.setBounds("b", 300, 100, 100, 80);
    diagram.setBounds("merge", 450, 115, 50, 50);
    diagram.setBounds("end", 550, 122, 36, 36);
    context = new LayoutContext(diagram, new LayoutSettings(), null);
  }

  @Test
  public void keepsTheDefaultBranchAndMovesTheOtherBelowIt() {
    new GatewayStackingPass().apply(context);

    assertThat(diagram.getBounds("b").getY()).isEqualTo(100);
    assertThat(diagram.getBounds("a").getY()).isEqualTo(230);
    assertThat(diagram.getBounds("a").getX()).isEqualTo(300);
    assertThat(diagram.getBounds("merge").getY()).isEqualTo(115);
  }

  @Test
  public void recordsTheHappyPath() {
    new GatewayStackingPass().apply(context);

    assertThat(context.getHappyPath().containsEdge("toB")).isTrue();
    assertThat(context.getHappyPath().containsNode("a")).isFalse();
  }

  @Test
  public void leavesPinnedBranchesAlone() {
    context.setPinned(Collections.singleton("a"));

    new GatewayStackingPass().apply(context);

    assertThat(diagram.getBounds("a").getY()).isEqualTo(100);
  }
}
