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

package org.bpmnlayout.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bpmnlayout.LayoutAlgorithmException;
import org.bpmnlayout.config.LayoutSettings;
import org.junit.jupiter.api.Test;

public class HierarchicalLayoutAlgorithmTest {

  private final HierarchicalLayoutAlgorithm algorithm = new HierarchicalLayoutAlgorithm(new LayoutSettings());

  @Test
  public void laysOutAChainFromLeftToRight() {
    LayoutNode root = new LayoutNode(LayoutGraphBuilder.ROOT_ID, 0, 0);
    LayoutNode start = root.addChild(new LayoutNode("start", 36, 36));
    LayoutNode task = root.addChild(new LayoutNode("task", 100, 80));
    LayoutNode end = root.addChild(new LayoutNode("end", 36, 36));
    root.addEdge(new LayoutEdge("e1", "e1", "start", "task", false));
    root.addEdge(new LayoutEdge("e2", "e2", "task", "end", false));

    algorithm.layout(root);

    assertThat(task.getX()).isGreaterThanOrEqualTo(start.getX() + start.getWidth());
    assertThat(end.getX()).isGreaterThanOrEqualTo(task.getX() + task.getWidth());
  }

  @Test
  public void growsCompoundsAroundTheirChildren() {
    LayoutNode root = new LayoutNode(LayoutGraphBuilder.ROOT_ID, 0, 0);
    LayoutNode subProcess = root.addChild(LayoutNode.compound("sub", 10, 10, 40));
    subProcess.addChild(new LayoutNode("inner1", 100, 80));
    subProcess.addChild(new LayoutNode("inner2", 100, 80));
    subProcess.addEdge(new LayoutEdge("inner", "inner", "inner1", "inner2", false));

    algorithm.layout(root);

    assertThat(subProcess.getWidth()).isGreaterThanOrEqualTo(200);
    assertThat(subProcess.getHeight()).isGreaterThanOrEqualTo(80);
  }

  @Test
  public void rejectsDuplicateNodes() {
    LayoutNode root = new LayoutNode(LayoutGraphBuilder.ROOT_ID, 0, 0);
    root.addChild(new LayoutNode("task", 100, 80));
    root.addChild(new LayoutNode("task", 100, 80));

    assertThatThrownBy(() -> algorithm.layout(root))
        .isInstanceOf(LayoutAlgorithmException.class)
        .hasMessageContaining("'task'");
  }

  @Test
  public void rejectsLeavesWithoutSize() {
    LayoutNode root = new LayoutNode(LayoutGraphBuilder.ROOT_ID, 0, 0);
    root.addChild(new LayoutNode("task", 0, 80));

    assertThatThrownBy(() -> algorithm.layout(root)).isInstanceOf(LayoutAlgorithmException.class);
  }

  @Test
  public void rejectsEdgesToUnknownNodes() {
    LayoutNode root = new LayoutNode(LayoutGraphBuilder.ROOT_ID, 0, 0);
    root.addChild(new LayoutNode("task", 100, 80));
    root.addEdge(new LayoutEdge("dangling", "dangling", "task", "nowhere", false));

    assertThatThrownBy(() -> algorithm.layout(root))
        .isInstanceOf(LayoutAlgorithmException.class)
        .hasMessageContaining("'dangling'");
  }
}
