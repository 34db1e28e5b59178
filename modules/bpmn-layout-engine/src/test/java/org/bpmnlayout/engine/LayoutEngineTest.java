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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.bpmnlayout.DiagramFixtures;
import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.LayoutAlgorithmException;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.graph.LayeredLayoutAlgorithm;
import org.bpmnlayout.graph.LayoutNode;
import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.model.Bounds;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.ElementKind;
import org.bpmnlayout.model.FlowNode;
import org.bpmnlayout.model.Point;
import org.bpmnlayout.model.Shape;
import org.bpmnlayout.routing.ManhattanConnectionRouter;
import org.bpmnlayout.strategy.LayoutStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LayoutEngineTest {

  private final LayoutSettings settings = new LayoutSettings();
  private LayoutEngine engine;
  private DiagramLayoutState state;

  @BeforeEach
  public void createEngine() {
    engine = new LayoutEngine(settings);
    state = new DiagramLayoutState();
  }

  @Test
  public void chainIsLaidOutDeterministicallyFromLeftToRight() {
    Diagram diagram = DiagramFixtures.chain("chain", 2);

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions());

    assertThat(result.getStrategy()).isEqualTo(LayoutStrategy.DETERMINISTIC);
    assertThat(result.isDryRun()).isFalse();
    String[] order = { "start", "task1", "task2", "end" };
    for (int i = 1; i < order.length; i++) {
      Bounds previous = diagram.getBounds(order[i - 1]);
      Bounds current = diagram.getBounds(order[i]);
      assertThat(current.getX()).isGreaterThan(previous.getRight());
      assertThat(Math.abs(current.getCenterY() - previous.getCenterY())).isLessThanOrEqualTo(50);
    }
    assertThat(result.getShapeDeltas()).containsKeys(order);
    assertThat(result.getShapeDeltas().get("start").isCreated()).isTrue();
    assertThat(result.getDiagnostics().getCrossingFlows()).isZero();
    assertThat(result.getDiagnostics().getDiRepair().getShapesSynthesized()).isEqualTo(4);
    assertGeometryIsSound(diagram);
  }

  @Test
  public void secondLayoutChangesNothing() {
    Diagram diagram = DiagramFixtures.chain("chain", 3);
    engine.layout(diagram, state, new LayoutOptions());

    LayoutResult second = engine.layout(diagram, state, new LayoutOptions());

    assertThat(second.getShapeDeltas()).isEmpty();
    assertThat(second.getEdgeWaypoints()).isEmpty();
    assertThat(second.getDiagnostics().getDiRepair()).isNull();
  }

  @Test
  public void fullLayoutOfBranchesKeepsRoutesOrthogonal() {
    Diagram diagram = DiagramFixtures.splitMerge("branches");

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions().setLayoutStrategy(LayoutStrategy.FULL));

    assertThat(result.getStrategy()).isEqualTo(LayoutStrategy.FULL);
    assertThat(result.getDiagnostics().getRecommendedStrategy()).isNull();
    assertGeometryIsSound(diagram);
    assertThat(diagram.getBounds("end").getX()).isGreaterThan(diagram.getBounds("start").getRight());
  }

  @Test
  public void dryRunOnlyRecommends() {
    Diagram diagram = DiagramFixtures.chain("dry", 2);

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions().setDryRun(true));

    assertThat(result.isDryRun()).isTrue();
    assertThat(result.getDiagnostics().getRecommendedStrategy().getStrategy()).isEqualTo(LayoutStrategy.DETERMINISTIC);
    assertThat(result.getShapeDeltas()).isEmpty();
    assertThat(diagram.getPlane()).isEmpty();
  }

  @Test
  public void fullLayoutClearsPins() {
    Diagram diagram = DiagramFixtures.chain("pins", 1);
    state.pin("task1");

    engine.layout(diagram, state, new LayoutOptions());

    assertThat(state.getPinnedIds()).isEmpty();
  }

  @Test
  public void subsetLayoutHonorsPins() {
    Diagram diagram = DiagramFixtures.chain("subset", 2);
    engine.layout(diagram, state, new LayoutOptions());
    state.pin("task1");
    Bounds pinned = diagram.getBounds("task1").copy();

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions().setElementIds("task1", "task2"));

    assertThat(result.getStrategy()).isEqualTo(LayoutStrategy.SUBSET);
    assertThat(result.getDiagnostics().getPinnedSkipped()).containsExactly("task1");
    assertThat(diagram.getBounds("task1").getX()).isEqualTo(pinned.getX());
    assertThat(diagram.getBounds("task1").getY()).isEqualTo(pinned.getY());
    assertThat(state.isPinned("task1")).isTrue();
  }

  @Test
  public void gridSnapAlignsShapes() {
    Diagram diagram = DiagramFixtures.chain("grid", 2);

    engine.layout(diagram, state, new LayoutOptions().setGridSnap(25));

    for (Shape shape : diagram.getPlane()) {
      assertThat(shape.getBounds().getX() % 25).as(shape.getElementId()).isZero();
      assertThat(shape.getBounds().getY() % 25).as(shape.getElementId()).isZero();
    }
    assertGeometryIsSound(diagram);
  }

  @Test
  public void gridSnappedBranchesStayApart() {
    Diagram diagram = DiagramFixtures.splitMerge("grid-branches");

    engine.layout(diagram, state, new LayoutOptions().setLayoutStrategy(LayoutStrategy.FULL).setGridSnap(20));

    assertGeometryIsSound(diagram);
  }

  @Test
  public void rejectedRequestsChangeNothing() {
    Diagram diagram = DiagramFixtures.chain("invalid", 1);

    assertThatThrownBy(() -> engine.layout(diagram, state, new LayoutOptions().setScopeElementId("task1")))
        .isInstanceOf(InvalidLayoutRequestException.class)
        .hasMessageContaining("'task1'");
    assertThatThrownBy(() -> engine.layout(diagram, state, new LayoutOptions().setElementIds("task1", "ghost")))
        .isInstanceOf(InvalidLayoutRequestException.class)
        .hasMessageContaining("ghost");
    assertThatThrownBy(() -> engine.layout(diagram, state, new LayoutOptions().setLayoutStrategy(LayoutStrategy.SUBSET)))
        .isInstanceOf(InvalidLayoutRequestException.class);
    assertThatThrownBy(() -> engine.layout(diagram, state, new LayoutOptions().setGridSnap(0)))
        .isInstanceOf(InvalidLayoutRequestException.class);
    assertThatThrownBy(() -> engine.layout(diagram, state,
        new LayoutOptions().setScopeElementId("pool").setElementIds("task1")))
        .isInstanceOf(InvalidLayoutRequestException.class);

    assertThat(diagram.getPlane()).isEmpty();
  }

  @Test
  public void failedAlgorithmRestoresDiagramAndPins() {
    LayeredLayoutAlgorithm failing = new LayeredLayoutAlgorithm() {
      @Override
      public void layout(LayoutNode root) {
        throw new LayoutAlgorithmException("Could not lay out graph: broken");
      }
    };
    LayoutEngine broken = new LayoutEngine(settings, failing, new ManhattanConnectionRouter(settings));
    Diagram diagram = DiagramFixtures.chain("broken", 1);
    state.pin("task1");

    assertThatThrownBy(() -> broken.layout(diagram, state, new LayoutOptions().setLayoutStrategy(LayoutStrategy.FULL)))
        .isInstanceOf(LayoutAlgorithmException.class);

    assertThat(diagram.getPlane()).isEmpty();
    assertThat(diagram.getEdge("f1").getWaypoints()).isEmpty();
    assertThat(state.isPinned("task1")).isTrue();
  }

  @Test
  public void diagnosticsJsonLeavesOutAbsentFigures() {
    Diagram diagram = DiagramFixtures.chain("json", 1);

    String json = engine.layout(diagram, state, new LayoutOptions()).getDiagnostics().toJson();

    assertThat(json).contains("\"strategy\":\"deterministic\"");
    assertThat(json).contains("\"crossingFlows\":0");
    assertThat(json).contains("\"qualityMetrics\"");
    assertThat(json).doesNotContain("laneCrossingMetrics");
    assertThat(json).doesNotContain("pinnedSkipped");
    assertThat(json).doesNotContain("subprocessesExpanded");
  }

  @Test
  public void lanesKeepTheirNodesAndReportCoherence() {
    Diagram diagram = DiagramFixtures.twoLanePool("lanes");

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions());

    Bounds lane1 = diagram.getBounds("lane1");
    for (String id : new String[] { "start", "task1", "task2", "end" }) {
      Bounds node = diagram.getBounds(id);
      assertThat(node.getY()).as(id).isGreaterThanOrEqualTo(lane1.getY());
      assertThat(node.getBottom()).as(id).isLessThanOrEqualTo(lane1.getBottom());
    }
    assertThat(result.getDiagnostics().getLaneCrossingMetrics().getLaneCoherenceScore()).isEqualTo(100);
    assertThat(result.getDiagnostics().toJson()).contains("\"laneCrossingMetrics\"");
    assertGeometryIsSound(diagram);
  }

  @Test
  public void dryRunDiagnosticsRenderAsJson() {
    Diagram diagram = DiagramFixtures.chain("dry-json", 2);

    String json = engine.layout(diagram, state, new LayoutOptions().setDryRun(true)).getDiagnostics().toJson();

    assertThat(json).contains("\"recommendedStrategy\"");
    assertThat(json).contains("\"deterministic\"");
  }

  @Test
  public void parallelBackwardFlowsAreLaidOut() {
    Diagram diagram = DiagramFixtures.chain("retries", 2);
    DiagramFixtures.flow(diagram, "back1", "task2", "task1");
    DiagramFixtures.flow(diagram, "back2", "task2", "task1");

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions().setLayoutStrategy(LayoutStrategy.FULL));

    assertThat(result.getStrategy()).isEqualTo(LayoutStrategy.FULL);
    assertThat(diagram.getBounds("task2").getX()).isGreaterThan(diagram.getBounds("task1").getRight());
    assertThat(diagram.getEdge("back1").getWaypoints()).isNotEqualTo(diagram.getEdge("back2").getWaypoints());
    assertGeometryIsSound(diagram);
  }

  @Test
  public void exceptionPathOfABoundaryEventDoesNotOverlapTheProcess() {
    Diagram diagram = DiagramFixtures.chain("exception", 2);
    diagram.addNode(new FlowNode("timeout", ElementKind.BOUNDARY_EVENT).setAttachedToId("task1"));
    DiagramFixtures.node(diagram, "escalate", ElementKind.TASK);
    DiagramFixtures.node(diagram, "escalated", ElementKind.END_EVENT);
    DiagramFixtures.flow(diagram, "toEscalate", "timeout", "escalate");
    DiagramFixtures.flow(diagram, "toEscalated", "escalate", "escalated");

    engine.layout(diagram, state, new LayoutOptions().setLayoutStrategy(LayoutStrategy.FULL));

    Bounds host = diagram.getBounds("task1");
    Bounds timeout = diagram.getBounds("timeout");
    assertThat(timeout.getCenterX()).isBetween(host.getX(), host.getRight());
    assertThat(timeout.getCenterY()).isIn(host.getY(), host.getBottom());
    assertGeometryIsSound(diagram);
  }

  @Test
  public void collaborationKeepsLoopbackInsideItsPool() {
    Diagram diagram = collaboration();

    LayoutResult result = engine.layout(diagram, state, new LayoutOptions());

    assertThat(result.getStrategy()).isEqualTo(LayoutStrategy.COLLABORATION);
    Bounds customer = diagram.getBounds("customer");
    Bounds shop = diagram.getBounds("shop");
    assertThat(shop.getY()).isGreaterThanOrEqualTo(customer.getBottom());
    for (String id : new String[] { "start", "request", "review", "end" }) {
      assertThat(customer.contains(diagram.getBounds(id), 0)).as(id).isTrue();
    }
    assertThat(shop.contains(diagram.getBounds("receive"), 0)).isTrue();
    for (Point point : diagram.getEdge("rework").getWaypoints()) {
      assertThat(point.getX()).as("rework").isBetween(customer.getX(), customer.getRight());
      assertThat(point.getY()).as("rework").isBetween(customer.getY(), customer.getBottom());
    }
    assertGeometryIsSound(diagram);
  }

  /**
   * Customer pool with a review loop sending a message to a shop pool.
   */
  private Diagram collaboration() {
    Diagram diagram = new Diagram("collaboration");
    DiagramFixtures.pool(diagram, "customer", 100, 100, 800, 250);
    DiagramFixtures.pool(diagram, "shop", 100, 400, 800, 200);
    ElementKind[] kinds = { ElementKind.START_EVENT, ElementKind.TASK, ElementKind.TASK, ElementKind.END_EVENT };
    String[] ids = { "start", "request", "review", "end" };
    for (int i = 0; i < ids.length; i++) {
      diagram.addNode(new FlowNode(ids[i], kinds[i]).setName(ids[i]).setParentId("customer"));
    }
    diagram.addNode(new FlowNode("receive", ElementKind.TASK).setName("receive").setParentId("shop"));
    DiagramFixtures.flow(diagram, "f1", "start", "request");
    DiagramFixtures.flow(diagram, "f2", "request", "review");
    DiagramFixtures.flow(diagram, "f3", "review", "end");
    DiagramFixtures.flow(diagram, "rework", "review", "request");
    DiagramFixtures.messageFlow(diagram, "order", "request", "receive");
    return diagram;
  }

  private void assertGeometryIsSound(Diagram diagram) {
    for (Shape shape : diagram.getPlane()) {
      assertThat(shape.getBounds().getWidth()).as(shape.getElementId()).isPositive();
      assertThat(shape.getBounds().getHeight()).as(shape.getElementId()).isPositive();
    }
    List<FlowNode> leaves = new ArrayList<FlowNode>();
    for (FlowNode node : diagram.getNodes()) {
      if (!node.isBoundaryEvent() && diagram.getContainer(node.getId()) == null && diagram.getBounds(node.getId()) != null) {
        leaves.add(node);
      }
    }
    for (int i = 0; i < leaves.size(); i++) {
      for (int j = i + 1; j < leaves.size(); j++) {
        FlowNode a = leaves.get(i);
        FlowNode b = leaves.get(j);
        boolean siblings = a.getParentId() == null ? b.getParentId() == null : a.getParentId().equals(b.getParentId());
        if (siblings) {
          assertThat(diagram.getBounds(a.getId()).intersects(diagram.getBounds(b.getId())))
              .as(a.getId() + " overlaps " + b.getId()).isFalse();
        }
      }
    }
    for (Edge edge : diagram.getEdges()) {
      List<Point> points = edge.getWaypoints();
      assertThat(points.size()).as(edge.getId()).isGreaterThanOrEqualTo(2);
      for (int i = 0; i + 1 < points.size(); i++) {
        Point a = points.get(i);
        Point b = points.get(i + 1);
        boolean axisAligned = Math.abs(a.getX() - b.getX()) <= settings.getOrthogonalTolerance()
            || Math.abs(a.getY() - b.getY()) <= settings.getOrthogonalTolerance();
        assertThat(axisAligned).as(edge.getId() + " segment " + i).isTrue();
      }
    }
  }
}
