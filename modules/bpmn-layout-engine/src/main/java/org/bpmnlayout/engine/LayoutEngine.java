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

import java.util.List;

import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.graph.DeterministicLayout;
import org.bpmnlayout.graph.HierarchicalLayoutAlgorithm;
import org.bpmnlayout.graph.LayeredLayoutAlgorithm;
import org.bpmnlayout.graph.LayoutGraphBuilder;
import org.bpmnlayout.graph.LayoutNode;
import org.bpmnlayout.graph.SubprocessExpander;
import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.incremental.PartialLayout;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.pass.CrossingDetector;
import org.bpmnlayout.pass.LaneCrossingMetrics;
import org.bpmnlayout.pass.LayoutContext;
import org.bpmnlayout.pass.PostLayoutPipeline;
import org.bpmnlayout.pass.QualityMetricsPass;
import org.bpmnlayout.repair.DiRepair;
import org.bpmnlayout.repair.DiRepairReport;
import org.bpmnlayout.routing.ConnectionRouter;
import org.bpmnlayout.routing.ManhattanConnectionRouter;
import org.bpmnlayout.strategy.LayoutStrategy;
import org.bpmnlayout.strategy.StrategyRecommendation;
import org.bpmnlayout.strategy.StrategySelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one layout invocation on a diagram:
 * <ol>
 * <li>validation of the request, nothing is changed when it is rejected</li>
 * <li>subprocess expansion (when requested) and interchange repair</li>
 * <li>strategy selection, unless a strategy is forced</li>
 * <li>placement: deterministic shortcut, layered algorithm, or partial/scoped layout</li>
 * <li>post-layout passes and diagnostics</li>
 * </ol>
 * A dry run only asks the strategy selector. When the invocation fails after validation, the
 * diagram and its layout state are restored.
 */
public class LayoutEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutEngine.class);

  protected LayoutSettings settings;
  protected LayeredLayoutAlgorithm algorithm;
  protected ConnectionRouter router;

  public LayoutEngine() {
    this(new LayoutSettings());
  }

  public LayoutEngine(LayoutSettings settings) {
    this(settings, new HierarchicalLayoutAlgorithm(settings), new ManhattanConnectionRouter(settings));
  }

  public LayoutEngine(LayoutSettings settings, LayeredLayoutAlgorithm algorithm, ConnectionRouter router) {
    this.settings = settings;
    this.algorithm = algorithm;
    this.router = router;
  }

  public LayoutResult layout(Diagram diagram, DiagramLayoutState state, LayoutOptions options) {
    validate(diagram, options);

    StrategySelector selector = new StrategySelector(settings);
    if (options.isDryRun()) {
      StrategyRecommendation recommendation = selector.recommend(diagram, options.isSubset());
      LOGGER.debug("Dry run on diagram {}: {}", diagram.getId(), recommendation);
      LayoutDiagnostics diagnostics = new LayoutDiagnostics();
      diagnostics.setRecommendedStrategy(recommendation);
      return new LayoutResult(diagram.getId(), null, diagnostics);
    }

    Diagram before = diagram.copy();
    DiagramLayoutState stateBefore = state.copy();
    try {
      return run(diagram, state, options, selector, before);
    } catch (RuntimeException e) {
      diagram.restore(before);
      state.restore(stateBefore);
      throw e;
    }
  }

  protected LayoutResult run(Diagram diagram, DiagramLayoutState state, LayoutOptions options,
      StrategySelector selector, Diagram before) {
    LayoutDiagnostics diagnostics = new LayoutDiagnostics();
    if (options.isExpandSubprocesses()) {
      diagnostics.setSubprocessesExpanded(new SubprocessExpander(settings).expand(diagram));
    }
    DiRepairReport repair = new DiRepair(settings).repair(diagram);
    diagnostics.setDiRepair(repair);

    StrategyRecommendation recommendation = selector.recommend(diagram, options.isSubset());
    LayoutStrategy strategy = options.isSubset() ? LayoutStrategy.SUBSET
        : options.getLayoutStrategy() != null ? options.getLayoutStrategy() : recommendation.getStrategy();
    LOGGER.debug("Strategy for diagram {}: {} (recommended {})", diagram.getId(), strategy, recommendation);

    boolean full = !options.isSubset() && options.getScopeElementId() == null;
    if (full) {
      state.clearPins();
    }

    LayoutContext context = new LayoutContext(diagram, settings, router);
    context.setGridSnap(options.getGridSnap());
    context.setPoolExpansion(options.isPoolExpansion());
    context.setLaneStrategy(options.getLaneStrategy());
    context.setPinned(state.getPinnedIds());

    PartialLayout partialLayout = new PartialLayout(settings, algorithm);
    if (options.isSubset()) {
      partialLayout.layoutSubset(context, options.getElementIds());
    } else if (options.getScopeElementId() != null) {
      partialLayout.layoutScope(context, options.getScopeElementId());
    } else if (strategy == LayoutStrategy.DETERMINISTIC) {
      new DeterministicLayout(settings).layout(diagram);
      PostLayoutPipeline.standard().run(context);
    } else {
      LayoutNode graph = new LayoutGraphBuilder(settings).build(diagram, null);
      algorithm.layout(graph);
      context.setLayoutGraph(graph);
      PostLayoutPipeline.standard().run(context);
    }

    diagnostics.setStrategy(strategy);
    diagnostics.setPinnedSkipped(context.getPinnedSkipped());
    diagnostics.setCrossings(new CrossingDetector(settings.getOrthogonalTolerance()).detect(diagram.getEdges()));
    diagnostics.setQualityMetrics(QualityMetricsPass.compute(diagram, settings.getOrthogonalTolerance()));
    diagnostics.setLaneCrossingMetrics(LaneCrossingMetrics.compute(diagram));

    LayoutResult result = LayoutResult.compare(before, diagram, strategy, diagnostics);
    LOGGER.info("Laid out diagram {} with strategy {}: {} shape(s) and {} edge(s) changed, {} crossing(s)",
        diagram.getId(), strategy, result.getShapeDeltas().size(), result.getEdgeWaypoints().size(),
        diagnostics.getCrossingFlows());
    return result;
  }

  protected void validate(Diagram diagram, LayoutOptions options) {
    if (options.isSubset() && options.getScopeElementId() != null) {
      throw new InvalidLayoutRequestException("Could not lay out diagram '" + diagram.getId()
          + "': a scope element and an element subset cannot be combined");
    }
    if (options.getLayoutStrategy() == LayoutStrategy.SUBSET && !options.isSubset()) {
      throw new InvalidLayoutRequestException("Could not lay out diagram '" + diagram.getId()
          + "': strategy " + LayoutStrategy.SUBSET + " needs element ids");
    }
    if (options.getGridSnap() != null && options.getGridSnap().intValue() <= 0) {
      throw new InvalidLayoutRequestException("Could not lay out diagram '" + diagram.getId()
          + "': grid pitch " + options.getGridSnap() + " is not positive");
    }
    if (options.getScopeElementId() != null) {
      PartialLayout.validateScope(diagram, options.getScopeElementId());
    }
    List<String> elementIds = options.getElementIds();
    if (!elementIds.isEmpty()) {
      PartialLayout.validateSubset(diagram, elementIds);
    }
  }

  public LayoutSettings getSettings() {
    return settings;
  }

  public ConnectionRouter getRouter() {
    return router;
  }
}
