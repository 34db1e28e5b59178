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

package org.bpmnlayout.strategy;

import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.model.Diagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recommends a layout strategy from the shape of a diagram. Never throws: an empty
 * diagram is a valid input.
 */
public class StrategySelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(StrategySelector.class);

  protected LayoutSettings settings;

  public StrategySelector(LayoutSettings settings) {
    this.settings = settings;
  }

  public StrategyRecommendation recommend(Diagram diagram, boolean subsetRequested) {
    DiagramStats stats = DiagramStats.of(diagram);
    StrategyRecommendation recommendation = recommend(stats, subsetRequested);
    LOGGER.debug("Diagram {}: {} -> {}", diagram.getId(), stats, recommendation);
    return recommendation;
  }

  protected StrategyRecommendation recommend(DiagramStats stats, boolean subsetRequested) {
    if (subsetRequested) {
      return new StrategyRecommendation(LayoutStrategy.SUBSET,
          "explicit element subset requested", Confidence.HIGH, stats);
    }
    if (stats.getFlowNodeCount() == 0) {
      return new StrategyRecommendation(LayoutStrategy.FULL,
          "empty diagram, nothing to lay out", Confidence.LOW, stats);
    }
    if (stats.getBoundaryEventCount() > 0) {
      return new StrategyRecommendation(LayoutStrategy.FULL,
          stats.getBoundaryEventCount() + " boundary event(s) attached to hosts", Confidence.MEDIUM, stats);
    }
    if (stats.getParticipantCount() >= 2) {
      return new StrategyRecommendation(LayoutStrategy.COLLABORATION,
          stats.getParticipantCount() + " participants with " + stats.getMessageFlowCount() + " message flow(s)",
          stats.getMessageFlowCount() > 0 ? Confidence.HIGH : Confidence.MEDIUM, stats);
    }
    if (stats.getLaneCount() >= 1) {
      return new StrategyRecommendation(LayoutStrategy.LANES,
          stats.getLaneCount() + " lane(s) in a single participant", Confidence.HIGH, stats);
    }
    if (stats.isTrivialShape(settings.getDeterministicMaxNodes())) {
      String shape = stats.getSplitCount() == 0 ? "linear chain" : "single split/merge";
      return new StrategyRecommendation(LayoutStrategy.DETERMINISTIC,
          shape + " of " + stats.getFlowNodeCount() + " node(s)", Confidence.HIGH, stats);
    }
    if (stats.isCyclic() || stats.getFlowNodeCount() > settings.getDeterministicMaxNodes()) {
      return new StrategyRecommendation(LayoutStrategy.FULL,
          stats.isCyclic() ? "cyclic process graph" : "too many nodes for the deterministic layout", Confidence.HIGH, stats);
    }
    return new StrategyRecommendation(LayoutStrategy.FULL,
        "branching structure beyond a single split/merge", Confidence.MEDIUM, stats);
  }
}
