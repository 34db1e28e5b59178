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

import java.util.ArrayList;
import java.util.List;

import org.bpmnlayout.LayoutException;
import org.bpmnlayout.pass.CrossingReport;
import org.bpmnlayout.pass.LaneCrossingMetrics;
import org.bpmnlayout.pass.QualityMetrics;
import org.bpmnlayout.repair.DiRepairReport;
import org.bpmnlayout.strategy.LayoutStrategy;
import org.bpmnlayout.strategy.StrategyRecommendation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Diagnostics bundle returned with every layout. Absent, empty and zero-valued figures are left
 * out of the JSON rendering, except for the crossing count of a real layout.
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "strategy", "crossingFlows", "crossingFlowPairs", "qualityMetrics", "laneCrossingMetrics",
    "pinnedSkipped", "subprocessesExpanded", "diRepair", "recommendedStrategy" })
public class LayoutDiagnostics {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  protected LayoutStrategy strategy;
  protected CrossingReport crossings;
  protected QualityMetrics qualityMetrics;
  protected LaneCrossingMetrics laneCrossingMetrics;
  protected List<String> pinnedSkipped = new ArrayList<String>();
  protected int subprocessesExpanded;
  protected DiRepairReport diRepair;
  protected StrategyRecommendation recommendedStrategy;

  public LayoutStrategy getStrategy() {
    return strategy;
  }

  public void setStrategy(LayoutStrategy strategy) {
    this.strategy = strategy;
  }

  public Integer getCrossingFlows() {
    return crossings != null ? Integer.valueOf(crossings.getCount()) : null;
  }

  @JsonInclude(Include.NON_EMPTY)
  public List<List<String>> getCrossingFlowPairs() {
    return crossings != null ? crossings.getPairs() : null;
  }

  @JsonIgnore
  public CrossingReport getCrossings() {
    return crossings;
  }

  public void setCrossings(CrossingReport crossings) {
    this.crossings = crossings;
  }

  public QualityMetrics getQualityMetrics() {
    return qualityMetrics;
  }

  public void setQualityMetrics(QualityMetrics qualityMetrics) {
    this.qualityMetrics = qualityMetrics;
  }

  public LaneCrossingMetrics getLaneCrossingMetrics() {
    return laneCrossingMetrics;
  }

  public void setLaneCrossingMetrics(LaneCrossingMetrics laneCrossingMetrics) {
    this.laneCrossingMetrics = laneCrossingMetrics;
  }

  @JsonInclude(Include.NON_EMPTY)
  public List<String> getPinnedSkipped() {
    return pinnedSkipped;
  }

  public void setPinnedSkipped(List<String> pinnedSkipped) {
    this.pinnedSkipped = new ArrayList<String>(pinnedSkipped);
  }

  @JsonInclude(Include.NON_DEFAULT)
  public int getSubprocessesExpanded() {
    return subprocessesExpanded;
  }

  public void setSubprocessesExpanded(int subprocessesExpanded) {
    this.subprocessesExpanded = subprocessesExpanded;
  }

  /**
   * @return the repair counts, or {@code null} when nothing had to be repaired
   */
  public DiRepairReport getDiRepair() {
    return diRepair != null && !diRepair.isEmpty() ? diRepair : null;
  }

  public void setDiRepair(DiRepairReport diRepair) {
    this.diRepair = diRepair;
  }

  public StrategyRecommendation getRecommendedStrategy() {
    return recommendedStrategy;
  }

  public void setRecommendedStrategy(StrategyRecommendation recommendedStrategy) {
    this.recommendedStrategy = recommendedStrategy;
  }

  public String toJson() {
    try {
      return OBJECT_MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new LayoutException("Could not serialize layout diagnostics", e);
    }
  }

  @Override
  public String toString() {
    return "LayoutDiagnostics[strategy=" + strategy + ", crossings=" + getCrossingFlows() + ", quality=" + qualityMetrics + "]";
  }
}
