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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of {@link StrategySelector#recommend}.
 */
@JsonPropertyOrder({ "strategy", "reason", "confidence" })
public class StrategyRecommendation {

  protected LayoutStrategy strategy;
  protected String reason;
  protected Confidence confidence;
  protected DiagramStats stats;

  public StrategyRecommendation(LayoutStrategy strategy, String reason, Confidence confidence, DiagramStats stats) {
    this.strategy = strategy;
    this.reason = reason;
    this.confidence = confidence;
    this.stats = stats;
  }

  public LayoutStrategy getStrategy() {
    return strategy;
  }

  public String getReason() {
    return reason;
  }

  public Confidence getConfidence() {
    return confidence;
  }

  @JsonIgnore
  public DiagramStats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return strategy + " (" + confidence.getId() + "): " + reason;
  }
}
