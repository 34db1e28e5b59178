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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Readability figures of a laid out diagram. The element density maps each lane name (or
 * {@code total} when there are no lanes) to the number of flow nodes it holds.
 */
@JsonPropertyOrder({ "orthogonalFlowPercent", "avgBendCount", "avgFlowLength", "elementDensity" })
public class QualityMetrics {

  protected int orthogonalFlowPercent;
  protected double avgBendCount;
  protected int avgFlowLength;
  protected Map<String, Integer> elementDensity = new LinkedHashMap<String, Integer>();

  public QualityMetrics(int orthogonalFlowPercent, double avgBendCount, int avgFlowLength, Map<String, Integer> elementDensity) {
    this.orthogonalFlowPercent = orthogonalFlowPercent;
    this.avgBendCount = avgBendCount;
    this.avgFlowLength = avgFlowLength;
    this.elementDensity.putAll(elementDensity);
  }

  public int getOrthogonalFlowPercent() {
    return orthogonalFlowPercent;
  }

  public double getAvgBendCount() {
    return avgBendCount;
  }

  public int getAvgFlowLength() {
    return avgFlowLength;
  }

  public Map<String, Integer> getElementDensity() {
    return Collections.unmodifiableMap(elementDensity);
  }

  @Override
  public String toString() {
    return "QualityMetrics[orthogonal " + orthogonalFlowPercent + "%, bends " + avgBendCount + ", length " + avgFlowLength + "]";
  }
}
