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

package org.bpmnlayout.repair;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Counts of the diagram interchange fixes applied before a layout.
 */
@JsonPropertyOrder({ "shapesSynthesized", "edgesRepaired", "duplicatesRemoved" })
public class DiRepairReport {

  protected int shapesSynthesized;
  protected int edgesRepaired;
  protected int duplicatesRemoved;

  public DiRepairReport(int shapesSynthesized, int edgesRepaired, int duplicatesRemoved) {
    this.shapesSynthesized = shapesSynthesized;
    this.edgesRepaired = edgesRepaired;
    this.duplicatesRemoved = duplicatesRemoved;
  }

  public int getShapesSynthesized() {
    return shapesSynthesized;
  }

  public int getEdgesRepaired() {
    return edgesRepaired;
  }

  public int getDuplicatesRemoved() {
    return duplicatesRemoved;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return shapesSynthesized == 0 && edgesRepaired == 0 && duplicatesRemoved == 0;
  }

  @Override
  public String toString() {
    return "DiRepairReport[shapes " + shapesSynthesized + ", edges " + edgesRepaired + ", duplicates " + duplicatesRemoved + "]";
  }
}
