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

package org.bpmnlayout.config;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How existing lane assignments influence lane ordering during lane compaction.
 */
public enum LaneStrategy {

  /** Lanes keep their declared order. */
  PRESERVE("preserve"),

  /** Lanes are reordered to bring lanes that exchange many flows next to each other. */
  OPTIMIZE("optimize");

  private final String id;

  LaneStrategy(String id) {
    this.id = id;
  }

  @JsonValue
  public String getId() {
    return id;
  }

  public static LaneStrategy fromId(String id) {
    for (LaneStrategy strategy : values()) {
      if (strategy.id.equalsIgnoreCase(id)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Could not resolve lane strategy: '" + id + "' is not one of preserve, optimize");
  }
}
