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
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.bpmnlayout.config.LaneStrategy;
import org.bpmnlayout.strategy.LayoutStrategy;

/**
 * Options of one layout invocation. Everything is optional; an empty instance lays out the whole
 * diagram with the strategy the selector recommends.
 */
public class LayoutOptions {

  protected LayoutStrategy layoutStrategy;
  protected LaneStrategy laneStrategy = LaneStrategy.PRESERVE;
  protected String scopeElementId;
  protected List<String> elementIds = new ArrayList<String>();
  protected Integer gridSnap;
  protected Boolean poolExpansion;
  protected boolean expandSubprocesses;
  protected boolean dryRun;

  public LayoutStrategy getLayoutStrategy() {
    return layoutStrategy;
  }

  /**
   * Forces a strategy instead of the recommended one.
   */
  public LayoutOptions setLayoutStrategy(LayoutStrategy layoutStrategy) {
    this.layoutStrategy = layoutStrategy;
    return this;
  }

  public LaneStrategy getLaneStrategy() {
    return laneStrategy;
  }

  public LayoutOptions setLaneStrategy(LaneStrategy laneStrategy) {
    this.laneStrategy = laneStrategy != null ? laneStrategy : LaneStrategy.PRESERVE;
    return this;
  }

  public String getScopeElementId() {
    return scopeElementId;
  }

  public LayoutOptions setScopeElementId(String scopeElementId) {
    this.scopeElementId = scopeElementId;
    return this;
  }

  public List<String> getElementIds() {
    return elementIds;
  }

  public LayoutOptions setElementIds(Collection<String> elementIds) {
    this.elementIds = new ArrayList<String>();
    if (elementIds != null) {
      this.elementIds.addAll(elementIds);
    }
    return this;
  }

  public LayoutOptions setElementIds(String... elementIds) {
    return setElementIds(Arrays.asList(elementIds));
  }

  public boolean isSubset() {
    return !elementIds.isEmpty();
  }

  public Integer getGridSnap() {
    return gridSnap;
  }

  public LayoutOptions setGridSnap(Integer gridSnap) {
    this.gridSnap = gridSnap;
    return this;
  }

  public Boolean getPoolExpansion() {
    return poolExpansion;
  }

  /**
   * Pools grow to fit their content unless this is explicitly set to false.
   */
  public boolean isPoolExpansion() {
    return poolExpansion == null || poolExpansion.booleanValue();
  }

  public LayoutOptions setPoolExpansion(Boolean poolExpansion) {
    this.poolExpansion = poolExpansion;
    return this;
  }

  public boolean isExpandSubprocesses() {
    return expandSubprocesses;
  }

  public LayoutOptions setExpandSubprocesses(boolean expandSubprocesses) {
    this.expandSubprocesses = expandSubprocesses;
    return this;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public LayoutOptions setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
    return this;
  }

  @Override
  public String toString() {
    return "LayoutOptions[strategy=" + layoutStrategy + ", lanes=" + laneStrategy + ", scope=" + scopeElementId
        + ", elements=" + elementIds + ", grid=" + gridSnap + ", dryRun=" + dryRun + "]";
  }
}
