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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.bpmnlayout.config.LaneStrategy;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.graph.HappyPath;
import org.bpmnlayout.graph.LayoutNode;
import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.routing.ConnectionRouter;

/**
 * State threaded through the post-layout passes of one layout invocation: the diagram being
 * laid out, the settings and options in effect, the pinned elements and the optional scope.
 * Passes also leave their results here (happy path, crossings, metrics).
 */
public class LayoutContext {

  protected Diagram diagram;
  protected LayoutSettings settings;
  protected ConnectionRouter router;

  protected LayoutNode layoutGraph;
  protected double originX;
  protected double originY;

  // null means the whole diagram
  protected Set<String> scope;
  protected Set<String> pinned = Collections.emptySet();
  protected List<String> pinnedSkipped = new ArrayList<String>();

  protected Integer gridSnap;
  protected boolean poolExpansion = true;
  protected LaneStrategy laneStrategy = LaneStrategy.PRESERVE;

  protected HappyPath happyPath;
  protected CrossingReport crossings;
  protected LaneCrossingMetrics laneCrossingMetrics;
  protected QualityMetrics qualityMetrics;

  public LayoutContext(Diagram diagram, LayoutSettings settings, ConnectionRouter router) {
    this.diagram = diagram;
    this.settings = settings;
    this.router = router;
    this.originX = settings.getOriginX();
    this.originY = settings.getOriginY();
  }

  public boolean isScoped() {
    return scope != null;
  }

  public boolean isInScope(String elementId) {
    return scope == null || scope.contains(elementId);
  }

  public boolean isPinned(String elementId) {
    return pinned.contains(elementId);
  }

  /**
   * True when a pass may change the geometry of the element.
   */
  public boolean isMovable(String elementId) {
    return isInScope(elementId) && !isPinned(elementId);
  }

  /**
   * An edge is in scope when one of its endpoints is.
   */
  public boolean isInScope(Edge edge) {
    return scope == null || scope.contains(edge.getSourceId()) || scope.contains(edge.getTargetId());
  }

  public Diagram getDiagram() {
    return diagram;
  }

  public LayoutSettings getSettings() {
    return settings;
  }

  public ConnectionRouter getRouter() {
    return router;
  }

  public LayoutNode getLayoutGraph() {
    return layoutGraph;
  }

  public void setLayoutGraph(LayoutNode layoutGraph) {
    this.layoutGraph = layoutGraph;
  }

  public double getOriginX() {
    return originX;
  }

  public double getOriginY() {
    return originY;
  }

  public void setOrigin(double originX, double originY) {
    this.originX = originX;
    this.originY = originY;
  }

  public Set<String> getScope() {
    return scope;
  }

  public void setScope(Collection<String> scope) {
    this.scope = scope != null ? new HashSet<String>(scope) : null;
  }

  public Set<String> getPinned() {
    return pinned;
  }

  public void setPinned(Set<String> pinned) {
    this.pinned = pinned != null ? pinned : Collections.<String>emptySet();
  }

  /**
   * Requested elements left untouched because they are pinned.
   */
  public List<String> getPinnedSkipped() {
    return pinnedSkipped;
  }

  public void setPinnedSkipped(List<String> pinnedSkipped) {
    this.pinnedSkipped = new ArrayList<String>(pinnedSkipped);
  }

  public Integer getGridSnap() {
    return gridSnap;
  }

  public void setGridSnap(Integer gridSnap) {
    this.gridSnap = gridSnap;
  }

  public boolean isPoolExpansion() {
    return poolExpansion;
  }

  public void setPoolExpansion(boolean poolExpansion) {
    this.poolExpansion = poolExpansion;
  }

  public LaneStrategy getLaneStrategy() {
    return laneStrategy;
  }

  public void setLaneStrategy(LaneStrategy laneStrategy) {
    this.laneStrategy = laneStrategy;
  }

  public HappyPath getHappyPath() {
    return happyPath;
  }

  public void setHappyPath(HappyPath happyPath) {
    this.happyPath = happyPath;
  }

  public CrossingReport getCrossings() {
    return crossings;
  }

  public void setCrossings(CrossingReport crossings) {
    this.crossings = crossings;
  }

  public LaneCrossingMetrics getLaneCrossingMetrics() {
    return laneCrossingMetrics;
  }

  public void setLaneCrossingMetrics(LaneCrossingMetrics laneCrossingMetrics) {
    this.laneCrossingMetrics = laneCrossingMetrics;
  }

  public QualityMetrics getQualityMetrics() {
    return qualityMetrics;
  }

  public void setQualityMetrics(QualityMetrics qualityMetrics) {
    this.qualityMetrics = qualityMetrics;
  }
}
