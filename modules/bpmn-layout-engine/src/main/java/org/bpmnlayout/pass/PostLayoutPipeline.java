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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of post-layout passes.
 */
public class PostLayoutPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(PostLayoutPipeline.class);

  protected List<LayoutPass> passes = new ArrayList<LayoutPass>();

  public PostLayoutPipeline(List<LayoutPass> passes) {
    this.passes.addAll(passes);
  }

  /**
   * The standard pipeline: position propagation, gateway stacking, boundary events, artifacts, lanes,
   * connection routing, crossings, bundling, labels, grid, message flows, loopbacks and metrics.
   */
  public static PostLayoutPipeline standard() {
    List<LayoutPass> passes = new ArrayList<LayoutPass>();
    passes.add(new PositionPropagationPass());
    passes.add(new GatewayStackingPass());
    passes.add(new BoundaryEventPass());
    passes.add(new ArtifactPlacementPass());
    passes.add(new LaneCompactionPass());
    passes.add(new ConnectionRoutingPass());
    passes.add(new CrossingDetectionPass());
    passes.add(new ParallelFlowBundlingPass());
    passes.add(new LabelPlacementPass());
    passes.add(new GridSnapPass());
    passes.add(new MessageFlowRoutingPass());
    passes.add(new LoopbackRoutingPass());
    passes.add(new QualityMetricsPass());
    return new PostLayoutPipeline(passes);
  }

  /**
   * Returns a copy of this pipeline with {@code pass} inserted right after the first pass of the
   * given type.
   */
  public PostLayoutPipeline insertAfter(Class<? extends LayoutPass> type, LayoutPass pass) {
    List<LayoutPass> result = new ArrayList<LayoutPass>(passes);
    for (int i = 0; i < result.size(); i++) {
      if (type.isInstance(result.get(i))) {
        result.add(i + 1, pass);
        return new PostLayoutPipeline(result);
      }
    }
    throw new IllegalArgumentException("Could not insert pass " + pass.getName() + ": no pass of type " + type.getSimpleName());
  }

  public void run(LayoutContext context) {
    for (LayoutPass pass : passes) {
      LOGGER.debug("Running pass {} on diagram {}", pass.getName(), context.getDiagram().getId());
      pass.apply(context);
    }
  }

  public List<LayoutPass> getPasses() {
    return Collections.unmodifiableList(passes);
  }
}
