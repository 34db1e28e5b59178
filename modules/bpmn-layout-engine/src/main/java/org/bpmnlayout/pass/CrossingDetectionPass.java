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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CrossingDetectionPass implements LayoutPass {

  private static final Logger LOGGER = LoggerFactory.getLogger(CrossingDetectionPass.class);

  @Override
  public String getName() {
    return "crossing-detection";
  }

  @Override
  public void apply(LayoutContext context) {
    CrossingDetector detector = new CrossingDetector(context.getSettings().getOrthogonalTolerance());
    CrossingReport report = detector.detect(context.getDiagram().getEdges());
    context.setCrossings(report);
    LOGGER.debug("Found {} crossing(s) in diagram {}", report.getCount(), context.getDiagram().getId());
  }
}
