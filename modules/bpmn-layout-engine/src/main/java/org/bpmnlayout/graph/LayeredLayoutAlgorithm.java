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

package org.bpmnlayout.graph;

/**
 * A layered graph-drawing algorithm.
 * <p>
 * Implementations compute, in place, the position of every node of the tree relative to its
 * parent, the size of every compound node and the bend points of every edge. Leaf sizes are
 * never changed.
 */
public interface LayeredLayoutAlgorithm {

  /**
   * @throws org.bpmnlayout.LayoutAlgorithmException when the graph is rejected
   */
  void layout(LayoutNode root);

}
