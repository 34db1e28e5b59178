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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of a crossing detection run: the number of crossing edge pairs and the pairs themselves,
 * each pair ordered by id.
 */
public class CrossingReport {

  protected List<List<String>> pairs = new ArrayList<List<String>>();

  public CrossingReport(List<List<String>> pairs) {
    this.pairs.addAll(pairs);
  }

  public static CrossingReport empty() {
    return new CrossingReport(Collections.<List<String>>emptyList());
  }

  public int getCount() {
    return pairs.size();
  }

  public List<List<String>> getPairs() {
    return Collections.unmodifiableList(pairs);
  }

  public boolean contains(String edgeA, String edgeB) {
    List<String> pair = edgeA.compareTo(edgeB) < 0 ? Arrays.asList(edgeA, edgeB) : Arrays.asList(edgeB, edgeA);
    return pairs.contains(pair);
  }

  @Override
  public String toString() {
    return "CrossingReport[" + pairs.size() + " crossing(s)]";
  }
}
