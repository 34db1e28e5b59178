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

package org.bpmnlayout;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.activiti.bpmn.model.BpmnModel;
import org.activiti.bpmn.model.EndEvent;
import org.activiti.bpmn.model.FlowElement;
import org.activiti.bpmn.model.GraphicInfo;
import org.activiti.bpmn.model.Process;
import org.activiti.bpmn.model.SequenceFlow;
import org.activiti.bpmn.model.StartEvent;
import org.activiti.bpmn.model.UserTask;
import org.bpmnlayout.engine.LayoutResult;
import org.bpmnlayout.strategy.LayoutStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BpmnAutoLayoutTest {

  private BpmnModel bpmnModel;

  @BeforeEach
  public void createModel() {
    bpmnModel = new BpmnModel();
    Process process = new Process();
    process.setId("vacationRequest");
    bpmnModel.addProcess(process);
    process.addFlowElement(withId(new StartEvent(), "request"));
    process.addFlowElement(withId(new UserTask(), "approve"));
    process.addFlowElement(withId(new EndEvent(), "done"));
    process.addFlowElement(flow("toApprove", "request", "approve"));
    process.addFlowElement(flow("toDone", "approve", "done"));
  }

  @Test
  public void writesLayoutIntoTheDiagramInterchange() {
    LayoutResult result = new BpmnAutoLayout(bpmnModel).execute();

    assertThat(result.getDiagramId()).isEqualTo("vacationRequest");
    assertThat(result.getStrategy()).isEqualTo(LayoutStrategy.DETERMINISTIC);
    assertThat(bpmnModel.getLocationMap()).containsOnlyKeys("request", "approve", "done");
    assertThat(bpmnModel.getFlowLocationMap()).containsOnlyKeys("toApprove", "toDone");

    GraphicInfo request = bpmnModel.getGraphicInfo("request");
    GraphicInfo approve = bpmnModel.getGraphicInfo("approve");
    GraphicInfo done = bpmnModel.getGraphicInfo("done");
    assertThat(approve.getX()).isGreaterThan(request.getX() + request.getWidth());
    assertThat(done.getX()).isGreaterThan(approve.getX() + approve.getWidth());
    assertThat(approve.getElement()).isSameAs(bpmnModel.getMainProcess().getFlowElement("approve"));

    List<GraphicInfo> waypoints = bpmnModel.getFlowLocationGraphicInfo("toApprove");
    assertThat(waypoints).hasSizeGreaterThanOrEqualTo(2);
    assertThat(waypoints.get(0).getX()).isEqualTo(request.getX() + request.getWidth());
  }

  @Test
  public void appliesTheConfiguredSizes() {
    BpmnAutoLayout layout = new BpmnAutoLayout(bpmnModel);
    layout.setTaskWidth(140);
    layout.setEventSize(30);

    layout.execute();

    assertThat(bpmnModel.getGraphicInfo("approve").getWidth()).isEqualTo(140);
    assertThat(bpmnModel.getGraphicInfo("request").getWidth()).isEqualTo(30);
  }

  @Test
  public void replacesStaleInterchangeByDefault() {
    GraphicInfo stale = new GraphicInfo();
    stale.setX(-500);
    stale.setY(-500);
    stale.setWidth(10);
    stale.setHeight(10);
    bpmnModel.addGraphicInfo("approve", stale);
    bpmnModel.addGraphicInfo("removedTask", stale);

    new BpmnAutoLayout(bpmnModel).execute();

    assertThat(bpmnModel.getLocationMap()).doesNotContainKey("removedTask");
    assertThat(bpmnModel.getGraphicInfo("approve").getWidth()).isEqualTo(100);
  }

  private static <T extends FlowElement> T withId(T flowElement, String id) {
    flowElement.setId(id);
    return flowElement;
  }

  private static SequenceFlow flow(String id, String sourceRef, String targetRef) {
    SequenceFlow sequenceFlow = new SequenceFlow(sourceRef, targetRef);
    sequenceFlow.setId(id);
    return sequenceFlow;
  }
}
