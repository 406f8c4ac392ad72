package org.upptest.harness;

import org.junit.Test;
import org.upptest.Status;
import org.upptest.TestResult;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class EventDispatcherTest {

  private static final class RecordingPlugin implements Plugin.BeforeRunListener,
    Plugin.TestResultListener, Plugin.AfterRunListener {

    private final String name;
    private final List<String> events;

    RecordingPlugin(String name, List<String> events) {
      this.name = name;
      this.events = events;
    }

    @Override
    public void beforeRun(int selectedCount) {
      events.add(name + ":before:" + selectedCount);
    }

    @Override
    public void onTestResult(TestResult result) {
      events.add(name + ":result:" + result.status());
    }

    @Override
    public void afterRun(Status aggregate) {
      events.add(name + ":after:" + aggregate);
    }
  }

  @Test
  public void endOfRunListenersWrapEarlierPlugins() {
    final List<String> events = new ArrayList<>();
    final EventDispatcher dispatcher = new EventDispatcher.Builder()
      .withPlugin(new RecordingPlugin("first", events))
      .withPlugin(new RecordingPlugin("second", events))
      .build();

    final TestResult result = new TestResult();
    result.pass();

    dispatcher.notifyBeforeRun(1);
    dispatcher.notifyOnTestResult(result);
    dispatcher.notifyAfterRun(Status.PASS);

    assertEquals(List.of(
      "first:before:1", "second:before:1",
      "first:result:PASS", "second:result:PASS",
      "second:after:PASS", "first:after:PASS"
    ), events);
  }

  @Test
  public void pluginsOnlyReceiveEventsTheyListenTo() {
    final List<String> events = new ArrayList<>();
    final Plugin.AfterRunListener afterOnly = aggregate -> events.add("after:" + aggregate);

    final EventDispatcher dispatcher = new EventDispatcher.Builder()
      .withPlugin(afterOnly)
      .withPlugin(new Plugin() { })
      .build();

    dispatcher.notifyBeforeRun(3);
    dispatcher.notifyOnTestResult(new TestResult());
    dispatcher.notifyAfterRun(Status.FAIL);

    assertEquals(List.of("after:FAIL"), events);
  }

}
