package org.upptest.harness;

import org.upptest.Status;
import org.upptest.TestResult;
import org.upptest.harness.Plugin.AfterRunListener;
import org.upptest.harness.Plugin.BeforeRunListener;
import org.upptest.harness.Plugin.TestResultListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Helper class to dispatch run events to plugins. Listeners are kept in
 * arrays in the order in which the plugins were registered, except for
 * the end-of-run listeners, which are notified in reverse order so that
 * each plugin wraps the plugins registered before it.
 */
final class EventDispatcher {

  private final BeforeRunListener[] beforeRunListeners;
  private final TestResultListener[] testResultListeners;
  private final AfterRunListener[] afterRunListeners;


  private EventDispatcher(Builder builder) {
    beforeRunListeners = builder.beforeRunListeners.toArray(new BeforeRunListener[0]);
    testResultListeners = builder.testResultListeners.toArray(new TestResultListener[0]);
    afterRunListeners = builder.afterRunListeners.toArray(new AfterRunListener[0]);
  }

  void notifyBeforeRun(final int selectedCount) {
    for (final BeforeRunListener l : beforeRunListeners) {
      l.beforeRun(selectedCount);
    }
  }

  void notifyOnTestResult(final TestResult result) {
    for (final TestResultListener l : testResultListeners) {
      l.onTestResult(result);
    }
  }

  void notifyAfterRun(final Status aggregate) {
    for (final AfterRunListener l : afterRunListeners) {
      l.afterRun(aggregate);
    }
  }

  //

  static final class Builder {
    private final List<BeforeRunListener> beforeRunListeners = new ArrayList<>();
    private final List<TestResultListener> testResultListeners = new ArrayList<>();
    private final List<AfterRunListener> afterRunListeners = new ArrayList<>();

    /**
     * Registers a plugin into listener lists based on implemented interfaces.
     *
     * @param plugin The {@link Plugin} to register
     * @return This {@link Builder}.
     */
    Builder withPlugin(Plugin plugin) {
      appendInstanceOf(plugin, BeforeRunListener.class, beforeRunListeners);
      appendInstanceOf(plugin, TestResultListener.class, testResultListeners);
      prependInstanceOf(plugin, AfterRunListener.class, afterRunListeners);
      return this;
    }

    private static <T extends Plugin> void prependInstanceOf(
      Plugin plugin, Class<T> listenerType, List<T> listeners
    ) {
      if (listenerType.isInstance(plugin)) {
        listeners.add(0, listenerType.cast(plugin));
      }
    }

    private static <T extends Plugin> void appendInstanceOf(
      Plugin plugin, Class<T> listenerType, List<T> listeners
    ) {
      if (listenerType.isInstance(plugin)) {
        listeners.add(listenerType.cast(plugin));
      }
    }

    /**
     * @return A new instance of {@link EventDispatcher}.
     */
    EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }

}
