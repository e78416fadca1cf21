/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.beatstore;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.inject.Inject;

import com.google.common.collect.ImmutableMultimap;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.Service.State;
import com.google.common.util.concurrent.ServiceManager;

import org.beatstore.common.application.Lifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for working with Guava.
 */
public final class GuavaUtils {
  private GuavaUtils() {
    // Utility class.
  }

  /**
   * Shuts the application down when any managed service fails.
   */
  public static class LifecycleShutdownListener extends ServiceManager.Listener {
    private static final Logger LOG = LoggerFactory.getLogger(LifecycleShutdownListener.class);

    private final Lifecycle lifecycle;

    @Inject
    LifecycleShutdownListener(Lifecycle lifecycle) {
      this.lifecycle = lifecycle;
    }

    @Override
    public void failure(Service service) {
      LOG.error("Service: " + service + " failed unexpectedly. Triggering shutdown.",
          service.failureCause());
      lifecycle.shutdown();
    }
  }

  /**
   * Interface for mocking. The Guava ServiceManager class is final.
   */
  public interface ServiceManagerIface {
    ServiceManagerIface startAsync();

    void awaitHealthy();

    ServiceManagerIface stopAsync();

    void awaitStopped(long timeout, TimeUnit unit) throws TimeoutException;

    ImmutableMultimap<State, Service> servicesByState();
  }

  /**
   * Create a new {@link ServiceManagerIface} that wraps a {@link ServiceManager}.
   *
   * @param delegate Service manager to delegate to.
   * @return A wrapper.
   */
  public static ServiceManagerIface serviceManager(final ServiceManager delegate) {
    return new ServiceManagerIface() {
      @Override
      public ServiceManagerIface startAsync() {
        delegate.startAsync();
        return this;
      }

      @Override
      public void awaitHealthy() {
        delegate.awaitHealthy();
      }

      @Override
      public ServiceManagerIface stopAsync() {
        delegate.stopAsync();
        return this;
      }

      @Override
      public void awaitStopped(long timeout, TimeUnit unit) throws TimeoutException {
        delegate.awaitStopped(timeout, unit);
      }

      @Override
      public ImmutableMultimap<State, Service> servicesByState() {
        return delegate.servicesByState();
      }
    };
  }
}
