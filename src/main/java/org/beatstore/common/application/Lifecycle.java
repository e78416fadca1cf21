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
package org.beatstore.common.application;

import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application lifecycle.  The main thread blocks in {@link #awaitShutdown()} until some other
 * party calls {@link #shutdown()}.
 */
public class Lifecycle {
  private static final Logger LOG = LoggerFactory.getLogger(Lifecycle.class);

  private final CountDownLatch stopped = new CountDownLatch(1);

  /**
   * Initiates shutdown.  Only the first call has an effect.
   */
  public synchronized void shutdown() {
    if (stopped.getCount() > 0) {
      LOG.info("Shutting down application");
      stopped.countDown();
    }
  }

  /**
   * Blocks until {@link #shutdown()} has been called.
   */
  public void awaitShutdown() {
    try {
      stopped.await();
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for shutdown, shutting down now");
      Thread.currentThread().interrupt();
      shutdown();
    }
  }

  public boolean isShutdown() {
    return stopped.getCount() == 0;
  }
}
