package ca.gc.cra.sentinel.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void coordinatorRunsOnNamedNonDaemonThread() throws Exception {
    ScheduledExecutorService coordinator = ExecutorFactories.newCoordinator("pool-coordinator", null);
    try {
      Thread thread = coordinator.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

      assertEquals("pool-coordinator", thread.getName());
      assertFalse(thread.isDaemon());
    } finally {
      coordinator.shutdownNow();
      assertTrue(coordinator.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void workerThreadsAreDaemonsNamedById() {
    Thread thread = ExecutorFactories.newWorkerThread(null, 7, () -> {}, null);

    assertEquals("sentinel-worker-7", thread.getName());
    assertTrue(thread.isDaemon());
  }
}
