package ca.gc.cra.medingest.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void poolQueuesMoreTasksThanThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(2, "test-worker", null);
    Set<String> threadNames = ConcurrentHashMap.newKeySet();
    List<Callable<Integer>> tasks = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      int value = i;
      tasks.add(() -> {
        threadNames.add(Thread.currentThread().getName());
        return value * value;
      });
    }
    try {
      List<Future<Integer>> futures = pool.invokeAll(tasks);
      int sum = 0;
      for (Future<Integer> future : futures) {
        sum += future.get();
      }
      assertEquals(285, sum);
      assertTrue(threadNames.stream().allMatch(name -> name.startsWith("test-worker-")), threadNames::toString);
      assertTrue(threadNames.size() <= 2);
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void sizeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
