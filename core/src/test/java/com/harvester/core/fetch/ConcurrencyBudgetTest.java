package com.harvester.core.fetch;

import com.harvester.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyBudgetTest extends TestBase {

    @Test
    void testRejectsEmptyBudget() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyBudget("none", 0));
    }

    @Test
    void testNeverExceedsPermits() throws Exception {
        ConcurrencyBudget budget = newBudget("test", 3);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            futures.add(budget.submit(() -> {
                sleep(20);
                return n;
            }));
        }
        int sum = 0;
        for (Future<Integer> f : futures) sum += f.get();

        assertEquals(190, sum);
        assertTrue(budget.getPeakInFlight() <= 3);
        assertEquals(0, budget.getInFlight());
    }

    @Test
    void testWithPermitRunsOnCallingThread() throws InterruptedException {
        ConcurrencyBudget budget = newBudget("inline", 1);

        String name = budget.withPermit(() -> Thread.currentThread().getName());

        assertEquals(Thread.currentThread().getName(), name);
    }

    @Test
    void testPermitIsReleasedWhenWorkThrows() throws InterruptedException {
        ConcurrencyBudget budget = newBudget("single", 1);

        assertThrows(IllegalStateException.class, () -> budget.withPermit(() -> {
            throw new IllegalStateException("fail");
        }));

        assertEquals("ok", budget.withPermit(() -> "ok"));
    }

    @Test
    void testWorkerThreadsAreNamedAfterBudget() throws Exception {
        ConcurrencyBudget budget = newBudget("image", 2);

        String name = budget.submit(() -> Thread.currentThread().getName()).get();

        assertTrue(name.startsWith("image-"), name);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
