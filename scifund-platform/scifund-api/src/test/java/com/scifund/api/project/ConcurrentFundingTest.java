package com.scifund.api.project;

import com.scifund.api.LedgerIntegrationTestSupport;
import com.scifund.api.error.InvalidStateException;
import com.scifund.core.domain.ProjectStatus;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent funders against one project: the goal check always sees the
 * post-increment total, so no contribution lands after the project is funded.
 */
class ConcurrentFundingTest extends LedgerIntegrationTestSupport {

    @Test
    void concurrentContributionsStopExactlyAtGoal() throws Exception {
        register(RESEARCHER);
        long projectId = createProject(RESEARCHER, 1000, 30);

        int funders = 20;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < funders; i++) {
            String funder = "funder-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    fund(funder, projectId, 100);
                    accepted.incrementAndGet();
                } catch (InvalidStateException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(10, accepted.get());
        assertEquals(10, rejected.get());

        ProjectService.ProjectView project = projectService.getProject(projectId);
        assertEquals(ProjectStatus.FUNDED, project.status());
        assertEquals(BigInteger.valueOf(1000), project.currentFunding());
        assertEquals(10, project.contributors().size());
        assertEquals(BigInteger.valueOf(1000), platformService.getPoolBalance());
    }
}
