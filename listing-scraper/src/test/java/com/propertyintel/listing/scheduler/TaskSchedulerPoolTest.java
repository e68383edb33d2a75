package com.propertyintel.listing.scheduler;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class TaskSchedulerPoolTest {

    @Autowired
    private ThreadPoolTaskScheduler taskScheduler;

    @Test
    void shouldProvideTwoSchedulerThreads() {
        assertEquals(2, taskScheduler.getPoolSize(), "Ingestion and enrichment each need a scheduler thread");
    }

    @Test
    void shouldRunSecondJob_WhileFirstJobIsBlocked() throws InterruptedException {
        // Arrange
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch secondRan = new CountDownLatch(1);

        // Act
        taskScheduler.schedule(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, Instant.now());
        taskScheduler.schedule(secondRan::countDown, Instant.now());

        // Assert
        try {
            assertTrue(secondRan.await(2, TimeUnit.SECONDS), "Second job should not wait for the blocked one");
        } finally {
            release.countDown();
        }
    }
}
