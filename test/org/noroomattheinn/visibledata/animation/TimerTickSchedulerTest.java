/*
 * TimerTickSchedulerTest.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 18, 2015
 */

package org.noroomattheinn.visibledata.animation;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TimerTickSchedulerTest {
    private ExecutorService eventLoop;
    private TimerTickScheduler scheduler;

    @BeforeEach public void setUp() {
        eventLoop = Executors.newSingleThreadExecutor();
        scheduler = new TimerTickScheduler(eventLoop);
    }

    @AfterEach public void tearDown() {
        scheduler.shutDown();
        eventLoop.shutdownNow();
    }

    @Test public void ticksRunOnTheEventLoop() throws InterruptedException {
        final CountDownLatch ticks = new CountDownLatch(3);
        final Thread[] where = new Thread[1];
        final Thread loopThread = loopThread();
        scheduler.schedule(new Runnable() {
            @Override public void run() {
                where[0] = Thread.currentThread();
                ticks.countDown();
            }
        }, 20);
        assertTrue(ticks.await(5, TimeUnit.SECONDS));
        assertSame(loopThread, where[0]);
    }

    @Test public void cancelledTicksStop() throws InterruptedException {
        final AtomicInteger count = new AtomicInteger();
        final CountDownLatch first = new CountDownLatch(1);
        TickScheduler.Ticket ticket = scheduler.schedule(new Runnable() {
            @Override public void run() {
                count.incrementAndGet();
                first.countDown();
            }
        }, 20);
        assertTrue(first.await(5, TimeUnit.SECONDS));
        ticket.cancel();
        drain();
        int seen = count.get();
        Thread.sleep(200);
        drain();
        assertEquals(seen, count.get());
    }

    private Thread loopThread() throws InterruptedException {
        final Thread[] t = new Thread[1];
        final CountDownLatch done = new CountDownLatch(1);
        eventLoop.execute(new Runnable() {
            @Override public void run() {
                t[0] = Thread.currentThread();
                done.countDown();
            }
        });
        assertTrue(done.await(5, TimeUnit.SECONDS));
        return t[0];
    }

    private void drain() throws InterruptedException {
        loopThread();
    }
}
