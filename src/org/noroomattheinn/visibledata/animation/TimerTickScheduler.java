/*
 * TimerTickScheduler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 15, 2015
 */

package org.noroomattheinn.visibledata.animation;

import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * TimerTickScheduler: A TickScheduler based on a java.util.Timer. The timer
 * thread never runs a tick itself, it hands it to the event loop.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class TimerTickScheduler implements TickScheduler {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.animation");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final Timer timer = new Timer("00 VD - Animation", true);
    private final Executor eventLoop;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    /**
     * @param eventLoop Where ticks are run. Platform::runLater in a GUI, a
     *                  single threaded executor otherwise.
     */
    public TimerTickScheduler(Executor eventLoop) {
        this.eventLoop = eventLoop;
    }

    @Override public Ticket schedule(final Runnable tick, long intervalMS) {
        final TimedTick task = new TimedTick(tick);
        timer.scheduleAtFixedRate(task, intervalMS, intervalMS);
        return new Ticket() {
            @Override public void cancel() {
                task.cancelled = true;
                task.cancel();
            }
        };
    }

    public void shutDown() {
        timer.cancel();
        logger.fine("Animation timer stopped");
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Classes
 *
 *----------------------------------------------------------------------------*/

    private class TimedTick extends TimerTask {
        private final Runnable tick;
        private volatile boolean cancelled = false;

        TimedTick(Runnable tick) { this.tick = tick; }

        @Override public void run() {
            if (cancelled) return;
            eventLoop.execute(new Runnable() {
                @Override public void run() {
                    if (!cancelled) tick.run();
                }
            });
        }
    }
}
