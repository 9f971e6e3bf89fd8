/*
 * TickScheduler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 15, 2015
 */

package org.noroomattheinn.visibledata.animation;

/**
 * TickScheduler: Calls a task periodically on the session's event loop.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public interface TickScheduler {

    /**
     * Run a task every intervalMS milliseconds, starting one interval from now
     * @return  A ticket to cancel the schedule
     */
    public Ticket schedule(Runnable tick, long intervalMS);

    public interface Ticket {
        /**
         * Stop the schedule. Ticks that were already queued don't run.
         */
        public void cancel();
    }
}
