/*
 * ManualScheduler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 17, 2015
 */

package org.noroomattheinn.visibledata.animation;

import java.util.ArrayList;
import java.util.List;

/**
 * ManualScheduler: A TickScheduler whose ticks are fired by the test.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class ManualScheduler implements TickScheduler {
    public final List<Runnable> scheduled = new ArrayList<>();
    public final List<Long> intervals = new ArrayList<>();
    public int cancelled = 0;
    private boolean active = false;

    @Override public Ticket schedule(Runnable tick, long intervalMS) {
        scheduled.add(tick);
        intervals.add(intervalMS);
        active = true;
        return new Ticket() {
            @Override public void cancel() {
                active = false;
                cancelled++;
            }
        };
    }

    public boolean isActive() { return active; }

    /**
     * Fire the current schedule n times, as long as it is active
     */
    public void fire(int n) {
        for (int i = 0; i < n && active; i++) {
            scheduled.get(scheduled.size() - 1).run();
        }
    }

    /**
     * Run a tick that was queued by an earlier schedule
     */
    public void fireStale(int schedule) { scheduled.get(schedule).run(); }
}
