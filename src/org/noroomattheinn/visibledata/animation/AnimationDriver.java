/*
 * AnimationDriver.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 15, 2015
 */

package org.noroomattheinn.visibledata.animation;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import org.noroomattheinn.visibledata.animation.AnimationState.Direction;
import org.noroomattheinn.visibledata.plot.DimensionIndexState;
import org.noroomattheinn.visibledata.plot.PlotSlot;

/**
 * AnimationDriver: Step the current plot through one dimension on a timer.
 * All methods, and the ticks, run on the session's event loop.
 *
 * NOTES
 * - The first tick after start() redraws the current frame. Later ticks
 *   step the index, wrapping around at either end.
 * - Every schedule gets a generation number. A tick from an older
 *   generation that was queued before stop() or setInterval() is ignored.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class AnimationDriver {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.animation");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final AnimationState state;
    private final TickScheduler scheduler;
    private final Host host;
    private TickScheduler.Ticket ticket = null;
    private int generation = 0;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    /**
     * What the driver needs from the session it animates
     */
    public interface Host {
        /**
         * @return  The plot to animate, or null if there is none
         */
        public PlotSlot currentSlot();

        /**
         * Lock (or unlock) the controls that must not be used while an
         * animation runs: the variables and the plot methods.
         */
        public void setControlsLocked(boolean locked);

        /**
         * A frame was drawn or the animation stopped
         */
        public void framesChanged();
    }

    public AnimationDriver(AnimationState state, TickScheduler scheduler, Host host) {
        this.state = state;
        this.scheduler = scheduler;
        this.host = host;
    }

    public AnimationState getState() { return state; }

    public boolean isRunning() { return state.isRunning(); }

    public boolean start(Direction direction) {
        return start(direction, AnimationState.Unbounded);
    }

    /**
     * Start animating the current plot.
     *
     * @param direction Which way to step
     * @param frames    Number of frames to draw, or Unbounded
     * @return          true if an animation was started. Starting while
     *                  running, or without something to animate, does nothing.
     */
    public boolean start(Direction direction, int frames) {
        if (state.isRunning()) return false;
        PlotSlot slot = host.currentSlot();
        if (slot == null) {
            logger.info("Nothing to animate");
            return false;
        }
        List<String> dims = slot.dimsToIterate();
        if (dims.isEmpty()) {
            logger.info("No dimension to animate in " + slot);
            return false;
        }
        String dim = dims.contains(state.getDim()) ? state.getDim() : dims.get(0);
        state.start(slot, dim, direction, frames);
        host.setControlsLocked(true);
        schedule();
        logger.fine("Animating " + slot.getName() + " along " + dim + " " + direction);
        return true;
    }

    public void stop() {
        if (!state.isRunning()) return;
        cancel();
        state.stop();
        host.setControlsLocked(false);
        host.framesChanged();
        logger.fine("Animation stopped");
    }

    /**
     * Stop if running, otherwise start in the given direction
     * @return  true if an animation is running afterwards
     */
    public boolean toggle(Direction direction) {
        if (state.isRunning()) {
            stop();
            return false;
        }
        return start(direction);
    }

    /**
     * Change the time between frames. A running animation continues from
     * where it is at the new pace.
     */
    public void setInterval(int ms) {
        state.setIntervalMS(ms);
        if (state.isRunning()) {
            cancel();
            schedule();
        }
    }

/*------------------------------------------------------------------------------
 *
 * PACKAGE - Driven by the TickScheduler
 *
 *----------------------------------------------------------------------------*/

    void tick() {
        if (!state.isRunning()) return;
        PlotSlot slot = state.getTarget();
        if (!slot.isRegistered()) {
            logger.fine("Dropping animation tick for a plot that is gone");
            stop();
            return;
        }
        if (!state.countFrame()) {
            stop();
            return;
        }

        if (state.takeReplay()) {
            slot.refresh();
        } else if (!step(slot)) {
            stop();
            return;
        }
        host.framesChanged();

        if (state.isBounded() && state.getFramesLeft() == 0) stop();
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private boolean step(PlotSlot slot) {
        String dim = state.getDim();
        DimensionIndexState idims = slot.getIdims();
        if (!idims.contains(dim) || idims.isFree(dim)) {
            logger.warning("Can't animate " + dim + " of " + idims);
            return false;
        }
        int i = idims.get(dim);
        int max = idims.size(dim) - 1;
        int next;
        if (state.getDirection() == Direction.Forward) {
            next = (i == max) ? 0 : i + 1;
        } else {
            next = (i == 0) ? max : i - 1;
        }
        slot.update(Collections.singletonMap(dim, next));
        return true;
    }

    private void schedule() {
        final int scheduled = ++generation;
        ticket = scheduler.schedule(new Runnable() {
            @Override public void run() {
                if (scheduled == generation) tick();
            }
        }, state.getIntervalMS());
    }

    private void cancel() {
        generation++;
        if (ticket != null) ticket.cancel();
        ticket = null;
    }
}
