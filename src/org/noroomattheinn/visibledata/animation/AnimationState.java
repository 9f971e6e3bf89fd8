/*
 * AnimationState.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 15, 2015
 */

package org.noroomattheinn.visibledata.animation;

import org.noroomattheinn.visibledata.plot.PlotSlot;

/**
 * AnimationState: Where an animation stands. Mutated only by the
 * AnimationDriver; everyone else reads.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class AnimationState {

/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public enum Direction { Forward, Backward }

    public static final int MinIntervalMS = 40;
    public static final int MaxIntervalMS = 10000;
    public static final int DefaultIntervalMS = 500;
    public static final int Unbounded = -1;

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private String dim = null;
    private Direction direction = Direction.Forward;
    private int intervalMS;
    private int framesLeft = Unbounded;
    private boolean running = false;
    private int replay = 0;
    private PlotSlot target = null;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public AnimationState() { this(DefaultIntervalMS); }

    public AnimationState(int intervalMS) {
        this.intervalMS = clampInterval(intervalMS);
    }

    public static int clampInterval(int ms) {
        return Math.max(MinIntervalMS, Math.min(MaxIntervalMS, ms));
    }

    /**
     * The dimension being animated, or the one selected for the next
     * animation when stopped. May be null.
     */
    public String getDim() { return dim; }
    public Direction getDirection() { return direction; }
    public int getIntervalMS() { return intervalMS; }
    public int getFramesLeft() { return framesLeft; }
    public boolean isBounded() { return framesLeft != Unbounded; }
    public boolean isRunning() { return running; }
    public int getReplay() { return replay; }
    public PlotSlot getTarget() { return target; }

    /**
     * Select the dimension to animate
     */
    public void setDim(String dim) { this.dim = dim; }

    @Override public String toString() {
        return running ? "Running(" + direction + " " + dim + ")" : "Stopped";
    }

/*------------------------------------------------------------------------------
 *
 * PACKAGE - Used by the AnimationDriver
 *
 *----------------------------------------------------------------------------*/

    void start(PlotSlot target, String dim, Direction direction, int frames) {
        this.target = target;
        this.dim = dim;
        this.direction = direction;
        this.framesLeft = frames < 0 ? Unbounded : frames;
        this.replay = 1;
        this.running = true;
    }

    void stop() {
        running = false;
        replay = 0;
        target = null;
    }

    void setIntervalMS(int ms) { intervalMS = clampInterval(ms); }

    /**
     * Count one frame.
     * @return  false if a bounded animation has no frames left
     */
    boolean countFrame() {
        if (framesLeft == Unbounded) return true;
        if (framesLeft == 0) return false;
        framesLeft--;
        return true;
    }

    boolean takeReplay() {
        if (replay <= 0) return false;
        replay--;
        return true;
    }
}
