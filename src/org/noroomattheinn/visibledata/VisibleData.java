/*
 * VisibleData.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 16, 2015
 */

package org.noroomattheinn.visibledata;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.prefs.Preferences;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.noroomattheinn.visibledata.animation.AnimationState.Direction;
import org.noroomattheinn.visibledata.animation.TimerTickScheduler;
import org.noroomattheinn.visibledata.data.DatasetRegistry;
import org.noroomattheinn.visibledata.data.DescriptorDataSource;
import org.noroomattheinn.visibledata.plot.MapPlotHandler;
import org.noroomattheinn.visibledata.plot.PlotMethod;
import org.noroomattheinn.visibledata.render.LoggingRenderer;
import org.noroomattheinn.visibledata.session.LoggingShell;
import org.noroomattheinn.visibledata.session.SessionController;
import org.noroomattheinn.visibledata.session.UIShell;

/**
 * This is the main class of the headless viewer. It opens a dataset, shows
 * one variable and optionally animates it, logging what the plots would
 * show.
 * <pre>
 * VisibleData &lt;dataset.json&gt; [variable] [plotmethod]
 *             [--preset file] [--projection name] [--animate N]
 * </pre>
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class VisibleData {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final Prefs prefs;
    private final ExecutorService eventLoop;
    private final TimerTickScheduler scheduler;
    private final UIShell shell;
    private final SessionController session;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public VisibleData(Prefs prefs) {
        this.prefs = prefs;
        this.eventLoop = Executors.newSingleThreadExecutor();
        this.scheduler = new TimerTickScheduler(eventLoop);
        this.shell = new LoggingShell();
        this.session = new SessionController(
                new DatasetRegistry(new DescriptorDataSource()), new LoggingRenderer(),
                shell, scheduler, prefs.getPlotMethod(), prefs.getAnimationInterval());
    }

    /**
     * Run the viewer with the given options
     * @return  The exit status
     */
    public int run(final Options o) {
        try {
            onLoop(new Callable<Void>() {
                @Override public Void call() throws Exception {
                    session.openDataset(o.dataset);
                    return null;
                }
            });
            if (o.projection != null) applyProjection(o.projection);
            if (o.preset != null) {
                boolean loaded = onLoop(new Callable<Boolean>() {
                    @Override public Boolean call() { return session.loadPreset(o.preset); }
                });
                if (loaded) prefs.lastPreset.set(o.preset);
            }

            final String variable = o.variable != null ? o.variable : firstVariable();
            if (variable == null) {
                logger.warning("Dataset " + o.dataset + " has no variables");
                return 1;
            }
            final PlotMethod method = o.method != null ? o.method : prefs.getPlotMethod();
            boolean shown = onLoop(new Callable<Boolean>() {
                @Override public Boolean call() { return session.activate(variable, method); }
            });
            if (!shown) return 1;

            if (o.frames > 0) animate(o.frames);
            return 0;
        } catch (ExecutionException e) {
            logger.log(Level.SEVERE, "Viewer failed", e.getCause());
            shell.reportError("Viewer failed: " + e.getCause().getMessage(),
                    e.getCause() instanceof Exception ? (Exception)e.getCause() : e);
            return 1;
        } catch (InterruptedException e) {
            logger.warning("Interrupted");
            Thread.currentThread().interrupt();
            return 1;
        } finally {
            scheduler.shutDown();
            eventLoop.shutdown();
        }
    }

    public static void main(String[] args) {
        Options o = Options.parse(args);
        if (o == null) {
            System.err.println(
                "usage: VisibleData <dataset.json> [variable] [plotmethod] " +
                "[--preset file] [--projection name] [--animate N]");
            System.exit(2);
        }
        Prefs prefs = new Prefs(Preferences.userNodeForPackage(VisibleData.class));
        setupLogger(appFilesFolder(), "visibledata", logger, prefs.getLogLevel());
        System.exit(new VisibleData(prefs).run(o));
    }

/*------------------------------------------------------------------------------
 *
 * Command line options
 *
 *----------------------------------------------------------------------------*/

    public static class Options {
        public String dataset = null;
        public String variable = null;
        public PlotMethod method = null;
        public String preset = null;
        public String projection = null;
        public int frames = 0;

        /**
         * @return  The options, or null if the arguments are unusable
         */
        public static Options parse(String[] args) {
            Options o = new Options();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("--preset") || arg.equals("--animate") || arg.equals("--projection")) {
                    if (i + 1 >= args.length) return null;
                    String value = args[++i];
                    if (arg.equals("--preset")) o.preset = value;
                    else if (arg.equals("--projection")) o.projection = value;
                    else if (StringUtils.isNumeric(value)) o.frames = Integer.parseInt(value);
                    else return null;
                } else if (arg.startsWith("--")) {
                    return null;
                } else {
                    positional.add(arg);
                }
            }
            if (positional.isEmpty() || positional.size() > 3) return null;
            o.dataset = positional.get(0);
            if (positional.size() > 1) o.variable = positional.get(1);
            if (positional.size() > 2) {
                o.method = PlotMethod.fromLabel(positional.get(2));
                if (o.method == null) return null;
            }
            return o;
        }
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private String firstVariable() throws ExecutionException, InterruptedException {
        return onLoop(new Callable<String>() {
            @Override public String call() {
                List<String> names = session.getState().currentDataset().variableNames();
                return names.isEmpty() ? null : names.get(0);
            }
        });
    }

    private void applyProjection(final String projection)
            throws ExecutionException, InterruptedException {
        if (!prefs.getProjections().contains(projection)) {
            logger.warning("Unknown projection " + projection + ", using the default");
            return;
        }
        onLoop(new Callable<Void>() {
            @Override public Void call() {
                MapPlotHandler h = (MapPlotHandler)session.getState().handler(PlotMethod.MapPlot);
                h.setProjection(projection);
                return null;
            }
        });
    }

    private void animate(final int frames) throws ExecutionException, InterruptedException {
        boolean started = onLoop(new Callable<Boolean>() {
            @Override public Boolean call() {
                return session.startAnimation(Direction.Forward, frames);
            }
        });
        if (!started) return;
        Callable<Boolean> running = new Callable<Boolean>() {
            @Override public Boolean call() { return session.getAnimation().isRunning(); }
        };
        while (onLoop(running)) {
            Thread.sleep(prefs.getAnimationInterval());
        }
    }

    /**
     * Run a task on the event loop and wait for it
     */
    private <T> T onLoop(Callable<T> task) throws ExecutionException, InterruptedException {
        return eventLoop.submit(task).get();
    }

    private static File appFilesFolder() {
        File folder = new File(FileUtils.getUserDirectory(), ".visibledata");
        if (!folder.exists() && !folder.mkdirs()) {
            logger.warning("Can't create " + folder + ", logging to the console only");
            return null;
        }
        return folder;
    }

    private static void setupLogger(File where, String basename, Logger logger, Level level) {
        logger.setUseParentHandlers(false);
        logger.setLevel(level);
        Handler console = new ConsoleHandler();
        console.setLevel(level);
        logger.addHandler(console);
        if (where == null) return;
        try {
            FileHandler fh = new FileHandler(
                    new File(where, basename + "-%g.log").getAbsolutePath(), 1000000, 3, true);
            fh.setFormatter(new SimpleFormatter());
            fh.setLevel(level);
            logger.addHandler(fh);
        } catch (IOException | SecurityException e) {
            logger.log(Level.WARNING, "Can't log to " + where, e);
        }
    }
}
