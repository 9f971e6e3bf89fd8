/*
 * Prefs.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 16, 2015
 */
package org.noroomattheinn.visibledata;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.logging.Level;
import java.util.prefs.Preferences;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.beans.value.ChangeListener;
import javafx.beans.value.ObservableValue;
import org.noroomattheinn.visibledata.animation.AnimationState;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * Prefs - Stores and Manages Preferences data for the viewer.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Prefs {
/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final String DefaultProjections = "cf,cyl,robin,ortho,moll,northpole,southpole";

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final Preferences persistentState;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public Preferences storage() { return persistentState; }

    public Prefs(Preferences underlyingStore) {
        this.persistentState = underlyingStore;
        loadGeneralPrefs();
    }

/*------------------------------------------------------------------------------
 *
 * General Application Preferences
 *
 *----------------------------------------------------------------------------*/

    public IntegerProperty  animationInterval   = new SimpleIntegerProperty();
    public StringProperty   defaultPlotMethod   = new SimpleStringProperty();
    public StringProperty   projections         = new SimpleStringProperty();
    public StringProperty   lastPreset          = new SimpleStringProperty();
    public StringProperty   logLevel            = new SimpleStringProperty();
    private static final String IntervalKey     = "APP_ANIMATION_INTERVAL";
    private static final String PlotMethodKey   = "APP_PLOT_METHOD";
    private static final String ProjectionsKey  = "APP_PROJECTIONS";
    private static final String LastPresetKey   = "APP_LAST_PRESET";
    private static final String LogLevelKey     = "APP_LOG_LEVEL";
    private static final ImmutableMap<String,Level> levelMap = ImmutableMap.<String,Level>builder()
            .put("Severe", Level.SEVERE).put("Warning", Level.WARNING)
            .put("Info",   Level.INFO).put("Config",  Level.CONFIG)
            .put("Fine",   Level.FINE).put("Finer",   Level.FINER)
            .put("Finest", Level.FINEST)
            .build();

    public Level getLogLevel() {
        Level l = levelMap.get(logLevel.get());
        return l == null ? Level.INFO : l;
    }

    /**
     * The plot method to start with. Falls back to mapplot if the stored
     * value isn't a known method.
     */
    public PlotMethod getPlotMethod() {
        PlotMethod m = PlotMethod.fromLabel(defaultPlotMethod.get());
        return m == null ? PlotMethod.MapPlot : m;
    }

    public int getAnimationInterval() {
        return AnimationState.clampInterval(animationInterval.get());
    }

    public List<String> getProjections() {
        return ImmutableList.copyOf(
                Splitter.on(',').trimResults().omitEmptyStrings().split(projections.get()));
    }

    private void loadGeneralPrefs() {
        integerPref(IntervalKey, animationInterval, AnimationState.DefaultIntervalMS);
        stringPref(PlotMethodKey, defaultPlotMethod, PlotMethod.MapPlot.label());
        stringPref(ProjectionsKey, projections, DefaultProjections);
        stringPref(LastPresetKey, lastPreset, "");
        stringPref(LogLevelKey, logLevel, "Info");
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private void integerPref(final String key, IntegerProperty property, int defaultValue) {
        property.set(persistentState.getInt(key, defaultValue));
        property.addListener(new ChangeListener<Number>() {
            @Override public void changed(
                ObservableValue<? extends Number> ov, Number old, Number cur) {
                    persistentState.putInt(key, cur.intValue());
            }
        });
    }

    private void stringPref(final String key, StringProperty property, String defaultValue) {
        property.set(persistentState.get(key, defaultValue));
        property.addListener(new ChangeListener<String>() {
            @Override public void changed(
                ObservableValue<? extends String> ov, String old, String cur) {
                    persistentState.put(key, cur);
            }
        });
    }
}
