/*
 * ArrayCollection.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 11, 2015
 */

package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * ArrayCollection: An ordered collection of PlotSlots, each with a unique
 * display name. The order is insertion order and is what selector widgets
 * show.
 *
 * NOTES
 * - A collection created with the public constructor owns the slots added to
 *   it. Collections returned by filter() and byMethod() are snapshots that
 *   leave ownership alone.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class ArrayCollection implements Iterable<PlotSlot> {
/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final String NamePrefix = "arr";

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final List<PlotSlot> slots = new ArrayList<>();
    private final boolean owning;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public ArrayCollection() { this(true); }

    private ArrayCollection(boolean owning) { this.owning = owning; }

    /**
     * Append a slot. If it has no name, or its name is taken, it gets a new
     * one of the form arrN.
     * @param slot  The slot to add
     * @return      The slot
     */
    public PlotSlot add(PlotSlot slot) {
        if (slots.contains(slot)) return slot;
        if (slot.getName() == null || get(slot.getName()) != null) {
            slot.setName(nextName(names()));
        }
        slots.add(slot);
        if (owning) slot.setOwner(this);
        return slot;
    }

    /**
     * Remove a slot
     * @return  true if the slot was part of this collection
     */
    public boolean remove(PlotSlot slot) {
        boolean removed = slots.remove(slot);
        if (removed && owning && slot.getOwner() == this) slot.setOwner(null);
        return removed;
    }

    /**
     * Remove the slot with the given name
     * @return  The removed slot, or null if there is no slot with that name
     */
    public PlotSlot remove(String name) {
        PlotSlot slot = get(name);
        if (slot != null) remove(slot);
        return slot;
    }

    /**
     * @return  The sub-collection of slots showing data of the given dataset
     */
    public ArrayCollection filter(int datasetID) {
        ArrayCollection result = new ArrayCollection(false);
        for (PlotSlot slot : slots) {
            if (slot.getDataset().getID() == datasetID) result.slots.add(slot);
        }
        return result;
    }

    /**
     * @return  The sub-collection of slots using the given plot method
     */
    public ArrayCollection byMethod(PlotMethod method) {
        ArrayCollection result = new ArrayCollection(false);
        for (PlotSlot slot : slots) {
            if (slot.getMethod() == method) result.slots.add(slot);
        }
        return result;
    }

    /**
     * Append all slots of another collection.
     *
     * @param other     The collection to merge in
     * @param rename    If true, slots whose name is already taken are renamed.
     *                  If false, a name collision is an error.
     * @throws IllegalArgumentException On a name collision with rename false.
     *                  Nothing is merged in that case.
     */
    public void extend(ArrayCollection other, boolean rename) {
        List<PlotSlot> incoming = ImmutableList.copyOf(other.slots);
        if (!rename) {
            Set<String> seen = new HashSet<>(names());
            for (PlotSlot slot : incoming) {
                if (slots.contains(slot)) continue;
                if (slot.getName() != null && !seen.add(slot.getName())) {
                    throw new IllegalArgumentException(
                            "A plot named " + slot.getName() + " already exists");
                }
            }
        }
        for (PlotSlot slot : incoming) { add(slot); }
    }

    public PlotSlot get(String name) {
        if (name == null) return null;
        for (PlotSlot slot : slots) {
            if (name.equals(slot.getName())) return slot;
        }
        return null;
    }

    public PlotSlot get(int index) { return slots.get(index); }

    public int indexOf(PlotSlot slot) { return slots.indexOf(slot); }

    public boolean contains(PlotSlot slot) { return slots.contains(slot); }

    public int size() { return slots.size(); }

    public boolean isEmpty() { return slots.isEmpty(); }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (PlotSlot slot : slots) { names.add(slot.getName()); }
        return names;
    }

    /**
     * @return  The short descriptions of all slots, in order
     */
    public List<String> descriptions() {
        List<String> descriptions = new ArrayList<>();
        for (PlotSlot slot : slots) { descriptions.add(slot.shortInfo()); }
        return descriptions;
    }

    public List<PlotSlot> asList() { return Collections.unmodifiableList(slots); }

    @Override public Iterator<PlotSlot> iterator() { return asList().iterator(); }

    @Override public String toString() { return "ArrayCollection" + names(); }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private static String nextName(List<String> taken) {
        int i = 0;
        while (taken.contains(NamePrefix + i)) { i++; }
        return NamePrefix + i;
    }
}
