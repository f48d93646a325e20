/* 
 * Copyright (C) 2022 SimPeaks developers
 *
 * This File is part of SimPeaks
 *
 * SimPeaks is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SimPeaks is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SimPeaks.  If not, see <http://www.gnu.org/licenses/>.
 */
package simpeaks.configuration.parameters;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Parameter whose value is a constant of an enum. Clients exchange it as the constant's ordinal, json files use the display name
 * @param <E> enum type
 */
public class EnumChoiceParameter<E extends Enum<E>> extends ParameterImpl<EnumChoiceParameter<E>> {
    final E[] enumChoiceList;
    final Function<E, String> toString;
    volatile E selectedItem;

    public EnumChoiceParameter(String name, E[] enumChoiceList, E selectedItem, Function<E, String> toString) {
        super(name);
        this.enumChoiceList = enumChoiceList;
        this.selectedItem = selectedItem;
        this.toString = toString;
    }

    public E getSelectedEnum() {
        return selectedItem;
    }

    public EnumChoiceParameter<E> setSelectedEnum(E selectedEnum) {
        this.selectedItem = selectedEnum;
        return this;
    }

    public int getSelectedIndex() {
        return selectedItem==null ? -1 : selectedItem.ordinal();
    }

    /**
     * @param index ordinal of the enum constant to select
     * @throws IllegalArgumentException if {@param index} is not the ordinal of a constant
     */
    public EnumChoiceParameter<E> setSelectedIndex(int index) {
        if (index<0 || index>=enumChoiceList.length) throw new IllegalArgumentException("Parameter "+name+": invalid choice index "+index+" (0-"+(enumChoiceList.length-1)+")");
        return setSelectedEnum(enumChoiceList[index]);
    }

    public EnumChoiceParameter<E> setSelectedItem(String item) {
        E e = Arrays.stream(enumChoiceList).filter(c -> toString.apply(c).equals(item) || c.name().equals(item)).findAny()
                .orElseThrow(() -> new IllegalArgumentException("Parameter "+name+": unknown choice "+item));
        return setSelectedEnum(e);
    }

    @Override
    public Object toJSONEntry() {
        return selectedItem==null ? null : toString.apply(selectedItem);
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof String) setSelectedItem((String)jsonEntry);
        else if (jsonEntry instanceof Number) setSelectedIndex(((Number)jsonEntry).intValue());
        else throw new IllegalArgumentException("Parameter "+name+": invalid choice "+jsonEntry);
    }

    @Override
    public String toString() {
        return name+": "+(selectedItem==null ? "" : toString.apply(selectedItem));
    }
}
