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

import org.json.simple.JSONArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Fixed-size array of parameters, one instance per index (e.g. one per peak)
 * @param <P> type of the addressed parameters
 */
public class IndexedParameter<P extends ParameterImpl<P>> extends ParameterImpl<IndexedParameter<P>> {
    final List<P> children;

    /**
     * @param factory creates the parameter of each index
     */
    public IndexedParameter(String name, Supplier<P> factory, int size) {
        super(name);
        if (size<1) throw new IllegalArgumentException("Parameter "+name+": invalid size "+size);
        List<P> c = new ArrayList<>(size);
        for (int i = 0; i<size; ++i) c.add(factory.get());
        this.children = Collections.unmodifiableList(c);
    }

    public int size() {
        return children.size();
    }

    /**
     * @throws IllegalArgumentException if {@param index} is out of range
     */
    public P get(int index) {
        if (index<0 || index>=children.size()) throw new IllegalArgumentException("Parameter "+name+": index "+index+" out of range (size="+children.size()+")");
        return children.get(index);
    }

    public List<P> getChildren() {
        return children;
    }

    @Override
    public Object toJSONEntry() {
        JSONArray res = new JSONArray();
        for (P p : children) res.add(p.toJSONEntry());
        return res;
    }

    /**
     * A single value is applied to every index, an array sets the first indices (extra values are ignored)
     */
    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof List) {
            List list = (List)jsonEntry;
            if (list.size()>size()) logger.warn("Parameter {}: {} values for {} indices, extra values ignored", name, list.size(), size());
            for (int i = 0; i<Math.min(size(), list.size()); ++i) children.get(i).initFromJSONEntry(list.get(i));
        } else {
            for (P p : children) p.initFromJSONEntry(jsonEntry);
        }
    }

    @Override
    public String toString() {
        return name+" ["+size()+"]";
    }
}
