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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simpeaks.utils.JSONSerializable;

/**
 *
 * @param <P> concrete parameter type
 */
public interface Parameter<P extends Parameter<P>> extends JSONSerializable {
    Logger logger = LoggerFactory.getLogger(Parameter.class);
    String getName();
}
