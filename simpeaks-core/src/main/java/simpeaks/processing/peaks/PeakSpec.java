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
package simpeaks.processing.peaks;

import simpeaks.image.BoundingBox;

/**
 * Immutable description of one peak, read once per frame.
 * fwhm and correlation are not validated here: shape functions clamp fwhm to at least 1 and correlation to [-1; 1]
 */
public final class PeakSpec {
    private final double positionX, positionY, fwhmX, fwhmY, amplitude, correlation, param1, param2;
    private final BoundingBox bounds;

    private PeakSpec(Builder builder) {
        this.positionX = builder.positionX;
        this.positionY = builder.positionY;
        this.fwhmX = builder.fwhmX;
        this.fwhmY = builder.fwhmY;
        this.amplitude = builder.amplitude;
        this.correlation = builder.correlation;
        this.param1 = builder.param1;
        this.param2 = builder.param2;
        this.bounds = builder.bounds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getPositionX() {return positionX;}
    public double getPositionY() {return positionY;}
    public double getFwhmX() {return fwhmX;}
    public double getFwhmY() {return fwhmY;}
    public double getAmplitude() {return amplitude;}
    public double getCorrelation() {return correlation;}
    /**
     * @return first shape parameter (Moffat beta)
     */
    public double getParam1() {return param1;}
    public double getParam2() {return param2;}
    /**
     * @return inclusive bin range the peak is restricted to, or null if the peak covers the whole frame
     */
    public BoundingBox getBounds() {return bounds;}
    public boolean hasBounds() {return bounds!=null;}

    @Override
    public String toString() {
        return "Peak{pos=("+positionX+";"+positionY+") fwhm=("+fwhmX+";"+fwhmY+") amp="+amplitude+" cor="+correlation+" p1="+param1+" p2="+param2+(bounds==null?"":" bounds="+bounds)+"}";
    }

    public static class Builder {
        double positionX, positionY, fwhmX = 1, fwhmY = 1, amplitude, correlation, param1, param2;
        BoundingBox bounds;
        public Builder setPosition(double x, double y) {
            this.positionX = x;
            this.positionY = y;
            return this;
        }
        public Builder setPosition(double x) {
            return setPosition(x, 0);
        }
        public Builder setFwhm(double x, double y) {
            this.fwhmX = x;
            this.fwhmY = y;
            return this;
        }
        public Builder setFwhm(double x) {
            return setFwhm(x, x);
        }
        public Builder setAmplitude(double amplitude) {
            this.amplitude = amplitude;
            return this;
        }
        public Builder setCorrelation(double correlation) {
            this.correlation = correlation;
            return this;
        }
        public Builder setParams(double param1, double param2) {
            this.param1 = param1;
            this.param2 = param2;
            return this;
        }
        public Builder setBounds(BoundingBox bounds) {
            this.bounds = bounds;
            return this;
        }
        public PeakSpec build() {
            return new PeakSpec(this);
        }
    }
}
