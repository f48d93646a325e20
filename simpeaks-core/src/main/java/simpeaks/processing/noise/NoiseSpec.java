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
package simpeaks.processing.noise;

public final class NoiseSpec {
    public final static NoiseSpec NONE = new NoiseSpec(NoiseType.NONE, 0, false, 0, 0);
    private final NoiseType type;
    private final double level, lower, upper;
    private final boolean clamp;

    /**
     * @param type distribution of the noise
     * @param level multiplicative factor applied to each draw
     * @param clamp whether scaled draws are clamped to [lower; upper]
     * @param lower lower clamping bound
     * @param upper upper clamping bound
     */
    public NoiseSpec(NoiseType type, double level, boolean clamp, double lower, double upper) {
        if (type==null) throw new IllegalArgumentException("Noise type cannot be null");
        this.type = type;
        this.level = level;
        this.clamp = clamp;
        this.lower = lower;
        this.upper = upper;
    }

    public NoiseType getType() {return type;}
    public double getLevel() {return level;}
    public boolean isClamp() {return clamp;}
    public double getLower() {return lower;}
    public double getUpper() {return upper;}
    public boolean isEnabled() {return type!=NoiseType.NONE;}

    @Override
    public String toString() {
        return type+" level="+level+(clamp ? " clamp=["+lower+";"+upper+"]" : "");
    }
}
