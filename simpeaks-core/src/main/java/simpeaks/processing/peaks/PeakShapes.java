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

/**
 * Unnormalized peak shapes, evaluated at a point (x) or (x, y) expressed in bins.
 * All functions are pure. FWHM values lower than 1 are replaced by 1, correlation is clamped to [-1; 1], and a Moffat beta within {@link #ZERO_CHECK} of zero is replaced by 1.
 * Bivariate Gaussian and Laplace distributions are degenerate for |rho| = 1, in which case a non-finite value is returned.
 */
public class PeakShapes {
    public final static double ZERO_CHECK = 1e-12;
    // 2 sqrt(2 ln 2)
    public final static double TWO_SQRT_TWO_LN2 = 2.3548200450309493;
    // sqrt(2 pi)
    public final static double SQRT_TWO_PI = 2.5066282746310002;
    // 2 ln 2
    public final static double TWO_LN2 = 1.3862943611198906;
    // Thompson-Cox-Hastings coefficients
    static final double PV_P1 = 2.69269, PV_P2 = 2.42843, PV_P3 = 4.47163, PV_P4 = 0.07842;
    static final double PV_E1 = 1.36603, PV_E2 = 0.47719, PV_E3 = 0.11116;

    private PeakShapes() {}

    public static double zeroCheck(double value) {
        if (value > -ZERO_CHECK && value < ZERO_CHECK) return 1.0;
        return value;
    }
    static double fwhm(double fwhm) {
        return Math.max(1.0, fwhm);
    }
    static double correlation(double rho) {
        return Math.min(1.0, Math.max(-1.0, rho));
    }
    static double smoothStepPolynomial(double t) {
        return 6*Math.pow(t, 5) - 15*Math.pow(t, 4) + 10*Math.pow(t, 3);
    }

    // 1D

    public static double square(PeakSpec p, double x) {
        double w = fwhm(p.getFwhmX());
        double pos = p.getPositionX();
        return (x > (int)(pos - w/2.0) && x <= (int)(pos + w/2.0)) ? 1.0 : 0.0;
    }

    public static double triangle(PeakSpec p, double x) {
        double w = fwhm(p.getFwhmX());
        double pos = p.getPositionX();
        double b = 1.0 / w;
        if (x > (int)pos) b = -b;
        return Math.max(0.0, 1.0 + b * (x - pos));
    }

    public static double gaussian(PeakSpec p, double x) {
        double sigma = fwhm(p.getFwhmX()) / TWO_SQRT_TWO_LN2;
        double d = x - p.getPositionX();
        return (1.0 / (sigma * SQRT_TWO_PI)) * Math.exp(-(d*d) / (2.0 * sigma * sigma));
    }

    public static double lorentz(PeakSpec p, double x) {
        double gamma = fwhm(p.getFwhmX()) / 2.0;
        double d = x - p.getPositionX();
        return (1.0 / (Math.PI * gamma)) * ((gamma * gamma) / (d*d + gamma * gamma));
    }

    public static double pseudoVoigt(PeakSpec p, double x) {
        double w = fwhm(p.getFwhmX());
        double eta = pseudoVoigtEta(w, w);
        return (1.0 - eta) * gaussian(p, x) + eta * lorentz(p, x);
    }

    /**
     * Thompson, Cox &amp; Hastings approximation of the mixing ratio of the pseudo-Voigt profile
     * @param fwhmG FWHM of the Gaussian component
     * @param fwhmL FWHM of the Lorentzian component
     * @return eta
     */
    public static double pseudoVoigtEta(double fwhmG, double fwhmL) {
        double sum = Math.pow(fwhmG, 5) + PV_P1 * Math.pow(fwhmG, 4) * fwhmL + PV_P2 * Math.pow(fwhmG, 3) * Math.pow(fwhmL, 2)
                + PV_P3 * Math.pow(fwhmG, 2) * Math.pow(fwhmL, 3) + PV_P4 * fwhmG * Math.pow(fwhmL, 4) + Math.pow(fwhmL, 5);
        double r = fwhmL / Math.pow(sum, 0.2);
        return PV_E1 * r - PV_E2 * r * r + PV_E3 * r * r * r;
    }

    public static double laplace(PeakSpec p, double x) {
        double b = fwhm(p.getFwhmX()) / TWO_LN2;
        return (1.0 / (2.0 * b)) * Math.exp(-Math.abs(x - p.getPositionX()) / b);
    }

    public static double moffat(PeakSpec p, double x) {
        double d = x - p.getPositionX();
        return moffatRadial(fwhm(p.getFwhmX()), zeroCheck(p.getParam1()), d*d);
    }

    static double moffatRadial(double w, double beta, double d2) {
        double alpha = w / (2.0 * Math.sqrt(Math.pow(2.0, 1.0 / beta) - 1));
        double alpha2 = alpha * alpha;
        return ((beta - 1) / (Math.PI * alpha2)) * Math.pow(1 + d2 / alpha2, -beta);
    }

    public static double smoothStep(PeakSpec p, double x) {
        double w = fwhm(p.getFwhmX());
        return smoothStepPolynomial(ramp(x, p.getPositionX(), w));
    }

    static double ramp(double x, double pos, double w) {
        double lowEdge = pos - w / 2.0;
        return Math.max(0.0, Math.min((x - lowEdge) / w, 1.0));
    }

    // 2D

    public static double square2D(PeakSpec p, double x, double y) {
        double wx = fwhm(p.getFwhmX()), wy = fwhm(p.getFwhmY());
        double px = p.getPositionX(), py = p.getPositionY();
        boolean inX = x > (int)(px - wx/2.0) && x <= (int)(px + wx/2.0);
        boolean inY = y > (int)(py - wy/2.0) && y <= (int)(py + wy/2.0);
        return inX && inY ? 1.0 : 0.0;
    }

    public static double pyramid2D(PeakSpec p, double x, double y) {
        double wx = fwhm(p.getFwhmX()), wy = fwhm(p.getFwhmY());
        double px = p.getPositionX(), py = p.getPositionY();
        double b = 1.0 / wx;
        double c = 1.0 / wy;
        if (x > (int)px) b = -b;
        if (y > (int)py) c = -c;
        return Math.max(0.0, 1.0 + b * (x - px) + c * (y - py));
    }

    /**
     * Elliptical cone of height wx + wy whose base is the ellipse of semi-axes wx and wy
     */
    public static double cone2D(PeakSpec p, double x, double y) {
        double wx = fwhm(p.getFwhmX()), wy = fwhm(p.getFwhmY());
        double peak = wx + wy;
        double dx = x - p.getPositionX(), dy = y - p.getPositionY();
        double d = Math.sqrt(dx*dx + dy*dy);
        if (d == 0) return peak;
        double theta = Math.asin(dy / d);
        double r = (wx * wy) / Math.sqrt(Math.pow(wy * Math.cos(theta), 2) + Math.pow(wx * Math.sin(theta), 2));
        return Math.max(0.0, (r - d) * (peak / r));
    }

    public static double gaussian2D(PeakSpec p, double x, double y) {
        double sx = fwhm(p.getFwhmX()) / TWO_SQRT_TWO_LN2;
        double sy = fwhm(p.getFwhmY()) / TWO_SQRT_TWO_LN2;
        double rho = correlation(p.getCorrelation());
        double oneMinusRho2 = 1 - rho * rho;
        double amp = 1.0 / (2.0 * Math.PI * sx * sy * Math.sqrt(oneMinusRho2));
        double u = (x - p.getPositionX()) / sx;
        double v = (y - p.getPositionY()) / sy;
        return amp * Math.exp(-(u*u - 2*rho*u*v + v*v) / (2 * oneMinusRho2));
    }

    /**
     * Symmetric bivariate Cauchy distribution, only the X FWHM is used
     */
    public static double lorentz2D(PeakSpec p, double x, double y) {
        double gamma = fwhm(p.getFwhmX()) / 2.0;
        double dx = x - p.getPositionX(), dy = y - p.getPositionY();
        return (1.0 / (2 * Math.PI)) * (gamma / Math.pow(dx*dx + dy*dy + gamma*gamma, 1.5));
    }

    public static double pseudoVoigt2D(PeakSpec p, double x, double y) {
        double w = (fwhm(p.getFwhmX()) + fwhm(p.getFwhmY())) / 2.0;
        double eta = pseudoVoigtEta(w, w);
        return (1.0 - eta) * gaussian2D(p, x, y) + eta * lorentz2D(p, x, y);
    }

    public static double laplace2D(PeakSpec p, double x, double y) {
        // standard deviation is sqrt(2) times the scale b
        double sx = Math.sqrt(2.0) * (fwhm(p.getFwhmX()) / TWO_LN2);
        double sy = Math.sqrt(2.0) * (fwhm(p.getFwhmY()) / TWO_LN2);
        double rho = correlation(p.getCorrelation());
        double oneMinusRho2 = 1 - rho * rho;
        double amp = 1.0 / (Math.PI * sx * sy * Math.sqrt(oneMinusRho2));
        double u = (x - p.getPositionX()) / sx;
        double v = (y - p.getPositionY()) / sy;
        return amp * Math.exp(-Math.sqrt(2.0 * (u*u - 2*rho*u*v + v*v) / oneMinusRho2));
    }

    /**
     * Symmetric Moffat, only the X FWHM is used
     */
    public static double moffat2D(PeakSpec p, double x, double y) {
        double dx = x - p.getPositionX(), dy = y - p.getPositionY();
        return moffatRadial(fwhm(p.getFwhmX()), zeroCheck(p.getParam1()), dx*dx + dy*dy);
    }

    public static double smoothStep2D(PeakSpec p, double x, double y) {
        double t = (ramp(x, p.getPositionX(), fwhm(p.getFwhmX())) + ramp(y, p.getPositionY(), fwhm(p.getFwhmY()))) / 2.0;
        return smoothStepPolynomial(t);
    }
}
