package in.co.jathakam.services;

import in.co.jathakam.pojos.CelestialBody;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static in.co.jathakam.services.AngleMath.sinDeg;

/**
 * Longitudes of Mercury, Venus, Mars, Jupiter and Saturn from mean orbital elements and
 * Kepler's equation, with a single great-inequality term coupling Jupiter and Saturn.
 *
 * <h2>Jupiter / Saturn coupling</h2>
 * Jupiter adds {@code 0.33 sin(2 (J - S))} and Saturn adds {@code 0.81 sin(2 (S - J))}. The
 * partner's longitude is its own uncorrected sidereal value: while one of the pair is being
 * resolved it sits in an in-progress set, and the partner sees it there and skips its correction.
 * The set is created per top-level call and copied on the way down, so two requests never share
 * it. This is a one-level approximation, not a simultaneous solution of both corrections.
 */
public class KeplerianPlanetSolver {

    private static final Map<CelestialBody, OrbitalElements> ELEMENTS;

    static {
        Map<CelestialBody, OrbitalElements> elements = new EnumMap<>(CelestialBody.class);
        elements.put(CelestialBody.MERCURY, new OrbitalElements(252.250906, 149472.6746358, 0.20563175, 174.7948, 0.0));
        elements.put(CelestialBody.VENUS, new OrbitalElements(181.979801, 58517.8156760, 0.00677323, 50.4161, 0.0));
        elements.put(CelestialBody.MARS, new OrbitalElements(355.433, 19140.299, 0.09341233, 19.3870, 0.0));
        elements.put(CelestialBody.JUPITER, new OrbitalElements(34.351519, 3034.9056606, 0.04839266, 20.0202, 0.33));
        elements.put(CelestialBody.SATURN, new OrbitalElements(50.077444, 1222.1138488, 0.05415060, 317.0207, 0.81));
        ELEMENTS = Collections.unmodifiableMap(elements);
    }

    private final AyanamsaModel ayanamsaModel;

    public KeplerianPlanetSolver(AyanamsaModel ayanamsaModel) {
        this.ayanamsaModel = ayanamsaModel;
    }

    /**
     * Sidereal longitude in [0, 360) of one of the five Keplerian planets.
     *
     * @throws IllegalArgumentException for the Sun, Moon or lunar nodes
     */
    public double siderealLongitude(CelestialBody planet, double julianDay) {
        return siderealLongitude(planet, julianDay, EnumSet.noneOf(CelestialBody.class));
    }

    /**
     * @param inProgress bodies already being resolved higher up this call; never modified
     */
    double siderealLongitude(CelestialBody planet, double julianDay, Set<CelestialBody> inProgress) {
        OrbitalElements elements = elementsOf(planet);
        double trueLongitude = trueLongitude(elements, julianDay);

        CelestialBody partner = perturbingPartner(planet);
        if (partner != null && !inProgress.contains(partner)) {
            Set<CelestialBody> resolving = EnumSet.noneOf(CelestialBody.class);
            resolving.addAll(inProgress);
            resolving.add(planet);
            double partnerLongitude = siderealLongitude(partner, julianDay, resolving);
            trueLongitude += elements.perturbationAmplitude * sinDeg(2 * (trueLongitude - partnerLongitude));
        }
        return ayanamsaModel.toSidereal(trueLongitude, julianDay);
    }

    /**
     * Tropical heliocentric-element longitude {@code L + (ν - M)} in [0, 360), without the
     * Jupiter/Saturn term.
     */
    public double trueLongitude(CelestialBody planet, double julianDay) {
        return trueLongitude(elementsOf(planet), julianDay);
    }

    private static double trueLongitude(OrbitalElements elements, double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        double meanLongitude = elements.meanLongitudeAtEpoch + elements.rate * t;
        double meanAnomaly = AngleMath.normalize(elements.meanAnomalyAtEpoch + elements.rate * t);

        double e = elements.eccentricity;
        KeplerSolution solution = solveKepler(Math.toRadians(meanAnomaly), e);
        double halfE = solution.eccentricAnomaly / 2;
        double trueAnomaly = 2 * Math.atan2(Math.sqrt(1 + e) * Math.sin(halfE), Math.sqrt(1 - e) * Math.cos(halfE));

        return AngleMath.normalize(meanLongitude + Math.toDegrees(trueAnomaly) - meanAnomaly);
    }

    /**
     * Solve {@code E = M + e sin E} by fixed-point iteration from {@code E0 = M + e sin M}.
     * Stops after {@link ChartServiceConfig#KEPLER_MAX_ITERATIONS} steps or once two successive
     * estimates differ by less than {@link ChartServiceConfig#KEPLER_TOLERANCE_RADIANS}; on
     * convergence the earlier of the two estimates is kept.
     *
     * @param meanAnomaly mean anomaly in radians
     * @param eccentricity orbital eccentricity, 0 &lt;= e &lt; 1
     */
    public static KeplerSolution solveKepler(double meanAnomaly, double eccentricity) {
        double estimate = meanAnomaly + eccentricity * Math.sin(meanAnomaly);
        int iterations = 0;
        boolean converged = false;
        while (iterations < ChartServiceConfig.KEPLER_MAX_ITERATIONS) {
            double next = meanAnomaly + eccentricity * Math.sin(estimate);
            iterations++;
            if (Math.abs(next - estimate) < ChartServiceConfig.KEPLER_TOLERANCE_RADIANS) {
                converged = true;
                break;
            }
            estimate = next;
        }
        return new KeplerSolution(estimate, iterations, converged);
    }

    private static CelestialBody perturbingPartner(CelestialBody planet) {
        if (planet == CelestialBody.JUPITER) return CelestialBody.SATURN;
        if (planet == CelestialBody.SATURN) return CelestialBody.JUPITER;
        return null;
    }

    private static OrbitalElements elementsOf(CelestialBody planet) {
        OrbitalElements elements = ELEMENTS.get(planet);
        if (elements == null) {
            throw new IllegalArgumentException("No orbital elements for " + planet);
        }
        return elements;
    }

    /**
     * Outcome of {@link #solveKepler}: the eccentric anomaly (radians) and how many
     * fixed-point steps were taken.
     */
    public static final class KeplerSolution {
        public final double eccentricAnomaly;
        public final int iterations;
        public final boolean converged;

        KeplerSolution(double eccentricAnomaly, int iterations, boolean converged) {
            this.eccentricAnomaly = eccentricAnomaly;
            this.iterations = iterations;
            this.converged = converged;
        }
    }

    // Degrees, degrees per Julian century, dimensionless
    private static final class OrbitalElements {
        final double meanLongitudeAtEpoch;
        final double rate;
        final double eccentricity;
        final double meanAnomalyAtEpoch;
        final double perturbationAmplitude;

        OrbitalElements(double meanLongitudeAtEpoch, double rate, double eccentricity,
                        double meanAnomalyAtEpoch, double perturbationAmplitude) {
            this.meanLongitudeAtEpoch = meanLongitudeAtEpoch;
            this.rate = rate;
            this.eccentricity = eccentricity;
            this.meanAnomalyAtEpoch = meanAnomalyAtEpoch;
            this.perturbationAmplitude = perturbationAmplitude;
        }
    }
}
