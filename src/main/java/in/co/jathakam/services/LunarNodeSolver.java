package in.co.jathakam.services;

/**
 * Mean lunar nodes. Rahu is the mean ascending node; Ketu is always the point opposite it.
 */
public class LunarNodeSolver {

    private final AyanamsaModel ayanamsaModel;

    public LunarNodeSolver(AyanamsaModel ayanamsaModel) {
        this.ayanamsaModel = ayanamsaModel;
    }

    /** Tropical longitude of the mean ascending node in [0, 360). */
    public double meanAscendingNode(double julianDay) {
        double t = AngleMath.julianCenturies(julianDay);
        double omega = 125.0445479 - 1934.1362891 * t + 0.0020754 * t * t + t * t * t / 467441.0;
        return AngleMath.normalize(omega);
    }

    public double rahu(double julianDay) {
        return ayanamsaModel.toSidereal(meanAscendingNode(julianDay), julianDay);
    }

    public double ketu(double julianDay) {
        return AngleMath.normalize(rahu(julianDay) + 180.0);
    }
}
