package in.co.jathakam.services;

import in.co.jathakam.pojos.BirthMoment;
import in.co.jathakam.pojos.BodyPlacement;
import in.co.jathakam.pojos.CelestialBody;
import in.co.jathakam.pojos.ChartOutcome;
import in.co.jathakam.pojos.ChartResult;
import in.co.jathakam.pojos.ErrorKind;
import in.co.jathakam.pojos.Location;
import in.co.jathakam.pojos.PlaceEntry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Computes a complete chart in two phases:
 * <ol>
 *   <li>Julian Day, ayanamsa, ascendant and navamsa ascendant, once per chart;</li>
 *   <li>for each body in {@link CelestialBody} order, its sidereal longitude and placement.</li>
 * </ol>
 * Input problems are detected before phase 1 starts. Every failure is returned as a failed
 * {@link ChartOutcome}; a partial chart is never produced.
 *
 * <p>Holds no mutable state; one instance can serve concurrent requests.</p>
 */
public class ChartOrchestrator {

    private static final String OPERATION = "chart_computation";

    private final AyanamsaModel ayanamsaModel;
    private final SolarPositionSolver solarSolver;
    private final LunarPositionSolver lunarSolver;
    private final KeplerianPlanetSolver planetSolver;
    private final LunarNodeSolver nodeSolver;
    private final AscendantSolver ascendantSolver;
    private final LocationDirectory locationDirectory;

    public ChartOrchestrator(LocationDirectory locationDirectory) {
        this(new AyanamsaModel(), locationDirectory);
    }

    private ChartOrchestrator(AyanamsaModel ayanamsaModel, LocationDirectory locationDirectory) {
        this(ayanamsaModel,
                new SolarPositionSolver(ayanamsaModel),
                new LunarPositionSolver(ayanamsaModel),
                new KeplerianPlanetSolver(ayanamsaModel),
                new LunarNodeSolver(ayanamsaModel),
                new AscendantSolver(ayanamsaModel),
                locationDirectory);
    }

    public ChartOrchestrator(AyanamsaModel ayanamsaModel, SolarPositionSolver solarSolver,
                             LunarPositionSolver lunarSolver, KeplerianPlanetSolver planetSolver,
                             LunarNodeSolver nodeSolver, AscendantSolver ascendantSolver,
                             LocationDirectory locationDirectory) {
        this.ayanamsaModel = ayanamsaModel;
        this.solarSolver = solarSolver;
        this.lunarSolver = lunarSolver;
        this.planetSolver = planetSolver;
        this.nodeSolver = nodeSolver;
        this.ascendantSolver = ascendantSolver;
        this.locationDirectory = locationDirectory;
    }

    // =========================================================================
    // Entry points
    // =========================================================================

    public ChartOutcome compute(BirthMoment moment, Location location) {
        return run(moment, location, null);
    }

    /**
     * Chart for explicit coordinates. Date is {@code yyyy-MM-dd}, time {@code HH:mm[:ss[.fff]]}.
     */
    public ChartOutcome compute(String date, String time, double utcOffsetHours, double latitude, double longitude) {
        try {
            BirthMoment moment = TimeConverter.parse(date, time, utcOffsetHours);
            return run(moment, locationOf(latitude, longitude), null);
        } catch (ChartComputationException e) {
            return rejected(e);
        }
    }

    /**
     * Chart for a place name resolved through the location directory; the directory's UTC offset
     * for that place is used. Date and time are checked before the place is looked up.
     */
    public ChartOutcome compute(String date, String time, String placeName) {
        try {
            BirthMoment parsed = TimeConverter.parse(date, time, 0.0);
            Optional<PlaceEntry> place = locationDirectory == null ? Optional.empty() : locationDirectory.find(placeName);
            if (place.isEmpty()) {
                throw new ChartComputationException(ErrorKind.LOCATION_UNRESOLVED,
                        "City " + placeName + " not found in database");
            }
            PlaceEntry entry = place.get();
            BirthMoment moment = new BirthMoment(parsed.getDate(), parsed.getTime(), entry.getUtcOffset());
            return run(moment, locationOf(entry.getLatitude(), entry.getLongitude()), entry.getName());
        } catch (ChartComputationException e) {
            return rejected(e);
        }
    }

    // =========================================================================
    // Phases
    // =========================================================================

    private ChartOutcome run(BirthMoment moment, Location location, String placeName) {
        Map<String, Object> logData = LoggingService.data(
                "birthMoment", String.valueOf(moment), "location", String.valueOf(location));
        long startTime = LoggingService.logOperationStart(OPERATION, logData);
        try {
            ChartResult chart = computeChart(moment, location, placeName);
            LoggingService.logOperationEnd(OPERATION, startTime, LoggingService.data(
                    "julianDay", chart.getJulianDay(), "ascendantSign", chart.getAscendantSign().name()));
            return ChartOutcome.success(chart);
        } catch (ChartComputationException e) {
            LoggingService.logOperationFailed(OPERATION, startTime, e.getErrorKind().name(), e.getMessage());
            return ChartOutcome.failure(e.getErrorKind(), e.getMessage());
        }
    }

    ChartResult computeChart(BirthMoment moment, Location location, String placeName) throws ChartComputationException {
        if (moment == null || location == null) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT, "Birth moment and location are required");
        }

        // Phase 1: frame of the chart
        double julianDay = TimeConverter.toJulianDay(moment);
        double ayanamsa = ayanamsaModel.ayanamsa(julianDay);
        double ascendant = ascendantSolver.siderealAscendant(julianDay, location);
        double navamsaAscendant = ChartMapper.navamsaAscendant(ascendant);

        // Phase 2: bodies
        Map<CelestialBody, BodyPlacement> placements = new EnumMap<>(CelestialBody.class);
        for (CelestialBody body : CelestialBody.values()) {
            double longitude = siderealLongitude(body, julianDay);
            placements.put(body, ChartMapper.place(body, longitude, ascendant, navamsaAscendant));
        }

        return new ChartResult(
                ascendant,
                ChartMapper.signOf(ascendant),
                ChartMapper.nakshatraOf(ascendant),
                navamsaAscendant,
                placements,
                julianDay,
                ayanamsa,
                moment,
                location,
                placeName);
    }

    /**
     * Raw sidereal longitude of one body; each Keplerian planet is its own top-level solver call.
     */
    double siderealLongitude(CelestialBody body, double julianDay) {
        if (body.isKeplerian()) {
            return planetSolver.siderealLongitude(body, julianDay);
        }
        switch (body) {
            case SUN:
                return solarSolver.siderealLongitude(julianDay);
            case MOON:
                return lunarSolver.siderealLongitude(julianDay);
            case RAHU:
                return nodeSolver.rahu(julianDay);
            case KETU:
                return nodeSolver.ketu(julianDay);
            default:
                throw new IllegalStateException("No solver for " + body);
        }
    }

    private static Location locationOf(double latitude, double longitude) throws ChartComputationException {
        if (!Location.isValid(latitude, longitude)) {
            throw new ChartComputationException(ErrorKind.INVALID_INPUT, String.format(Locale.ENGLISH,
                    "Coordinates out of range: latitude=%s, longitude=%s", latitude, longitude));
        }
        return new Location(latitude, longitude);
    }

    private static ChartOutcome rejected(ChartComputationException e) {
        LoggingService.warn(OPERATION + "_rejected", LoggingService.data(
                "errorCode", e.getErrorKind().name(), "errorMessage", e.getMessage()));
        return ChartOutcome.failure(e.getErrorKind(), e.getMessage());
    }
}
