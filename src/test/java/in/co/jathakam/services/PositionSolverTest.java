package in.co.jathakam.services;

import in.co.jathakam.pojos.CelestialBody;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Range and continuity checks for the Sun, Moon and lunar node solvers.
 */
public class PositionSolverTest {

    private static final double START_JD = 2415020.5;    // 1900-01-01
    private static final double END_JD = 2488069.5;      // 2100-01-01

    private final AyanamsaModel ayanamsaModel = new AyanamsaModel();
    private final SolarPositionSolver solar = new SolarPositionSolver(ayanamsaModel);
    private final LunarPositionSolver lunar = new LunarPositionSolver(ayanamsaModel);
    private final LunarNodeSolver nodes = new LunarNodeSolver(ayanamsaModel);

    private static void assertInRange(double longitude, String label) {
        assertTrue(longitude >= 0.0 && longitude < 360.0, label + " out of [0, 360): " + longitude);
    }

    @Test
    public void test_allSolvers_stayInZeroTo360() {
        for (double jd = START_JD; jd <= END_JD; jd += 97.3) {
            assertInRange(solar.siderealLongitude(jd), "Sun at " + jd);
            assertInRange(lunar.siderealLongitude(jd), "Moon at " + jd);
            assertInRange(nodes.rahu(jd), "Rahu at " + jd);
            assertInRange(nodes.ketu(jd), "Ketu at " + jd);
        }
    }

    @Test
    public void test_sunAtJ2000_nearTropical280MinusAyanamsa() {
        // Apparent tropical Sun at J2000 is about 280.37 degrees
        assertEquals(280.37 - 23.85, solar.siderealLongitude(AngleMath.J2000), 0.05);
    }

    @Test
    public void test_sun_advancesAboutOneDegreePerDay() {
        double today = solar.siderealLongitude(AngleMath.J2000);
        double tomorrow = solar.siderealLongitude(AngleMath.J2000 + 1);
        assertEquals(1.0, tomorrow - today, 0.05);
    }

    @Test
    public void test_moon_advancesTwelveToFifteenDegreesPerDay() {
        for (double jd = AngleMath.J2000; jd < AngleMath.J2000 + 30; jd += 1) {
            double step = AngleMath.normalize(lunar.siderealLongitude(jd + 1) - lunar.siderealLongitude(jd));
            assertTrue(step > 11.5 && step < 15.5, "Moon moved " + step + " degrees in a day at " + jd);
        }
    }

    @Test
    public void test_rahuAndKetu_areExactlyOpposite() {
        for (double jd = START_JD; jd <= END_JD; jd += 113.7) {
            double separation = AngleMath.normalize(nodes.ketu(jd) - nodes.rahu(jd));
            assertEquals(180.0, separation, 1e-9, "Ketu not opposite Rahu at " + jd);
        }
    }

    @Test
    public void test_meanNode_movesRetrograde() {
        double now = nodes.meanAscendingNode(AngleMath.J2000);
        double later = nodes.meanAscendingNode(AngleMath.J2000 + 100);
        double step = AngleMath.normalize(later - now);
        // About -5.3 degrees per 100 days
        assertTrue(step > 350.0, "Node should regress, moved " + step);
    }

    @Test
    public void test_keplerianBodyFlag_matchesPlanetSolverCoverage() {
        KeplerianPlanetSolver planets = new KeplerianPlanetSolver(ayanamsaModel);
        for (CelestialBody body : CelestialBody.values()) {
            if (body.isKeplerian()) {
                assertInRange(planets.siderealLongitude(body, AngleMath.J2000), body.name());
            } else {
                assertThrows(IllegalArgumentException.class, () -> planets.siderealLongitude(body, AngleMath.J2000));
            }
        }
    }
}
