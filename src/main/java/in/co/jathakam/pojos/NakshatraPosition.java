package in.co.jathakam.pojos;

import java.util.Objects;

/**
 * A nakshatra together with the pada (quarter, 1..4) a longitude falls in.
 */
public final class NakshatraPosition {

    private final Nakshatra nakshatra;
    private final int pada;

    public NakshatraPosition(Nakshatra nakshatra, int pada) {
        if (pada < 1 || pada > 4) {
            throw new IllegalArgumentException("Pada must be in 1..4, got " + pada);
        }
        this.nakshatra = Objects.requireNonNull(nakshatra, "nakshatra");
        this.pada = pada;
    }

    public Nakshatra getNakshatra() {
        return nakshatra;
    }

    public int getPada() {
        return pada;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NakshatraPosition)) return false;
        NakshatraPosition that = (NakshatraPosition) o;
        return pada == that.pada && nakshatra == that.nakshatra;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nakshatra, pada);
    }

    @Override
    public String toString() {
        return nakshatra + "/" + pada;
    }
}
