package in.co.jathakam.services;

import in.co.jathakam.pojos.PlaceEntry;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a birth place name to coordinates and a UTC offset.
 */
public interface LocationDirectory {

    Optional<PlaceEntry> find(String name);

    /** All known place names, in directory order. */
    List<String> names();
}
