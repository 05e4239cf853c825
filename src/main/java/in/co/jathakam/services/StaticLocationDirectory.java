package in.co.jathakam.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.co.jathakam.pojos.Location;
import in.co.jathakam.pojos.PlaceEntry;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Location directory backed by a JSON array bundled on the classpath.
 * Loaded once at construction; read-only afterwards.
 *
 * <p>Lookup tries the exact name first, then a trimmed, case-insensitive match.</p>
 */
public class StaticLocationDirectory implements LocationDirectory {

    private final Map<String, PlaceEntry> byName;
    private final Map<String, PlaceEntry> byNormalizedName;

    public StaticLocationDirectory() {
        this(ChartServiceConfig.CITIES_RESOURCE);
    }

    public StaticLocationDirectory(String resource) {
        this(load(resource));
    }

    public StaticLocationDirectory(List<PlaceEntry> entries) {
        Map<String, PlaceEntry> exact = new LinkedHashMap<>();
        Map<String, PlaceEntry> normalized = new LinkedHashMap<>();
        for (PlaceEntry entry : entries) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new IllegalArgumentException("Location entry without a name");
            }
            if (!Location.isValid(entry.getLatitude(), entry.getLongitude())) {
                throw new IllegalArgumentException("Location entry out of range: " + entry.getName());
            }
            exact.put(entry.getName(), entry);
            normalized.putIfAbsent(normalize(entry.getName()), entry);
        }
        this.byName = Collections.unmodifiableMap(exact);
        this.byNormalizedName = Collections.unmodifiableMap(normalized);
    }

    @Override
    public Optional<PlaceEntry> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        PlaceEntry entry = byName.get(name);
        if (entry == null) {
            entry = byNormalizedName.get(normalize(name));
        }
        return Optional.ofNullable(entry);
    }

    @Override
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(byName.keySet()));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static List<PlaceEntry> load(String resource) {
        try (InputStream in = StaticLocationDirectory.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Location directory resource not found: " + resource);
            }
            List<PlaceEntry> entries = new ObjectMapper().readValue(in, new TypeReference<List<PlaceEntry>>() {});
            LoggingService.debug("location_directory_loaded", LoggingService.data("resource", resource, "count", entries.size()));
            return entries;
        } catch (IOException e) {
            LoggingService.error("location_directory_load_failed", e);
            throw new IllegalStateException("Could not read location directory " + resource, e);
        }
    }
}
