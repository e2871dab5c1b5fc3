package org.janelia.astrometry.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.astrometry.geom.CelestialPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads reference stars from a local comma separated text catalog.
 *
 * Each data line holds ra, dec (degrees) and optionally magnitude and diameter followed by any number
 * of extra columns.  Empty magnitude or diameter fields mean unknown.  Lines starting with '#' are
 * ignored.  An optional first line whose first field is not numeric is treated as a header and supplies
 * the names of the extra columns.
 */
public class CsvCatalogLookup
        implements CatalogLookup {

    public static final int DEFAULT_MAX_STARS = 100000;

    private final Path path;
    private final int maxStars;
    private List<CatalogStar> allStars;

    public CsvCatalogLookup(final Path path) {
        this(path, DEFAULT_MAX_STARS);
    }

    /**
     * @param  path      catalog file.
     * @param  maxStars  maximum number of (brightest) stars returned for a query.
     */
    public CsvCatalogLookup(final Path path,
                            final int maxStars) {
        this.path = path;
        this.maxStars = maxStars;
        this.allStars = null;
    }

    @Override
    public String getCatalogId() {
        return path.toAbsolutePath().toString();
    }

    @Override
    public CatalogQueryResult load(final CelestialPoint center,
                                   final double fovDegrees,
                                   final double limitMagnitude)
            throws CatalogException {

        if (allStars == null) {
            try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                allStars = parse(reader, path.toString());
            } catch (final IOException e) {
                throw new CatalogException("failed to read catalog " + path, e);
            }
            LOG.info("load: read {} stars from {}", allStars.size(), path);
        }

        final double radius = fovDegrees / 2.0;
        final List<CatalogStar> selected = new ArrayList<>();
        for (final CatalogStar star : allStars) {
            final Double magnitude = star.getMagnitude();
            if (((magnitude == null) || (magnitude <= limitMagnitude)) &&
                (center.angularDistance(star.getPosition()) <= radius)) {
                selected.add(star);
            }
        }

        selected.sort(CatalogStar.BRIGHTEST_FIRST);

        final boolean truncated = selected.size() > maxStars;
        final CatalogQueryResult result =
                new CatalogQueryResult(truncated ? selected.subList(0, maxStars) : selected, truncated);

        LOG.debug("load: returning {} for center {}, fov {}, limitMagnitude {}",
                  result, center, fovDegrees, limitMagnitude);

        return result;
    }

    /**
     * @return all stars in the specified catalog text.
     *
     * @throws CatalogException
     *   if any data line cannot be parsed.
     */
    public static List<CatalogStar> parse(final Reader reader,
                                          final String context)
            throws IOException, CatalogException {

        final BufferedReader bufferedReader =
                reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        final List<CatalogStar> stars = new ArrayList<>();
        List<String> columnNames = Collections.emptyList();
        int lineNumber = 0;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            final String[] fields = trimmed.split(",", -1);

            if (stars.isEmpty() && columnNames.isEmpty() && (! isNumeric(fields[0]))) {
                columnNames = new ArrayList<>(fields.length);
                for (final String field : fields) {
                    columnNames.add(field.trim());
                }
                continue;
            }

            if (fields.length < 2) {
                throw new CatalogException("line " + lineNumber + " of " + context +
                                           " must have at least ra and dec fields");
            }

            try {
                final CelestialPoint position = new CelestialPoint(Double.parseDouble(fields[0].trim()),
                                                                   Double.parseDouble(fields[1].trim()));
                final Double magnitude = fields.length > 2 ? parseOptional(fields[2]) : null;
                final Double diameter = fields.length > 3 ? parseOptional(fields[3]) : null;
                Map<String, String> extras = null;
                if (fields.length > 4) {
                    extras = new LinkedHashMap<>();
                    for (int i = 4; i < fields.length; i++) {
                        final String name = i < columnNames.size() ? columnNames.get(i) : "column" + (i + 1);
                        extras.put(name, fields[i].trim());
                    }
                }
                stars.add(new CatalogStar(position.getRa(), position.getDec(), magnitude, diameter, extras));
            } catch (final IllegalArgumentException e) {
                throw new CatalogException("failed to parse line " + lineNumber + " of " + context +
                                           ": '" + line + "'", e);
            }
        }

        return stars;
    }

    private static Double parseOptional(final String field) {
        final String trimmed = field.trim();
        return trimmed.isEmpty() ? null : Double.valueOf(trimmed);
    }

    private static boolean isNumeric(final String field) {
        try {
            Double.parseDouble(field.trim());
            return true;
        } catch (final NumberFormatException e) {
            return false;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CsvCatalogLookup.class);
}
