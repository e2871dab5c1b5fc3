package org.janelia.astrometry.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Reference star loaded from a catalog.
 *
 * The fixed fields are common to all catalogs; anything else a catalog provides
 * (identifiers, colors, proper motions, ...) is kept in the extras map.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogStar
        implements Serializable {

    /** Orders stars by magnitude (brightest first) with unknown magnitudes last. */
    public static final Comparator<CatalogStar> BRIGHTEST_FIRST =
            Comparator.comparing(CatalogStar::getMagnitude, Comparator.nullsLast(Comparator.naturalOrder()));

    private final double ra;
    private final double dec;
    private final Double magnitude;
    private final Double diameter;
    private final Map<String, String> extras;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CatalogStar() {
        this(0.0, 0.0, null, null, null);
    }

    public CatalogStar(final double ra,
                       final double dec,
                       final Double magnitude) {
        this(ra, dec, magnitude, null, null);
    }

    public CatalogStar(final double ra,
                       final double dec,
                       final Double magnitude,
                       final Double diameter,
                       final Map<String, String> extras) {
        this.ra = ra;
        this.dec = dec;
        this.magnitude = magnitude;
        this.diameter = diameter;
        this.extras = extras == null ? null : new LinkedHashMap<>(extras);
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    @JsonIgnore
    public CelestialPoint getPosition() {
        return new CelestialPoint(ra, dec);
    }

    public Double getMagnitude() {
        return magnitude;
    }

    public Double getDiameter() {
        return diameter;
    }

    public Map<String, String> getExtras() {
        return extras == null ? null : Collections.unmodifiableMap(extras);
    }

    @JsonIgnore
    public String getExtra(final String name) {
        return extras == null ? null : extras.get(name);
    }

    @Override
    public String toString() {
        return "{ra: " + ra + ", dec: " + dec + ", magnitude: " + magnitude + '}';
    }
}
