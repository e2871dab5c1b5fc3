package org.janelia.astrometry.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.ImageRegion;

/**
 * Synthetic star field rendered from catalog stars that an image is aligned against.
 */
public class ReferenceTemplate {

    private final int width;
    private final int height;
    private final List<TemplateStar> stars;
    private final ImageRegion clipRegion;

    public ReferenceTemplate(final int width,
                             final int height,
                             final List<TemplateStar> stars,
                             final ImageRegion clipRegion) {
        this.width = width;
        this.height = height;
        this.stars = Collections.unmodifiableList(new ArrayList<>(stars));
        this.clipRegion = clipRegion;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<TemplateStar> getStars() {
        return stars;
    }

    public int size() {
        return stars.size();
    }

    /**
     * @return region the stars were clipped to, or null if the whole template was rendered.
     */
    public ImageRegion getClipRegion() {
        return clipRegion;
    }

    @Override
    public String toString() {
        return "{size: " + width + "x" + height + ", numberOfStars: " + stars.size() +
               ", clipRegion: " + clipRegion + '}';
    }
}
