package org.janelia.astrometry.solver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.transform.Homography;
import org.janelia.astrometry.transform.LinearTransform;
import org.janelia.astrometry.transform.SplineFitParameters;
import org.janelia.astrometry.transform.SurfaceSplineTransform;
import org.janelia.astrometry.transform.TransformFitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Optical distortion of a camera/lens combination sampled on a grid.
 *
 * Each sample holds a distorted image position and the offset between it and the position
 * an undistorted (linear) projection would produce.  The text form is a header line followed
 * by one "x,y,dx,dy" line per sample.
 */
public class DistortionModel {

    public static final String HEADER = "ThinPlate,2";
    public static final int GRID_INTERVALS = 30;

    private static final int SPLINE_ORDER = 2;

    private final List<PlanePoint> distortedPoints;
    private final List<PlanePoint> undistortedPoints;
    private final List<PlanePoint> offsets;
    private final SurfaceSplineTransform distortedToOffset;

    /**
     * @throws TransformFitException
     *   if the offset spline cannot be fitted to the samples.
     */
    public DistortionModel(final List<PlanePoint> distortedPoints,
                           final List<PlanePoint> offsets)
            throws TransformFitException {

        if (distortedPoints.size() != offsets.size()) {
            throw new IllegalArgumentException("distortion model point and offset lists differ in size");
        }

        final List<PlanePoint> undistorted = new ArrayList<>(distortedPoints.size());
        for (int i = 0; i < distortedPoints.size(); i++) {
            final PlanePoint d = distortedPoints.get(i);
            final PlanePoint o = offsets.get(i);
            undistorted.add(new PlanePoint(d.getX() - o.getX(), d.getY() - o.getY()));
        }

        this.distortedPoints = Collections.unmodifiableList(new ArrayList<>(distortedPoints));
        this.undistortedPoints = Collections.unmodifiableList(undistorted);
        this.offsets = Collections.unmodifiableList(new ArrayList<>(offsets));
        this.distortedToOffset = SurfaceSplineTransform.fit(this.distortedPoints,
                                                            this.offsets,
                                                            null,
                                                            SplineFitParameters.interpolating(SPLINE_ORDER));
    }

    public static DistortionModel load(final Path path)
            throws IOException, TransformFitException {
        LOG.info("load: reading {}", path);
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Reads a model, skipping the header line and any line that does not hold exactly four values.
     */
    public static DistortionModel read(final Reader reader)
            throws IOException, TransformFitException {

        final BufferedReader bufferedReader =
                reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        final String header = bufferedReader.readLine();
        if (header == null) {
            throw new IOException("distortion model is empty");
        }

        final List<PlanePoint> distorted = new ArrayList<>();
        final List<PlanePoint> offsets = new ArrayList<>();
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            final String[] tokens = line.split(",");
            if (tokens.length != 4) {
                continue;
            }
            try {
                distorted.add(new PlanePoint(Double.parseDouble(tokens[0].trim()), Double.parseDouble(tokens[1].trim())));
                offsets.add(new PlanePoint(Double.parseDouble(tokens[2].trim()), Double.parseDouble(tokens[3].trim())));
            } catch (final NumberFormatException e) {
                throw new IOException("invalid distortion model line '" + line + "'", e);
            }
        }

        return new DistortionModel(distorted, offsets);
    }

    /**
     * Samples the distortion of a solution on a regular grid over the image.
     *
     * For spline solutions the undistorted reference is a similarity transform fitted to the control
     * points and pinned at the image center, otherwise the solution's linear transform.
     *
     * @throws TransformFitException
     *   if the reference transform cannot be fitted or the samples cannot be modeled.
     */
    public static DistortionModel generate(final GeometricSolution solution)
            throws TransformFitException {

        LinearTransform linear = solution.getLinearImageToNative();
        final ControlPoints controlPoints = solution.getControlPoints();
        if (controlPoints != null) {
            final PlanePoint centerI = solution.getImageCenter();
            final PlanePoint centerG = solution.getImageToNative().apply(centerI);
            linear = Homography.fitSimilarity(controlPoints.getImagePoints(),
                                              controlPoints.getNativePoints(),
                                              centerI,
                                              centerG);
        }

        final List<PlanePoint> distorted = new ArrayList<>();
        final List<PlanePoint> offsets = new ArrayList<>();
        for (int y = 0; y <= GRID_INTERVALS; y++) {
            for (int x = 0; x <= GRID_INTERVALS; x++) {
                final PlanePoint linearI = new PlanePoint((double) solution.getWidth() / GRID_INTERVALS * x,
                                                          (double) solution.getHeight() / GRID_INTERVALS * y);
                final PlanePoint distortI = solution.getNativeToImage().apply(linear.apply(linearI));
                distorted.add(linearI);
                offsets.add(new PlanePoint(distortI.getX() - linearI.getX(), distortI.getY() - linearI.getY()));
            }
        }

        return new DistortionModel(distorted, offsets);
    }

    public void write(final Path path)
            throws IOException {
        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer);
        }
        LOG.info("write: saved {}", path);
    }

    public void write(final Writer writer)
            throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (int i = 0; i < distortedPoints.size(); i++) {
            final PlanePoint p = distortedPoints.get(i);
            final PlanePoint o = offsets.get(i);
            writer.write(String.format(Locale.ROOT, "%f,%f,%f,%f\n", p.getX(), p.getY(), o.getX(), o.getY()));
        }
    }

    public List<PlanePoint> getDistortedPoints() {
        return distortedPoints;
    }

    public List<PlanePoint> getUndistortedPoints() {
        return undistortedPoints;
    }

    public List<PlanePoint> getOffsets() {
        return offsets;
    }

    public int size() {
        return distortedPoints.size();
    }

    /**
     * @return position the specified distorted image position would have without distortion.
     */
    public PlanePoint undistort(final PlanePoint distorted) {
        final PlanePoint offset = distortedToOffset.apply(distorted);
        return new PlanePoint(distorted.getX() - offset.getX(), distorted.getY() - offset.getY());
    }

    private static final Logger LOG = LoggerFactory.getLogger(DistortionModel.class);
}
