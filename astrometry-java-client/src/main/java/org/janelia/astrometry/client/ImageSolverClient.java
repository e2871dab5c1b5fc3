package org.janelia.astrometry.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.AstrometryException;
import org.janelia.astrometry.align.TriangleDescriptorAligner;
import org.janelia.astrometry.catalog.CachingCatalogLookup;
import org.janelia.astrometry.catalog.CsvCatalogLookup;
import org.janelia.astrometry.client.parameter.CommandLineParameters;
import org.janelia.astrometry.json.JsonUtils;
import org.janelia.astrometry.service.DetectedStar;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.service.StarDetectionService;
import org.janelia.astrometry.solver.CancellationSignal;
import org.janelia.astrometry.solver.GeometricSolution;
import org.janelia.astrometry.solver.ImageSolver;
import org.janelia.astrometry.solver.SeedParameters;
import org.janelia.astrometry.solver.SolveResult;
import org.janelia.astrometry.solver.SolverParameters;
import org.janelia.astrometry.wcs.AstrometricSolutionSpec;
import org.janelia.astrometry.wcs.FitsKeyword;
import org.janelia.astrometry.wcs.WcsSolutionConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for solving an image from a list of detected stars and a local star catalog.
 *
 * The solution is written as JSON (WCS keywords plus spline control points) and, optionally,
 * as FITS header cards that can be merged into the image header.
 */
public class ImageSolverClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--stars",
                description = "JSON file with the detected stars of the image (array of {x, y, boxWidth, boxHeight, flux})",
                required = true)
        public String starsPath;

        @Parameter(
                names = "--catalog",
                description = "CSV star catalog file (ra,dec[,magnitude[,diameter[,...]]])",
                required = true)
        public String catalogPath;

        @Parameter(
                names = "--maxCatalogStars",
                description = "Maximum number of catalog stars returned for a single field")
        public Integer maxCatalogStars = CsvCatalogLookup.DEFAULT_MAX_STARS;

        @Parameter(
                names = "--imageName",
                description = "Name of the image (default is the stars file name)")
        public String imageName;

        @Parameter(
                names = "--width",
                description = "Image width in pixels",
                required = true)
        public Integer width;

        @Parameter(
                names = "--height",
                description = "Image height in pixels",
                required = true)
        public Integer height;

        @Parameter(
                names = "--ra",
                description = "Approximate right ascension of the image center (degrees)",
                required = true)
        public Double ra;

        @Parameter(
                names = "--dec",
                description = "Approximate declination of the image center (degrees)",
                required = true)
        public Double dec;

        @Parameter(
                names = "--resolution",
                description = "Approximate image scale (arcseconds per pixel), omit to derive it from --focalLength and --pixelSize")
        public Double resolution;

        @Parameter(
                names = "--focalLength",
                description = "Telescope focal length (mm)")
        public Double focalLength;

        @Parameter(
                names = "--pixelSize",
                description = "Sensor pixel size (micrometers)")
        public Double pixelSize;

        @Parameter(
                names = "--existingSolution",
                description = "JSON solution to start from (required with --onlyOptimize)")
        public String existingSolutionPath;

        @Parameter(
                names = "--solutionJson",
                description = "File where the solution JSON should be written (default is standard out)")
        public String solutionJsonPath;

        @Parameter(
                names = "--fitsHeader",
                description = "File where FITS header cards for the solution should be written")
        public String fitsHeaderPath;

        @ParametersDelegate
        public SolverParameters solver = new SolverParameters();

        /**
         * @throws IllegalArgumentException
         *   if the seed cannot be derived from the specified values.
         */
        public SeedParameters buildSeed()
                throws IllegalArgumentException {
            if (resolution != null) {
                return new SeedParameters(ra, dec, resolution / 3600.0, width, height);
            }
            if ((focalLength == null) || (pixelSize == null)) {
                throw new IllegalArgumentException("specify either --resolution or both --focalLength and --pixelSize");
            }
            return SeedParameters.fromFocalLength(ra, dec, focalLength, pixelSize, width, height);
        }

        public String getImageName() {
            return imageName == null ? Paths.get(starsPath).getFileName().toString() : imageName;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final ImageSolverClient client = new ImageSolverClient(parameters);
                final SolveResult result = client.solve();
                client.writeResult(result);

                if (! result.isSolved()) {
                    throw new AstrometryException("failed to solve " + parameters.getImageName(), result.getError());
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public ImageSolverClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public SolveResult solve()
            throws IOException, AstrometryException {

        final List<DetectedStar> stars = loadStars(Paths.get(parameters.starsPath));
        final SourceImage image = new SourceImage(parameters.getImageName(), parameters.width, parameters.height);
        final StarDetectionService detectionService = new StarListDetectionService(stars);

        final ImageSolver solver = new ImageSolver(parameters.solver,
                                                   detectionService,
                                                   null,
                                                   new TriangleDescriptorAligner(detectionService),
                                                   new CachingCatalogLookup(
                                                           new CsvCatalogLookup(Paths.get(parameters.catalogPath),
                                                                                parameters.maxCatalogStars)));

        GeometricSolution existingSolution = null;
        if (parameters.existingSolutionPath != null) {
            try (final Reader reader = Files.newBufferedReader(Paths.get(parameters.existingSolutionPath),
                                                               StandardCharsets.UTF_8)) {
                existingSolution = WcsSolutionConverter.fromSpec(AstrometricSolutionSpec.fromJson(reader));
            }
        }

        final SolveResult result = solver.solve(image, parameters.buildSeed(), existingSolution, new CancellationSignal());

        for (final String warning : result.getWarnings()) {
            LOG.warn("solve: {}", warning);
        }

        return result;
    }

    public void writeResult(final SolveResult result)
            throws IOException, AstrometryException {

        if (! result.isSolved()) {
            LOG.warn("writeResult: no solution to write for {}", parameters.getImageName());
            return;
        }

        final AstrometricSolutionSpec spec = WcsSolutionConverter.toSpec(result.getSolution());
        if (parameters.solutionJsonPath == null) {
            System.out.println(spec.toJson());
        } else {
            final Path path = Paths.get(parameters.solutionJsonPath);
            try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                spec.writeJson(writer);
            }
            LOG.info("writeResult: saved {}", path);
        }

        if (parameters.fitsHeaderPath != null) {
            final Path path = Paths.get(parameters.fitsHeaderPath);
            writeFitsHeader(spec.getWcs().toFitsKeywords(), path);
            LOG.info("writeResult: saved {}", path);
        }
    }

    static List<DetectedStar> loadStars(final Path path)
            throws IOException {
        final List<DetectedStar> stars;
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            stars = STAR_JSON_HELPER.fromJsonArray(reader);
        }
        LOG.info("loadStars: loaded {} stars from {}", stars.size(), path);
        return stars;
    }

    static void writeFitsHeader(final List<FitsKeyword> keywords,
                                final Path path)
            throws IOException {
        final List<String> cards = new ArrayList<>(keywords.size());
        for (final FitsKeyword keyword : keywords) {
            cards.add(keyword.toCard());
        }
        Files.write(path, cards, StandardCharsets.US_ASCII);
    }

    /**
     * Detection service backed by a precomputed star list.
     */
    static class StarListDetectionService
            implements StarDetectionService {

        private final List<DetectedStar> stars;

        StarListDetectionService(final List<DetectedStar> stars) {
            this.stars = Collections.unmodifiableList(new ArrayList<>(stars));
        }

        @Override
        public List<DetectedStar> detect(final SourceImage image) {
            return stars;
        }
    }

    private static final JsonUtils.Helper<DetectedStar> STAR_JSON_HELPER =
            new JsonUtils.Helper<>(DetectedStar.class);

    private static final Logger LOG = LoggerFactory.getLogger(ImageSolverClient.class);
}
