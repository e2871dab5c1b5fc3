package org.janelia.astrometry.catalog;

import java.io.File;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.janelia.astrometry.geom.CelestialPoint;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link CsvCatalogLookup} class.
 */
public class CsvCatalogLookupTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParse() throws Exception {

        final String text =
                "ra,dec,magnitude,diameter,name,type\n" +
                "# comment line\n" +
                "\n" +
                "10.5,-20.25,7.1,,Alpha,star\n" +
                "370.0,45.0\n" +
                "11.0, 21.0, , 2.5\n";

        final List<CatalogStar> stars = CsvCatalogLookup.parse(new StringReader(text), "test");

        Assert.assertEquals("invalid number of stars", 3, stars.size());

        final CatalogStar first = stars.get(0);
        Assert.assertEquals("invalid ra", 10.5, first.getRa(), 0.0);
        Assert.assertEquals("invalid dec", -20.25, first.getDec(), 0.0);
        Assert.assertEquals("invalid magnitude", 7.1, first.getMagnitude(), 0.0);
        Assert.assertNull("diameter should be unknown", first.getDiameter());
        Assert.assertEquals("invalid name", "Alpha", first.getExtra("name"));
        Assert.assertEquals("invalid type", "star", first.getExtra("type"));

        final CatalogStar second = stars.get(1);
        Assert.assertEquals("ra should be normalized", 10.0, second.getRa(), 1.0e-12);
        Assert.assertNull("magnitude should be unknown", second.getMagnitude());

        final CatalogStar third = stars.get(2);
        Assert.assertNull("magnitude should be unknown", third.getMagnitude());
        Assert.assertEquals("invalid diameter", 2.5, third.getDiameter(), 0.0);
    }

    @Test
    public void testParseInvalidLine() throws Exception {
        for (final String text : Arrays.asList("1.0,2.0\n3.0\n", "1.0,2.0\n3.0,95.0\n", "1.0,2.0\n3.0,x\n")) {
            try {
                CsvCatalogLookup.parse(new StringReader(text), "test");
                Assert.fail("parse of '" + text + "' should have failed");
            } catch (final CatalogException e) {
                Assert.assertTrue("message should identify the line: " + e.getMessage(),
                                  e.getMessage().contains("line 2"));
            }
        }
    }

    @Test
    public void testLoad() throws Exception {

        final File catalogFile = temporaryFolder.newFile("catalog.csv");
        Files.write(catalogFile.toPath(),
                    Arrays.asList("150.0,30.0,9.0",
                                  "150.1,30.1,6.0",
                                  "150.2,29.9,12.5",
                                  "150.0,30.2",
                                  "151.5,30.0,5.0",
                                  "100.0,-10.0,3.0"),
                    StandardCharsets.UTF_8);

        final CsvCatalogLookup lookup = new CsvCatalogLookup(catalogFile.toPath());
        final CatalogQueryResult result = lookup.load(new CelestialPoint(150.0, 30.0), 1.0, 10.0);

        Assert.assertFalse("result should not be truncated", result.isTruncated());
        Assert.assertEquals("invalid number of stars", 3, result.size());
        Assert.assertEquals("brightest star should be first", 6.0, result.getStars().get(0).getMagnitude(), 0.0);
        Assert.assertEquals("invalid second star", 9.0, result.getStars().get(1).getMagnitude(), 0.0);
        Assert.assertNull("star without magnitude should be last", result.getStars().get(2).getMagnitude());

        final CsvCatalogLookup limitedLookup = new CsvCatalogLookup(catalogFile.toPath(), 2);
        final CatalogQueryResult limitedResult = limitedLookup.load(new CelestialPoint(150.0, 30.0), 4.0, 20.0);
        Assert.assertTrue("result should be truncated", limitedResult.isTruncated());
        Assert.assertEquals("invalid number of stars", 2, limitedResult.size());
        Assert.assertEquals("invalid brightest star", 5.0, limitedResult.getStars().get(0).getMagnitude(), 0.0);
    }

    @Test(expected = CatalogException.class)
    public void testLoadMissingFile() throws Exception {
        final CsvCatalogLookup lookup =
                new CsvCatalogLookup(temporaryFolder.getRoot().toPath().resolve("missing.csv"));
        lookup.load(new CelestialPoint(0.0, 0.0), 1.0, 10.0);
    }
}
