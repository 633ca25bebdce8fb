package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.testutils.BaseTest;
import org.testng.Assert;
import org.testng.SkipException;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

public final class SampleAggregatorUnitTest extends BaseTest {

    static ClusteredSampleFixture clusteredSample(final Path root, final String sample) {
        return new ClusteredSampleFixture(root, sample)
                .read("@r1", "AAA", "CCC", "BC1")
                .read("@r2", "AAA", "CCC", "BC1")
                .read("@r3", "AAA", "CCC", "BC2")
                .read("@r4", "GGG", "TTT", "BC3")
                .read("@r5", "AAA", "CCC", "BC4")
                .writeExtraction()
                .clusters("AAA_CCC", "0:BC1")
                .barcodes("AAA_CCC", "BC1:0", "BC2:0")
                .clusters("GGG_TTT", "0:BC3")
                .barcodes("GGG_TTT", "BC3:1");
    }

    @Test
    public void testAggregate() {
        final Path root = createTempDir("samples").toPath();
        final SampleAggregation aggregation = SampleAggregator.aggregate(clusteredSample(root, "Mouse_1").getSampleDirectory());

        Assert.assertEquals(aggregation.getSample(), "Mouse_1");
        Assert.assertEquals(aggregation.getRaw(), Arrays.asList(
                new FrequencyRow("AAA_CCC", "BC1", "AAA", "CCC", "BC1", "Mouse_1", 2),
                new FrequencyRow("AAA_CCC", "BC1", "AAA", "CCC", "BC2", "Mouse_1", 1)));
        Assert.assertEquals(aggregation.getComplete(), Collections.singletonList(
                new FrequencyRow("AAA_CCC", "BC1", "AAA", "CCC", null, "Mouse_1", 3)));

        final JoinStatistics statistics = aggregation.getStatistics();
        Assert.assertEquals(statistics.getBarcodeEntries(), 3);
        Assert.assertEquals(statistics.getBarcodeEntriesWithoutCluster(), 1);
        Assert.assertEquals(statistics.getBartenderPairs(), 5);
        Assert.assertEquals(statistics.getBartenderPairsWithoutCenter(), 2);
        Assert.assertEquals(statistics.getReadsWithoutExtractionRecord(), 0);
        Assert.assertEquals(statistics.getUnifiedRows(), 5);
        Assert.assertEquals(statistics.getUnifiedRowsWithoutCenter(), 2);
    }

    @Test
    public void testClusteredReadsMissingFromTheReadTableAreDropped() {
        final Path root = createTempDir("samples").toPath();
        final ClusteredSampleFixture fixture = new ClusteredSampleFixture(root, "Mouse_1")
                .read("@r1", "AAA", "CCC", "BC1")
                .read("@r3", "AAA", "CCC", "BC2")
                .writeExtraction()
                .clusters("AAA_CCC", "0:BC1")
                .barcodes("AAA_CCC", "BC1:0", "BC2:0");
        // the bartender file has a read the read table does not
        writeLines(fixture.clonalBarcodeDirectory().resolve("AAA_CCC.bartender"), "BC1,@r1", "BC1,@r2", "BC2,@r3");

        final SampleAggregation aggregation = SampleAggregator.aggregate(fixture.getSampleDirectory());
        Assert.assertEquals(aggregation.getComplete(), Collections.singletonList(
                new FrequencyRow("AAA_CCC", "BC1", "AAA", "CCC", null, "Mouse_1", 2)));
        Assert.assertEquals(aggregation.getStatistics().getReadsWithoutExtractionRecord(), 1);
    }

    @Test
    public void testFindClusterFiles() {
        final Path sample = createTempDir("sample").toPath();
        writeLines(sample.resolve("Clonal_barcode/B_B_cluster.csv"), "x");
        writeLines(sample.resolve("run2/Clonal_barcode/A_A_cluster.csv"), "x");
        writeLines(sample.resolve("Clonal_barcode/A_A_barcode.csv"), "x");
        writeLines(sample.resolve("other/C_C_cluster.csv"), "x");
        Assert.assertEquals(SampleAggregator.findClusterFiles(sample), Arrays.asList(
                sample.resolve("Clonal_barcode/B_B_cluster.csv"),
                sample.resolve("run2/Clonal_barcode/A_A_cluster.csv")));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testNoClusterFiles() {
        final Path root = createTempDir("samples").toPath();
        final ClusteredSampleFixture fixture = new ClusteredSampleFixture(root, "Mouse_1").read("@r1", "AAA", "CCC", "BC1").writeExtraction();
        SampleAggregator.aggregate(fixture.getSampleDirectory());
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingBarcodeTable() {
        final Path root = createTempDir("samples").toPath();
        final ClusteredSampleFixture fixture = new ClusteredSampleFixture(root, "Mouse_1")
                .read("@r1", "AAA", "CCC", "BC1")
                .writeExtraction()
                .clusters("AAA_CCC", "0:BC1");
        SampleAggregator.aggregate(fixture.getSampleDirectory());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMalformedClusterTable() {
        final Path root = createTempDir("samples").toPath();
        final ClusteredSampleFixture fixture = clusteredSample(root, "Mouse_1");
        writeLines(fixture.clonalBarcodeDirectory().resolve("AAA_CCC_cluster.csv"), "Cluster.ID,Score", "0,1");
        SampleAggregator.aggregate(fixture.getSampleDirectory());
    }

    /**
     * Removes the read permission of a directory, or skips the test where that does not stop listing it (as root).
     */
    static void lockDirectory(final Path directory) {
        if (!directory.toFile().setReadable(false, false) || Files.isReadable(directory)) {
            unlockDirectory(directory);
            throw new SkipException("cannot make " + directory + " unreadable for this user");
        }
    }

    static void unlockDirectory(final Path directory) {
        directory.toFile().setReadable(true, false);
    }

    @Test
    public void testUnreadableSubDirectory() {
        final Path root = createTempDir("samples").toPath();
        final Path sampleDirectory = clusteredSample(root, "Mouse_1").getSampleDirectory();
        final Path locked = sampleDirectory.resolve("locked");
        writeLines(locked.resolve("notes.txt"), "unreadable");

        lockDirectory(locked);
        try {
            SampleAggregator.aggregate(sampleDirectory);
            Assert.fail("an unreadable sub-directory should fail the sample");
        } catch (final UserException.CouldNotReadInputFile e) {
            assertContains(e.getMessage(), "a sub-directory could not be listed");
        } finally {
            unlockDirectory(locked);
        }
    }
}
