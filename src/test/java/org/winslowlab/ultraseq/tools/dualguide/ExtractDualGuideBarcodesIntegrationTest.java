package org.winslowlab.ultraseq.tools.dualguide;

import htsjdk.samtools.metrics.MetricsFile;
import org.winslowlab.ultraseq.CommandLineProgramTest;
import org.winslowlab.ultraseq.cmdline.StandardArgumentDefinitions;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.metrics.DualGuideExtractionMetrics;
import org.winslowlab.ultraseq.testutils.ArgumentsBuilder;
import org.winslowlab.ultraseq.utils.table.TableReader;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.winslowlab.ultraseq.tools.dualguide.DualGuideTestReads.*;

public final class ExtractDualGuideBarcodesIntegrationTest extends CommandLineProgramTest {

    private static final String EXPECTED_COMBINATION = GUIDE_1 + "_" + GUIDE_2;
    private static final String UNEXPECTED_COMBINATION = GUIDE_1 + "_" + OFF_TARGET_GUIDE_2;

    /**
     * Writes the standard pairs and the reference under {@code dir} and returns the tool arguments for {@code output}.
     */
    public static ArgumentsBuilder standardArguments(final Path dir, final Path output) {
        final Path read1 = dir.resolve("sample_R1.fastq.gz");
        final Path read2 = dir.resolve("sample_R2.fastq.gz");
        writeFastqs(read1, read2, standardPairs());
        final Path reference = writeReference(dir.resolve("guides.csv"));
        return new ArgumentsBuilder()
                .add(ExtractDualGuideBarcodes.READ1_LONG_NAME, read1)
                .add(ExtractDualGuideBarcodes.READ2_LONG_NAME, read2)
                .add(ExtractDualGuideBarcodes.GUIDE_REFERENCE_LONG_NAME, reference)
                .addOutput(output);
    }

    private static List<ExtractedRead> readTable(final Path path) throws IOException {
        try (final TableReader<ExtractedRead> reader = ExtractedReadTable.reader(path)) {
            return reader.toList();
        }
    }

    @Test
    public void testExtraction() throws IOException {
        final Path dir = createTempDir("extraction").toPath();
        final Path output = dir.resolve("Mouse_1");
        final Path metrics = dir.resolve("metrics.txt");
        final Object result = runCommandLine(standardArguments(dir, output)
                .add(StandardArgumentDefinitions.METRICS_FILE_LONG_NAME, metrics));

        assertContains(result.toString(), "Sample Mouse_1 has a total of 5 reads.");

        final List<ExtractedRead> intermediate = readTable(output.resolve(ExtractedReadTable.INTERMEDIATE_FILE_NAME));
        Assert.assertEquals(intermediate.stream().map(ExtractedRead::getReadId).collect(Collectors.toList()),
                Arrays.asList("@frag1 1:N:0:1", "@frag2 1:N:0:1", "@frag3 1:N:0:1", "@frag4 1:N:0:1"));
        Assert.assertTrue(intermediate.stream().allMatch(r -> r.getSampleId().equals("Mouse_1")));
        Assert.assertEquals(intermediate.get(2),
                new ExtractedRead(GUIDE_1, GUIDE_2, BARCODE_B, "@frag3 1:N:0:1", "Mouse_1", ReadClass.EXPECTED));

        final List<ExtractedRead> unexpected = readTable(output.resolve(ExtractedReadTable.UNEXPECTED_READS_FILE_NAME));
        Assert.assertEquals(unexpected, Collections.singletonList(
                new ExtractedRead(GUIDE_1, OFF_TARGET_GUIDE_2, BARCODE_C, "@frag4 1:N:0:1", "Mouse_1", ReadClass.UNEXPECTED)));

        final Path partitions = output.resolve(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY);
        Assert.assertEquals(readLines(partitions.resolve(EXPECTED_COMBINATION + BartenderInputWriter.BARTENDER_EXTENSION)),
                Arrays.asList(BARCODE_A + ",@frag1 1:N:0:1", BARCODE_A + ",@frag2 1:N:0:1", BARCODE_B + ",@frag3 1:N:0:1"));
        Assert.assertEquals(readLines(partitions.resolve(UNEXPECTED_COMBINATION + BartenderInputWriter.BARTENDER_EXTENSION)),
                Collections.singletonList(BARCODE_C + ",@frag4 1:N:0:1"));
        Assert.assertEquals(readLines(output.resolve(BartenderInputWriter.MANIFEST_FILE_NAME)).size(), 2);

        final MetricsFile<DualGuideExtractionMetrics, Comparable<?>> metricsFile = new MetricsFile<>();
        try (final Reader reader = new FileReader(metrics.toFile())) {
            metricsFile.read(reader);
        }
        final DualGuideExtractionMetrics extractionMetrics = metricsFile.getMetrics().get(0);
        Assert.assertEquals(extractionMetrics.SAMPLE, "Mouse_1");
        Assert.assertEquals(extractionMetrics.TOTAL_READS, 5);
        Assert.assertEquals(extractionMetrics.EXTRACTED_READS, 4);
        Assert.assertEquals(extractionMetrics.EXPECTED_READS, 3);
    }

    @Test
    public void testExpectedReadsOnly() throws IOException {
        final Path dir = createTempDir("extraction").toPath();
        final Path output = dir.resolve("out");
        runCommandLine(standardArguments(dir, output)
                .add(ExtractDualGuideBarcodes.EXPECTED_READS_ONLY_LONG_NAME, true)
                .add(StandardArgumentDefinitions.SAMPLE_ID_LONG_NAME, "Lung_7"));

        final List<ExtractedRead> intermediate = readTable(output.resolve(ExtractedReadTable.INTERMEDIATE_FILE_NAME));
        Assert.assertEquals(intermediate.size(), 3);
        Assert.assertTrue(intermediate.stream().allMatch(r -> r.getReadClass() == ReadClass.EXPECTED && r.getSampleId().equals("Lung_7")));
        Assert.assertEquals(readTable(output.resolve(ExtractedReadTable.UNEXPECTED_READS_FILE_NAME)).size(), 1);
        Assert.assertFalse(Files.exists(output.resolve(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY)
                .resolve(UNEXPECTED_COMBINATION + BartenderInputWriter.BARTENDER_EXTENSION)));
    }

    @Test(expectedExceptions = UserException.MateDesynchronization.class)
    public void testDesynchronizedMates() {
        final Path dir = createTempDir("extraction").toPath();
        final Path read1 = dir.resolve("R1.fastq");
        final Path read2 = dir.resolve("R2.fastq");
        writeFastqs(read1, read2, Arrays.asList(
                Pair.of("frag1", read1(BARCODE_A, GUIDE_1), read2(GUIDE_2)),
                new Pair("frag2/1", read1(BARCODE_A, GUIDE_1), "frag3/2", read2(GUIDE_2))));
        runCommandLine(new ArgumentsBuilder()
                .add(ExtractDualGuideBarcodes.READ1_LONG_NAME, read1)
                .add(ExtractDualGuideBarcodes.READ2_LONG_NAME, read2)
                .add(ExtractDualGuideBarcodes.GUIDE_REFERENCE_LONG_NAME, writeReference(dir.resolve("guides.csv")))
                .addOutput(dir.resolve("out")));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testReferenceWithoutSequenceColumn() {
        final Path dir = createTempDir("extraction").toPath();
        final ArgumentsBuilder args = standardArguments(dir, dir.resolve("out"));
        writeLines(dir.resolve("guides.csv"), "Position,sequence", "G1," + GUIDE_1);
        runCommandLine(args);
    }
}
