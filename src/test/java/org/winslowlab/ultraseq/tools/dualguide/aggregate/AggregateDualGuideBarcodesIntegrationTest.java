package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.CommandLineProgramTest;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.testutils.ArgumentsBuilder;
import org.winslowlab.ultraseq.tools.dualguide.BartenderInputWriter;
import org.winslowlab.ultraseq.tools.dualguide.ExtractDualGuideBarcodesIntegrationTest;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedReadTable;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.winslowlab.ultraseq.tools.dualguide.DualGuideTestReads.*;

public final class AggregateDualGuideBarcodesIntegrationTest extends CommandLineProgramTest {

    private static final String COMBINATION = GUIDE_1 + "_" + GUIDE_2;

    /**
     * Runs extraction on the standard reads into {@code root/sample} and adds the clustering output that merges
     * barcode B into the cluster of barcode A.
     */
    private void extractAndCluster(final Path root, final String sample) {
        final Path fastqDir = createTempDir("fastq").toPath();
        final List<String> extractionArgs = ExtractDualGuideBarcodesIntegrationTest
                .standardArguments(fastqDir, root.resolve(sample)).getArgsList();
        runCommandLine(extractionArgs, "ExtractDualGuideBarcodes");

        final Path clonalBarcodes = root.resolve(sample).resolve(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY);
        writeLines(clonalBarcodes.resolve(COMBINATION + ClusteringOutputTables.CLUSTER_FILE_SUFFIX),
                "Cluster.ID,Center,Cluster.Score,time_point_1",
                "0," + BARCODE_A + ",0.02,3");
        writeLines(clonalBarcodes.resolve(COMBINATION + ClusteringOutputTables.BARCODE_FILE_SUFFIX),
                "Unique.reads,Frequency,Cluster.ID",
                BARCODE_A + ",2,0",
                BARCODE_B + ",1,0");
    }

    @Test
    public void testAggregation() {
        final Path root = createTempDir("bartender").toPath();
        extractAndCluster(root, "Mouse_1");
        final Path output = createTempDir("aggregated").toPath();
        final Path statistics = output.resolve("join_statistics.csv");

        final Object result = runCommandLine(new ArgumentsBuilder()
                .addInput(root)
                .add(AggregateDualGuideBarcodes.OUTPUT_PREFIX_LONG_NAME, output + "/")
                .add(AggregateDualGuideBarcodes.JOIN_STATISTICS_FILE_LONG_NAME, statistics));
        Assert.assertEquals(result, 1);

        Assert.assertEquals(readLines(output.resolve("Mouse_1").resolve(FrequencyTable.RAW_FILE_NAME)), Arrays.asList(
                "gRNA_combination,Clonal_barcode_center,gRNA1,gRNA2,Clonal_barcode,Sample_ID,Frequency",
                String.join(",", COMBINATION, BARCODE_A, GUIDE_1, GUIDE_2, BARCODE_A, "Mouse_1", "2"),
                String.join(",", COMBINATION, BARCODE_A, GUIDE_1, GUIDE_2, BARCODE_B, "Mouse_1", "1")));
        final List<String> complete = Arrays.asList(
                "gRNA_combination,Clonal_barcode,gRNA1,gRNA2,Sample_ID,Frequency",
                String.join(",", COMBINATION, BARCODE_A, GUIDE_1, GUIDE_2, "Mouse_1", "3"));
        Assert.assertEquals(readLines(output.resolve("Mouse_1").resolve(FrequencyTable.COMPLETE_FILE_NAME)), complete);
        Assert.assertEquals(readLines(output.resolve(FrequencyTable.COMBINED_FILE_NAME)), complete);

        Assert.assertEquals(readLines(statistics), Arrays.asList(
                String.join(",", JoinStatistics.COLUMNS.names()),
                "Mouse_1,2,0,3,0,0,3,0"));
    }

    @Test
    public void testFailedSample() {
        final Path root = createTempDir("bartender").toPath();
        extractAndCluster(root, "Mouse_1");
        writeLines(root.resolve("Mouse_2").resolve("notes.txt"), "clustering did not run");
        final Path output = createTempDir("aggregated").toPath();

        try {
            runCommandLine(new ArgumentsBuilder()
                    .addInput(root)
                    .add(AggregateDualGuideBarcodes.OUTPUT_PREFIX_LONG_NAME, output + "/"));
            Assert.fail("the failed sample should be reported");
        } catch (final UserException.FailedSamples e) {
            assertContains(e.getMessage(), "Mouse_2");
        }
        Assert.assertTrue(Files.exists(output.resolve("Mouse_1").resolve(FrequencyTable.COMPLETE_FILE_NAME)));
        Assert.assertEquals(readLines(output.resolve(FrequencyTable.COMBINED_FILE_NAME)).size(), 2);
    }

    private static Map<String, byte[]> readOutputTables(final Path output, final String sample) throws IOException {
        final Map<String, byte[]> tables = new LinkedHashMap<>();
        for (final Path table : Arrays.asList(
                output.resolve(sample).resolve(FrequencyTable.RAW_FILE_NAME),
                output.resolve(sample).resolve(FrequencyTable.COMPLETE_FILE_NAME),
                output.resolve(FrequencyTable.COMBINED_FILE_NAME))) {
            tables.put(output.relativize(table).toString(), Files.readAllBytes(table));
        }
        return tables;
    }

    private static Map<String, List<String>> readExtractionOutputs(final Path sampleDirectory) throws IOException {
        final Map<String, List<String>> outputs = new TreeMap<>();
        final Path clonalBarcodes = sampleDirectory.resolve(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY);
        try (final Stream<Path> files = Files.list(clonalBarcodes)) {
            for (final Path file : files.filter(f -> f.getFileName().toString().endsWith(".bartender")).collect(Collectors.toList())) {
                outputs.put(sampleDirectory.relativize(file).toString(), readLines(file));
            }
        }
        for (final String name : Arrays.asList(BartenderInputWriter.MANIFEST_FILE_NAME,
                ExtractedReadTable.INTERMEDIATE_FILE_NAME, ExtractedReadTable.UNEXPECTED_READS_FILE_NAME)) {
            outputs.put(name, readLines(sampleDirectory.resolve(name)));
        }
        return outputs;
    }

    @Test
    public void testRerunIntoEmptiedOutputGivesIdenticalTables() throws IOException {
        final Path root = createTempDir("bartender").toPath();
        extractAndCluster(root, "Mouse_1");
        final Path output = createTempDir("aggregated").toPath();
        final ArgumentsBuilder aggregationArgs = new ArgumentsBuilder()
                .addInput(root)
                .add(AggregateDualGuideBarcodes.OUTPUT_PREFIX_LONG_NAME, output + "/");

        runCommandLine(aggregationArgs);
        final Map<String, byte[]> firstRun = readOutputTables(output, "Mouse_1");

        IOUtils.deleteRecursively(output);
        extractAndCluster(root, "Mouse_1");
        runCommandLine(aggregationArgs);
        final Map<String, byte[]> secondRun = readOutputTables(output, "Mouse_1");

        Assert.assertEquals(secondRun.keySet(), firstRun.keySet());
        for (final String table : firstRun.keySet()) {
            Assert.assertEquals(secondRun.get(table), firstRun.get(table), table);
        }
    }

    @Test
    public void testRerunExtractionOverwritesBartenderFiles() throws IOException {
        final Path sampleDirectory = createTempDir("bartender").toPath().resolve("Mouse_1");
        runCommandLine(ExtractDualGuideBarcodesIntegrationTest
                .standardArguments(createTempDir("fastq").toPath(), sampleDirectory).getArgsList(), "ExtractDualGuideBarcodes");
        final Map<String, List<String>> firstRun = readExtractionOutputs(sampleDirectory);
        Assert.assertEquals(firstRun.get(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY + "/" + COMBINATION + ".bartender"),
                Arrays.asList(BARCODE_A + ",@frag1 1:N:0:1", BARCODE_A + ",@frag2 1:N:0:1", BARCODE_B + ",@frag3 1:N:0:1"));

        runCommandLine(ExtractDualGuideBarcodesIntegrationTest
                .standardArguments(createTempDir("fastq").toPath(), sampleDirectory).getArgsList(), "ExtractDualGuideBarcodes");
        Assert.assertEquals(readExtractionOutputs(sampleDirectory), firstRun);
    }
}
