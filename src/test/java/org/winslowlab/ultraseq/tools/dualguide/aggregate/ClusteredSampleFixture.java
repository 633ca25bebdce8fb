package org.winslowlab.ultraseq.tools.dualguide.aggregate;

import org.winslowlab.ultraseq.testutils.BaseTest;
import org.winslowlab.ultraseq.tools.dualguide.BartenderInputWriter;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedRead;
import org.winslowlab.ultraseq.tools.dualguide.ExtractedReadTable;
import org.winslowlab.ultraseq.tools.dualguide.ReadClass;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a sample directory as extraction and barcode clustering leave it: the per-read table, one bartender file
 * per combination and the cluster and barcode tables next to it.
 */
final class ClusteredSampleFixture {

    private final Path sampleDirectory;
    private final String sample;
    private final List<ExtractedRead> reads = new ArrayList<>();

    ClusteredSampleFixture(final Path root, final String sample) {
        this.sampleDirectory = root.resolve(sample);
        this.sample = sample;
    }

    ClusteredSampleFixture read(final String readId, final String gRNA1, final String gRNA2, final String barcode) {
        reads.add(new ExtractedRead(gRNA1, gRNA2, barcode, readId, sample, ReadClass.EXPECTED));
        return this;
    }

    /**
     * Writes the per-read table and the bartender files of the reads added so far.
     */
    ClusteredSampleFixture writeExtraction() {
        final BartenderInputWriter bartenderWriter = new BartenderInputWriter(sampleDirectory);
        IOUtils.createDirectories(sampleDirectory);
        try (final TableWriter<ExtractedRead> writer = ExtractedReadTable.writer(sampleDirectory.resolve(ExtractedReadTable.INTERMEDIATE_FILE_NAME))) {
            for (final ExtractedRead read : reads) {
                writer.writeRecord(read);
                bartenderWriter.add(read);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        bartenderWriter.write();
        return this;
    }

    /**
     * Writes the cluster table of a combination; each cluster is given as "id:center".
     */
    ClusteredSampleFixture clusters(final String combination, final String... clusters) {
        final List<String> lines = new ArrayList<>();
        lines.add("Cluster.ID,Center,Cluster.Score,time_point_1");
        for (final String cluster : clusters) {
            final String[] parts = cluster.split(":");
            lines.add(parts[0] + "," + parts[1] + ",0.01,1");
        }
        BaseTest.writeLines(clonalBarcodeDirectory().resolve(combination + ClusteringOutputTables.CLUSTER_FILE_SUFFIX), lines.toArray(new String[0]));
        return this;
    }

    /**
     * Writes the barcode table of a combination; each barcode is given as "barcode:clusterId".
     */
    ClusteredSampleFixture barcodes(final String combination, final String... barcodes) {
        final List<String> lines = new ArrayList<>();
        lines.add("Unique.reads,Frequency,Cluster.ID");
        for (final String barcode : barcodes) {
            final String[] parts = barcode.split(":");
            lines.add(parts[0] + ",1," + parts[1]);
        }
        BaseTest.writeLines(clonalBarcodeDirectory().resolve(combination + ClusteringOutputTables.BARCODE_FILE_SUFFIX), lines.toArray(new String[0]));
        return this;
    }

    Path clonalBarcodeDirectory() {
        return sampleDirectory.resolve(BartenderInputWriter.CLONAL_BARCODE_DIRECTORY);
    }

    Path getSampleDirectory() {
        return sampleDirectory;
    }
}
