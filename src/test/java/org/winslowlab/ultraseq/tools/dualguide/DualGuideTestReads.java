package org.winslowlab.ultraseq.tools.dualguide;

import htsjdk.samtools.util.IOUtil;
import org.winslowlab.ultraseq.utils.BaseUtils;
import org.winslowlab.ultraseq.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Synthetic dual-guide reads built around the default read structures.
 */
public final class DualGuideTestReads {

    public static final String GUIDE_1 = "ACGTACGTACGTACGTAC";
    public static final String GUIDE_2 = "CATGCATGCATGCATGCAT";
    public static final String OFF_TARGET_GUIDE_2 = "GGGGAAAACCCCTTTTGG";

    public static final String BARCODE_A = "AAAACCCCGGGGTTTT";
    public static final String BARCODE_B = "AAAACCCCGGGGTTTA";
    public static final String BARCODE_C = "CCCCAAAAGGGGTTTT";

    private DualGuideTestReads() {}

    /**
     * Mate 1 as sequenced: a short flank, then anchors around the barcode and guide 1.
     */
    public static String read1(final String barcode, final String gRNA1) {
        return "CC" + "TAGTT" + barcode + "TATGG" + gRNA1 + "GTTTA" + "CCCC";
    }

    /**
     * Mate 2 as sequenced, whose reverse complement holds guide 2 between its anchors.
     */
    public static String read2(final String gRNA2) {
        return BaseUtils.simpleReverseComplement("TGTTG" + gRNA2 + "GTTTG" + "AAAA");
    }

    /**
     * Five pairs: three Expected (barcodes A, A, B), one Unexpected (barcode C) and one without anchors.
     */
    public static List<Pair> standardPairs() {
        return Arrays.asList(
                Pair.of("frag1", read1(BARCODE_A, GUIDE_1), read2(GUIDE_2)),
                Pair.of("frag2", read1(BARCODE_A, GUIDE_1), read2(GUIDE_2)),
                Pair.of("frag3", read1(BARCODE_B, GUIDE_1), read2(GUIDE_2)),
                Pair.of("frag4", read1(BARCODE_C, GUIDE_1), read2(OFF_TARGET_GUIDE_2)),
                Pair.of("frag5", "ACGTACGTACGTACGTACGTACGT", "ACGTACGTACGTACGTACGTACGT"));
    }

    public static GuideReference reference() {
        return new GuideReference(Arrays.asList(GUIDE_1), Arrays.asList(GUIDE_2));
    }

    public static Path writeReference(final Path path) {
        try (final Writer writer = new OutputStreamWriter(IOUtil.openFileForWriting(path.toFile()), StandardCharsets.UTF_8)) {
            writer.write("Position,gRNA_complete\n");
            writer.write("G1," + GUIDE_1 + "\n");
            writer.write("G2," + GUIDE_2 + "\n");
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return path;
    }

    /**
     * A read pair to write; {@code read1Name} and {@code read2Name} are the header lines without '@'.
     */
    public static final class Pair {
        final String read1Name;
        final String read1Bases;
        final String read2Name;
        final String read2Bases;

        public Pair(final String read1Name, final String read1Bases, final String read2Name, final String read2Bases) {
            this.read1Name = read1Name;
            this.read1Bases = read1Bases;
            this.read2Name = read2Name;
            this.read2Bases = read2Bases;
        }

        public static Pair of(final String name, final String read1Bases, final String read2Bases) {
            return new Pair(name + " 1:N:0:1", read1Bases, name + " 2:N:0:1", read2Bases);
        }
    }

    /**
     * Writes the mates to two FASTQ files, gzipped when a name ends with .gz.
     */
    public static void writeFastqs(final Path read1, final Path read2, final List<Pair> pairs) {
        final List<String[]> mates1 = new ArrayList<>();
        final List<String[]> mates2 = new ArrayList<>();
        for (final Pair pair : pairs) {
            mates1.add(new String[]{pair.read1Name, pair.read1Bases});
            mates2.add(new String[]{pair.read2Name, pair.read2Bases});
        }
        writeFastq(read1.toFile(), mates1);
        writeFastq(read2.toFile(), mates2);
    }

    public static void writeFastq(final File file, final List<String[]> records) {
        try (final Writer writer = new OutputStreamWriter(IOUtil.openFileForWriting(file), StandardCharsets.UTF_8)) {
            for (final String[] record : records) {
                writer.write("@" + record[0] + "\n");
                writer.write(record[1] + "\n");
                writer.write("+\n");
                writer.write(Utils.dupChar('I', record[1].length()) + "\n");
            }
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
