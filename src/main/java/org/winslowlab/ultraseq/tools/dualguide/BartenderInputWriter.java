package org.winslowlab.ultraseq.tools.dualguide;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.winslowlab.ultraseq.utils.table.TableColumnCollection;
import org.winslowlab.ultraseq.utils.table.TableReader;
import org.winslowlab.ultraseq.utils.table.TableReaderOptions;
import org.winslowlab.ultraseq.utils.table.TableUtils;
import org.winslowlab.ultraseq.utils.table.TableWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Partitions extracted reads by guide combination into the bartender input files of a sample.
 * <p>
 * Each combination gets {@code <output>/Clonal_barcode/<combination>.bartender}, a headerless table of
 * (clonal barcode, read id) in the order the reads were added. The manifest {@code <output>/Bartender_input_address}
 * lists the partition files, one per line, in ascending combination order. Existing files are overwritten.
 * </p>
 */
public final class BartenderInputWriter {

    private static final Logger logger = LogManager.getLogger(BartenderInputWriter.class);

    public static final String CLONAL_BARCODE_DIRECTORY = "Clonal_barcode";
    public static final String BARTENDER_EXTENSION = ".bartender";
    public static final String MANIFEST_FILE_NAME = "Bartender_input_address";

    /**
     * Columns of a bartender file; the files themselves have no header line.
     */
    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            ExtractedReadTable.CLONAL_BARCODE_COLUMN, ExtractedReadTable.READ_ID_COLUMN);

    private final Path outputDirectory;
    private final SortedMap<String, List<BartenderPair>> partitions = new TreeMap<>();

    public BartenderInputWriter(final Path outputDirectory) {
        this.outputDirectory = Utils.nonNull(outputDirectory, "the output directory cannot be null");
    }

    public void add(final ExtractedRead read) {
        Utils.nonNull(read, "the read cannot be null");
        partitions.computeIfAbsent(read.getCombination(), k -> new ArrayList<>())
                .add(new BartenderPair(read.getClonalBarcode(), read.getReadId()));
    }

    /**
     * Writes the partition files and the manifest.
     *
     * @return the partition files written, in manifest order.
     */
    public List<Path> write() {
        final Path partitionDirectory = IOUtils.createDirectories(outputDirectory.resolve(CLONAL_BARCODE_DIRECTORY));
        final List<Path> written = new ArrayList<>(partitions.size());
        for (final Map.Entry<String, List<BartenderPair>> partition : partitions.entrySet()) {
            final Path path = partitionDirectory.resolve(partition.getKey() + BARTENDER_EXTENSION);
            try (final TableWriter<BartenderPair> writer = TableUtils.headerlessWriter(path, COLUMNS,
                    (pair, dataLine) -> dataLine.set(ExtractedReadTable.CLONAL_BARCODE_COLUMN, pair.getClonalBarcode())
                            .set(ExtractedReadTable.READ_ID_COLUMN, pair.getReadId()))) {
                writer.writeAllRecords(partition.getValue());
            } catch (final IOException e) {
                throw new UserException.CouldNotCreateOutputFile(path, e);
            }
            written.add(path);
        }
        final Path manifest = outputDirectory.resolve(MANIFEST_FILE_NAME);
        try (final Writer writer = IOUtils.makeWriter(manifest)) {
            for (final Path path : written) {
                writer.write(path.toString());
                writer.write('\n');
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(manifest, e);
        }
        logger.info(String.format("Wrote %d bartender input files under %s", written.size(), partitionDirectory));
        return written;
    }

    /**
     * Opens a bartender input file for reading.
     */
    public static TableReader<BartenderPair> reader(final Path path) throws IOException {
        return TableUtils.reader(path, TableReaderOptions.headerless(COLUMNS), (columns, formatExceptionFactory) ->
                dataLine -> new BartenderPair(dataLine.get(ExtractedReadTable.CLONAL_BARCODE_COLUMN), dataLine.get(ExtractedReadTable.READ_ID_COLUMN)));
    }
}
