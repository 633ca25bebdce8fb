package org.winslowlab.ultraseq.tools.dualguide;

import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.config.UltraSeqConfig;
import org.winslowlab.ultraseq.utils.io.IOUtils;
import org.winslowlab.ultraseq.utils.table.TableColumnCollection;
import org.winslowlab.ultraseq.utils.table.TableReader;
import org.winslowlab.ultraseq.utils.table.TableUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * The reference guides for each of the two guide positions. Immutable once loaded.
 */
public final class GuideReference {

    private static final Logger logger = LogManager.getLogger(GuideReference.class);

    private final ImmutableSet<String> position1Guides;
    private final ImmutableSet<String> position2Guides;

    public GuideReference(final Collection<String> position1Guides, final Collection<String> position2Guides) {
        Utils.containsNoNull(position1Guides, "position 1 guides cannot be null or contain null");
        Utils.containsNoNull(position2Guides, "position 2 guides cannot be null or contain null");
        this.position1Guides = ImmutableSet.copyOf(position1Guides);
        this.position2Guides = ImmutableSet.copyOf(position2Guides);
    }

    /**
     * Loads the reference with the column names and position labels of the configuration.
     */
    public static GuideReference load(final Path path, final UltraSeqConfig config) {
        Utils.nonNull(config);
        return load(path, config.guide_position_column(), config.guide_sequence_column(),
                config.guide_position_1(), config.guide_position_2());
    }

    /**
     * Loads a reference table. Rows whose position is neither {@code position1} nor {@code position2} are ignored.
     *
     * @param path           the reference CSV.
     * @param positionColumn column holding the guide position label.
     * @param sequenceColumn column holding the guide sequence.
     * @throws UserException.BadInput if a column is missing.
     */
    public static GuideReference load(final Path path, final String positionColumn, final String sequenceColumn,
                                      final String position1, final String position2) {
        IOUtils.assertFileIsReadable(path);
        final ImmutableSet.Builder<String> guides1 = ImmutableSet.builder();
        final ImmutableSet.Builder<String> guides2 = ImmutableSet.builder();
        try (final TableReader<String[]> reader = TableUtils.reader(path, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, new TableColumnCollection(positionColumn, sequenceColumn), formatExceptionFactory);
            return dataLine -> new String[]{dataLine.get(positionColumn), dataLine.get(sequenceColumn)};
        })) {
            final List<String[]> rows = reader.toList();
            for (final String[] row : rows) {
                if (row[0].equals(position1)) {
                    guides1.add(row[1]);
                } else if (row[0].equals(position2)) {
                    guides2.add(row[1]);
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        final GuideReference reference = new GuideReference(guides1.build(), guides2.build());
        logger.info(String.format("Loaded %d %s and %d %s guides from %s",
                reference.position1Guides.size(), position1, reference.position2Guides.size(), position2, path));
        if (reference.position1Guides.isEmpty() || reference.position2Guides.isEmpty()) {
            logger.warn("The guide reference has no guides for at least one position; every read will be Unexpected");
        }
        return reference;
    }

    public ImmutableSet<String> getPosition1Guides() {
        return position1Guides;
    }

    public ImmutableSet<String> getPosition2Guides() {
        return position2Guides;
    }

    /**
     * Classifies a pair of guides: expected iff each is a reference guide at its own position.
     */
    public ReadClass classify(final String gRNA1, final String gRNA2) {
        return position1Guides.contains(gRNA1) && position2Guides.contains(gRNA2) ? ReadClass.EXPECTED : ReadClass.UNEXPECTED;
    }
}
