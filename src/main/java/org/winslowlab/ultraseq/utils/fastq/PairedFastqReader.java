package org.winslowlab.ultraseq.utils.fastq;

import htsjdk.samtools.fastq.FastqConstants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;
import org.winslowlab.ultraseq.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads two mate FASTQ files in lock-step, one record from each per {@link ReadPair}.
 * <p>
 * Both files may be gzipped or plain text. A record is four lines: the {@code @} header, the bases, the {@code +}
 * separator and the qualities. Records with no bases are valid and are returned like any other. Blank lines
 * between records are skipped.
 * </p>
 * <p>
 * When one file runs out of records before the other, or when mate names are validated and disagree, a
 * {@link UserException.MateDesynchronization} is thrown at the offending record. Truncated records, missing
 * header or separator lines, and qualities of the wrong length raise {@link UserException.MalformedFile}.
 * </p>
 */
public final class PairedFastqReader implements Closeable, Iterable<ReadPair> {

    private static final Logger logger = LogManager.getLogger(PairedFastqReader.class);

    private final Path read1Path;
    private final Path read2Path;
    private final FastqRecordReader read1Reader;
    private final FastqRecordReader read2Reader;
    private final boolean validateMateNames;

    private long recordNumber = 0;

    /**
     * @param read1Path         mate-1 FASTQ, gzipped or not.
     * @param read2Path         mate-2 FASTQ, gzipped or not.
     * @param validateMateNames whether mate names at the same position must agree.
     */
    public PairedFastqReader(final Path read1Path, final Path read2Path, final boolean validateMateNames) {
        this.read1Path = Utils.nonNull(read1Path, "read1 path cannot be null");
        this.read2Path = Utils.nonNull(read2Path, "read2 path cannot be null");
        this.validateMateNames = validateMateNames;
        IOUtils.assertFileIsReadable(read1Path);
        IOUtils.assertFileIsReadable(read2Path);
        this.read1Reader = new FastqRecordReader(read1Path);
        FastqRecordReader reader2 = null;
        try {
            reader2 = new FastqRecordReader(read2Path);
        } finally {
            if (reader2 == null) {
                read1Reader.close();
            }
        }
        this.read2Reader = reader2;
        logger.debug("Opened mate files " + read1Path + " and " + read2Path);
    }

    private boolean hasNext() {
        final boolean hasRead1 = read1Reader.hasNext();
        final boolean hasRead2 = read2Reader.hasNext();
        if (hasRead1 != hasRead2) {
            throw new UserException.MateDesynchronization(read1Path, read2Path, recordNumber + 1,
                    (hasRead1 ? read2Path : read1Path).getFileName() + " has fewer records than its mate");
        }
        return hasRead1;
    }

    private ReadPair next() {
        if (!hasNext()) {
            throw new NoSuchElementException("there are no more read pairs");
        }
        final FastqRecordReader.Record read1 = read1Reader.next();
        final FastqRecordReader.Record read2 = read2Reader.next();
        recordNumber++;
        if (validateMateNames && !mateNamesAgree(read1.name, read2.name)) {
            throw new UserException.MateDesynchronization(read1Path, read2Path, recordNumber,
                    String.format("read names '%s' and '%s' do not match", read1.name, read2.name));
        }
        return new ReadPair(read1.name, read1.bases, read2.bases);
    }

    /**
     * Compares the names of two mates on their first whitespace-delimited token, ignoring a trailing /1 or /2.
     */
    static boolean mateNamesAgree(final String read1Name, final String read2Name) {
        return normalizeMateName(read1Name).equals(normalizeMateName(read2Name));
    }

    static String normalizeMateName(final String readName) {
        final String trimmed = readName.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        final String token = trimmed.substring(0, end);
        if (token.endsWith(FastqConstants.FIRST_OF_PAIR) || token.endsWith(FastqConstants.SECOND_OF_PAIR)) {
            return token.substring(0, token.length() - 2);
        }
        return token;
    }

    @Override
    public Iterator<ReadPair> iterator() {
        return new Iterator<ReadPair>() {
            @Override
            public boolean hasNext() {
                return PairedFastqReader.this.hasNext();
            }

            @Override
            public ReadPair next() {
                return PairedFastqReader.this.next();
            }
        };
    }

    @Override
    public void close() {
        try {
            read1Reader.close();
        } finally {
            read2Reader.close();
        }
    }

    /**
     * Reads the four-line records of one FASTQ file, one record ahead.
     */
    private static final class FastqRecordReader implements Closeable {

        private static final class Record {
            private final String name;
            private final String bases;

            private Record(final String name, final String bases) {
                this.name = name;
                this.bases = bases;
            }
        }

        private final Path path;
        private final BufferedReader reader;
        private long lineNumber = 0;
        private Record nextRecord;

        private FastqRecordReader(final Path path) {
            this.path = path;
            try {
                this.reader = IOUtils.makeReaderMaybeGzipped(path);
            } catch (final IOException e) {
                throw new UserException.CouldNotReadInputFile(path, e);
            }
            this.nextRecord = readRecord();
        }

        private boolean hasNext() {
            return nextRecord != null;
        }

        private Record next() {
            if (nextRecord == null) {
                throw new NoSuchElementException("there are no more records in " + path);
            }
            final Record record = nextRecord;
            nextRecord = readRecord();
            return record;
        }

        private Record readRecord() {
            String header = readLine();
            while (header != null && header.trim().isEmpty()) {
                header = readLine();
            }
            if (header == null) {
                return null;
            }
            if (!header.startsWith(FastqConstants.SEQUENCE_HEADER)) {
                throw malformed(String.format("the header line should start with '%s' but was '%s'",
                        FastqConstants.SEQUENCE_HEADER, header));
            }
            final String bases = requireLine("sequence");
            final String separator = requireLine("separator");
            if (!separator.startsWith(FastqConstants.QUALITY_HEADER)) {
                throw malformed(String.format("the separator line should start with '%s' but was '%s'",
                        FastqConstants.QUALITY_HEADER, separator));
            }
            final String qualities = requireLine("quality");
            if (qualities.length() != bases.length()) {
                throw malformed(String.format("%d bases but %d qualities", bases.length(), qualities.length()));
            }
            return new Record(header.substring(FastqConstants.SEQUENCE_HEADER.length()), bases);
        }

        private String requireLine(final String kind) {
            final String line = readLine();
            if (line == null) {
                throw malformed("the record ends before its " + kind + " line");
            }
            return line;
        }

        private String readLine() {
            try {
                final String line = reader.readLine();
                if (line != null) {
                    lineNumber++;
                }
                return line;
            } catch (final IOException e) {
                throw new UserException.CouldNotReadInputFile(path, e);
            }
        }

        private UserException.MalformedFile malformed(final String message) {
            return new UserException.MalformedFile(path, String.format("invalid FASTQ record at line %d: %s", lineNumber, message));
        }

        @Override
        public void close() {
            try {
                reader.close();
            } catch (final IOException e) {
                throw new UserException.CouldNotReadInputFile(path, "could not be closed", e);
            }
        }
    }
}
