package org.winslowlab.ultraseq.exceptions;

import java.io.File;
import java.nio.file.Path;
import java.util.List;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(String message, Exception e) {
            super(String.format("Couldn't read file. Error was: %s with exception: %s", message, getMessage(e)), e);
        }

        public CouldNotReadInputFile(Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }

        public CouldNotReadInputFile(String message) {
            super(message);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final Path file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath().toUri(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final Path file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.toAbsolutePath().toUri(), getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message, Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * <p/>
     * Class UserException.MalformedFile
     * <p/>
     * For errors parsing files
     */
    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(String message) {
            super(String.format("Unknown file is malformed: %s", message));
        }

        public MalformedFile(Path p, String message) {
            super(String.format("File %s is malformed: %s", p.toUri(), message));
        }

        public MalformedFile(Path p, String message, Exception e) {
            super(String.format("File %s is malformed: %s caused by %s", p.toUri(), message, getMessage(e)), e);
        }
    }

    /**
     * Mate FASTQ files that stopped describing the same fragments: one ran out of records before the other,
     * or the read names at the same position disagree.
     */
    public static final class MateDesynchronization extends UserException {
        private static final long serialVersionUID = 0L;

        public MateDesynchronization(final Path read1, final Path read2, final long recordNumber, final String message) {
            super(String.format("Mate files %s and %s are out of sync at record %d: %s",
                    read1.toUri(), read2.toUri(), recordNumber, message));
        }
    }

    /**
     * One or more samples could not be aggregated. The message lists every failed sample and its cause.
     */
    public static final class FailedSamples extends UserException {
        private static final long serialVersionUID = 0L;

        public FailedSamples(final List<String> failures) {
            super(String.format("%d sample(s) failed to aggregate:%n  %s", failures.size(), String.join(System.lineSeparator() + "  ", failures)));
        }
    }
}
