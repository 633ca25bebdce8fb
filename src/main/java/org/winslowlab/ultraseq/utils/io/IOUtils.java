package org.winslowlab.ultraseq.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import htsjdk.samtools.util.IOUtil;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

public final class IOUtils {

    private IOUtils() {}

    /**
     * Makes a reader for a file, unzipping if the file content starts with the gzip magic number.
     */
    public static BufferedReader makeReaderMaybeGzipped(final Path path) throws IOException {
        Utils.nonNull(path);
        final InputStream in = new BufferedInputStream(Files.newInputStream(path));
        return makeReaderMaybeGzipped(in, IOUtil.isGZIPInputStream(in));
    }

    /**
     * makes a reader for an inputStream wrapping it in an appropriate unzipper if necessary
     * @param zipped is this stream zipped
     */
    public static BufferedReader makeReaderMaybeGzipped(final InputStream in, final boolean zipped) throws IOException {
        if (zipped) {
            return new BufferedReader(new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8));
        } else {
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     */
    public static InputStream makeZippedInputStream(final InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * Makes a UTF-8 writer for a file, replacing any existing content.
     */
    public static Writer makeWriter(final Path path) throws IOException {
        Utils.nonNull(path);
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    /**
     * @param path Path to test
     * @throws UserException.CouldNotReadInputFile if the file isn't readable
     *         and a regular file
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path);

        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }

    /**
     * @param path Path to test
     * @throws UserException.CouldNotReadInputFile if the path isn't a readable directory
     */
    public static void assertDirectoryIsReadable(final Path path) {
        Utils.nonNull(path);

        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isDirectory(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a directory");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }

    /**
     * Creates a directory and any missing parents. Does nothing if the directory already exists.
     * @throws UserException.CouldNotCreateOutputFile if the directory cannot be created.
     */
    public static Path createDirectories(final Path path) {
        Utils.nonNull(path);
        try {
            return Files.createDirectories(path);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, "the directory could not be created", e);
        }
    }

    /**
     * Delete rootPath recursively
     * @param rootPath is the file/directory to be deleted
     */
    public static void deleteRecursively(final Path rootPath) {
        IOUtil.recursiveDelete(rootPath);
    }
}
