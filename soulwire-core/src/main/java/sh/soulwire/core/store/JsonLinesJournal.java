// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.soulwire.core.error.PersistenceException;

/**
 * Journal stored as one JSON document per line.
 *
 * <p>
 * Every append reaches the file before it returns. An append that fails part-way
 * is cut back to the previous end of file; if even that fails the journal refuses
 * further appends, so a torn line never has records after it. A crash mid-append can
 * leave a partial final line; opening the journal cuts it off (logged at WARN) so
 * the next append starts on a fresh line, and replay skips an unparseable final
 * line for the same reason. A malformed line anywhere else means the file was
 * damaged and replay fails with {@link PersistenceException}.
 *
 * @param <T> record type, serialized with Jackson
 * @since 0.1.0
 */
public final class JsonLinesJournal<T> implements Journal<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesJournal.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path file;
    private final Class<T> type;
    private final FileChannel channel;
    private boolean closed;
    private boolean failed;

    JsonLinesJournal(final Path file, final Class<T> type, final FileChannel channel) {
        this.file = file;
        this.type = type;
        this.channel = channel;
    }

    /**
     * Opens (creating if needed) the journal at {@code file}.
     *
     * @throws PersistenceException if the file or its parent directory cannot be opened
     */
    public static <T> JsonLinesJournal<T> open(final Path file, final Class<T> type) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(type, "type");
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            repairTail(file);
            final FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            log.debug("Opened journal {} for {}", file, type.getSimpleName());
            return new JsonLinesJournal<>(file, type, channel);
        } catch (IOException e) {
            throw new PersistenceException("Cannot open journal " + file, e);
        }
    }

    @Override
    public synchronized void append(final T record) {
        Objects.requireNonNull(record, "record");
        if (closed) {
            throw new PersistenceException("Journal " + file + " is closed");
        }
        if (failed) {
            throw new PersistenceException("Journal " + file + " holds a torn record and refuses appends");
        }
        final String line;
        try {
            line = MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize " + type.getSimpleName(), e);
        }
        final ByteBuffer buffer = ByteBuffer.wrap((line + "\n").getBytes(StandardCharsets.UTF_8));
        final long start;
        try {
            start = channel.size();
        } catch (IOException e) {
            throw new PersistenceException("Cannot append to journal " + file, e);
        }
        try {
            long position = start;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
        } catch (IOException e) {
            rollBack(start, e);
            throw new PersistenceException("Cannot append to journal " + file, e);
        }
    }

    private void rollBack(final long length, final IOException cause) {
        try {
            channel.truncate(length);
        } catch (IOException e) {
            failed = true;
            cause.addSuppressed(e);
            log.error("Cannot cut torn record from {}; journal refuses further appends", file, e);
        }
    }

    @Override
    public void replay(final Consumer<? super T> consumer) {
        final List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot read journal " + file, e);
        }

        int replayed = 0;
        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            final T record;
            try {
                record = MAPPER.readValue(line, type);
            } catch (JsonProcessingException e) {
                if (i == lines.size() - 1) {
                    log.warn("Skipping truncated final record in {} (line {})", file, i + 1);
                    continue;
                }
                throw new PersistenceException("Corrupt record in " + file + " at line " + (i + 1), e);
            }
            consumer.accept(record);
            replayed++;
        }
        log.info("Replayed {} {} records from {}", replayed, type.getSimpleName(), file);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            throw new PersistenceException("Cannot close journal " + file, e);
        }
    }

    /**
     * Makes sure the file ends with a newline. A complete record missing only its
     * newline is terminated; a partial record left by a crash is cut off.
     */
    private static void repairTail(final Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return;
        }
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            final long length = raf.length();
            raf.seek(length - 1);
            if (raf.read() == '\n') {
                return;
            }
            long start = length - 1;
            while (start > 0) {
                raf.seek(start - 1);
                if (raf.read() == '\n') {
                    break;
                }
                start--;
            }
            final byte[] tail = new byte[(int) (length - start)];
            raf.seek(start);
            raf.readFully(tail);
            if (isJson(tail)) {
                raf.seek(length);
                raf.write('\n');
            } else {
                log.warn("Dropping {} bytes of partial record at the end of {}", tail.length, file);
                raf.setLength(start);
            }
        }
    }

    private static boolean isJson(final byte[] bytes) {
        try {
            MAPPER.readTree(bytes);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "JsonLinesJournal[" + file + "]";
    }
}
