package io.research.vectors.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.research.vectors.ChunkRecord;
import io.research.vectors.CorruptCollectionException;
import io.research.vectors.StorageException;
import io.research.vectors.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Append-only binary log holding every put and delete of a collection.
 *
 * <p>Layout: a header ({@code RVLG}, format version, dimensions) followed by frames of
 * {@code [op:1][length:4][headerCrc:4][payload:length][crc:4]}. A put payload is the JSON
 * of the record's scalar fields followed by the embedding as big-endian floats; a delete
 * payload is the id as a JSON string. The header CRC covers the op byte and the length,
 * the trailing CRC covers the op byte and the payload.</p>
 *
 * <p>Every append is forced to disk before it returns. A failed append is truncated
 * away so the log never holds a partial frame that later frames are appended behind.</p>
 *
 * <p>Not thread-safe; {@link PersistentCollection} serialises access.</p>
 */
final class RecordLog implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RecordLog.class);

    static final String FILE_NAME = "records.log";

    // Format constants
    private static final byte[] MAGIC = "RVLG".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;
    static final int HEADER_BYTES = MAGIC.length + 2 + 4;
    static final int FRAME_HEADER_BYTES = 1 + 4 + 4;
    private static final int FRAME_OVERHEAD = FRAME_HEADER_BYTES + 4;
    private static final int MAX_PAYLOAD_BYTES = 256 * 1024 * 1024;

    static final byte OP_PUT = 1;
    static final byte OP_DELETE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_LONG_FOR_INTS);

    /**
     * Receives the frames of a log while it is replayed on open.
     */
    interface Replay {
        void put(ChunkRecord record);

        void delete(String id);
    }

    private final Path file;
    private final int dimensions;
    private FileChannel channel;
    private long endPosition;
    private long frameCount;
    private boolean failed;

    private RecordLog(Path file, int dimensions, FileChannel channel, long endPosition, long frameCount) {
        this.file = file;
        this.dimensions = dimensions;
        this.channel = channel;
        this.endPosition = endPosition;
        this.frameCount = frameCount;
    }

    /**
     * Creates an empty log. The header is written to a temporary file first so a crash
     * never leaves a half-written header behind.
     */
    static RecordLog create(Path file, int dimensions) throws IOException {
        writeSnapshot(file, dimensions, List.of());
        FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
        log.debug("Created record log {} ({}d)", file, dimensions);
        return new RecordLog(file, dimensions, channel, HEADER_BYTES, 0);
    }

    /**
     * Opens an existing log and replays it into {@code replay}.
     *
     * <p>A frame cut short by the end of the file is the trace of a write that crashed
     * before it was acknowledged; it is truncated with a warning. A frame only counts as
     * cut short when its header is incomplete or its checksummed length runs past the end
     * of the file. Any other damage fails and leaves the file as it was.</p>
     *
     * @throws CorruptCollectionException if the header, a checksum or a payload is invalid
     */
    static RecordLog open(Path file, int dimensions, Replay replay) throws IOException {
        long fileSize = Files.size(file);
        long position;
        long frames = 0;
        boolean torn = false;

        try (InputStream raw = Files.newInputStream(file);
             DataInputStream in = new DataInputStream(new BufferedInputStream(raw, 1 << 16))) {

            readHeader(in, file, dimensions);
            position = HEADER_BYTES;

            while (true) {
                int op = in.read();
                if (op == -1) {
                    break;
                }
                if (op != OP_PUT && op != OP_DELETE) {
                    throw new CorruptCollectionException(file, String.format(
                        "unknown frame type %d at offset %d", op, position));
                }
                if (position + FRAME_HEADER_BYTES > fileSize) {
                    torn = true;
                    break;
                }
                int length = in.readInt();
                int storedHeaderCrc = in.readInt();
                if (storedHeaderCrc != headerChecksum((byte) op, length)) {
                    throw new CorruptCollectionException(file, String.format(
                        "frame header checksum mismatch at offset %d", position));
                }
                if (length < 0 || length > MAX_PAYLOAD_BYTES) {
                    throw new CorruptCollectionException(file, String.format(
                        "invalid frame length %d at offset %d", length, position));
                }
                if (position + FRAME_OVERHEAD + length > fileSize) {
                    torn = true;
                    break;
                }
                byte[] payload = new byte[length];
                in.readFully(payload);
                int storedCrc = in.readInt();
                if (storedCrc != checksum((byte) op, payload)) {
                    throw new CorruptCollectionException(file, String.format(
                        "checksum mismatch in frame at offset %d", position));
                }

                if (op == OP_PUT) {
                    replay.put(decodePut(payload, dimensions, file, position));
                } else {
                    replay.delete(decodeDelete(payload, file, position));
                }
                position += FRAME_OVERHEAD + length;
                frames++;
            }
        } catch (EOFException e) {
            throw new CorruptCollectionException(file, "unexpected end of file: " + e.getMessage());
        }

        FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
        try {
            if (torn || channel.size() != position) {
                log.warn("Truncating incomplete trailing frame of {} at offset {} ({} bytes discarded)",
                    file, position, fileSize - position);
                channel.truncate(position);
                channel.force(true);
            }
        } catch (IOException e) {
            channel.close();
            throw e;
        }

        log.debug("Replayed {} frames from {}", frames, file);
        return new RecordLog(file, dimensions, channel, position, frames);
    }

    // ==================== Appends ====================

    void appendPuts(Collection<ChunkRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            DataOutputStream out = new DataOutputStream(buffer);
            for (ChunkRecord record : records) {
                writeFrame(out, OP_PUT, encodePut(record));
            }
            out.flush();
        } catch (IOException e) {
            throw new StorageException("Failed to encode records for " + file, e);
        }
        append(buffer.toByteArray(), records.size());
    }

    void appendDeletes(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            DataOutputStream out = new DataOutputStream(buffer);
            for (String id : ids) {
                writeFrame(out, OP_DELETE, MAPPER.writeValueAsBytes(id));
            }
            out.flush();
        } catch (IOException e) {
            throw new StorageException("Failed to encode deletions for " + file, e);
        }
        append(buffer.toByteArray(), ids.size());
    }

    private void append(byte[] frames, int count) {
        ensureWritable();
        long start = endPosition;
        try {
            ByteBuffer buffer = ByteBuffer.wrap(frames);
            long position = start;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        } catch (IOException e) {
            rollback(start);
            throw new StorageException(String.format("Failed to append %d frames to %s", count, file), e);
        }
        endPosition = start + frames.length;
        frameCount += count;
    }

    private void rollback(long position) {
        try {
            channel.truncate(position);
            channel.force(true);
        } catch (IOException e) {
            failed = true;
            log.error("Could not roll back partial append to {}; refusing further writes", file, e);
        }
    }

    /**
     * Replaces the whole log with a fresh one holding only {@code records}.
     */
    void rewrite(Collection<ChunkRecord> records) {
        ensureWritable();
        try {
            Path tmp = writeSnapshotTemp(file, dimensions, records);
            channel.close();
            try {
                FileReplacement.moveAtomically(tmp, file);
            } finally {
                channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
            }
            endPosition = channel.size();
            frameCount = records.size();
        } catch (IOException e) {
            throw new StorageException("Failed to rewrite " + file, e);
        }
    }

    // ==================== Accessors ====================

    long frameCount() {
        return frameCount;
    }

    long sizeBytes() {
        return endPosition;
    }

    Path file() {
        return file;
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.force(true);
            channel.close();
        }
    }

    private void ensureWritable() {
        if (failed) {
            throw new StorageException("Record log " + file + " is in a failed state after an unrecoverable write error");
        }
        if (!channel.isOpen()) {
            throw new StorageException("Record log " + file + " is closed");
        }
    }

    // ==================== Encoding ====================

    private static void writeSnapshot(Path file, int dimensions, Collection<ChunkRecord> records) throws IOException {
        Path tmp = writeSnapshotTemp(file, dimensions, records);
        FileReplacement.moveAtomically(tmp, file);
    }

    private static Path writeSnapshotTemp(Path file, int dimensions, Collection<ChunkRecord> records) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (FileChannel out = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
             DataOutputStream dos = new DataOutputStream(
                 new BufferedOutputStream(Channels.newOutputStream(out), 1 << 16))) {
            dos.write(MAGIC);
            dos.writeShort(FORMAT_VERSION);
            dos.writeInt(dimensions);
            for (ChunkRecord record : records) {
                writeFrame(dos, OP_PUT, encodePut(record));
            }
            dos.flush();
            out.force(true);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return tmp;
    }

    private static void readHeader(DataInputStream in, Path file, int dimensions) throws IOException {
        byte[] magic = new byte[MAGIC.length];
        in.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new CorruptCollectionException(file, "bad magic number");
        }
        short version = in.readShort();
        if (version != FORMAT_VERSION) {
            throw new UnsupportedFormatException(file, version);
        }
        int storedDimensions = in.readInt();
        if (storedDimensions != dimensions) {
            throw new CorruptCollectionException(file, String.format(
                "log dimension %d disagrees with descriptor dimension %d", storedDimensions, dimensions));
        }
    }

    private static void writeFrame(DataOutputStream out, byte op, byte[] payload) throws IOException {
        out.writeByte(op);
        out.writeInt(payload.length);
        out.writeInt(headerChecksum(op, payload.length));
        out.write(payload);
        out.writeInt(checksum(op, payload));
    }

    static int headerChecksum(byte op, int length) {
        CRC32 crc = new CRC32();
        crc.update(op);
        crc.update(ByteBuffer.allocate(4).putInt(length).array());
        return (int) crc.getValue();
    }

    private static int checksum(byte op, byte[] payload) {
        CRC32 crc = new CRC32();
        crc.update(op);
        crc.update(payload);
        return (int) crc.getValue();
    }

    private static byte[] encodePut(ChunkRecord record) throws IOException {
        byte[] json = MAPPER.writeValueAsBytes(StoredFields.of(record));
        float[] embedding = record.embedding();
        ByteBuffer payload = ByteBuffer.allocate(4 + json.length + embedding.length * 4);
        payload.putInt(json.length);
        payload.put(json);
        for (float v : embedding) {
            payload.putFloat(v);
        }
        return payload.array();
    }

    private static String decodeDelete(byte[] payload, Path file, long offset) {
        try {
            String id = MAPPER.readValue(payload, String.class);
            if (id == null) {
                throw new CorruptCollectionException(file, "null id in delete frame at offset " + offset);
            }
            return id;
        } catch (JsonProcessingException e) {
            throw new CorruptCollectionException(file, String.format(
                "unreadable delete frame at offset %d: %s", offset, e.getOriginalMessage()));
        } catch (IOException e) {
            throw new StorageException("Failed to decode deletion at offset " + offset + " of " + file, e);
        }
    }

    private static ChunkRecord decodePut(byte[] payload, int dimensions, Path file, long offset) {
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        if (payload.length < 4) {
            throw new CorruptCollectionException(file, "short put frame at offset " + offset);
        }
        int jsonLength = buffer.getInt();
        if (jsonLength < 0 || payload.length != 4 + jsonLength + dimensions * 4) {
            throw new CorruptCollectionException(file, String.format(
                "put frame at offset %d does not hold a %d-dimensional record", offset, dimensions));
        }
        StoredFields fields;
        try {
            fields = MAPPER.readValue(payload, 4, jsonLength, StoredFields.class);
        } catch (JsonProcessingException e) {
            throw new CorruptCollectionException(file, String.format(
                "unreadable record at offset %d: %s", offset, e.getOriginalMessage()));
        } catch (IOException e) {
            throw new StorageException("Failed to decode record at offset " + offset + " of " + file, e);
        }
        buffer.position(4 + jsonLength);
        float[] embedding = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            embedding[i] = buffer.getFloat();
        }
        try {
            return new ChunkRecord(
                fields.id(),
                fields.text(),
                fields.sourceReference(),
                fields.metadata(),
                embedding,
                fields.embeddingModelId(),
                Instant.parse(fields.createdAt())
            );
        } catch (NullPointerException | DateTimeParseException e) {
            throw new CorruptCollectionException(file, String.format(
                "incomplete record at offset %d: %s", offset, e.getMessage()));
        }
    }

    /**
     * Scalar part of a record as written into a put frame.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredFields(
        String id,
        String text,
        String sourceReference,
        Map<String, Object> metadata,
        String embeddingModelId,
        String createdAt
    ) {
        static StoredFields of(ChunkRecord record) {
            return new StoredFields(
                record.id(),
                record.text(),
                record.sourceReference(),
                record.metadata(),
                record.embeddingModelId(),
                record.createdAt().toString()
            );
        }
    }
}
