package com.tradecore.repository.stream;

import com.tradecore.domain.model.StreamObservation;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Columnar batch file format for dumped observations.
 *
 * <p>Header layout (36 bytes):
 * <ul>
 *   <li>magic(8): 0x5443434F4C554D4E ("TCCOLUMN" in ASCII)</li>
 *   <li>version(4): format version (currently 1)</li>
 *   <li>rowCount(4)</li>
 *   <li>columnCount(4)</li>
 *   <li>createdAtEpochMs(8)</li>
 *   <li>crc32(8): CRC32 of everything after the header</li>
 * </ul>
 *
 * <p>Body: the schema name (modified UTF-8), one descriptor per column (name as modified UTF-8,
 * type code as one byte), then one block per column holding that column's value for every row
 * in row order.
 *
 * <p>Value encodings: LONG as 8 bytes, INT as 4 bytes, STRING as a presence byte followed by
 * modified UTF-8, DECIMAL as a presence byte, the scale (4 bytes), the unscaled value length
 * (4 bytes) and its two's-complement bytes. Decimals therefore reload with their exact scale.
 *
 * <p>Files are written to a temporary sibling and moved into place, so a reader never sees a
 * partially written file under the final name.
 */
public final class BatchFileFormat {

    public static final long MAGIC = 0x5443434F4C554D4EL; // "TCCOLUMN"
    public static final int VERSION = 1;
    public static final int HEADER_SIZE = 36;
    public static final String FILE_EXTENSION = ".tcol";

    private BatchFileFormat() {}

    /**
     * Writes {@code records} to {@code target} in columnar layout.
     *
     * @return the number of bytes written
     */
    public static <T extends StreamObservation> long write(Path target, ObservationSchema<T> schema, List<T> records)
            throws IOException {
        byte[] body = encodeBody(schema, records);

        CRC32 crc = new CRC32();
        crc.update(body);

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp));
                DataOutputStream dos = new DataOutputStream(out)) {
            writeHeader(dos, records.size(), schema.getColumns().size(), crc.getValue());
            dos.write(body);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return HEADER_SIZE + body.length;
    }

    static void writeHeader(DataOutputStream dos, int rowCount, int columnCount, long crc32) throws IOException {
        dos.writeLong(MAGIC);
        dos.writeInt(VERSION);
        dos.writeInt(rowCount);
        dos.writeInt(columnCount);
        dos.writeLong(System.currentTimeMillis());
        dos.writeLong(crc32);
    }

    /**
     * Validates and parses the file header.
     */
    public static FileHeader readHeader(DataInputStream dis) throws IOException {
        long magic = dis.readLong();
        if (magic != MAGIC) {
            throw new IOException("Invalid batch file: bad magic number");
        }
        int version = dis.readInt();
        if (version != VERSION) {
            throw new IOException("Unsupported batch file version: " + version);
        }
        int rowCount = dis.readInt();
        int columnCount = dis.readInt();
        long createdAtMs = dis.readLong();
        long crc32 = dis.readLong();
        return new FileHeader(version, rowCount, columnCount, createdAtMs, crc32);
    }

    private static <T extends StreamObservation> byte[] encodeBody(ObservationSchema<T> schema, List<T> records)
            throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(records.size() * 64 + 256);
        DataOutputStream dos = new DataOutputStream(bytes);

        dos.writeUTF(schema.getName());
        for (ObservationSchema.Column<T> column : schema.getColumns()) {
            dos.writeUTF(column.getName());
            dos.writeByte(column.getType().getCode());
        }

        for (ObservationSchema.Column<T> column : schema.getColumns()) {
            for (T record : records) {
                writeValue(dos, column.getType(), column.valueOf(record));
            }
        }
        dos.flush();
        return bytes.toByteArray();
    }

    private static void writeValue(DataOutputStream dos, ObservationSchema.ColumnType type, Object value)
            throws IOException {
        switch (type) {
            case LONG -> dos.writeLong(value != null ? (Long) value : 0L);
            case INT -> dos.writeInt(value != null ? (Integer) value : 0);
            case STRING -> {
                dos.writeBoolean(value != null);
                if (value != null) {
                    dos.writeUTF((String) value);
                }
            }
            case DECIMAL -> {
                dos.writeBoolean(value != null);
                if (value != null) {
                    BigDecimal decimal = (BigDecimal) value;
                    byte[] unscaled = decimal.unscaledValue().toByteArray();
                    dos.writeInt(decimal.scale());
                    dos.writeInt(unscaled.length);
                    dos.write(unscaled);
                }
            }
        }
    }

    static Object readValue(DataInputStream dis, ObservationSchema.ColumnType type) throws IOException {
        return switch (type) {
            case LONG -> dis.readLong();
            case INT -> dis.readInt();
            case STRING -> dis.readBoolean() ? dis.readUTF() : null;
            case DECIMAL -> readDecimal(dis);
        };
    }

    private static BigDecimal readDecimal(DataInputStream dis) throws IOException {
        if (!dis.readBoolean()) {
            return null;
        }
        int scale = dis.readInt();
        byte[] unscaled = new byte[dis.readInt()];
        dis.readFully(unscaled);
        return new BigDecimal(new BigInteger(unscaled), scale);
    }

    /** File name of one dump, unique per dump sequence number. */
    public static String fileName(String prefix, long createdAtEpochMs, long sequence) {
        return String.format("%s_%d_%06d%s", prefix, createdAtEpochMs, sequence, FILE_EXTENSION);
    }

    /**
     * Parsed file header.
     */
    public record FileHeader(int version, int rowCount, int columnCount, long createdAtEpochMs, long crc32) {}
}
