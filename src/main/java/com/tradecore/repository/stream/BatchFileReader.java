package com.tradecore.repository.stream;

import com.tradecore.domain.model.StreamObservation;
import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Reloads batch files written by {@link BatchFileFormat}. Used by tests and offline tooling;
 * the live repositories never read their own dumps back.
 */
public final class BatchFileReader {

    private BatchFileReader() {}

    /**
     * Reads every record of {@code file}.
     *
     * @throws IOException if the file is truncated, fails its checksum, or was written with a
     *     different column layout than {@code schema}
     */
    public static <T extends StreamObservation> List<T> read(Path file, ObservationSchema<T> schema)
            throws IOException {
        BatchFileFormat.FileHeader header;
        byte[] body;
        try (InputStream in = Files.newInputStream(file);
                DataInputStream dis = new DataInputStream(in)) {
            header = BatchFileFormat.readHeader(dis);
            body = dis.readAllBytes();
        }

        CRC32 crc = new CRC32();
        crc.update(body);
        if (crc.getValue() != header.crc32()) {
            throw new IOException("Batch file " + file + " failed CRC32 check");
        }

        DataInputStream dis = new DataInputStream(new ByteArrayInputStream(body));
        String schemaName = dis.readUTF();
        if (!schemaName.equals(schema.getName())) {
            throw new IOException(
                    String.format("Batch file %s holds %s, expected %s", file, schemaName, schema.getName()));
        }

        List<ObservationSchema.ColumnType> types = new ArrayList<>(header.columnCount());
        List<String> names = new ArrayList<>(header.columnCount());
        for (int i = 0; i < header.columnCount(); i++) {
            names.add(dis.readUTF());
            types.add(ObservationSchema.ColumnType.fromCode(dis.readUnsignedByte()));
        }
        verifyLayout(file, schema, names, types);

        int rows = header.rowCount();
        Object[][] columns = new Object[names.size()][rows];
        for (int c = 0; c < names.size(); c++) {
            for (int r = 0; r < rows; r++) {
                columns[c][r] = BatchFileFormat.readValue(dis, types.get(c));
            }
        }

        List<T> records = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            Map<String, Object> values = new HashMap<>();
            for (int c = 0; c < names.size(); c++) {
                values.put(names.get(c), columns[c][r]);
            }
            records.add(schema.assemble(values));
        }
        return records;
    }

    /** Reads only the header, without validating the body. */
    public static BatchFileFormat.FileHeader readHeader(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
                DataInputStream dis = new DataInputStream(in)) {
            return BatchFileFormat.readHeader(dis);
        }
    }

    private static void verifyLayout(
            Path file, ObservationSchema<?> schema, List<String> names, List<ObservationSchema.ColumnType> types)
            throws IOException {
        List<? extends ObservationSchema.Column<?>> expected = schema.getColumns();
        if (expected.size() != names.size()) {
            throw new IOException(String.format(
                    "Batch file %s has %d columns, expected %d", file, names.size(), expected.size()));
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).getName().equals(names.get(i)) || expected.get(i).getType() != types.get(i)) {
                throw new IOException(String.format(
                        "Batch file %s column %d is %s:%s, expected %s:%s",
                        file,
                        i,
                        names.get(i),
                        types.get(i),
                        expected.get(i).getName(),
                        expected.get(i).getType()));
            }
        }
    }
}
