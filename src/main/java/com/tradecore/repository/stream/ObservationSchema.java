package com.tradecore.repository.stream;

import com.tradecore.domain.model.StreamObservation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Column layout of one observation type, used to write and reload batch files.
 *
 * <p>{@code estimatedRecordBytes} is the heap cost charged per buffered record when comparing the
 * buffer against its dump threshold and memory limit.
 */
public final class ObservationSchema<T extends StreamObservation> {

    public enum ColumnType {
        LONG(1),
        INT(2),
        STRING(3),
        DECIMAL(4);

        private final int code;

        ColumnType(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        public static ColumnType fromCode(int code) {
            for (ColumnType type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown column type code: " + code);
        }
    }

    public static final class Column<T> {

        private final String name;
        private final ColumnType type;
        private final Function<T, Object> getter;

        Column(String name, ColumnType type, Function<T, Object> getter) {
            this.name = name;
            this.type = type;
            this.getter = getter;
        }

        public String getName() {
            return name;
        }

        public ColumnType getType() {
            return type;
        }

        public Object valueOf(T record) {
            return getter.apply(record);
        }
    }

    /** One decoded record, addressed by column name. */
    public static final class Row {

        private final Map<String, Object> values;

        Row(Map<String, Object> values) {
            this.values = values;
        }

        public long getLong(String column) {
            Object value = values.get(column);
            return value == null ? 0L : (Long) value;
        }

        public int getInt(String column) {
            Object value = values.get(column);
            return value == null ? 0 : (Integer) value;
        }

        public String getString(String column) {
            return (String) values.get(column);
        }

        public BigDecimal getDecimal(String column) {
            return (BigDecimal) values.get(column);
        }
    }

    private final String name;
    private final int estimatedRecordBytes;
    private final List<Column<T>> columns;
    private final Function<Row, T> assembler;

    private ObservationSchema(
            String name, int estimatedRecordBytes, List<Column<T>> columns, Function<Row, T> assembler) {
        this.name = name;
        this.estimatedRecordBytes = estimatedRecordBytes;
        this.columns = Collections.unmodifiableList(columns);
        this.assembler = assembler;
    }

    public static <T extends StreamObservation> Builder<T> builder(String name, int estimatedRecordBytes) {
        return new Builder<>(name, estimatedRecordBytes);
    }

    public String getName() {
        return name;
    }

    public int getEstimatedRecordBytes() {
        return estimatedRecordBytes;
    }

    public List<Column<T>> getColumns() {
        return columns;
    }

    T assemble(Map<String, Object> values) {
        return assembler.apply(new Row(new HashMap<>(values)));
    }

    public static final class Builder<T extends StreamObservation> {

        private final String name;
        private final int estimatedRecordBytes;
        private final List<Column<T>> columns = new ArrayList<>();

        private Builder(String name, int estimatedRecordBytes) {
            this.name = name;
            this.estimatedRecordBytes = estimatedRecordBytes;
        }

        public Builder<T> longColumn(String column, Function<T, Long> getter) {
            columns.add(new Column<>(column, ColumnType.LONG, getter::apply));
            return this;
        }

        public Builder<T> intColumn(String column, Function<T, Integer> getter) {
            columns.add(new Column<>(column, ColumnType.INT, getter::apply));
            return this;
        }

        public Builder<T> stringColumn(String column, Function<T, String> getter) {
            columns.add(new Column<>(column, ColumnType.STRING, getter::apply));
            return this;
        }

        public Builder<T> decimalColumn(String column, Function<T, BigDecimal> getter) {
            columns.add(new Column<>(column, ColumnType.DECIMAL, getter::apply));
            return this;
        }

        public ObservationSchema<T> build(Function<Row, T> assembler) {
            return new ObservationSchema<>(name, estimatedRecordBytes, new ArrayList<>(columns), assembler);
        }
    }
}
