package com.streamfirst.sheetgrid.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One denormalized row of a sheet: a mapping from column name to a scalar cell value. The identity
 * column's value is lifted into {@link #id} and is also kept in {@link #fields} so that it takes
 * part in searching and display like any other column.
 *
 * <p>Instances are immutable; {@link #with(String, Object)} returns a modified copy.
 */
@Value
@EqualsAndHashCode
public class SheetRecord {
    /** Business identity correlating this row with the remote store */
    @NonNull RecordId id;

    /** Cell values keyed by column name, in sheet column order. Values may be null. */
    @NonNull Map<String, Object> fields;

    private SheetRecord(RecordId id, Map<String, Object> fields) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builds a record whose identity is read from {@code identityColumn}.
     *
     * @throws IllegalArgumentException if the identity column is missing or blank
     */
    public static SheetRecord of(String identityColumn, Map<String, ?> fields) {
        Objects.requireNonNull(identityColumn, "Identity column cannot be null");
        Objects.requireNonNull(fields, "Fields cannot be null");
        Object identity = fields.get(identityColumn);
        if (CellValues.isBlank(identity)) {
            throw new IllegalArgumentException(
                    "Record has no value in identity column '" + identityColumn + "'");
        }
        return new SheetRecord(RecordId.of(CellValues.stringify(identity).trim()), copy(fields));
    }

    /** Returns the value of a column, or {@code null} when the column is absent or empty. */
    public Object get(String column) {
        return fields.get(column);
    }

    public boolean hasColumn(String column) {
        return fields.containsKey(column);
    }

    /** Returns a copy of this record with one field replaced. The identity never changes. */
    public SheetRecord with(String column, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(fields);
        updated.put(column, value);
        return new SheetRecord(id, updated);
    }

    private static Map<String, Object> copy(Map<String, ?> fields) {
        return new LinkedHashMap<>(fields);
    }

    @Override
    public String toString() {
        return "SheetRecord{" + "id=" + id + ", fieldCount=" + fields.size() + '}';
    }
}
