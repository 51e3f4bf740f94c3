package com.largomodo.kormarc.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable KORMARC bibliographic record: leader, control fields and data fields.
 * <p>
 * Field order within each list is meaningful and preserved through every
 * serialization round-trip. Updates are expressed by constructing a new instance.
 */
public record KormarcRecord(Leader leader, List<ControlField> controlFields, List<DataField> dataFields) {

    public KormarcRecord {
        Objects.requireNonNull(leader, "leader must not be null");
        controlFields = controlFields == null ? List.of() : List.copyOf(controlFields);
        dataFields = dataFields == null ? List.of() : List.copyOf(dataFields);
    }

    public Optional<ControlField> controlField(String tag) {
        return controlFields.stream().filter(f -> f.tag().equals(tag)).findFirst();
    }

    /**
     * First data field with the given tag. Repeatable tags (e.g. 650) keep the rest
     * available through {@link #dataFields(String)}.
     */
    public Optional<DataField> dataField(String tag) {
        return dataFields.stream().filter(f -> f.tag().equals(tag)).findFirst();
    }

    public List<DataField> dataFields(String tag) {
        return dataFields.stream().filter(f -> f.tag().equals(tag)).toList();
    }

    public boolean hasControlField(String tag) {
        return controlField(tag).isPresent();
    }

    public boolean hasDataField(String tag) {
        return dataField(tag).isPresent();
    }
}
