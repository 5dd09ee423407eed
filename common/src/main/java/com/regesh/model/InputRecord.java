package com.regesh.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input record as read from the source JSON array.
 *
 * <p>Only {@code text} is expected; {@code id}, {@code category} and {@code source} are
 * optional, and every other field is kept as-is so that it survives enrichment.  Field
 * order follows the source document.</p>
 */
@ToString
@EqualsAndHashCode
public class InputRecord {

    public static final String ID = "id";
    public static final String TEXT = "text";
    public static final String CATEGORY = "category";
    public static final String SOURCE = "source";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public InputRecord() {
    }

    private InputRecord(Map<String, Object> fields) {
        this.fields.putAll(fields);
    }

    /**
     * Creates a record holding a copy of the given fields.
     */
    public static InputRecord of(Map<String, Object> fields) {
        return new InputRecord(fields);
    }

    @JsonAnySetter
    private void put(String name, Object value) {
        fields.put(name, value);
    }

    /** All fields in source order. */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Object getId() {
        return fields.get(ID);
    }

    public String getCategory() {
        return asString(fields.get(CATEGORY));
    }

    public String getSource() {
        return asString(fields.get(SOURCE));
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
