package com.emma.client.core.model;

import com.emma.client.api.Account;
import com.emma.client.core.wire.WireValues;

import java.util.List;
import java.util.Map;

/**
 * A custom member field defined on the account. Its shortcut name is the key
 * members use for the field's value.
 */
public class Field extends ApiModel {

    public static final String FIELD_ID = "field_id";
    public static final String SHORTCUT_NAME = "shortcut_name";
    public static final String DISPLAY_NAME = "display_name";
    public static final String FIELD_TYPE = "field_type";

    private static final List<String> DEFAULT_TOP_LEVEL = List.of(FIELD_ID, SHORTCUT_NAME, DISPLAY_NAME, FIELD_TYPE);

    private Long fieldId;
    private String shortcutName;
    private String displayName;
    private String fieldType;

    public Field(Account account, Map<String, ?> raw) {
        super(account);
        if (raw != null) {
            parse(raw);
        }
    }

    @Override
    protected void readAttributes(Map<String, Object> values) {
        this.fieldId = WireValues.asLong(values.remove(FIELD_ID));
        this.shortcutName = WireValues.asString(values.remove(SHORTCUT_NAME));
        this.displayName = WireValues.asString(values.remove(DISPLAY_NAME));
        this.fieldType = WireValues.asString(values.remove(FIELD_TYPE));
    }

    @Override
    protected void writeAttributes(Map<String, Object> wire) {
        putIfPresent(wire, FIELD_ID, fieldId);
        putIfPresent(wire, SHORTCUT_NAME, shortcutName);
        putIfPresent(wire, DISPLAY_NAME, displayName);
        putIfPresent(wire, FIELD_TYPE, fieldType);
    }

    @Override
    protected List<String> defaultTopLevel() {
        return DEFAULT_TOP_LEVEL;
    }

    public Long getFieldId() {
        return fieldId;
    }

    public String getShortcutName() {
        return shortcutName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getFieldType() {
        return fieldType;
    }

    @Override
    public String toString() {
        return "Field{fieldId=" + fieldId + ", shortcutName='" + shortcutName + "'}";
    }
}
