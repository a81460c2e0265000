package com.emma.client.core.model;

import com.emma.client.api.Account;
import com.emma.client.core.wire.WireValues;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for entities backed by an API record.
 *
 * <p>An entity has explicit typed attributes declared by the subclass plus a
 * bucket of custom fields holding every other value the record carried. The
 * two halves meet in the wire form:</p>
 * <ul>
 *   <li><b>parse</b> (hydration): a nested {@code fields} object is flattened into the
 *       record, wire-internal keys are dropped, the subclass consumes and coerces its
 *       attributes, and whatever is left becomes a custom field.</li>
 *   <li><b>extract</b>: typed attributes are written back in wire form next to the
 *       custom fields; keys in the requested top-level set stay at the top, keys the
 *       account lists as field shortcuts are nested under {@code fields}, everything
 *       else is left out.</li>
 * </ul>
 *
 * <p>Entities are mutable and not thread-safe.</p>
 */
public abstract class ApiModel {

    /**
     * Wire key holding custom field values.
     */
    public static final String FIELDS_KEY = "fields";

    protected final Account account;
    private final Map<String, Object> customFields = new LinkedHashMap<>();

    protected ApiModel(Account account) {
        this.account = Objects.requireNonNull(account, "account is required");
    }

    /**
     * Hydrates this entity from a raw API record. The record itself is not modified.
     */
    protected final void parse(Map<String, ?> raw) {
        Map<String, Object> values = WireValues.asMap(raw);
        Object nested = values.remove(FIELDS_KEY);
        if (nested instanceof Map<?, ?> nestedFields) {
            nestedFields.forEach((key, value) -> values.put(String.valueOf(key), value));
        }
        internalKeys().forEach(values::remove);
        readAttributes(values);
        customFields.putAll(values);
    }

    /**
     * Removes the entity's recognized attributes from {@code values}, coercing
     * them into typed fields. Anything left afterwards is kept as a custom field.
     */
    protected abstract void readAttributes(Map<String, Object> values);

    /**
     * Writes the entity's typed attributes in wire form. Null attributes are skipped.
     */
    protected abstract void writeAttributes(Map<String, Object> wire);

    /**
     * Top-level keys used by {@link #extract()}.
     */
    protected abstract List<String> defaultTopLevel();

    /**
     * Wire keys with no meaning once the record is hydrated.
     */
    protected Set<String> internalKeys() {
        return Set.of();
    }

    /**
     * Hook for entities with fields that a write body cannot go without.
     */
    protected void checkExtractable() {
    }

    /**
     * Flat wire view of the entity: typed attributes followed by custom fields.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        writeAttributes(wire);
        customFields.forEach(wire::putIfAbsent);
        return wire;
    }

    /**
     * Projects the entity into a write body using the entity's default top-level keys.
     */
    public Map<String, Object> extract() {
        return extract(defaultTopLevel());
    }

    /**
     * Projects the entity into a write body.
     *
     * @param topLevel keys kept at the top of the body; all other keys are
     *                 nested under {@code fields} if the account knows them as
     *                 shortcuts, and dropped otherwise
     * @return a new mutable map
     */
    public Map<String, Object> extract(Collection<String> topLevel) {
        checkExtractable();

        Map<String, Object> body = new LinkedHashMap<>();
        Map<String, Object> fields = new LinkedHashMap<>();
        List<String> shortcuts = null;
        for (Map.Entry<String, Object> entry : toWire().entrySet()) {
            String key = entry.getKey();
            if (topLevel.contains(key)) {
                body.put(key, entry.getValue());
                continue;
            }
            if (shortcuts == null) {
                shortcuts = account.getFields().exportShortcuts();
            }
            if (shortcuts.contains(key)) {
                fields.put(key, entry.getValue());
            }
        }
        if (!fields.isEmpty()) {
            body.put(FIELDS_KEY, fields);
        }
        return body;
    }

    protected static void putIfPresent(Map<String, Object> wire, String key, Object value) {
        if (value != null) {
            wire.put(key, value);
        }
    }

    public Account getAccount() {
        return account;
    }

    public Object getCustomField(String name) {
        return customFields.get(name);
    }

    public void setCustomField(String name, Object value) {
        customFields.put(Objects.requireNonNull(name, "name is required"), value);
    }

    public Object removeCustomField(String name) {
        return customFields.remove(name);
    }

    public boolean hasCustomField(String name) {
        return customFields.containsKey(name);
    }

    public Map<String, Object> getCustomFields() {
        return Collections.unmodifiableMap(customFields);
    }
}
