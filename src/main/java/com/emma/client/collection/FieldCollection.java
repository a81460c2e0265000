package com.emma.client.collection;

import com.emma.client.api.Account;
import com.emma.client.core.model.Field;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Custom member fields of an account, keyed by field id.
 */
public class FieldCollection extends ApiCollection<Long, Field> {

    public FieldCollection(Account account) {
        super(account);
    }

    @Override
    protected String collectionPath() {
        return "/fields";
    }

    @Override
    protected Field create(Map<String, Object> raw) {
        return new Field(account, raw);
    }

    @Override
    protected Long keyOf(Field item) {
        return item.getFieldId();
    }

    /**
     * Shortcut names of the account's fields: the custom field keys that may
     * be sent when writing members.
     */
    public List<String> exportShortcuts() {
        return fetchAll().values().stream()
                .map(Field::getShortcutName)
                .filter(Objects::nonNull)
                .toList();
    }
}
