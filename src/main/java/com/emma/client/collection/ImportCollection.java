package com.emma.client.collection;

import com.emma.client.api.Account;
import com.emma.client.core.model.EmmaImport;

import java.util.Map;
import java.util.Optional;

/**
 * Member imports run on an account, keyed by import id.
 */
public class ImportCollection extends ApiCollection<Long, EmmaImport> {

    public ImportCollection(Account account) {
        super(account);
    }

    @Override
    protected String collectionPath() {
        return "/members/imports";
    }

    @Override
    protected EmmaImport create(Map<String, Object> raw) {
        return new EmmaImport(account, raw);
    }

    @Override
    protected Long keyOf(EmmaImport item) {
        return item.getImportId();
    }

    public Optional<EmmaImport> find(long importId) {
        return fetchOne(importId, "/members/imports/" + importId);
    }
}
