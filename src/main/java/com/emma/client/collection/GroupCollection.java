package com.emma.client.collection;

import com.emma.client.api.Account;
import com.emma.client.core.model.Group;

import java.util.Map;
import java.util.Optional;

/**
 * Groups defined on an account, keyed by group id.
 */
public class GroupCollection extends ApiCollection<Long, Group> {

    public GroupCollection(Account account) {
        super(account);
    }

    @Override
    protected String collectionPath() {
        return "/groups";
    }

    @Override
    protected Group create(Map<String, Object> raw) {
        return new Group(account, raw);
    }

    @Override
    protected Long keyOf(Group item) {
        return item.getGroupId();
    }

    public Optional<Group> find(long groupId) {
        return fetchOne(groupId, "/groups/" + groupId);
    }
}
