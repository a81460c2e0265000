package com.emma.client.collection;

import com.emma.client.core.model.Group;
import com.emma.client.core.model.Member;

import java.util.Map;
import java.util.Objects;

/**
 * Groups a member belongs to, keyed by group name.
 */
public class MemberGroupCollection extends MemberRelationCollection<String, Group> {

    public MemberGroupCollection(Member member) {
        super(member);
    }

    @Override
    protected String relation() {
        return "groups";
    }

    @Override
    protected Group create(Map<String, Object> raw) {
        return new Group(account, raw);
    }

    @Override
    protected String keyOf(Group item) {
        return item.getGroupName();
    }

    /**
     * Adds a group locally. A member created afterwards is added straight into
     * the staged groups; no request is made here.
     */
    public void add(Group group) {
        stage(Objects.requireNonNull(group, "group is required"));
    }
}
