package com.emma.client.collection;

import com.emma.client.core.model.ApiModel;
import com.emma.client.core.model.Member;
import com.emma.client.core.model.MissingIdentifierException;

import java.util.Objects;

/**
 * Collection scoped to one member, read from {@code /members/{member_id}/{relation}}.
 * The member must already exist remotely.
 */
abstract class MemberRelationCollection<K, T extends ApiModel> extends ApiCollection<K, T> {

    protected final Member member;

    protected MemberRelationCollection(Member member) {
        super(Objects.requireNonNull(member, "member is required").getAccount());
        this.member = member;
    }

    /**
     * Last path segment of the relation, e.g. {@code groups}.
     */
    protected abstract String relation();

    @Override
    protected String collectionPath() {
        Long memberId = member.getMemberId();
        if (memberId == null) {
            throw new MissingIdentifierException("Member has no member_id; cannot read its " + relation());
        }
        return "/members/" + memberId + "/" + relation();
    }

    public Member getMember() {
        return member;
    }
}
