package com.emma.client.collection;

import com.emma.client.adapter.Adapter;
import com.emma.client.api.Account;
import com.emma.client.core.model.Mailing;
import com.emma.client.core.model.Member;
import com.emma.client.core.model.MissingIdentifierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemberMailingCollectionTest {

    @Mock
    private Adapter adapter;

    private Member member;

    @BeforeEach
    void setUp() {
        Account account = Account.builder()
                .accountId("1234")
                .adapter(adapter)
                .build();
        member = new Member(account, Map.of("member_id", 9, "email", "a@b.com"));
    }

    @Test
    void mailingsAreKeyedById() {
        when(adapter.get("/members/9/mailings", Map.of())).thenReturn(List.of(
                Map.of("mailing_id", 200, "name", "Newsletter", "delivery_ts", "@D:2011-03-04T05:06:07"),
                Map.of("mailing_id", 201, "name", "Promo")));

        Map<Long, Mailing> mailings = member.getMailings().fetchAll();

        assertEquals(2, mailings.size());
        assertEquals("Newsletter", mailings.get(200L).getName());
        assertEquals(LocalDateTime.of(2011, 3, 4, 5, 6, 7), mailings.get(200L).getDeliveryTs());
        assertNull(mailings.get(201L).getDeliveryTs());
    }

    @Test
    void secondReadIsServedFromCache() {
        when(adapter.get("/members/9/mailings", Map.of())).thenReturn(List.of(Map.of("mailing_id", 200)));

        member.getMailings().fetchAll();
        member.getMailings().fetchAll();

        verify(adapter, times(1)).get("/members/9/mailings", Map.of());
    }

    @Test
    void requiresMemberId() {
        Member fresh = new Member(member.getAccount());

        assertThrows(MissingIdentifierException.class, () -> fresh.getMailings().fetchAll());
        verifyNoInteractions(adapter);
    }
}
