package com.emma.client.core.model;

import com.emma.client.adapter.Adapter;
import com.emma.client.api.Account;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MemberTest {

    @Mock
    private Adapter adapter;

    private Account account;

    @BeforeEach
    void setUp() {
        account = Account.builder()
                .accountId("1234")
                .adapter(adapter)
                .build();
    }

    private void stubShortcuts(String... shortcuts) {
        List<Map<String, Object>> fields = Arrays.stream(shortcuts)
                .map(name -> Map.<String, Object>of("field_id", (long) name.hashCode(), "shortcut_name", name))
                .toList();
        when(adapter.get("/fields", Map.of())).thenReturn(fields);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> capturedPutBody(String path) {
        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(adapter).put(eq(path), body.capture());
        return (Map<String, Object>) body.getValue();
    }

    @Nested
    @DisplayName("Hydration and extraction")
    class ParseAndExtract {

        @Test
        @DisplayName("Top-level custom values are nested under fields on extract")
        void extractNestsShortcutFields() {
            stubShortcuts("first_name", "last_name");
            Member member = new Member(account, Map.of(
                    "member_id", 123,
                    "email", "a@b.com",
                    "first_name", "X"));

            Map<String, Object> body = member.extract();

            assertEquals(Map.of(
                    "member_id", 123L,
                    "email", "a@b.com",
                    "fields", Map.of("first_name", "X")), body);
        }

        @Test
        @DisplayName("Nested fields object is flattened into custom fields")
        void nestedFieldsAreFlattened() {
            Member member = new Member(account, Map.of(
                    "member_id", 7,
                    "email", "a@b.com",
                    "fields", Map.of("first_name", "Ada", "last_name", "Lovelace")));

            assertEquals("Ada", member.getCustomField("first_name"));
            assertEquals("Lovelace", member.getCustomField("last_name"));
            assertFalse(member.hasCustomField("fields"));
        }

        @Test
        @DisplayName("Status code resolves and member_status_id is dropped")
        void statusResolved() {
            Member member = new Member(account, Map.of(
                    "member_id", 7,
                    "email", "a@b.com",
                    "status", "o",
                    "member_status_id", "o"));

            assertEquals(MemberStatus.OPT_OUT, member.getStatus());
            assertFalse(member.hasCustomField("member_status_id"));
            assertFalse(member.hasCustomField("status"));
        }

        @Test
        @DisplayName("Date attributes are parsed from wire timestamps")
        void datesParsed() {
            Member member = new Member(account, Map.of(
                    "member_id", 7,
                    "email", "a@b.com",
                    "member_since", "@D:2010-11-12T11:23:45"));

            assertEquals(LocalDateTime.of(2010, 11, 12, 11, 23, 45), member.getMemberSince());
        }

        @Test
        @DisplayName("Identity and email survive parse then extract")
        void identityPreserved() {
            stubShortcuts();
            Member member = new Member(account, Map.of(
                    "member_id", 123,
                    "email", "a@b.com",
                    "status", "a",
                    "fields", Map.of("first_name", "X")));

            Map<String, Object> body = member.extract();

            assertEquals(123L, body.get("member_id"));
            assertEquals("a@b.com", body.get("email"));
            assertFalse(body.containsKey("fields"));
            assertFalse(body.containsKey("status"));
        }

        @Test
        @DisplayName("Explicit top-level keys stay at the top")
        void explicitTopLevel() {
            Member member = new Member(account, Map.of(
                    "member_id", 123,
                    "email", "a@b.com",
                    "status", "a"));

            Map<String, Object> body = member.extract(List.of("member_id", "email", "status"));

            assertEquals("a", body.get("status"));
            verifyNoInteractions(adapter);
        }

        @Test
        @DisplayName("Extract without email fails")
        void extractRequiresEmail() {
            Member member = new Member(account, Map.of("member_id", 123));

            assertThrows(MissingEmailException.class, member::extract);
            verifyNoInteractions(adapter);
        }

        @Test
        @DisplayName("Raw record is left unmodified")
        void rawNotModified() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("member_id", 1);
            raw.put("email", "a@b.com");
            raw.put("fields", Map.of("first_name", "X"));

            new Member(account, raw);

            assertTrue(raw.containsKey("fields"));
            assertEquals(3, raw.size());
        }

        @Test
        @DisplayName("Unknown status code fails hydration")
        void unknownStatus() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Member(account, Map.of("member_id", 1, "email", "a@b.com", "status", "z")));
        }
    }

    @Nested
    @DisplayName("save() on a new member")
    class Create {

        @Test
        @DisplayName("Creates with one POST and adopts the server id and status")
        void createAssignsIdentity() {
            when(adapter.post(eq("/members/add"), any()))
                    .thenReturn(Map.of("added", true, "member_id", 55, "status", "a"));
            Member member = account.getMembers().factory(Map.of("email", "new@example.com"));

            member.save();

            assertEquals(55L, member.getMemberId());
            assertEquals(MemberStatus.ACTIVE, member.getStatus());
            verify(adapter, times(1)).post(eq("/members/add"), any());
            verify(adapter, never()).put(anyString(), any());
        }

        @Test
        @DisplayName("Existing member keeps no local id when added is false")
        void notAddedKeepsNoId() {
            when(adapter.post(eq("/members/add"), any()))
                    .thenReturn(Map.of("added", false, "status", "e"));
            Member member = account.getMembers().factory(Map.of("email", "known@example.com"));

            member.save();

            assertNull(member.getMemberId());
            assertEquals(MemberStatus.ERROR, member.getStatus());
        }

        @Test
        @DisplayName("Staged group ids and signup form are sent")
        @SuppressWarnings("unchecked")
        void sendsGroupsAndSignupForm() {
            when(adapter.post(eq("/members/add"), any()))
                    .thenReturn(Map.of("added", true, "member_id", 56, "status", "a"));
            Member member = account.getMembers().factory(Map.of("email", "new@example.com"));
            member.getGroups().add(new Group(account, Map.of("group_id", 7, "group_name", "VIP")));

            member.save(300L);

            ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
            verify(adapter).post(eq("/members/add"), body.capture());
            Map<String, Object> sent = (Map<String, Object>) body.getValue();
            assertEquals("new@example.com", sent.get("email"));
            assertEquals(List.of(7L), sent.get("group_ids"));
            assertEquals(300L, sent.get("signup_form_id"));
        }

        @Test
        @DisplayName("Empty response fails and leaves the member new")
        void emptyResponseFails() {
            when(adapter.post(eq("/members/add"), any())).thenReturn(null);
            Member member = account.getMembers().factory(Map.of("email", "new@example.com"));

            assertThrows(MemberUpdateException.class, member::save);
            assertNull(member.getMemberId());
            assertNull(member.getStatus());
        }

        @Test
        @DisplayName("Member without email is not sent")
        void requiresEmail() {
            Member member = account.getMembers().factory();

            assertThrows(MissingEmailException.class, member::save);
            verifyNoInteractions(adapter);
        }
    }

    @Nested
    @DisplayName("save() on an existing member")
    class Update {

        @Test
        @DisplayName("Updates with one PUT and includes status_to for active members")
        void updateSendsStatusTo() {
            stubShortcuts("first_name");
            when(adapter.put(eq("/members/55"), any())).thenReturn(true);
            Member member = new Member(account, Map.of(
                    "member_id", 55, "email", "a@b.com", "status", "a", "first_name", "X"));

            member.save();

            Map<String, Object> body = capturedPutBody("/members/55");
            assertEquals("a", body.get("status_to"));
            assertEquals(Map.of("first_name", "X"), body.get("fields"));
            verify(adapter, never()).post(anyString(), any());
        }

        @Test
        @DisplayName("Forwarded status is not a transition target")
        void forwardedOmitsStatusTo() {
            stubShortcuts();
            when(adapter.put(eq("/members/55"), any())).thenReturn(true);
            Member member = new Member(account, Map.of(
                    "member_id", 55, "email", "a@b.com", "status", "f"));

            member.save();

            assertFalse(capturedPutBody("/members/55").containsKey("status_to"));
        }

        @Test
        @DisplayName("Opt-out status is sent as status_to")
        void optOutTransition() {
            stubShortcuts();
            when(adapter.put(eq("/members/55"), any())).thenReturn(true);
            Member member = new Member(account, Map.of(
                    "member_id", 55, "email", "a@b.com", "status", "a"));
            member.setStatus(MemberStatus.OPT_OUT);

            member.save();

            assertEquals("o", capturedPutBody("/members/55").get("status_to"));
        }

        @Test
        @DisplayName("Falsy response raises and keeps local state")
        void falsyResponseFails() {
            stubShortcuts("first_name");
            when(adapter.put(eq("/members/55"), any())).thenReturn(null);
            Member member = new Member(account, Map.of(
                    "member_id", 55, "email", "a@b.com", "status", "a", "first_name", "X"));

            assertThrows(MemberUpdateException.class, member::save);
            assertEquals(55L, member.getMemberId());
            assertEquals("a@b.com", member.getEmail());
            assertEquals(MemberStatus.ACTIVE, member.getStatus());
            assertEquals("X", member.getCustomField("first_name"));
        }
    }

    @Nested
    @DisplayName("Opt-out")
    class OptOut {

        @Test
        @DisplayName("optOut without email fails before any request")
        void optOutRequiresEmail() {
            Member member = new Member(account, Map.of("member_id", 55));

            assertThrows(MissingEmailException.class, member::optOut);
            verifyNoInteractions(adapter);
        }

        @Test
        @DisplayName("Confirmed opt-out changes the local status")
        void optOutConfirmed() {
            when(adapter.put("/members/email/optout/a@b.com", null)).thenReturn(true);
            Member member = new Member(account, Map.of("member_id", 55, "email", "a@b.com", "status", "a"));

            member.optOut();

            assertEquals(MemberStatus.OPT_OUT, member.getStatus());
            assertTrue(member.hasOptedOut());
        }

        @Test
        @DisplayName("Rejected opt-out leaves the status alone")
        void optOutRejected() {
            when(adapter.put("/members/email/optout/a@b.com", null)).thenReturn(false);
            Member member = new Member(account, Map.of("member_id", 55, "email", "a@b.com", "status", "a"));

            member.optOut();

            assertEquals(MemberStatus.ACTIVE, member.getStatus());
            assertFalse(member.hasOptedOut());
        }

        @Test
        @DisplayName("hasOptedOut without a status fails")
        void hasOptedOutRequiresStatus() {
            Member member = new Member(account, Map.of("member_id", 55, "email", "a@b.com"));

            assertThrows(MissingStatusException.class, member::hasOptedOut);
        }

        @Test
        @DisplayName("Opt-out detail needs a member id")
        void detailRequiresId() {
            Member member = new Member(account, Map.of("email", "a@b.com", "status", "o"));

            assertThrows(MissingIdentifierException.class, member::getOptOutDetail);
            verifyNoInteractions(adapter);
        }

        @Test
        @DisplayName("Opt-out detail is empty without a request for active members")
        void detailSkippedWhenActive() {
            Member member = new Member(account, Map.of("member_id", 55, "email", "a@b.com", "status", "a"));

            assertTrue(member.getOptOutDetail().isEmpty());
            verifyNoInteractions(adapter);
        }

        @Test
        @DisplayName("Opt-out detail is returned as decoded")
        void detailFetched() {
            List<Object> history = List.of(Map.of("action", "o", "timestamp", "@D:2011-01-02T10:00:00"));
            when(adapter.get("/members/55/optout", Map.of())).thenReturn(history);
            Member member = new Member(account, Map.of("member_id", 55, "email", "a@b.com", "status", "o"));

            assertEquals(history, member.getOptOutDetail());
        }
    }

    @Nested
    @DisplayName("delete()")
    class Delete {

        @Test
        @DisplayName("Delete needs a member id")
        void deleteRequiresId() {
            Member member = new Member(account, Map.of("email", "a@b.com"));

            assertThrows(MissingIdentifierException.class, member::delete);
            verifyNoInteractions(adapter);
        }

        @Test
        @DisplayName("Delete reports the API confirmation")
        void deleteConfirmed() {
            when(adapter.delete("/members/55", Map.of())).thenReturn(true);
            Member member = new Member(account, Map.of("member_id", 55, "email", "a@b.com"));

            assertTrue(member.delete());
            assertEquals(55L, member.getMemberId());
        }
    }
}
