package com.emma.client.api;

import com.emma.client.adapter.Adapter;
import com.emma.client.adapter.AdapterConfig;
import com.emma.client.adapter.HttpClientAdapter;
import com.emma.client.collection.FieldCollection;
import com.emma.client.collection.GroupCollection;
import com.emma.client.collection.ImportCollection;
import com.emma.client.collection.MemberCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the client: one Emma account and its resources.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * Account account = Account.builder()
 *     .accountId("1234")
 *     .publicKey("08192a3b4c5d6e7f")
 *     .privateKey("f7e6d5c4b3a29180")
 *     .build();
 *
 * Member member = account.getMembers().find(123).orElseThrow();
 * Map&lt;String, Group&gt; groups = member.getGroups().fetchAll();
 *
 * Member fresh = account.getMembers().factory(Map.of("email", "new@example.com"));
 * fresh.save();
 * </pre>
 *
 * <p>The account and everything reached from it are meant for single-threaded use.</p>
 */
public class Account {
    private static final Logger log = LoggerFactory.getLogger(Account.class);

    private final String accountId;
    private final Adapter adapter;
    private final MemberCollection members;
    private final GroupCollection groups;
    private final FieldCollection fields;
    private final ImportCollection imports;

    private Account(String accountId, Adapter adapter) {
        this.accountId = accountId;
        this.adapter = adapter;
        this.members = new MemberCollection(this);
        this.groups = new GroupCollection(this);
        this.fields = new FieldCollection(this);
        this.imports = new ImportCollection(this);
        log.info("Account initialized: accountId={}, adapter={}", accountId, adapter.getClass().getSimpleName());
    }

    public String getAccountId() {
        return accountId;
    }

    public Adapter getAdapter() {
        return adapter;
    }

    public MemberCollection getMembers() {
        return members;
    }

    public GroupCollection getGroups() {
        return groups;
    }

    /**
     * Custom member fields; their shortcut names decide which custom values
     * are sent when members are written.
     */
    public FieldCollection getFields() {
        return fields;
    }

    public ImportCollection getImports() {
        return imports;
    }

    @Override
    public String toString() {
        return "Account{accountId='" + accountId + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Account configured from {@code EMMA_*} environment variables.
     *
     * @see AdapterConfig#fromEnvironment()
     */
    public static Account fromEnvironment() {
        return builder().config(AdapterConfig.fromEnvironment()).build();
    }

    public static class Builder {
        private String accountId;
        private String publicKey;
        private String privateKey;
        private String baseUrl;
        private Duration timeout;
        private AdapterConfig config;
        private Adapter adapter;

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder publicKey(String publicKey) {
            this.publicKey = publicKey;
            return this;
        }

        public Builder privateKey(String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Uses a complete adapter configuration instead of the individual settings.
         */
        public Builder config(AdapterConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Uses a custom transport. When set, credentials are not needed.
         */
        public Builder adapter(Adapter adapter) {
            this.adapter = adapter;
            return this;
        }

        public Account build() {
            String resolvedAccountId = accountId;
            Adapter resolvedAdapter = adapter;
            if (resolvedAdapter == null) {
                AdapterConfig resolved = config != null ? config : new AdapterConfig(
                        accountId,
                        publicKey,
                        privateKey,
                        baseUrl != null ? baseUrl : AdapterConfig.DEFAULT_BASE_URL,
                        timeout != null ? timeout : AdapterConfig.DEFAULT_TIMEOUT);
                resolvedAdapter = new HttpClientAdapter(resolved);
                resolvedAccountId = resolved.accountId();
            }
            Objects.requireNonNull(resolvedAccountId, "accountId is required");
            return new Account(resolvedAccountId, resolvedAdapter);
        }
    }
}
