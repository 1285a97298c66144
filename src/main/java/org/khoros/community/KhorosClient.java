package org.khoros.community;

import org.khoros.community.config.EnvironmentConfig;
import org.khoros.community.config.HelperConfig;
import org.khoros.community.config.KhorosSettings;
import org.khoros.community.transport.HttpTransport;
import org.khoros.community.transport.RetryableTransport;
import org.khoros.community.transport.Transport;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client for a Khoros community.
 *
 * <pre>{@code
 * try (var client = KhorosClient.builder()
 *         .communityUrl("https://community.example.com")
 *         .sessionAuth("api-user", "secret")
 *         .build()
 *         .connect()) {
 *
 *     int online = client.users().getOnlineUserCount();
 *     var items = client.liql().performQueryForItems("SELECT id, subject FROM messages LIMIT 5");
 * }
 * }</pre>
 *
 * <p>The client holds the current {@link Session}. {@link #connect()} swaps in an
 * authenticated session and {@link #close()} invalidates a session key; every
 * request reads whichever session is current.
 */
public final class KhorosClient implements AutoCloseable {

    private static final System.Logger logger = System.getLogger(KhorosClient.class.getName());

    private final KhorosSettings settings;
    private final AtomicReference<Session> session;
    private final RequestDispatcher dispatcher;
    private final SessionAuthenticator authenticator;
    private final Liql liql;
    private final Nodes nodes;
    private final Users users;
    private final Boards boards;
    private final Categories categories;
    private final GroupHubs grouphubs;
    private final Messages messages;
    private final Tags tags;

    private KhorosClient(KhorosSettings settings, Transport transport, ErrorTranslations translations) {
        this.settings = settings;
        this.session = new AtomicReference<>(Session.of(settings));
        this.dispatcher = new RequestDispatcher(session::get, transport, translations);
        this.authenticator = new SessionAuthenticator(dispatcher);
        this.liql = new Liql(dispatcher);
        this.nodes = new Nodes(liql);
        this.users = new Users(dispatcher, liql);
        this.boards = new Boards(dispatcher, liql, users);
        this.categories = new Categories(dispatcher, liql);
        this.grouphubs = new GroupHubs(dispatcher, liql);
        this.messages = new Messages(dispatcher);
        this.tags = new Tags(dispatcher);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A client configured from a YAML or JSON helper file. */
    public static KhorosClient fromHelperFile(Path helperFile) {
        return builder().settings(HelperConfig.load(helperFile)).build();
    }

    /** A client configured from {@code KHOROS_*} environment variables. */
    public static KhorosClient fromEnvironment() {
        return builder().settings(EnvironmentConfig.system().load()).build();
    }

    // --- Session lifecycle ---

    /**
     * Authenticate according to the configured auth type. Already authenticated
     * sessions are left as they are.
     *
     * @return this client
     * @throws KhorosError.KhorosException with an {@link KhorosError.AuthError} on failure
     */
    public KhorosClient connect() {
        var current = session.get();
        if (current.isAuthenticated()) {
            return this;
        }
        var authenticated = authenticator.authenticate(current, settings);
        session.set(authenticated);
        logger.log(System.Logger.Level.DEBUG, "Connected to {0} using {1}",
                authenticated.baseUrl(), authenticated.authType().configValue());
        return this;
    }

    /** Invalidate the session key, if any. The client may be connected again. */
    @Override
    public void close() {
        var current = session.get();
        if (current.isAuthenticated()) {
            session.set(authenticator.invalidate(current));
        }
    }

    // --- Accessors ---

    public Session session() {
        return session.get();
    }

    public KhorosSettings settings() {
        return settings;
    }

    /** The dispatcher for direct v1 and v2 requests. */
    public RequestDispatcher api() {
        return dispatcher;
    }

    public Liql liql() {
        return liql;
    }

    public Nodes nodes() {
        return nodes;
    }

    public Boards boards() {
        return boards;
    }

    public Categories categories() {
        return categories;
    }

    public GroupHubs grouphubs() {
        return grouphubs;
    }

    public Messages messages() {
        return messages;
    }

    public Users users() {
        return users;
    }

    public Tags tags() {
        return tags;
    }

    // --- Builder ---

    public static final class Builder {
        private KhorosSettings.Builder settings = KhorosSettings.builder();
        private Transport transport;
        private Duration initialBackoff;
        private Duration maxBackoff;
        private ErrorTranslations translations = ErrorTranslations.defaults();

        private Builder() {}

        /** Start from loaded settings; later builder calls override them. */
        public Builder settings(KhorosSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null").toBuilder();
            return this;
        }

        public Builder communityUrl(String communityUrl) {
            settings.communityUrl(communityUrl);
            return this;
        }

        public Builder tenantId(String tenantId) {
            settings.tenantId(tenantId);
            return this;
        }

        public Builder sessionAuth(String username, String password) {
            settings.authType(AuthType.SESSION_KEY).sessionAuth(username, password);
            return this;
        }

        public Builder oauthAccessToken(String accessToken) {
            settings.authType(AuthType.OAUTH2).oauthAccessToken(accessToken);
            return this;
        }

        public Builder ssoToken(String ssoToken) {
            settings.authType(AuthType.SSO).ssoToken(ssoToken);
            return this;
        }

        public Builder preferJson(boolean preferJson) {
            settings.preferJson(preferJson);
            return this;
        }

        public Builder translateErrors(boolean translateErrors) {
            settings.translateErrors(translateErrors);
            return this;
        }

        /** Additional or replacement error translations. */
        public Builder errorTranslations(ErrorTranslations translations) {
            this.translations = Objects.requireNonNull(translations, "translations must not be null");
            return this;
        }

        /**
         * The single-attempt transport to send requests with (default: {@link HttpTransport}).
         * It is wrapped in a {@link RetryableTransport}.
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            settings.maxAttempts(maxAttempts);
            return this;
        }

        /** Delay before the first retry; zero retries without delay (default: 200ms). */
        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            settings.requestTimeout(requestTimeout);
            return this;
        }

        /**
         * @throws KhorosError.KhorosException with code {@code missing_required_data} without a
         *                                     community URL, or {@code invalid_url} for a bad one
         */
        public KhorosClient build() {
            var built = settings.build();
            var base = transport != null ? transport
                    : HttpTransport.builder().requestTimeout(built.requestTimeout()).build();
            var retrying = RetryableTransport.builder()
                    .delegate(base)
                    .maxAttempts(built.maxAttempts());
            if (initialBackoff != null) retrying.initialBackoff(initialBackoff);
            if (maxBackoff != null) retrying.maxBackoff(maxBackoff);
            return new KhorosClient(built, retrying.build(), translations);
        }
    }
}
