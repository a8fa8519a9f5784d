package com.meetchat.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetchat.server.dedup.DedupGuard;
import com.meetchat.server.dedup.InMemoryDedupGuard;
import com.meetchat.server.protocol.EventCodec;
import com.meetchat.server.scheduling.ChatEventLoop;
import com.meetchat.server.service.ChatExporter;
import com.meetchat.server.service.MeetingAccessService;
import com.meetchat.server.service.RoomBroadcaster;
import com.meetchat.server.store.ChatStore;
import com.meetchat.server.store.DatabaseConfig;
import com.meetchat.server.store.InMemoryChatStore;
import com.meetchat.server.store.JdbcChatStore;
import com.meetchat.server.store.MeetingStore;
import com.meetchat.server.ws.ConnectionRegistry;
import com.meetchat.server.ws.InMemoryConnectionRegistry;
import com.meetchat.server.ws.WebSocketRoomTransport;
import jakarta.validation.Validation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the chat core. Services are plain objects; this class owns their construction and,
 * through destroy methods, their shutdown order.
 */
@Configuration
public class ChatConfig {
    private static final Logger log = LoggerFactory.getLogger(ChatConfig.class);

    @Bean
    public ChatSettings chatSettings(
            @Value("${chat.typing.idle-timeout-ms:3000}") long typingIdleMs,
            @Value("${chat.dedup.presence-window-ms:10000}") long presenceWindowMs,
            @Value("${chat.dedup.system-message-window-ms:30000}") long systemWindowMs,
            @Value("${chat.message.max-length:2000}") int maxLength,
            @Value("${chat.history.default-limit:50}") int defaultLimit,
            @Value("${chat.history.max-limit:100}") int maxLimit) {
        ChatSettings s = new ChatSettings(Duration.ofMillis(typingIdleMs), Duration.ofMillis(presenceWindowMs),
                Duration.ofMillis(systemWindowMs), maxLength, defaultLimit, maxLimit);
        log.info("[BOOT] chat settings {}", s);
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ChatEventLoop chatEventLoop(@Value("${chat.loop.shutdown-timeout-ms:5000}") long shutdownTimeoutMs) {
        return new ChatEventLoop(shutdownTimeoutMs);
    }

    @Bean
    public EventCodec eventCodec(ObjectMapper mapper) {
        return new EventCodec(mapper, Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new InMemoryConnectionRegistry();
    }

    @Bean
    public DedupGuard dedupGuard(Clock clock) {
        return new InMemoryDedupGuard(clock);
    }

    @Bean
    public WebSocketRoomTransport roomTransport(EventCodec codec) {
        return new WebSocketRoomTransport(codec);
    }

    @Bean
    @ConditionalOnProperty(name = "chat.store.type", havingValue = "memory", matchIfMissing = true)
    public InMemoryChatStore inMemoryChatStore(Clock clock) {
        log.info("[BOOT] using in-memory chat store");
        return new InMemoryChatStore(clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "chat.store.type", havingValue = "jdbc")
    public DatabaseConfig databaseConfig(
            @Value("${chat.store.jdbc.url}") String url,
            @Value("${chat.store.jdbc.username:}") String username,
            @Value("${chat.store.jdbc.password:}") String password,
            @Value("${chat.store.jdbc.driver:}") String driver,
            @Value("${chat.store.jdbc.maximum-pool-size:10}") int maxPool,
            @Value("${chat.store.jdbc.minimum-idle:2}") int minIdle,
            @Value("${chat.store.jdbc.connection-timeout-ms:30000}") long connectionTimeout,
            @Value("${chat.store.jdbc.idle-timeout-ms:600000}") long idleTimeout,
            @Value("${chat.store.jdbc.max-lifetime-ms:1800000}") long maxLifetime,
            @Value("${chat.store.jdbc.init-schema:true}") boolean initSchema) {
        DatabaseConfig db = new DatabaseConfig(url, username, password, driver, maxPool, minIdle,
                connectionTimeout, idleTimeout, maxLifetime);
        db.initialize();
        if (initSchema) {
            DatabaseConfig.runScript(db.getDataSource(), "db/schema-mysql.sql");
        }
        return db;
    }

    @Bean
    @ConditionalOnProperty(name = "chat.store.type", havingValue = "jdbc")
    public JdbcChatStore jdbcChatStore(DatabaseConfig db, Clock clock) {
        log.info("[BOOT] using JDBC chat store");
        return new JdbcChatStore(db.getDataSource(), clock);
    }

    @Bean
    public MeetingAccessService meetingAccessService(MeetingStore meetings) {
        return new MeetingAccessService(meetings);
    }

    @Bean
    public ChatExporter chatExporter() {
        return new ChatExporter();
    }

    @Bean(destroyMethod = "close")
    public RoomBroadcaster roomBroadcaster(ConnectionRegistry registry, DedupGuard dedup, ChatStore store,
                                           MeetingStore meetings, WebSocketRoomTransport transport,
                                           ChatEventLoop loop, ChatSettings settings, Clock clock) {
        return new RoomBroadcaster(registry, dedup, store, meetings, transport, loop, settings, clock);
    }
}
