package org.decide.authentication.shared.services;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.TransactionResult;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.api.sync.RedisServerCommands;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.decide.authentication.shared.exceptions.StorageException;

import java.util.Optional;

import static io.lettuce.core.SetArgs.Builder.xx;
import static io.lettuce.core.support.ConnectionPoolSupport.createGenericObjectPool;

public class RedisConnectionService implements KeyValueStore, AutoCloseable {

    public static final String REDIS_CONNECTION_ERROR = "Error getting Redis connection";
    private final RedisClient client;

    private final GenericObjectPool<StatefulRedisConnection<String, String>> pool;

    public RedisConnectionService(
            String host, int port, boolean useSsl, Optional<String> password, boolean warmup) {
        RedisURI.Builder builder = RedisURI.builder().withHost(host).withPort(port).withSsl(useSsl);
        password.ifPresent(s -> builder.withPassword(s.toCharArray()));
        this.client = RedisClient.create(builder.build());
        this.pool = createGenericObjectPool(client::connect, new GenericObjectPoolConfig<>());
        if (warmup) warmUp();
    }

    public RedisConnectionService(ConfigurationService configurationService) {
        this(
                configurationService.getRedisHost(),
                configurationService.getRedisPort(),
                configurationService.getUseRedisTLS(),
                configurationService.getRedisPassword(),
                true);
    }

    @FunctionalInterface
    private interface RedisFunction<T> {
        T getResult(RedisCommands<String, String> commands);
    }

    private <T> T executeCommand(RedisFunction<T> callable) {
        try (StatefulRedisConnection<String, String> connection = pool.borrowObject()) {
            return callable.getResult(connection.sync());
        } catch (Exception e) {
            throw new RedisConnectionException(REDIS_CONNECTION_ERROR, e);
        }
    }

    @Override
    public void save(final String key, final String value) {
        executeCommand(commands -> commands.set(key, value));
    }

    @Override
    public void saveWithExpiry(final String key, final String value, final long expiry) {
        executeCommand(commands -> commands.setex(key, expiry, value));
    }

    @Override
    public Optional<String> getValue(final String key) {
        return Optional.ofNullable(executeCommand(commands -> commands.get(key)));
    }

    @Override
    public Optional<String> popValue(final String key) {
        return Optional.ofNullable(
                executeCommand(
                        commands -> {
                            commands.multi();
                            commands.get(key);
                            commands.del(key);
                            TransactionResult result = commands.exec();
                            String value = result.get(0);
                            return value;
                        }));
    }

    @Override
    public boolean replaceValue(final String key, final String value) {
        return "OK".equals(
                executeCommand(commands -> commands.set(key, value, xx().keepttl())));
    }

    @Override
    public long deleteValue(final String key) {
        return executeCommand(commands -> commands.del(key));
    }

    @Override
    public long increment(final String key) {
        return executeCommand(commands -> commands.incr(key));
    }

    private void warmUp() {
        executeCommand(RedisServerCommands::clientGetname);
    }

    @Override
    public void close() {
        pool.close();
        client.shutdown();
    }

    public static class RedisConnectionException extends StorageException {
        public RedisConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
