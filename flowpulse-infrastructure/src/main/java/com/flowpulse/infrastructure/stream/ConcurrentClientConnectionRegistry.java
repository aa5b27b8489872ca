package com.flowpulse.infrastructure.stream;

import com.flowpulse.domain.stream.adapter.registry.IClientConnectionRegistry;
import com.flowpulse.domain.stream.model.entity.ClientConnectionEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内连接注册表：clientId → 连接，channel → clientId 集合。
 */
@Component
public class ConcurrentClientConnectionRegistry implements IClientConnectionRegistry {

    private final ConcurrentMap<String, ClientConnectionEntity> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> subscribersByChannel = new ConcurrentHashMap<>();

    @Override
    public ClientConnectionEntity register(ClientConnectionEntity connection) {
        ClientConnectionEntity replaced = connections.put(connection.getClientId(), connection);
        if (replaced != null) {
            unindex(replaced);
        }
        for (String channel : connection.getChannels()) {
            subscribersByChannel.computeIfAbsent(channel, key -> ConcurrentHashMap.newKeySet()).add(connection.getClientId());
        }
        return replaced;
    }

    @Override
    public boolean remove(ClientConnectionEntity connection) {
        if (connection == null) {
            return false;
        }
        boolean removed = connections.remove(connection.getClientId(), connection);
        if (removed) {
            unindex(connection);
        }
        return removed;
    }

    @Override
    public ClientConnectionEntity find(String clientId) {
        return clientId == null ? null : connections.get(clientId);
    }

    @Override
    public List<ClientConnectionEntity> findAll() {
        return new ArrayList<>(connections.values());
    }

    @Override
    public List<ClientConnectionEntity> findByChannels(Collection<String> channels) {
        List<ClientConnectionEntity> result = new ArrayList<>();
        if (channels == null || channels.isEmpty()) {
            return result;
        }
        Set<String> clientIds = new LinkedHashSet<>();
        for (String channel : channels) {
            Set<String> subscribers = channel == null ? null : subscribersByChannel.get(channel);
            if (subscribers != null) {
                clientIds.addAll(subscribers);
            }
        }
        for (String clientId : clientIds) {
            ClientConnectionEntity connection = connections.get(clientId);
            if (connection != null && connection.subscribesToAny(channels)) {
                result.add(connection);
            }
        }
        return result;
    }

    @Override
    public int size() {
        return connections.size();
    }

    /**
     * 仅在没有同 clientId 的新连接订阅该频道时移除索引。
     */
    private void unindex(ClientConnectionEntity connection) {
        ClientConnectionEntity current = connections.get(connection.getClientId());
        for (String channel : connection.getChannels()) {
            if (current != null && current.getChannels().contains(channel)) {
                continue;
            }
            subscribersByChannel.computeIfPresent(channel, (key, subscribers) -> {
                subscribers.remove(connection.getClientId());
                return subscribers.isEmpty() ? null : subscribers;
            });
        }
    }
}
