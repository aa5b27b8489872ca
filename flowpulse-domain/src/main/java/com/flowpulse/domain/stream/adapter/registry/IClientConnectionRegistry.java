package com.flowpulse.domain.stream.adapter.registry;

import com.flowpulse.domain.stream.model.entity.ClientConnectionEntity;

import java.util.Collection;
import java.util.List;

/**
 * 客户端连接注册表：连接索引 + 频道订阅索引，实现必须线程安全。
 */
public interface IClientConnectionRegistry {

    /**
     * 登记连接
     *
     * @return 被替换的同 clientId 旧连接，没有则为 null
     */
    ClientConnectionEntity register(ClientConnectionEntity connection);

    /**
     * 仅当当前登记的就是该连接实例时移除
     */
    boolean remove(ClientConnectionEntity connection);

    ClientConnectionEntity find(String clientId);

    List<ClientConnectionEntity> findAll();

    /**
     * 订阅频道与给定频道有交集的连接
     */
    List<ClientConnectionEntity> findByChannels(Collection<String> channels);

    int size();
}
