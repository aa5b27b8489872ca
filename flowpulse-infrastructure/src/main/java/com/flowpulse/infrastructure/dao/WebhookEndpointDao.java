package com.flowpulse.infrastructure.dao;

import com.flowpulse.infrastructure.dao.po.WebhookEndpointPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 外发端点 DAO，计数器均为单行原子自增。
 */
@Mapper
public interface WebhookEndpointDao {

    int insert(WebhookEndpointPO po);

    WebhookEndpointPO selectByEndpointId(@Param("endpointId") String endpointId);

    List<WebhookEndpointPO> selectAll();

    List<WebhookEndpointPO> selectActive();

    int incrementTriggerCount(@Param("endpointId") String endpointId,
                              @Param("now") LocalDateTime now);

    int incrementSuccessCount(@Param("endpointId") String endpointId,
                              @Param("now") LocalDateTime now);

    int incrementErrorCount(@Param("endpointId") String endpointId,
                            @Param("now") LocalDateTime now);
}
