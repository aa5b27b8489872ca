package com.flowpulse.infrastructure.dao;

import com.flowpulse.infrastructure.dao.po.WebhookDeliveryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

/**
 * Webhook 投递记录 DAO
 */
@Mapper
public interface WebhookDeliveryDao {

    int insert(WebhookDeliveryPO po);

    long countSince(@Param("since") LocalDateTime since);

    long countFailedSince(@Param("since") LocalDateTime since);
}
