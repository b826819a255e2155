package com.tradecore.mapper;

import com.tradecore.domain.model.Order;
import com.tradecore.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Order domain model and OrderEntity.
 *
 * <p>Domain uses 'type' for OrderType, entity uses 'orderType' (mapped explicitly).
 */
@Mapper
public interface OrderMapper {

    @Mapping(source = "type", target = "orderType")
    OrderEntity toEntity(Order order);

    @Mapping(source = "orderType", target = "type")
    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);

    List<OrderEntity> toEntityList(List<Order> orders);
}
