package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.OrderStatus;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface OrderMapper {
    @Select("SELECT o.id, o.product_id, p.name AS product_name, o.quantity, o.due_date, o.status, o.created_at " +
            "FROM production_order o JOIN product p ON p.id = o.product_id WHERE o.id = #{id}")
    Order selectByPrimaryKey(Long id);

    @Select("SELECT o.id, o.product_id, p.name AS product_name, o.quantity, o.due_date, o.status, o.created_at " +
            "FROM production_order o JOIN product p ON p.id = o.product_id " +
            "WHERE o.status <> 'COMPLETED' ORDER BY o.due_date, o.id")
    List<Order> selectOpen();

    @Update("UPDATE production_order SET status = #{status} WHERE id = #{id}")
    int updateStatus(@Param("id") Long id, @Param("status") OrderStatus status);
}
