package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    private Long id;
    private Long productId;
    private String productName;   // product との結合結果（非永続）
    private Integer quantity;
    private LocalDate dueDate;
    private OrderStatus status;
    private LocalDateTime createdAt;
}
