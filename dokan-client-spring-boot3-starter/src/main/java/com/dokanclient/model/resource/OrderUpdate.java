package com.dokanclient.model.resource;

import com.dokanclient.model.enums.OrderStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 订单更新请求, 只提交非 null 字段
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderUpdate {

    private OrderStatus status;
    private String customerNote;
    private Address billing;
    private Address shipping;
    private List<LineItem> lineItems;
    private List<ShippingLine> shippingLines;
    private List<FeeLine> feeLines;
    private List<CouponLine> couponLines;
    private List<MetaData> metaData;
}
