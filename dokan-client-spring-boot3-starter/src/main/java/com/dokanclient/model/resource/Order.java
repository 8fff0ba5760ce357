package com.dokanclient.model.resource;

import com.dokanclient.model.enums.OrderStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 订单
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Order {

    private Long id;
    private Long parentId;
    private String number;
    private String orderKey;
    private String createdVia;
    private String version;
    private OrderStatus status;
    private String currency;
    private LocalDateTime dateCreated;
    private LocalDateTime dateCreatedGmt;
    private LocalDateTime dateModified;
    private LocalDateTime dateModifiedGmt;
    private String discountTotal;
    private String discountTax;
    private String shippingTotal;
    private String shippingTax;
    private String cartTax;
    private String total;
    private String totalTax;
    private Boolean pricesIncludeTax;
    private Long customerId;
    private String customerIpAddress;
    private String customerUserAgent;
    private String customerNote;
    private Address billing;
    private Address shipping;
    private String paymentMethod;
    private String paymentMethodTitle;
    private String transactionId;
    private LocalDateTime datePaid;
    private LocalDateTime datePaidGmt;
    private LocalDateTime dateCompleted;
    private LocalDateTime dateCompletedGmt;
    private String cartHash;
    private List<LineItem> lineItems;
    private List<TaxLine> taxLines;
    private List<ShippingLine> shippingLines;
    private List<FeeLine> feeLines;
    private List<CouponLine> couponLines;
    private List<Refund> refunds;
    private List<MetaData> metaData;
}
