package com.dokanclient.model.resource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LineItem {

    private Long id;
    private String name;
    private Long productId;
    private Long variationId;
    private Integer quantity;
    private String taxClass;
    private String subtotal;
    private String subtotalTax;
    private String total;
    private String totalTax;
    private List<TaxAmount> taxes;
    private List<MetaData> metaData;
    private String sku;
    private BigDecimal price;
}
