package com.dokanclient.model.query;

import com.dokanclient.annotation.QueryParam;
import com.dokanclient.model.enums.ProductStatus;
import com.dokanclient.model.enums.ProductType;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.List;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ProductListParams extends ListParams {

    @QueryParam("status")
    private List<ProductStatus> status;

    @QueryParam("type")
    private List<ProductType> type;

    /** 显式 false 也会提交 */
    @QueryParam(value = "featured", omitEmpty = false)
    private Boolean featured;

    @QueryParam("category")
    private List<Long> category;

    @QueryParam("tag")
    private List<Long> tag;

    @QueryParam(value = "min_price", omitEmpty = false)
    private BigDecimal minPrice;

    @QueryParam(value = "max_price", omitEmpty = false)
    private BigDecimal maxPrice;

    @QueryParam("stock_status")
    private String stockStatus;

    @QueryParam("sku")
    private String sku;
}
