package com.dokanclient.model.resource;

import com.dokanclient.model.enums.CatalogVisibility;
import com.dokanclient.model.enums.ProductStatus;
import com.dokanclient.model.enums.ProductType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 商品, 字段与 /products 接口一致; 写操作只序列化非 null 字段
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Product {

    private Long id;
    private String name;
    private String slug;
    private String permalink;
    private LocalDateTime dateCreated;
    private LocalDateTime dateCreatedGmt;
    private LocalDateTime dateModified;
    private LocalDateTime dateModifiedGmt;
    private ProductType type;
    private ProductStatus status;
    private Boolean featured;
    private CatalogVisibility catalogVisibility;
    private String description;
    private String shortDescription;
    private String sku;
    /** 金额均为字符串, 与接口保持一致 */
    private String price;
    private String regularPrice;
    private String salePrice;
    private LocalDateTime dateOnSaleFrom;
    private LocalDateTime dateOnSaleFromGmt;
    private LocalDateTime dateOnSaleTo;
    private LocalDateTime dateOnSaleToGmt;
    private String priceHtml;
    private Boolean onSale;
    private Boolean purchasable;
    private Integer totalSales;
    private Boolean virtual;
    private Boolean downloadable;
    private List<ProductCategory> categories;
    private List<ProductTag> tags;
    private List<ProductImage> images;
    private List<ProductAttribute> attributes;
    private List<ProductAttribute> defaultAttributes;
    private List<Long> variations;
    private List<Long> groupedProducts;
    private Integer menuOrder;
    private List<MetaData> metaData;
}
