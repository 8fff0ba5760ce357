package com.dokanclient.model.resource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaxLine {

    private Long id;
    private String rateCode;
    private Long rateId;
    private String label;
    private Boolean compound;
    private String taxTotal;
    private String shippingTaxTotal;
    private List<MetaData> metaData;
}
