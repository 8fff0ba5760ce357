package com.dokanclient.model.resource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 商品评价
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Review {

    private Long id;
    private Long productId;
    private String status;
    private String reviewer;
    private String reviewerEmail;
    private String review;
    private Integer rating;
    private Boolean verified;
    private LocalDateTime dateCreated;
    private LocalDateTime dateCreatedGmt;
}
