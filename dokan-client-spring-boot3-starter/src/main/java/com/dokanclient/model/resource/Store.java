package com.dokanclient.model.resource;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 店铺(供应商)
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Store {

    private Long id;
    private String storeName;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private Boolean showEmail;
    private Address address;
    private String location;
    private String banner;
    private String icon;
    private String gravatar;
    private String shopUrl;
    private String productsUrl;
    private String tocsUrl;
    private Boolean featured;
    private StoreRating rating;
    private Boolean enabled;
    private String registered;
    private Map<String, Map<String, Object>> payment;
    private Map<String, String> social;
}
