package com.dokanclient.model.query;

import com.dokanclient.annotation.QueryParam;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReviewListParams extends ListParams {

    @QueryParam("product")
    private Long product;

    @QueryParam("status")
    private String status;

    @QueryParam("reviewer")
    private String reviewer;

    @QueryParam("rating")
    private Integer rating;
}
