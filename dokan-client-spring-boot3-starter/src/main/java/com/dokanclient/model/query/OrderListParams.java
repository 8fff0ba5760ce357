package com.dokanclient.model.query;

import com.dokanclient.annotation.QueryParam;
import com.dokanclient.model.enums.OrderStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class OrderListParams extends ListParams {

    @QueryParam("status")
    private List<OrderStatus> status;

    @QueryParam("customer")
    private Long customer;

    @QueryParam("product")
    private Long product;

    /** RFC 3339 */
    @QueryParam("after")
    private OffsetDateTime after;

    @QueryParam("before")
    private OffsetDateTime before;

    @QueryParam("modified_after")
    private OffsetDateTime modifiedAfter;

    @QueryParam("modified_before")
    private OffsetDateTime modifiedBefore;
}
