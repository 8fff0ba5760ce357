package com.dokanclient.model.query;

import com.dokanclient.annotation.QueryParam;
import com.dokanclient.model.enums.SortOrder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * 通用分页/排序参数
 */
@Data
@SuperBuilder
@NoArgsConstructor
public class ListParams {

    @QueryParam("page")
    private Integer page;

    @QueryParam("per_page")
    private Integer perPage;

    @QueryParam("search")
    private String search;

    @QueryParam("orderby")
    private String orderBy;

    @QueryParam("order")
    private SortOrder order;
}
