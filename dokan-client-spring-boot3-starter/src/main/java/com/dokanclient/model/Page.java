package com.dokanclient.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 列表查询结果, total/totalPages 取自 X-WP-Total / X-WP-TotalPages
 */
@Value
@Builder
public class Page<T> {

    List<T> items;

    int totalItems;

    int totalPages;

    /** 请求的页码, 未指定时为 0 */
    int page;

    int perPage;

    /** 店铺子列表时为店铺 id, 否则 null */
    Long vendorId;

    public boolean hasNext() {
        return page > 0 && page < totalPages;
    }
}
