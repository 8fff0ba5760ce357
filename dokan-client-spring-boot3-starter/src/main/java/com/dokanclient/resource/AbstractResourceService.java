package com.dokanclient.resource;

import com.dokanclient.client.DokanClient;
import com.dokanclient.exception.ValidationException;
import com.dokanclient.model.Page;
import com.dokanclient.model.RequestDescription;
import com.dokanclient.model.ResponseEnvelope;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.model.query.ListParams;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * 资源服务公共部分: 发送、解码、分页头读取
 */
public abstract class AbstractResourceService {

    public static final String API_PREFIX = "/wp-json/dokan/v1";

    public static final String HEADER_TOTAL = "X-WP-Total";

    public static final String HEADER_TOTAL_PAGES = "X-WP-TotalPages";

    protected final DokanClient client;

    protected AbstractResourceService(DokanClient client) {
        this.client = client;
    }

    /** 资源名, 用于防护与指标分组 */
    protected abstract String resource();

    protected ResponseEnvelope send(CallContext ctx, RequestDescription.RequestDescriptionBuilder desc) {
        return client.execute(ctx, desc.resource(resource()).build());
    }

    protected <T> T decode(ResponseEnvelope response, Class<T> type) {
        return client.getSerializer().deserialize(response.getBody(), type);
    }

    protected <T> Page<T> page(ResponseEnvelope response, TypeReference<List<T>> type, ListParams params, Long vendorId) {
        List<T> items = client.getSerializer().deserialize(response.getBody(), type);
        return Page.<T>builder()
                .items(items == null ? List.of() : items)
                .totalItems(response.intHeader(HEADER_TOTAL))
                .totalPages(response.intHeader(HEADER_TOTAL_PAGES))
                .page(params != null && params.getPage() != null ? params.getPage() : 0)
                .perPage(params != null && params.getPerPage() != null ? params.getPerPage() : 0)
                .vendorId(vendorId)
                .build();
    }

    protected static void requirePositiveId(String field, long id) {
        if (id <= 0) {
            throw new ValidationException(field, "invalid_id", field + " must be a positive number");
        }
    }
}
