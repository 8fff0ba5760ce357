package com.dokanclient.resource;

import com.dokanclient.client.DokanClient;
import com.dokanclient.model.Page;
import com.dokanclient.model.RequestDescription;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.model.query.ProductListParams;
import com.dokanclient.model.query.ReviewListParams;
import com.dokanclient.model.query.StoreListParams;
import com.dokanclient.model.resource.Product;
import com.dokanclient.model.resource.Review;
import com.dokanclient.model.resource.Store;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * 店铺接口 /stores, 只读
 */
public class StoreService extends AbstractResourceService {

    private static final String PATH = API_PREFIX + "/stores";

    private static final TypeReference<List<Store>> LIST_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<Product>> PRODUCT_LIST_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<Review>> REVIEW_LIST_TYPE = new TypeReference<>() { };

    public StoreService(DokanClient client) {
        super(client);
    }

    @Override
    protected String resource() {
        return "stores";
    }

    public Store get(long vendorId) {
        return get(CallContext.background(), vendorId);
    }

    public Store get(CallContext ctx, long vendorId) {
        requirePositiveId("vendorId", vendorId);
        return decode(send(ctx, RequestDescription.get(PATH + "/" + vendorId)), Store.class);
    }

    public Page<Store> list(StoreListParams params) {
        return list(CallContext.background(), params);
    }

    public Page<Store> list(CallContext ctx, StoreListParams params) {
        return page(send(ctx, RequestDescription.get(PATH + "/").query(params)), LIST_TYPE, params, null);
    }

    public Page<Product> products(long vendorId, ProductListParams params) {
        return products(CallContext.background(), vendorId, params);
    }

    public Page<Product> products(CallContext ctx, long vendorId, ProductListParams params) {
        requirePositiveId("vendorId", vendorId);
        return page(send(ctx, RequestDescription.get(PATH + "/" + vendorId + "/products").query(params)),
                PRODUCT_LIST_TYPE, params, vendorId);
    }

    public Page<Review> reviews(long vendorId, ReviewListParams params) {
        return reviews(CallContext.background(), vendorId, params);
    }

    public Page<Review> reviews(CallContext ctx, long vendorId, ReviewListParams params) {
        requirePositiveId("vendorId", vendorId);
        return page(send(ctx, RequestDescription.get(PATH + "/" + vendorId + "/reviews").query(params)),
                REVIEW_LIST_TYPE, params, vendorId);
    }
}
