package com.dokanclient.resource;

import com.dokanclient.client.DokanClient;
import com.dokanclient.exception.ValidationException;
import com.dokanclient.model.Page;
import com.dokanclient.model.RequestDescription;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.model.query.ProductListParams;
import com.dokanclient.model.resource.Product;
import com.dokanclient.model.resource.ProductSummary;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * 商品接口 /products
 */
public class ProductService extends AbstractResourceService {

    private static final String PATH = API_PREFIX + "/products";

    private static final TypeReference<List<Product>> LIST_TYPE = new TypeReference<>() { };

    public ProductService(DokanClient client) {
        super(client);
    }

    @Override
    protected String resource() {
        return "products";
    }

    public Product create(Product product) {
        return create(CallContext.background(), product);
    }

    /**
     * 名称为必填, 校验失败不会发起请求
     */
    public Product create(CallContext ctx, Product product) {
        if (product == null || product.getName() == null || product.getName().isBlank()) {
            throw new ValidationException("name", "required", "product name is required");
        }
        return decode(send(ctx, RequestDescription.post(PATH + "/").body(product)), Product.class);
    }

    public Product get(long id) {
        return get(CallContext.background(), id);
    }

    public Product get(CallContext ctx, long id) {
        requirePositiveId("id", id);
        return decode(send(ctx, RequestDescription.get(PATH + "/" + id)), Product.class);
    }

    public Page<Product> list(ProductListParams params) {
        return list(CallContext.background(), params);
    }

    public Page<Product> list(CallContext ctx, ProductListParams params) {
        return page(send(ctx, RequestDescription.get(PATH + "/").query(params)), LIST_TYPE, params, null);
    }

    public Product update(long id, Product product) {
        return update(CallContext.background(), id, product);
    }

    public Product update(CallContext ctx, long id, Product product) {
        requirePositiveId("id", id);
        if (product == null) {
            throw new ValidationException("product", "required", "product is required");
        }
        return decode(send(ctx, RequestDescription.put(PATH + "/" + id).body(product)), Product.class);
    }

    public void delete(long id) {
        delete(CallContext.background(), id);
    }

    public void delete(CallContext ctx, long id) {
        requirePositiveId("id", id);
        send(ctx, RequestDescription.delete(PATH + "/" + id));
    }

    public ProductSummary summary() {
        return summary(CallContext.background());
    }

    public ProductSummary summary(CallContext ctx) {
        return decode(send(ctx, RequestDescription.get(PATH + "/summary")), ProductSummary.class);
    }
}
