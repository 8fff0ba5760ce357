package com.dokanclient.resource;

import com.dokanclient.client.DokanClient;
import com.dokanclient.exception.ValidationException;
import com.dokanclient.model.Page;
import com.dokanclient.model.RequestDescription;
import com.dokanclient.model.ctx.CallContext;
import com.dokanclient.model.query.OrderListParams;
import com.dokanclient.model.resource.Order;
import com.dokanclient.model.resource.OrderSummary;
import com.dokanclient.model.resource.OrderUpdate;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;

/**
 * 订单接口 /orders, 订单由下单流程创建, 这里只读取和更新
 */
public class OrderService extends AbstractResourceService {

    private static final String PATH = API_PREFIX + "/orders";

    private static final TypeReference<List<Order>> LIST_TYPE = new TypeReference<>() { };

    public OrderService(DokanClient client) {
        super(client);
    }

    @Override
    protected String resource() {
        return "orders";
    }

    public Order get(long id) {
        return get(CallContext.background(), id);
    }

    public Order get(CallContext ctx, long id) {
        requirePositiveId("id", id);
        return decode(send(ctx, RequestDescription.get(PATH + "/" + id)), Order.class);
    }

    public Page<Order> list(OrderListParams params) {
        return list(CallContext.background(), params);
    }

    public Page<Order> list(CallContext ctx, OrderListParams params) {
        return page(send(ctx, RequestDescription.get(PATH + "/").query(params)), LIST_TYPE, params, null);
    }

    public Order update(long id, OrderUpdate update) {
        return update(CallContext.background(), id, update);
    }

    /**
     * 至少需要一个非空字段
     */
    public Order update(CallContext ctx, long id, OrderUpdate update) {
        requirePositiveId("id", id);
        if (isEmpty(update)) {
            throw new ValidationException("update", "empty", "order update must change at least one field");
        }
        return decode(send(ctx, RequestDescription.put(PATH + "/" + id).body(update)), Order.class);
    }

    public OrderSummary summary() {
        return summary(CallContext.background());
    }

    public OrderSummary summary(CallContext ctx) {
        return decode(send(ctx, RequestDescription.get(PATH + "/summary")), OrderSummary.class);
    }

    private static boolean isEmpty(OrderUpdate u) {
        return u == null
                || u.getStatus() == null
                && (u.getCustomerNote() == null || u.getCustomerNote().isEmpty())
                && u.getBilling() == null
                && u.getShipping() == null
                && (u.getLineItems() == null || u.getLineItems().isEmpty())
                && (u.getShippingLines() == null || u.getShippingLines().isEmpty())
                && (u.getFeeLines() == null || u.getFeeLines().isEmpty())
                && (u.getCouponLines() == null || u.getCouponLines().isEmpty())
                && (u.getMetaData() == null || u.getMetaData().isEmpty());
    }
}
