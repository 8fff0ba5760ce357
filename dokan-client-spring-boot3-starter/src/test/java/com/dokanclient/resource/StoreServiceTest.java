package com.dokanclient.resource;

import com.dokanclient.client.DokanClient;
import com.dokanclient.exception.NetworkException;
import com.dokanclient.model.Page;
import com.dokanclient.model.query.ProductListParams;
import com.dokanclient.model.query.ReviewListParams;
import com.dokanclient.model.query.StoreListParams;
import com.dokanclient.model.resource.Product;
import com.dokanclient.model.resource.Review;
import com.dokanclient.model.resource.Store;
import com.dokanclient.support.StubTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreServiceTest {

    private final StubTransport transport = new StubTransport();

    private StoreService stores;

    @BeforeEach
    void setUp() {
        stores = DokanClient.builder()
                .baseAddress("https://shop.test")
                .basicAuth("user", "pass")
                .retryCount(3)
                .baseDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(5))
                .transport(transport)
                .build()
                .stores();
    }

    @Test
    void getStore() {
        transport.respond(200, "{\"id\":3,\"store_name\":\"Acme\",\"rating\":{\"rating\":\"4.50\",\"count\":12},"
                + "\"social\":{\"fb\":\"acme\"},\"payment\":{\"paypal\":{\"email\":\"a@b.c\"}},"
                + "\"registered\":\"2023-06-01 10:00:00\"}");

        Store s = stores.get(3);

        assertThat(s.getStoreName()).isEqualTo("Acme");
        assertThat(s.getRating().getCount()).isEqualTo(12);
        assertThat(s.getSocial()).containsEntry("fb", "acme");
        assertThat(s.getPayment().get("paypal")).containsEntry("email", "a@b.c");
    }

    @Test
    void listKeepsExplicitFalseFilters() {
        transport.respond(200, "[]");

        Page<Store> page = stores.list(StoreListParams.builder().featured(true).enabled(false).build());

        assertThat(page.getItems()).isEmpty();
        assertThat(transport.lastRequest().getUri().getRawQuery()).isEqualTo("featured=true&enabled=false");
    }

    @Test
    void productsOfVendor() {
        transport.respond(200, Map.of("X-WP-Total", List.of("2"), "X-WP-TotalPages", List.of("1")),
                "[{\"id\":1},{\"id\":2}]");

        Page<Product> page = stores.products(3, ProductListParams.builder().perPage(50).build());

        assertThat(page.getVendorId()).isEqualTo(3L);
        assertThat(page.getItems()).hasSize(2);
        assertThat(page.getTotalItems()).isEqualTo(2);
        assertThat(transport.lastRequest().getUri().toString())
                .isEqualTo("https://shop.test/wp-json/dokan/v1/stores/3/products?per_page=50");
    }

    @Test
    void reviewsOfVendor() {
        transport.respond(200, "[{\"id\":8,\"product_id\":1,\"rating\":5,\"reviewer\":\"Bo\",\"verified\":true}]");

        Page<Review> page = stores.reviews(3, ReviewListParams.builder().rating(5).build());

        assertThat(page.getItems()).singleElement().satisfies(r -> {
            assertThat(r.getRating()).isEqualTo(5);
            assertThat(r.getVerified()).isTrue();
        });
        assertThat(transport.lastRequest().getUri().getPath()).isEqualTo("/wp-json/dokan/v1/stores/3/reviews");
        assertThat(transport.lastRequest().getUri().getRawQuery()).isEqualTo("rating=5");
    }

    @Test
    void networkFailuresAreRetriedThenSurfaced() {
        transport.fail(new IOException("reset"));

        assertThatThrownBy(() -> stores.get(3)).isInstanceOf(NetworkException.class);
        assertThat(transport.calls()).isEqualTo(3);
    }
}
