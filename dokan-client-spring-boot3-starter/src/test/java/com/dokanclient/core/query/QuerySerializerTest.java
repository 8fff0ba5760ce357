package com.dokanclient.core.query;

import com.dokanclient.annotation.QueryParam;
import com.dokanclient.exception.SerializationException;
import com.dokanclient.model.enums.OrderStatus;
import com.dokanclient.model.enums.ProductStatus;
import com.dokanclient.model.enums.SortOrder;
import com.dokanclient.model.query.OrderListParams;
import com.dokanclient.model.query.ProductListParams;
import com.dokanclient.model.query.StoreListParams;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class QuerySerializerTest {

    @Test
    void zeroValueWithOmitEmptyProducesNoParameter() {
        ProductListParams params = ProductListParams.builder().page(0).sku("").build();
        assertThat(QuerySerializer.flatten(params)).isEmpty();
    }

    @Test
    void collectionIsCommaJoined() {
        ProductListParams params = ProductListParams.builder().category(List.of(15L, 23L)).build();
        assertThat(QuerySerializer.flatten(params)).containsExactly(entry("category", "15,23"));
    }

    @Test
    void inheritedFieldsComeFirst() {
        ProductListParams params = ProductListParams.builder()
                .page(2)
                .perPage(20)
                .order(SortOrder.DESC)
                .status(List.of(ProductStatus.PUBLISH, ProductStatus.DRAFT))
                .sku("W-1")
                .build();

        assertThat(QuerySerializer.flatten(params)).containsExactly(
                entry("page", "2"),
                entry("per_page", "20"),
                entry("order", "desc"),
                entry("status", "publish,draft"),
                entry("sku", "W-1"));
    }

    @Test
    void explicitFalseIsKeptWhenNotOmitEmpty() {
        StoreListParams params = StoreListParams.builder().featured(false).build();
        assertThat(QuerySerializer.flatten(params)).containsExactly(entry("featured", "false"));
    }

    @Test
    void decimalsHaveNoExponentOrTrailingZeros() {
        ProductListParams params = ProductListParams.builder()
                .minPrice(new BigDecimal("10.50"))
                .maxPrice(new BigDecimal("1E+3"))
                .build();
        assertThat(QuerySerializer.flatten(params))
                .containsExactly(entry("min_price", "10.5"), entry("max_price", "1000"));
    }

    @Test
    void timesAreRfc3339() {
        OrderListParams params = OrderListParams.builder()
                .status(List.of(OrderStatus.ON_HOLD))
                .after(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 999, ZoneOffset.UTC))
                .before(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(2)))
                .build();

        assertThat(QuerySerializer.flatten(params)).containsExactly(
                entry("status", "on-hold"),
                entry("after", "2024-01-02T03:04:05Z"),
                entry("before", "2024-01-02T03:04:05+02:00"));
    }

    @Test
    void encodeEscapesValues() {
        ProductListParams params = ProductListParams.builder().search("red & blue").build();
        assertThat(QuerySerializer.encode(params)).isEqualTo("search=red+%26+blue");
        assertThat(QuerySerializer.encode(null)).isEmpty();
    }

    @Test
    void optionalIsDereferenced() {
        assertThat(QuerySerializer.flatten(new WithOptional()))
                .containsExactly(entry("q", "x"));
    }

    @Test
    void unsupportedTypeFails() {
        assertThatThrownBy(() -> QuerySerializer.flatten(new WithMap()))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("filter");
    }

    static class WithOptional {
        @QueryParam("q")
        Optional<String> q = Optional.of("x");
        @QueryParam("empty")
        Optional<String> empty = Optional.empty();
        String ignored = "not annotated";
    }

    static class WithMap {
        @QueryParam("filter")
        Map<String, String> filter = Map.of("a", "b");
    }
}
