package com.dokanclient.core.serializer;

import com.dokanclient.exception.SerializationException;
import com.dokanclient.model.resource.Product;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonPayloadSerializerTest {

    private final JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();

    @Test
    void nullBodyIsNotSerialized() {
        assertThat(serializer.serialize(null)).isNull();
    }

    @Test
    void unknownFieldsAreIgnored() {
        Product p = serializer.deserialize("{\"id\":3,\"name\":\"Lamp\",\"_links\":{}}"
                .getBytes(StandardCharsets.UTF_8), Product.class);
        assertThat(p.getId()).isEqualTo(3L);
        assertThat(p.getName()).isEqualTo("Lamp");
    }

    @Test
    void marshalFailureBecomesSerializationException() {
        assertThatThrownBy(() -> serializer.serialize(new Exploding()))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("failed to marshal request body");
    }

    @Test
    void malformedResponseBecomesSerializationException() {
        assertThatThrownBy(() -> serializer.deserialize("{not json".getBytes(StandardCharsets.UTF_8), Product.class))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("failed to unmarshal response");
    }

    static class Exploding {
        public String getValue() {
            throw new IllegalStateException("boom");
        }
    }
}
