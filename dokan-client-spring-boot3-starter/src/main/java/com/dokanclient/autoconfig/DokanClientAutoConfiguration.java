package com.dokanclient.autoconfig;

import com.dokanclient.client.DokanClient;
import com.dokanclient.client.DokanClientBuilder;
import com.dokanclient.config.DokanClientProperties;
import com.dokanclient.core.auth.BasicAuthenticator;
import com.dokanclient.core.auth.BearerTokenAuthenticator;
import com.dokanclient.core.failure.FailureDeciders;
import com.dokanclient.core.failure.RouterFailureDecider;
import com.dokanclient.core.metric.ClientMeterRegistryProvider;
import com.dokanclient.core.spi.Authenticator;
import com.dokanclient.core.spi.BackoffPolicy;
import com.dokanclient.core.spi.HttpTransport;
import com.dokanclient.core.spi.TokenRefresher;
import com.dokanclient.core.spi.failure.FailureCaseHandler;
import com.dokanclient.core.spi.failure.FailureDecider;
import com.dokanclient.model.enums.AuthType;
import com.dokanclient.resource.OrderService;
import com.dokanclient.resource.ProductService;
import com.dokanclient.resource.StoreService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 配置了 dokan.client.base-address 时创建 DokanClient
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "dokan.client", name = "base-address")
@EnableConfigurationProperties(DokanClientProperties.class)
public class DokanClientAutoConfiguration {

    /**
     * 按配置创建认证器, 用户自定义 Authenticator Bean 优先
     */
    @Bean
    @ConditionalOnMissingBean(Authenticator.class)
    @ConditionalOnProperty(prefix = "dokan.client.auth", name = "type")
    public Authenticator dokanAuthenticator(DokanClientProperties props,
                                            ObjectProvider<TokenRefresher> refresher) {
        DokanClientProperties.Auth auth = props.getAuth();
        AuthType type;
        try {
            type = AuthType.from(auth.getType());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported dokan.client.auth.type: " + auth.getType(), e);
        }
        switch (type) {
            case BASIC:
                return new BasicAuthenticator(auth.getUsername(), auth.getPassword());
            case BEARER:
            default:
                return new BearerTokenAuthenticator(auth.getToken(), auth.getExpiresAt(), auth.getRefreshToken(),
                        refresher.getIfAvailable(), Clock.systemUTC());
        }
    }

    // Router 决策器, 内置处理器 + 用户注册的 FailureCaseHandler
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider dokanFailureDecider(ObjectProvider<FailureCaseHandler<?>> custom) {
        List<FailureCaseHandler<?>> handlers = new ArrayList<>(custom.orderedStream().collect(Collectors.toList()));
        handlers.addAll(FailureDeciders.defaultHandlers());
        return new RouterFailureDecider(handlers);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DokanClient dokanClient(DokanClientProperties props,
                                   ObjectProvider<Authenticator> authenticator,
                                   ObjectProvider<HttpTransport> transport,
                                   ObjectProvider<ObjectMapper> objectMapper,
                                   ObjectProvider<ClientMeterRegistryProvider> meterRegistryProvider,
                                   ObjectProvider<BackoffPolicy> backoffPolicy,
                                   FailureDecider failureDecider) {
        DokanClientProperties.Retry retry = props.getRetry();
        DokanClientBuilder b = DokanClient.builder()
                .baseAddress(props.getBaseAddress())
                .timeout(props.getTimeout())
                .connectTimeout(props.getConnectTimeout())
                .userAgent(props.getUserAgent())
                .retryCount(retry.getMaxAttempts())
                .baseDelay(retry.getBaseDelay())
                .maxDelay(retry.getMaxDelay())
                .multiplier(retry.getMultiplier())
                .defaultRetryAfter(props.getErrors().getDefaultRetryAfter())
                .distinguishForbidden(props.getErrors().isDistinguishForbidden())
                .guard(props.getGuard())
                .failureDecider(failureDecider)
                .authenticator(authenticator.getIfAvailable())
                .transport(transport.getIfAvailable())
                .meterRegistry(meterRegistryProvider.getIfAvailable(() -> new ClientMeterRegistryProvider(null))
                        .getRegistry());
        // 复用应用的 ObjectMapper, 但必须忽略未知字段
        ObjectMapper mapper = objectMapper.getIfUnique();
        if (mapper != null) {
            b.objectMapper(mapper.copy()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        }
        BackoffPolicy backoff = backoffPolicy.getIfUnique();
        if (backoff != null) {
            b.backoffPolicy(backoff);
        }
        return b.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProductService dokanProductService(DokanClient client) {
        return client.products();
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderService dokanOrderService(DokanClient client) {
        return client.orders();
    }

    @Bean
    @ConditionalOnMissingBean
    public StoreService dokanStoreService(DokanClient client) {
        return client.stores();
    }
}
