package com.dokanclient.autoconfig;

import com.dokanclient.core.metric.ClientMeterRegistryProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 汇总应用内的 MeterRegistry, 供 DokanClient 使用
 */
@AutoConfiguration(before = DokanClientAutoConfiguration.class)
public class DokanClientMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ClientMeterRegistryProvider dokanMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        List<MeterRegistry> registries = discovered.orderedStream().collect(Collectors.toList());
        return new ClientMeterRegistryProvider(registries);
    }
}
