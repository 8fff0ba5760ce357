package com.dokanclient.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class ClientMetrics {
    private final Counter requests;
    private final Counter success;
    private final Counter failed;
    private final Counter retries;
    private final DistributionSummary attempts;
    private final Timer exchangeTimer;
    private final Timer backoffTimer;

    private ClientMetrics(MeterRegistry reg) {
        this.requests = Counter.builder("dokan.client.requests").description("logical api calls").register(reg);
        this.success  = Counter.builder("dokan.client.success").description("calls succeeded").register(reg);
        this.failed   = Counter.builder("dokan.client.failed").description("calls failed").register(reg);
        this.retries  = Counter.builder("dokan.client.retries").description("retry attempts").register(reg);
        this.attempts = DistributionSummary.builder("dokan.client.attempts")
                .description("attempt count per call").baseUnit("times").register(reg);
        this.exchangeTimer = Timer.builder("dokan.client.exchange.time").description("http exchange time").register(reg);
        this.backoffTimer  = Timer.builder("dokan.client.backoff.time").description("time spent waiting between attempts").register(reg);
    }

    public static ClientMetrics create(MeterRegistry reg) { return new ClientMetrics(reg); }

    public void incRequests(){ requests.increment(); }
    public void incSuccess(){  success.increment(); }
    public void incFailed(){   failed.increment(); }
    public void incRetries(){  retries.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExchangeNanos(long nanos){ exchangeTimer.record(nanos, TimeUnit.NANOSECONDS); }
    public void recordBackoffNanos(long nanos){ backoffTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
