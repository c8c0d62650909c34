package com.ietfdata.gateway.config;

import com.ietfdata.client.ClientSettings;
import com.ietfdata.client.Datatracker;
import com.ietfdata.client.transport.HttpTransport;
import com.ietfdata.client.transport.Transport;
import com.ietfdata.observability.MetricFactory;
import com.ietfdata.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Datatracker client into the application context.
 *
 * <p>Metrics go to the actuator's {@link MeterRegistry}; spans go to whatever OpenTelemetry SDK
 * has been registered globally (a no-op tracer when none has).
 */
@Configuration
public class ClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ClientConfiguration.class);

    static final String CLIENT_NAME = "datatracker-gateway";

    @Bean
    public ClientSettings clientSettings(DatatrackerProperties properties) {
        log.info("Datatracker client: {}", properties.redacted());
        return properties.toClientSettings();
    }

    @Bean
    public MetricFactory datatrackerMetrics(MeterRegistry meterRegistry) {
        return new MetricFactory(meterRegistry, CLIENT_NAME);
    }

    @Bean
    public Transport datatrackerTransport(ClientSettings settings, MetricFactory datatrackerMetrics) {
        SpanHelper spans = new SpanHelper(GlobalOpenTelemetry.getTracer(SpanHelper.INSTRUMENTATION_NAME));
        return new HttpTransport(settings, datatrackerMetrics, spans);
    }

    @Bean
    public Datatracker datatracker(Transport transport, ClientSettings settings, MetricFactory datatrackerMetrics) {
        return new Datatracker(transport, settings, datatrackerMetrics);
    }
}
