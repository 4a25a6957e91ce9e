package com.bookindexer.ingest.config;

import java.util.Collections;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.micrometer.observation.autoconfigure.ObservationRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.tracing.Tracer;
import io.micrometer.tracing.handler.DefaultTracingObservationHandler;
import io.micrometer.tracing.handler.PropagatingReceiverTracingObservationHandler;
import io.micrometer.tracing.handler.PropagatingSenderTracingObservationHandler;
import io.micrometer.tracing.otel.bridge.OtelBaggageManager;
import io.micrometer.tracing.otel.bridge.OtelCurrentTraceContext;
import io.micrometer.tracing.otel.bridge.OtelPropagator;
import io.micrometer.tracing.otel.bridge.OtelTracer;
import io.micrometer.tracing.otel.bridge.Slf4JBaggageEventListener;
import io.micrometer.tracing.otel.bridge.Slf4JEventListener;
import io.micrometer.tracing.propagation.Propagator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.semconv.ServiceAttributes;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports spans for push requests, catalog API calls and audit sends over OTLP.
 * <p>
 * Trace and span ids are put on the SLF4J MDC so log lines of one message can be correlated.
 * The SDK is closed with the application context, which flushes pending spans.
 */
@Configuration
@Slf4j
public class TracingConfiguration {

    private final String serviceName;
    private final String otlpEndpoint;
    private final double samplingProbability;

    public TracingConfiguration(@Value("${spring.application.name}") String serviceName,
            @Value("${management.otlp.tracing.endpoint}") String otlpEndpoint,
            @Value("${management.tracing.sampling.probability:1.0}") double samplingProbability) {
        this.serviceName = serviceName;
        this.otlpEndpoint = otlpEndpoint;
        this.samplingProbability = samplingProbability;
    }

    @Bean
    public OpenTelemetrySdk openTelemetry() {
        log.info("Exporting {} traces to {} (sampling {})", serviceName, otlpEndpoint, samplingProbability);

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(ServiceAttributes.SERVICE_NAME, serviceName)));

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(
                        OtlpGrpcSpanExporter.builder()
                                .setEndpoint(otlpEndpoint)
                                .build())
                        .build())
                .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(samplingProbability)))
                .setResource(resource)
                .build();

        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }

    @Bean
    public Tracer otelTracer(OpenTelemetry openTelemetry) {
        OtelCurrentTraceContext currentTraceContext = new OtelCurrentTraceContext();
        Slf4JEventListener slf4JEventListener = new Slf4JEventListener();
        Slf4JBaggageEventListener slf4JBaggageEventListener = new Slf4JBaggageEventListener(Collections.emptyList());

        return new OtelTracer(
                openTelemetry.getTracer(serviceName),
                currentTraceContext,
                event -> {
                    slf4JEventListener.onEvent(event);
                    slf4JBaggageEventListener.onEvent(event);
                },
                new OtelBaggageManager(currentTraceContext, Collections.emptyList(), Collections.emptyList()));
    }

    @Bean
    public OtelPropagator otelPropagator(OpenTelemetry openTelemetry) {
        return new OtelPropagator(openTelemetry.getPropagators(), openTelemetry.getTracer(serviceName));
    }

    @Bean
    public ObservationRegistryCustomizer<ObservationRegistry> observationRegistryCustomizer(
            Tracer tracer, Propagator propagator) {
        // Default handler first so a message without incoming context still gets a root span
        return registry -> registry.observationConfig()
                .observationHandler(new DefaultTracingObservationHandler(tracer))
                .observationHandler(new PropagatingReceiverTracingObservationHandler<>(tracer, propagator))
                .observationHandler(new PropagatingSenderTracingObservationHandler<>(tracer, propagator));
    }
}
