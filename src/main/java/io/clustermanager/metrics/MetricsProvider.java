package io.clustermanager.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/*
 * MetricsProvider registers the manager's counters, gauges and timers. Every meter is
 * tagged with the manager id as hostname.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String hostname;

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${manager.id:cluster-manager}") String managerId) {
        this.registry = registry;
        this.hostname = managerId;
        log.info("MetricsProvider initialized for the manager: {}", hostname);
    }

    /**
     * Counter for the name and tags, created on first use.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(withHostname(tags)).register(registry);
    }

    /**
     * Gauge reporting the returned value holder. The registry keeps the first holder
     * registered for a name and tag set, so register each gauge once.
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        AtomicDouble gaugeValue = new AtomicDouble(0);
        Gauge.builder(name, gaugeValue::get).tags(withHostname(tags)).register(registry);
        return gaugeValue;
    }

    /**
     * Timer for the name and tags, publishing the 50th, 90th and 99th percentiles.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(withHostname(tags))
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private Tags withHostname(Map<String, String> tags) {
        Tags result = Tags.of(HOST_NAME_TAG, hostname);
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            result = result.and(entry.getKey(), entry.getValue());
        }
        return result;
    }
}
