package ru.derendyaev.SmsInbox.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;
import ru.derendyaev.SmsInbox.model.IngestionOutcome;

import java.util.EnumMap;
import java.util.Map;

/**
 * Счётчик webhook_requests_total{result=...}: по одному значению тега на каждый итог обработки.
 */
@Component
public class IngestionMetrics {

    public static final String WEBHOOK_REQUESTS = "webhook.requests";
    public static final String RESULT_TAG = "result";

    private final Map<IngestionOutcome.Type, Counter> counters = new EnumMap<>(IngestionOutcome.Type.class);

    public IngestionMetrics(MeterRegistry registry) {
        for (IngestionOutcome.Type type : IngestionOutcome.Type.values()) {
            counters.put(type, Counter.builder(WEBHOOK_REQUESTS)
                    .description("Total webhook requests by result")
                    .tag(RESULT_TAG, type.getMetricTag())
                    .register(registry));
        }
    }

    public void record(IngestionOutcome outcome) {
        counters.get(outcome.getType()).increment();
    }

    public double count(IngestionOutcome.Type type) {
        return counters.get(type).count();
    }
}
