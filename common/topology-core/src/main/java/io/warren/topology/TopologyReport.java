package io.warren.topology;

import io.warren.topology.model.ExchangeBinding;
import java.util.List;

/**
 * What a single declaration pass did on the broker.
 *
 * @param skippedQueueBindings queues that were declared but left unbound because their header
 *                             binding had no valid match mode
 */
public record TopologyReport(List<String> exchanges,
                             List<String> queues,
                             List<String> skippedQueueBindings,
                             List<ExchangeBinding> appliedBindings,
                             List<ExchangeBinding> failedBindings) {

    public TopologyReport {
        exchanges = List.copyOf(exchanges);
        queues = List.copyOf(queues);
        skippedQueueBindings = List.copyOf(skippedQueueBindings);
        appliedBindings = List.copyOf(appliedBindings);
        failedBindings = List.copyOf(failedBindings);
    }

    public boolean complete() {
        return skippedQueueBindings.isEmpty() && failedBindings.isEmpty();
    }
}
