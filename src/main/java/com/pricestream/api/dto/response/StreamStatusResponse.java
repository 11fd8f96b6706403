package com.pricestream.api.dto.response;

import com.pricestream.scheduler.SchedulerStats;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Operational snapshot of the stream: connections, live subscriptions and scheduler counters. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamStatusResponse {

    private int connections;
    private int maxConnections;
    private List<String> subscribedSymbols;
    private List<String> supportedSymbols;
    private SchedulerStats scheduler;
}
