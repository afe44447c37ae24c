package jump.email.watch.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
public class HealthReport {
    HealthStatus status;
    Map<String, Boolean> checks;
    WatchStatistics statistics;
    List<String> recommendations;
    Map<String, Long> orphanEvents;
    Instant sampledAt;
}
