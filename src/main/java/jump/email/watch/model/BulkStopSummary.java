package jump.email.watch.model;

import lombok.Value;

import java.util.List;

@Value
public class BulkStopSummary {
    int total;
    int stopped;
    int failed;
    List<String> failures;
}
