package jump.email.watch.model;

import lombok.Value;

import java.util.List;

@Value
public class RenewalSummary {
    int renewed;
    int failed;
    int retired;
    List<String> details;
}
