package jump.email.watch.model;

import lombok.Value;

@Value
public class TriageReceipt {
    String acceptedId;
    String status;
}
