package jump.email.watch.model;

import lombok.Value;

@Value
public class MessageRef {
    String id;
    String threadId;
}
