package jump.email.watch.model;

import lombok.Value;

@Value
public class PullCycleSummary {
    int pulled;
    int acknowledged;
    int leftForRedelivery;
    int decodeFailures;
    int messagesProcessed;
    String error;

    public static PullCycleSummary failed(String error) {
        return new PullCycleSummary(0, 0, 0, 0, 0, error);
    }
}
