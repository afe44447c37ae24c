package jump.email.watch.service;

import jump.email.watch.model.CanonicalMessage;
import jump.email.watch.model.SourceContext;
import jump.email.watch.model.TriageReceipt;

/**
 * Downstream analysis of inbound mail. Submission is fire-and-forget; results arrive elsewhere.
 */
public interface TriageClient {
    TriageReceipt submit(CanonicalMessage message, SourceContext context);
}
