package jump.email.watch.service;

import com.google.api.services.gmail.model.Message;
import jump.email.watch.entity.LabelFilter;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.model.MessageRef;
import jump.email.watch.model.ProviderResult;
import jump.email.watch.model.WatchCreated;

import java.math.BigInteger;
import java.util.List;

/**
 * Mailbox operations the watch pipeline needs. Implementations never throw for provider
 * failures; they classify them into a {@link ProviderResult}.
 */
public interface MailboxProvider {

    /**
     * The mailbox's current history id.
     */
    ProviderResult<BigInteger> getCurrentCursor(MailboxHandle handle);

    ProviderResult<WatchCreated> createWatch(MailboxHandle handle, LabelFilter labelFilter);

    /**
     * Stops push delivery for the mailbox. NOT_FOUND means there was nothing to stop.
     */
    ProviderResult<Void> stopWatch(MailboxHandle handle);

    /**
     * Messages added after {@code fromCursor} up to and including {@code toCursor} that match the filter.
     * NOT_FOUND means {@code fromCursor} is older than the provider keeps history for.
     */
    ProviderResult<List<MessageRef>> listChanges(MailboxHandle handle, BigInteger fromCursor,
                                                 BigInteger toCursor, LabelFilter labelFilter);

    ProviderResult<Message> getMessage(MailboxHandle handle, MessageRef ref);
}
