package mail.archiver.app.service.source;

import java.util.Iterator;

/**
 * Lazy sequence of messages in one folder. Must be closed to release the folder.
 * <p>
 * {@link #next()} throws {@link MailSourceException} for a message whose envelope cannot be
 * read, after moving past it, so iteration can go on. {@link #hasNext()} may throw when a
 * page cannot be loaded; calling it again retries the same page.
 */
public interface MessageStream extends Iterator<SourceMessage>, AutoCloseable {

    /**
     * @return number of messages the stream yields, or -1 when the provider pages lazily
     */
    int size();

    @Override
    void close();
}
