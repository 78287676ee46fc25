package tech.datarepository.repository;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import org.jboss.logging.Logger;

/**
 * Hot, multi-subscriber channel announcing that items of one type changed.
 *
 * <p>Each signal is delivered to the subscribers present when it is emitted; nothing is
 * replayed for late subscribers. Every subscriber gets its own overflow buffer, so one that
 * requests items slowly still receives all of them, in order. Emissions are serialized so
 * concurrent callers never interleave signals. Once closed, subscribers see completion
 * (after draining their buffer) and further emissions are ignored.
 */
class EntityUpdateBroadcaster<T> {

    private static final Logger LOG = Logger.getLogger(EntityUpdateBroadcaster.class);

    private final Class<T> itemType;
    private final BroadcastProcessor<Class<T>> processor = BroadcastProcessor.create();
    private final Multi<Class<T>> stream = Multi.createFrom().publisher(processor)
        .onOverflow().bufferUnconditionally();

    private boolean closed;

    EntityUpdateBroadcaster(Class<T> itemType) {
        this.itemType = itemType;
    }

    Multi<Class<T>> stream() {
        return stream;
    }

    synchronized void emit() {
        if (closed) {
            LOG.debugf("Dropping update notification for [%s]: channel closed", itemType.getSimpleName());
            return;
        }
        processor.onNext(itemType);
    }

    synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        processor.onComplete();
        LOG.debugf("Closed update notification channel for [%s]", itemType.getSimpleName());
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
