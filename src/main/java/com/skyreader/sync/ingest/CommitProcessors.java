package com.skyreader.sync.ingest;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.skyreader.sync.core.model.JetstreamEvent;
import com.skyreader.sync.core.model.WatchedCollection;

import reactor.core.publisher.Mono;

/**
 * Routes commit frames to the processor of their collection.
 */
@Component
public class CommitProcessors {

    private final Map<WatchedCollection, CommitProcessor> byCollection = new EnumMap<>(WatchedCollection.class);

    public CommitProcessors(List<CommitProcessor> processors) {
        for (CommitProcessor p : processors) {
            CommitProcessor previous = byCollection.put(p.collection(), p);
            if (previous != null) {
                throw new IllegalStateException("Two processors for " + p.collection() + ": "
                        + previous.getClass().getSimpleName() + ", " + p.getClass().getSimpleName());
            }
        }
    }

    /**
     * @return {@link CommitOutcome#IGNORED} for non-commits and collections without a processor
     */
    public Mono<CommitOutcome> process(JetstreamEvent event) {
        return event.watchedCollection()
                .map(byCollection::get)
                .map(p -> p.process(event))
                .orElseGet(() -> Mono.just(CommitOutcome.IGNORED));
    }

    public boolean handles(WatchedCollection collection) {
        return byCollection.containsKey(collection);
    }
}
