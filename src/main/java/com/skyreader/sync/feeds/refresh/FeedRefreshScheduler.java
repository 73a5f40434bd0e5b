package com.skyreader.sync.feeds.refresh;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.alarm.AlarmHandler;
import com.skyreader.sync.core.alarm.Alarms;
import com.skyreader.sync.core.model.RefreshCandidate;
import com.skyreader.sync.core.store.StateStore;
import com.skyreader.sync.core.store.SubscriptionStore;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs refresh cycles over subscribed feeds, one batch per alarm.
 *
 * <h2>Cycle</h2>
 * <ol>
 *   <li>{@link #trigger()} selects up to {@code maxFeedsPerCycle} feeds of recently active users (never fetched
 *       first, then most subscribed), persists the cycle state and arms the batch alarm.</li>
 *   <li>Each alarm refreshes the next {@code batchSize} feeds concurrently, adds the outcomes to the cycle
 *       counters and arms the next batch after {@code batchDelay}.</li>
 *   <li>After the last batch the totals are stored as the cycle statistics and the cycle state is removed.</li>
 * </ol>
 * The cycle state lives in {@code sync_state}, so a restart resumes at the next unprocessed batch.
 */
@Component
public class FeedRefreshScheduler implements AlarmHandler {

    private static final Logger log = LoggerFactory.getLogger(FeedRefreshScheduler.class);

    public static final String ALARM = "feed-refresh-batch";

    static final String CYCLE_KEY = "feed_refresh_cycle";
    static final String STATS_KEY = "feed_refresh_stats";

    private static final Duration START_DELAY = Duration.ofMillis(100);

    private final SubscriptionStore subscriptions;
    private final FeedRefresher refresher;
    private final StateStore state;
    private final Alarms alarms;
    private final FeedRefreshProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FeedRefreshScheduler(SubscriptionStore subscriptions, FeedRefresher refresher, StateStore state,
            Alarms alarms, FeedRefreshProperties props, ObjectMapper mapper, Clock clock) {
        this.subscriptions = subscriptions;
        this.refresher = refresher;
        this.state = state;
        this.alarms = alarms;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String alarmName() {
        return ALARM;
    }

    /**
     * Starts a cycle unless one is in progress.
     */
    public Mono<TriggerResult> trigger() {
        return loadCycle().filter(cycle -> !cycle.complete())
                .flatMap(cycle -> alarms.setIfAbsent(ALARM, START_DELAY)
                        .doOnNext(rearmed -> {
                            if (rearmed) {
                                log.info("Refresh cycle {} had no pending batch; re-armed", cycle.progress());
                            }
                        })
                        .thenReturn(TriggerResult.inProgress(cycle.progress())))
                .switchIfEmpty(Mono.defer(this::startCycle));
    }

    private Mono<TriggerResult> startCycle() {
        Instant now = clock.instant();
        return selectFeeds(now).flatMap(feeds -> {
            if (feeds.isEmpty()) {
                log.info("No feeds need refreshing");
                return Mono.just(TriggerResult.noFeeds());
            }
            log.info("Refresh cycle starting feeds={}", feeds.size());
            return saveCycle(RefreshCycleState.start(feeds, now))
                    .then(alarms.setIn(ALARM, START_DELAY))
                    .thenReturn(TriggerResult.started(feeds.size()));
        });
    }

    Mono<List<RefreshCandidate>> selectFeeds(Instant now) {
        return subscriptions.refreshCandidates(now.minus(props.getActiveWindow()), props.getMaxErrorCount(),
                        props.getMaxFeedsPerCycle())
                .filter(c -> c.errorCount() < props.getMaxErrorCount())
                .take(props.getMaxFeedsPerCycle())
                .collectList();
    }

    @Override
    public Mono<Void> onAlarm() {
        return loadCycle()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(cycle -> {
                    if (cycle.isEmpty() || cycle.get().complete()) {
                        log.debug("No active refresh cycle");
                        return alarms.clear(ALARM);
                    }
                    return runBatch(cycle.get());
                });
    }

    private Mono<Void> runBatch(RefreshCycleState cycle) {
        List<RefreshCandidate> batch = cycle.nextBatch(props.getBatchSize());
        log.info("Refresh batch feeds {}-{} of {}", cycle.currentIndex() + 1, cycle.currentIndex() + batch.size(),
                cycle.feeds().size());

        return Flux.fromIterable(batch)
                .flatMap(candidate -> refresher.refresh(candidate)
                        .onErrorResume(err -> {
                            log.warn("Feed refresh failed url={} err={}", candidate.feedUrl(), err.toString());
                            return Mono.just(RefreshOutcome.FAILED);
                        }), props.getBatchSize())
                .collectList()
                .flatMap(outcomes -> {
                    int fetched = count(outcomes, RefreshOutcome.FETCHED);
                    int failed = count(outcomes, RefreshOutcome.FAILED);
                    int skipped = outcomes.size() - fetched - failed;
                    RefreshCycleState next = cycle.advance(batch.size(), fetched, skipped, failed);

                    if (next.complete()) {
                        return finish(next);
                    }
                    log.info("Refresh batch done fetched={} skipped={} errors={} next in {}", fetched, skipped,
                            failed, props.getBatchDelay());
                    return saveCycle(next).then(alarms.setIn(ALARM, props.getBatchDelay()));
                });
    }

    private Mono<Void> finish(RefreshCycleState cycle) {
        Instant now = clock.instant();
        RefreshStats stats = new RefreshStats(cycle.fetched(), cycle.skipped(), cycle.errors(),
                Duration.between(cycle.startedAt(), now).toMillis(), now);
        log.info("Refresh cycle complete fetched={} skipped={} errors={} durationMs={}", stats.fetched(),
                stats.skipped(), stats.errors(), stats.durationMs());
        return state.put(STATS_KEY, write(stats)).then(state.delete(CYCLE_KEY)).then(alarms.clear(ALARM));
    }

    public Mono<RefresherStatus> status() {
        Mono<RefreshCycleState> cycle = loadCycle();
        Mono<RefreshStats> stats = state.get(STATS_KEY).flatMap(json -> read(json, RefreshStats.class));
        Mono<Instant> next = alarms.get(ALARM);

        return Mono.zip(
                        cycle.map(CycleSummary::of).map(Optional::of).defaultIfEmpty(Optional.empty()),
                        stats.map(Optional::of).defaultIfEmpty(Optional.empty()),
                        next.map(Optional::of).defaultIfEmpty(Optional.empty()))
                .map(t -> new RefresherStatus(t.getT1().orElse(null), t.getT2().orElse(null), t.getT3().orElse(null),
                        t.getT3().isPresent()));
    }

    private Mono<RefreshCycleState> loadCycle() {
        return state.get(CYCLE_KEY).flatMap(json -> read(json, RefreshCycleState.class));
    }

    private Mono<Void> saveCycle(RefreshCycleState cycle) {
        return state.put(CYCLE_KEY, write(cycle));
    }

    private <T> Mono<T> read(String json, Class<T> type) {
        try {
            return Mono.just(mapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} in state store err={}", type.getSimpleName(), e.getOriginalMessage());
            return Mono.empty();
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static int count(List<RefreshOutcome> outcomes, RefreshOutcome wanted) {
        return (int) outcomes.stream().filter(o -> o == wanted).count();
    }

    /**
     * Response of {@link #trigger()}.
     *
     * @param status    {@code started}, {@code in_progress} or {@code no_feeds}
     * @param feedCount feeds selected, only when started
     * @param progress  {@code index/total}, only when in progress
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TriggerResult(String status, Integer feedCount, String progress) {

        static TriggerResult started(int feedCount) {
            return new TriggerResult("started", feedCount, null);
        }

        static TriggerResult inProgress(String progress) {
            return new TriggerResult("in_progress", null, progress);
        }

        static TriggerResult noFeeds() {
            return new TriggerResult("no_feeds", 0, null);
        }
    }

    public record CycleSummary(int totalFeeds, int currentIndex, int fetched, int skipped, int errors,
            Instant startedAt) {

        static CycleSummary of(RefreshCycleState s) {
            return new CycleSummary(s.feeds().size(), s.currentIndex(), s.fetched(), s.skipped(), s.errors(),
                    s.startedAt());
        }
    }

    public record RefresherStatus(CycleSummary cycleState, RefreshStats lastStats, Instant nextAlarm,
            boolean running) {
    }
}
