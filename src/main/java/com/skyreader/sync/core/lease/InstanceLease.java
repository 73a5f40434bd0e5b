package com.skyreader.sync.core.lease;

import reactor.core.publisher.Mono;

/**
 * Freshness-stamped "active instance" marker shared by all processes of a deployment.
 *
 * <p>Only the holder may keep the live firehose connection open. The newest claimant wins; older holders
 * observe the change on their next check and step down. Markers expire when nobody refreshes them.</p>
 */
public interface InstanceLease {

    /**
     * Claims (or refreshes) the lease for {@code instanceId}.
     */
    Mono<Void> claim(String instanceId);

    /**
     * @return the id of the current holder, empty if the marker expired
     */
    Mono<String> holder();
}
