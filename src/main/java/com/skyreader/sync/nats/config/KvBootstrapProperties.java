package com.skyreader.sync.nats.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Controls how strictly existing key-value buckets are validated at startup.
 *
 * <p>With {@code failOnMismatch=true} a bucket whose TTL, storage or replica count drifted from the declared
 * spec stops the application; otherwise the drift is logged and startup continues. Existing buckets are
 * never modified.</p>
 */
@ConfigurationProperties(prefix = "skyreader.nats.bootstrap")
public class KvBootstrapProperties {

	private boolean enabled = true;

	private boolean failOnMismatch = false;

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public boolean isFailOnMismatch() {
		return failOnMismatch;
	}

	public void setFailOnMismatch(boolean failOnMismatch) {
		this.failOnMismatch = failOnMismatch;
	}
}
