package com.skyreader.sync.nats.config;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.KeyValueManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Wires the shared NATS {@link Connection} and key-value management API.
 *
 * <h2>Connection strategy</h2>
 * <ul>
 *   <li>Without auth or TLS settings, connect with the plain URL.</li>
 *   <li>Otherwise build {@link Options} with the configured token, user/password, creds file and TLS flag.</li>
 *   <li>Reconnects forever; the connection is closed on context shutdown.</li>
 * </ul>
 *
 * <p>Secrets are never logged; only the URL and which auth mode is in use.</p>
 */
@Configuration
@EnableConfigurationProperties({
        NatsProperties.class,        // url, auth, tls
        KvBucketsProperties.class,   // sessions / coordination bucket specs
        KvBootstrapProperties.class  // bucket validation strictness
})
public class NatsConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties props) throws Exception {
        String url = props.getUrl();

        boolean wantsOptions = notBlank(props.getUser()) || notBlank(props.getPassword())
                || notBlank(props.getToken()) || notBlank(props.getCreds()) || props.isTls();

        Options.Builder builder = new Options.Builder()
                .server(url)
                .connectionName(props.getConnectionName())
                .maxReconnects(-1)
                .reconnectWait(Duration.ofSeconds(2));

        if (!wantsOptions) {
            log.info("Connecting to NATS url={} auth=none", url);
            return Nats.connect(builder.build());
        }

        String mode;
        if (notBlank(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
            mode = "creds";
        } else if (notBlank(props.getToken())) {
            builder.token(props.getToken().toCharArray());
            mode = "token";
        } else {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser(), pass);
            mode = "user";
        }

        if (props.isTls()) {
            builder.secure();
        }

        log.info("Connecting to NATS url={} auth={} tls={}", url, mode, props.isTls());
        return Nats.connect(builder.build());
    }

    @Bean
    public KeyValueManagement keyValueManagement(Connection connection) throws Exception {
        return connection.keyValueManagement();
    }

    private static boolean notBlank(String v) {
        return v != null && !v.isBlank();
    }
}
