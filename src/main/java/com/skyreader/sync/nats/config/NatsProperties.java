package com.skyreader.sync.nats.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * NATS connection settings.
 *
 * <pre>
 * skyreader:
 *   nats:
 *     url: nats://localhost:4222
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *     tls: false
 * </pre>
 *
 * <p>Secrets should come from the environment, never from committed configuration.</p>
 */
@ConfigurationProperties(prefix = "skyreader.nats")
public class NatsProperties {

    private String url = "nats://localhost:4222";

    private String user;

    private String password;

    private String token;

    /** Path to a {@code .creds} file (JWT + NKey). */
    private String creds;

    private boolean tls = false;

    /** Connection name reported to the server. */
    private String connectionName = "skyreader-sync";

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }

    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }
}
