/**
 * OpenAlex works API configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.scholarly_dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "openalex.api")
public class OpenAlexConfigurationProperties {
    private String baseUrl = "https://api.openalex.org/works";
    private String mailto;
    private int maxPerPage = 200;
    private int defaultPerPage = 200;
    private Duration timeout = Duration.ofSeconds(30);

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getMailto() { return mailto; }
    public void setMailto(String mailto) { this.mailto = mailto; }

    public int getMaxPerPage() { return maxPerPage; }
    public void setMaxPerPage(int maxPerPage) { this.maxPerPage = maxPerPage; }

    public int getDefaultPerPage() { return defaultPerPage; }
    public void setDefaultPerPage(int defaultPerPage) { this.defaultPerPage = defaultPerPage; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    /**
     * Backoff for transient failures (5xx, timeouts, transport errors). Zero attempts disables retries.
     */
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double jitter = 0.5;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
    }
}
