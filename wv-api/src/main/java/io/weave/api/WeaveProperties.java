package io.weave.api;

import io.weave.governance.ApprovalStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Settings under {@code weave.*}. */
@ConfigurationProperties(prefix = "weave")
public class WeaveProperties {

    private final Approval approval = new Approval();
    private final Stream stream = new Stream();

    public Approval getApproval() {
        return approval;
    }

    public Stream getStream() {
        return stream;
    }

    public static class Approval {
        /** Deadline for yields submitted without one. */
        private Duration defaultTimeout = Duration.ofMinutes(5);
        private ApprovalStrategy defaultStrategy = ApprovalStrategy.ALL;

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public ApprovalStrategy getDefaultStrategy() {
            return defaultStrategy;
        }

        public void setDefaultStrategy(ApprovalStrategy defaultStrategy) {
            this.defaultStrategy = defaultStrategy;
        }
    }

    public static class Stream {
        /** Lifetime of an SSE connection. */
        private Duration timeout = Duration.ofMinutes(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
