package com.thorbis.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("RequestContextHolder")
class RequestContextHolderTest {

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Nested
    @DisplayName("set() / get()")
    class SetAndGet {

        @Test
        @DisplayName("binds context and mirrors it into MDC")
        void populatesMdc() {
            var ctx = new RequestContext("corr-1", "biz-1", "user-1", "sess-1", "req-1");

            RequestContextHolder.set(ctx);

            assertThat(RequestContextHolder.get()).contains(ctx);
            assertThat(MDC.get(RequestContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(RequestContext.MDC_TENANT_ID)).isEqualTo("biz-1");
            assertThat(MDC.get(RequestContext.MDC_PRINCIPAL_ID)).isEqualTo("user-1");
            assertThat(MDC.get(RequestContext.MDC_SESSION_ID)).isEqualTo("sess-1");
            assertThat(MDC.get(RequestContext.MDC_REQUEST_ID)).isEqualTo("req-1");
        }

        @Test
        @DisplayName("null fields remove stale MDC keys")
        void nullFieldsRemoveKeys() {
            RequestContextHolder.set(new RequestContext("corr-1", "biz-1", "user-1", null, null));
            RequestContextHolder.set(RequestContext.of("corr-2"));

            assertThat(MDC.get(RequestContext.MDC_CORRELATION_ID)).isEqualTo("corr-2");
            assertThat(MDC.get(RequestContext.MDC_TENANT_ID)).isNull();
            assertThat(MDC.get(RequestContext.MDC_PRINCIPAL_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> RequestContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects blank correlation ID at construction")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> RequestContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("clear()")
    class Clear {

        @Test
        @DisplayName("removes context and MDC keys")
        void removesEverything() {
            RequestContextHolder.set(new RequestContext("corr-1", "biz-1", "user-1", "sess-1", "req-1"));

            RequestContextHolder.clear();

            assertThat(RequestContextHolder.get()).isEmpty();
            assertThat(RequestContextHolder.currentCorrelationId()).isNull();
            assertThat(MDC.get(RequestContext.MDC_TENANT_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("callWithContext()")
    class CallWithContext {

        @Test
        @DisplayName("binds context for the duration of the call and clears afterwards")
        void scopedBinding() {
            String seen = RequestContextHolder.callWithContext(
                    RequestContext.of("scoped"), RequestContextHolder::currentCorrelationId);

            assertThat(seen).isEqualTo("scoped");
            assertThat(RequestContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("restores the previously bound context")
        void restoresPrevious() {
            RequestContextHolder.set(RequestContext.of("outer"));

            RequestContextHolder.callWithContext(RequestContext.of("inner"), () -> null);

            assertThat(RequestContextHolder.currentCorrelationId()).isEqualTo("outer");
        }

        @Test
        @DisplayName("withCaller() keeps correlation and request IDs")
        void withCallerCopies() {
            var ctx = new RequestContext("corr", null, null, null, "req")
                    .withCaller("biz-9", "user-9", "sess-9");

            assertThat(ctx.correlationId()).isEqualTo("corr");
            assertThat(ctx.requestId()).isEqualTo("req");
            assertThat(ctx.tenantId()).isEqualTo("biz-9");
            assertThat(ctx.principalId()).isEqualTo("user-9");
            assertThat(ctx.sessionId()).isEqualTo("sess-9");
        }
    }
}
