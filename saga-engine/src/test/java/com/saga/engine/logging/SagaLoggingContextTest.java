package com.saga.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class SagaLoggingContextTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    @DisplayName("Saga context sets identity and a trace id, and clears them on close")
    void sagaContext() {
        try (var ctx = SagaLoggingContext.forSaga("saga-1", "order")) {
            assertThat(MDC.get(SagaLoggingContext.SAGA_ID)).isEqualTo("saga-1");
            assertThat(MDC.get(SagaLoggingContext.SAGA_TYPE)).isEqualTo("order");
            assertThat(SagaLoggingContext.getTraceId()).hasSize(8);
        }
        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }

    @Test
    @DisplayName("Nested contexts restore the outer values")
    void nesting() {
        MDC.put(SagaLoggingContext.TRACE_ID, "caller-trace");
        try (var outer = SagaLoggingContext.forSaga("outer", "order")) {
            try (var inner = SagaLoggingContext.forSaga("inner", "refund")) {
                assertThat(SagaLoggingContext.getSagaId()).isEqualTo("inner");
                try (var step = SagaLoggingContext.forStep("charge", 2)) {
                    assertThat(MDC.get(SagaLoggingContext.ATTEMPT)).isEqualTo("2");
                }
                assertThat(MDC.get(SagaLoggingContext.STEP)).isNull();
            }
            assertThat(SagaLoggingContext.getSagaId()).isEqualTo("outer");
            assertThat(MDC.get(SagaLoggingContext.SAGA_TYPE)).isEqualTo("order");
        }
        assertThat(SagaLoggingContext.getSagaId()).isNull();
        assertThat(SagaLoggingContext.getTraceId()).isEqualTo("caller-trace");
    }
}
