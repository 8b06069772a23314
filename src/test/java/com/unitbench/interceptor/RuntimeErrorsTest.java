package com.unitbench.interceptor;

import com.unitbench.model.ErrorLevel;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RuntimeErrorsTest {

    private static class Recorded {
        final ErrorLevel code;
        final String     message;
        final String     file;
        final int        line;
        final Map<String, Object> context;

        Recorded(ErrorLevel code, String message, String file, int line, Map<String, Object> context) {
            this.code    = code;
            this.message = message;
            this.file    = file;
            this.line    = line;
            this.context = context;
        }
    }

    @Test
    public void trigger_deliversToInstalledHandler() {
        List<Recorded> seen = new ArrayList<>();

        try (RuntimeErrors.Scope scope = RuntimeErrors.install(
                (code, message, file, line, context) -> seen.add(new Recorded(code, message, file, line, context)))) {
            RuntimeErrors.trigger(ErrorLevel.NOTICE, "undefined index", Map.of("key", "sku"));
        }

        assertThat(seen).hasSize(1);
        Recorded r = seen.get(0);
        assertThat(r.code).isEqualTo(ErrorLevel.NOTICE);
        assertThat(r.message).isEqualTo("undefined index");
        assertThat(r.file).isEqualTo("RuntimeErrorsTest.java");
        assertThat(r.line).isPositive();
        assertThat(r.context).containsEntry("key", "sku");
    }

    @Test
    public void scope_restoresPreviousHandlerInNestingOrder() {
        RuntimeErrorHandler before = RuntimeErrors.current();
        RuntimeErrorHandler outer  = (code, message, file, line, context) -> { };
        RuntimeErrorHandler inner  = (code, message, file, line, context) -> { };

        try (RuntimeErrors.Scope o = RuntimeErrors.install(outer)) {
            assertThat(RuntimeErrors.current()).isSameAs(outer);
            try (RuntimeErrors.Scope i = RuntimeErrors.install(inner)) {
                assertThat(RuntimeErrors.current()).isSameAs(inner);
                assertThat(i.getInstalled()).isSameAs(inner);
            }
            assertThat(RuntimeErrors.current()).isSameAs(outer);
        }
        assertThat(RuntimeErrors.current()).isSameAs(before);
    }

    @Test
    public void scope_restoresWhenBodyThrows() {
        RuntimeErrorHandler before = RuntimeErrors.current();

        assertThatThrownBy(() -> {
            try (RuntimeErrors.Scope scope = RuntimeErrors.install((code, message, file, line, context) -> { })) {
                throw new IllegalStateException("body failed");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(RuntimeErrors.current()).isSameAs(before);
    }

    @Test
    public void scope_closeIsIdempotent() {
        RuntimeErrorHandler before = RuntimeErrors.current();
        RuntimeErrors.Scope scope = RuntimeErrors.install((code, message, file, line, context) -> { });

        scope.close();
        scope.close();

        assertThat(RuntimeErrors.current()).isSameAs(before);
    }

    @Test
    public void trigger_withoutHandlerOnlyLogs() {
        RuntimeErrorHandler before = RuntimeErrors.current();
        if (before == null) {
            assertThatCode(() -> RuntimeErrors.trigger(ErrorLevel.ERROR, "nobody listening"))
                .doesNotThrowAnyException();
        }
    }

    @Test
    public void install_rejectsNull() {
        assertThatThrownBy(() -> RuntimeErrors.install(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
