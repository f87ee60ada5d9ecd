package org.civicroute.engine.api;

import okhttp3.Interceptor;
import okhttp3.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for AuthInterceptor.
 */
class AuthInterceptorTest {

    @Test
    @DisplayName("Should add a bearer token and replace any existing header")
    void shouldAddBearerToken() throws IOException {
        Interceptor.Chain chain = mock(Interceptor.Chain.class);
        Request original = new Request.Builder()
                .url("http://localhost/api/issues/1")
                .header("Authorization", "Basic stale")
                .build();
        when(chain.request()).thenReturn(original);

        new AuthInterceptor("engine-token").intercept(chain);

        ArgumentCaptor<Request> sent = ArgumentCaptor.forClass(Request.class);
        verify(chain).proceed(sent.capture());
        assertThat(sent.getValue().headers("Authorization")).containsExactly("Bearer engine-token");
        assertThat(sent.getValue().url()).isEqualTo(original.url());
    }
}
