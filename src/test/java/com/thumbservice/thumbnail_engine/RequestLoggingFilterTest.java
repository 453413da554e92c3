package com.thumbservice.thumbnail_engine;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLoggingFilterTest {

    @Test
    void requestUrlIsInMdcOnlyWhileTheRequestRuns() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/42/");
        request.setQueryString("color=true&width=300");
        AtomicReference<String> seen = new AtomicReference<>();

        new RequestLoggingFilter().doFilter(request, new MockHttpServletResponse(),
            (req, res) -> seen.set(MDC.get(RequestLoggingFilter.MDC_URL_KEY)));

        assertThat(seen.get()).isEqualTo("http://localhost/42/?color=true&width=300");
        assertThat(MDC.get(RequestLoggingFilter.MDC_URL_KEY)).isNull();
    }
}
