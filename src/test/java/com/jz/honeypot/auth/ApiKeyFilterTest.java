package com.jz.honeypot.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.honeypot.config.AuthProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyFilterTest {

    private AuthProperties props;
    private ApiKeyFilter filter;

    @BeforeEach
    void setUp() {
        props = new AuthProperties();
        props.setApiKey("s3cret");
        filter = new ApiKeyFilter(props, new ObjectMapper());
    }

    private MockHttpServletResponse run(MockHttpServletRequest req, MockFilterChain chain) throws Exception {
        MockHttpServletResponse resp = new MockHttpServletResponse();
        filter.doFilter(req, resp, chain);
        return resp;
    }

    @Test
    void correctKeyPassesThrough() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/honeypot");
        req.addHeader("x-api-key", "s3cret");
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse resp = run(req, chain);

        assertThat(resp.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isSameAs(req);
    }

    @Test
    void wrongOrMissingKeyIsUnauthorized() throws Exception {
        MockHttpServletRequest wrong = new MockHttpServletRequest("POST", "/api/honeypot");
        wrong.addHeader("x-api-key", "guess");
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse resp = run(wrong, chain);

        assertThat(resp.getStatus()).isEqualTo(401);
        assertThat(resp.getContentAsString()).contains("\"code\":401").contains("Invalid or missing API key");
        assertThat(chain.getRequest()).isNull();

        MockFilterChain chain2 = new MockFilterChain();
        assertThat(run(new MockHttpServletRequest("POST", "/api/honeypot"), chain2).getStatus()).isEqualTo(401);
        assertThat(chain2.getRequest()).isNull();
    }

    @Test
    void preflightAndUnprotectedPathsSkipCheck() throws Exception {
        MockFilterChain preflight = new MockFilterChain();
        run(new MockHttpServletRequest("OPTIONS", "/api/honeypot"), preflight);
        assertThat(preflight.getRequest()).isNotNull();

        MockFilterChain root = new MockFilterChain();
        run(new MockHttpServletRequest("GET", "/"), root);
        assertThat(root.getRequest()).isNotNull();
    }

    @Test
    void noConfiguredKeyDisablesCheck() throws Exception {
        props.setApiKey("");
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse resp = run(new MockHttpServletRequest("POST", "/api/honeypot"), chain);

        assertThat(resp.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isNotNull();
    }
}
