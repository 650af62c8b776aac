package org.relaychat.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JwtHandshakeInterceptorTest {

    @Mock
    private JwtUtil jwtUtil;

    @InjectMocks
    private JwtHandshakeInterceptor interceptor;

    private MockHttpServletRequest servletRequest;
    private MockHttpServletResponse servletResponse;
    private final Map<String, Object> attributes = new HashMap<>();

    @BeforeEach
    void setUp() {
        servletRequest = new MockHttpServletRequest("GET", "/ws/info");
        servletResponse = new MockHttpServletResponse();
    }

    private boolean handshake() {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse), null, attributes);
    }

    @Test
    void tokenInQuery_shouldAcceptAndKeepUserId() {
        servletRequest.setQueryString("token=abc.def.ghi");
        when(jwtUtil.validateToken("abc.def.ghi")).thenReturn(true);
        when(jwtUtil.extractUserId("abc.def.ghi")).thenReturn(42L);

        assertThat(handshake()).isTrue();

        assertThat(attributes).containsEntry(JwtHandshakeInterceptor.TOKEN_ATTR, "abc.def.ghi")
                .containsEntry(JwtHandshakeInterceptor.USER_ID_ATTR, 42L);
    }

    @Test
    void bearerHeader_shouldBeUsedWithoutQueryToken() {
        servletRequest.addHeader("Authorization", "Bearer hdr.tok.en");
        when(jwtUtil.validateToken("hdr.tok.en")).thenReturn(true);
        when(jwtUtil.extractUserId("hdr.tok.en")).thenReturn(7L);

        assertThat(handshake()).isTrue();
        assertThat(attributes).containsEntry(JwtHandshakeInterceptor.USER_ID_ATTR, 7L);
    }

    @Test
    void invalidToken_shouldRejectWith401() {
        servletRequest.setQueryString("token=expired");
        when(jwtUtil.validateToken("expired")).thenReturn(false);

        assertThat(handshake()).isFalse();

        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
        verify(jwtUtil, never()).extractUserId(anyString());
    }

    @Test
    void missingToken_shouldRejectWithoutCallingJwt() {
        servletRequest.addHeader("Authorization", "Basic xyz");

        assertThat(handshake()).isFalse();

        assertThat(servletResponse.getStatus()).isEqualTo(401);
        verifyNoInteractions(jwtUtil);
    }
}
