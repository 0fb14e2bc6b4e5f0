package com.example.cloudmedia.security;

import com.example.cloudmedia.exception.TokenException;
import com.example.cloudmedia.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BearerTokenInterceptorTest {

    @Mock
    private TokenService tokenService;

    @InjectMocks
    private BearerTokenInterceptor interceptor;

    @Test
    void should_ExposeCaller_When_TokenIsValid() {
        when(tokenService.verify("good")).thenReturn(new TokenClaims("user-1", "a@x.com"));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/media");
        request.addHeader("Authorization", "Bearer good");

        boolean proceed = interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

        assertThat(proceed).isTrue();
        assertThat(request.getAttribute(BearerTokenInterceptor.CALLER_ATTRIBUTE)).isEqualTo("user-1");
    }

    @Test
    void should_Reject_When_HeaderIsMissingOrNotBearer() {
        MockHttpServletRequest missing = new MockHttpServletRequest("GET", "/api/media");
        MockHttpServletRequest basic = new MockHttpServletRequest("GET", "/api/media");
        basic.addHeader("Authorization", "Basic dXNlcjpwdw==");
        MockHttpServletRequest empty = new MockHttpServletRequest("GET", "/api/media");
        empty.addHeader("Authorization", "Bearer   ");

        assertThatThrownBy(() -> interceptor.preHandle(missing, new MockHttpServletResponse(), new Object()))
            .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> interceptor.preHandle(basic, new MockHttpServletResponse(), new Object()))
            .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> interceptor.preHandle(empty, new MockHttpServletResponse(), new Object()))
            .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(tokenService);
    }

    @Test
    void should_PropagateTokenFailure_When_TokenIsRejected() {
        when(tokenService.verify("stale"))
            .thenThrow(new TokenException(TokenException.Reason.EXPIRED, "Token has expired"));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/media");
        request.addHeader("Authorization", "Bearer stale");

        assertThatThrownBy(() -> interceptor.preHandle(request, new MockHttpServletResponse(), new Object()))
            .isInstanceOf(TokenException.class)
            .extracting("code").isEqualTo("TOKEN_EXPIRED");
        assertThat(request.getAttribute(BearerTokenInterceptor.CALLER_ATTRIBUTE)).isNull();
    }

    @Test
    void should_LetPreflightThrough_When_MethodIsOptions() {
        MockHttpServletRequest preflight = new MockHttpServletRequest("OPTIONS", "/api/media");

        assertThat(interceptor.preHandle(preflight, new MockHttpServletResponse(), new Object())).isTrue();
        verifyNoInteractions(tokenService);
    }
}
