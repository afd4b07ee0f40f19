package com.handelsregister.scraper.web;

import com.handelsregister.scraper.model.ServiceToken;
import com.handelsregister.scraper.service.api.CallerRateLimiter;
import com.handelsregister.scraper.service.api.ServiceTokenService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Guards protected endpoints: verifies the service token, then charges the
 * caller's rate limit. Failures surface as exceptions and are rendered by
 * {@link ApiExceptionHandler}.
 */
@RequiredArgsConstructor
public class ServiceTokenInterceptor implements HandlerInterceptor {

    /** Request attribute holding the verified {@link ServiceToken}. */
    public static final String TOKEN_ATTRIBUTE = "serviceToken";

    private final ServiceTokenService tokens;

    private final CallerRateLimiter limiter;

    @Override
    public boolean preHandle(final HttpServletRequest request,
                             final HttpServletResponse response,
                             final Object handler) {
        ServiceToken token = tokens.verifyHeader(request.getHeader(HttpHeaders.AUTHORIZATION));
        limiter.acquire(request.getRemoteAddr());
        request.setAttribute(TOKEN_ATTRIBUTE, token);
        return true;
    }
}
