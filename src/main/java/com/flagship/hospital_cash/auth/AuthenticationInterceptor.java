package com.flagship.hospital_cash.auth;

import com.flagship.hospital_cash.exception.UnauthorizedException;
import com.flagship.hospital_cash.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.MDC;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects requests that do not carry a logged-in session.
 *
 * Registered for the API paths only; the login endpoint stays open.
 */
public class AuthenticationInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        HttpSession session = request.getSession(false);

        if (session == null
                || !(session.getAttribute(SessionAttributes.USER) instanceof SessionUser user)
                || !(session.getAttribute(SessionAttributes.PROJECT) instanceof SessionProject)) {
            throw new UnauthorizedException("You must be logged in to access this resource.");
        }

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, String.valueOf(user.getId()));
        return true;
    }
}
