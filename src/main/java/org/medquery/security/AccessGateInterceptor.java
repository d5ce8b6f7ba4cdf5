package org.medquery.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.medquery.models.enums.Role;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.EnumSet;
import java.util.List;

/**
 * Runs the {@link AccessGate} for handlers annotated with {@link RequiresRole}. It runs before
 * argument resolution, so request bodies and uploads are not read for rejected callers.
 */
@Component
@RequiredArgsConstructor
public class AccessGateInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = "medquery.principal";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessGate accessGate;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RequiresRole requiresRole = resolveAnnotation(handlerMethod);
        if (requiresRole == null) {
            return true;
        }

        Principal principal = accessGate.authorize(extractCredential(request), EnumSet.copyOf(List.of(requiresRole.value())));
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        return true;
    }

    private RequiresRole resolveAnnotation(HandlerMethod handlerMethod) {
        RequiresRole onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), RequiresRole.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequiresRole.class);
    }

    private String extractCredential(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }
}
