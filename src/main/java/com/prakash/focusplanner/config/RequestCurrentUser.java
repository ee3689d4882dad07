package com.prakash.focusplanner.config;

import com.prakash.focusplanner.service.CurrentUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * Resolves the current user from the configured request header, falling back to
 * {@code focus.user.default-id}. Outside a request only the fallback applies.
 */
@Component
public class RequestCurrentUser implements CurrentUser {

    private final FocusProperties properties;

    @Autowired
    public RequestCurrentUser(FocusProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> currentUserId() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servletAttributes) {
            HttpServletRequest request = servletAttributes.getRequest();
            String header = request.getHeader(properties.getUser().getHeader());
            if (header != null && !header.isBlank()) {
                return Optional.of(header.trim());
            }
        }
        String defaultId = properties.getUser().getDefaultId();
        return defaultId == null || defaultId.isBlank() ? Optional.empty() : Optional.of(defaultId);
    }
}
