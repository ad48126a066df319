package com.xksgroup.conversionengine.config.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.conversionengine.config.security.response.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Réponse JSON pour les accès refusés (403), par exemple un utilisateur sans rôle
 * {@code worker} qui appelle un callback de progression.
 */
@Slf4j
public class CustomAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {

        String user = request.getUserPrincipal() != null ? request.getUserPrincipal().getName() : "anonymous";
        log.warn("Accès refusé: {} - Path: {} - User: {}", accessDeniedException.getMessage(), request.getRequestURI(), user);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", "Vous n'avez pas les permissions nécessaires pour accéder à cette ressource.");
        details.put("authenticatedUser", user);

        ApiError apiError = new ApiError(
                false,
                HttpServletResponse.SC_FORBIDDEN,
                "AccessDenied",
                "Accès refusé",
                details,
                OffsetDateTime.now().toString(),
                request.getRequestURI()
        );

        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), apiError);
    }
}
