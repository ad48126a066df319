package com.xksgroup.conversionengine.config.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.conversionengine.config.security.response.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Réponse JSON pour les erreurs d'authentification (401) : token manquant, expiré ou
 * invalide.
 */
@Slf4j
public class CustomAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        log.warn("Erreur d'authentification: {} - Path: {}", authException.getMessage(), request.getRequestURI());

        String lowerMessage = authException.getMessage() != null
                ? authException.getMessage().toLowerCase(Locale.ROOT)
                : "";
        Map<String, Object> details = new LinkedHashMap<>();
        String errorType;
        String message;

        if (lowerMessage.contains("expired")) {
            errorType = "TokenExpired";
            message = "Le token d'authentification a expiré";
            details.put("reason", "Token expiré. Veuillez rafraîchir votre token.");
        } else if (lowerMessage.contains("malformed") || lowerMessage.contains("signature")) {
            errorType = "TokenInvalid";
            message = "Token d'authentification invalide";
            details.put("reason", "Le format ou la signature du token est invalide.");
        } else if (lowerMessage.contains("bearer") || lowerMessage.contains("full authentication")) {
            errorType = "TokenMissing";
            message = "Token d'authentification manquant";
            details.put("format", "Authorization: Bearer <votre-token>");
        } else {
            errorType = "AuthenticationException";
            message = "Authentification requise";
            details.put("exceptionType", authException.getClass().getSimpleName());
        }

        ApiError apiError = new ApiError(
                false,
                HttpServletResponse.SC_UNAUTHORIZED,
                errorType,
                message,
                details,
                OffsetDateTime.now().toString(),
                request.getRequestURI()
        );

        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), apiError);
    }
}
