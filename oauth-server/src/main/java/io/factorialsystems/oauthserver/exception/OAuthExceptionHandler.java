package io.factorialsystems.oauthserver.exception;

import io.factorialsystems.oauthserver.dto.OAuthErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Renders failures as RFC 6749 {@code {error, error_description}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class OAuthExceptionHandler {

    @ExceptionHandler(OAuthException.class)
    public ResponseEntity<OAuthErrorResponse> handleOAuthException(OAuthException e) {
        log.debug("OAuth request rejected: {}", e.getMessage());
        return render(e.getError(), e.getDescription());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<OAuthErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("Store failure while handling OAuth request", e);
        return render(OAuthError.SERVER_ERROR, "The authorization server encountered an internal error");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<OAuthErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String description = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return render(OAuthError.INVALID_REQUEST, description);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<OAuthErrorResponse> handleMalformedRequest(Exception e) {
        log.debug("Malformed OAuth request: {}", e.getMessage());
        return render(OAuthError.INVALID_REQUEST, "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<OAuthErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error while handling OAuth request", e);
        return render(OAuthError.SERVER_ERROR, "The authorization server encountered an internal error");
    }

    private ResponseEntity<OAuthErrorResponse> render(OAuthError error, String description) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(error.getStatus())
                .cacheControl(CacheControl.noStore());

        if (error == OAuthError.INVALID_CLIENT) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"oauth\"");
        } else if (error == OAuthError.INVALID_TOKEN) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        }

        return builder.body(new OAuthErrorResponse(error.getCode(), description));
    }
}
