package agentauth.web;

import agentauth.exceptions.BaseException;
import agentauth.exceptions.InvalidClientMetadataException;
import agentauth.exceptions.InvalidTokenException;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.ServletWebRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as an OAuth error body {@code {error, error_description}}. Unexpected failures
 * become {@code server_error} without exposing their cause.
 */
@RestController
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    private static final Log LOG = LogFactory.getLog(ErrorController.class);

    private final DefaultErrorAttributes errorAttributes;

    public ErrorController() {
        this.errorAttributes = new DefaultErrorAttributes();
    }

    @RequestMapping("${server.error.path:${error.path:/error}}")
    public ResponseEntity<Map<String, Object>> error(HttpServletRequest request) {
        ServletWebRequest webRequest = new ServletWebRequest(request);
        Map<String, Object> attributes = errorAttributes.getErrorAttributes(webRequest, ErrorAttributeOptions.defaults());
        Throwable error = errorAttributes.getError(webRequest);
        while (error instanceof ServletException && error.getCause() != null) {
            error = error.getCause();
        }
        String path = String.valueOf(attributes.getOrDefault("path", ""));
        Object statusAttribute = attributes.get("status");
        int status = statusAttribute instanceof Integer ? (Integer) statusAttribute : 500;

        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl(CacheControl.noStore());
        headers.setPragma("no-cache");
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new LinkedHashMap<>();
        HttpStatus statusCode;
        if (error instanceof BaseException) {
            BaseException baseException = (BaseException) error;
            ResponseStatus annotation = AnnotationUtils.findAnnotation(error.getClass(), ResponseStatus.class);
            statusCode = annotation != null ? annotation.value() : HttpStatus.BAD_REQUEST;
            LOG.warn(String.format("%s %s: %s", path, baseException.getErrorCode(), error.getMessage()));
            body.put("error", baseException.getErrorCode());
            body.put("error_description", error.getMessage());
            if (error instanceof InvalidTokenException) {
                headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
            }
        } else if (isMalformedRequest(error)) {
            statusCode = HttpStatus.BAD_REQUEST;
            LOG.warn(String.format("%s malformed request: %s", path, error.getMessage()));
            body.put("error", path.contains("register") ?
                    InvalidClientMetadataException.INVALID_CLIENT_METADATA : "invalid_request");
            body.put("error_description", "Malformed request");
        } else if (status >= 400 && status < 500) {
            statusCode = HttpStatus.valueOf(status);
            body.put("error", statusCode == HttpStatus.NOT_FOUND ? "not_found" : "invalid_request");
            body.put("error_description", statusCode.getReasonPhrase());
        } else {
            statusCode = HttpStatus.INTERNAL_SERVER_ERROR;
            LOG.error(String.format("Error has occurred at %s", path), error);
            body.put("error", "server_error");
            body.put("error_description", "Internal server error");
        }
        return new ResponseEntity<>(body, headers, statusCode);
    }

    private boolean isMalformedRequest(Throwable error) {
        return error instanceof HttpMessageNotReadableException ||
                error instanceof HttpMediaTypeNotSupportedException ||
                error instanceof MissingServletRequestParameterException;
    }
}
