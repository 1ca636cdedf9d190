package com.pgcluster.ha.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("should render a cluster operation exception with its status and code")
    void clusterOperationException() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleClusterOperationException(new CannotRemovePrimaryException("10.0.0.1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).containsEntry("status", 409);
        assertThat(response.getBody()).containsEntry("code", CannotRemovePrimaryException.CODE);
        assertThat(response.getBody()).containsKey("timestamp");
        assertThat((String) response.getBody().get("message")).contains("10.0.0.1 cannot be removed");
    }

    @Test
    @DisplayName("should map a failed command to 502")
    void commandFailure() {
        CommandExecutionException ex = new CommandExecutionException("systemctl restart haproxy", 5, "unit not found");

        ResponseEntity<Map<String, Object>> response = handler.handleClusterOperationException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ex.getExitCode()).isEqualTo(5);
        assertThat((String) response.getBody().get("message"))
                .isEqualTo("Command 'systemctl restart haproxy' failed with exit code 5: unit not found");
    }

    @Test
    @DisplayName("should map a node that does not answer to 422")
    void nodeNotResponding() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleClusterOperationException(new NodeNotRespondingException("10.0.0.4"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    @DisplayName("should handle MethodArgumentNotValidException with field errors")
    void validationException() {
        BindingResult bindingResult = mock(BindingResult.class);
        FieldError fieldError = new FieldError("addNodeRequest", "address", "Node address is required");
        when(bindingResult.getAllErrors()).thenReturn(List.of(fieldError));

        MethodArgumentNotValidException ex = new MethodArgumentNotValidException((MethodParameter) null, bindingResult);

        ResponseEntity<Map<String, Object>> response = handler.handleValidationException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("message", "Invalid request body");
        @SuppressWarnings("unchecked")
        Map<String, String> errors = (Map<String, String>) response.getBody().get("errors");
        assertThat(errors).containsEntry("address", "Node address is required");
    }

    @Test
    @DisplayName("should hide file details of a failed config edit")
    void uncheckedIo() {
        ResponseEntity<Map<String, Object>> response = handler.handleUncheckedIOException(
                new UncheckedIOException("Failed to update /etc/haproxy/haproxy.cfg", new IOException("denied")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("message", "Local configuration file could not be updated");
    }

    @Test
    @DisplayName("should map IllegalStateException to 409")
    void illegalState() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleIllegalStateException(new IllegalStateException("DCS config is not valid JSON"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    @DisplayName("should not leak details of unexpected errors")
    void genericException() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(new RuntimeException("secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("message", "An unexpected error occurred");
    }
}
