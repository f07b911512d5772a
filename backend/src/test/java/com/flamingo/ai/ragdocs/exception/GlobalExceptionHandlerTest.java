package com.flamingo.ai.ragdocs.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

  @Mock private HttpServletRequest request;

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    when(request.getRequestURI()).thenReturn("/api/search");
  }

  private double errors(String type) {
    return meterRegistry.counter("api_errors_total", "error_type", type).count();
  }

  @Test
  @DisplayName("Unreachable store maps to 503 with the user message")
  void shouldMapUnreachableStore() {
    ResponseEntity<ApiError> response =
        handler.handleStoreUnreachable(
            new VectorStoreConnectionException("Connection refused: localhost:9200"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.STORE_UNREACHABLE);
    assertThat(response.getBody().getMessage()).doesNotContain("localhost");
    assertThat(response.getBody().getPath()).isEqualTo("/api/search");
    assertThat(response.getBody().getErrorId()).hasSize(8);
    assertThat(errors("store_unreachable")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Storage failure maps to 503")
  void shouldMapStorageFailure() {
    ResponseEntity<ApiError> response =
        handler.handleStorage(new StorageException("bulk insert failed"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.STORAGE_ERROR);
    assertThat(errors("storage_error")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Schema mismatch maps to 500 without leaking details")
  void shouldMapSchemaMismatch() {
    ResponseEntity<ApiError> response =
        handler.handleSchema(
            new SchemaException("docs_tech", "Field embedding is keyword, expected dense_vector"),
            request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.SCHEMA_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("dense_vector");
  }

  @Test
  @DisplayName("Open circuit maps to 503")
  void shouldMapOpenCircuit() {
    CallNotPermittedException ex =
        CallNotPermittedException.createCallNotPermittedException(
            CircuitBreaker.ofDefaults("elasticsearch"));

    ResponseEntity<ApiError> response = handler.handleCircuitOpen(ex, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.STORE_CIRCUIT_OPEN);
    assertThat(errors("circuit_open")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Rejected search maps to 400 with its user message")
  void shouldMapRejectedSearch() {
    ResponseEntity<ApiError> response =
        handler.handleSearch(
            new SearchException("topK was 0", "The number of results must be positive."), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getMessage())
        .isEqualTo("The number of results must be positive.");
  }

  @Test
  @DisplayName("Illegal argument maps to 400")
  void shouldMapIllegalArgument() {
    ResponseEntity<ApiError> response =
        handler.handleIllegalArgument(
            new IllegalArgumentException("Technology must not be blank"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.VALIDATION_ERROR);
    assertThat(response.getBody().getMessage()).isEqualTo("Technology must not be blank");
  }

  @Test
  @DisplayName("Unexpected error maps to 500 with a generic message")
  void shouldMapUnexpectedError() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("boom"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INTERNAL_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("boom");
    assertThat(errors("internal_error")).isEqualTo(1.0);
  }
}
