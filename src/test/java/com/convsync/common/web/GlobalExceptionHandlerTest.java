package com.convsync.common.web;

import com.convsync.common.api.ApiCodes;
import com.convsync.common.api.Result;
import com.convsync.domain.AccessDeniedException;
import com.convsync.log.ConversationLogException;
import com.convsync.log.PublishInProgressException;
import com.convsync.sync.SyncStateStoreException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void illegalArgument_ShouldReturn400WithReason() {
        ResponseEntity<Result<Void>> resp = handler.handleBadRequest(new IllegalArgumentException("invalid_conversation_id"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.BAD_REQUEST);
        assertThat(resp.getBody().message()).isEqualTo("invalid_conversation_id");
    }

    @Test
    void missingParam_ShouldNameTheParameter() {
        ResponseEntity<Result<Void>> resp = handler.handleMissingParam(new MissingServletRequestParameterException("clientId", "String"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().message()).isEqualTo("missing_clientId");
    }

    @Test
    void jwt_ShouldReturn401() {
        ResponseEntity<Result<Void>> resp = handler.handleJwt(new JwtException("expired"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.UNAUTHORIZED);
    }

    @Test
    void accessDenied_ShouldReturn403() {
        ResponseEntity<Result<Void>> resp = handler.handleForbidden(new AccessDeniedException("forbidden"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.FORBIDDEN);
    }

    @Test
    void publishInProgress_ShouldReturn409() {
        ResponseEntity<Result<Void>> resp = handler.handleInProgress(new PublishInProgressException("m-1"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(resp.getBody().message()).isEqualTo("publish_in_progress");
    }

    @Test
    void storageFailures_ShouldReturn503() {
        ResponseEntity<Result<Void>> logDown = handler.handleUnavailable(new ConversationLogException("append_failed", new RuntimeException("boom")));
        ResponseEntity<Result<Void>> stateDown = handler.handleUnavailable(new SyncStateStoreException("get_failed", new RuntimeException("boom")));

        assertThat(logDown.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(stateDown.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(stateDown.getBody().code()).isEqualTo(ApiCodes.SERVICE_UNAVAILABLE);
        assertThat(stateDown.getBody().message()).isEqualTo("storage_unavailable");
    }

    @Test
    void unexpected_ShouldReturn500WithoutDetails() {
        ResponseEntity<Result<Void>> resp = handler.handleAny(new Exception("secret detail"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(resp.getBody().message()).isEqualTo("internal_error");
    }
}
