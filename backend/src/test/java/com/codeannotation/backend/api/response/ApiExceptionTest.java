package com.codeannotation.backend.api.response;

import com.codeannotation.backend.repo.StoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionTest {

    @Test
    void newHttpError_joinsPartsWithSpaces() {
        ApiException e = Responses.newHttpError(400, "wrong", "format", "here");

        assertThat(e.statusCode()).isEqualTo(400);
        assertThat(e.title()).isEqualTo("wrong format here");
        assertThat(e.getMessage()).isEqualTo("wrong format here");
        assertThat(e).isInstanceOf(RuntimeException.class).isInstanceOf(HttpError.class);
    }

    @Test
    @DisplayName("an empty title falls back to the reason phrase of the status")
    void message_fallsBackToStatusText() {
        assertThat(Responses.newHttpError(404).getMessage()).isEqualTo("Not Found");
        assertThat(ErrorKind.UNAUTHENTICATED.error().getMessage()).isEqualTo("Unauthorized");
    }

    @Test
    @DisplayName("an empty title with an unknown status falls back to the 500 reason phrase")
    void message_fallsBackToInternalServerError() {
        assertThat(Responses.newHttpError(0).getMessage()).isEqualTo("Internal Server Error");
        assertThat(Responses.newHttpError(799).getMessage()).isEqualTo("Internal Server Error");
    }

    @Test
    void toDetail_carriesRenderedTitleAndDetails() {
        ErrorDetail plain = Responses.newHttpError(404).toDetail();
        ErrorDetail detailed = ErrorKind.BAD_REQUEST.error("invalid request body").withDetails("line 1").toDetail();

        assertThat(plain).isEqualTo(new ErrorDetail(404, "Not Found", null));
        assertThat(detailed).isEqualTo(new ErrorDetail(400, "invalid request body", "line 1"));
    }

    @Test
    void wrap_keepsCauseOutOfTheTitle() {
        StoreException cause = new StoreException("connection refused");

        ApiException e = ErrorKind.INTERNAL.wrap("error counting assignments", cause);

        assertThat(e.statusCode()).isEqualTo(500);
        assertThat(e.getMessage()).isEqualTo("error counting assignments");
        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.details()).isEmpty();
    }
}
