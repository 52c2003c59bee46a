package com.olympiadregistration.interfaces.api.exception;

import com.olympiadregistration.domain.exception.BulkImportException;
import com.olympiadregistration.domain.exception.ErrorKind;
import com.olympiadregistration.domain.exception.RecordNotFoundException;
import com.olympiadregistration.domain.exception.UniquenessViolationException;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void every_error_kind_has_a_status() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.REQUIRED_FIELD_MISSING));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.FORMAT_INVALID));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.REFERENCE_INVALID));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.UNIQUENESS_VIOLATION));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.STATE_CONFLICT));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.RACE_CONDITION));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(ErrorKind.PERMISSION_DENIED));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorKind.NOT_FOUND));
    }

    @Test
    void registration_message_returned_verbatim_with_row() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/bulk/countries");

        ResponseEntity<ErrorResponse> response = handler.handleRegistration(
            new BulkImportException(3, new UniquenessViolationException("duplicate value of Code")), request);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        ErrorResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("row 3: duplicate value of Code", body.getMessage());
        assertEquals("UNIQUENESS_VIOLATION", body.getKind());
        assertEquals(3, body.getRow());
        assertEquals("/api/v1/bulk/countries", body.getPath());
    }

    @Test
    void not_found_has_no_row() {
        ResponseEntity<ErrorResponse> response = handler.handleRegistration(
            new RecordNotFoundException("Country not found: 9"), new MockHttpServletRequest("GET", "/api/v1/countries/9"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNull(response.getBody().getRow());
    }
}
