package com.campus.lending.controller.handler;

import com.campus.lending.dto.response.ErrorResponse;
import com.campus.lending.exception.DuplicateEmailException;
import com.campus.lending.exception.DuplicateSerialNumberException;
import com.campus.lending.exception.EquipmentInUseException;
import com.campus.lending.exception.EquipmentUnavailableException;
import com.campus.lending.exception.InsufficientPrivilegeException;
import com.campus.lending.exception.InvalidReservationStateException;
import com.campus.lending.exception.InvalidTicketStateException;
import com.campus.lending.exception.InvalidTimeWindowException;
import com.campus.lending.exception.LoanAlreadyExistsException;
import com.campus.lending.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final Map<String, String> UNIQUE_CONSTRAINT_MESSAGES = Map.of(
        "uk_users_email", "Email already registered",
        "uk_equipment_serial_number", "Serial number already exists",
        "uk_loans_reservation", "Reservation already has a loan",
        "uk_reservation_items_pair", "Equipment is listed twice in the reservation"
    );

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(EquipmentUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(EquipmentUnavailableException ex, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(HttpStatus.CONFLICT, ex.getMessage(), request.getRequestURI())
            .withDetails(ex.getUnavailableItems());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler({
        DuplicateEmailException.class,
        DuplicateSerialNumberException.class,
        EquipmentInUseException.class,
        LoanAlreadyExistsException.class,
        InvalidReservationStateException.class,
        InvalidTicketStateException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex, HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientPrivilegeException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientPrivilege(InsufficientPrivilegeException ex,
                                                                      HttpServletRequest request) {
        log.debug("Denied on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.FORBIDDEN, ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return error(HttpStatus.FORBIDDEN, "Access denied", request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex, HttpServletRequest request) {
        log.info("Authentication failed on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "Invalid email or password, or account inactive", request);
    }

    @ExceptionHandler({InvalidTimeWindowException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList();
        ErrorResponse body = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Validation failed", request.getRequestURI())
            .withFieldErrors(fieldErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                           HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                             HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST,
            "Parameter '" + ex.getName() + "' has an invalid value: " + ex.getValue(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                 HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "Missing parameter '" + ex.getParameterName() + "'", request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                              HttpServletRequest request) {
        String constraint = ex.getCause() instanceof ConstraintViolationException cve ? cve.getConstraintName() : null;
        String message = constraint != null ? UNIQUE_CONSTRAINT_MESSAGES.get(constraint) : null;
        if (message != null) {
            return error(HttpStatus.CONFLICT, message, request);
        }
        log.warn("Data integrity violation on {} (constraint {})", request.getRequestURI(), constraint);
        return error(HttpStatus.BAD_REQUEST, "Data integrity violation", request);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                               HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "Record was changed by another request, retry", request);
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handlePessimisticLock(PessimisticLockingFailureException ex,
                                                                HttpServletRequest request) {
        log.warn("Lock wait timed out on {}", request.getRequestURI());
        return error(HttpStatus.CONFLICT, "Equipment is being booked by another request, retry", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, message, request.getRequestURI()));
    }
}
