package com.campus.lending.controller;

import com.campus.lending.dto.request.CreateLoanRequest;
import com.campus.lending.dto.response.LoanResponse;
import com.campus.lending.dto.response.LoanReturnResponse;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.entity.LoanState;
import com.campus.lending.security.UserPrincipal;
import com.campus.lending.service.LoanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
@Tag(name = "Loans", description = "Checkout and return of reserved equipment (staff only)")
public class LoanController {

    private final LoanService loanService;

    @PostMapping
    @Operation(summary = "Create a loan", description = "Checks out the equipment of a reservation. "
        + "A pending reservation is approved; due date defaults to three days after checkout.")
    @ApiResponse(responseCode = "201", description = "Loan created")
    @ApiResponse(responseCode = "400", description = "Due date not after checkout")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    @ApiResponse(responseCode = "409", description = "Reservation denied or already loaned")
    public ResponseEntity<LoanResponse> create(@Valid @RequestBody CreateLoanRequest request,
                                               @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(loanService.create(principal.toActor(), request));
    }

    @PatchMapping("/{id}/return")
    @Operation(summary = "Mark a loan returned", description = "Computes the overdue fee. "
        + "Returning an already returned loan changes nothing.")
    @ApiResponse(responseCode = "200", description = "Loan returned, or already returned")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    public ResponseEntity<LoanReturnResponse> returnLoan(@PathVariable Long id,
                                                         @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(loanService.returnLoan(principal.toActor(), id));
    }

    @GetMapping
    @Operation(summary = "List loans")
    public ResponseEntity<PagedResponse<LoanResponse>> findAll(
            @Parameter(description = "Filter by state (OUTSTANDING, RETURNED)") @RequestParam(required = false) LoanState state,
            @PageableDefault(sort = "checkedOutAt", direction = Sort.Direction.DESC) Pageable pageable,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(PagedResponse.from(loanService.findAll(principal.toActor(), state, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get loan by ID")
    @ApiResponse(responseCode = "200", description = "Loan found")
    @ApiResponse(responseCode = "404", description = "Loan not found")
    public ResponseEntity<LoanResponse> findById(@PathVariable Long id,
                                                 @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(loanService.findById(principal.toActor(), id));
    }
}
