package com.campus.lending.controller;

import com.campus.lending.dto.request.UpdateUserStatusRequest;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.dto.response.UserResponse;
import com.campus.lending.security.UserPrincipal;
import com.campus.lending.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "User directory and account status")
public class UserController {

    private final UserService userService;

    @GetMapping
    @Operation(summary = "List users", description = "Staff only. Use staffOnly=true to list possible ticket assignees.")
    @ApiResponse(responseCode = "200", description = "Users listed")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    public ResponseEntity<PagedResponse<UserResponse>> findAll(
            @Parameter(description = "Only technical staff and administrators")
            @RequestParam(defaultValue = "false") boolean staffOnly,
            @PageableDefault(sort = "fullName") Pageable pageable,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(
            PagedResponse.from(userService.findAll(principal.toActor(), staffOnly, pageable)));
    }

    @PatchMapping("/{id}/status")
    @Operation(summary = "Activate or deactivate an account", description = "System administrators only.")
    @ApiResponse(responseCode = "200", description = "Status updated")
    @ApiResponse(responseCode = "403", description = "Caller is not a system administrator")
    @ApiResponse(responseCode = "404", description = "User not found")
    public ResponseEntity<UserResponse> updateStatus(@PathVariable Long id,
                                                     @Valid @RequestBody UpdateUserStatusRequest request,
                                                     @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(userService.updateStatus(principal.toActor(), id, request.status()));
    }
}
