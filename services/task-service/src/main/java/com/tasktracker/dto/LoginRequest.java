package com.tasktracker.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * LoginRequest - Data Transfer Object for username/password login requests.
 * 
 * Usage:
 * <pre>
 * POST /api/auth/login
 * Content-Type: application/json
 * 
 * {
 *   "username": "alice",
 *   "password": "Secr3tPass!"
 * }
 * </pre>
 * 
 * Security Note:
 * Never log or persist the password field; it is excluded from toString().
 * 
 * @see com.tasktracker.controller.AuthController#login
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    /** Login name, case-sensitive. */
    @NotBlank(message = "Username is required")
    private String username;

    @ToString.Exclude
    @NotBlank(message = "Password is required")
    private String password;
}
