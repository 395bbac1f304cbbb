package com.tasktracker.dto;

import com.tasktracker.entity.User;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Payload of POST /api/auth/register. The minimum password length is configuration
 * (auth.password.min-length) and is checked by AuthService.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank(message = "Username is required")
    @Size(max = User.MAX_USERNAME_LENGTH, message = "Username cannot exceed 100 characters")
    private String username;

    @ToString.Exclude
    @NotBlank(message = "Password is required")
    private String password;
}
