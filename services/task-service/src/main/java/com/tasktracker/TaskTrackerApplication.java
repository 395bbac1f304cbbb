package com.tasktracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * TaskTrackerApplication - Main entry point for the Task Tracker service.
 * 
 * This service backs the task-tracking UI and is responsible for:
 * - Username/password registration and login
 * - Issuing and validating short-lived signed JWT bearer tokens
 * - Resolving the caller's identity once per request
 * - Owner-scoped CRUD on personal tasks (no cross-user visibility)
 * 
 * Architecture Context:
 * - Runs on port 8080 (configured in application.yml)
 * - Connects to PostgreSQL for users and tasks (schema managed by Flyway)
 * - Stateless design - the server holds no session or token state
 * 
 * Startup Contract:
 * All security configuration (jwt.*, auth.password.*) is bound and validated while
 * the context starts. A missing or weak signing secret aborts startup instead of
 * failing on the first login.
 * 
 * The default in-memory UserDetailsService is excluded: identities come from the
 * bearer token filter, never from form or basic login.
 * 
 * API Base Path: /api
 * 
 * @see com.tasktracker.controller.AuthController for authentication endpoints
 * @see com.tasktracker.controller.TaskController for task endpoints
 * @see com.tasktracker.config.SecurityConfig for the filter chain
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class TaskTrackerApplication {

    /**
     * Application entry point.
     * 
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(TaskTrackerApplication.class, args);
    }
}
