package com.tasktracker.repository;

import com.tasktracker.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * UserRepository - Data Access Layer for credential records.
 * 
 * Spring Data JPA generates the implementation from the method names:
 * - findByUsername -> SELECT * FROM users WHERE username = ?
 * - existsByUsername -> SELECT COUNT(*) > 0 FROM users WHERE username = ?
 * 
 * Username uniqueness is ultimately enforced by the uk_users_username constraint; a
 * concurrent duplicate insert fails with DataIntegrityViolationException.
 * 
 * @see User for entity definition
 * @see com.tasktracker.service.AuthService for business logic using this repository
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find a user by login name.
     * 
     * @param username The exact username (case-sensitive)
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByUsername(String username);

    /**
     * Check if a username is already registered.
     * 
     * Cheaper than findByUsername when only existence matters.
     * 
     * @param username The username to check
     * @return true if a user with this username exists, false otherwise
     */
    boolean existsByUsername(String username);
}
