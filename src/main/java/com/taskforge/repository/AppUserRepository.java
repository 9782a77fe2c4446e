package com.taskforge.repository;

import com.taskforge.entity.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository interface for managing {@link AppUser} entities.
 */
public interface AppUserRepository extends JpaRepository<AppUser, Long> {
}
