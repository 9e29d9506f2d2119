package com.pocketpilot.budget.repository;

import com.pocketpilot.budget.model.UserProfile;
import java.util.Optional;
import java.util.UUID;

public interface UserProfileRepository {

    UserProfile save(UserProfile profile);

    Optional<UserProfile> findById(UUID userId);
}
