package com.pocketpilot.budget.repository;

import com.pocketpilot.budget.model.UserProfile;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryUserProfileRepository implements UserProfileRepository {

    private final Map<UUID, UserProfile> storage = new ConcurrentHashMap<>();

    @Override
    public UserProfile save(UserProfile profile) {
        storage.put(profile.userId(), profile);
        return profile;
    }

    @Override
    public Optional<UserProfile> findById(UUID userId) {
        return Optional.ofNullable(storage.get(userId));
    }
}
