package com.pocketpilot.budget.user;

import com.pocketpilot.budget.model.UserProfile;
import com.pocketpilot.budget.repository.UserProfileRepository;
import com.pocketpilot.budget.service.ResourceNotFoundException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class UserProfileService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileService.class);

    private final UserProfileRepository userProfileRepository;

    public UserProfileService(UserProfileRepository userProfileRepository) {
        this.userProfileRepository = userProfileRepository;
    }

    public UserProfile saveProfile(UserProfile profile) {
        UserProfile saved = userProfileRepository.save(profile);
        log.info("Stored profile for user {}", saved.userId());
        return saved;
    }

    public UserProfile requireProfile(UUID userId) {
        return userProfileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User profile not found"));
    }
}
