package com.pocketpilot.budget.controller;

import com.pocketpilot.budget.analytics.StrategyClassifier;
import com.pocketpilot.budget.controller.dto.StrategyResponseDto;
import com.pocketpilot.budget.controller.dto.UserProfileRequestDto;
import com.pocketpilot.budget.controller.dto.UserProfileResponseDto;
import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.UserProfile;
import com.pocketpilot.budget.user.UserProfileService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}")
public class UserProfileController {

    private final UserProfileService userProfileService;
    private final StrategyClassifier strategyClassifier;
    private final Clock clock;

    public UserProfileController(UserProfileService userProfileService, StrategyClassifier strategyClassifier, Clock clock) {
        this.userProfileService = userProfileService;
        this.strategyClassifier = strategyClassifier;
        this.clock = clock;
    }

    @PutMapping("/profile")
    public ResponseEntity<UserProfileResponseDto> saveProfile(
            @PathVariable("userId") UUID userId,
            @RequestBody @Valid UserProfileRequestDto request
    ) {
        UserProfile saved = userProfileService.saveProfile(toProfile(userId, request));
        return ResponseEntity.ok(map(saved));
    }

    @GetMapping("/strategy")
    public ResponseEntity<StrategyResponseDto> strategy(@PathVariable("userId") UUID userId) {
        UserProfile profile = userProfileService.requireProfile(userId);
        BudgetStrategy strategy = strategyClassifier.classify(profile, LocalDate.now(clock));
        return ResponseEntity.ok(toStrategyDto(strategy, strategy.split(profile.numberOfChildren())));
    }

    static StrategyResponseDto toStrategyDto(BudgetStrategy strategy, BudgetStrategy.Split split) {
        return new StrategyResponseDto(
                strategy.name(),
                strategy.displayName(),
                split.needsPercent(),
                split.wantsPercent(),
                split.savingsPercent()
        );
    }

    private UserProfile toProfile(UUID userId, UserProfileRequestDto request) {
        return new UserProfile(
                userId,
                request.monthlyNetIncome(),
                request.monthlyGrossIncome(),
                request.currency(),
                request.incomeFrequency(),
                request.profession(),
                request.birthDate(),
                request.civilStatus(),
                request.householdSituation(),
                Boolean.TRUE.equals(request.hasChildren()),
                request.numberOfChildren() == null ? 0 : request.numberOfChildren(),
                Boolean.TRUE.equals(request.businessOwner()),
                request.debtStatuses(),
                request.savingsInstruments(),
                request.emergencyFundBalance()
        );
    }

    private UserProfileResponseDto map(UserProfile profile) {
        return new UserProfileResponseDto(
                profile.userId().toString(),
                profile.monthlyNetIncome(),
                profile.monthlyGrossIncome(),
                profile.currency(),
                profile.incomeFrequency() == null ? null : profile.incomeFrequency().name(),
                profile.profession() == null ? null : profile.profession().name(),
                profile.hasChildren(),
                profile.numberOfChildren(),
                profile.activeDebtCount()
        );
    }
}
