package com.pocketpilot.budget.controller;

import com.pocketpilot.budget.controller.dto.DailyBudgetResponseDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.AdjustmentDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.AnalysisDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.DailyAllocationDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.IncomeDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.MonthlyAllocationDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.SourceDto;
import com.pocketpilot.budget.controller.dto.PrescriptionResponseDto.TipDto;
import com.pocketpilot.budget.model.BudgetPrescription;
import com.pocketpilot.budget.model.BudgetPrescription.BehaviorAdjustment;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import com.pocketpilot.budget.model.DailyBudget;
import com.pocketpilot.budget.service.PrescriptionService;
import com.pocketpilot.budget.web.RequestContextHolder;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}/prescription")
public class PrescriptionController {

    private final PrescriptionService prescriptionService;
    private final Clock clock;

    public PrescriptionController(PrescriptionService prescriptionService, Clock clock) {
        this.prescriptionService = prescriptionService;
        this.clock = clock;
    }

    /**
     * Current month's prescription; 204 while there is not enough history to build one.
     */
    @GetMapping
    public ResponseEntity<PrescriptionResponseDto> currentPrescription(@PathVariable("userId") UUID userId) {
        return prescriptionService.getOrGenerate(userId, LocalDate.now(clock))
                .map(this::toPrescriptionDto)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/daily-budget")
    public ResponseEntity<DailyBudgetResponseDto> dailyBudget(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        LocalDate target = date != null ? date : LocalDate.now(clock);
        return prescriptionService.dailyBudget(userId, target)
                .map(this::toDailyBudgetDto)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private DailyBudgetResponseDto toDailyBudgetDto(DailyBudget budget) {
        return new DailyBudgetResponseDto(
                budget.date(),
                budget.baseBudget(),
                budget.adjustments().stream().map(this::toAdjustmentDto).toList(),
                budget.effectiveBudget(),
                RequestContextHolder.currentTraceId()
        );
    }

    private PrescriptionResponseDto toPrescriptionDto(BudgetPrescription prescription) {
        return new PrescriptionResponseDto(
                prescription.id(),
                prescription.month().toString(),
                new SourceDto(
                        prescription.sourceMonth().toString(),
                        prescription.selectionRule().name(),
                        prescription.selectionReason(),
                        prescription.dataCompleteness(),
                        prescription.daysWithData(),
                        prescription.daysInSourceMonth(),
                        prescription.transactionCount(),
                        prescription.confidence().name(),
                        prescription.sourceSpending()
                ),
                new IncomeDto(prescription.netIncome(), prescription.netIncomeSource().name()),
                UserProfileController.toStrategyDto(prescription.strategy(), prescription.strategySplit()),
                toAnalysisDto(prescription.analysis()),
                prescription.dailyAllocations().stream()
                        .map(a -> new DailyAllocationDto(a.category(), a.dailyAmount(), a.historicalDailyAverage(), a.description()))
                        .toList(),
                prescription.monthlyAllocations().stream()
                        .map(a -> new MonthlyAllocationDto(a.category(), a.monthlyAmount(), a.fixed(), a.description()))
                        .toList(),
                prescription.behaviorAdjustments().stream().map(this::toAdjustmentDto).toList(),
                prescription.totalDailyBudget(),
                prescription.tips().stream()
                        .map(t -> new TipDto(t.category(), t.title(), t.message(), t.action(), t.priority()))
                        .toList(),
                prescription.lastUpdated(),
                RequestContextHolder.currentTraceId()
        );
    }

    private AnalysisDto toAnalysisDto(CategoryBudgetAnalysis analysis) {
        CategoryBudgetAnalysis.FixedNeeds fixed = analysis.fixedNeeds();
        Map<String, BigDecimal> fixedNeeds = new LinkedHashMap<>();
        fixedNeeds.put("housingAndUtilities", fixed.housingAndUtilities());
        fixedNeeds.put("debt", fixed.debt());
        fixedNeeds.put("groceries", fixed.groceries());
        fixedNeeds.put("healthAndPersonalCare", fixed.healthAndPersonalCare());
        fixedNeeds.put("education", fixed.education());
        fixedNeeds.put("childcare", fixed.childcare());
        return new AnalysisDto(
                fixedNeeds,
                fixed.total(),
                analysis.flexibleNeeds().food(),
                analysis.flexibleNeeds().transport(),
                analysis.projectedBudget(),
                analysis.remainingBudget(),
                analysis.sustainable(),
                analysis.validationCase().name(),
                analysis.scaleFactor(),
                analysis.warnings(),
                analysis.adjustments()
        );
    }

    private AdjustmentDto toAdjustmentDto(BehaviorAdjustment adjustment) {
        return new AdjustmentDto(adjustment.type().name(), adjustment.amount(), adjustment.reason(), adjustment.effectiveDate());
    }
}
