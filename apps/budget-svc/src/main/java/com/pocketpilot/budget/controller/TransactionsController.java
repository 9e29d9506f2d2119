package com.pocketpilot.budget.controller;

import com.pocketpilot.budget.controller.dto.TransactionRequestDto;
import com.pocketpilot.budget.controller.dto.TransactionResponseDto;
import com.pocketpilot.budget.controller.dto.TransactionUpdateRequestDto;
import com.pocketpilot.budget.model.Transaction;
import com.pocketpilot.budget.service.TransactionService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{userId}/transactions")
public class TransactionsController {

    private final TransactionService transactionService;
    private final Clock clock;

    public TransactionsController(TransactionService transactionService, Clock clock) {
        this.transactionService = transactionService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<TransactionResponseDto>> listTransactions(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "month", required = false) String month
    ) {
        YearMonth target = parseMonth(month);
        List<TransactionResponseDto> body = transactionService.listTransactions(userId, target).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(body);
    }

    @PostMapping
    public ResponseEntity<TransactionResponseDto> recordTransaction(
            @PathVariable("userId") UUID userId,
            @RequestBody @Valid TransactionRequestDto request
    ) {
        Transaction saved = transactionService.recordTransaction(
                userId,
                request.amount(),
                request.type(),
                request.category(),
                request.date(),
                request.description()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(map(saved));
    }

    @PatchMapping("/{transactionId}")
    public ResponseEntity<TransactionResponseDto> updateTransaction(
            @PathVariable("userId") UUID userId,
            @PathVariable("transactionId") UUID transactionId,
            @RequestBody @Valid TransactionUpdateRequestDto request
    ) {
        Transaction updated = transactionService.updateTransaction(
                userId,
                transactionId,
                Optional.ofNullable(request.category()),
                Optional.ofNullable(request.amount()),
                Optional.ofNullable(request.date())
        );
        return ResponseEntity.ok(map(updated));
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<Void> deleteTransaction(
            @PathVariable("userId") UUID userId,
            @PathVariable("transactionId") UUID transactionId
    ) {
        transactionService.deleteTransaction(userId, transactionId);
        return ResponseEntity.noContent().build();
    }

    private YearMonth parseMonth(String month) {
        if (month == null || month.isBlank()) {
            return YearMonth.now(clock);
        }
        try {
            return YearMonth.parse(month);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("month must be formatted as yyyy-MM");
        }
    }

    private TransactionResponseDto map(Transaction transaction) {
        return new TransactionResponseDto(
                transaction.id().toString(),
                transaction.userId().toString(),
                transaction.amount(),
                transaction.type().name(),
                transaction.category(),
                transaction.occurredOn(),
                transaction.description()
        );
    }
}
