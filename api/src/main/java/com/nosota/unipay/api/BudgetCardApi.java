package com.nosota.unipay.api;

import com.nosota.unipay.api.dto.AccountDTO;
import com.nosota.unipay.api.request.CreateBudgetCardRequest;
import com.nosota.unipay.api.request.FundsRequest;
import com.nosota.unipay.api.request.SpendRequest;
import com.nosota.unipay.api.response.CardSummaryResponse;
import com.nosota.unipay.api.response.SpendDecisionResponse;
import com.nosota.unipay.api.response.TransferResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

/**
 * Budget card API: sub-accounts funded from a wallet with an optional monthly spending limit.
 */
@RequestMapping("/api/v1/budget-cards")
public interface BudgetCardApi {

    @PostMapping
    ResponseEntity<AccountDTO> createCard(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @RequestBody @Valid CreateBudgetCardRequest request);

    @GetMapping("/{cardId}")
    ResponseEntity<CardSummaryResponse> getCard(@PathVariable("cardId") Long cardId);

    /**
     * Moves money from the funding wallet to the card.
     */
    @PostMapping("/{cardId}/allocations")
    ResponseEntity<TransferResponse> allocate(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("cardId") Long cardId,
            @RequestBody @Valid FundsRequest request);

    /**
     * Moves unspent card money back to the funding wallet.
     */
    @PostMapping("/{cardId}/returns")
    ResponseEntity<TransferResponse> returnToWallet(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("cardId") Long cardId,
            @RequestBody @Valid FundsRequest request);

    /**
     * Sets or clears (no parameter) the monthly spending limit.
     */
    @PutMapping("/{cardId}/monthly-limit")
    ResponseEntity<CardSummaryResponse> updateMonthlyLimit(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("cardId") Long cardId,
            @RequestParam(value = "monthlyLimit", required = false) @PositiveOrZero BigDecimal monthlyLimit);

    @GetMapping("/{cardId}/can-spend")
    ResponseEntity<SpendDecisionResponse> canSpend(
            @PathVariable("cardId") Long cardId,
            @RequestParam("amount") @Positive BigDecimal amount);

    @PostMapping("/{cardId}/spends")
    ResponseEntity<TransferResponse> spend(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("cardId") Long cardId,
            @RequestBody @Valid SpendRequest request);
}
