package com.nosota.unipay.controller;

import com.nosota.unipay.api.BudgetCardApi;
import com.nosota.unipay.api.dto.AccountDTO;
import com.nosota.unipay.api.request.CreateBudgetCardRequest;
import com.nosota.unipay.api.request.FundsRequest;
import com.nosota.unipay.api.request.SpendRequest;
import com.nosota.unipay.api.response.CardSummaryResponse;
import com.nosota.unipay.api.response.SpendDecisionResponse;
import com.nosota.unipay.api.response.TransferResponse;
import com.nosota.unipay.mapper.AccountMapper;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.service.BudgetCardService;
import com.nosota.unipay.service.SpendDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class BudgetCardController implements BudgetCardApi {

    private final BudgetCardService budgetCardService;

    @Override
    public ResponseEntity<AccountDTO> createCard(Long ownerId, CreateBudgetCardRequest request) {
        Account card = budgetCardService.createCard(ownerId, request.walletId(), request.name(),
                request.monthlyLimit()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountMapper.INSTANCE.toDTO(card));
    }

    @Override
    public ResponseEntity<CardSummaryResponse> getCard(Long cardId) {
        return ResponseEntity.ok(budgetCardService.getCardSummary(cardId));
    }

    @Override
    public ResponseEntity<TransferResponse> allocate(Long ownerId, Long cardId, FundsRequest request) {
        return TransferResponses.of(budgetCardService.allocate(ownerId, cardId, request.amount(), request.operationId()));
    }

    @Override
    public ResponseEntity<TransferResponse> returnToWallet(Long ownerId, Long cardId, FundsRequest request) {
        return TransferResponses.of(
                budgetCardService.returnToWallet(ownerId, cardId, request.amount(), request.operationId()));
    }

    @Override
    public ResponseEntity<CardSummaryResponse> updateMonthlyLimit(Long ownerId, Long cardId, BigDecimal monthlyLimit) {
        budgetCardService.updateMonthlyLimit(ownerId, cardId, monthlyLimit).orElseThrow();
        return ResponseEntity.ok(budgetCardService.getCardSummary(cardId));
    }

    @Override
    public ResponseEntity<SpendDecisionResponse> canSpend(Long cardId, BigDecimal amount) {
        SpendDecision decision = budgetCardService.canSpend(cardId, amount);
        return ResponseEntity.ok(new SpendDecisionResponse(
                decision.allowed(), decision.constraint(), decision.message(), decision.shortfall()));
    }

    @Override
    public ResponseEntity<TransferResponse> spend(Long ownerId, Long cardId, SpendRequest request) {
        return TransferResponses.of(budgetCardService.spend(ownerId, cardId, request.amount(),
                request.operationId(), request.description()));
    }
}
