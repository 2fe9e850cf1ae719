package com.nosota.unipay.controller;

import com.nosota.unipay.api.LedgerApi;
import com.nosota.unipay.api.dto.AccountDTO;
import com.nosota.unipay.api.dto.LedgerEntryDTO;
import com.nosota.unipay.api.dto.PagedResponse;
import com.nosota.unipay.api.request.FundsRequest;
import com.nosota.unipay.api.request.LoanDisbursementRequest;
import com.nosota.unipay.api.request.OpenWalletRequest;
import com.nosota.unipay.api.request.TransferRequest;
import com.nosota.unipay.api.response.BalanceResponse;
import com.nosota.unipay.api.response.LoanResponse;
import com.nosota.unipay.api.response.ReconciliationResponse;
import com.nosota.unipay.api.response.TransferResponse;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.mapper.AccountMapper;
import com.nosota.unipay.mapper.LedgerEntryMapper;
import com.nosota.unipay.model.Account;
import com.nosota.unipay.model.LedgerEntry;
import com.nosota.unipay.service.AccountService;
import com.nosota.unipay.service.LoanService;
import com.nosota.unipay.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class LedgerController implements LedgerApi {

    private final AccountService accountService;
    private final LoanService loanService;
    private final ReconciliationService reconciliationService;

    @Override
    public ResponseEntity<AccountDTO> openWallet(Long ownerId, OpenWalletRequest request) {
        Account wallet = accountService.openWallet(ownerId, request.name(), request.currency());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountMapper.INSTANCE.toDTO(wallet));
    }

    @Override
    public ResponseEntity<AccountDTO> getAccount(Long accountId) {
        return ResponseEntity.ok(AccountMapper.INSTANCE.toDTO(accountService.getAccount(accountId)));
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Long accountId) {
        return ResponseEntity.ok(AccountMapper.INSTANCE.toBalance(accountService.getAccount(accountId)));
    }

    @Override
    public ResponseEntity<PagedResponse<LedgerEntryDTO>> getEntries(Long accountId, int page, int size) {
        Page<LedgerEntry> entries = accountService.getEntries(accountId, page, size);
        return ResponseEntity.ok(new PagedResponse<>(
                LedgerEntryMapper.INSTANCE.toDTOList(entries.getContent()),
                entries.getNumber(),
                entries.getSize(),
                entries.getTotalElements(),
                entries.getTotalPages(),
                entries.isLast()));
    }

    @Override
    public ResponseEntity<AccountDTO> freeze(Long accountId) {
        return ResponseEntity.ok(AccountMapper.INSTANCE.toDTO(accountService.freeze(accountId).orElseThrow()));
    }

    @Override
    public ResponseEntity<AccountDTO> unfreeze(Long accountId) {
        return ResponseEntity.ok(AccountMapper.INSTANCE.toDTO(accountService.unfreeze(accountId).orElseThrow()));
    }

    @Override
    public ResponseEntity<AccountDTO> close(Long ownerId, Long accountId) {
        return ResponseEntity.ok(AccountMapper.INSTANCE.toDTO(accountService.close(ownerId, accountId).orElseThrow()));
    }

    @Override
    public ResponseEntity<TransferResponse> topUp(Long accountId, FundsRequest request) {
        return TransferResponses.of(accountService.topUp(accountId, request.amount(), request.operationId()));
    }

    @Override
    public ResponseEntity<TransferResponse> withdraw(Long ownerId, Long accountId, FundsRequest request) {
        return TransferResponses.of(accountService.withdraw(ownerId, accountId, request.amount(), request.operationId()));
    }

    @Override
    public ResponseEntity<TransferResponse> transfer(Long ownerId, TransferRequest request) {
        LedgerResult<TransferReceipt> result = accountService.transfer(ownerId, request.fromAccountId(),
                request.toAccountId(), request.amount(), request.operationId());
        return TransferResponses.of(result);
    }

    @Override
    public ResponseEntity<List<LedgerEntryDTO>> getOperationEntries(String operationId) {
        return ResponseEntity.ok(LedgerEntryMapper.INSTANCE.toDTOList(accountService.getOperationEntries(operationId)));
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcile() {
        return ResponseEntity.ok(reconciliationService.reconcile());
    }

    @Override
    public ResponseEntity<LoanResponse> disburseLoan(Long ownerId, LoanDisbursementRequest request) {
        LedgerResult<Account> result = loanService.disburse(ownerId, request.lenderAccountId(),
                request.borrowerAccountId(), request.principal(), request.operationId());
        Account loan = result.orElseThrow();
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(toLoanResponse(loan, request.operationId(), result.isDuplicate()));
    }

    @Override
    public ResponseEntity<LoanResponse> repayLoan(Long ownerId, Long loanAccountId, FundsRequest request) {
        LedgerResult<Account> result = loanService.repay(ownerId, loanAccountId, request.amount(), request.operationId());
        return ResponseEntity.ok(toLoanResponse(result.orElseThrow(), request.operationId(), result.isDuplicate()));
    }

    private static LoanResponse toLoanResponse(Account loan, String operationId, boolean duplicate) {
        return new LoanResponse(loan.getId(), loan.getCounterpartyAccountId(), loan.getParentAccountId(),
                loan.getBalance(), loan.getStatus(), operationId, duplicate);
    }
}
