package com.nosota.unipay.api;

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
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Ledger API: accounts, funding, peer transfers and loans.
 *
 * <p>Every balance-moving endpoint takes a client supplied {@code operationId}. Re-sending the
 * same id never moves money twice: the response carries {@code duplicate=true} and the entries
 * written by the first application.
 *
 * <p>Rejected operations answer with a {@link com.nosota.unipay.api.response.LedgerErrorResponse}
 * body carrying the requested, available and shortfall amounts.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>LedgerController - in service module (server-side implementation)</li>
 *   <li>LedgerClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/ledger")
public interface LedgerApi {

    // ==================== Accounts ====================

    @PostMapping("/wallets")
    ResponseEntity<AccountDTO> openWallet(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @RequestBody @Valid OpenWalletRequest request);

    @GetMapping("/accounts/{accountId}")
    ResponseEntity<AccountDTO> getAccount(@PathVariable("accountId") Long accountId);

    @GetMapping("/accounts/{accountId}/balance")
    ResponseEntity<BalanceResponse> getBalance(@PathVariable("accountId") Long accountId);

    /**
     * Ledger entries of an account, newest first.
     */
    @GetMapping("/accounts/{accountId}/entries")
    ResponseEntity<PagedResponse<LedgerEntryDTO>> getEntries(
            @PathVariable("accountId") Long accountId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "50") @Min(1) @Max(500) int size);

    @PostMapping("/accounts/{accountId}/freeze")
    ResponseEntity<AccountDTO> freeze(@PathVariable("accountId") Long accountId);

    @PostMapping("/accounts/{accountId}/unfreeze")
    ResponseEntity<AccountDTO> unfreeze(@PathVariable("accountId") Long accountId);

    /**
     * Closes an empty account owned by the caller.
     */
    @PostMapping("/accounts/{accountId}/close")
    ResponseEntity<AccountDTO> close(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("accountId") Long accountId);

    // ==================== Funding ====================

    /**
     * Credits an account with money received from the external funding source
     * (card payment, bank transfer). Called by the payment processor integration.
     */
    @PostMapping("/accounts/{accountId}/top-ups")
    ResponseEntity<TransferResponse> topUp(
            @PathVariable("accountId") Long accountId,
            @RequestBody @Valid FundsRequest request);

    @PostMapping("/accounts/{accountId}/withdrawals")
    ResponseEntity<TransferResponse> withdraw(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("accountId") Long accountId,
            @RequestBody @Valid FundsRequest request);

    // ==================== Transfers ====================

    @PostMapping("/transfers")
    ResponseEntity<TransferResponse> transfer(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @RequestBody @Valid TransferRequest request);

    @GetMapping("/operations/{operationId}/entries")
    ResponseEntity<List<LedgerEntryDTO>> getOperationEntries(@PathVariable("operationId") String operationId);

    @GetMapping("/reconciliation")
    ResponseEntity<ReconciliationResponse> reconcile();

    // ==================== Loans ====================

    @PostMapping("/loans")
    ResponseEntity<LoanResponse> disburseLoan(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @RequestBody @Valid LoanDisbursementRequest request);

    @PostMapping("/loans/{loanAccountId}/repayments")
    ResponseEntity<LoanResponse> repayLoan(
            @RequestHeader(LedgerHeaders.OWNER_ID) Long ownerId,
            @PathVariable("loanAccountId") Long loanAccountId,
            @RequestBody @Valid FundsRequest request);
}
