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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of LedgerApi for consuming the UniPay ledger service.
 *
 * <p>Rejected operations surface as {@link org.springframework.web.reactive.function.client.WebClientResponseException};
 * the response body is a {@link com.nosota.unipay.api.response.LedgerErrorResponse}.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class UnipayClientConfig {
 *     @Bean
 *     public WebClient unipayWebClient(WebClient.Builder builder,
 *                                      @Value("${services.unipay.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public LedgerClient ledgerClient(WebClient unipayWebClient) {
 *         return new LedgerClient(unipayWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class LedgerClient implements LedgerApi {

    private static final String BASE_PATH = "/api/v1/ledger";

    private final WebClient webClient;

    @Override
    public ResponseEntity<AccountDTO> openWallet(Long ownerId, OpenWalletRequest request) {
        log.debug("Calling openWallet: ownerId={}, currency={}", ownerId, request.currency());

        return webClient.post()
                .uri(BASE_PATH + "/wallets")
                .header(LedgerHeaders.OWNER_ID, String.valueOf(ownerId))
                .bodyValue(request)
                .retrieve()
                .toEntity(AccountDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<AccountDTO> getAccount(Long accountId) {
        log.debug("Calling getAccount: accountId={}", accountId);

        return webClient.get()
                .uri(BASE_PATH + "/accounts/{accountId}", accountId)
                .retrieve()
                .toEntity(AccountDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(Long accountId) {
        log.debug("Calling getBalance: accountId={}", accountId);

        return webClient.get()
                .uri(BASE_PATH + "/accounts/{accountId}/balance", accountId)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<LedgerEntryDTO>> getEntries(Long accountId, int page, int size) {
        log.debug("Calling getEntries: accountId={}, page={}, size={}", accountId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE_PATH + "/accounts/{accountId}/entries")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(accountId))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<LedgerEntryDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<AccountDTO> freeze(Long accountId) {
        log.debug("Calling freeze: accountId={}", accountId);
        return postForAccount("/accounts/{accountId}/freeze", null, accountId);
    }

    @Override
    public ResponseEntity<AccountDTO> unfreeze(Long accountId) {
        log.debug("Calling unfreeze: accountId={}", accountId);
        return postForAccount("/accounts/{accountId}/unfreeze", null, accountId);
    }

    @Override
    public ResponseEntity<AccountDTO> close(Long ownerId, Long accountId) {
        log.debug("Calling close: ownerId={}, accountId={}", ownerId, accountId);
        return postForAccount("/accounts/{accountId}/close", ownerId, accountId);
    }

    @Override
    public ResponseEntity<TransferResponse> topUp(Long accountId, FundsRequest request) {
        log.debug("Calling topUp: accountId={}, amount={}, operationId={}",
                accountId, request.amount(), request.operationId());

        return webClient.post()
                .uri(BASE_PATH + "/accounts/{accountId}/top-ups", accountId)
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> withdraw(Long ownerId, Long accountId, FundsRequest request) {
        log.debug("Calling withdraw: accountId={}, amount={}, operationId={}",
                accountId, request.amount(), request.operationId());

        return webClient.post()
                .uri(BASE_PATH + "/accounts/{accountId}/withdrawals", accountId)
                .header(LedgerHeaders.OWNER_ID, String.valueOf(ownerId))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> transfer(Long ownerId, TransferRequest request) {
        log.debug("Calling transfer: from={}, to={}, amount={}, operationId={}",
                request.fromAccountId(), request.toAccountId(), request.amount(), request.operationId());

        return webClient.post()
                .uri(BASE_PATH + "/transfers")
                .header(LedgerHeaders.OWNER_ID, String.valueOf(ownerId))
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<LedgerEntryDTO>> getOperationEntries(String operationId) {
        log.debug("Calling getOperationEntries: operationId={}", operationId);

        return webClient.get()
                .uri(BASE_PATH + "/operations/{operationId}/entries", operationId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<LedgerEntryDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcile() {
        log.debug("Calling reconcile");

        return webClient.get()
                .uri(BASE_PATH + "/reconciliation")
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanResponse> disburseLoan(Long ownerId, LoanDisbursementRequest request) {
        log.debug("Calling disburseLoan: lender={}, borrower={}, principal={}",
                request.lenderAccountId(), request.borrowerAccountId(), request.principal());

        return webClient.post()
                .uri(BASE_PATH + "/loans")
                .header(LedgerHeaders.OWNER_ID, String.valueOf(ownerId))
                .bodyValue(request)
                .retrieve()
                .toEntity(LoanResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanResponse> repayLoan(Long ownerId, Long loanAccountId, FundsRequest request) {
        log.debug("Calling repayLoan: loanAccountId={}, amount={}", loanAccountId, request.amount());

        return webClient.post()
                .uri(BASE_PATH + "/loans/{loanAccountId}/repayments", loanAccountId)
                .header(LedgerHeaders.OWNER_ID, String.valueOf(ownerId))
                .bodyValue(request)
                .retrieve()
                .toEntity(LoanResponse.class)
                .block();
    }

    private ResponseEntity<AccountDTO> postForAccount(String path, Long ownerId, Long accountId) {
        WebClient.RequestBodySpec spec = webClient.post().uri(BASE_PATH + path, accountId);
        if (ownerId != null) {
            spec.header(LedgerHeaders.OWNER_ID, String.valueOf(ownerId));
        }
        return spec.retrieve()
                .toEntity(AccountDTO.class)
                .block();
    }
}
