package com.nosota.unipay.controller;

import com.nosota.unipay.TestBase;
import com.nosota.unipay.api.LedgerHeaders;
import com.nosota.unipay.api.dto.AccountDTO;
import com.nosota.unipay.api.request.FundsRequest;
import com.nosota.unipay.api.request.LoanDisbursementRequest;
import com.nosota.unipay.api.request.OpenWalletRequest;
import com.nosota.unipay.api.request.TransferRequest;
import com.nosota.unipay.api.response.LoanResponse;
import com.nosota.unipay.model.Account;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Ledger endpoints through the controller layer: status codes, error bodies and idempotent replays.
 */
@DisplayName("8. Ledger API")
class LedgerControllerTest extends TestBase {

    private static final String LEDGER = "/api/v1/ledger";

    @Test
    @DisplayName("Opening a wallet returns 201 with an empty ACTIVE wallet")
    void openWallet() throws Exception {
        Long owner = newOwner();

        MvcResult result = mockMvc.perform(post(LEDGER + "/wallets")
                        .header(LedgerHeaders.OWNER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new OpenWalletRequest("Main", "USD"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.kind").value("WALLET"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.ownerId").value(owner))
                .andExpect(header().string("X-Correlation-Id", not(emptyString())))
                .andReturn();

        AccountDTO wallet = objectMapper.readValue(result.getResponse().getContentAsString(), AccountDTO.class);
        assertThat(wallet.getBalance()).isEqualByComparingTo("0");

        mockMvc.perform(get(LEDGER + "/accounts/{accountId}/balance", wallet.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currency").value("USD"));
    }

    @Test
    @DisplayName("A replayed top-up answers 200 with duplicate=true and credits once")
    void topUpReplay() throws Exception {
        Account wallet = openWallet(newOwner());
        String body = objectMapper.writeValueAsString(new FundsRequest(opId("topup"), usd("75.00")));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/top-ups", wallet.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.reason").value("TOPUP"))
                .andExpect(jsonPath("$.duplicate").value(false))
                .andExpect(jsonPath("$.entries.length()").value(1));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/top-ups", wallet.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));

        assertThat(balanceOf(wallet.getId())).isEqualByComparingTo("75.00");
    }

    @Test
    @DisplayName("An overdraft answers 422 with the shortfall")
    void insufficientFunds() throws Exception {
        Long owner = newOwner();
        Account from = fundedWallet(owner, "40.00");
        Account to = openWallet(newOwner());

        mockMvc.perform(post(LEDGER + "/transfers")
                        .header(LedgerHeaders.OWNER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new TransferRequest(opId("p2p"), from.getId(), to.getId(), usd("100.00")))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"))
                .andExpect(jsonPath("$.accountId").value(from.getId()))
                .andExpect(jsonPath("$.shortfall").value(60.0));

        assertThat(balanceOf(from.getId())).isEqualByComparingTo("40.00");
        assertThat(balanceOf(to.getId())).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Bad input is rejected with 400 and foreign accounts with 403")
    void requestErrors() throws Exception {
        Long owner = newOwner();
        Account from = fundedWallet(owner, "40.00");
        Account to = openWallet(newOwner());
        String transfer = objectMapper.writeValueAsString(
                new TransferRequest(opId("p2p"), from.getId(), to.getId(), usd("10.00")));

        mockMvc.perform(post(LEDGER + "/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(transfer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(post(LEDGER + "/transfers")
                        .header(LedgerHeaders.OWNER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new TransferRequest(opId("p2p"), from.getId(), to.getId(), usd("-5")))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(post(LEDGER + "/transfers")
                        .header(LedgerHeaders.OWNER_ID, newOwner())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(transfer))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(get(LEDGER + "/accounts/{accountId}", Long.MAX_VALUE))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    @DisplayName("A frozen account rejects withdrawals until unfrozen")
    void freezeAndUnfreeze() throws Exception {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "50.00");
        String withdrawal = objectMapper.writeValueAsString(new FundsRequest(opId("withdraw"), usd("20.00")));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/freeze", wallet.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FROZEN"));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/withdrawals", wallet.getId())
                        .header(LedgerHeaders.OWNER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(withdrawal))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("ACCOUNT_FROZEN"));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/freeze", wallet.getId()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/unfreeze", wallet.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/withdrawals", wallet.getId())
                        .header(LedgerHeaders.OWNER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(withdrawal))
                .andExpect(status().isCreated());

        assertThat(balanceOf(wallet.getId())).isEqualByComparingTo("30.00");
    }

    @Test
    @DisplayName("Only an empty account of the caller can be closed, and it accepts nothing afterwards")
    void closeAccount() throws Exception {
        Long owner = newOwner();
        Account wallet = fundedWallet(owner, "20.00");

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/close", wallet.getId())
                        .header(LedgerHeaders.OWNER_ID, owner))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));

        accountService.withdraw(owner, wallet.getId(), usd("20.00"), opId("withdraw")).orElseThrow();

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/close", wallet.getId())
                        .header(LedgerHeaders.OWNER_ID, newOwner()))
                .andExpect(status().isForbidden());

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/close", wallet.getId())
                        .header(LedgerHeaders.OWNER_ID, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CLOSED"));

        mockMvc.perform(post(LEDGER + "/accounts/{accountId}/top-ups", wallet.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FundsRequest(opId("topup"), usd("5.00")))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("ACCOUNT_FROZEN"));
    }

    @Test
    @DisplayName("Entries of an account are paged newest first")
    void entriesPage() throws Exception {
        Account wallet = fundedWallet(newOwner(), "10.00");
        accountService.topUp(wallet.getId(), usd("5.00"), opId("topup")).orElseThrow();

        mockMvc.perform(get(LEDGER + "/accounts/{accountId}/entries", wallet.getId())
                        .param("page", "0")
                        .param("size", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.length()").value(1))
                .andExpect(jsonPath("$.totalElements").value(2))
                .andExpect(jsonPath("$.last").value(false));
    }

    @Test
    @DisplayName("Loan disbursement answers 201, its replay 200 with the same loan")
    void disburseLoan() throws Exception {
        Long lender = newOwner();
        Account lenderWallet = fundedWallet(lender, "300.00");
        Account borrowerWallet = openWallet(newOwner());
        String body = objectMapper.writeValueAsString(new LoanDisbursementRequest(
                opId("loan"), lenderWallet.getId(), borrowerWallet.getId(), usd("120.00")));

        MvcResult created = mockMvc.perform(post(LEDGER + "/loans")
                        .header(LedgerHeaders.OWNER_ID, lender)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andReturn();
        LoanResponse loan = objectMapper.readValue(created.getResponse().getContentAsString(), LoanResponse.class);

        assertThat(loan.lenderAccountId()).isEqualTo(lenderWallet.getId());
        assertThat(loan.borrowerAccountId()).isEqualTo(borrowerWallet.getId());
        assertThat(loan.outstanding()).isEqualByComparingTo("120.00");

        mockMvc.perform(post(LEDGER + "/loans")
                        .header(LedgerHeaders.OWNER_ID, lender)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loanAccountId").value(loan.loanAccountId()))
                .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    @DisplayName("Reconciliation endpoint reports a balanced ledger")
    void reconciliation() throws Exception {
        fundedWallet(newOwner(), "10.00");

        mockMvc.perform(get(LEDGER + "/reconciliation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanced").value(true));
    }
}
